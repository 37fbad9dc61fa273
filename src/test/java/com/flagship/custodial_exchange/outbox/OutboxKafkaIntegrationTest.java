package com.flagship.custodial_exchange.outbox;

import com.flagship.custodial_exchange.ledger.LedgerService;
import com.flagship.custodial_exchange.lobby.Lobby;
import com.flagship.custodial_exchange.lobby.WagerLobbyService;
import com.flagship.custodial_exchange.market.Order;
import com.flagship.custodial_exchange.market.OrderEscrowService;
import com.flagship.custodial_exchange.registry.AssetRegistryService;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox relay against a real broker: order events land on the orders topic,
 * lobby events on the lobbies topic, keyed by aggregate id.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxKafkaIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_exchange")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        // Keep the publisher bean but trigger passes manually
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OrderEscrowService orderEscrowService;

    @Autowired
    private WagerLobbyService lobbyService;

    @Autowired
    private AssetRegistryService assetRegistry;

    @Autowired
    private LedgerService ledgerService;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(List.of("exchange.orders", "exchange.lobbies"));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Publisher routes order and lobby events to their topics")
    void testPublisherRoutesByAggregate() {
        printTestHeader("Publisher Routes by Aggregate");

        String suffix = UUID.randomUUID().toString().substring(0, 8);
        String seller = "seller-" + suffix;
        String assetId = "asset-" + suffix;
        assetRegistry.mint(assetId, seller);
        Order order = orderEscrowService.createOrder(seller, assetId, 100);

        String creator = "creator-" + suffix;
        ledgerService.deposit(creator, 50);
        ledgerService.approve(creator, "escrow:wager-lobby", 50);
        Lobby lobby = lobbyService.createLobby(creator, Instant.now().getEpochSecond() + 3600, 50);

        outboxPublisher.triggerPublish();
        assertEquals(0, outboxService.countUnpublished(), "All events should be published");

        List<ConsumerRecord<String, String>> records = consumeRecords(2, 10000);
        System.out.println("Records received: " + records.size());

        ConsumerRecord<String, String> orderRecord = records.stream()
            .filter(r -> r.topic().equals("exchange.orders")).findFirst().orElseThrow();
        ConsumerRecord<String, String> lobbyRecord = records.stream()
            .filter(r -> r.topic().equals("exchange.lobbies")).findFirst().orElseThrow();

        assertEquals(String.valueOf(order.getId()), orderRecord.key());
        assertTrue(orderRecord.value().contains(assetId));
        assertEquals(String.valueOf(lobby.getId()), lobbyRecord.key());
        assertTrue(lobbyRecord.value().contains(creator));

        printSuccess("Events relayed to Kafka and marked as published");
    }

    private List<ConsumerRecord<String, String>> consumeRecords(int expected, long timeoutMs) {
        List<ConsumerRecord<String, String>> allRecords = new ArrayList<>();
        long endTime = System.currentTimeMillis() + timeoutMs;

        while (System.currentTimeMillis() < endTime && allRecords.size() < expected) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(100));
            for (ConsumerRecord<String, String> record : records) {
                allRecords.add(record);
            }
        }
        return allRecords;
    }
}
