package com.flagship.custodial_exchange.market;

import com.flagship.custodial_exchange.config.ExchangeProperties;
import com.flagship.custodial_exchange.exception.EscrowException;
import com.flagship.custodial_exchange.exception.Violation;
import com.flagship.custodial_exchange.ledger.ValueLedger;
import com.flagship.custodial_exchange.market.event.OrderBoughtEvent;
import com.flagship.custodial_exchange.market.event.OrderCanceledEvent;
import com.flagship.custodial_exchange.market.event.OrderCreatedEvent;
import com.flagship.custodial_exchange.observability.ExchangeMetrics;
import com.flagship.custodial_exchange.outbox.OutboxService;
import com.flagship.custodial_exchange.registry.AssetRegistry;
import com.flagship.custodial_exchange.settings.PropertiesSettingsProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Engine tests against mocked collaborators: check ordering, effect ordering
 * and the exact transfers of a sale.
 */
@ExtendWith(MockitoExtension.class)
class OrderEscrowServiceTest {

    private static final String CUSTODY = "escrow:order-market";
    private static final String SELLER = "alice";
    private static final String BUYER = "bob";

    @Mock
    private OrderPersistenceService persistenceService;

    @Mock
    private ValueLedger valueLedger;

    @Mock
    private AssetRegistry assetRegistry;

    @Mock
    private OutboxService outboxService;

    private SimpleMeterRegistry meterRegistry;
    private OrderEscrowService service;

    @BeforeEach
    void setUp() {
        ExchangeProperties properties = new ExchangeProperties();
        meterRegistry = new SimpleMeterRegistry();
        service = new OrderEscrowService(
            persistenceService,
            valueLedger,
            assetRegistry,
            new PropertiesSettingsProvider(properties),
            outboxService,
            new ExchangeMetrics(meterRegistry),
            properties,
            Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC)
        );
    }

    private Order activeOrder(long id, long price) {
        return new Order(id, OrderStatus.ACTIVE, "sword-1", SELLER, null, price, Instant.EPOCH, Instant.EPOCH);
    }

    @Test
    @DisplayName("Create takes the asset into custody after storing the order")
    void testCreateOrder() {
        when(assetRegistry.ownerOf("sword-1")).thenReturn(SELLER);
        when(persistenceService.nextOrderId()).thenReturn(0L);
        when(persistenceService.insert(any())).thenAnswer(inv -> inv.getArgument(0));

        Order order = service.createOrder(SELLER, "sword-1", 1000);

        assertEquals(0, order.getId());
        assertEquals(OrderStatus.ACTIVE, order.getStatus());

        InOrder inOrder = inOrder(persistenceService, assetRegistry, outboxService);
        inOrder.verify(persistenceService).insert(any());
        inOrder.verify(assetRegistry).transferCustody(SELLER, CUSTODY, "sword-1");
        inOrder.verify(outboxService).saveEvent(eq("Order"), eq(0L), eq(OrderCreatedEvent.EVENT_TYPE), any(OrderCreatedEvent.class));
    }

    @Test
    @DisplayName("Listing an asset held by someone else is UNAUTHORIZED and has no effect")
    void testCreateOrderNotOwner() {
        when(assetRegistry.ownerOf("sword-1")).thenReturn("carol");

        EscrowException e = assertThrows(EscrowException.class,
            () -> service.createOrder(SELLER, "sword-1", 1000));

        assertEquals(Violation.UNAUTHORIZED, e.getViolation());
        verify(persistenceService, never()).insert(any());
        verify(assetRegistry, never()).transferCustody(any(), any(), any());
        verifyNoInteractions(outboxService);
        assertEquals(1.0, meterRegistry.counter("escrow.operations",
            "engine", "market", "operation", "create", "outcome", "UNAUTHORIZED").count());
    }

    @Test
    @DisplayName("Buy commits SOLD before any value moves, then fans out exactly the split")
    void testBuyOrderEffectOrder() {
        when(persistenceService.lockById(3L)).thenReturn(activeOrder(3, 1000));
        when(persistenceService.update(any())).thenAnswer(inv -> inv.getArgument(0));

        Order sold = service.buyOrder(BUYER, 3L, 1000);

        assertEquals(OrderStatus.SOLD, sold.getStatus());
        assertEquals(BUYER, sold.getBuyer());

        InOrder inOrder = inOrder(persistenceService, valueLedger, assetRegistry, outboxService);
        inOrder.verify(persistenceService).update(argThat(o -> o.getStatus() == OrderStatus.SOLD));
        inOrder.verify(persistenceService).recordPurchase(BUYER, 3L);
        inOrder.verify(valueLedger).transferFrom(CUSTODY, BUYER, CUSTODY, 1000);
        inOrder.verify(valueLedger).transfer(CUSTODY, "treasury", 15);
        inOrder.verify(valueLedger).transfer(CUSTODY, "reward-pool", 35);
        inOrder.verify(valueLedger).transfer(CUSTODY, SELLER, 950);
        inOrder.verify(assetRegistry).transferCustody(CUSTODY, BUYER, "sword-1");
        inOrder.verify(outboxService).saveEvent(eq("Order"), eq(3L), eq(OrderBoughtEvent.EVENT_TYPE), any());

        assertEquals(1000.0, meterRegistry.counter("market.sales.volume").count());
    }

    @Test
    @DisplayName("The sale event carries the fee split")
    void testBuyEventPayload() {
        when(persistenceService.lockById(3L)).thenReturn(activeOrder(3, 1000));
        when(persistenceService.update(any())).thenAnswer(inv -> inv.getArgument(0));

        service.buyOrder(BUYER, 3L, 1000);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(outboxService).saveEvent(eq("Order"), eq(3L), eq(OrderBoughtEvent.EVENT_TYPE), payload.capture());
        OrderBoughtEvent event = (OrderBoughtEvent) payload.getValue();
        assertEquals(15, event.getTreasuryAmount());
        assertEquals(35, event.getRewardPoolAmount());
        assertEquals(950, event.getSellerAmount());
        assertEquals(BUYER, event.getBuyer());
    }

    @Test
    @DisplayName("Wrong amount is AMOUNT_MISMATCH before anything is written")
    void testBuyAmountMismatch() {
        when(persistenceService.lockById(3L)).thenReturn(activeOrder(3, 1000));

        EscrowException e = assertThrows(EscrowException.class, () -> service.buyOrder(BUYER, 3L, 900));

        assertEquals(Violation.AMOUNT_MISMATCH, e.getViolation());
        verify(persistenceService, never()).update(any());
        verifyNoInteractions(valueLedger, assetRegistry, outboxService);
    }

    @Test
    @DisplayName("A failing pull propagates so the transaction rolls back the SOLD state")
    void testBuyTransferFailurePropagates() {
        when(persistenceService.lockById(3L)).thenReturn(activeOrder(3, 1000));
        when(persistenceService.update(any())).thenAnswer(inv -> inv.getArgument(0));
        doThrow(EscrowException.insufficientFunds("short"))
            .when(valueLedger).transferFrom(CUSTODY, BUYER, CUSTODY, 1000);

        EscrowException e = assertThrows(EscrowException.class, () -> service.buyOrder(BUYER, 3L, 1000));

        assertEquals(Violation.INSUFFICIENT_FUNDS, e.getViolation());
        verify(valueLedger, never()).transfer(any(), any(), anyLong());
        verifyNoInteractions(assetRegistry, outboxService);
    }

    @Test
    @DisplayName("Cancel commits CANCELED then returns the asset to the seller")
    void testCancelOrder() {
        when(persistenceService.lockById(3L)).thenReturn(activeOrder(3, 1000));
        when(persistenceService.update(any())).thenAnswer(inv -> inv.getArgument(0));

        Order canceled = service.cancelOrder(SELLER, 3L);

        assertEquals(OrderStatus.CANCELED, canceled.getStatus());
        InOrder inOrder = inOrder(persistenceService, assetRegistry, outboxService);
        inOrder.verify(persistenceService).update(any());
        inOrder.verify(assetRegistry).transferCustody(CUSTODY, SELLER, "sword-1");
        inOrder.verify(outboxService).saveEvent(eq("Order"), eq(3L), eq(OrderCanceledEvent.EVENT_TYPE), any());
        verifyNoInteractions(valueLedger);
    }

    @Test
    @DisplayName("Only the seller may cancel or reprice")
    void testSellerOnly() {
        when(persistenceService.lockById(3L)).thenReturn(activeOrder(3, 1000));

        assertEquals(Violation.UNAUTHORIZED,
            assertThrows(EscrowException.class, () -> service.cancelOrder(BUYER, 3L)).getViolation());
        assertEquals(Violation.UNAUTHORIZED,
            assertThrows(EscrowException.class, () -> service.updateOrder(BUYER, 3L, 5)).getViolation());
        verify(persistenceService, never()).update(any());
    }

    @Test
    @DisplayName("Unknown order id is NOT_FOUND on reads")
    void testGetOrderNotFound() {
        when(persistenceService.findById(42L)).thenReturn(java.util.Optional.empty());

        EscrowException e = assertThrows(EscrowException.class, () -> service.getOrder(42L));
        assertEquals(Violation.NOT_FOUND, e.getViolation());
    }
}
