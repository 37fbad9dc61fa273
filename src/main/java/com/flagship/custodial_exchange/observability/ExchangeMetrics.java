package com.flagship.custodial_exchange.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for the escrow engines.
 *
 * <ul>
 *   <li>{@code escrow.operations} counter, tagged by engine, operation and outcome</li>
 *   <li>{@code escrow.latency} timer, tagged by engine and operation</li>
 *   <li>{@code market.sales.volume} and {@code market.fees.*} sale amounts</li>
 *   <li>{@code lobby.stakes.escrowed} and {@code lobby.stakes.refunded}</li>
 *   <li>{@code idempotency.cache} hit/miss</li>
 *   <li>{@code market.orders.active} and {@code lobby.stakes.held} gauges, refreshed by {@link MetricsScheduler}</li>
 * </ul>
 */
@Component
public class ExchangeMetrics {

    public static final String MARKET = "market";
    public static final String LOBBY = "lobby";

    private final MeterRegistry registry;

    private final Counter salesVolume;
    private final Counter treasuryFees;
    private final Counter rewardPoolFees;
    private final Counter stakesEscrowed;
    private final Counter stakesRefunded;

    private final AtomicLong activeOrders = new AtomicLong(0);
    private final AtomicLong stakesHeld = new AtomicLong(0);

    public ExchangeMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.salesVolume = Counter.builder("market.sales.volume")
                .description("Sum of sale prices paid for orders")
                .register(registry);

        this.treasuryFees = Counter.builder("market.fees.treasury")
                .description("Sale fees routed to the treasury")
                .register(registry);

        this.rewardPoolFees = Counter.builder("market.fees.reward_pool")
                .description("Sale fees routed to the reward pool")
                .register(registry);

        this.stakesEscrowed = Counter.builder("lobby.stakes.escrowed")
                .description("Stakes pulled into lobby custody")
                .register(registry);

        this.stakesRefunded = Counter.builder("lobby.stakes.refunded")
                .description("Stakes refunded from lobby custody")
                .register(registry);

        Gauge.builder("market.orders.active", activeOrders, AtomicLong::get)
                .description("Orders listed and not yet sold or canceled")
                .register(registry);

        Gauge.builder("lobby.stakes.held", stakesHeld, AtomicLong::get)
                .description("Stake currently escrowed across all lobbies")
                .register(registry);
    }

    /**
     * Records one engine operation with its outcome ("success" or the
     * violation name) and latency.
     */
    public void recordOperation(String engine, String operation, String outcome, long durationMs) {
        registry.counter("escrow.operations",
                "engine", engine,
                "operation", operation,
                "outcome", sanitizeTag(outcome)
        ).increment();
        Timer timer = registry.timer("escrow.latency", "engine", engine, "operation", operation);
        timer.record(Duration.ofMillis(durationMs));
    }

    public void recordSale(long price, long treasuryAmount, long rewardPoolAmount) {
        salesVolume.increment(price);
        treasuryFees.increment(treasuryAmount);
        rewardPoolFees.increment(rewardPoolAmount);
    }

    public void recordStakeEscrowed(long amount) {
        stakesEscrowed.increment(amount);
    }

    public void recordStakeRefunded(long amount) {
        stakesRefunded.increment(amount);
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }

    public void updateEscrowGauges(long activeOrderCount, long escrowedStake) {
        activeOrders.set(activeOrderCount);
        stakesHeld.set(escrowedStake);
    }
}
