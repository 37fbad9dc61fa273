package com.flagship.custodial_exchange.market;

import com.flagship.custodial_exchange.config.ExchangeProperties;
import com.flagship.custodial_exchange.exception.EscrowException;
import com.flagship.custodial_exchange.ledger.ValueLedger;
import com.flagship.custodial_exchange.market.event.OrderBoughtEvent;
import com.flagship.custodial_exchange.market.event.OrderCanceledEvent;
import com.flagship.custodial_exchange.market.event.OrderCreatedEvent;
import com.flagship.custodial_exchange.market.event.OrderUpdatedEvent;
import com.flagship.custodial_exchange.observability.CorrelationContext;
import com.flagship.custodial_exchange.observability.ExchangeMetrics;
import com.flagship.custodial_exchange.outbox.OutboxPublisher;
import com.flagship.custodial_exchange.outbox.OutboxService;
import com.flagship.custodial_exchange.pagination.CursorPage;
import com.flagship.custodial_exchange.registry.AssetRegistry;
import com.flagship.custodial_exchange.settings.SettingsProvider;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Order escrow market: sellers list assets into custody, buyers pay the exact
 * price, and the sale proceeds fan out to treasury, reward pool and seller.
 *
 * Every write runs in one transaction and follows the same sequence:
 * 1. Lock the order row and check preconditions (no effect yet)
 * 2. Flush the state transition
 * 3. Move value and asset custody
 * 4. Record the outbox event
 *
 * A failure at any step, a short allowance for instance, rolls back the whole
 * operation including the flushed transition.
 */
@Service
@Slf4j
public class OrderEscrowService {

    private static final String AGGREGATE_TYPE = OutboxPublisher.ORDER_AGGREGATE;

    private final OrderPersistenceService persistenceService;
    private final ValueLedger valueLedger;
    private final AssetRegistry assetRegistry;
    private final SettingsProvider settings;
    private final OutboxService outboxService;
    private final ExchangeMetrics metrics;
    private final Clock clock;
    private final String custodyAddress;

    public OrderEscrowService(OrderPersistenceService persistenceService,
                              ValueLedger valueLedger,
                              AssetRegistry assetRegistry,
                              SettingsProvider settings,
                              OutboxService outboxService,
                              ExchangeMetrics metrics,
                              ExchangeProperties properties,
                              Clock clock) {
        this.persistenceService = persistenceService;
        this.valueLedger = valueLedger;
        this.assetRegistry = assetRegistry;
        this.settings = settings;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.clock = clock;
        this.custodyAddress = properties.getCustody().getMarketAddress();
    }

    /**
     * Lists {@code assetId} for sale at {@code price}. The asset moves into
     * market custody until the order is canceled or sold.
     *
     * @throws EscrowException UNAUTHORIZED if the caller does not hold the asset
     */
    @Transactional
    public Order createOrder(String caller, String assetId, long price) {
        long startTime = System.currentTimeMillis();
        try {
            String owner = assetRegistry.ownerOf(assetId);
            if (!owner.equals(caller)) {
                throw EscrowException.unauthorized("Asset %s is not held by %s", assetId, caller);
            }

            Order order = Order.list(persistenceService.nextOrderId(), assetId, caller, price);
            MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, String.valueOf(order.getId()));

            Order saved = persistenceService.insert(order);
            assetRegistry.transferCustody(caller, custodyAddress, assetId);

            outboxService.saveEvent(AGGREGATE_TYPE, saved.getId(), OrderCreatedEvent.EVENT_TYPE,
                OrderCreatedEvent.fromOrder(saved, clock.instant()));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(ExchangeMetrics.MARKET, "create", "success", duration);
            log.info("Order created: asset={}, seller={}, price={}, duration={}ms",
                assetId, caller, price, duration);
            return saved;

        } catch (RuntimeException e) {
            fail("create", e, startTime);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
        }
    }

    /**
     * Changes the asking price of an active order.
     *
     * @throws EscrowException NOT_FOUND, INVALID_STATE unless ACTIVE, UNAUTHORIZED unless seller
     */
    @Transactional
    public Order updateOrder(String caller, long orderId, long price) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, String.valueOf(orderId));
        try {
            Order current = persistenceService.lockById(orderId);
            Order updated = persistenceService.update(current.reprice(caller, price));

            outboxService.saveEvent(AGGREGATE_TYPE, orderId, OrderUpdatedEvent.EVENT_TYPE,
                OrderUpdatedEvent.fromOrder(updated, current.getPrice(), clock.instant()));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(ExchangeMetrics.MARKET, "update", "success", duration);
            log.info("Order repriced: {} -> {}", current.getPrice(), price);
            return updated;

        } catch (RuntimeException e) {
            fail("update", e, startTime);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
        }
    }

    /**
     * Withdraws an active order and returns the asset to the seller.
     *
     * @throws EscrowException NOT_FOUND, INVALID_STATE unless ACTIVE, UNAUTHORIZED unless seller
     */
    @Transactional
    public Order cancelOrder(String caller, long orderId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, String.valueOf(orderId));
        try {
            Order canceled = persistenceService.update(
                persistenceService.lockById(orderId).cancel(caller));

            assetRegistry.transferCustody(custodyAddress, canceled.getSeller(), canceled.getAssetId());

            outboxService.saveEvent(AGGREGATE_TYPE, orderId, OrderCanceledEvent.EVENT_TYPE,
                OrderCanceledEvent.fromOrder(canceled, clock.instant()));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(ExchangeMetrics.MARKET, "cancel", "success", duration);
            log.info("Order canceled, asset {} returned to {}", canceled.getAssetId(), canceled.getSeller());
            return canceled;

        } catch (RuntimeException e) {
            fail("cancel", e, startTime);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
        }
    }

    /**
     * Buys an active order for exactly its price.
     *
     * The buyer must have approved the market custody address for at least
     * {@code amount}. Proceeds are split per {@link FeeSplit}; the asset goes
     * to the buyer.
     *
     * @throws EscrowException NOT_FOUND, INVALID_STATE unless ACTIVE,
     *         AMOUNT_MISMATCH if amount differs from price,
     *         INSUFFICIENT_FUNDS if the buyer's balance or allowance is short
     */
    @Transactional
    public Order buyOrder(String caller, long orderId, long amount) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, String.valueOf(orderId));
        try {
            Order sold = persistenceService.lockById(orderId).sell(caller, amount);
            FeeSplit split = FeeSplit.of(sold.getPrice(), settings.feeRate(), settings.treasuryFeeRate());

            sold = persistenceService.update(sold);
            persistenceService.recordPurchase(caller, orderId);

            valueLedger.transferFrom(custodyAddress, caller, custodyAddress, amount);
            valueLedger.transfer(custodyAddress, settings.treasuryAddress(), split.getTreasuryAmount());
            valueLedger.transfer(custodyAddress, settings.rewardPoolAddress(), split.getRewardPoolAmount());
            valueLedger.transfer(custodyAddress, sold.getSeller(), split.getSellerAmount());
            assetRegistry.transferCustody(custodyAddress, caller, sold.getAssetId());

            outboxService.saveEvent(AGGREGATE_TYPE, orderId, OrderBoughtEvent.EVENT_TYPE,
                OrderBoughtEvent.fromSale(sold, split, clock.instant()));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(ExchangeMetrics.MARKET, "buy", "success", duration);
            metrics.recordSale(split.getPrice(), split.getTreasuryAmount(), split.getRewardPoolAmount());
            log.info("Order bought: buyer={}, price={}, treasury={}, rewardPool={}, seller={}, duration={}ms",
                caller, split.getPrice(), split.getTreasuryAmount(), split.getRewardPoolAmount(),
                split.getSellerAmount(), duration);
            return sold;

        } catch (RuntimeException e) {
            fail("buy", e, startTime);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
        }
    }

    /**
     * @throws EscrowException NOT_FOUND for an unknown id
     */
    @Transactional(readOnly = true)
    public Order getOrder(long orderId) {
        return persistenceService.findById(orderId)
            .orElseThrow(() -> EscrowException.notFound("Order not found: %d", orderId));
    }

    @Transactional(readOnly = true)
    public long countOwnedOrders(String address) {
        return persistenceService.count(OrderIndexKind.OWNED, address);
    }

    @Transactional(readOnly = true)
    public long countBoughtOrders(String address) {
        return persistenceService.count(OrderIndexKind.BOUGHT, address);
    }

    @Transactional(readOnly = true)
    public CursorPage<Order> fetchOwnedOrders(String address, long cursor, int howMany) {
        return resolve(persistenceService.fetchPage(OrderIndexKind.OWNED, address, cursor, howMany));
    }

    @Transactional(readOnly = true)
    public CursorPage<Order> fetchBoughtOrders(String address, long cursor, int howMany) {
        return resolve(persistenceService.fetchPage(OrderIndexKind.BOUGHT, address, cursor, howMany));
    }

    private CursorPage<Order> resolve(CursorPage<Long> ids) {
        return new CursorPage<>(
            ids.getItems().stream().map(this::getOrder).toList(),
            ids.getNewCursor());
    }

    private void fail(String operation, RuntimeException e, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        String outcome = e instanceof EscrowException escrow ? escrow.getViolation().name() : "error";
        metrics.recordOperation(ExchangeMetrics.MARKET, operation, outcome, duration);
        log.warn("Order {} failed: outcome={}, error={}, duration={}ms", operation, outcome, e.getMessage(), duration);
    }
}
