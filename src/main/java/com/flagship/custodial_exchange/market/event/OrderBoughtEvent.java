package com.flagship.custodial_exchange.market.event;

import com.flagship.custodial_exchange.market.FeeSplit;
import com.flagship.custodial_exchange.market.Order;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an order sells.
 *
 * Carries the full fee split so consumers can reconcile treasury and reward
 * pool inflows without recomputing fees.
 */
@Value
public class OrderBoughtEvent implements OrderEvent {
    UUID eventId;
    long orderId;
    String assetId;
    String seller;
    String buyer;
    long price;
    long treasuryAmount;
    long rewardPoolAmount;
    long sellerAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderBought";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OrderBoughtEvent fromSale(Order order, FeeSplit split, Instant occurredAt) {
        return new OrderBoughtEvent(
            UUID.randomUUID(),
            order.getId(),
            order.getAssetId(),
            order.getSeller(),
            order.getBuyer(),
            order.getPrice(),
            split.getTreasuryAmount(),
            split.getRewardPoolAmount(),
            split.getSellerAmount(),
            occurredAt
        );
    }
}
