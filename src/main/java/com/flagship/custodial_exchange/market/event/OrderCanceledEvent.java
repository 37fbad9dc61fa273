package com.flagship.custodial_exchange.market.event;

import com.flagship.custodial_exchange.market.Order;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when the seller withdraws an order and gets the asset back.
 */
@Value
public class OrderCanceledEvent implements OrderEvent {
    UUID eventId;
    long orderId;
    String assetId;
    String seller;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderCanceled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OrderCanceledEvent fromOrder(Order order, Instant occurredAt) {
        return new OrderCanceledEvent(
            UUID.randomUUID(),
            order.getId(),
            order.getAssetId(),
            order.getSeller(),
            occurredAt
        );
    }
}
