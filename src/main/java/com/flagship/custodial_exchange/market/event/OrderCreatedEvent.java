package com.flagship.custodial_exchange.market.event;

import com.flagship.custodial_exchange.market.Order;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an asset is listed and taken into market custody.
 */
@Value
public class OrderCreatedEvent implements OrderEvent {
    UUID eventId;
    long orderId;
    String assetId;
    String seller;
    long price;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OrderCreatedEvent fromOrder(Order order, Instant occurredAt) {
        return new OrderCreatedEvent(
            UUID.randomUUID(),
            order.getId(),
            order.getAssetId(),
            order.getSeller(),
            order.getPrice(),
            occurredAt
        );
    }
}
