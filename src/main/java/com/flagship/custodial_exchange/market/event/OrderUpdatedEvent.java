package com.flagship.custodial_exchange.market.event;

import com.flagship.custodial_exchange.market.Order;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when the seller changes the asking price.
 */
@Value
public class OrderUpdatedEvent implements OrderEvent {
    UUID eventId;
    long orderId;
    String seller;
    long previousPrice;
    long price;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OrderUpdatedEvent fromOrder(Order order, long previousPrice, Instant occurredAt) {
        return new OrderUpdatedEvent(
            UUID.randomUUID(),
            order.getId(),
            order.getSeller(),
            previousPrice,
            order.getPrice(),
            occurredAt
        );
    }
}
