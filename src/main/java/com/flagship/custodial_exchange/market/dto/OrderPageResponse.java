package com.flagship.custodial_exchange.market.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.custodial_exchange.market.Order;
import com.flagship.custodial_exchange.pagination.CursorPage;
import lombok.Value;

import java.util.List;

/**
 * One page of an owner or buyer index. Pass {@code new_cursor} back as
 * {@code cursor} to continue.
 */
@Value
public class OrderPageResponse {

    @JsonProperty("items")
    List<OrderResponse> items;

    @JsonProperty("new_cursor")
    long newCursor;

    public static OrderPageResponse from(CursorPage<Order> page) {
        return new OrderPageResponse(
            page.getItems().stream().map(OrderResponse::from).toList(),
            page.getNewCursor());
    }
}
