package com.flagship.custodial_exchange.market.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.custodial_exchange.market.Order;
import com.flagship.custodial_exchange.market.OrderStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class OrderResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("status")
    OrderStatus status;

    @JsonProperty("asset_id")
    String assetId;

    @JsonProperty("seller")
    String seller;

    @JsonProperty("buyer")
    String buyer;

    @JsonProperty("price")
    long price;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static OrderResponse from(Order order) {
        return OrderResponse.builder()
            .id(order.getId())
            .status(order.getStatus())
            .assetId(order.getAssetId())
            .seller(order.getSeller())
            .buyer(order.getBuyer())
            .price(order.getPrice())
            .createdAt(order.getCreatedAt())
            .updatedAt(order.getUpdatedAt())
            .build();
    }
}
