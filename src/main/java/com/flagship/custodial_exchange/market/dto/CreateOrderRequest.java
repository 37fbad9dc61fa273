package com.flagship.custodial_exchange.market.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

/**
 * Request DTO for listing an asset.
 */
@Value
public class CreateOrderRequest {

    @NotBlank(message = "Asset id is required")
    @JsonProperty("asset_id")
    String assetId;

    @NotNull(message = "Price is required")
    @PositiveOrZero(message = "Price must not be negative")
    @JsonProperty("price")
    Long price;
}
