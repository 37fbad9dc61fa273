package com.flagship.custodial_exchange.market.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

@Value
public class UpdatePriceRequest {

    @NotNull(message = "Price is required")
    @PositiveOrZero(message = "Price must not be negative")
    @JsonProperty("price")
    Long price;
}
