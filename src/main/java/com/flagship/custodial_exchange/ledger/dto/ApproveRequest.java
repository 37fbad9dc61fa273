package com.flagship.custodial_exchange.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

/**
 * Request DTO for granting a spender (usually an escrow custody address) an allowance.
 */
@Value
public class ApproveRequest {

    @NotBlank(message = "Spender is required")
    @JsonProperty("spender")
    String spender;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    @JsonProperty("amount")
    Long amount;
}
