package com.flagship.custodial_exchange.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

/**
 * Request DTO for crediting value to an address from the issuer account.
 */
@Value
public class DepositRequest {

    @NotBlank(message = "Address is required")
    @JsonProperty("address")
    String address;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    @JsonProperty("amount")
    Long amount;
}
