package com.flagship.custodial_exchange.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class BalanceResponse {

    @JsonProperty("address")
    String address;

    @JsonProperty("balance")
    long balance;
}
