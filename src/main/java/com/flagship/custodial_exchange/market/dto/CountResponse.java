package com.flagship.custodial_exchange.market.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class CountResponse {

    @JsonProperty("address")
    String address;

    @JsonProperty("count")
    long count;
}
