package com.flagship.custodial_exchange.registry.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class AssetOwnerResponse {

    @JsonProperty("asset_id")
    String assetId;

    @JsonProperty("owner")
    String owner;
}
