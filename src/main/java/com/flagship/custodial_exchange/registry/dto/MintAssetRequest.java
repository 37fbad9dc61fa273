package com.flagship.custodial_exchange.registry.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class MintAssetRequest {

    @NotBlank(message = "Asset id is required")
    @JsonProperty("asset_id")
    String assetId;

    @NotBlank(message = "Owner is required")
    @JsonProperty("owner")
    String owner;
}
