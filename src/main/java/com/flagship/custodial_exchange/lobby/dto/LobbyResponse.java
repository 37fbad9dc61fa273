package com.flagship.custodial_exchange.lobby.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.custodial_exchange.lobby.Lobby;
import com.flagship.custodial_exchange.lobby.LobbyPhase;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class LobbyResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("creator")
    String creator;

    @JsonProperty("joiner")
    String joiner;

    @JsonProperty("canceled")
    boolean canceled;

    @JsonProperty("phase")
    LobbyPhase phase;

    @JsonProperty("start_time")
    long startTime;

    @JsonProperty("bet_amount")
    long betAmount;

    @JsonProperty("escrowed_amount")
    long escrowedAmount;

    @JsonProperty("creator_mead_in_land")
    long creatorMeadInLand;

    @JsonProperty("joiner_mead_in_land")
    long joinerMeadInLand;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static LobbyResponse from(Lobby lobby, LobbyPhase phase) {
        return LobbyResponse.builder()
            .id(lobby.getId())
            .creator(lobby.getCreator())
            .joiner(lobby.getJoiner())
            .canceled(lobby.isCanceled())
            .phase(phase)
            .startTime(lobby.getStartTime())
            .betAmount(lobby.getBetAmount())
            .escrowedAmount(lobby.getEscrowedAmount())
            .creatorMeadInLand(lobby.getCreatorMeadInLand())
            .joinerMeadInLand(lobby.getJoinerMeadInLand())
            .createdAt(lobby.getCreatedAt())
            .updatedAt(lobby.getUpdatedAt())
            .build();
    }
}
