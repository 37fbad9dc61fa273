package com.flagship.custodial_exchange.lobby;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class BreweryStatusId implements Serializable {

    @Column(name = "lobby_id", nullable = false, updatable = false)
    private long lobbyId;

    @Column(name = "address", nullable = false, updatable = false)
    private String address;
}
