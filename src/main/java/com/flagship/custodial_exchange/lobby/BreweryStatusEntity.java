package com.flagship.custodial_exchange.lobby;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * JPA entity for brewery_statuses, one row per (lobby, participant) that has
 * been mutated at least once.
 */
@Entity
@Table(name = "brewery_statuses")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BreweryStatusEntity {

    @EmbeddedId
    private BreweryStatusId id;

    @Column(nullable = false)
    private long mead;

    @Column(nullable = false)
    private long points;

    @Column(name = "valve_opened", nullable = false)
    private boolean valveOpened;

    @Column(name = "last_updated_at", nullable = false)
    private long lastUpdatedAt;

    @Column(name = "mead_per_second", nullable = false)
    private long meadPerSecond;

    BreweryStatusEntity(BreweryStatusId id) {
        this.id = id;
    }

    void copyFrom(BreweryStatus status) {
        this.mead = status.getMead();
        this.points = status.getPoints();
        this.valveOpened = status.isValveOpened();
        this.lastUpdatedAt = status.getLastUpdatedAt();
        this.meadPerSecond = status.getMeadPerSecond();
    }

    public BreweryStatus toDomain() {
        return new BreweryStatus(id.getLobbyId(), id.getAddress(), mead, points,
            valveOpened, lastUpdatedAt, meadPerSecond);
    }
}
