package com.flagship.custodial_exchange.lobby;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for the lobbies table. Rows are never deleted.
 */
@Entity
@Table(name = "lobbies")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LobbyEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(name = "creator_address", nullable = false, updatable = false)
    private String creator;

    @Column(name = "joiner_address")
    private String joiner;

    @Column(nullable = false)
    private boolean canceled;

    @Column(name = "start_time", nullable = false)
    private long startTime;

    @Column(name = "bet_amount", nullable = false, updatable = false)
    private long betAmount;

    @Column(name = "creator_mead_in_land", nullable = false)
    private long creatorMeadInLand;

    @Column(name = "joiner_mead_in_land", nullable = false)
    private long joinerMeadInLand;

    @Column(name = "escrowed_amount", nullable = false)
    private long escrowedAmount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static LobbyEntity fromDomain(Lobby lobby) {
        return new LobbyEntity(
            lobby.getId(),
            lobby.getCreator(),
            lobby.getJoiner(),
            lobby.isCanceled(),
            lobby.getStartTime(),
            lobby.getBetAmount(),
            lobby.getCreatorMeadInLand(),
            lobby.getJoinerMeadInLand(),
            lobby.getEscrowedAmount(),
            null,
            null
        );
    }

    public Lobby toDomain() {
        return new Lobby(id, creator, joiner, canceled, startTime, betAmount,
            creatorMeadInLand, joinerMeadInLand, escrowedAmount, createdAt, updatedAt);
    }

    /**
     * Copies the mutable fields. A canceled row cannot be rewritten.
     */
    void updateFromDomain(Lobby lobby) {
        if (this.canceled) {
            throw new IllegalStateException("Lobby " + this.id + " is canceled and can no longer change");
        }
        this.joiner = lobby.getJoiner();
        this.canceled = lobby.isCanceled();
        this.startTime = lobby.getStartTime();
        this.creatorMeadInLand = lobby.getCreatorMeadInLand();
        this.joinerMeadInLand = lobby.getJoinerMeadInLand();
        this.escrowedAmount = lobby.getEscrowedAmount();
    }
}
