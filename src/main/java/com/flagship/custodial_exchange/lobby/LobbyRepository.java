package com.flagship.custodial_exchange.lobby;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LobbyRepository extends JpaRepository<LobbyEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LobbyEntity l WHERE l.id = :id")
    Optional<LobbyEntity> findByIdForUpdate(@Param("id") Long id);

    /**
     * Stake the lobby custody account must be able to cover.
     */
    @Query("SELECT COALESCE(SUM(l.escrowedAmount), 0) FROM LobbyEntity l")
    long sumEscrowedAmount();
}
