package com.flagship.custodial_exchange.lobby;

import com.flagship.custodial_exchange.exception.EscrowException;
import com.flagship.custodial_exchange.persistence.RecordCounters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Storage for lobbies and their per-participant brewery statuses.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LobbyPersistenceService {

    private final LobbyRepository lobbyRepository;
    private final BreweryStatusRepository breweryStatusRepository;
    private final RecordCounters recordCounters;

    /**
     * Next lobby id; counting starts at 1.
     */
    @Transactional
    public long nextLobbyId() {
        return recordCounters.next(RecordCounters.LOBBY);
    }

    @Transactional
    public Lobby insert(Lobby lobby) {
        LobbyEntity saved = lobbyRepository.saveAndFlush(LobbyEntity.fromDomain(lobby));
        log.debug("Saved lobby {} for creator {}", saved.getId(), saved.getCreator());
        return saved.toDomain();
    }

    /**
     * @throws EscrowException NOT_FOUND if the lobby does not exist
     */
    @Transactional
    public Lobby lockById(long lobbyId) {
        return lobbyRepository.findByIdForUpdate(lobbyId)
            .map(LobbyEntity::toDomain)
            .orElseThrow(() -> EscrowException.notFound("Lobby not found: %d", lobbyId));
    }

    @Transactional(readOnly = true)
    public Optional<Lobby> findById(long lobbyId) {
        return lobbyRepository.findById(lobbyId).map(LobbyEntity::toDomain);
    }

    /**
     * Writes a transition and flushes it before any stake moves.
     */
    @Transactional
    public Lobby update(Lobby lobby) {
        LobbyEntity existing = lobbyRepository.findById(lobby.getId())
            .orElseThrow(() -> EscrowException.notFound("Lobby not found: %d", lobby.getId()));
        existing.updateFromDomain(lobby);
        LobbyEntity updated = lobbyRepository.saveAndFlush(existing);
        log.debug("Updated lobby {}: joiner={}, canceled={}", updated.getId(), updated.getJoiner(), updated.isCanceled());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<BreweryStatus> findBreweryStatus(long lobbyId, String address) {
        return breweryStatusRepository.findById(new BreweryStatusId(lobbyId, address))
            .map(BreweryStatusEntity::toDomain);
    }

    @Transactional
    public BreweryStatus saveBreweryStatus(BreweryStatus status) {
        BreweryStatusId id = new BreweryStatusId(status.getLobbyId(), status.getAddress());
        BreweryStatusEntity entity = breweryStatusRepository.findById(id)
            .orElseGet(() -> new BreweryStatusEntity(id));
        entity.copyFrom(status);
        return breweryStatusRepository.saveAndFlush(entity).toDomain();
    }

    @Transactional(readOnly = true)
    public long sumEscrowed() {
        return lobbyRepository.sumEscrowedAmount();
    }
}
