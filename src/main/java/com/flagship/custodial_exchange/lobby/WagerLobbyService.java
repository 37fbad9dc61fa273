package com.flagship.custodial_exchange.lobby;

import com.flagship.custodial_exchange.config.ExchangeProperties;
import com.flagship.custodial_exchange.exception.EscrowException;
import com.flagship.custodial_exchange.ledger.ValueLedger;
import com.flagship.custodial_exchange.lobby.accrual.MeadAccrualPolicy;
import com.flagship.custodial_exchange.lobby.event.LobbyCanceledEvent;
import com.flagship.custodial_exchange.lobby.event.LobbyCreatedEvent;
import com.flagship.custodial_exchange.lobby.event.LobbyJoinedEvent;
import com.flagship.custodial_exchange.lobby.event.LobbyUnjoinedEvent;
import com.flagship.custodial_exchange.lobby.event.LobbyUpdatedEvent;
import com.flagship.custodial_exchange.lobby.event.ValveToggledEvent;
import com.flagship.custodial_exchange.observability.CorrelationContext;
import com.flagship.custodial_exchange.observability.ExchangeMetrics;
import com.flagship.custodial_exchange.outbox.OutboxPublisher;
import com.flagship.custodial_exchange.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Wager lobby engine: a creator stakes a bet, one joiner matches it, and the
 * pair plays a five-minute game from the start time on.
 *
 * Stakes are pulled into the lobby custody address with
 * {@link ValueLedger#transferFrom}, so creator and joiner approve that address
 * first. Write operations lock the lobby row, check, flush the transition and
 * only then move value, all in one transaction.
 */
@Service
@Slf4j
public class WagerLobbyService {

    private static final String AGGREGATE_TYPE = OutboxPublisher.LOBBY_AGGREGATE;

    private final LobbyPersistenceService persistenceService;
    private final ValueLedger valueLedger;
    private final MeadAccrualPolicy accrualPolicy;
    private final OutboxService outboxService;
    private final ExchangeMetrics metrics;
    private final Clock clock;
    private final String custodyAddress;
    private final long meadPerSecond;

    public WagerLobbyService(LobbyPersistenceService persistenceService,
                             ValueLedger valueLedger,
                             MeadAccrualPolicy accrualPolicy,
                             OutboxService outboxService,
                             ExchangeMetrics metrics,
                             ExchangeProperties properties,
                             Clock clock) {
        this.persistenceService = persistenceService;
        this.valueLedger = valueLedger;
        this.accrualPolicy = accrualPolicy;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.clock = clock;
        this.custodyAddress = properties.getCustody().getLobbyAddress();
        this.meadPerSecond = properties.getLobby().getMeadPerSecond();
    }

    /**
     * Opens a lobby and escrows the creator's bet.
     *
     * @throws EscrowException TIMING_VIOLATION unless startTime is in the future,
     *         INSUFFICIENT_FUNDS if the creator cannot cover the bet
     */
    @Transactional
    public Lobby createLobby(String caller, long startTime, long betAmount) {
        long begin = System.currentTimeMillis();
        try {
            Instant now = clock.instant();
            Lobby lobby = Lobby.open(persistenceService.nextLobbyId(), caller, startTime, betAmount,
                now.getEpochSecond());
            MDC.put(CorrelationContext.LOBBY_ID_MDC_KEY, String.valueOf(lobby.getId()));

            Lobby saved = persistenceService.insert(lobby);
            valueLedger.transferFrom(custodyAddress, caller, custodyAddress, betAmount);

            outboxService.saveEvent(AGGREGATE_TYPE, saved.getId(), LobbyCreatedEvent.EVENT_TYPE,
                LobbyCreatedEvent.fromLobby(saved, now));

            succeeded("create", begin);
            metrics.recordStakeEscrowed(betAmount);
            log.info("Lobby created: creator={}, startTime={}, bet={}", caller, startTime, betAmount);
            return saved;

        } catch (RuntimeException e) {
            fail("create", e, begin);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.LOBBY_ID_MDC_KEY);
        }
    }

    /**
     * Moves the start time. The new time is not required to be in the future;
     * setting it to the past starts the lobby immediately.
     */
    @Transactional
    public Lobby updateStartTime(String caller, long lobbyId, long newStartTime) {
        long begin = System.currentTimeMillis();
        MDC.put(CorrelationContext.LOBBY_ID_MDC_KEY, String.valueOf(lobbyId));
        try {
            Instant now = clock.instant();
            Lobby current = persistenceService.lockById(lobbyId);
            Lobby updated = persistenceService.update(
                current.reschedule(caller, newStartTime, now.getEpochSecond()));

            outboxService.saveEvent(AGGREGATE_TYPE, lobbyId, LobbyUpdatedEvent.EVENT_TYPE,
                LobbyUpdatedEvent.fromLobby(updated, current.getStartTime(), now));

            succeeded("update", begin);
            log.info("Lobby rescheduled: {} -> {}", current.getStartTime(), newStartTime);
            return updated;

        } catch (RuntimeException e) {
            fail("update", e, begin);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.LOBBY_ID_MDC_KEY);
        }
    }

    /**
     * Cancels before start and refunds every escrowed stake.
     */
    @Transactional
    public Lobby cancelLobby(String caller, long lobbyId) {
        long begin = System.currentTimeMillis();
        MDC.put(CorrelationContext.LOBBY_ID_MDC_KEY, String.valueOf(lobbyId));
        try {
            Instant now = clock.instant();
            Lobby canceled = persistenceService.update(
                persistenceService.lockById(lobbyId).cancel(caller, now.getEpochSecond()));

            valueLedger.transfer(custodyAddress, canceled.getCreator(), canceled.getBetAmount());
            metrics.recordStakeRefunded(canceled.getBetAmount());
            if (canceled.getJoiner() != null) {
                valueLedger.transfer(custodyAddress, canceled.getJoiner(), canceled.getBetAmount());
                metrics.recordStakeRefunded(canceled.getBetAmount());
            }

            outboxService.saveEvent(AGGREGATE_TYPE, lobbyId, LobbyCanceledEvent.EVENT_TYPE,
                LobbyCanceledEvent.fromLobby(canceled, now));

            succeeded("cancel", begin);
            log.info("Lobby canceled: creator={}, joiner={}, refundEach={}",
                canceled.getCreator(), canceled.getJoiner(), canceled.getBetAmount());
            return canceled;

        } catch (RuntimeException e) {
            fail("cancel", e, begin);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.LOBBY_ID_MDC_KEY);
        }
    }

    /**
     * Joins an open lobby and escrows the joiner's matching bet.
     */
    @Transactional
    public Lobby joinLobby(String caller, long lobbyId) {
        long begin = System.currentTimeMillis();
        MDC.put(CorrelationContext.LOBBY_ID_MDC_KEY, String.valueOf(lobbyId));
        try {
            Instant now = clock.instant();
            Lobby joined = persistenceService.update(
                persistenceService.lockById(lobbyId).join(caller, now.getEpochSecond()));

            valueLedger.transferFrom(custodyAddress, caller, custodyAddress, joined.getBetAmount());

            outboxService.saveEvent(AGGREGATE_TYPE, lobbyId, LobbyJoinedEvent.EVENT_TYPE,
                LobbyJoinedEvent.fromLobby(joined, now));

            succeeded("join", begin);
            metrics.recordStakeEscrowed(joined.getBetAmount());
            log.info("Lobby joined by {}", caller);
            return joined;

        } catch (RuntimeException e) {
            fail("join", e, begin);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.LOBBY_ID_MDC_KEY);
        }
    }

    /**
     * Leaves a lobby more than a minute before start; the bet is refunded and
     * the seat opens up again.
     */
    @Transactional
    public Lobby unjoinLobby(String caller, long lobbyId) {
        long begin = System.currentTimeMillis();
        MDC.put(CorrelationContext.LOBBY_ID_MDC_KEY, String.valueOf(lobbyId));
        try {
            Instant now = clock.instant();
            Lobby reopened = persistenceService.update(
                persistenceService.lockById(lobbyId).unjoin(caller, now.getEpochSecond()));

            valueLedger.transfer(custodyAddress, caller, reopened.getBetAmount());

            outboxService.saveEvent(AGGREGATE_TYPE, lobbyId, LobbyUnjoinedEvent.EVENT_TYPE,
                LobbyUnjoinedEvent.fromLobby(reopened, caller, now));

            succeeded("unjoin", begin);
            metrics.recordStakeRefunded(reopened.getBetAmount());
            log.info("Lobby unjoined by {}", caller);
            return reopened;

        } catch (RuntimeException e) {
            fail("unjoin", e, begin);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.LOBBY_ID_MDC_KEY);
        }
    }

    /**
     * Opens or closes the caller's valve while the game runs. The caller's
     * accrual is checkpointed first.
     *
     * @throws EscrowException INVALID_STATE when canceled or unjoined,
     *         TIMING_VIOLATION outside the game window,
     *         UNAUTHORIZED for non-participants,
     *         ALREADY_IN_STATE if the valve is already in the desired state
     */
    @Transactional
    public BreweryStatus toggleValve(String caller, long lobbyId, boolean open) {
        long begin = System.currentTimeMillis();
        MDC.put(CorrelationContext.LOBBY_ID_MDC_KEY, String.valueOf(lobbyId));
        try {
            Instant now = clock.instant();
            Lobby lobby = persistenceService.lockById(lobbyId);
            lobby.requireInProgress(now.getEpochSecond());
            lobby.requireParticipant(caller);

            BreweryStatus status = persistenceService.findBreweryStatus(lobbyId, caller)
                .orElseGet(() -> BreweryStatus.initial(lobbyId, caller, meadPerSecond));
            if (status.isValveOpened() == open) {
                throw EscrowException.alreadyInState("Valve of %s in lobby %d is already %s",
                    caller, lobbyId, open ? "open" : "closed");
            }

            BreweryStatus saved = persistenceService.saveBreweryStatus(
                accrualPolicy.checkpoint(status, now.getEpochSecond()).withValve(open));

            outboxService.saveEvent(AGGREGATE_TYPE, lobbyId, ValveToggledEvent.EVENT_TYPE,
                ValveToggledEvent.fromStatus(saved, now));

            succeeded("toggle_valve", begin);
            log.info("Valve of {} {}", caller, open ? "opened" : "closed");
            return saved;

        } catch (RuntimeException e) {
            fail("toggle_valve", e, begin);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.LOBBY_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public Lobby getLobby(long lobbyId) {
        return persistenceService.findById(lobbyId)
            .orElseThrow(() -> EscrowException.notFound("Lobby not found: %d", lobbyId));
    }

    /**
     * Stored status, or the initial one if the participant never toggled.
     * Reading never creates a row.
     */
    @Transactional(readOnly = true)
    public BreweryStatus getBreweryStatus(long lobbyId, String address) {
        getLobby(lobbyId);
        return persistenceService.findBreweryStatus(lobbyId, address)
            .orElseGet(() -> BreweryStatus.initial(lobbyId, address, meadPerSecond));
    }

    public LobbyPhase phaseOf(Lobby lobby) {
        return lobby.phaseAt(clock.instant().getEpochSecond());
    }

    private void succeeded(String operation, long begin) {
        metrics.recordOperation(ExchangeMetrics.LOBBY, operation, "success", System.currentTimeMillis() - begin);
    }

    private void fail(String operation, RuntimeException e, long begin) {
        long duration = System.currentTimeMillis() - begin;
        String outcome = e instanceof EscrowException escrow ? escrow.getViolation().name() : "error";
        metrics.recordOperation(ExchangeMetrics.LOBBY, operation, outcome, duration);
        log.warn("Lobby {} failed: outcome={}, error={}, duration={}ms", operation, outcome, e.getMessage(), duration);
    }
}
