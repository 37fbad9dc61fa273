package com.flagship.custodial_exchange.lobby;

import com.flagship.custodial_exchange.exception.EscrowException;
import lombok.Value;

import java.time.Instant;

/**
 * Lobby domain object.
 *
 * Times are epoch seconds. A lobby has started once {@code startTime <= now};
 * before that it may be rescheduled, joined, unjoined or canceled. Once
 * started and joined it is in progress for {@link #GAME_DURATION_SECONDS}.
 *
 * {@code escrowedAmount} tracks the stake held for this lobby: the bet after
 * create, twice the bet while joined, zero after cancel.
 *
 * Transitions return a new instance and check in a fixed order: canceled,
 * started, role, then anything operation specific.
 */
@Value
public class Lobby {

    public static final long UNJOIN_CUTOFF_SECONDS = 60;
    public static final long GAME_DURATION_SECONDS = 5 * 60;

    long id;
    String creator;
    String joiner;
    boolean canceled;
    long startTime;
    long betAmount;
    long creatorMeadInLand;
    long joinerMeadInLand;
    long escrowedAmount;
    Instant createdAt;
    Instant updatedAt;

    /**
     * @throws EscrowException TIMING_VIOLATION unless {@code startTime} is after {@code now}
     */
    public static Lobby open(long id, String creator, long startTime, long betAmount, long now) {
        requireCaller(creator);
        if (betAmount < 0) {
            throw new IllegalArgumentException("Bet amount must not be negative: " + betAmount);
        }
        if (startTime <= now) {
            throw EscrowException.timing("Start time %d is not in the future (now %d)", startTime, now);
        }
        return new Lobby(id, creator, null, false, startTime, betAmount, 0, 0, betAmount, null, null);
    }

    public Lobby reschedule(String caller, long newStartTime, long now) {
        requireNotCanceled("update");
        requireNotStarted("update", now);
        requireCreator(caller, "update");
        return new Lobby(id, creator, joiner, canceled, newStartTime, betAmount,
            creatorMeadInLand, joinerMeadInLand, escrowedAmount, createdAt, updatedAt);
    }

    /**
     * Cancels the lobby. The caller refunds the bet to the creator and, when
     * present, to the joiner.
     */
    public Lobby cancel(String caller, long now) {
        requireNotCanceled("cancel");
        requireNotStarted("cancel", now);
        requireCreator(caller, "cancel");
        return new Lobby(id, creator, joiner, true, startTime, betAmount,
            creatorMeadInLand, joinerMeadInLand, 0, createdAt, updatedAt);
    }

    /**
     * @throws EscrowException ALREADY_IN_STATE if someone already joined
     */
    public Lobby join(String caller, long now) {
        requireCaller(caller);
        requireNotCanceled("join");
        requireNotStarted("join", now);
        if (joiner != null) {
            throw EscrowException.alreadyInState("Lobby %d already joined by %s", id, joiner);
        }
        return new Lobby(id, creator, caller, canceled, startTime, betAmount,
            creatorMeadInLand, joinerMeadInLand, Math.addExact(escrowedAmount, betAmount),
            createdAt, updatedAt);
    }

    /**
     * @throws EscrowException UNAUTHORIZED unless caller is the joiner,
     *         TIMING_VIOLATION within {@link #UNJOIN_CUTOFF_SECONDS} of start
     */
    public Lobby unjoin(String caller, long now) {
        requireNotCanceled("unjoin");
        requireNotStarted("unjoin", now);
        if (joiner == null || !joiner.equals(caller)) {
            throw EscrowException.unauthorized("Only the joiner may unjoin lobby %d", id);
        }
        if (startTime - now <= UNJOIN_CUTOFF_SECONDS) {
            throw EscrowException.timing(
                "Lobby %d starts in %d seconds; unjoin closes %d seconds before start",
                id, startTime - now, UNJOIN_CUTOFF_SECONDS);
        }
        return new Lobby(id, creator, null, canceled, startTime, betAmount,
            creatorMeadInLand, joinerMeadInLand, escrowedAmount - betAmount, createdAt, updatedAt);
    }

    /**
     * @throws EscrowException INVALID_STATE without a joiner or when canceled,
     *         TIMING_VIOLATION outside the game window
     */
    public void requireInProgress(long now) {
        if (canceled) {
            throw EscrowException.invalidState("Lobby %d is canceled", id);
        }
        if (joiner == null) {
            throw EscrowException.invalidState("Lobby %d has no joiner", id);
        }
        if (now < startTime || now >= gameEndTime()) {
            throw EscrowException.timing("Lobby %d is in progress from %d until %d, now %d",
                id, startTime, gameEndTime(), now);
        }
    }

    public void requireParticipant(String caller) {
        if (!isParticipant(caller)) {
            throw EscrowException.unauthorized("%s is not a participant of lobby %d", caller, id);
        }
    }

    public boolean isParticipant(String address) {
        return creator.equals(address) || (joiner != null && joiner.equals(address));
    }

    public boolean hasStarted(long now) {
        return startTime <= now;
    }

    public long gameEndTime() {
        return Math.addExact(startTime, GAME_DURATION_SECONDS);
    }

    public LobbyPhase phaseAt(long now) {
        if (canceled) {
            return LobbyPhase.CANCELED;
        }
        if (!hasStarted(now)) {
            return joiner == null ? LobbyPhase.OPEN : LobbyPhase.JOINED;
        }
        if (joiner != null && now < gameEndTime()) {
            return LobbyPhase.IN_PROGRESS;
        }
        return LobbyPhase.ENDED;
    }

    private void requireNotCanceled(String operation) {
        if (canceled) {
            throw EscrowException.invalidState("Cannot %s lobby %d: it is canceled", operation, id);
        }
    }

    private void requireNotStarted(String operation, long now) {
        if (hasStarted(now)) {
            throw EscrowException.timing("Cannot %s lobby %d: it started at %d", operation, id, startTime);
        }
    }

    private void requireCreator(String caller, String operation) {
        if (!creator.equals(caller)) {
            throw EscrowException.unauthorized("Only the creator may %s lobby %d", operation, id);
        }
    }

    private static void requireCaller(String caller) {
        if (caller == null || caller.isBlank()) {
            throw new IllegalArgumentException("Caller address is required");
        }
    }
}
