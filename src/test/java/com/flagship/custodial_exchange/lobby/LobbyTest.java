package com.flagship.custodial_exchange.lobby;

import com.flagship.custodial_exchange.exception.EscrowException;
import com.flagship.custodial_exchange.exception.Violation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LobbyTest {

    private static final long NOW = 1_700_000_000L;
    private static final long START = NOW + 3600;
    private static final String CREATOR = "alice";
    private static final String JOINER = "bob";

    private Lobby open() {
        return Lobby.open(1, CREATOR, START, 100, NOW);
    }

    private void assertViolation(Violation expected, Runnable action) {
        EscrowException e = assertThrows(EscrowException.class, action::run);
        assertEquals(expected, e.getViolation(), e.getMessage());
    }

    @Test
    @DisplayName("Start time must be strictly in the future")
    void testOpenRequiresFutureStart() {
        assertViolation(Violation.TIMING_VIOLATION, () -> Lobby.open(1, CREATOR, NOW, 100, NOW));
        assertViolation(Violation.TIMING_VIOLATION, () -> Lobby.open(1, CREATOR, NOW - 1, 100, NOW));

        Lobby lobby = open();
        assertEquals(100, lobby.getEscrowedAmount());
        assertEquals(LobbyPhase.OPEN, lobby.phaseAt(NOW));
    }

    @Test
    @DisplayName("Join escrows a second stake; a second joiner is rejected")
    void testJoin() {
        Lobby joined = open().join(JOINER, NOW);

        assertEquals(JOINER, joined.getJoiner());
        assertEquals(200, joined.getEscrowedAmount());
        assertEquals(LobbyPhase.JOINED, joined.phaseAt(NOW));
        assertViolation(Violation.ALREADY_IN_STATE, () -> joined.join("carol", NOW));
    }

    @Test
    @DisplayName("Unjoin 100s before start succeeds; 50s before start fails")
    void testUnjoinCutoff() {
        Lobby joined = open().join(JOINER, NOW);

        Lobby reopened = joined.unjoin(JOINER, NOW + 3500);
        assertNull(reopened.getJoiner());
        assertEquals(100, reopened.getEscrowedAmount());

        assertViolation(Violation.TIMING_VIOLATION, () -> joined.unjoin(JOINER, NOW + 3550));
        assertViolation(Violation.TIMING_VIOLATION, () -> joined.unjoin(JOINER, START - 60));
    }

    @Test
    @DisplayName("Only the current joiner may unjoin")
    void testUnjoinRole() {
        assertViolation(Violation.UNAUTHORIZED, () -> open().unjoin(JOINER, NOW));
        assertViolation(Violation.UNAUTHORIZED, () -> open().join(JOINER, NOW).unjoin(CREATOR, NOW));
    }

    @Test
    @DisplayName("A re-opened lobby can be joined by someone else")
    void testRejoin() {
        Lobby rejoined = open().join(JOINER, NOW).unjoin(JOINER, NOW).join("carol", NOW);
        assertEquals("carol", rejoined.getJoiner());
        assertEquals(200, rejoined.getEscrowedAmount());
    }

    @Test
    @DisplayName("Cancel is creator-only, pre-start, and final")
    void testCancel() {
        assertViolation(Violation.UNAUTHORIZED, () -> open().cancel(JOINER, NOW));
        assertViolation(Violation.TIMING_VIOLATION, () -> open().cancel(CREATOR, START));

        Lobby canceled = open().join(JOINER, NOW).cancel(CREATOR, NOW);
        assertTrue(canceled.isCanceled());
        assertEquals(JOINER, canceled.getJoiner(), "joiner stays recorded for the refund");
        assertEquals(0, canceled.getEscrowedAmount());
        assertEquals(LobbyPhase.CANCELED, canceled.phaseAt(NOW));

        assertViolation(Violation.INVALID_STATE, () -> canceled.cancel(CREATOR, NOW));
        assertViolation(Violation.INVALID_STATE, () -> canceled.join("carol", NOW));
        assertViolation(Violation.INVALID_STATE, () -> canceled.reschedule(CREATOR, START + 10, NOW));
        assertViolation(Violation.INVALID_STATE, () -> canceled.unjoin(JOINER, NOW));
    }

    @Test
    @DisplayName("Reschedule is creator-only and closed once started")
    void testReschedule() {
        assertEquals(START + 600, open().reschedule(CREATOR, START + 600, NOW).getStartTime());
        assertViolation(Violation.UNAUTHORIZED, () -> open().reschedule(JOINER, START + 600, NOW));
        assertViolation(Violation.TIMING_VIOLATION, () -> open().reschedule(CREATOR, START + 600, START));
    }

    @Test
    @DisplayName("In progress from start until five minutes later, only when joined")
    void testInProgressWindow() {
        Lobby joined = open().join(JOINER, NOW);

        assertViolation(Violation.TIMING_VIOLATION, () -> joined.requireInProgress(START - 1));
        joined.requireInProgress(START);
        joined.requireInProgress(START + 299);
        assertViolation(Violation.TIMING_VIOLATION, () -> joined.requireInProgress(START + 300));

        assertEquals(LobbyPhase.IN_PROGRESS, joined.phaseAt(START));
        assertEquals(LobbyPhase.ENDED, joined.phaseAt(START + 300));

        assertViolation(Violation.INVALID_STATE, () -> open().requireInProgress(START));
        assertEquals(LobbyPhase.ENDED, open().phaseAt(START));
    }

    @Test
    @DisplayName("Participants are the creator and the current joiner")
    void testParticipants() {
        Lobby joined = open().join(JOINER, NOW);

        joined.requireParticipant(CREATOR);
        joined.requireParticipant(JOINER);
        assertViolation(Violation.UNAUTHORIZED, () -> joined.requireParticipant("carol"));
    }
}
