package com.flagship.custodial_exchange.lobby;

import com.flagship.custodial_exchange.config.ExchangeProperties;
import com.flagship.custodial_exchange.exception.EscrowException;
import com.flagship.custodial_exchange.exception.Violation;
import com.flagship.custodial_exchange.ledger.ValueLedger;
import com.flagship.custodial_exchange.lobby.accrual.CheckpointOnlyAccrualPolicy;
import com.flagship.custodial_exchange.lobby.event.LobbyCanceledEvent;
import com.flagship.custodial_exchange.lobby.event.LobbyUnjoinedEvent;
import com.flagship.custodial_exchange.lobby.event.ValveToggledEvent;
import com.flagship.custodial_exchange.observability.ExchangeMetrics;
import com.flagship.custodial_exchange.outbox.OutboxService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WagerLobbyServiceTest {

    private static final String CUSTODY = "escrow:wager-lobby";
    private static final String CREATOR = "alice";
    private static final String JOINER = "bob";
    private static final long NOW = 1_800_000_000L;
    private static final long START = NOW + 3600;

    @Mock
    private LobbyPersistenceService persistenceService;

    @Mock
    private ValueLedger valueLedger;

    @Mock
    private OutboxService outboxService;

    @Mock
    private Clock clock;

    private WagerLobbyService service;

    @BeforeEach
    void setUp() {
        ExchangeProperties properties = new ExchangeProperties();
        service = new WagerLobbyService(
            persistenceService,
            valueLedger,
            new CheckpointOnlyAccrualPolicy(),
            outboxService,
            new ExchangeMetrics(new SimpleMeterRegistry()),
            properties,
            clock
        );
    }

    private void at(long epochSecond) {
        when(clock.instant()).thenReturn(Instant.ofEpochSecond(epochSecond));
    }

    private Lobby openLobby() {
        return new Lobby(1, CREATOR, null, false, START, 100, 0, 0, 100, Instant.EPOCH, Instant.EPOCH);
    }

    private Lobby joinedLobby() {
        return new Lobby(1, CREATOR, JOINER, false, START, 100, 0, 0, 200, Instant.EPOCH, Instant.EPOCH);
    }

    private void assertViolation(Violation expected, Runnable action) {
        EscrowException e = assertThrows(EscrowException.class, action::run);
        assertEquals(expected, e.getViolation(), e.getMessage());
    }

    @Test
    @DisplayName("Create stores the lobby, then pulls the creator's bet into custody")
    void testCreateLobby() {
        at(NOW);
        when(persistenceService.nextLobbyId()).thenReturn(1L);
        when(persistenceService.insert(any())).thenAnswer(inv -> inv.getArgument(0));

        Lobby lobby = service.createLobby(CREATOR, START, 100);

        assertEquals(1, lobby.getId());
        assertEquals(CREATOR, lobby.getCreator());
        InOrder inOrder = inOrder(persistenceService, valueLedger, outboxService);
        inOrder.verify(persistenceService).insert(any());
        inOrder.verify(valueLedger).transferFrom(CUSTODY, CREATOR, CUSTODY, 100);
        inOrder.verify(outboxService).saveEvent(eq("Lobby"), eq(1L), eq("LobbyCreated"), any());
    }

    @Test
    @DisplayName("Create with a start time not in the future moves no value")
    void testCreateLobbyInPast() {
        at(NOW);

        assertViolation(Violation.TIMING_VIOLATION, () -> service.createLobby(CREATOR, NOW, 100));
        verify(persistenceService, never()).insert(any());
        verifyNoInteractions(valueLedger, outboxService);
    }

    @Test
    @DisplayName("Join records the joiner before pulling the matching bet")
    void testJoinLobby() {
        at(NOW);
        when(persistenceService.lockById(1L)).thenReturn(openLobby());
        when(persistenceService.update(any())).thenAnswer(inv -> inv.getArgument(0));

        Lobby joined = service.joinLobby(JOINER, 1L);

        assertEquals(JOINER, joined.getJoiner());
        InOrder inOrder = inOrder(persistenceService, valueLedger);
        inOrder.verify(persistenceService).update(argThat(l -> JOINER.equals(l.getJoiner())));
        inOrder.verify(valueLedger).transferFrom(CUSTODY, JOINER, CUSTODY, 100);
    }

    @Test
    @DisplayName("Unjoin 100s before start refunds the joiner and clears the seat")
    void testUnjoinBeforeCutoff() {
        at(NOW + 3500);
        when(persistenceService.lockById(1L)).thenReturn(joinedLobby());
        when(persistenceService.update(any())).thenAnswer(inv -> inv.getArgument(0));

        Lobby reopened = service.unjoinLobby(JOINER, 1L);

        assertNull(reopened.getJoiner());
        InOrder inOrder = inOrder(persistenceService, valueLedger, outboxService);
        inOrder.verify(persistenceService).update(argThat(l -> l.getJoiner() == null));
        inOrder.verify(valueLedger).transfer(CUSTODY, JOINER, 100);
        inOrder.verify(outboxService).saveEvent(eq("Lobby"), eq(1L), eq(LobbyUnjoinedEvent.EVENT_TYPE), any());
    }

    @Test
    @DisplayName("Unjoin 50s before start fails and leaves the joiner in place")
    void testUnjoinAfterCutoff() {
        at(NOW + 3550);
        when(persistenceService.lockById(1L)).thenReturn(joinedLobby());

        assertViolation(Violation.TIMING_VIOLATION, () -> service.unjoinLobby(JOINER, 1L));
        verify(persistenceService, never()).update(any());
        verifyNoInteractions(valueLedger, outboxService);
    }

    @Test
    @DisplayName("Cancel with a joiner refunds exactly the bet to both")
    void testCancelRefundsBoth() {
        at(NOW);
        when(persistenceService.lockById(1L)).thenReturn(joinedLobby());
        when(persistenceService.update(any())).thenAnswer(inv -> inv.getArgument(0));

        Lobby canceled = service.cancelLobby(CREATOR, 1L);

        assertTrue(canceled.isCanceled());
        InOrder inOrder = inOrder(persistenceService, valueLedger, outboxService);
        inOrder.verify(persistenceService).update(argThat(Lobby::isCanceled));
        inOrder.verify(valueLedger).transfer(CUSTODY, CREATOR, 100);
        inOrder.verify(valueLedger).transfer(CUSTODY, JOINER, 100);
        inOrder.verify(outboxService).saveEvent(eq("Lobby"), eq(1L), eq(LobbyCanceledEvent.EVENT_TYPE), any());
        verify(valueLedger, times(2)).transfer(any(), any(), anyLong());
    }

    @Test
    @DisplayName("Cancel without a joiner refunds only the creator")
    void testCancelRefundsCreatorOnly() {
        at(NOW);
        when(persistenceService.lockById(1L)).thenReturn(openLobby());
        when(persistenceService.update(any())).thenAnswer(inv -> inv.getArgument(0));

        service.cancelLobby(CREATOR, 1L);

        verify(valueLedger).transfer(CUSTODY, CREATOR, 100);
        verifyNoMoreInteractions(valueLedger);
    }

    @Test
    @DisplayName("Redundant valve toggle is rejected; alternating toggles advance the checkpoint")
    void testToggleValve() {
        AtomicReference<BreweryStatus> stored = new AtomicReference<>();
        when(persistenceService.lockById(1L)).thenReturn(joinedLobby());
        when(persistenceService.findBreweryStatus(1L, JOINER)).thenAnswer(inv -> Optional.ofNullable(stored.get()));
        when(persistenceService.saveBreweryStatus(any())).thenAnswer(inv -> {
            stored.set(inv.getArgument(0));
            return stored.get();
        });

        when(clock.instant()).thenReturn(
            Instant.ofEpochSecond(START + 10),
            Instant.ofEpochSecond(START + 20),
            Instant.ofEpochSecond(START + 30));

        BreweryStatus opened = service.toggleValve(JOINER, 1L, true);
        assertTrue(opened.isValveOpened());
        assertEquals(START + 10, opened.getLastUpdatedAt());

        assertViolation(Violation.ALREADY_IN_STATE, () -> service.toggleValve(JOINER, 1L, true));
        assertEquals(START + 10, stored.get().getLastUpdatedAt(), "rejected toggle leaves the checkpoint");

        BreweryStatus closed = service.toggleValve(JOINER, 1L, false);
        assertFalse(closed.isValveOpened());
        assertEquals(START + 30, closed.getLastUpdatedAt());

        verify(outboxService, times(2)).saveEvent(eq("Lobby"), eq(1L), eq(ValveToggledEvent.EVENT_TYPE), any());
    }

    @Test
    @DisplayName("Valve outside the game window, by a stranger, or without joiner is rejected")
    void testToggleValvePreconditions() {
        when(persistenceService.lockById(1L)).thenReturn(joinedLobby(), joinedLobby(), openLobby());

        at(START - 1);
        assertViolation(Violation.TIMING_VIOLATION, () -> service.toggleValve(CREATOR, 1L, true));

        at(START + 1);
        assertViolation(Violation.UNAUTHORIZED, () -> service.toggleValve("carol", 1L, true));
        assertViolation(Violation.INVALID_STATE, () -> service.toggleValve(CREATOR, 1L, true));

        verify(persistenceService, never()).saveBreweryStatus(any());
        verifyNoInteractions(outboxService);
    }

    @Test
    @DisplayName("Reading a brewery status never creates one")
    void testGetBreweryStatusDefault() {
        when(persistenceService.findById(1L)).thenReturn(Optional.of(joinedLobby()));
        when(persistenceService.findBreweryStatus(1L, JOINER)).thenReturn(Optional.empty());

        BreweryStatus status = service.getBreweryStatus(1L, JOINER);

        assertFalse(status.isValveOpened());
        assertEquals(0, status.getMead());
        assertEquals(0, status.getLastUpdatedAt());
        verify(persistenceService, never()).saveBreweryStatus(any());
    }
}
