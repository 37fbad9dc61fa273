package com.flagship.custodial_exchange.lobby;

import com.flagship.custodial_exchange.idempotency.IdempotencyService;
import com.flagship.custodial_exchange.lobby.dto.BreweryStatusResponse;
import com.flagship.custodial_exchange.lobby.dto.CreateLobbyRequest;
import com.flagship.custodial_exchange.lobby.dto.LobbyResponse;
import com.flagship.custodial_exchange.lobby.dto.ToggleValveRequest;
import com.flagship.custodial_exchange.lobby.dto.UpdateStartTimeRequest;
import com.flagship.custodial_exchange.observability.ExchangeMetrics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * REST controller for wager lobbies.
 *
 * Creating a lobby is idempotent per {@code Idempotency-Key} and caller, so a
 * retried request never escrows the bet twice.
 */
@RestController
@RequestMapping("/api/lobbies")
@RequiredArgsConstructor
@Slf4j
public class LobbyController {

    private static final String CALLER_HEADER = "X-Caller-Address";
    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final WagerLobbyService lobbyService;
    private final IdempotencyService idempotencyService;
    private final ExchangeMetrics metrics;

    @PostMapping
    @Transactional
    public ResponseEntity<LobbyResponse> createLobby(
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @Valid @RequestBody CreateLobbyRequest request) {

        log.info("Received lobby creation request: idempotencyKey={}, startTime={}, bet={}",
                idempotencyKey, request.getStartTime(), request.getBetAmount());

        Optional<Long> existingId = idempotencyService.lookup(IdempotencyService.LOBBY, caller, idempotencyKey);
        if (existingId.isPresent()) {
            metrics.recordIdempotencyHit();
            log.info("Idempotency key already used, returning existing lobby {}", existingId.get());
            return ResponseEntity.ok(respond(lobbyService.getLobby(existingId.get())));
        }
        metrics.recordIdempotencyMiss();

        Lobby lobby = lobbyService.createLobby(caller, request.getStartTime(), request.getBetAmount());
        idempotencyService.store(IdempotencyService.LOBBY, caller, idempotencyKey, lobby.getId());

        return ResponseEntity.status(HttpStatus.CREATED).body(respond(lobby));
    }

    @PutMapping("/{id}/start-time")
    public ResponseEntity<LobbyResponse> updateStartTime(@RequestHeader(CALLER_HEADER) String caller,
                                                         @PathVariable("id") long id,
                                                         @Valid @RequestBody UpdateStartTimeRequest request) {
        return ResponseEntity.ok(respond(lobbyService.updateStartTime(caller, id, request.getStartTime())));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<LobbyResponse> cancel(@RequestHeader(CALLER_HEADER) String caller,
                                                @PathVariable("id") long id) {
        return ResponseEntity.ok(respond(lobbyService.cancelLobby(caller, id)));
    }

    @PostMapping("/{id}/join")
    public ResponseEntity<LobbyResponse> join(@RequestHeader(CALLER_HEADER) String caller,
                                              @PathVariable("id") long id) {
        return ResponseEntity.ok(respond(lobbyService.joinLobby(caller, id)));
    }

    @PostMapping("/{id}/unjoin")
    public ResponseEntity<LobbyResponse> unjoin(@RequestHeader(CALLER_HEADER) String caller,
                                                @PathVariable("id") long id) {
        return ResponseEntity.ok(respond(lobbyService.unjoinLobby(caller, id)));
    }

    @PostMapping("/{id}/valve")
    public ResponseEntity<BreweryStatusResponse> toggleValve(@RequestHeader(CALLER_HEADER) String caller,
                                                             @PathVariable("id") long id,
                                                             @Valid @RequestBody ToggleValveRequest request) {
        return ResponseEntity.ok(BreweryStatusResponse.from(
            lobbyService.toggleValve(caller, id, request.getOpen())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<LobbyResponse> getLobby(@PathVariable("id") long id) {
        return ResponseEntity.ok(respond(lobbyService.getLobby(id)));
    }

    @GetMapping("/{id}/brewery/{address}")
    public ResponseEntity<BreweryStatusResponse> getBreweryStatus(@PathVariable("id") long id,
                                                                  @PathVariable("address") String address) {
        return ResponseEntity.ok(BreweryStatusResponse.from(lobbyService.getBreweryStatus(id, address)));
    }

    private LobbyResponse respond(Lobby lobby) {
        return LobbyResponse.from(lobby, lobbyService.phaseOf(lobby));
    }
}
