package com.flagship.custodial_exchange.health;

import com.flagship.custodial_exchange.market.OrderPersistenceService;
import com.flagship.custodial_exchange.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain liveness probe for load balancers that cannot reach the actuator.
 * Reports the open order book size and the outbox backlog; any database
 * failure turns the probe DOWN.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final OrderPersistenceService orderPersistenceService;
    private final OutboxService outboxService;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", clock.instant().toString());
        try {
            body.put("activeOrders", orderPersistenceService.countActive());
            body.put("pendingEvents", outboxService.countUnpublished());
            body.put("database", "UP");
            body.put("status", "UP");
            return ResponseEntity.ok(body);
        } catch (DataAccessException e) {
            log.warn("Health probe failed: {}", e.getMessage());
            body.put("database", "DOWN");
            body.put("status", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
    }
}
