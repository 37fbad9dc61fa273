package com.flagship.custodial_exchange.observability;

import com.flagship.custodial_exchange.lobby.LobbyPersistenceService;
import com.flagship.custodial_exchange.market.OrderPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the gauges backed by database queries: outbox backlog, open
 * orders and stake held in lobby custody.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final ExchangeMetrics exchangeMetrics;
    private final OrderPersistenceService orderPersistenceService;
    private final LobbyPersistenceService lobbyPersistenceService;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        outboxMetrics.refreshMetrics();
        try {
            exchangeMetrics.updateEscrowGauges(
                orderPersistenceService.countActive(),
                lobbyPersistenceService.sumEscrowed());
        } catch (DataAccessException e) {
            log.error("Failed to refresh escrow gauges", e);
        }
    }
}
