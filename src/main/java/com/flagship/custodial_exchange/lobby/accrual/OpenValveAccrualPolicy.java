package com.flagship.custodial_exchange.lobby.accrual;

import com.flagship.custodial_exchange.lobby.BreweryStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Credits {@code meadPerSecond} for every second the valve stayed open since
 * the last checkpoint. A closed valve only moves the checkpoint.
 */
@Component
@ConditionalOnProperty(name = "exchange.lobby.accrual-policy", havingValue = "open-valve")
public class OpenValveAccrualPolicy implements MeadAccrualPolicy {

    @Override
    public BreweryStatus checkpoint(BreweryStatus status, long now) {
        if (!status.isValveOpened() || now <= status.getLastUpdatedAt()) {
            return status.checkpointed(status.getMead(), Math.max(now, status.getLastUpdatedAt()));
        }
        long elapsed = now - status.getLastUpdatedAt();
        long accrued = Math.multiplyExact(elapsed, status.getMeadPerSecond());
        return status.checkpointed(Math.addExact(status.getMead(), accrued), now);
    }
}
