package com.flagship.custodial_exchange.lobby.accrual;

import com.flagship.custodial_exchange.lobby.BreweryStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Default policy: moves the checkpoint, leaves balances untouched.
 */
@Component
@ConditionalOnProperty(name = "exchange.lobby.accrual-policy", havingValue = "checkpoint-only", matchIfMissing = true)
public class CheckpointOnlyAccrualPolicy implements MeadAccrualPolicy {

    @Override
    public BreweryStatus checkpoint(BreweryStatus status, long now) {
        return status.checkpointed(status.getMead(), now);
    }
}
