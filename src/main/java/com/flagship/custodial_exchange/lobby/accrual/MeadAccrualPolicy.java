package com.flagship.custodial_exchange.lobby.accrual;

import com.flagship.custodial_exchange.lobby.BreweryStatus;

/**
 * Settles a participant's accrual up to {@code now} and advances the
 * checkpoint. Chosen with {@code exchange.lobby.accrual-policy}.
 *
 * No payout, point award or end-of-game settlement is attached to the result.
 */
public interface MeadAccrualPolicy {

    /**
     * @return the status with {@code lastUpdatedAt == now}
     */
    BreweryStatus checkpoint(BreweryStatus status, long now);
}
