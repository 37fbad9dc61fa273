package com.flagship.custodial_exchange.settings;

/**
 * Fee configuration consulted on every sale.
 *
 * Rates are basis points (10000 = 100%).
 */
public interface SettingsProvider {

    int feeRate();

    int treasuryFeeRate();

    String treasuryAddress();

    String rewardPoolAddress();
}
