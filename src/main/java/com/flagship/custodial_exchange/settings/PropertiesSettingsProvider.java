package com.flagship.custodial_exchange.settings;

import com.flagship.custodial_exchange.config.ExchangeProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * {@link SettingsProvider} backed by the validated {@code exchange.fees.*} properties.
 */
@Component
@RequiredArgsConstructor
public class PropertiesSettingsProvider implements SettingsProvider {

    private final ExchangeProperties properties;

    @Override
    public int feeRate() {
        return properties.getFees().getFeeRate();
    }

    @Override
    public int treasuryFeeRate() {
        return properties.getFees().getTreasuryFeeRate();
    }

    @Override
    public String treasuryAddress() {
        return properties.getFees().getTreasuryAddress();
    }

    @Override
    public String rewardPoolAddress() {
        return properties.getFees().getRewardPoolAddress();
    }
}
