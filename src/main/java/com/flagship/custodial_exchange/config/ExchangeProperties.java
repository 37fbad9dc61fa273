package com.flagship.custodial_exchange.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed configuration bound from the {@code exchange.*} prefix.
 *
 * Invalid values (fee rates outside basis-point range, blank addresses) fail
 * application startup.
 *
 * <pre>
 * exchange:
 *   fees:
 *     fee-rate: 500
 *     treasury-fee-rate: 3000
 *     treasury-address: treasury
 *     reward-pool-address: reward-pool
 *   custody:
 *     market-address: escrow:order-market
 *     lobby-address: escrow:wager-lobby
 * </pre>
 */
@ConfigurationProperties(prefix = "exchange")
@Validated
@Getter
@Setter
public class ExchangeProperties {

    @Valid
    @NotNull
    private Fees fees = new Fees();

    @Valid
    @NotNull
    private Custody custody = new Custody();

    @Valid
    @NotNull
    private Ledger ledger = new Ledger();

    @Valid
    @NotNull
    private Lobby lobby = new Lobby();

    @Getter
    @Setter
    public static class Fees {
        /** Sale fee in basis points. */
        @Min(0)
        @Max(10_000)
        private int feeRate = 500;

        /** Share of the sale fee routed to the treasury, in basis points. */
        @Min(0)
        @Max(10_000)
        private int treasuryFeeRate = 3000;

        @NotBlank
        private String treasuryAddress = "treasury";

        @NotBlank
        private String rewardPoolAddress = "reward-pool";
    }

    @Getter
    @Setter
    public static class Custody {
        @NotBlank
        private String marketAddress = "escrow:order-market";

        @NotBlank
        private String lobbyAddress = "escrow:wager-lobby";
    }

    @Getter
    @Setter
    public static class Ledger {
        /** Account that funds deposits; the only account allowed to go negative. */
        @NotBlank
        private String issuerAddress = "issuer";
    }

    @Getter
    @Setter
    public static class Lobby {
        @Min(0)
        private long meadPerSecond = 0;

        /** {@code checkpoint-only} or {@code open-valve}. */
        @NotBlank
        private String accrualPolicy = "checkpoint-only";
    }
}
