package com.flagship.custodial_exchange.ledger;

/**
 * Fungible value ledger as seen by the escrow engines.
 *
 * Implementations must join the caller's transaction so a failed transfer rolls
 * back the engine's state change with it.
 */
public interface ValueLedger {

    /**
     * Moves {@code amount} from {@code from} to {@code to}.
     *
     * @throws com.flagship.custodial_exchange.exception.EscrowException with
     *         {@code INSUFFICIENT_FUNDS} if {@code from} cannot cover the amount
     */
    void transfer(String from, String to, long amount);

    /**
     * Moves {@code amount} from {@code from} to {@code to} on behalf of
     * {@code spender}, consuming the allowance {@code from} granted to it.
     *
     * @throws com.flagship.custodial_exchange.exception.EscrowException with
     *         {@code INSUFFICIENT_FUNDS} if balance or allowance is short
     */
    void transferFrom(String spender, String from, String to, long amount);

    long balanceOf(String address);
}
