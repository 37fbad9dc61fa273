package com.flagship.custodial_exchange.exception;

/**
 * Precondition categories an escrow operation can fail on.
 *
 * Every failed operation reports exactly one violation. A failure leaves stored
 * state and escrowed custody unchanged.
 */
public enum Violation {
    /**
     * Caller lacks the required role (seller, creator, joiner, owner).
     */
    UNAUTHORIZED,

    /**
     * Operation attempted from a status or phase that does not permit it.
     */
    INVALID_STATE,

    /**
     * Operation attempted outside its allowed time window.
     */
    TIMING_VIOLATION,

    /**
     * Submitted payment does not equal the current price.
     */
    AMOUNT_MISMATCH,

    /**
     * Target is already in the requested state (redundant toggle, occupied seat).
     */
    ALREADY_IN_STATE,

    /**
     * Referenced order, lobby or asset does not exist.
     */
    NOT_FOUND,

    /**
     * Ledger balance or allowance does not cover the transfer.
     */
    INSUFFICIENT_FUNDS
}
