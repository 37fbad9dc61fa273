package com.flagship.custodial_exchange.exception;

import lombok.Getter;

/**
 * Raised when an escrow operation's precondition fails.
 *
 * The whole operation aborts; the surrounding transaction rolls back so no
 * partial effect survives.
 */
@Getter
public class EscrowException extends RuntimeException {

    private final Violation violation;

    public EscrowException(Violation violation, String message) {
        super(message);
        this.violation = violation;
    }

    public static EscrowException unauthorized(String format, Object... args) {
        return new EscrowException(Violation.UNAUTHORIZED, String.format(format, args));
    }

    public static EscrowException invalidState(String format, Object... args) {
        return new EscrowException(Violation.INVALID_STATE, String.format(format, args));
    }

    public static EscrowException timing(String format, Object... args) {
        return new EscrowException(Violation.TIMING_VIOLATION, String.format(format, args));
    }

    public static EscrowException amountMismatch(String format, Object... args) {
        return new EscrowException(Violation.AMOUNT_MISMATCH, String.format(format, args));
    }

    public static EscrowException alreadyInState(String format, Object... args) {
        return new EscrowException(Violation.ALREADY_IN_STATE, String.format(format, args));
    }

    public static EscrowException notFound(String format, Object... args) {
        return new EscrowException(Violation.NOT_FOUND, String.format(format, args));
    }

    public static EscrowException insufficientFunds(String format, Object... args) {
        return new EscrowException(Violation.INSUFFICIENT_FUNDS, String.format(format, args));
    }
}
