package io.unitledger.core.protocol;

/**
 * Named failure conditions of the ledger. Every one of them fails the whole
 * operation with no partial effect.
 */
public enum LedgerError {
    INVALID_ADDRESS("invalid_address", 400),
    SELF_SPONSORSHIP_FORBIDDEN("self_sponsorship_forbidden", 400),
    ASSET_NOT_ELIGIBLE("asset_not_eligible", 422),
    SPONSOR_LOCKED("sponsor_locked", 409),
    UNAUTHORIZED_CALLER("unauthorized_caller", 403),
    INVALID_AMOUNT("invalid_amount", 400),
    INSUFFICIENT_BALANCE("insufficient_balance", 409),
    CAP_EXCEEDED("cap_exceeded", 409),
    NOTHING_TO_FORFEIT("nothing_to_forfeit", 409),
    NOT_EMPTY("not_empty", 409),
    ZERO_RECEIVED("zero_received", 422),
    REENTRANT_CALL("reentrant_call", 409),
    TRANSFER_FAILED("transfer_failed", 422),
    ARITHMETIC_OVERFLOW("arithmetic_overflow", 422);

    private final String code;
    private final int httpStatus;

    LedgerError(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    /** Stable wire name, used in RPC error bodies and metric tags. */
    public String code() { return code; }

    public int httpStatus() { return httpStatus; }
}
