package io.unitledger.core.protocol;

import java.util.Objects;

public final class LedgerException extends RuntimeException {
    private final LedgerError error;

    public LedgerException(LedgerError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public LedgerException(LedgerError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    public LedgerError error() { return error; }

    @Override
    public String toString() {
        return "LedgerException[" + error + "]: " + getMessage();
    }
}
