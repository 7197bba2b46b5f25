package io.unitledger.core.audit;

import java.util.Objects;

/** One appended audit record with its position in the log. */
public record AuditEntry(long sequence, long timestampMillis, LedgerEvent event) {
    public AuditEntry {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0");
        }
        Objects.requireNonNull(event, "event");
    }
}
