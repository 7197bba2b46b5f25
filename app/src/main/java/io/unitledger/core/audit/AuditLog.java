package io.unitledger.core.audit;

import java.util.List;
import java.util.function.Consumer;

/**
 * Append-only record of ledger events. Sequences start at 0 and have no gaps.
 */
public interface AuditLog {

    /** Append events in order, all-or-nothing from the reader's point of view. */
    List<AuditEntry> append(List<? extends LedgerEvent> events);

    /** Entries with {@code sequence >= fromSequence}, in order. */
    List<AuditEntry> entriesSince(long fromSequence);

    /** Sequence the next appended entry will get. */
    long nextSequence();

    /** Register a listener invoked after every successful append. */
    void subscribe(Consumer<AuditEntry> listener);

    void unsubscribe(Consumer<AuditEntry> listener);
}
