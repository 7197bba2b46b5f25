package io.unitledger.core.audit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Audit log kept in a list. Base class for the file-backed log, which adds
 * persistence in {@link #persist(List)}.
 */
public class InMemoryAuditLog implements AuditLog {
    private static final Logger LOG = Logger.getLogger(InMemoryAuditLog.class.getName());

    private final List<AuditEntry> entries = new ArrayList<>();
    private final CopyOnWriteArrayList<Consumer<AuditEntry>> listeners = new CopyOnWriteArrayList<>();

    protected InMemoryAuditLog(List<AuditEntry> existing) {
        entries.addAll(existing);
    }

    public InMemoryAuditLog() {
        this(Collections.emptyList());
    }

    @Override
    public List<AuditEntry> append(List<? extends LedgerEvent> events) {
        if (events == null || events.isEmpty()) {
            return Collections.emptyList();
        }
        List<AuditEntry> appended;
        synchronized (this) {
            long now = System.currentTimeMillis();
            long seq = entries.size();
            appended = new ArrayList<>(events.size());
            for (LedgerEvent event : events) {
                appended.add(new AuditEntry(seq++, now, event));
            }
            persist(appended);
            entries.addAll(appended);
        }
        for (AuditEntry entry : appended) {
            for (Consumer<AuditEntry> listener : listeners) {
                try {
                    listener.accept(entry);
                } catch (RuntimeException e) {
                    LOG.log(Level.WARNING, "Audit listener failed for entry " + entry.sequence(), e);
                }
            }
        }
        return Collections.unmodifiableList(appended);
    }

    /** Hook for durable logs; called under the log's lock before entries become visible. */
    protected void persist(List<AuditEntry> appended) {
    }

    @Override
    public synchronized List<AuditEntry> entriesSince(long fromSequence) {
        int from = (int) Math.max(0L, Math.min(fromSequence, entries.size()));
        return Collections.unmodifiableList(new ArrayList<>(entries.subList(from, entries.size())));
    }

    @Override
    public synchronized long nextSequence() {
        return entries.size();
    }

    @Override
    public void subscribe(Consumer<AuditEntry> listener) {
        if (listener != null) {
            listeners.addIfAbsent(listener);
        }
    }

    @Override
    public void unsubscribe(Consumer<AuditEntry> listener) {
        listeners.remove(listener);
    }
}
