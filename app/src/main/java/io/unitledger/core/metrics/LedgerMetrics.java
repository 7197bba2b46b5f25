package io.unitledger.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Process-wide ledger meters. Operation outcomes are counted per operation and
 * error code; unit flows are recorded as distribution summaries.
 */
public final class LedgerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final DistributionSummary unitsCredited = DistributionSummary.builder("ledger.units.credited")
            .baseUnit("units")
            .description("Units credited to beneficiaries (actually received by the sink)")
            .register(registry);
    private static final DistributionSummary unitsDeducted = DistributionSummary.builder("ledger.units.deducted")
            .baseUnit("units")
            .description("Requested units withheld by the asset during transfer")
            .register(registry);
    private static final DistributionSummary unitsConsumed = DistributionSummary.builder("ledger.units.consumed")
            .baseUnit("units")
            .description("Units debited by the consuming engine")
            .register(registry);
    private static final DistributionSummary unitsForfeited = DistributionSummary.builder("ledger.units.forfeited")
            .baseUnit("units")
            .description("Units forfeited by beneficiaries")
            .register(registry);
    private static final Counter replayedEntries = Counter.builder("ledger.replay.entries")
            .description("Audit entries applied while rebuilding state")
            .register(registry);

    private LedgerMetrics() {}

    public static void recordAccepted(String operation) {
        registry.counter("ledger.operations", "operation", operation, "outcome", "accepted").increment();
    }

    public static void recordRejected(String operation, String errorCode) {
        registry.counter("ledger.operations", "operation", operation, "outcome", "rejected", "error", errorCode).increment();
    }

    public static void recordCredit(long requested, long received) {
        unitsCredited.record(received);
        if (requested > received) {
            unitsDeducted.record(requested - received);
        }
    }

    public static void recordConsumed(long units) {
        unitsConsumed.record(units);
    }

    public static void recordForfeited(long units) {
        unitsForfeited.record(units);
    }

    public static void recordReplayed(long entries) {
        replayedEntries.increment(entries);
    }

    public static Timer.Sample startRequest() {
        return Timer.start(registry);
    }

    public static void stopRequest(Timer.Sample sample, String method, String path, int status) {
        Timer timer = Timer
                .builder("http.server.requests")
                .description("HTTP server request duration")
                .tag("method", method)
                .tag("path", path)
                .tag("status", Integer.toString(status))
                .register(registry);
        sample.stop(timer);
    }

    public static double count(String name, String... tags) {
        Counter counter = registry.find(name).tags(tags).counter();
        return counter == null ? 0.0 : counter.count();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                for (Tag tag : m.getId().getTags()) {
                    sb.append(',').append(tag.getKey()).append('=').append(tag.getValue());
                }
                sb.append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
