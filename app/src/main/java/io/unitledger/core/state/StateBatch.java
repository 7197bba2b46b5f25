package io.unitledger.core.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Write set of one ledger operation. Later writes to the same key replace earlier ones.
 * An empty {@link Optional} for sponsors and meta values means "delete".
 */
public final class StateBatch {

    /** Composite key of a balance entry. */
    public record BalanceKey(String beneficiary, String asset) {
        public BalanceKey {
            Objects.requireNonNull(beneficiary, "beneficiary");
            Objects.requireNonNull(asset, "asset");
        }
    }

    private final Map<String, Optional<String>> sponsors = new LinkedHashMap<>();
    private final Map<BalanceKey, Long> balances = new LinkedHashMap<>();
    private final Map<String, Long> activeCounts = new LinkedHashMap<>();
    private final Map<String, Long> assetTotals = new LinkedHashMap<>();
    private final Map<String, Long> lifetimeTotals = new LinkedHashMap<>();
    private final Map<String, Optional<String>> meta = new LinkedHashMap<>();

    public StateBatch assignSponsor(String beneficiary, String sponsor) {
        sponsors.put(beneficiary, Optional.of(Objects.requireNonNull(sponsor, "sponsor")));
        return this;
    }

    public StateBatch clearSponsor(String beneficiary) {
        sponsors.put(beneficiary, Optional.empty());
        return this;
    }

    public StateBatch putBalance(String beneficiary, String asset, long balance) {
        balances.put(new BalanceKey(beneficiary, asset), nonNegative(balance, "balance"));
        return this;
    }

    public StateBatch putActiveAssetCount(String beneficiary, long count) {
        activeCounts.put(beneficiary, nonNegative(count, "active asset count"));
        return this;
    }

    public StateBatch putCumulativeSponsored(String asset, long total) {
        assetTotals.put(asset, nonNegative(total, "cumulative sponsored"));
        return this;
    }

    public StateBatch putLifetimeAllocated(String beneficiary, long total) {
        lifetimeTotals.put(beneficiary, nonNegative(total, "lifetime allocated"));
        return this;
    }

    public StateBatch putMeta(String key, String value) {
        meta.put(key, Optional.of(Objects.requireNonNull(value, "value")));
        return this;
    }

    public StateBatch deleteMeta(String key) {
        meta.put(key, Optional.empty());
        return this;
    }

    public Map<String, Optional<String>> sponsors() { return Collections.unmodifiableMap(sponsors); }
    public Map<BalanceKey, Long> balances() { return Collections.unmodifiableMap(balances); }
    public Map<String, Long> activeCounts() { return Collections.unmodifiableMap(activeCounts); }
    public Map<String, Long> assetTotals() { return Collections.unmodifiableMap(assetTotals); }
    public Map<String, Long> lifetimeTotals() { return Collections.unmodifiableMap(lifetimeTotals); }
    public Map<String, Optional<String>> meta() { return Collections.unmodifiableMap(meta); }

    /**
     * Batch that puts every key written by this batch back to its value in {@code current}.
     * Must be taken before this batch is applied.
     */
    public StateBatch undoAgainst(StateStore current) {
        StateBatch undo = new StateBatch();
        for (String beneficiary : sponsors.keySet()) {
            Optional<String> previous = current.getSponsor(beneficiary);
            if (previous.isPresent()) {
                undo.assignSponsor(beneficiary, previous.get());
            } else {
                undo.clearSponsor(beneficiary);
            }
        }
        for (BalanceKey key : balances.keySet()) {
            undo.putBalance(key.beneficiary(), key.asset(), current.getBalance(key.beneficiary(), key.asset()));
        }
        for (String beneficiary : activeCounts.keySet()) {
            undo.putActiveAssetCount(beneficiary, current.getActiveAssetCount(beneficiary));
        }
        for (String asset : assetTotals.keySet()) {
            undo.putCumulativeSponsored(asset, current.getCumulativeSponsored(asset));
        }
        for (String beneficiary : lifetimeTotals.keySet()) {
            undo.putLifetimeAllocated(beneficiary, current.getLifetimeAllocated(beneficiary));
        }
        for (String key : meta.keySet()) {
            Optional<String> previous = current.getMeta(key);
            if (previous.isPresent()) {
                undo.putMeta(key, previous.get());
            } else {
                undo.deleteMeta(key);
            }
        }
        return undo;
    }

    public boolean isEmpty() {
        return sponsors.isEmpty() && balances.isEmpty() && activeCounts.isEmpty()
                && assetTotals.isEmpty() && lifetimeTotals.isEmpty() && meta.isEmpty();
    }

    private static long nonNegative(long value, String what) {
        if (value < 0) {
            throw new IllegalArgumentException(what + " must be >= 0 (was " + value + ")");
        }
        return value;
    }
}
