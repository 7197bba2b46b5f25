package io.unitledger.core.state;

import java.util.Map;
import java.util.Optional;

/**
 * Ledger accounting state: sponsors, per-asset balances, active-asset counts,
 * lifetime totals and a few configuration values.
 *
 * Reads are point lookups. Writes go exclusively through {@link #apply(StateBatch)},
 * which must make the whole batch visible at once or not at all.
 */
public interface StateStore {
    Optional<String> getSponsor(String beneficiary);

    /** Balance of one asset; 0 when never credited. */
    long getBalance(String beneficiary, String asset);

    /** All strictly positive balances of a beneficiary, ordered by asset id. */
    Map<String, Long> getBalances(String beneficiary);

    long getActiveAssetCount(String beneficiary);

    long getCumulativeSponsored(String asset);

    long getLifetimeAllocated(String beneficiary);

    Optional<String> getMeta(String key);

    /** Atomically apply every write in the batch. */
    void apply(StateBatch batch);

    // well-known meta keys
    String META_CONSUMING_ENGINE = "consuming_engine";
    String META_OWNER = "owner";
    String META_PENDING_OWNER = "pending_owner";
}
