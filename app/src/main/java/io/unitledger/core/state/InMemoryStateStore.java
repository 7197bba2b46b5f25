package io.unitledger.core.state;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory implementation of StateStore.
 * Not persistent; journaled nodes rebuild it from the audit log on restart.
 */
public final class InMemoryStateStore implements StateStore {

    private final Map<String, String> sponsors = new HashMap<>();
    private final Map<String, TreeMap<String, Long>> balances = new HashMap<>();
    private final Map<String, Long> activeCounts = new HashMap<>();
    private final Map<String, Long> assetTotals = new HashMap<>();
    private final Map<String, Long> lifetimeTotals = new HashMap<>();
    private final Map<String, String> meta = new HashMap<>();

    @Override
    public synchronized Optional<String> getSponsor(String beneficiary) {
        return Optional.ofNullable(sponsors.get(beneficiary));
    }

    @Override
    public synchronized long getBalance(String beneficiary, String asset) {
        Map<String, Long> byAsset = balances.get(beneficiary);
        return byAsset == null ? 0L : byAsset.getOrDefault(asset, 0L);
    }

    @Override
    public synchronized Map<String, Long> getBalances(String beneficiary) {
        TreeMap<String, Long> byAsset = balances.get(beneficiary);
        return byAsset == null ? Collections.emptyMap() : Collections.unmodifiableMap(new TreeMap<>(byAsset));
    }

    @Override
    public synchronized long getActiveAssetCount(String beneficiary) {
        return activeCounts.getOrDefault(beneficiary, 0L);
    }

    @Override
    public synchronized long getCumulativeSponsored(String asset) {
        return assetTotals.getOrDefault(asset, 0L);
    }

    @Override
    public synchronized long getLifetimeAllocated(String beneficiary) {
        return lifetimeTotals.getOrDefault(beneficiary, 0L);
    }

    @Override
    public synchronized Optional<String> getMeta(String key) {
        return Optional.ofNullable(meta.get(key));
    }

    @Override
    public synchronized void apply(StateBatch batch) {
        // StateBatch already rejected negative values, so nothing below can fail halfway.
        batch.sponsors().forEach((beneficiary, sponsor) -> {
            if (sponsor.isPresent()) {
                sponsors.put(beneficiary, sponsor.get());
            } else {
                sponsors.remove(beneficiary);
            }
        });
        batch.balances().forEach((key, value) -> {
            if (value == 0L) {
                TreeMap<String, Long> byAsset = balances.get(key.beneficiary());
                if (byAsset != null) {
                    byAsset.remove(key.asset());
                    if (byAsset.isEmpty()) {
                        balances.remove(key.beneficiary());
                    }
                }
            } else {
                balances.computeIfAbsent(key.beneficiary(), k -> new TreeMap<>()).put(key.asset(), value);
            }
        });
        putOrRemoveZero(activeCounts, batch.activeCounts());
        assetTotals.putAll(batch.assetTotals());
        lifetimeTotals.putAll(batch.lifetimeTotals());
        batch.meta().forEach((key, value) -> {
            if (value.isPresent()) {
                meta.put(key, value.get());
            } else {
                meta.remove(key);
            }
        });
    }

    private static void putOrRemoveZero(Map<String, Long> target, Map<String, Long> writes) {
        writes.forEach((key, value) -> {
            if (value == 0L) {
                target.remove(key);
            } else {
                target.put(key, value);
            }
        });
    }
}
