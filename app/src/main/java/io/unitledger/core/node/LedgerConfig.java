package io.unitledger.core.node;

import io.unitledger.core.registry.AssetListing;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/** Simple config holder for a local ledger node. */
public final class LedgerConfig {
    public final String ownerAddress;
    public final String engineAddress;
    public final String sinkAddress;
    public final Map<String, AssetListing> defaultAssets;
    public final Map<String, Integer> transferFeeBps;

    public LedgerConfig(String ownerAddress,
                        String engineAddress,
                        String sinkAddress,
                        Map<String, AssetListing> defaultAssets,
                        Map<String, Integer> transferFeeBps) {
        this.ownerAddress = ownerAddress;
        this.engineAddress = engineAddress;
        this.sinkAddress = sinkAddress;
        this.defaultAssets = defaultAssets;
        this.transferFeeBps = transferFeeBps;
    }

    public static LedgerConfig defaultLocal() {
        Map<String, AssetListing> assets = new LinkedHashMap<>();
        assets.put("asset:usdx", AssetListing.enabled(6, 1_000_000L));
        assets.put("asset:gold", new AssetListing(true, true, 8, 1L, OptionalLong.of(1_000_000L)));
        assets.put("asset:feex", AssetListing.enabled(0, 1L));
        assets.put("asset:frozen", new AssetListing(true, false, 0, 1L, OptionalLong.empty()));
        Map<String, Integer> fees = new LinkedHashMap<>();
        fees.put("asset:feex", 100); // 1% burned on every transfer
        return new LedgerConfig(
                "owner-local",
                "engine-local",
                "sink:dead",
                assets,
                fees
        );
    }

    public LedgerConfig withOwner(String ownerAddress) {
        return new LedgerConfig(ownerAddress, engineAddress, sinkAddress, defaultAssets, transferFeeBps);
    }

    public LedgerConfig withEngine(String engineAddress) {
        return new LedgerConfig(ownerAddress, engineAddress, sinkAddress, defaultAssets, transferFeeBps);
    }
}
