package io.unitledger.core.registry;

import io.unitledger.core.protocol.ProtocolLimits;

import java.util.OptionalLong;

/**
 * What the registry knows about one asset.
 *
 * @param listed                 asset is known to the registry
 * @param enabled                asset may currently be sponsored
 * @param decimals               asset precision, informational
 * @param unitsPerReferenceAmount pricing hint, informational
 * @param capUnits               cumulative sponsored-unit cap; empty means uncapped
 */
public record AssetListing(boolean listed,
                           boolean enabled,
                           int decimals,
                           long unitsPerReferenceAmount,
                           OptionalLong capUnits) {

    public AssetListing {
        if (decimals < 0 || decimals > ProtocolLimits.MAX_DECIMALS) {
            throw new IllegalArgumentException("decimals out of range: " + decimals);
        }
        if (unitsPerReferenceAmount < 0) {
            throw new IllegalArgumentException("unitsPerReferenceAmount must be >= 0");
        }
        capUnits = capUnits == null ? OptionalLong.empty() : capUnits;
        if (capUnits.isPresent() && capUnits.getAsLong() < 0) {
            throw new IllegalArgumentException("capUnits must be >= 0");
        }
    }

    public static AssetListing enabled(int decimals, long unitsPerReferenceAmount) {
        return new AssetListing(true, true, decimals, unitsPerReferenceAmount, OptionalLong.empty());
    }

    public boolean sponsorable() {
        return listed && enabled;
    }

    public boolean capped() {
        return capUnits.isPresent();
    }

    public AssetListing withEnabled(boolean value) {
        return new AssetListing(listed, value, decimals, unitsPerReferenceAmount, capUnits);
    }

    public AssetListing withCap(long cap) {
        return new AssetListing(listed, enabled, decimals, unitsPerReferenceAmount, OptionalLong.of(cap));
    }

    public AssetListing uncapped() {
        return new AssetListing(listed, enabled, decimals, unitsPerReferenceAmount, OptionalLong.empty());
    }
}
