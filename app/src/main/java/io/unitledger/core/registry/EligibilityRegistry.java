package io.unitledger.core.registry;

import java.util.Optional;

/**
 * Read-only view of asset eligibility. The ledger never writes through it.
 */
public interface EligibilityRegistry {

    /** Listing for the asset, or empty when the registry has never heard of it. */
    Optional<AssetListing> lookup(String assetId);
}
