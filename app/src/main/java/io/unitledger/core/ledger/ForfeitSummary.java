package io.unitledger.core.ledger;

import java.util.Map;

/** Result of clearSponsorAndForfeit: what was zeroed and whether the sponsor was released. */
public record ForfeitSummary(String beneficiary,
                             Map<String, Long> forfeited,
                             long totalForfeited,
                             boolean sponsorCleared,
                             long remainingActiveAssets) {

    public ForfeitSummary {
        forfeited = Map.copyOf(forfeited);
    }

    public int assetsCleared() {
        return forfeited.size();
    }
}
