package io.unitledger.core.ledger;

import io.unitledger.core.protocol.LedgerError;
import io.unitledger.core.protocol.LedgerException;

import java.util.HashSet;
import java.util.Set;

/**
 * Tracks sponsor calls that are waiting on their outbound transfer. A nested sponsor
 * call for the same beneficiary or the same asset is refused: the first would race the
 * sponsor lock, the second would be counted twice by the sink-balance measurement.
 *
 * Only touched while holding the {@link LedgerCore} monitor.
 */
final class SponsorGuard {
    private final Set<String> beneficiaries = new HashSet<>();
    private final Set<String> assets = new HashSet<>();

    Scope enter(String beneficiary, String asset) {
        if (beneficiaries.contains(beneficiary)) {
            throw new LedgerException(LedgerError.REENTRANT_CALL, "Sponsorship of " + beneficiary + " already in progress");
        }
        if (assets.contains(asset)) {
            throw new LedgerException(LedgerError.REENTRANT_CALL, "Transfer of " + asset + " into the sink already in progress");
        }
        beneficiaries.add(beneficiary);
        assets.add(asset);
        return new Scope(beneficiary, asset);
    }

    final class Scope implements AutoCloseable {
        private final String beneficiary;
        private final String asset;

        private Scope(String beneficiary, String asset) {
            this.beneficiary = beneficiary;
            this.asset = asset;
        }

        @Override
        public void close() {
            beneficiaries.remove(beneficiary);
            assets.remove(asset);
        }
    }
}
