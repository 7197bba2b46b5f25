package io.unitledger.core.state;

import io.unitledger.core.audit.AuditEntry;
import io.unitledger.core.audit.LedgerEvent;
import io.unitledger.core.metrics.LedgerMetrics;
import io.unitledger.core.protocol.Units;

import java.util.logging.Logger;

/**
 * Rebuilds ledger state from audit entries. Used when a node keeps its state in
 * memory and its audit log on disk.
 */
public final class StateReplayer {
    private static final Logger LOG = Logger.getLogger(StateReplayer.class.getName());

    private StateReplayer(){}

    public static void replay(Iterable<AuditEntry> entries, StateStore state) {
        long applied = 0;
        for (AuditEntry entry : entries) {
            StateBatch batch = new StateBatch();
            stage(entry.event(), state, batch);
            state.apply(batch);
            applied++;
        }
        LedgerMetrics.recordReplayed(applied);
        long total = applied;
        LOG.info(() -> "Replayed " + total + " audit entries into ledger state");
    }

    private static void stage(LedgerEvent event, StateStore state, StateBatch batch) {
        if (event instanceof LedgerEvent.Sponsored e) {
            long oldBalance = state.getBalance(e.beneficiary(), e.asset());
            if (oldBalance == 0L && e.newBalance() > 0L) {
                batch.putActiveAssetCount(e.beneficiary(), Units.add(state.getActiveAssetCount(e.beneficiary()), 1L));
            }
            batch.putBalance(e.beneficiary(), e.asset(), e.newBalance());
            batch.assignSponsor(e.beneficiary(), e.sponsor());
        } else if (event instanceof LedgerEvent.SponsoredReceived e) {
            batch.putCumulativeSponsored(e.asset(), Units.add(state.getCumulativeSponsored(e.asset()), e.receivedUnits()));
            batch.putLifetimeAllocated(e.beneficiary(), Units.add(state.getLifetimeAllocated(e.beneficiary()), e.receivedUnits()));
        } else if (event instanceof LedgerEvent.Consumed e) {
            batch.putBalance(e.beneficiary(), e.asset(), e.remaining());
            if (e.remaining() == 0L) {
                batch.putActiveAssetCount(e.beneficiary(), Units.subtract(state.getActiveAssetCount(e.beneficiary()), 1L));
            }
        } else if (event instanceof LedgerEvent.Forfeited e) {
            batch.putBalance(e.beneficiary(), e.asset(), 0L);
            batch.putActiveAssetCount(e.beneficiary(), Units.subtract(state.getActiveAssetCount(e.beneficiary()), 1L));
        } else if (event instanceof LedgerEvent.SponsorCleared e) {
            batch.clearSponsor(e.beneficiary());
        } else if (event instanceof LedgerEvent.EngineConfigured e) {
            batch.putMeta(StateStore.META_CONSUMING_ENGINE, e.engine());
        } else if (event instanceof LedgerEvent.OwnershipTransferStarted e) {
            batch.putMeta(StateStore.META_PENDING_OWNER, e.pendingOwner());
        } else if (event instanceof LedgerEvent.OwnershipTransferred e) {
            batch.putMeta(StateStore.META_OWNER, e.newOwner());
            batch.deleteMeta(StateStore.META_PENDING_OWNER);
        }
        // SponsorClearedWithForfeit is a summary; its effects arrive as Forfeited/SponsorCleared
    }
}
