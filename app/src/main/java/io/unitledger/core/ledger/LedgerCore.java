package io.unitledger.core.ledger;

import io.unitledger.core.audit.AuditLog;
import io.unitledger.core.audit.LedgerEvent;
import io.unitledger.core.metrics.LedgerMetrics;
import io.unitledger.core.protocol.Address;
import io.unitledger.core.protocol.LedgerError;
import io.unitledger.core.protocol.LedgerException;
import io.unitledger.core.protocol.Units;
import io.unitledger.core.registry.AssetListing;
import io.unitledger.core.registry.EligibilityRegistry;
import io.unitledger.core.sink.MeasuredTransfer;
import io.unitledger.core.sink.TransferMeasurer;
import io.unitledger.core.state.StateBatch;
import io.unitledger.core.state.StateStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The balance state machine.
 *
 * <p>Sponsors provision beneficiaries by pulling an asset into the sink; the amount the
 * sink actually received is credited as units. The configured consuming engine draws
 * units down. Beneficiaries release their sponsor once empty, or forfeit balances to get
 * there.
 *
 * <p>Every public mutator runs under this object's monitor and is all-or-nothing: checks
 * run first, writes are collected in one {@link StateBatch}, the batch is applied in a
 * single step and only then are audit events appended. The only outbound call is the
 * transfer into the sink; everything it could influence is re-read after it returns, and
 * the transfer is reverted when the call fails afterwards.
 */
public final class LedgerCore {
    private static final Logger LOG = Logger.getLogger(LedgerCore.class.getName());

    private final StateStore state;
    private final EligibilityRegistry registry;
    private final TransferMeasurer measurer;
    private final AuditLog audit;
    private final AdminControl admin;
    private final SponsorGuard guard = new SponsorGuard();

    public LedgerCore(StateStore state, EligibilityRegistry registry, TransferMeasurer measurer, AuditLog audit) {
        this.state = Objects.requireNonNull(state, "state");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.measurer = Objects.requireNonNull(measurer, "measurer");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.admin = new AdminControl(state);
    }

    // -------------------- sponsor (credit) --------------------

    public synchronized SponsorReceipt sponsor(String caller, String beneficiary, String asset, long requestedUnits) {
        return run("sponsor", () -> doSponsor(caller, beneficiary, asset, requestedUnits));
    }

    private SponsorReceipt doSponsor(String caller, String beneficiary, String asset, long requestedUnits) {
        Address.require(caller, "caller");
        Address.require(beneficiary, "beneficiary");
        Address.require(asset, "asset");
        if (beneficiary.equals(caller)) {
            throw new LedgerException(LedgerError.SELF_SPONSORSHIP_FORBIDDEN, "Cannot sponsor yourself: " + caller);
        }
        Units.requirePositive(requestedUnits, "requested units");
        AssetListing listing = registry.lookup(asset)
                .filter(AssetListing::sponsorable)
                .orElseThrow(() -> new LedgerException(LedgerError.ASSET_NOT_ELIGIBLE, "Asset not listed or disabled: " + asset));
        requireSponsorAssignable(caller, beneficiary);

        try (SponsorGuard.Scope ignored = guard.enter(beneficiary, asset)) {
            MeasuredTransfer transfer = pullIntoSink(caller, asset, requestedUnits);
            try {
                return settle(caller, beneficiary, listing, transfer);
            } catch (RuntimeException e) {
                transfer.abort();
                throw e;
            }
        }
    }

    private MeasuredTransfer pullIntoSink(String caller, String asset, long requestedUnits) {
        try {
            return measurer.pull(caller, asset, requestedUnits);
        } catch (LedgerException e) {
            // raised by a nested ledger call made from inside the transfer
            throw e;
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new LedgerException(LedgerError.TRANSFER_FAILED, "Transfer of " + asset + " from " + caller + " failed: " + e.getMessage(), e);
        }
    }

    private SponsorReceipt settle(String caller, String beneficiary, AssetListing listing, MeasuredTransfer transfer) {
        String asset = transfer.asset();
        long received = transfer.received();
        if (received == 0L) {
            throw new LedgerException(LedgerError.ZERO_RECEIVED, "Sink received nothing for " + transfer.requested() + " requested units of " + asset);
        }

        // the transfer may have called back into the ledger; read everything afresh
        Optional<String> currentSponsor = requireSponsorAssignable(caller, beneficiary);
        long cumulative = Units.add(state.getCumulativeSponsored(asset), received);
        if (listing.capped() && cumulative > listing.capUnits().getAsLong()) {
            throw new LedgerException(LedgerError.CAP_EXCEEDED, "Cap of " + asset + " would be exceeded: "
                    + cumulative + " > " + listing.capUnits().getAsLong());
        }
        long oldBalance = state.getBalance(beneficiary, asset);
        long newBalance = Units.add(oldBalance, received);
        long activeCount = state.getActiveAssetCount(beneficiary);
        if (oldBalance == 0L) {
            activeCount = Units.add(activeCount, 1L);
        }
        long lifetime = Units.add(state.getLifetimeAllocated(beneficiary), received);
        boolean assigning = currentSponsor.isEmpty() || !currentSponsor.get().equals(caller);

        StateBatch batch = new StateBatch()
                .putCumulativeSponsored(asset, cumulative)
                .putBalance(beneficiary, asset, newBalance)
                .putActiveAssetCount(beneficiary, activeCount)
                .putLifetimeAllocated(beneficiary, lifetime);
        if (assigning) {
            batch.assignSponsor(beneficiary, caller);
        }
        commit(batch, List.of(
                new LedgerEvent.Sponsored(caller, beneficiary, asset, transfer.requested(), newBalance),
                new LedgerEvent.SponsoredReceived(caller, beneficiary, asset, transfer.requested(), received)));
        LedgerMetrics.recordCredit(transfer.requested(), received);
        LOG.fine(() -> caller + " sponsored " + beneficiary + " with " + received + " " + asset
                + " (requested " + transfer.requested() + ", balance " + newBalance + ")");
        return new SponsorReceipt(caller, beneficiary, asset, transfer.requested(), received, newBalance, cumulative, assigning);
    }

    /** Returns the current sponsor when the caller may sponsor the beneficiary. */
    private Optional<String> requireSponsorAssignable(String caller, String beneficiary) {
        Optional<String> current = state.getSponsor(beneficiary);
        if (current.isPresent() && !current.get().equals(caller) && state.getActiveAssetCount(beneficiary) > 0L) {
            throw new LedgerException(LedgerError.SPONSOR_LOCKED, beneficiary + " is locked to sponsor " + current.get());
        }
        return current;
    }

    // -------------------- consume (debit) --------------------

    public synchronized long consume(String caller, String beneficiary, String asset, long units) {
        return run("consume", () -> doConsume(caller, beneficiary, asset, units));
    }

    private long doConsume(String caller, String beneficiary, String asset, long units) {
        Optional<String> engine = consumingEngine();
        if (caller == null || engine.isEmpty() || !engine.get().equals(caller)) {
            throw new LedgerException(LedgerError.UNAUTHORIZED_CALLER, "Only the consuming engine may consume (caller " + caller + ")");
        }
        Address.require(beneficiary, "beneficiary");
        Address.require(asset, "asset");
        Units.requirePositive(units, "units");
        long balance = state.getBalance(beneficiary, asset);
        if (units > balance) {
            throw new LedgerException(LedgerError.INSUFFICIENT_BALANCE, beneficiary + " holds " + balance + " " + asset + ", cannot consume " + units);
        }
        long remaining = Units.subtract(balance, units);
        StateBatch batch = new StateBatch().putBalance(beneficiary, asset, remaining);
        if (remaining == 0L) {
            batch.putActiveAssetCount(beneficiary, Units.subtract(state.getActiveAssetCount(beneficiary), 1L));
        }
        commit(batch, List.of(new LedgerEvent.Consumed(caller, beneficiary, asset, units, remaining)));
        LedgerMetrics.recordConsumed(units);
        LOG.fine(() -> "Consumed " + units + " " + asset + " of " + beneficiary + ", " + remaining + " left");
        return remaining;
    }

    // -------------------- clear / forfeit --------------------

    /** Release the caller's sponsor once every balance of the caller is zero. */
    public synchronized String clearSponsorIfEmpty(String caller) {
        return run("clear_sponsor", () -> {
            Address.require(caller, "caller");
            String sponsor = state.getSponsor(caller)
                    .orElseThrow(() -> new LedgerException(LedgerError.NOTHING_TO_FORFEIT, caller + " has no sponsor to clear"));
            long active = state.getActiveAssetCount(caller);
            if (active != 0L) {
                throw new LedgerException(LedgerError.NOT_EMPTY, caller + " still holds " + active + " asset balance(s)");
            }
            commit(new StateBatch().clearSponsor(caller), List.of(new LedgerEvent.SponsorCleared(caller, sponsor)));
            LOG.fine(() -> caller + " released sponsor " + sponsor);
            return sponsor;
        });
    }

    /**
     * Zero the caller's balance of every listed asset and release the sponsor if nothing
     * is left. Assets with no balance, and repeats, are skipped. Assets that are not
     * listed keep their balance and keep the sponsor locked.
     */
    public synchronized ForfeitSummary clearSponsorAndForfeit(String caller, List<String> assets) {
        return run("forfeit", () -> doForfeit(caller, assets));
    }

    private ForfeitSummary doForfeit(String caller, List<String> assets) {
        Address.require(caller, "caller");
        List<String> requested = assets == null ? List.of() : assets;
        for (String asset : requested) {
            Address.require(asset, "asset");
        }

        StateBatch batch = new StateBatch();
        List<LedgerEvent> events = new ArrayList<>();
        Map<String, Long> forfeited = new LinkedHashMap<>();
        long activeCount = state.getActiveAssetCount(caller);
        long total = 0L;
        for (String asset : requested) {
            if (forfeited.containsKey(asset)) {
                continue;
            }
            long balance = state.getBalance(caller, asset);
            if (balance == 0L) {
                continue;
            }
            batch.putBalance(caller, asset, 0L);
            forfeited.put(asset, balance);
            total = Units.add(total, balance);
            activeCount = Units.subtract(activeCount, 1L);
            events.add(new LedgerEvent.Forfeited(caller, asset, balance));
        }
        if (total == 0L) {
            throw new LedgerException(LedgerError.NOTHING_TO_FORFEIT, "No positive balance among " + requested.size() + " listed asset(s)");
        }
        batch.putActiveAssetCount(caller, activeCount);

        Optional<String> sponsor = state.getSponsor(caller);
        boolean sponsorCleared = sponsor.isPresent() && activeCount == 0L;
        if (sponsorCleared) {
            batch.clearSponsor(caller);
            events.add(new LedgerEvent.SponsorCleared(caller, sponsor.get()));
        }
        events.add(new LedgerEvent.SponsorClearedWithForfeit(caller, forfeited.size(), total, sponsorCleared));
        commit(batch, events);
        LedgerMetrics.recordForfeited(total);

        long totalForfeited = total;
        long remaining = activeCount;
        LOG.fine(() -> caller + " forfeited " + totalForfeited + " units over " + forfeited.size() + " asset(s)"
                + (sponsorCleared ? ", sponsor released" : ", " + remaining + " asset(s) still held"));
        return new ForfeitSummary(caller, forfeited, total, sponsorCleared, activeCount);
    }

    // -------------------- admin --------------------

    /** Record the initial owner if none is stored yet. */
    public synchronized void bootstrapOwner(String initialOwner) {
        StateBatch batch = new StateBatch();
        admin.stageBootstrap(initialOwner, batch).ifPresent(event -> {
            commit(batch, List.of(event));
            LOG.info(() -> "Ledger owner initialised to " + initialOwner);
        });
    }

    public synchronized void setConsumingEngine(String caller, String engine) {
        run("set_engine", () -> {
            admin.requireOwner(caller);
            Address.require(engine, "engine");
            String previous = consumingEngine().orElse(null);
            commit(new StateBatch().putMeta(StateStore.META_CONSUMING_ENGINE, engine),
                    List.of(new LedgerEvent.EngineConfigured(previous, engine)));
            LOG.info(() -> "Consuming engine set to " + engine + (previous != null ? " (was " + previous + ")" : ""));
            return engine;
        });
    }

    public synchronized void transferOwnership(String caller, String newOwner) {
        run("transfer_ownership", () -> {
            StateBatch batch = new StateBatch();
            LedgerEvent event = admin.stageTransfer(caller, newOwner, batch);
            commit(batch, List.of(event));
            return newOwner;
        });
    }

    public synchronized void acceptOwnership(String caller) {
        run("accept_ownership", () -> {
            StateBatch batch = new StateBatch();
            LedgerEvent event = admin.stageAccept(caller, batch);
            commit(batch, List.of(event));
            LOG.info(() -> "Ledger ownership accepted by " + caller);
            return caller;
        });
    }

    // -------------------- read surface --------------------

    public Optional<String> sponsorOf(String beneficiary) {
        return state.getSponsor(beneficiary);
    }

    public long balanceOf(String beneficiary, String asset) {
        return state.getBalance(beneficiary, asset);
    }

    public Map<String, Long> balancesOf(String beneficiary) {
        return state.getBalances(beneficiary);
    }

    public long activeAssetCount(String beneficiary) {
        return state.getActiveAssetCount(beneficiary);
    }

    public long cumulativeSponsoredUnits(String asset) {
        return state.getCumulativeSponsored(asset);
    }

    public long lifetimeAllocatedUnits(String beneficiary) {
        return state.getLifetimeAllocated(beneficiary);
    }

    public Optional<String> consumingEngine() {
        return state.getMeta(StateStore.META_CONSUMING_ENGINE);
    }

    public Optional<String> owner() {
        return admin.owner();
    }

    public Optional<String> pendingOwner() {
        return admin.pendingOwner();
    }

    public EligibilityRegistry registry() {
        return registry;
    }

    public AuditLog audit() {
        return audit;
    }

    // -------------------- helpers --------------------

    // state first so audit listeners observe it; put back if the append fails
    private void commit(StateBatch batch, List<LedgerEvent> events) {
        StateBatch undo = batch.undoAgainst(state);
        state.apply(batch);
        try {
            audit.append(events);
        } catch (RuntimeException e) {
            state.apply(undo);
            LOG.log(Level.SEVERE, "Audit append failed; state write rolled back", e);
            throw e;
        }
    }

    private <T> T run(String operation, Supplier<T> body) {
        try {
            T result = body.get();
            LedgerMetrics.recordAccepted(operation);
            return result;
        } catch (LedgerException e) {
            LedgerMetrics.recordRejected(operation, e.error().code());
            LOG.fine(() -> operation + " rejected: " + e.getMessage());
            throw e;
        }
    }
}
