package io.unitledger.core.node;

import io.unitledger.core.audit.AuditLog;
import io.unitledger.core.audit.InMemoryAuditLog;
import io.unitledger.core.audit.JsonLinesAuditLog;
import io.unitledger.core.ledger.LedgerCore;
import io.unitledger.core.protocol.LedgerError;
import io.unitledger.core.protocol.LedgerException;
import io.unitledger.core.registry.AssetListing;
import io.unitledger.core.registry.InMemoryEligibilityRegistry;
import io.unitledger.core.sink.SimulatedAssetBank;
import io.unitledger.core.sink.SinkBalanceMeasurer;
import io.unitledger.core.state.InMemoryStateStore;
import io.unitledger.core.state.RocksDBStateStore;
import io.unitledger.core.state.StateReplayer;
import io.unitledger.core.state.StateStore;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires state, registry, simulated assets, audit log and the ledger core.
 * Start once, then drive the core directly or through the RPC server.
 */
public final class LedgerNode implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(LedgerNode.class.getName());

    public static final String REGISTRY_FILE = "registry.json";
    public static final String AUDIT_FILE = "audit.jsonl";
    public static final String STATE_DIR = "state";

    private final StateStore state;
    private final AuditLog audit;
    private final InMemoryEligibilityRegistry registry;
    private final SimulatedAssetBank bank;
    private final LedgerCore core;
    private final LedgerConfig config;
    private final boolean replayOnStart;
    private final Path registryFile;

    public LedgerNode(StateStore state,
                      AuditLog audit,
                      InMemoryEligibilityRegistry registry,
                      SimulatedAssetBank bank,
                      LedgerConfig config,
                      boolean replayOnStart) {
        this(state, audit, registry, bank, config, replayOnStart, null);
    }

    /** @param registryFile where listing changes are saved; null keeps them in memory only */
    public LedgerNode(StateStore state,
                      AuditLog audit,
                      InMemoryEligibilityRegistry registry,
                      SimulatedAssetBank bank,
                      LedgerConfig config,
                      boolean replayOnStart,
                      Path registryFile) {
        this.registryFile = registryFile;
        this.state = state;
        this.audit = audit;
        this.registry = registry;
        this.bank = bank;
        this.config = config;
        this.replayOnStart = replayOnStart;
        this.core = new LedgerCore(state, registry, new SinkBalanceMeasurer(bank, bank), audit);
        for (Map.Entry<String, Integer> fee : config.transferFeeBps.entrySet()) {
            bank.setTransferFeeBps(fee.getKey(), fee.getValue());
        }
    }

    /** Convenience factory for a throwaway in-memory node. */
    public static LedgerNode inMemory(LedgerConfig config) {
        return new LedgerNode(
                new InMemoryStateStore(),
                new InMemoryAuditLog(),
                defaultRegistry(config),
                new SimulatedAssetBank(config.sinkAddress),
                config,
                false);
    }

    /** State in memory, audit log on disk; state is rebuilt from the log on start. */
    public static LedgerNode journaled(LedgerConfig config, Path dataDir) {
        return new LedgerNode(
                new InMemoryStateStore(),
                JsonLinesAuditLog.open(dataDir.resolve(AUDIT_FILE)),
                loadOrCreateRegistry(config, dataDir),
                new SimulatedAssetBank(config.sinkAddress),
                config,
                true,
                dataDir.resolve(REGISTRY_FILE));
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static LedgerNode rocks(LedgerConfig config, Path dataDir) {
        return new LedgerNode(
                RocksDBStateStore.open(dataDir.resolve(STATE_DIR).toString()),
                JsonLinesAuditLog.open(dataDir.resolve(AUDIT_FILE)),
                loadOrCreateRegistry(config, dataDir),
                new SimulatedAssetBank(config.sinkAddress),
                config,
                false,
                dataDir.resolve(REGISTRY_FILE));
    }

    /** Replay the journal if needed and apply configured owner/engine. Safe to call multiple times. */
    public void start() {
        if (replayOnStart && core.owner().isEmpty()) {
            StateReplayer.replay(audit.entriesSince(0L), state);
        }
        core.bootstrapOwner(config.ownerAddress);
        if (config.engineAddress != null && core.consumingEngine().isEmpty()) {
            core.owner().ifPresent(owner -> {
                if (owner.equals(config.ownerAddress)) {
                    core.setConsumingEngine(owner, config.engineAddress);
                }
            });
        }
        LOG.info(() -> "Ledger node started (owner=" + core.owner().orElse("-")
                + ", engine=" + core.consumingEngine().orElse("-")
                + ", sink=" + bank.address()
                + ", audit entries=" + audit.nextSequence() + ")");
    }

    /**
     * Owner-only change to an existing listing. A null argument leaves that field as it is;
     * a {@code capUnits} of 0 lifts the cap, matching the registry file.
     */
    public synchronized AssetListing configureAsset(String caller, String asset, Boolean enabled, Long capUnits) {
        if (core.owner().filter(owner -> owner.equals(caller)).isEmpty()) {
            throw new LedgerException(LedgerError.UNAUTHORIZED_CALLER, "Only the ledger owner may change asset listings");
        }
        Optional<AssetListing> current = registry.lookup(asset);
        if (current.isEmpty()) {
            throw new LedgerException(LedgerError.ASSET_NOT_ELIGIBLE, "Asset not listed: " + asset);
        }
        if (capUnits != null && capUnits < 0) {
            throw new LedgerException(LedgerError.INVALID_AMOUNT, "capUnits must be >= 0");
        }
        if (enabled != null) {
            registry.setEnabled(asset, enabled);
        }
        if (capUnits != null) {
            registry.setCap(asset, capUnits == 0L ? OptionalLong.empty() : OptionalLong.of(capUnits));
        }
        if (registryFile != null) {
            registry.save(registryFile);
        }
        AssetListing updated = registry.lookup(asset).orElseThrow();
        LOG.info(() -> "Asset " + asset + " updated by " + caller + ": enabled=" + updated.enabled()
                + ", cap=" + (updated.capped() ? String.valueOf(updated.capUnits().getAsLong()) : "none"));
        return updated;
    }

    /** Close underlying resources if any (e.g., RocksDB). */
    @Override
    public void close() {
        if (state instanceof AutoCloseable) {
            try {
                ((AutoCloseable) state).close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Failed to close ledger state", e);
            }
        }
    }

    private static InMemoryEligibilityRegistry defaultRegistry(LedgerConfig config) {
        InMemoryEligibilityRegistry registry = new InMemoryEligibilityRegistry();
        for (Map.Entry<String, AssetListing> entry : config.defaultAssets.entrySet()) {
            registry.put(entry.getKey(), entry.getValue());
        }
        return registry;
    }

    private static InMemoryEligibilityRegistry loadOrCreateRegistry(LedgerConfig config, Path dataDir) {
        Path file = dataDir.resolve(REGISTRY_FILE);
        if (Files.exists(file)) {
            return InMemoryEligibilityRegistry.load(file);
        }
        InMemoryEligibilityRegistry registry = defaultRegistry(config);
        registry.save(file);
        LOG.info(() -> "Wrote default asset registry to " + file + ". Edit it to list more assets.");
        return registry;
    }

    // Properly typed accessors
    public LedgerCore core() { return core; }
    public StateStore state() { return state; }
    public AuditLog audit() { return audit; }
    public InMemoryEligibilityRegistry registry() { return registry; }
    public SimulatedAssetBank bank() { return bank; }
    public LedgerConfig config() { return config; }
}
