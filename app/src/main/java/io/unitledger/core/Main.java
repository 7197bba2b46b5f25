package io.unitledger.core;

import io.unitledger.core.feed.AuditFeedServer;
import io.unitledger.core.ledger.ForfeitSummary;
import io.unitledger.core.ledger.LedgerCore;
import io.unitledger.core.ledger.SponsorReceipt;
import io.unitledger.core.metrics.LedgerMetrics;
import io.unitledger.core.node.LedgerConfig;
import io.unitledger.core.node.LedgerNode;
import io.unitledger.core.protocol.LedgerException;
import io.unitledger.core.rpc.RpcServer;
import io.unitledger.core.sink.SimulatedAssetBank;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;
import java.util.stream.Stream;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    private static final String DEMO_USD = "asset:usdx";
    private static final String DEMO_GOLD = "asset:gold";

    enum Storage { MEMORY, JOURNAL, ROCKS }

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        Path dataPath = options.dataDir().toAbsolutePath().normalize();
        if (options.resetState()) {
            resetLedgerState(dataPath);
        }

        LedgerConfig config = LedgerConfig.defaultLocal();
        if (options.ownerAddress() != null) {
            config = config.withOwner(options.ownerAddress());
        }
        if (options.engineAddress() != null) {
            config = config.withEngine(options.engineAddress());
        }

        LedgerNode node = openNode(options.storage(), config, dataPath);
        RpcServer rpcServer = null;
        AuditFeedServer feedServer = null;
        try {
            node.start();

            if (options.demo()) {
                runDemoFlow(node);
            } else {
                LOG.info("Demo flow disabled (--no-demo)");
            }

            if (options.enableFeed()) {
                feedServer = new AuditFeedServer(node.audit(), options.feedPort());
                feedServer.start();
            }
            if (options.enableRpc()) {
                rpcServer = new RpcServer(node, options.rpcBind(), options.rpcPort(), options.rpcToken());
                rpcServer.start();
            }

            if (options.keepAlive()) {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "unit-ledger-shutdown"));
                LOG.info("Ledger running. Press CTRL+C to exit.");
                shutdownLatch.await();
            }
        } finally {
            if (rpcServer != null) {
                rpcServer.stop();
            }
            if (feedServer != null) {
                feedServer.stop();
            }
            node.close();
        }
    }

    static LedgerNode openNode(Storage storage, LedgerConfig config, Path dataPath) throws IOException {
        if (storage == Storage.MEMORY) {
            LOG.info("Using in-memory storage; nothing is persisted");
            return LedgerNode.inMemory(config);
        }
        Files.createDirectories(dataPath);
        if (storage == Storage.JOURNAL) {
            LOG.info(() -> "Using audit journal under " + dataPath);
            return LedgerNode.journaled(config, dataPath);
        }
        LOG.info(() -> "Using RocksDB state under " + dataPath);
        return LedgerNode.rocks(config, dataPath);
    }

    /**
     * Walks the basic lifecycle: sponsor, a locked-out second sponsor, consumption to zero,
     * release, then partial and full forfeiture. Addresses get a per-run suffix so the flow
     * also works against persisted state.
     */
    static void runDemoFlow(LedgerNode node) {
        LedgerCore ledger = node.core();
        SimulatedAssetBank bank = node.bank();
        String run = Long.toString(node.audit().nextSequence());
        String sponsor = "demo-sponsor-" + run;
        String rival = "demo-rival-" + run;
        String beneficiary = "demo-user-" + run;
        String forfeiter = "demo-user-b-" + run;
        String engine = ledger.consumingEngine().orElseThrow(
                () -> new IllegalStateException("Demo flow needs a consuming engine"));

        bank.mint(sponsor, DEMO_USD, 1_000L);
        bank.mint(sponsor, DEMO_GOLD, 1_000L);
        bank.mint(rival, DEMO_USD, 1_000L);

        SponsorReceipt receipt = ledger.sponsor(sponsor, beneficiary, DEMO_USD, 100L);
        LOG.info(() -> "[1] sponsored " + receipt.receivedUnits() + " units, balance=" + receipt.newBalance()
                + ", sponsor=" + ledger.sponsorOf(beneficiary).orElse("-"));

        expectRejection("[2] rival sponsor", () -> ledger.sponsor(rival, beneficiary, DEMO_USD, 10L));

        long remaining = ledger.consume(engine, beneficiary, DEMO_USD, 100L);
        LOG.info(() -> "[3] consumed 100, remaining=" + remaining + ", active=" + ledger.activeAssetCount(beneficiary));
        expectRejection("[3] consume past zero", () -> ledger.consume(engine, beneficiary, DEMO_USD, 1L));

        String released = ledger.clearSponsorIfEmpty(beneficiary);
        LOG.info(() -> "[4] released sponsor " + released + ", sponsor now " + ledger.sponsorOf(beneficiary).orElse("-"));

        ledger.sponsor(sponsor, forfeiter, DEMO_USD, 50L);
        ledger.sponsor(sponsor, forfeiter, DEMO_GOLD, 30L);
        ForfeitSummary partial = ledger.clearSponsorAndForfeit(forfeiter, List.of(DEMO_USD));
        LOG.info(() -> "[5] forfeited " + partial.totalForfeited() + " across " + partial.assetsCleared()
                + " asset(s), sponsorCleared=" + partial.sponsorCleared());

        ForfeitSummary full = ledger.clearSponsorAndForfeit(forfeiter, List.of(DEMO_GOLD));
        LOG.info(() -> "[6] forfeited " + full.totalForfeited() + ", sponsorCleared=" + full.sponsorCleared()
                + ", sponsor now " + ledger.sponsorOf(forfeiter).orElse("-"));

        LOG.info(() -> "Sink holds " + bank.balanceOf(DEMO_USD) + " " + DEMO_USD + " and "
                + bank.balanceOf(DEMO_GOLD) + " " + DEMO_GOLD);
        LOG.info("=== Metrics ===\n" + LedgerMetrics.scrapeMetrics());
    }

    private static void expectRejection(String label, Runnable action) {
        try {
            action.run();
            LOG.warning(() -> label + " unexpectedly succeeded");
        } catch (LedgerException e) {
            LOG.info(() -> label + " rejected: " + e.error().code());
        }
    }

    private static void resetLedgerState(Path dataPath) {
        if (!Files.exists(dataPath)) {
            return;
        }
        Path registryFile = dataPath.resolve(LedgerNode.REGISTRY_FILE).normalize();
        try (Stream<Path> stream = Files.walk(dataPath)) {
            stream.sorted(Comparator.reverseOrder())
                    .filter(path -> !path.equals(dataPath))
                    .filter(path -> !path.normalize().equals(registryFile))
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            throw new IllegalStateException("Failed to delete " + path, e);
                        }
                    });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to reset ledger data in " + dataPath, e);
        }
        LOG.info("Cleared ledger state under " + dataPath + " (asset registry preserved).");
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            Storage storage,
            boolean resetState,
            boolean keepAlive,
            boolean demo,
            boolean enableRpc,
            String rpcBind,
            int rpcPort,
            String rpcToken,
            boolean enableFeed,
            int feedPort,
            String ownerAddress,
            String engineAddress
    ) {
        static CliOptions parse(String[] args) {
            return parse(args, System.getenv());
        }

        static CliOptions parse(String[] args, Map<String, String> env) {
            boolean showHelp = false;
            String error = null;
            Path dataDir = Path.of(envOrDefault(env, "UNIT_LEDGER_DATA_DIR", "./data/ledger"));
            Storage storage = Storage.ROCKS;
            boolean reset = false;
            boolean keepAlive = "true".equalsIgnoreCase(env.get("UNIT_LEDGER_KEEP_ALIVE"));
            boolean demo = true;
            boolean enableRpc = "true".equalsIgnoreCase(env.get("UNIT_LEDGER_ENABLE_RPC"));
            String rpcBind = envOrDefault(env, "UNIT_LEDGER_RPC_BIND", "127.0.0.1");
            int rpcPort = 9090;
            String rpcToken = envOrDefault(env, "UNIT_LEDGER_RPC_TOKEN", null);
            boolean enableFeed = !"false".equalsIgnoreCase(env.get("UNIT_LEDGER_ENABLE_FEED"));
            int feedPort = 9100;
            String owner = envOrDefault(env, "UNIT_LEDGER_OWNER", null);
            String engine = envOrDefault(env, "UNIT_LEDGER_ENGINE", null);

            try {
                String storageEnv = env.get("UNIT_LEDGER_STORAGE");
                if (storageEnv != null && !storageEnv.isBlank()) {
                    storage = parseStorage(storageEnv, "UNIT_LEDGER_STORAGE");
                }
                rpcPort = envPort(env, "UNIT_LEDGER_RPC_PORT", rpcPort);
                feedPort = envPort(env, "UNIT_LEDGER_FEED_PORT", feedPort);
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--data-dir=")) {
                            dataDir = Path.of(arg.substring("--data-dir=".length()));
                        } else if (arg.startsWith("--storage=")) {
                            storage = parseStorage(arg.substring("--storage=".length()), "--storage");
                        } else if (arg.equals("--reset-state")) {
                            reset = true;
                        } else if (arg.equals("--keep-alive")) {
                            keepAlive = true;
                        } else if (arg.equals("--demo")) {
                            demo = true;
                        } else if (arg.equals("--no-demo")) {
                            demo = false;
                        } else if (arg.equals("--enable-rpc")) {
                            enableRpc = true;
                        } else if (arg.startsWith("--rpc-bind=")) {
                            rpcBind = arg.substring("--rpc-bind=".length());
                        } else if (arg.startsWith("--rpc-port=")) {
                            rpcPort = parsePort(arg.substring("--rpc-port=".length()), "--rpc-port");
                        } else if (arg.startsWith("--rpc-token=")) {
                            rpcToken = arg.substring("--rpc-token=".length());
                        } else if (arg.equals("--enable-feed")) {
                            enableFeed = true;
                        } else if (arg.equals("--no-feed")) {
                            enableFeed = false;
                        } else if (arg.startsWith("--feed-port=")) {
                            feedPort = parsePort(arg.substring("--feed-port=".length()), "--feed-port");
                        } else if (arg.startsWith("--owner=")) {
                            owner = arg.substring("--owner=".length()).trim();
                        } else if (arg.startsWith("--engine=")) {
                            engine = arg.substring("--engine=".length()).trim();
                        } else if (!arg.startsWith("--")) {
                            dataDir = Path.of(arg);
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        if (error == null) {
                            error = ex.getMessage();
                        }
                    }
                }
            }

            keepAlive = keepAlive || enableRpc;
            if (rpcToken != null && rpcToken.isBlank()) {
                rpcToken = null;
            }
            if (owner != null && owner.isBlank()) {
                owner = null;
            }
            if (engine != null && engine.isBlank()) {
                engine = null;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    storage,
                    reset,
                    keepAlive,
                    demo,
                    enableRpc,
                    rpcBind,
                    rpcPort,
                    rpcToken,
                    enableFeed,
                    feedPort,
                    owner,
                    engine
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: unit-ledger [options] [data-dir]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for ledger data (default ./data/ledger)
  --storage=<kind>           memory, journal or rocks (default rocks)
  --reset-state              Delete ledger state and audit log (registry.json is kept)
  --keep-alive               Keep the ledger running until interrupted
  --demo / --no-demo         Enable (default) or disable the demo sponsorship flow
  --enable-rpc               Start the RPC server (default bind 127.0.0.1:9090)
  --rpc-bind=<host>          Bind address for the RPC server
  --rpc-port=<port>          Port for the RPC server (default 9090)
  --rpc-token=<token>        Require Bearer/X-API-Key token for the RPC server
  --enable-feed / --no-feed  Start (default) or skip the audit feed listener
  --feed-port=<port>         Port for the audit feed (default 9100)
  --owner=<addr>             Initial ledger owner on a fresh data dir
  --engine=<addr>            Consuming engine set on a fresh data dir

Environment overrides:
  UNIT_LEDGER_DATA_DIR       Override --data-dir
  UNIT_LEDGER_STORAGE        Storage backend
  UNIT_LEDGER_ENABLE_RPC     Set to "true" to enable RPC without CLI flag
  UNIT_LEDGER_RPC_BIND       RPC bind address
  UNIT_LEDGER_RPC_PORT       RPC port
  UNIT_LEDGER_RPC_TOKEN      Token for RPC auth (if --rpc-token not supplied)
  UNIT_LEDGER_ENABLE_FEED    Set to "false" to disable the audit feed
  UNIT_LEDGER_FEED_PORT      Audit feed port
  UNIT_LEDGER_OWNER          Initial owner address
  UNIT_LEDGER_ENGINE         Consuming engine address
  UNIT_LEDGER_KEEP_ALIVE     Set to "true" to force keep-alive mode
""");
        }

        private static String envOrDefault(Map<String, String> env, String key, String fallback) {
            String value = env.get(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(Map<String, String> env, String key, int fallback) {
            String value = env.get(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static Storage parseStorage(String value, String flag) {
            try {
                return Storage.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value
                        + " (expected memory, journal or rocks)");
            }
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }
    }
}
