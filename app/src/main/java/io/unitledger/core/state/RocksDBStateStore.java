package io.unitledger.core.state;

import org.rocksdb.*;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Persistent StateStore using RocksDB.
 *
 * Layout (column families):
 *  - "sponsors"     : key = beneficiary,              val = sponsor (UTF-8)
 *  - "balances"     : key = beneficiary 0x00 asset,   val = units (8, big-endian)
 *  - "active"       : key = beneficiary,              val = count (8, big-endian)
 *  - "asset_totals" : key = asset,                    val = cumulative sponsored units
 *  - "lifetime"     : key = beneficiary,              val = cumulative allocated units
 *  - "meta"         : key = name,                     val = UTF-8 string
 *
 * Zero balances and zero counts are stored as absent keys.
 */
public final class RocksDBStateStore implements StateStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(RocksDBStateStore.class.getName());
    private static final byte SEPARATOR = 0x00;

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfSponsors;
    private final ColumnFamilyHandle cfBalances;
    private final ColumnFamilyHandle cfActive;
    private final ColumnFamilyHandle cfAssetTotals;
    private final ColumnFamilyHandle cfLifetime;
    private final ColumnFamilyHandle cfMeta;
    private final List<ColumnFamilyHandle> handles;
    private final DBOptions dbOptions;

    private RocksDBStateStore(RocksDB db, List<ColumnFamilyHandle> handles, DBOptions dbOptions) {
        this.db = db;
        this.handles = handles;
        this.cfSponsors = handles.get(1);
        this.cfBalances = handles.get(2);
        this.cfActive = handles.get(3);
        this.cfAssetTotals = handles.get(4);
        this.cfLifetime = handles.get(5);
        this.cfMeta = handles.get(6);
        this.dbOptions = dbOptions;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBStateStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        try {
            List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                    descriptor("sponsors"),
                    descriptor("balances"),
                    descriptor("active"),
                    descriptor("asset_totals"),
                    descriptor("lifetime"),
                    descriptor("meta")
            );
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            LOG.info(() -> "Opened ledger state at " + dataDir);
            return new RocksDBStateStore(db, cfHandles, dbOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- StateStore API ----------------

    @Override
    public synchronized Optional<String> getSponsor(String beneficiary) {
        return Optional.ofNullable(getString(cfSponsors, key(beneficiary), "getSponsor"));
    }

    @Override
    public synchronized long getBalance(String beneficiary, String asset) {
        return getLong(cfBalances, balanceKey(beneficiary, asset), "getBalance");
    }

    @Override
    public synchronized Map<String, Long> getBalances(String beneficiary) {
        byte[] prefix = balancePrefix(beneficiary);
        TreeMap<String, Long> out = new TreeMap<>();
        try (RocksIterator it = db.newIterator(cfBalances)) {
            for (it.seek(prefix); it.isValid(); it.next()) {
                byte[] k = it.key();
                if (!startsWith(k, prefix)) {
                    break;
                }
                String asset = new String(k, prefix.length, k.length - prefix.length, StandardCharsets.UTF_8);
                out.put(asset, bytesToLong(it.value()));
            }
        }
        return out.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(out);
    }

    @Override
    public synchronized long getActiveAssetCount(String beneficiary) {
        return getLong(cfActive, key(beneficiary), "getActiveAssetCount");
    }

    @Override
    public synchronized long getCumulativeSponsored(String asset) {
        return getLong(cfAssetTotals, key(asset), "getCumulativeSponsored");
    }

    @Override
    public synchronized long getLifetimeAllocated(String beneficiary) {
        return getLong(cfLifetime, key(beneficiary), "getLifetimeAllocated");
    }

    @Override
    public synchronized Optional<String> getMeta(String name) {
        return Optional.ofNullable(getString(cfMeta, key(name), "getMeta"));
    }

    @Override
    public synchronized void apply(StateBatch batch) {
        if (batch.isEmpty()) {
            return;
        }
        try (WriteOptions wo = new WriteOptions().setSync(true);
             WriteBatch wb = new WriteBatch()) {
            for (Map.Entry<String, Optional<String>> e : batch.sponsors().entrySet()) {
                if (e.getValue().isPresent()) {
                    wb.put(cfSponsors, key(e.getKey()), key(e.getValue().get()));
                } else {
                    wb.delete(cfSponsors, key(e.getKey()));
                }
            }
            for (Map.Entry<StateBatch.BalanceKey, Long> e : batch.balances().entrySet()) {
                putOrDeleteZero(wb, cfBalances, balanceKey(e.getKey().beneficiary(), e.getKey().asset()), e.getValue());
            }
            for (Map.Entry<String, Long> e : batch.activeCounts().entrySet()) {
                putOrDeleteZero(wb, cfActive, key(e.getKey()), e.getValue());
            }
            for (Map.Entry<String, Long> e : batch.assetTotals().entrySet()) {
                wb.put(cfAssetTotals, key(e.getKey()), longToBytes(e.getValue()));
            }
            for (Map.Entry<String, Long> e : batch.lifetimeTotals().entrySet()) {
                wb.put(cfLifetime, key(e.getKey()), longToBytes(e.getValue()));
            }
            for (Map.Entry<String, Optional<String>> e : batch.meta().entrySet()) {
                if (e.getValue().isPresent()) {
                    wb.put(cfMeta, key(e.getKey()), key(e.getValue().get()));
                } else {
                    wb.delete(cfMeta, key(e.getKey()));
                }
            }
            db.write(wo, wb);
        } catch (RocksDBException e) {
            throw new IllegalStateException("apply failed", e);
        }
    }

    @Override
    public void close() {
        // Close CF handles first, then DB/options
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        db.close();
        dbOptions.close();
    }

    // -------------- helpers ----------------

    private static ColumnFamilyDescriptor descriptor(String name) {
        return new ColumnFamilyDescriptor(name.getBytes(StandardCharsets.UTF_8));
    }

    private void putOrDeleteZero(WriteBatch wb, ColumnFamilyHandle cf, byte[] k, long value) throws RocksDBException {
        if (value == 0L) {
            wb.delete(cf, k);
        } else {
            wb.put(cf, k, longToBytes(value));
        }
    }

    private long getLong(ColumnFamilyHandle cf, byte[] k, String op) {
        try {
            byte[] v = db.get(cf, k);
            return v == null ? 0L : bytesToLong(v);
        } catch (RocksDBException e) {
            throw new IllegalStateException(op + " failed", e);
        }
    }

    private String getString(ColumnFamilyHandle cf, byte[] k, String op) {
        try {
            byte[] v = db.get(cf, k);
            return v == null ? null : new String(v, StandardCharsets.UTF_8);
        } catch (RocksDBException e) {
            throw new IllegalStateException(op + " failed", e);
        }
    }

    private static byte[] key(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] balancePrefix(String beneficiary) {
        byte[] b = key(beneficiary);
        byte[] out = Arrays.copyOf(b, b.length + 1);
        out[b.length] = SEPARATOR;
        return out;
    }

    private static byte[] balanceKey(String beneficiary, String asset) {
        byte[] prefix = balancePrefix(beneficiary);
        byte[] a = key(asset);
        byte[] out = Arrays.copyOf(prefix, prefix.length + a.length);
        System.arraycopy(a, 0, out, prefix.length, a.length);
        return out;
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static byte[] longToBytes(long v) {
        ByteBuffer b = ByteBuffer.allocate(8);
        b.putLong(v);
        return b.array();
    }

    private static long bytesToLong(byte[] a) {
        return ByteBuffer.wrap(a).getLong();
    }
}
