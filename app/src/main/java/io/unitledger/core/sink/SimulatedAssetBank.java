package io.unitledger.core.sink;

import io.unitledger.core.protocol.Address;
import io.unitledger.core.protocol.ProtocolLimits;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * In-process stand-in for the assets themselves: tracks holder balances per asset,
 * can charge a per-asset transfer fee (in basis points, burned) and can invoke a hook
 * mid-transfer the way a callback-bearing asset would.
 *
 * Also serves as the {@link AssetSink} for one designated sink address.
 */
public final class SimulatedAssetBank implements AssetTransferer, AssetSink {

    /** Called after the holder was debited and before the recipient is credited. */
    @FunctionalInterface
    public interface TransferHook {
        void onTransfer(String from, String to, String asset, long amount);
    }

    private final String sinkAddress;
    private final Map<String, Map<String, Long>> holdings = new HashMap<>();
    private final Map<String, Integer> feeBps = new HashMap<>();
    private TransferHook hook;

    public SimulatedAssetBank(String sinkAddress) {
        this.sinkAddress = Address.require(sinkAddress, "sink");
    }

    @Override
    public String address() {
        return sinkAddress;
    }

    @Override
    public synchronized long balanceOf(String asset) {
        return holdingOf(sinkAddress, asset);
    }

    public synchronized long holdingOf(String holder, String asset) {
        Map<String, Long> byAsset = holdings.get(holder);
        if (byAsset == null) {
            return 0L;
        }
        return byAsset.getOrDefault(asset, 0L);
    }

    /** Credit a holder out of thin air (genesis-style funding for demos and tests). */
    public synchronized void mint(String holder, String asset, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
        put(holder, asset, Math.addExact(holdingOf(holder, asset), amount));
    }

    public synchronized void setTransferFeeBps(String asset, int bps) {
        if (bps < 0 || bps > ProtocolLimits.MAX_FEE_BPS) {
            throw new IllegalArgumentException("fee bps out of range: " + bps);
        }
        feeBps.put(asset, bps);
    }

    public synchronized void setHook(TransferHook hook) {
        this.hook = hook;
    }

    @Override
    public TransferHandle transfer(String from, String to, String asset, long amount) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(asset, "asset");
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
        long fee;
        TransferHook currentHook;
        synchronized (this) {
            long fromBal = holdingOf(from, asset);
            if (fromBal < amount) {
                throw new IllegalStateException("Insufficient " + asset + " held by " + from + ": " + fromBal + " < " + amount);
            }
            put(from, asset, fromBal - amount);
            fee = feeFor(asset, amount);
            currentHook = hook;
        }
        if (currentHook != null) {
            try {
                currentHook.onTransfer(from, to, asset, amount);
            } catch (RuntimeException e) {
                synchronized (this) {
                    put(from, asset, holdingOf(from, asset) + amount);
                }
                throw e;
            }
        }
        long delivered = amount - fee;
        synchronized (this) {
            put(to, asset, holdingOf(to, asset) + delivered);
        }
        return () -> {
            synchronized (SimulatedAssetBank.this) {
                put(to, asset, holdingOf(to, asset) - delivered);
                put(from, asset, holdingOf(from, asset) + amount);
            }
        };
    }

    private long feeFor(String asset, long amount) {
        int bps = feeBps.getOrDefault(asset, 0);
        if (bps == 0) {
            return 0L;
        }
        try {
            return Math.multiplyExact(amount, (long) bps) / ProtocolLimits.MAX_FEE_BPS;
        } catch (ArithmeticException e) {
            return (amount / ProtocolLimits.MAX_FEE_BPS) * bps;
        }
    }

    private void put(String holder, String asset, long value) {
        Map<String, Long> byAsset = holdings.computeIfAbsent(holder, k -> new HashMap<>());
        if (value == 0L) {
            byAsset.remove(asset);
        } else {
            byAsset.put(asset, value);
        }
    }
}
