package io.unitledger.core.sink;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Measures receipt as the difference of the sink's balance read before and after
 * the transfer. The requested figure is never trusted.
 */
public final class SinkBalanceMeasurer implements TransferMeasurer {
    private static final Logger LOG = Logger.getLogger(SinkBalanceMeasurer.class.getName());

    private final AssetSink sink;
    private final AssetTransferer transferer;

    public SinkBalanceMeasurer(AssetSink sink, AssetTransferer transferer) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.transferer = Objects.requireNonNull(transferer, "transferer");
    }

    @Override
    public MeasuredTransfer pull(String from, String asset, long requested) {
        long before = sink.balanceOf(asset);
        TransferHandle handle = transferer.transfer(from, sink.address(), asset, requested);
        long after = sink.balanceOf(asset);
        if (after < before) {
            handle.revert();
            throw new IllegalStateException("Sink balance of " + asset + " decreased during transfer (" + before + " -> " + after + ")");
        }
        long received = after - before;
        if (received != requested) {
            LOG.fine(() -> "Transfer of " + asset + " from " + from + " delivered " + received + " of " + requested + " requested");
        }
        return new MeasuredTransfer(asset, requested, received, handle);
    }
}
