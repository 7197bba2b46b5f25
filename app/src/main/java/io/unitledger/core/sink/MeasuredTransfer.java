package io.unitledger.core.sink;

import java.util.Objects;

/**
 * Outcome of pulling an asset into the sink: what was asked for, what the sink
 * actually gained, and how to undo it if the enclosing call fails.
 */
public record MeasuredTransfer(String asset, long requested, long received, TransferHandle handle) {

    public MeasuredTransfer {
        Objects.requireNonNull(asset, "asset");
        handle = handle == null ? TransferHandle.NONE : handle;
        if (received < 0) {
            throw new IllegalArgumentException("received must be >= 0");
        }
    }

    public long deducted() {
        return Math.max(0L, requested - received);
    }

    public void abort() {
        handle.revert();
    }
}
