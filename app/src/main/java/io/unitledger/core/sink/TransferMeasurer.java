package io.unitledger.core.sink;

/**
 * Transfer-and-measure collaborator: pulls an asset from a sponsor into the sink
 * and reports the amount the sink actually received.
 */
@FunctionalInterface
public interface TransferMeasurer {
    MeasuredTransfer pull(String from, String asset, long requested);
}
