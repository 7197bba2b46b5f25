package io.unitledger.core.sink;

/**
 * Irreversible destination of sponsored assets. Nothing is ever withdrawn from it
 * by the ledger; its balance is only read, to measure what actually arrived.
 */
public interface AssetSink {
    String address();

    long balanceOf(String asset);
}
