package io.unitledger.core.sink;

/**
 * The asset-transfer mechanism. Implementations are untrusted: they may charge a
 * fee on transfer, deliver nothing, or call back into the ledger.
 */
public interface AssetTransferer {

    /**
     * Move {@code amount} of {@code asset} from {@code from} to {@code to}.
     *
     * @return handle that undoes the movement
     * @throws IllegalStateException if the holder cannot cover the amount
     */
    TransferHandle transfer(String from, String to, String asset, long amount);
}
