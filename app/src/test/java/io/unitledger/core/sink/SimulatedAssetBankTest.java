package io.unitledger.core.sink;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedAssetBankTest {

    @Test
    void measuresWhatTheSinkActuallyReceived() {
        SimulatedAssetBank bank = new SimulatedAssetBank("sink:dead");
        bank.mint("sponsor-1", "asset:fee", 1_000L);
        bank.setTransferFeeBps("asset:fee", 300);
        TransferMeasurer measurer = new SinkBalanceMeasurer(bank, bank);

        MeasuredTransfer transfer = measurer.pull("sponsor-1", "asset:fee", 1_000L);

        assertEquals(1_000L, transfer.requested());
        assertEquals(970L, transfer.received());
        assertEquals(30L, transfer.deducted());
        assertEquals(0L, bank.holdingOf("sponsor-1", "asset:fee"));
        assertEquals(970L, bank.balanceOf("asset:fee"));
    }

    @Test
    void abortRestoresBothSides() {
        SimulatedAssetBank bank = new SimulatedAssetBank("sink:dead");
        bank.mint("sponsor-1", "asset:a", 500L);
        bank.mint("sink:dead", "asset:a", 7L);
        TransferMeasurer measurer = new SinkBalanceMeasurer(bank, bank);

        MeasuredTransfer transfer = measurer.pull("sponsor-1", "asset:a", 200L);
        assertEquals(207L, bank.balanceOf("asset:a"));

        transfer.abort();
        assertEquals(500L, bank.holdingOf("sponsor-1", "asset:a"));
        assertEquals(7L, bank.balanceOf("asset:a"));
    }

    @Test
    void failingHookLeavesHoldingsUntouched() {
        SimulatedAssetBank bank = new SimulatedAssetBank("sink:dead");
        bank.mint("sponsor-1", "asset:a", 500L);
        bank.setHook((from, to, asset, amount) -> {
            throw new IllegalStateException("rejected by asset");
        });

        assertThrows(IllegalStateException.class, () -> bank.transfer("sponsor-1", "sink:dead", "asset:a", 100L));
        assertEquals(500L, bank.holdingOf("sponsor-1", "asset:a"));
        assertEquals(0L, bank.balanceOf("asset:a"));
    }

    @Test
    void sinkDrainDuringTransferIsDetected() {
        SimulatedAssetBank bank = new SimulatedAssetBank("sink:dead");
        bank.mint("sponsor-1", "asset:a", 100L);
        bank.mint("sink:dead", "asset:a", 50L);
        AssetTransferer drainer = (from, to, asset, amount) -> {
            TransferHandle inner = bank.transfer(from, to, asset, amount);
            TransferHandle drain = bank.transfer("sink:dead", "thief", asset, amount + 20L);
            return () -> {
                drain.revert();
                inner.revert();
            };
        };
        TransferMeasurer measurer = new SinkBalanceMeasurer(bank, drainer);

        assertThrows(IllegalStateException.class, () -> measurer.pull("sponsor-1", "asset:a", 10L));
        assertEquals(100L, bank.holdingOf("sponsor-1", "asset:a"));
        assertEquals(50L, bank.balanceOf("asset:a"));
        assertEquals(0L, bank.holdingOf("thief", "asset:a"));
    }

    @Test
    void rejectsOutOfRangeFees() {
        SimulatedAssetBank bank = new SimulatedAssetBank("sink:dead");
        assertThrows(IllegalArgumentException.class, () -> bank.setTransferFeeBps("asset:a", 10_001));
        assertThrows(IllegalArgumentException.class, () -> bank.setTransferFeeBps("asset:a", -1));
    }
}
