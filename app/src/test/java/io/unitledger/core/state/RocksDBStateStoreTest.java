package io.unitledger.core.state;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RocksDBStateStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void persistsAcrossReopen() {
        String dir = tempDir.resolve("state").toString();
        try (RocksDBStateStore store = RocksDBStateStore.open(dir)) {
            store.apply(new StateBatch()
                    .assignSponsor("user-b", "sponsor-1")
                    .putBalance("user-b", "asset:a", 50L)
                    .putBalance("user-b", "asset:b", 30L)
                    .putActiveAssetCount("user-b", 2L)
                    .putCumulativeSponsored("asset:a", 50L)
                    .putLifetimeAllocated("user-b", 80L)
                    .putMeta(StateStore.META_OWNER, "owner-1"));
        }

        try (RocksDBStateStore store = RocksDBStateStore.open(dir)) {
            assertEquals("sponsor-1", store.getSponsor("user-b").orElseThrow());
            assertEquals(Map.of("asset:a", 50L, "asset:b", 30L), store.getBalances("user-b"));
            assertEquals(2L, store.getActiveAssetCount("user-b"));
            assertEquals(50L, store.getCumulativeSponsored("asset:a"));
            assertEquals(80L, store.getLifetimeAllocated("user-b"));
            assertEquals("owner-1", store.getMeta(StateStore.META_OWNER).orElseThrow());
        }
    }

    @Test
    void balancePrefixDoesNotLeakIntoLongerAddresses() {
        try (RocksDBStateStore store = RocksDBStateStore.open(tempDir.resolve("prefix").toString())) {
            store.apply(new StateBatch()
                    .putBalance("user-a", "asset:x", 1L)
                    .putBalance("user-ab", "asset:y", 2L));

            assertEquals(Map.of("asset:x", 1L), store.getBalances("user-a"));
            assertEquals(Map.of("asset:y", 2L), store.getBalances("user-ab"));
        }
    }

    @Test
    void zeroWritesDeleteEntries() {
        try (RocksDBStateStore store = RocksDBStateStore.open(tempDir.resolve("zero").toString())) {
            store.apply(new StateBatch()
                    .assignSponsor("user-b", "sponsor-1")
                    .putBalance("user-b", "asset:a", 5L)
                    .putActiveAssetCount("user-b", 1L));
            store.apply(new StateBatch()
                    .clearSponsor("user-b")
                    .putBalance("user-b", "asset:a", 0L)
                    .putActiveAssetCount("user-b", 0L));

            assertTrue(store.getBalances("user-b").isEmpty());
            assertEquals(0L, store.getActiveAssetCount("user-b"));
            assertTrue(store.getSponsor("user-b").isEmpty());
        }
    }
}
