package io.unitledger.core.registry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEligibilityRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void readsFixtureWithZeroCapAsUncapped() throws Exception {
        InMemoryEligibilityRegistry registry;
        try (InputStream in = getClass().getResourceAsStream("/registry-fixture.json")) {
            assertNotNull(in);
            registry = InMemoryEligibilityRegistry.read(in);
        }

        AssetListing usdx = registry.lookup("asset:usdx").orElseThrow();
        assertTrue(usdx.sponsorable());
        assertFalse(usdx.capped());
        assertEquals(6, usdx.decimals());

        assertEquals(OptionalLong.of(500L), registry.lookup("asset:gold").orElseThrow().capUnits());
        assertFalse(registry.lookup("asset:frozen").orElseThrow().sponsorable());
        assertFalse(registry.lookup("asset:delisted").orElseThrow().sponsorable());
        assertTrue(registry.lookup("asset:missing").isEmpty());
        assertTrue(registry.lookup(null).isEmpty());
    }

    @Test
    void saveAndLoadKeepListings() {
        InMemoryEligibilityRegistry registry = new InMemoryEligibilityRegistry()
                .put("asset:a", AssetListing.enabled(2, 100L))
                .put("asset:b", AssetListing.enabled(0, 1L).withCap(42L));
        registry.setEnabled("asset:a", false);
        Path file = tempDir.resolve("registry.json");

        registry.save(file);
        InMemoryEligibilityRegistry loaded = InMemoryEligibilityRegistry.load(file);

        assertEquals(registry.listings(), loaded.listings());
    }

    @Test
    void capCanBeLiftedAndRestored() {
        InMemoryEligibilityRegistry registry = new InMemoryEligibilityRegistry()
                .put("asset:a", AssetListing.enabled(0, 1L).withCap(10L));

        registry.setCap("asset:a", OptionalLong.empty());
        assertFalse(registry.lookup("asset:a").orElseThrow().capped());

        registry.setCap("asset:a", OptionalLong.of(0L));
        assertEquals(OptionalLong.of(0L), registry.lookup("asset:a").orElseThrow().capUnits());
    }

    @Test
    void rejectsBadListings() {
        InMemoryEligibilityRegistry registry = new InMemoryEligibilityRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.put("bad asset", AssetListing.enabled(0, 1L)));
        assertThrows(IllegalArgumentException.class, () -> registry.setEnabled("asset:none", true));
        assertThrows(IllegalArgumentException.class, () -> AssetListing.enabled(99, 1L));
    }
}
