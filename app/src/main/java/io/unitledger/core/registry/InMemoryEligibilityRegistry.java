package io.unitledger.core.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.unitledger.core.protocol.Address;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.logging.Logger;

/**
 * Registry backed by a map, loadable from and savable to a JSON file of the form
 * <pre>
 * { "asset:usdx": { "listed": true, "enabled": true, "decimals": 6,
 *                   "unitsPerReferenceAmount": 1000000, "capUnits": 0 } }
 * </pre>
 * In the file a {@code capUnits} of 0 (or a missing field) means uncapped.
 */
public final class InMemoryEligibilityRegistry implements EligibilityRegistry {
    private static final Logger LOG = Logger.getLogger(InMemoryEligibilityRegistry.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Map<String, AssetListing> listings = new LinkedHashMap<>();

    @Override
    public synchronized Optional<AssetListing> lookup(String assetId) {
        if (assetId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(listings.get(assetId));
    }

    public synchronized InMemoryEligibilityRegistry put(String assetId, AssetListing listing) {
        if (!Address.isValid(assetId)) {
            throw new IllegalArgumentException("Invalid asset id: " + assetId);
        }
        listings.put(assetId, listing);
        return this;
    }

    public synchronized void setEnabled(String assetId, boolean enabled) {
        listings.put(assetId, existing(assetId).withEnabled(enabled));
    }

    public synchronized void setCap(String assetId, OptionalLong cap) {
        AssetListing current = existing(assetId);
        listings.put(assetId, cap.isPresent() ? current.withCap(cap.getAsLong()) : current.uncapped());
    }

    public synchronized Map<String, AssetListing> listings() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(listings));
    }

    private AssetListing existing(String assetId) {
        AssetListing listing = listings.get(assetId);
        if (listing == null) {
            throw new IllegalArgumentException("Unknown asset: " + assetId);
        }
        return listing;
    }

    // -------------------- JSON file --------------------

    public static InMemoryEligibilityRegistry load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            InMemoryEligibilityRegistry registry = read(in);
            LOG.info(() -> "Loaded " + registry.listings.size() + " asset listing(s) from " + path);
            return registry;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read asset registry from " + path, e);
        }
    }

    public static InMemoryEligibilityRegistry read(InputStream in) throws IOException {
        Map<String, ListingFile> raw = JSON.readValue(in, new TypeReference<Map<String, ListingFile>>() {});
        InMemoryEligibilityRegistry registry = new InMemoryEligibilityRegistry();
        if (raw == null) {
            return registry;
        }
        for (Map.Entry<String, ListingFile> entry : raw.entrySet()) {
            ListingFile f = entry.getValue();
            if (f == null) {
                continue;
            }
            OptionalLong cap = f.capUnits > 0 ? OptionalLong.of(f.capUnits) : OptionalLong.empty();
            registry.put(entry.getKey(), new AssetListing(f.listed, f.enabled, f.decimals, f.unitsPerReferenceAmount, cap));
        }
        return registry;
    }

    public synchronized void save(Path path) {
        Map<String, ListingFile> out = new LinkedHashMap<>();
        for (Map.Entry<String, AssetListing> entry : listings.entrySet()) {
            AssetListing l = entry.getValue();
            ListingFile f = new ListingFile();
            f.listed = l.listed();
            f.enabled = l.enabled();
            f.decimals = l.decimals();
            f.unitsPerReferenceAmount = l.unitsPerReferenceAmount();
            f.capUnits = l.capUnits().orElse(0L);
            out.put(entry.getKey(), f);
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            JSON.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), out);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist asset registry to " + path, e);
        }
    }

    static final class ListingFile {
        public boolean listed = true;
        public boolean enabled = true;
        public int decimals;
        public long unitsPerReferenceAmount;
        public long capUnits;
    }
}
