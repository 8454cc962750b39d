package com.shelfsync.converter.service.identity;

import com.shelfsync.converter.model.NormalizedProduct;
import com.shelfsync.converter.repository.CatalogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maps a product's natural keys to a canonical product id that never changes once assigned.
 *
 * <p>Keys are tried in priority order {@code plu}, {@code sku}, {@code source_id}, then the
 * stop-word-stripped normalized title. The first key that already has a mapping decides the id.
 * Otherwise a name-based UUID of the highest-priority key is allocated, with a sequence number
 * bumped until the id is unused. Every key of the product that has no mapping yet is then
 * bound to the id; existing mappings are left alone.
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final CatalogRepository catalog;
    private final ReentrantLock allocationLock;

    public IdentityResolver(CatalogRepository catalog) {
        this(catalog, new ReentrantLock());
    }

    public IdentityResolver(CatalogRepository catalog, ReentrantLock allocationLock) {
        this.catalog = catalog;
        this.allocationLock = allocationLock;
    }

    public static List<IdentityKey> candidateKeys(NormalizedProduct product) {
        List<IdentityKey> keys = new ArrayList<>(4);
        addIfPresent(keys, IdentityKey.of(IdentityKey.PLU, product.getPlu()));
        addIfPresent(keys, IdentityKey.of(IdentityKey.SKU, product.getSku()));
        addIfPresent(keys, IdentityKey.of(IdentityKey.SOURCE_ID, product.getSource_id()));
        addIfPresent(keys, IdentityKey.of(IdentityKey.NORMALIZED_NAME, product.getTitle_normalized_no_stopwords()));
        return keys;
    }

    private static void addIfPresent(List<IdentityKey> keys, IdentityKey key) {
        if (key != null) keys.add(key);
    }

    public String resolve(String parserName, NormalizedProduct product) {
        return resolve(parserName, candidateKeys(product));
    }

    /** Resolves a single source key. */
    public String resolve(String parserName, IdentityKey sourceKey) {
        return resolve(parserName, List.of(sourceKey));
    }

    public String resolve(String parserName, List<IdentityKey> keys) {
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("Product has no identity key (plu, sku, source_id or title)");
        }
        String parser = parserName.trim().toLowerCase(Locale.ROOT);
        allocationLock.lock();
        try {
            String canonicalId = null;
            for (IdentityKey key : keys) {
                Optional<String> existing = catalog.findCanonicalId(parser, key.type(), key.value());
                if (existing.isPresent()) {
                    canonicalId = existing.get();
                    break;
                }
            }
            if (canonicalId == null) {
                canonicalId = allocate(parser, keys.get(0));
                log.debug("Allocated canonical id {} for {} {}={}", canonicalId, parser, keys.get(0).type(), keys.get(0).value());
            }
            for (IdentityKey key : keys) {
                catalog.insertIdentityIfAbsent(parser, key.type(), key.value(), canonicalId);
            }
            return canonicalId;
        } finally {
            allocationLock.unlock();
        }
    }

    private String allocate(String parser, IdentityKey key) {
        for (int seq = 0; ; seq++) {
            String seed = parser + "|" + key.type() + "|" + key.value() + "|" + seq;
            String candidate = UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
            if (!catalog.isCanonicalIdInUse(candidate)) return candidate;
        }
    }
}
