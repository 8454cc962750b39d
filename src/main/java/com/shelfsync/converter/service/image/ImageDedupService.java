package com.shelfsync.converter.service.image;

import com.shelfsync.converter.repository.CatalogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent image deduplication scoped to one product.
 *
 * <p>URLs are fingerprinted (a known URL reuses its stored fingerprint). Each fingerprint keeps the
 * canonical URL it was first registered with, so the kept URL of a group does not change between
 * passes: when the canonical URL is listed it is kept, otherwise it replaces the group's URLs. For
 * a fingerprint seen for the first time the first URL in the list becomes canonical. Every other
 * URL of a group is removed, marked superseded by the canonical one and, when it lives on the
 * storage origin, deleted upstream. A failed delete aborts the record in strict mode and is only
 * logged in lenient mode.
 *
 * <p>A removed URL whose storage asset is also named by a kept URL is never deleted.
 */
public class ImageDedupService {
    private static final Logger log = LoggerFactory.getLogger(ImageDedupService.class);

    private final CatalogRepository catalog;
    private final ImageFingerprinter fingerprinter;
    private final ImageStorageGateway storage;
    private final boolean strict;

    public ImageDedupService(CatalogRepository catalog, ImageFingerprinter fingerprinter,
                             ImageStorageGateway storage, boolean strict) {
        this.catalog = catalog;
        this.fingerprinter = fingerprinter;
        this.storage = storage;
        this.strict = strict;
    }

    public ImageDedupResult dedupe(String canonicalProductId, List<String> imageUrls) {
        Set<String> distinct = new LinkedHashSet<>();
        if (imageUrls != null) {
            for (String url : imageUrls) {
                if (url != null && !url.isBlank()) distinct.add(url.trim());
            }
        }

        Map<String, String> fingerprintByUrl = new LinkedHashMap<>();
        Map<String, String> keptByFingerprint = new LinkedHashMap<>();
        for (String url : distinct) {
            String fingerprint = catalog.findImageFingerprint(url).orElse(null);
            if (fingerprint == null) {
                fingerprint = fingerprinter.fingerprint(url);
                catalog.registerImage(url, fingerprint);
            }
            fingerprintByUrl.put(url, fingerprint);
            if (!keptByFingerprint.containsKey(fingerprint)) {
                keptByFingerprint.put(fingerprint, catalog.findCanonicalImageUrl(fingerprint).orElse(url));
            }
        }

        Set<String> keptAssets = new HashSet<>();
        for (String keptUrl : keptByFingerprint.values()) {
            storage.assetName(keptUrl).ifPresent(keptAssets::add);
        }

        List<String> removed = new ArrayList<>();
        for (Map.Entry<String, String> entry : fingerprintByUrl.entrySet()) {
            String url = entry.getKey();
            String keptUrl = keptByFingerprint.get(entry.getValue());
            if (url.equals(keptUrl)) continue;
            removed.add(url);
            catalog.markImageSuperseded(url, keptUrl);
            deleteUpstream(canonicalProductId, url, keptAssets);
        }

        if (!removed.isEmpty()) {
            log.debug("Product {}: kept {} image(s), removed {} duplicate(s)", canonicalProductId, keptByFingerprint.size(), removed.size());
        }
        return new ImageDedupResult(
                new ArrayList<>(keptByFingerprint.values()),
                removed,
                new ArrayList<>(keptByFingerprint.keySet()));
    }

    private void deleteUpstream(String canonicalProductId, String url, Set<String> keptAssets) {
        Optional<String> asset = storage.assetName(url);
        if (asset.isEmpty()) {
            log.debug("Not deleting {}: outside the storage origin or asset path", url);
            return;
        }
        if (keptAssets.contains(asset.get())) {
            log.debug("Not deleting {}: asset {} is still referenced by a kept image", url, asset.get());
            return;
        }
        try {
            storage.delete(url);
        } catch (ImageDeleteException e) {
            if (strict) throw e;
            log.warn("Product {}: duplicate image kept in storage, {}", canonicalProductId, e.getMessage());
        }
    }
}
