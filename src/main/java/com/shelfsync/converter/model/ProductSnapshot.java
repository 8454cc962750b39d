package com.shelfsync.converter.model;

import java.time.Instant;

/**
 * Immutable point-in-time copy of a product's normalized record, as stored in
 * {@code catalog_product_snapshots}.
 */
public record ProductSnapshot(
        long id,
        String canonicalProductId,
        String parserName,
        String sourceId,
        String runId,
        String contentHash,
        Instant observedAt,
        Instant createdAt,
        NormalizedProduct product
) {}
