package com.shelfsync.converter.model;

/**
 * Receiver read position: the last processed {@code (ingested_at, product_id)} pair.
 * Receiver rows are read in ascending order of that pair.
 */
public record SyncCursor(String ingestedAt, long productId) {

    public boolean isBefore(String otherIngestedAt, long otherProductId) {
        int cmp = ingestedAt.compareTo(otherIngestedAt);
        return cmp < 0 || (cmp == 0 && productId < otherProductId);
    }
}
