package com.shelfsync.converter.repository;

import com.shelfsync.converter.model.GeoInfo;
import com.shelfsync.converter.model.NormalizedProduct;
import com.shelfsync.converter.model.ProductSnapshot;
import com.shelfsync.converter.model.SyncCursor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Catalog store port. Identity, image and reference tables are insert-if-absent or
 * fill-missing only; snapshots are append-only. Implementations share these semantics
 * regardless of backend.
 */
public interface CatalogRepository extends AutoCloseable {

    /** Creates missing tables, then verifies existing ones carry the columns this code writes. */
    void ensureSchema();

    /** Runs {@code work} in one transaction; a runtime exception rolls everything back. */
    <T> T inTransaction(Supplier<T> work);

    Optional<String> findCanonicalId(String parserName, String identityType, String identityValue);

    boolean isCanonicalIdInUse(String canonicalProductId);

    /** Never replaces an existing mapping. */
    void insertIdentityIfAbsent(String parserName, String identityType, String identityValue, String canonicalProductId);

    Optional<String> findImageFingerprint(String url);

    /** URL first registered under the fingerprint; it stays canonical for good. */
    Optional<String> findCanonicalImageUrl(String fingerprint);

    void registerImage(String url, String fingerprint);

    void markImageSuperseded(String url, String supersededBy);

    /** Snapshots of one product, oldest first. */
    List<ProductSnapshot> loadHistory(String canonicalProductId);

    Optional<ProductSnapshot> latestSnapshot(String canonicalProductId);

    long appendSnapshot(NormalizedProduct product, String contentHash);

    void linkSnapshotCategory(long snapshotId, long categoryId, boolean primary, int sortOrder);

    void upsertSource(String parserName, String sourceId, String canonicalProductId, long snapshotId, Instant seenAt);

    Optional<NormalizedProduct> loadProjection(String canonicalProductId);

    void saveProjection(NormalizedProduct merged, long snapshotId);

    long upsertCategory(String parserName, String categoryKey, String uid, String title, String titleNormalized);

    /** Inserts the settlement or fills its missing columns. */
    long upsertSettlement(String geoKey, GeoInfo geo, String nameNormalized);

    void appendGeodata(long settlementId, String fingerprint, double latitude, double longitude);

    Optional<SyncCursor> loadCursor(String parserName);

    void saveCursor(String parserName, SyncCursor cursor);

    @Override
    void close();
}
