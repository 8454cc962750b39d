package com.shelfsync.converter.service.catalog;

import com.shelfsync.converter.model.CategoryRef;
import com.shelfsync.converter.model.GeoInfo;
import com.shelfsync.converter.model.NormalizedProduct;
import com.shelfsync.converter.model.ProductSnapshot;
import com.shelfsync.converter.repository.CatalogRepository;
import com.shelfsync.converter.service.parser.TextNormalizer;
import com.shelfsync.converter.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Writes one normalized product into the catalog: reference rows (settlement, geodata point,
 * categories), a snapshot, the source pointer and the merged projection.
 *
 * <p>Callers run {@link #write} inside {@link CatalogRepository#inTransaction} so the steps land
 * together or not at all. A snapshot is appended only when the record's content hash differs
 * from the product's latest snapshot; the source pointer and projection are refreshed either way.
 */
public class CatalogWriter {
    private static final Logger log = LoggerFactory.getLogger(CatalogWriter.class);

    private final CatalogRepository catalog;
    private final SnapshotHasher hasher;
    private final ProjectionMerger merger;
    private final TextNormalizer text;

    public CatalogWriter(CatalogRepository catalog, SnapshotHasher hasher, ProjectionMerger merger, TextNormalizer text) {
        this.catalog = catalog;
        this.hasher = hasher;
        this.merger = merger;
        this.text = text;
    }

    public WriteResult write(String productId, NormalizedProduct normalized) {
        if (productId == null || productId.isBlank()) {
            throw new CatalogWriteException("Cannot write a product without canonical id");
        }
        NormalizedProduct product = normalized.copy();
        product.setCanonical_product_id(productId);
        try {
            writeSettlement(product.getGeo());
            List<Long> categoryIds = writeCategories(product);

            String hash = hasher.hash(product);
            Optional<ProductSnapshot> latest = catalog.latestSnapshot(productId);
            long snapshotId;
            boolean appended;
            if (latest.isPresent() && hash.equals(latest.get().contentHash())) {
                snapshotId = latest.get().id();
                appended = false;
            } else {
                snapshotId = catalog.appendSnapshot(product, hash);
                appended = true;
                for (int i = 0; i < categoryIds.size(); i++) {
                    catalog.linkSnapshotCategory(snapshotId, categoryIds.get(i), i == 0, i);
                }
            }

            if (product.getSource_id() != null) {
                catalog.upsertSource(product.getParser_name(), product.getSource_id(), productId, snapshotId, product.getObserved_at());
            }
            NormalizedProduct merged = catalog.loadProjection(productId)
                    .map(existing -> merger.merge(existing, product))
                    .orElse(product);
            catalog.saveProjection(merged, snapshotId);

            log.debug("Wrote {} snapshot={} appended={}", productId, snapshotId, appended);
            return new WriteResult(snapshotId, appended);
        } catch (DataAccessResourceFailureException e) {
            throw e;
        } catch (DataAccessException e) {
            throw new CatalogWriteException("Catalog write failed for " + productId + ": " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private void writeSettlement(GeoInfo geo) {
        if (geo == null) return;
        String name = text.trimToNull(geo.getName());
        String region = text.trimToNull(geo.getRegion());
        String country = text.trimToNull(geo.getCountry());
        if (name == null && region == null && country == null) return;

        String geoKey = String.join("|", lower(country), lower(region), lower(name));
        long settlementId = catalog.upsertSettlement(geoKey, geo, text.normalizeField(name));
        if (geo.hasCoordinates()) {
            String point = String.format(Locale.ROOT, "%d|%.6f|%.6f", settlementId, geo.getLatitude(), geo.getLongitude());
            catalog.appendGeodata(settlementId, HashUtils.sha256Hex(point), geo.getLatitude(), geo.getLongitude());
        }
    }

    private List<Long> writeCategories(NormalizedProduct product) {
        List<CategoryRef> refs = new ArrayList<>(product.getCategories());
        if (refs.isEmpty() && product.getCategory_raw() != null) {
            refs.add(new CategoryRef(null, product.getCategory_raw()));
        }
        String parser = product.getParser_name();
        List<Long> ids = new ArrayList<>();
        for (CategoryRef ref : refs) {
            String uid = text.trimToNull(ref.getUid());
            String title = text.trimToNull(ref.getTitle());
            if (uid == null && title == null) continue;
            String key = uid != null
                    ? parser + ":uid:" + uid
                    : parser + ":title:" + HashUtils.sha256Hex(title.toLowerCase(Locale.ROOT)).substring(0, 40);
            long id = catalog.upsertCategory(parser, key, uid, title, text.normalizeField(title));
            if (!ids.contains(id)) ids.add(id);
        }
        return ids;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
