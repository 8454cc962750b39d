package com.shelfsync.converter.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shelfsync.converter.model.GeoInfo;
import com.shelfsync.converter.model.NormalizedProduct;
import com.shelfsync.converter.model.ProductSnapshot;
import com.shelfsync.converter.model.SyncCursor;
import com.shelfsync.converter.util.HashUtils;
import com.shelfsync.converter.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * JDBC catalog store. SQL is shared between backends; subclasses supply the few dialect
 * fragments that differ (auto-increment ids, insert-or-ignore, last insert id, long text).
 *
 * <p>Timestamps are stored as fixed-width UTC strings, full records as JSON.
 */
public abstract class AbstractJdbcCatalogRepository implements CatalogRepository {
    private static final Logger log = LoggerFactory.getLogger(AbstractJdbcCatalogRepository.class);

    static final String CURSOR_KEY_PREFIX = "receiver_cursor:";

    protected final JdbcStore store;
    protected final JdbcTemplate jdbc;
    private final ObjectMapper mapper;

    protected AbstractJdbcCatalogRepository(JdbcStore store, ObjectMapper mapper) {
        this.store = store;
        this.jdbc = store.jdbc();
        this.mapper = mapper;
    }

    /** Column definition of an auto-increment primary key named {@code id}. */
    protected abstract String idColumn();

    protected abstract String longText();

    /** {@code INSERT} variant that silently skips rows violating a unique key. */
    protected abstract String insertIgnore();

    protected abstract String lastInsertIdSql();

    protected String tableOptions() {
        return "";
    }

    @Override
    public void ensureSchema() {
        for (String ddl : ddl()) {
            jdbc.execute(ddl);
        }
        requireColumns("catalog_products", Set.of("canonical_product_id", "latest_snapshot_id", "record_json"));
        requireColumns("catalog_product_snapshots", Set.of("canonical_product_id", "content_hash", "record_json"));
        requireColumns("catalog_product_sources", Set.of("parser_name", "source_id", "latest_snapshot_id"));
        requireColumns("catalog_identity_map", Set.of("parser_name", "identity_type", "identity_value", "canonical_product_id"));
        log.debug("Catalog schema ready at {}", store.description());
    }

    private void requireColumns(String table, Set<String> required) {
        Set<String> present = store.columnsOf(table);
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!present.contains(column)) missing.add(column);
        }
        if (!missing.isEmpty()) {
            throw new IncompatibleSchemaException("Catalog table " + table + " is missing columns " + missing);
        }
    }

    private List<String> ddl() {
        String id = idColumn();
        String text = longText();
        String opts = tableOptions();
        return List.of(
                "CREATE TABLE IF NOT EXISTS catalog_products ("
                        + "canonical_product_id VARCHAR(64) PRIMARY KEY, parser_name VARCHAR(64) NOT NULL, "
                        + "title_original TEXT, title_normalized TEXT, brand VARCHAR(255), unit VARCHAR(8), "
                        + "available_count DOUBLE, package_quantity DOUBLE, package_unit VARCHAR(8), "
                        + "category_normalized TEXT, geo_normalized TEXT, latest_snapshot_id BIGINT, "
                        + "observed_at VARCHAR(40), created_at VARCHAR(40) NOT NULL, updated_at VARCHAR(40) NOT NULL, "
                        + "record_json " + text + " NOT NULL)" + opts,
                "CREATE TABLE IF NOT EXISTS catalog_identity_map ("
                        + "parser_name VARCHAR(64) NOT NULL, identity_type VARCHAR(32) NOT NULL, "
                        + "identity_value VARCHAR(255) NOT NULL, canonical_product_id VARCHAR(64) NOT NULL, "
                        + "created_at VARCHAR(40) NOT NULL, PRIMARY KEY (parser_name, identity_type, identity_value))" + opts,
                "CREATE TABLE IF NOT EXISTS catalog_image_fingerprints ("
                        + "fingerprint VARCHAR(64) PRIMARY KEY, canonical_url TEXT NOT NULL, created_at VARCHAR(40) NOT NULL)" + opts,
                "CREATE TABLE IF NOT EXISTS catalog_image_urls ("
                        + "url_hash VARCHAR(64) PRIMARY KEY, url TEXT NOT NULL, fingerprint VARCHAR(64) NOT NULL, "
                        + "superseded INTEGER NOT NULL DEFAULT 0, superseded_by TEXT, "
                        + "created_at VARCHAR(40) NOT NULL, updated_at VARCHAR(40) NOT NULL)" + opts,
                "CREATE TABLE IF NOT EXISTS catalog_product_snapshots ("
                        + "id " + id + ", canonical_product_id VARCHAR(64) NOT NULL, parser_name VARCHAR(64) NOT NULL, "
                        + "source_id VARCHAR(255), run_id VARCHAR(64), content_hash VARCHAR(64) NOT NULL, "
                        + "observed_at VARCHAR(40), created_at VARCHAR(40) NOT NULL, record_json " + text + " NOT NULL)" + opts,
                "CREATE TABLE IF NOT EXISTS catalog_product_sources ("
                        + "parser_name VARCHAR(64) NOT NULL, source_id VARCHAR(255) NOT NULL, "
                        + "canonical_product_id VARCHAR(64) NOT NULL, latest_snapshot_id BIGINT NOT NULL, "
                        + "first_seen_at VARCHAR(40) NOT NULL, last_seen_at VARCHAR(40) NOT NULL, "
                        + "PRIMARY KEY (parser_name, source_id))" + opts,
                "CREATE TABLE IF NOT EXISTS catalog_categories ("
                        + "id " + id + ", category_key VARCHAR(255) NOT NULL UNIQUE, parser_name VARCHAR(64) NOT NULL, "
                        + "uid VARCHAR(128), title VARCHAR(255), title_normalized VARCHAR(255), "
                        + "created_at VARCHAR(40) NOT NULL, updated_at VARCHAR(40) NOT NULL)" + opts,
                "CREATE TABLE IF NOT EXISTS catalog_product_category_links ("
                        + "snapshot_id BIGINT NOT NULL, category_id BIGINT NOT NULL, "
                        + "is_primary INTEGER NOT NULL DEFAULT 0, sort_order INTEGER NOT NULL DEFAULT 0, "
                        + "PRIMARY KEY (snapshot_id, category_id))" + opts,
                "CREATE TABLE IF NOT EXISTS catalog_settlements ("
                        + "id " + id + ", geo_key VARCHAR(255) NOT NULL UNIQUE, country VARCHAR(255), "
                        + "region VARCHAR(255), name VARCHAR(255), name_normalized VARCHAR(255), "
                        + "created_at VARCHAR(40) NOT NULL, updated_at VARCHAR(40) NOT NULL)" + opts,
                "CREATE TABLE IF NOT EXISTS catalog_settlement_geodata ("
                        + "id " + id + ", settlement_id BIGINT NOT NULL, fingerprint VARCHAR(64) NOT NULL UNIQUE, "
                        + "latitude DOUBLE NOT NULL, longitude DOUBLE NOT NULL, created_at VARCHAR(40) NOT NULL)" + opts,
                "CREATE TABLE IF NOT EXISTS converter_sync_state ("
                        + "state_key VARCHAR(128) PRIMARY KEY, state_value TEXT NOT NULL, updated_at VARCHAR(40) NOT NULL)" + opts
        );
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return store.tx().execute(status -> work.get());
    }

    // --- identity

    @Override
    public Optional<String> findCanonicalId(String parserName, String identityType, String identityValue) {
        List<String> ids = jdbc.queryForList(
                "SELECT canonical_product_id FROM catalog_identity_map WHERE parser_name = ? AND identity_type = ? AND identity_value = ?",
                String.class, parserName, identityType, identityValue);
        return ids.stream().findFirst();
    }

    @Override
    public boolean isCanonicalIdInUse(String canonicalProductId) {
        Integer mapped = jdbc.queryForObject(
                "SELECT COUNT(*) FROM catalog_identity_map WHERE canonical_product_id = ?", Integer.class, canonicalProductId);
        Integer projected = jdbc.queryForObject(
                "SELECT COUNT(*) FROM catalog_products WHERE canonical_product_id = ?", Integer.class, canonicalProductId);
        return (mapped != null && mapped > 0) || (projected != null && projected > 0);
    }

    @Override
    public void insertIdentityIfAbsent(String parserName, String identityType, String identityValue, String canonicalProductId) {
        jdbc.update(insertIgnore() + " INTO catalog_identity_map (parser_name, identity_type, identity_value, canonical_product_id, created_at) VALUES (?, ?, ?, ?, ?)",
                parserName, identityType, identityValue, canonicalProductId, now());
    }

    // --- images

    @Override
    public Optional<String> findImageFingerprint(String url) {
        List<String> found = jdbc.queryForList(
                "SELECT fingerprint FROM catalog_image_urls WHERE url_hash = ?", String.class, HashUtils.sha256Hex(url));
        return found.stream().findFirst();
    }

    @Override
    public Optional<String> findCanonicalImageUrl(String fingerprint) {
        List<String> found = jdbc.queryForList(
                "SELECT canonical_url FROM catalog_image_fingerprints WHERE fingerprint = ?", String.class, fingerprint);
        return found.stream().findFirst();
    }

    @Override
    public void registerImage(String url, String fingerprint) {
        String now = now();
        jdbc.update(insertIgnore() + " INTO catalog_image_fingerprints (fingerprint, canonical_url, created_at) VALUES (?, ?, ?)",
                fingerprint, url, now);
        jdbc.update(insertIgnore() + " INTO catalog_image_urls (url_hash, url, fingerprint, superseded, created_at, updated_at) VALUES (?, ?, ?, 0, ?, ?)",
                HashUtils.sha256Hex(url), url, fingerprint, now, now);
    }

    @Override
    public void markImageSuperseded(String url, String supersededBy) {
        jdbc.update("UPDATE catalog_image_urls SET superseded = 1, superseded_by = ?, updated_at = ? WHERE url_hash = ?",
                supersededBy, now(), HashUtils.sha256Hex(url));
    }

    // --- snapshots

    private final RowMapper<ProductSnapshot> snapshotMapper = (rs, i) -> new ProductSnapshot(
            rs.getLong("id"),
            rs.getString("canonical_product_id"),
            rs.getString("parser_name"),
            rs.getString("source_id"),
            rs.getString("run_id"),
            rs.getString("content_hash"),
            Timestamps.parse(rs.getString("observed_at")),
            Timestamps.parse(rs.getString("created_at")),
            readRecord(rs.getString("record_json")));

    @Override
    public List<ProductSnapshot> loadHistory(String canonicalProductId) {
        return jdbc.query("SELECT * FROM catalog_product_snapshots WHERE canonical_product_id = ? ORDER BY observed_at ASC, id ASC",
                snapshotMapper, canonicalProductId);
    }

    @Override
    public Optional<ProductSnapshot> latestSnapshot(String canonicalProductId) {
        List<ProductSnapshot> rows = jdbc.query(
                "SELECT * FROM catalog_product_snapshots WHERE canonical_product_id = ? ORDER BY id DESC LIMIT 1",
                snapshotMapper, canonicalProductId);
        return rows.stream().findFirst();
    }

    @Override
    public long appendSnapshot(NormalizedProduct product, String contentHash) {
        jdbc.update("INSERT INTO catalog_product_snapshots (canonical_product_id, parser_name, source_id, run_id, content_hash, observed_at, created_at, record_json) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                product.getCanonical_product_id(), product.getParser_name(), product.getSource_id(), product.getRun_id(),
                contentHash, Timestamps.format(product.getObserved_at()), now(), writeRecord(product));
        return lastInsertId();
    }

    @Override
    public void linkSnapshotCategory(long snapshotId, long categoryId, boolean primary, int sortOrder) {
        jdbc.update(insertIgnore() + " INTO catalog_product_category_links (snapshot_id, category_id, is_primary, sort_order) VALUES (?, ?, ?, ?)",
                snapshotId, categoryId, primary ? 1 : 0, sortOrder);
    }

    @Override
    public void upsertSource(String parserName, String sourceId, String canonicalProductId, long snapshotId, Instant seenAt) {
        String seen = Timestamps.format(seenAt != null ? seenAt : Instant.now());
        int updated = jdbc.update("UPDATE catalog_product_sources SET canonical_product_id = ?, latest_snapshot_id = ?, "
                        + "last_seen_at = CASE WHEN last_seen_at < ? THEN ? ELSE last_seen_at END "
                        + "WHERE parser_name = ? AND source_id = ?",
                canonicalProductId, snapshotId, seen, seen, parserName, sourceId);
        if (updated == 0) {
            jdbc.update("INSERT INTO catalog_product_sources (parser_name, source_id, canonical_product_id, latest_snapshot_id, first_seen_at, last_seen_at) VALUES (?, ?, ?, ?, ?, ?)",
                    parserName, sourceId, canonicalProductId, snapshotId, seen, seen);
        }
    }

    // --- projection

    @Override
    public Optional<NormalizedProduct> loadProjection(String canonicalProductId) {
        List<String> json = jdbc.queryForList(
                "SELECT record_json FROM catalog_products WHERE canonical_product_id = ?", String.class, canonicalProductId);
        return json.stream().findFirst().map(this::readRecord);
    }

    @Override
    public void saveProjection(NormalizedProduct p, long snapshotId) {
        String now = now();
        Object[] values = {
                p.getParser_name(), p.getTitle_original(), p.getTitle_normalized(), p.getBrand(),
                p.getUnit() != null ? p.getUnit().name() : null, p.getAvailable_count(), p.getPackage_quantity(),
                p.getPackage_unit() != null ? p.getPackage_unit().name() : null, p.getCategory_normalized(),
                p.getGeo_normalized(), snapshotId, Timestamps.format(p.getObserved_at()), now, writeRecord(p),
                p.getCanonical_product_id()
        };
        int updated = jdbc.update("UPDATE catalog_products SET parser_name = ?, title_original = ?, title_normalized = ?, brand = ?, "
                + "unit = ?, available_count = ?, package_quantity = ?, package_unit = ?, category_normalized = ?, "
                + "geo_normalized = ?, latest_snapshot_id = ?, observed_at = ?, updated_at = ?, record_json = ? "
                + "WHERE canonical_product_id = ?", values);
        if (updated == 0) {
            jdbc.update("INSERT INTO catalog_products (parser_name, title_original, title_normalized, brand, unit, available_count, "
                    + "package_quantity, package_unit, category_normalized, geo_normalized, latest_snapshot_id, observed_at, "
                    + "updated_at, record_json, canonical_product_id, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    append(values, now));
        }
    }

    // --- reference data

    @Override
    public long upsertCategory(String parserName, String categoryKey, String uid, String title, String titleNormalized) {
        List<Long> ids = jdbc.queryForList("SELECT id FROM catalog_categories WHERE category_key = ?", Long.class, categoryKey);
        String now = now();
        if (ids.isEmpty()) {
            jdbc.update("INSERT INTO catalog_categories (category_key, parser_name, uid, title, title_normalized, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?)",
                    categoryKey, parserName, uid, title, titleNormalized, now, now);
            return lastInsertId();
        }
        long id = ids.get(0);
        jdbc.update("UPDATE catalog_categories SET uid = COALESCE(uid, ?), title = COALESCE(?, title), "
                        + "title_normalized = COALESCE(?, title_normalized), updated_at = ? WHERE id = ?",
                uid, title, titleNormalized, now, id);
        return id;
    }

    @Override
    public long upsertSettlement(String geoKey, GeoInfo geo, String nameNormalized) {
        List<Long> ids = jdbc.queryForList("SELECT id FROM catalog_settlements WHERE geo_key = ?", Long.class, geoKey);
        String now = now();
        if (ids.isEmpty()) {
            jdbc.update("INSERT INTO catalog_settlements (geo_key, country, region, name, name_normalized, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?)",
                    geoKey, geo.getCountry(), geo.getRegion(), geo.getName(), nameNormalized, now, now);
            return lastInsertId();
        }
        long id = ids.get(0);
        jdbc.update("UPDATE catalog_settlements SET country = COALESCE(country, ?), region = COALESCE(region, ?), "
                        + "name = COALESCE(name, ?), name_normalized = COALESCE(name_normalized, ?), updated_at = ? WHERE id = ?",
                geo.getCountry(), geo.getRegion(), geo.getName(), nameNormalized, now, id);
        return id;
    }

    @Override
    public void appendGeodata(long settlementId, String fingerprint, double latitude, double longitude) {
        jdbc.update(insertIgnore() + " INTO catalog_settlement_geodata (settlement_id, fingerprint, latitude, longitude, created_at) VALUES (?, ?, ?, ?, ?)",
                settlementId, fingerprint, latitude, longitude, now());
    }

    // --- cursor

    @Override
    public Optional<SyncCursor> loadCursor(String parserName) {
        List<String> values = jdbc.queryForList("SELECT state_value FROM converter_sync_state WHERE state_key = ?",
                String.class, CURSOR_KEY_PREFIX + parserName);
        if (values.isEmpty()) return Optional.empty();
        try {
            JsonNode node = mapper.readTree(values.get(0));
            String ingestedAt = node.path("ingested_at").asText(null);
            if (ingestedAt == null) return Optional.empty();
            return Optional.of(new SyncCursor(ingestedAt, node.path("product_id").asLong(0)));
        } catch (JsonProcessingException e) {
            throw new IncompatibleSchemaException("Unreadable sync cursor for " + parserName + ": " + e.getOriginalMessage());
        }
    }

    @Override
    public void saveCursor(String parserName, SyncCursor cursor) {
        ObjectNode node = mapper.createObjectNode();
        node.put("ingested_at", cursor.ingestedAt());
        node.put("product_id", cursor.productId());
        String key = CURSOR_KEY_PREFIX + parserName;
        String now = now();
        int updated = jdbc.update("UPDATE converter_sync_state SET state_value = ?, updated_at = ? WHERE state_key = ?",
                node.toString(), now, key);
        if (updated == 0) {
            jdbc.update("INSERT INTO converter_sync_state (state_key, state_value, updated_at) VALUES (?, ?, ?)",
                    key, node.toString(), now);
        }
    }

    @Override
    public void close() {
        store.close();
    }

    // --- helpers

    protected long lastInsertId() {
        Long id = jdbc.queryForObject(lastInsertIdSql(), Long.class);
        if (id == null) {
            throw new IllegalStateException("No generated id returned");
        }
        return id;
    }

    private String writeRecord(NormalizedProduct product) {
        try {
            return mapper.writeValueAsString(product);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize product record", e);
        }
    }

    private NormalizedProduct readRecord(String json) {
        try {
            return mapper.readValue(json, NormalizedProduct.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read stored product record", e);
        }
    }

    private static Object[] append(Object[] values, Object extra) {
        Object[] out = new Object[values.length + 1];
        System.arraycopy(values, 0, out, 0, values.length);
        out[values.length] = extra;
        return out;
    }

    private static String now() {
        return Timestamps.format(Instant.now());
    }
}
