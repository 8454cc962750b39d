package com.shelfsync.converter.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shelfsync.converter.model.CategoryRef;
import com.shelfsync.converter.model.GeoInfo;
import com.shelfsync.converter.model.PackageUnit;
import com.shelfsync.converter.model.RawProduct;
import com.shelfsync.converter.model.SyncCursor;
import com.shelfsync.converter.model.Unit;
import com.shelfsync.converter.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads receiver run artifacts ({@code run_artifacts} and its child tables) into
 * {@link RawProduct}s, in {@code (ingested_at, product id)} order.
 *
 * <p>Columns beyond the required set (prices, producer, flags, coordinates) are read when the
 * receiver has them.
 */
public class JdbcReceiverRepository implements ReceiverRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcReceiverRepository.class);

    static final String UNNAMED_PRODUCT = "Unnamed product";

    static final Map<String, Set<String>> REQUIRED_COLUMNS = Map.of(
            "run_artifacts", Set.of("id", "run_id", "source", "parser_name", "ingested_at"),
            "run_artifact_products", Set.of("id", "artifact_id", "sku", "plu", "title", "composition", "brand", "unit",
                    "available_count", "package_quantity", "package_unit", "categories_uid_json", "main_image", "sort_order"),
            "run_artifact_categories", Set.of("artifact_id", "uid", "title"),
            "run_artifact_administrative_units", Set.of("id", "artifact_id", "name", "region", "country"),
            "run_artifact_product_images", Set.of("product_id", "url", "sort_order")
    );

    private static final List<String> OPTIONAL_PRODUCT_COLUMNS = List.of(
            "source_id", "description", "price", "discount_price", "loyal_price", "price_unit",
            "producer_name", "producer_country", "rating", "reviews_count", "adult", "is_new", "promo", "hit");

    private final JdbcStore store;
    private final ObjectMapper mapper;
    private Set<String> optionalProductColumns = Set.of();
    private boolean adminCoordinates;
    private boolean schemaChecked;

    public JdbcReceiverRepository(JdbcStore store, ObjectMapper mapper) {
        this.store = store;
        this.mapper = mapper;
    }

    @Override
    public void checkSchema() {
        List<String> problems = new ArrayList<>();
        Map<String, Set<String>> present = new HashMap<>();
        for (String table : new TreeSet<>(REQUIRED_COLUMNS.keySet())) {
            Set<String> columns = store.columnsOf(table);
            present.put(table, columns);
            if (columns.isEmpty()) {
                problems.add("missing table " + table);
                continue;
            }
            for (String column : new TreeSet<>(REQUIRED_COLUMNS.get(table))) {
                if (!columns.contains(column)) problems.add("missing column " + table + "." + column);
            }
        }
        if (!problems.isEmpty()) {
            throw new IncompatibleSchemaException("Unsupported receiver schema at " + store.description() + ": "
                    + String.join(", ", problems));
        }
        Set<String> optional = new LinkedHashSet<>();
        for (String column : OPTIONAL_PRODUCT_COLUMNS) {
            if (present.get("run_artifact_products").contains(column)) optional.add(column);
        }
        optionalProductColumns = optional;
        Set<String> admin = present.get("run_artifact_administrative_units");
        adminCoordinates = admin.contains("latitude") && admin.contains("longitude");
        schemaChecked = true;
        log.debug("Receiver schema ok at {} (optional columns {})", store.description(), optional);
    }

    @Override
    public List<RawProduct> fetchBatch(String parserName, SyncCursor after, int limit) {
        if (!schemaChecked) checkSchema();
        String parser = parserName.trim().toLowerCase(Locale.ROOT);

        StringBuilder sql = new StringBuilder("SELECT p.id AS product_id, p.artifact_id, p.sku, p.plu, p.title, p.composition, "
                + "p.brand, p.unit, p.available_count, p.package_quantity, p.package_unit, p.categories_uid_json, "
                + "p.main_image, p.sort_order, a.run_id, a.source AS artifact_source, a.parser_name, a.ingested_at");
        for (String column : optionalProductColumns) {
            sql.append(", p.").append(column);
        }
        sql.append(" FROM run_artifact_products p JOIN run_artifacts a ON a.id = p.artifact_id"
                + " WHERE LOWER(a.parser_name) = :parser");
        MapSqlParameterSource params = new MapSqlParameterSource("parser", parser);
        if (after != null) {
            sql.append(" AND (a.ingested_at > :after OR (a.ingested_at = :after AND p.id > :afterId))");
            params.addValue("after", after.ingestedAt()).addValue("afterId", after.productId());
        }
        sql.append(" ORDER BY a.ingested_at ASC, p.id ASC LIMIT :limit");
        params.addValue("limit", Math.max(1, limit));

        List<Map<String, Object>> rows = store.named().query(sql.toString(), params, (rs, i) -> readRow(rs));
        if (rows.isEmpty()) return List.of();

        Set<Long> artifactIds = new TreeSet<>();
        Set<Long> productIds = new TreeSet<>();
        for (Map<String, Object> row : rows) {
            artifactIds.add((Long) row.get("artifact_id"));
            productIds.add((Long) row.get("product_id"));
        }
        Map<Long, Map<String, String>> categoryTitles = loadCategoryTitles(artifactIds);
        Map<Long, GeoInfo> geo = loadGeo(artifactIds);
        Map<Long, List<String>> images = loadImages(productIds);

        List<RawProduct> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            long artifactId = (Long) row.get("artifact_id");
            long productId = (Long) row.get("product_id");
            out.add(toRawProduct(row, parser,
                    categoryTitles.getOrDefault(artifactId, Map.of()),
                    geo.get(artifactId),
                    images.getOrDefault(productId, List.of())));
        }
        return out;
    }

    private Map<String, Object> readRow(ResultSet rs) throws SQLException {
        Map<String, Object> row = new HashMap<>();
        row.put("product_id", rs.getLong("product_id"));
        row.put("artifact_id", rs.getLong("artifact_id"));
        for (String column : List.of("sku", "plu", "title", "composition", "brand", "unit", "package_unit",
                "categories_uid_json", "main_image", "run_id", "artifact_source", "parser_name", "ingested_at")) {
            row.put(column, rs.getString(column));
        }
        row.put("available_count", rs.getObject("available_count"));
        row.put("package_quantity", rs.getObject("package_quantity"));
        row.put("sort_order", rs.getObject("sort_order"));
        for (String column : optionalProductColumns) {
            row.put(column, rs.getObject(column));
        }
        return row;
    }

    RawProduct toRawProduct(Map<String, Object> row, String parser, Map<String, String> categoryTitles,
                            GeoInfo geo, List<String> images) {
        RawProduct raw = new RawProduct();
        String parserName = trimToNull(row.get("parser_name"));
        raw.setParser_name(parserName != null ? parserName.toLowerCase(Locale.ROOT) : parser);

        String title = trimToNull(row.get("title"));
        raw.setTitle(title != null ? title : UNNAMED_PRODUCT);

        String runId = trimToNull(row.get("run_id"));
        Long productId = (Long) row.get("product_id");
        String sourceId = trimToNull(row.get("source_id"));
        if (sourceId == null && runId != null) {
            sourceId = "receiver:" + runId + ":" + productId;
        }
        raw.setSource_id(sourceId);
        raw.setRun_id(runId);
        raw.setPlu(trimToNull(row.get("plu")));
        raw.setSku(trimToNull(row.get("sku")));
        raw.setBrand(trimToNull(row.get("brand")));
        raw.setUnit(Unit.fromCode(trimToNull(row.get("unit"))));
        raw.setAvailable_count(toDouble(row.get("available_count")));
        raw.setPackage_quantity(toDouble(row.get("package_quantity")));
        raw.setPackage_unit(PackageUnit.fromCode(trimToNull(row.get("package_unit"))));
        raw.setComposition(trimToNull(row.get("composition")));

        List<String> uids = stringList(row.get("categories_uid_json"));
        List<CategoryRef> categories = new ArrayList<>();
        Set<String> seenTitles = new LinkedHashSet<>();
        List<String> titles = new ArrayList<>();
        for (String uid : uids) {
            String categoryTitle = trimToNull(categoryTitles.get(uid));
            if (categoryTitle == null) continue;
            categories.add(new CategoryRef(uid, categoryTitle));
            if (seenTitles.add(categoryTitle.toLowerCase(Locale.ROOT))) titles.add(categoryTitle);
        }
        raw.setCategories(categories);
        raw.setCategory(titles.isEmpty() ? null : String.join(" / ", titles));
        raw.setGeo(geo != null ? geo.copy() : null);

        List<String> imageUrls = new ArrayList<>(images);
        if (imageUrls.isEmpty()) {
            String mainImage = trimToNull(row.get("main_image"));
            if (mainImage != null) imageUrls.add(mainImage);
        }
        raw.setImage_urls(imageUrls);

        String ingestedAt = trimToNull(row.get("ingested_at"));
        Instant observed = Timestamps.parse(ingestedAt);
        raw.setObserved_at(observed != null ? observed : Instant.now());
        raw.setReceiver_ingested_at(ingestedAt != null ? ingestedAt : "");
        raw.setReceiver_product_id(productId);
        raw.setReceiver_artifact_id((Long) row.get("artifact_id"));
        raw.setReceiver_sort_order(toInteger(row.get("sort_order")));
        raw.setReceiver_source(trimToNull(row.get("artifact_source")));

        raw.setDescription(trimToNull(row.get("description")));
        raw.setPrice(toDouble(row.get("price")));
        raw.setDiscount_price(toDouble(row.get("discount_price")));
        raw.setLoyal_price(toDouble(row.get("loyal_price")));
        raw.setPrice_unit(trimToNull(row.get("price_unit")));
        raw.setProducer_name(trimToNull(row.get("producer_name")));
        raw.setProducer_country(trimToNull(row.get("producer_country")));
        raw.setRating(toDouble(row.get("rating")));
        raw.setReviews_count(toInteger(row.get("reviews_count")));
        raw.setAdult(toBoolean(row.get("adult")));
        raw.setIs_new(toBoolean(row.get("is_new")));
        raw.setPromo(toBoolean(row.get("promo")));
        raw.setHit(toBoolean(row.get("hit")));
        return raw;
    }

    private Map<Long, Map<String, String>> loadCategoryTitles(Set<Long> artifactIds) {
        Map<Long, Map<String, String>> out = new HashMap<>();
        store.named().query("SELECT artifact_id, uid, title FROM run_artifact_categories WHERE artifact_id IN (:ids)",
                new MapSqlParameterSource("ids", artifactIds), rs -> {
                    String uid = trimToNull(rs.getString("uid"));
                    String title = trimToNull(rs.getString("title"));
                    if (uid != null && title != null) {
                        out.computeIfAbsent(rs.getLong("artifact_id"), k -> new HashMap<>()).put(uid, title);
                    }
                });
        return out;
    }

    /** First administrative unit per artifact. */
    private Map<Long, GeoInfo> loadGeo(Set<Long> artifactIds) {
        String columns = adminCoordinates ? "artifact_id, name, region, country, latitude, longitude" : "artifact_id, name, region, country";
        Map<Long, GeoInfo> out = new HashMap<>();
        store.named().query("SELECT " + columns + " FROM run_artifact_administrative_units WHERE artifact_id IN (:ids) ORDER BY artifact_id, id",
                new MapSqlParameterSource("ids", artifactIds), rs -> {
                    long artifactId = rs.getLong("artifact_id");
                    if (out.containsKey(artifactId)) return;
                    GeoInfo geo = new GeoInfo(trimToNull(rs.getString("country")), trimToNull(rs.getString("region")),
                            trimToNull(rs.getString("name")));
                    if (adminCoordinates) {
                        geo.setLatitude(toDouble(rs.getObject("latitude")));
                        geo.setLongitude(toDouble(rs.getObject("longitude")));
                    }
                    out.put(artifactId, geo);
                });
        return out;
    }

    private Map<Long, List<String>> loadImages(Set<Long> productIds) {
        Map<Long, List<String>> out = new LinkedHashMap<>();
        store.named().query("SELECT product_id, url FROM run_artifact_product_images WHERE product_id IN (:ids) ORDER BY product_id ASC, sort_order ASC",
                new MapSqlParameterSource("ids", productIds), rs -> {
                    String url = trimToNull(rs.getString("url"));
                    if (url == null) return;
                    List<String> bucket = out.computeIfAbsent(rs.getLong("product_id"), k -> new ArrayList<>());
                    if (!bucket.contains(url)) bucket.add(url);
                });
        return out;
    }

    /** JSON array, comma-separated list or single value. */
    List<String> stringList(Object value) {
        String token = trimToNull(value);
        if (token == null) return List.of();
        List<String> out = new ArrayList<>();
        if (token.startsWith("[")) {
            try {
                JsonNode node = mapper.readTree(token);
                if (node.isArray()) {
                    for (JsonNode item : node) {
                        String s = trimToNull(item.isTextual() ? item.asText() : item.toString());
                        if (s != null) out.add(s);
                    }
                    return out;
                }
            } catch (JsonProcessingException e) {
                log.debug("categories_uid_json is not JSON, treating as text: {}", e.getOriginalMessage());
            }
        }
        for (String part : token.split(",")) {
            String s = part.trim();
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    private static String trimToNull(Object value) {
        if (value == null) return null;
        String token = value.toString().trim();
        return token.isEmpty() ? null : token;
    }

    private static Double toDouble(Object value) {
        if (value == null || value instanceof Boolean) return null;
        if (value instanceof Number n) return n.doubleValue();
        String token = trimToNull(value);
        if (token == null) return null;
        try {
            return Double.parseDouble(token.replace(',', '.'));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Integer toInteger(Object value) {
        Double d = toDouble(value);
        return d == null ? null : d.intValue();
    }

    private static Boolean toBoolean(Object value) {
        if (value == null) return null;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.intValue() != 0;
        String token = value.toString().trim().toLowerCase(Locale.ROOT);
        if (token.isEmpty()) return null;
        return token.equals("1") || token.equals("true") || token.equals("yes");
    }

    @Override
    public void close() {
        store.close();
    }
}
