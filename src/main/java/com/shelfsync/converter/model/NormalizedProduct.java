package com.shelfsync.converter.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Parser-independent product record built by a parser handler from one {@link RawProduct}.
 *
 * <p>After the handler returns, the conversion pipeline stamps the canonical product id,
 * replaces the image list with the deduplicated one and may backfill null fields from
 * earlier snapshots. The whole record is what gets stored in a product snapshot and in the
 * current catalog projection.
 *
 * <p>Fields use the same snake_case names as their JSON form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NormalizedProduct {
    private String parser_name;

    // Title
    private String raw_title;
    private String title_original;
    private String title_normalized;
    private String title_original_no_stopwords;
    private String title_normalized_no_stopwords;
    private String brand;

    // Unit policy: PCE + package_* for packaged items, KGM/LTR with null count/package for bulk
    private Unit unit;
    private Double available_count;
    private Double package_quantity;
    private PackageUnit package_unit;

    // Prices
    private Double price;
    private Double discount_price;
    private Double loyal_price;
    private String price_unit;

    private String description;
    private String producer_name;
    private String producer_country;
    private Double rating;
    private Integer reviews_count;
    private Boolean adult;
    private Boolean is_new;
    private Boolean promo;
    private Boolean hit;

    // Identity
    private String source_id;
    private String plu;
    private String sku;
    private String canonical_product_id;

    private String category_raw;
    private String category_normalized;
    private List<CategoryRef> categories = new ArrayList<>();

    private String geo_raw;
    private String geo_normalized;
    private GeoInfo geo;

    private String composition_original;
    private String composition_normalized;

    // Images after dedup
    private List<String> image_urls = new ArrayList<>();
    private List<String> duplicate_image_urls = new ArrayList<>();
    private List<String> image_fingerprints = new ArrayList<>();

    // Receiver coordinates, excluded from the snapshot content hash
    private Instant observed_at;
    private String run_id;
    private Long receiver_product_id;
    private Long receiver_artifact_id;
    private Integer receiver_sort_order;
    private String receiver_source;

    private List<String> warnings = new ArrayList<>();

    public NormalizedProduct() {}

    /** Field-by-field copy; lists and nested objects are copied too. */
    public NormalizedProduct copy() {
        NormalizedProduct c = new NormalizedProduct();
        c.parser_name = parser_name;
        c.raw_title = raw_title;
        c.title_original = title_original;
        c.title_normalized = title_normalized;
        c.title_original_no_stopwords = title_original_no_stopwords;
        c.title_normalized_no_stopwords = title_normalized_no_stopwords;
        c.brand = brand;
        c.unit = unit;
        c.available_count = available_count;
        c.package_quantity = package_quantity;
        c.package_unit = package_unit;
        c.price = price;
        c.discount_price = discount_price;
        c.loyal_price = loyal_price;
        c.price_unit = price_unit;
        c.description = description;
        c.producer_name = producer_name;
        c.producer_country = producer_country;
        c.rating = rating;
        c.reviews_count = reviews_count;
        c.adult = adult;
        c.is_new = is_new;
        c.promo = promo;
        c.hit = hit;
        c.source_id = source_id;
        c.plu = plu;
        c.sku = sku;
        c.canonical_product_id = canonical_product_id;
        c.category_raw = category_raw;
        c.category_normalized = category_normalized;
        for (CategoryRef ref : categories) {
            c.categories.add(new CategoryRef(ref.getUid(), ref.getTitle()));
        }
        c.geo_raw = geo_raw;
        c.geo_normalized = geo_normalized;
        c.geo = geo != null ? geo.copy() : null;
        c.composition_original = composition_original;
        c.composition_normalized = composition_normalized;
        c.image_urls = new ArrayList<>(image_urls);
        c.duplicate_image_urls = new ArrayList<>(duplicate_image_urls);
        c.image_fingerprints = new ArrayList<>(image_fingerprints);
        c.observed_at = observed_at;
        c.run_id = run_id;
        c.receiver_product_id = receiver_product_id;
        c.receiver_artifact_id = receiver_artifact_id;
        c.receiver_sort_order = receiver_sort_order;
        c.receiver_source = receiver_source;
        c.warnings = new ArrayList<>(warnings);
        return c;
    }

    @JsonIgnore
    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public String getParser_name() { return parser_name; }
    public void setParser_name(String parser_name) { this.parser_name = parser_name; }
    public String getRaw_title() { return raw_title; }
    public void setRaw_title(String raw_title) { this.raw_title = raw_title; }
    public String getTitle_original() { return title_original; }
    public void setTitle_original(String title_original) { this.title_original = title_original; }
    public String getTitle_normalized() { return title_normalized; }
    public void setTitle_normalized(String title_normalized) { this.title_normalized = title_normalized; }
    public String getTitle_original_no_stopwords() { return title_original_no_stopwords; }
    public void setTitle_original_no_stopwords(String v) { this.title_original_no_stopwords = v; }
    public String getTitle_normalized_no_stopwords() { return title_normalized_no_stopwords; }
    public void setTitle_normalized_no_stopwords(String v) { this.title_normalized_no_stopwords = v; }
    public String getBrand() { return brand; }
    public void setBrand(String brand) { this.brand = brand; }
    public Unit getUnit() { return unit; }
    public void setUnit(Unit unit) { this.unit = unit; }
    public Double getAvailable_count() { return available_count; }
    public void setAvailable_count(Double available_count) { this.available_count = available_count; }
    public Double getPackage_quantity() { return package_quantity; }
    public void setPackage_quantity(Double package_quantity) { this.package_quantity = package_quantity; }
    public PackageUnit getPackage_unit() { return package_unit; }
    public void setPackage_unit(PackageUnit package_unit) { this.package_unit = package_unit; }
    public Double getPrice() { return price; }
    public void setPrice(Double price) { this.price = price; }
    public Double getDiscount_price() { return discount_price; }
    public void setDiscount_price(Double discount_price) { this.discount_price = discount_price; }
    public Double getLoyal_price() { return loyal_price; }
    public void setLoyal_price(Double loyal_price) { this.loyal_price = loyal_price; }
    public String getPrice_unit() { return price_unit; }
    public void setPrice_unit(String price_unit) { this.price_unit = price_unit; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getProducer_name() { return producer_name; }
    public void setProducer_name(String producer_name) { this.producer_name = producer_name; }
    public String getProducer_country() { return producer_country; }
    public void setProducer_country(String producer_country) { this.producer_country = producer_country; }
    public Double getRating() { return rating; }
    public void setRating(Double rating) { this.rating = rating; }
    public Integer getReviews_count() { return reviews_count; }
    public void setReviews_count(Integer reviews_count) { this.reviews_count = reviews_count; }
    public Boolean getAdult() { return adult; }
    public void setAdult(Boolean adult) { this.adult = adult; }
    public Boolean getIs_new() { return is_new; }
    public void setIs_new(Boolean is_new) { this.is_new = is_new; }
    public Boolean getPromo() { return promo; }
    public void setPromo(Boolean promo) { this.promo = promo; }
    public Boolean getHit() { return hit; }
    public void setHit(Boolean hit) { this.hit = hit; }
    public String getSource_id() { return source_id; }
    public void setSource_id(String source_id) { this.source_id = source_id; }
    public String getPlu() { return plu; }
    public void setPlu(String plu) { this.plu = plu; }
    public String getSku() { return sku; }
    public void setSku(String sku) { this.sku = sku; }
    public String getCanonical_product_id() { return canonical_product_id; }
    public void setCanonical_product_id(String canonical_product_id) { this.canonical_product_id = canonical_product_id; }
    public String getCategory_raw() { return category_raw; }
    public void setCategory_raw(String category_raw) { this.category_raw = category_raw; }
    public String getCategory_normalized() { return category_normalized; }
    public void setCategory_normalized(String category_normalized) { this.category_normalized = category_normalized; }
    public List<CategoryRef> getCategories() { return categories; }
    public void setCategories(List<CategoryRef> categories) { this.categories = categories != null ? categories : new ArrayList<>(); }
    public String getGeo_raw() { return geo_raw; }
    public void setGeo_raw(String geo_raw) { this.geo_raw = geo_raw; }
    public String getGeo_normalized() { return geo_normalized; }
    public void setGeo_normalized(String geo_normalized) { this.geo_normalized = geo_normalized; }
    public GeoInfo getGeo() { return geo; }
    public void setGeo(GeoInfo geo) { this.geo = geo; }
    public String getComposition_original() { return composition_original; }
    public void setComposition_original(String composition_original) { this.composition_original = composition_original; }
    public String getComposition_normalized() { return composition_normalized; }
    public void setComposition_normalized(String composition_normalized) { this.composition_normalized = composition_normalized; }
    public List<String> getImage_urls() { return image_urls; }
    public void setImage_urls(List<String> image_urls) { this.image_urls = image_urls != null ? image_urls : new ArrayList<>(); }
    public List<String> getDuplicate_image_urls() { return duplicate_image_urls; }
    public void setDuplicate_image_urls(List<String> v) { this.duplicate_image_urls = v != null ? v : new ArrayList<>(); }
    public List<String> getImage_fingerprints() { return image_fingerprints; }
    public void setImage_fingerprints(List<String> v) { this.image_fingerprints = v != null ? v : new ArrayList<>(); }
    public Instant getObserved_at() { return observed_at; }
    public void setObserved_at(Instant observed_at) { this.observed_at = observed_at; }
    public String getRun_id() { return run_id; }
    public void setRun_id(String run_id) { this.run_id = run_id; }
    public Long getReceiver_product_id() { return receiver_product_id; }
    public void setReceiver_product_id(Long receiver_product_id) { this.receiver_product_id = receiver_product_id; }
    public Long getReceiver_artifact_id() { return receiver_artifact_id; }
    public void setReceiver_artifact_id(Long receiver_artifact_id) { this.receiver_artifact_id = receiver_artifact_id; }
    public Integer getReceiver_sort_order() { return receiver_sort_order; }
    public void setReceiver_sort_order(Integer receiver_sort_order) { this.receiver_sort_order = receiver_sort_order; }
    public String getReceiver_source() { return receiver_source; }
    public void setReceiver_source(String receiver_source) { this.receiver_source = receiver_source; }
    public List<String> getWarnings() { return warnings; }
    public void setWarnings(List<String> warnings) { this.warnings = warnings != null ? warnings : new ArrayList<>(); }
}
