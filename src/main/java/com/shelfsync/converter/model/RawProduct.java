package com.shelfsync.converter.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Represents one scraped product row as read from the receiver store.
 * This is the input of the conversion pipeline and is never modified once read.
 *
 * <p>RawProduct carries:
 * <ul>
 *   <li>Natural keys (plu, sku, source_id) and the parser that produced the row</li>
 *   <li>Unit and package data as declared by the scraper, if any</li>
 *   <li>Category, geo, composition, price, producer and flag fields</li>
 *   <li>Ordered image URLs</li>
 *   <li>Receiver coordinates (artifact and product ids, run id) used for the sync cursor</li>
 * </ul>
 *
 * @see NormalizedProduct
 * @see com.shelfsync.converter.service.conversion.ConversionPipeline
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RawProduct {
    private String parser_name;
    private String source_id;
    private String plu;
    private String sku;
    private String run_id;
    /** Receiver ingestion time of the artifact this row belongs to */
    private Instant observed_at;

    private String title;
    private String brand;

    // As declared by the receiver; parsed values from the title are used when absent
    private Unit unit;
    private Double available_count;
    private Double package_quantity;
    private PackageUnit package_unit;

    /** Category titles joined with " / " in receiver order */
    private String category;
    private List<CategoryRef> categories = new ArrayList<>();
    private GeoInfo geo;
    private String composition;
    private String description;

    private Double price;
    private Double discount_price;
    private Double loyal_price;
    private String price_unit;

    private String producer_name;
    private String producer_country;
    private Double rating;
    private Integer reviews_count;
    private Boolean adult;
    private Boolean is_new;
    private Boolean promo;
    private Boolean hit;

    private List<String> image_urls = new ArrayList<>();

    private Long receiver_product_id;
    /** ingested_at exactly as stored by the receiver; the cursor compares on this value */
    private String receiver_ingested_at;
    private Long receiver_artifact_id;
    private Integer receiver_sort_order;
    private String receiver_source;

    public String getParser_name() { return parser_name; }
    public void setParser_name(String parser_name) { this.parser_name = parser_name; }
    public String getSource_id() { return source_id; }
    public void setSource_id(String source_id) { this.source_id = source_id; }
    public String getPlu() { return plu; }
    public void setPlu(String plu) { this.plu = plu; }
    public String getSku() { return sku; }
    public void setSku(String sku) { this.sku = sku; }
    public String getRun_id() { return run_id; }
    public void setRun_id(String run_id) { this.run_id = run_id; }
    public Instant getObserved_at() { return observed_at; }
    public void setObserved_at(Instant observed_at) { this.observed_at = observed_at; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
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
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public List<CategoryRef> getCategories() { return categories; }
    public void setCategories(List<CategoryRef> categories) { this.categories = categories != null ? categories : new ArrayList<>(); }
    public GeoInfo getGeo() { return geo; }
    public void setGeo(GeoInfo geo) { this.geo = geo; }
    public String getComposition() { return composition; }
    public void setComposition(String composition) { this.composition = composition; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public Double getPrice() { return price; }
    public void setPrice(Double price) { this.price = price; }
    public Double getDiscount_price() { return discount_price; }
    public void setDiscount_price(Double discount_price) { this.discount_price = discount_price; }
    public Double getLoyal_price() { return loyal_price; }
    public void setLoyal_price(Double loyal_price) { this.loyal_price = loyal_price; }
    public String getPrice_unit() { return price_unit; }
    public void setPrice_unit(String price_unit) { this.price_unit = price_unit; }
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
    public List<String> getImage_urls() { return image_urls; }
    public void setImage_urls(List<String> image_urls) { this.image_urls = image_urls != null ? image_urls : new ArrayList<>(); }
    public Long getReceiver_product_id() { return receiver_product_id; }
    public void setReceiver_product_id(Long receiver_product_id) { this.receiver_product_id = receiver_product_id; }
    public String getReceiver_ingested_at() { return receiver_ingested_at; }
    public void setReceiver_ingested_at(String receiver_ingested_at) { this.receiver_ingested_at = receiver_ingested_at; }
    public Long getReceiver_artifact_id() { return receiver_artifact_id; }
    public void setReceiver_artifact_id(Long receiver_artifact_id) { this.receiver_artifact_id = receiver_artifact_id; }
    public Integer getReceiver_sort_order() { return receiver_sort_order; }
    public void setReceiver_sort_order(Integer receiver_sort_order) { this.receiver_sort_order = receiver_sort_order; }
    public String getReceiver_source() { return receiver_source; }
    public void setReceiver_source(String receiver_source) { this.receiver_source = receiver_source; }

    @JsonIgnore
    public String getGeoDisplay() {
        return geo != null ? geo.displayName() : null;
    }
}
