package com.shelfsync.converter.service.parser;

import com.shelfsync.converter.model.GeoInfo;
import com.shelfsync.converter.model.NormalizedProduct;
import com.shelfsync.converter.model.PackageUnit;
import com.shelfsync.converter.model.RawProduct;
import com.shelfsync.converter.model.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared normalization policy. Subclasses supply the title grammar and may refine
 * category, geo and composition normalization.
 *
 * <p>Receiver-declared unit, count and package values win over values parsed from the title.
 * Package quantity and unit are taken as a pair: when the receiver declares only one of them,
 * the parsed pair is used. Bulk products ({@code KGM}/{@code LTR}) never carry a count or a
 * package.
 */
public abstract class AbstractParserHandler implements ParserHandler {
    private static final Logger log = LoggerFactory.getLogger(AbstractParserHandler.class);

    public static final String TITLE_PARSE_FAILED = "TITLE_PARSE_FAILED";

    private final String parserName;
    private final TitleParser titleParser;
    protected final TextNormalizer text;

    protected AbstractParserHandler(String parserName, TitleParser titleParser, TextNormalizer text) {
        this.parserName = parserName;
        this.titleParser = titleParser;
        this.text = text;
    }

    @Override
    public String parserName() {
        return parserName;
    }

    @Override
    public NormalizedProduct normalize(RawProduct raw) {
        String rawTitle = raw.getTitle() != null ? raw.getTitle().trim() : "";
        NormalizedProduct out = new NormalizedProduct();
        out.setParser_name(parserName);
        out.setRaw_title(rawTitle);

        TitleParseResult title = null;
        try {
            title = titleParser.parse(rawTitle);
        } catch (RuntimeException e) {
            log.debug("Title grammar failed for {} '{}': {}", parserName, rawTitle, e.toString());
            out.addWarning(TITLE_PARSE_FAILED + ": " + e.getMessage());
        }

        if (title != null) {
            out.setTitle_original(title.nameOriginal());
            out.setTitle_normalized(title.nameNormalized());
            out.setTitle_original_no_stopwords(title.originalNoStopwords());
            out.setTitle_normalized_no_stopwords(title.normalizedNoStopwords());
            out.setBrand(title.brand() != null ? title.brand() : text.trimToNull(raw.getBrand()));
        } else {
            out.setTitle_original(rawTitle);
            out.setTitle_normalized(text.normalize(rawTitle));
            out.setTitle_original_no_stopwords(text.removeStopwords(rawTitle));
            out.setTitle_normalized_no_stopwords(text.removeStopwords(out.getTitle_normalized()));
            out.setBrand(text.trimToNull(raw.getBrand()));
        }
        applyUnitPolicy(raw, title, out);

        out.setPrice(raw.getPrice());
        out.setDiscount_price(raw.getDiscount_price());
        out.setLoyal_price(raw.getLoyal_price());
        out.setPrice_unit(text.trimToNull(raw.getPrice_unit()));
        out.setDescription(text.trimToNull(text.stripHtml(raw.getDescription())));
        out.setProducer_name(text.trimToNull(raw.getProducer_name()));
        out.setProducer_country(text.trimToNull(raw.getProducer_country()));
        out.setRating(raw.getRating());
        out.setReviews_count(raw.getReviews_count());
        out.setAdult(raw.getAdult());
        out.setIs_new(raw.getIs_new());
        out.setPromo(raw.getPromo());
        out.setHit(raw.getHit());

        out.setSource_id(text.trimToNull(raw.getSource_id()));
        out.setPlu(text.trimToNull(raw.getPlu()));
        out.setSku(text.trimToNull(raw.getSku()));

        out.setCategory_raw(text.trimToNull(raw.getCategory()));
        out.setCategory_normalized(normalizeCategory(raw.getCategory()));
        out.setCategories(raw.getCategories());
        String geo = raw.getGeoDisplay();
        out.setGeo_raw(geo);
        out.setGeo_normalized(normalizeGeo(geo));
        out.setGeo(raw.getGeo() != null ? raw.getGeo().copy() : null);
        String composition = text.stripHtml(raw.getComposition());
        out.setComposition_original(text.trimToNull(composition));
        out.setComposition_normalized(normalizeComposition(composition));

        out.setImage_urls(raw.getImage_urls());
        out.setObserved_at(raw.getObserved_at());
        out.setRun_id(raw.getRun_id());
        out.setReceiver_product_id(raw.getReceiver_product_id());
        out.setReceiver_artifact_id(raw.getReceiver_artifact_id());
        out.setReceiver_sort_order(raw.getReceiver_sort_order());
        out.setReceiver_source(raw.getReceiver_source());
        return out.copy();
    }

    private static void applyUnitPolicy(RawProduct raw, TitleParseResult title, NormalizedProduct out) {
        Unit unit = raw.getUnit() != null ? raw.getUnit() : (title != null ? title.unit() : null);
        Double count = raw.getAvailable_count() != null ? raw.getAvailable_count()
                : (title != null ? title.availableCount() : null);

        Double packageQuantity = raw.getPackage_quantity();
        PackageUnit packageUnit = raw.getPackage_unit();
        if (packageQuantity == null || packageUnit == null) {
            packageQuantity = title != null ? title.packageQuantity() : null;
            packageUnit = title != null ? title.packageUnit() : null;
        }

        if (unit != null && unit.isBulk()) {
            count = null;
            packageQuantity = null;
            packageUnit = null;
        }
        out.setUnit(unit);
        out.setAvailable_count(count);
        out.setPackage_quantity(packageQuantity);
        out.setPackage_unit(packageUnit);
    }

    protected String normalizeCategory(String category) {
        return text.normalizeField(category);
    }

    protected String normalizeGeo(String geo) {
        return text.normalizeField(geo);
    }

    protected String normalizeComposition(String composition) {
        return text.normalizeField(composition);
    }
}
