package com.shelfsync.converter.service.backfill;

import com.shelfsync.converter.model.NormalizedProduct;
import com.shelfsync.converter.model.ProductSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Fills fields the current pass left empty from the product's earlier snapshots.
 *
 * <p>History is scanned newest to oldest and the first non-missing value is adopted. Snapshots
 * observed after the candidate are ignored, so reprocessing an old receiver row never pulls data
 * from the future. Populated candidate fields are never touched, and neither is the history.
 */
public class NullBackfillService {
    private static final Logger log = LoggerFactory.getLogger(NullBackfillService.class);

    private record Field<T>(String name, Function<NormalizedProduct, T> getter, BiConsumer<NormalizedProduct, T> setter) {
        boolean missingIn(NormalizedProduct p) {
            return isMissing(getter.apply(p));
        }

        void copy(NormalizedProduct from, NormalizedProduct to) {
            setter.accept(to, getter.apply(from));
        }
    }

    private static final List<Field<?>> FIELDS = List.of(
            new Field<String>("brand", NormalizedProduct::getBrand, NormalizedProduct::setBrand),
            new Field<String>("category_normalized", NormalizedProduct::getCategory_normalized, NormalizedProduct::setCategory_normalized),
            new Field<String>("geo_normalized", NormalizedProduct::getGeo_normalized, NormalizedProduct::setGeo_normalized),
            new Field<String>("composition_original", NormalizedProduct::getComposition_original, NormalizedProduct::setComposition_original),
            new Field<String>("composition_normalized", NormalizedProduct::getComposition_normalized, NormalizedProduct::setComposition_normalized),
            new Field<String>("description", NormalizedProduct::getDescription, NormalizedProduct::setDescription),
            new Field<String>("producer_name", NormalizedProduct::getProducer_name, NormalizedProduct::setProducer_name),
            new Field<String>("producer_country", NormalizedProduct::getProducer_country, NormalizedProduct::setProducer_country),
            new Field<String>("price_unit", NormalizedProduct::getPrice_unit, NormalizedProduct::setPrice_unit)
    );

    /**
     * @param history snapshots of {@code productId}, oldest first
     * @return a backfilled copy of {@code candidate}
     */
    public NormalizedProduct backfill(String productId, NormalizedProduct candidate, List<ProductSnapshot> history) {
        NormalizedProduct out = candidate.copy();
        if (history == null || history.isEmpty()) return out;
        Instant cutoff = candidate.getObserved_at();

        for (Field<?> field : FIELDS) {
            if (!field.missingIn(out)) continue;
            NormalizedProduct source = mostRecentWith(history, cutoff, field);
            if (source != null) {
                field.copy(source, out);
                log.debug("Backfilled {} of {} from history", field.name(), productId);
            }
        }

        // Package quantity and unit travel together and only for non-bulk products.
        if (out.getUnit() == null || !out.getUnit().isBulk()) {
            if (out.getPackage_quantity() == null && out.getPackage_unit() == null) {
                for (int i = history.size() - 1; i >= 0; i--) {
                    NormalizedProduct past = history.get(i).product();
                    if (!usable(history.get(i), cutoff) || past == null) continue;
                    if (past.getPackage_quantity() != null && past.getPackage_unit() != null) {
                        out.setPackage_quantity(past.getPackage_quantity());
                        out.setPackage_unit(past.getPackage_unit());
                        log.debug("Backfilled package of {} from history", productId);
                        break;
                    }
                }
            }
        }
        return out;
    }

    private static NormalizedProduct mostRecentWith(List<ProductSnapshot> history, Instant cutoff, Field<?> field) {
        for (int i = history.size() - 1; i >= 0; i--) {
            ProductSnapshot snapshot = history.get(i);
            if (!usable(snapshot, cutoff) || snapshot.product() == null) continue;
            if (!field.missingIn(snapshot.product())) return snapshot.product();
        }
        return null;
    }

    private static boolean usable(ProductSnapshot snapshot, Instant cutoff) {
        return cutoff == null || snapshot.observedAt() == null || !snapshot.observedAt().isAfter(cutoff);
    }

    static boolean isMissing(Object value) {
        if (value == null) return true;
        if (value instanceof String s) return s.isBlank();
        return false;
    }
}
