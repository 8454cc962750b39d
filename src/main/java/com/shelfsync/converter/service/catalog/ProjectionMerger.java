package com.shelfsync.converter.service.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shelfsync.converter.model.NormalizedProduct;
import com.shelfsync.converter.util.Timestamps;

import java.util.Iterator;
import java.util.Map;

/**
 * Non-destructive merge of a new record into the current projection: a present value
 * overwrites, a null, blank or empty-list value never clears what the projection already has.
 * The canonical id of the projection is kept and {@code observed_at} only moves forward.
 * Two fields are exceptions: {@code warnings} are those of the incoming record, and a bulk
 * ({@code KGM}/{@code LTR}) projection carries no package.
 */
public class ProjectionMerger {
    private final ObjectMapper mapper;

    public ProjectionMerger(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public NormalizedProduct merge(NormalizedProduct existing, NormalizedProduct incoming) {
        if (existing == null) return incoming.copy();
        ObjectNode merged = mapper.valueToTree(existing);
        JsonNode update = mapper.valueToTree(incoming);

        mergeInto(merged, update);
        if (existing.getCanonical_product_id() != null) {
            merged.put("canonical_product_id", existing.getCanonical_product_id());
        }
        merged.put("observed_at", Timestamps.format(Timestamps.max(existing.getObserved_at(), incoming.getObserved_at())));
        if (merged.get("observed_at").isNull()) merged.remove("observed_at");

        // Warnings describe the latest normalization only.
        JsonNode warnings = update.get("warnings");
        merged.set("warnings", warnings != null && warnings.isArray() ? warnings : mapper.createArrayNode());

        try {
            NormalizedProduct result = mapper.treeToValue(merged, NormalizedProduct.class);
            if (result.getUnit() != null && result.getUnit().isBulk()) {
                result.setPackage_quantity(null);
                result.setPackage_unit(null);
            }
            return result;
        } catch (JsonProcessingException e) {
            throw new CatalogWriteException("Cannot merge projection of " + existing.getCanonical_product_id(), e);
        }
    }

    /** Objects merge field by field, arrays replace as a whole. */
    private static void mergeInto(ObjectNode target, JsonNode update) {
        Iterator<Map.Entry<String, JsonNode>> fields = update.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (isEmpty(value)) continue;
            JsonNode current = target.get(field.getKey());
            if (value.isObject() && current != null && current.isObject()) {
                mergeInto((ObjectNode) current, value);
            } else {
                target.set(field.getKey(), value);
            }
        }
    }

    private static boolean isEmpty(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) return true;
        if (value.isTextual()) return value.asText().isBlank();
        if (value.isContainerNode()) return value.isEmpty();
        return false;
    }
}
