package com.shelfsync.converter.service.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shelfsync.converter.model.NormalizedProduct;
import com.shelfsync.converter.util.HashUtils;

/**
 * Content hash of a normalized record. Fields that change on every pass without the product
 * changing (observation time, run id, receiver row coordinates) are left out.
 */
public class SnapshotHasher {
    private final ObjectMapper mapper;

    public SnapshotHasher(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String hash(NormalizedProduct product) {
        NormalizedProduct content = product.copy();
        content.setObserved_at(null);
        content.setRun_id(null);
        content.setReceiver_product_id(null);
        content.setReceiver_artifact_id(null);
        content.setReceiver_sort_order(null);
        content.setReceiver_source(null);
        try {
            return HashUtils.sha256Hex(mapper.writeValueAsString(content));
        } catch (JsonProcessingException e) {
            throw new CatalogWriteException("Cannot serialize product " + product.getCanonical_product_id(), e);
        }
    }
}
