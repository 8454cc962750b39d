package com.shelfsync.converter.repository;

import com.shelfsync.converter.model.RawProduct;
import com.shelfsync.converter.model.SyncCursor;

import java.util.List;

/** Read side of the receiver store. */
public interface ReceiverRepository extends AutoCloseable {

    /** Fails with {@link IncompatibleSchemaException} when a required table or column is missing. */
    void checkSchema();

    /**
     * Next rows of {@code parserName} strictly after {@code after} (null = from the start),
     * ordered by {@code (ingested_at, product_id)}.
     */
    List<RawProduct> fetchBatch(String parserName, SyncCursor after, int limit);

    @Override
    void close();
}
