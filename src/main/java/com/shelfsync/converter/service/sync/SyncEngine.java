package com.shelfsync.converter.service.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shelfsync.converter.dto.SyncDtos;
import com.shelfsync.converter.model.RawProduct;
import com.shelfsync.converter.model.SyncCursor;
import com.shelfsync.converter.repository.CatalogRepository;
import com.shelfsync.converter.repository.ReceiverRepository;
import com.shelfsync.converter.repository.StoreFactory;
import com.shelfsync.converter.repository.StoreUnavailableException;
import com.shelfsync.converter.service.backfill.NullBackfillService;
import com.shelfsync.converter.service.catalog.CatalogWriter;
import com.shelfsync.converter.service.catalog.ProjectionMerger;
import com.shelfsync.converter.service.catalog.SnapshotHasher;
import com.shelfsync.converter.service.catalog.WriteResult;
import com.shelfsync.converter.service.conversion.ConversionOutcome;
import com.shelfsync.converter.service.conversion.ConversionPipeline;
import com.shelfsync.converter.service.identity.IdentityResolver;
import com.shelfsync.converter.service.image.ImageDedupService;
import com.shelfsync.converter.service.image.ImageFingerprinter;
import com.shelfsync.converter.service.image.ImageStorageGateway;
import com.shelfsync.converter.service.parser.ParserHandlerRegistry;
import com.shelfsync.converter.service.parser.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Moves receiver rows of one parser into the catalog, batch by batch from the stored cursor.
 *
 * <p>The receiver schema is checked before the catalog is even opened, so an incompatible
 * receiver leaves the catalog untouched. Each record is converted and written in its own catalog
 * transaction; a failed record is rolled back and counted, and the batch goes on. The cursor is
 * saved after every batch. Losing a store connection ends the run with
 * {@link StoreUnavailableException}.
 */
public class SyncEngine {
    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    private final StoreFactory stores;
    private final ParserHandlerRegistry registry;
    private final TextNormalizer text;
    private final ObjectMapper mapper;
    private final ImageFingerprinter fingerprinter;
    private final ImageStorageGateway storage;
    private final boolean strictDeletes;
    private final ReentrantLock identityLock = new ReentrantLock();

    public SyncEngine(StoreFactory stores, ParserHandlerRegistry registry, TextNormalizer text, ObjectMapper mapper,
                      ImageFingerprinter fingerprinter, ImageStorageGateway storage, boolean strictDeletes) {
        this.stores = stores;
        this.registry = registry;
        this.text = text;
        this.mapper = mapper;
        this.fingerprinter = fingerprinter;
        this.storage = storage;
        this.strictDeletes = strictDeletes;
    }

    public SyncDtos.SyncReport run(SyncJob job) {
        return run(job, BatchListener.NONE);
    }

    public SyncDtos.SyncReport run(SyncJob job, BatchListener listener) {
        return run(job, listener, new SyncDtos.SyncReport());
    }

    /**
     * Runs the job, counting into the caller's report. When the run throws, the report still holds
     * the batches and records handled before the failure.
     */
    public SyncDtos.SyncReport run(SyncJob job, BatchListener listener, SyncDtos.SyncReport report) {
        String parser = job.parserName();
        report.setParser_name(parser);
        report.setStarted_at(Instant.now());
        registry.resolve(parser);

        log.info("Sync {} started: receiver={} catalog={} batch_size={} max_batches={} run_id={} source={}",
                parser, job.receiverLocation(), job.catalogLocation(), job.batchSize(), job.maxBatches(), job.runId(), job.source());

        try (ReceiverRepository receiver = stores.openReceiver(job.receiverLocation())) {
            receiver.checkSchema();
            try (CatalogRepository catalog = stores.openCatalog(job.catalogLocation())) {
                catalog.ensureSchema();
                runBatches(job, receiver, catalog, report, listener);
            }
        } catch (DataAccessResourceFailureException e) {
            throw new StoreUnavailableException("Store connection lost during sync of " + parser + ": " + e.getMessage(), e);
        }

        report.setFinished_at(Instant.now());
        log.info("Sync {} finished: processed={} skipped={} failed={} batches={} cursor=({}, {})",
                parser, report.getProcessed(), report.getSkipped(), report.getFailed(), report.getBatches(),
                report.getCursor_ingested_at(), report.getCursor_product_id());
        return report;
    }

    private void runBatches(SyncJob job, ReceiverRepository receiver, CatalogRepository catalog,
                            SyncDtos.SyncReport report, BatchListener listener) {
        String parser = job.parserName();
        ConversionPipeline pipeline = new ConversionPipeline(registry,
                new IdentityResolver(catalog, identityLock),
                new ImageDedupService(catalog, fingerprinter, storage, strictDeletes),
                new NullBackfillService(),
                catalog);
        CatalogWriter writer = new CatalogWriter(catalog, new SnapshotHasher(mapper), new ProjectionMerger(mapper), text);

        SyncCursor cursor = catalog.loadCursor(parser).orElse(null);
        if (cursor != null) {
            report.setCursor_ingested_at(cursor.ingestedAt());
            report.setCursor_product_id(cursor.productId());
        }

        int batches = 0;
        while (job.maxBatches() == 0 || batches < job.maxBatches()) {
            List<RawProduct> rows = receiver.fetchBatch(parser, cursor, job.batchSize());
            if (rows.isEmpty()) break;
            batches++;

            for (RawProduct raw : rows) {
                processRecord(raw, pipeline, writer, catalog, report);
            }

            RawProduct last = rows.get(rows.size() - 1);
            SyncCursor next = new SyncCursor(last.getReceiver_ingested_at(), last.getReceiver_product_id());
            catalog.inTransaction(() -> {
                catalog.saveCursor(parser, next);
                return null;
            });
            cursor = next;
            report.setBatches(batches);
            report.setCursor_ingested_at(next.ingestedAt());
            report.setCursor_product_id(next.productId());
            log.info("Sync {} batch {}: {}/{} records, cursor=({}, {})",
                    parser, batches, rows.size(), report.total(), next.ingestedAt(), next.productId());
            listener.onBatch(new SyncDtos.BatchEvent(batches, rows.size(), report.total(), next.ingestedAt(), next.productId()));

            if (rows.size() < job.batchSize()) break;
        }
    }

    private void processRecord(RawProduct raw, ConversionPipeline pipeline, CatalogWriter writer,
                               CatalogRepository catalog, SyncDtos.SyncReport report) {
        String sourceId = raw.getSource_id();
        try {
            WriteResult result = catalog.inTransaction(() -> {
                ConversionOutcome outcome = pipeline.convert(raw);
                if (!outcome.isSuccess()) {
                    throw new RecordFailedException(outcome.describeFailure());
                }
                return writer.write(outcome.product().getCanonical_product_id(), outcome.product());
            });
            if (result.appended()) report.recordProcessed();
            else report.recordSkipped();
        } catch (DataAccessResourceFailureException | StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            String message = e instanceof RecordFailedException ? e.getMessage() : e.toString();
            log.warn("Record {} (receiver product {}) failed, rolled back: {}", sourceId, raw.getReceiver_product_id(), message);
            report.recordFailure(sourceId, message);
        }
    }

    /** Rolls back the record's transaction when conversion reports a failure. */
    private static class RecordFailedException extends RuntimeException {
        RecordFailedException(String message) {
            super(message);
        }
    }
}
