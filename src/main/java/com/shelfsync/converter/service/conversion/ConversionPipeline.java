package com.shelfsync.converter.service.conversion;

import com.shelfsync.converter.model.NormalizedProduct;
import com.shelfsync.converter.model.RawProduct;
import com.shelfsync.converter.repository.CatalogRepository;
import com.shelfsync.converter.service.backfill.NullBackfillService;
import com.shelfsync.converter.service.identity.IdentityResolver;
import com.shelfsync.converter.service.image.ImageDedupResult;
import com.shelfsync.converter.service.image.ImageDedupService;
import com.shelfsync.converter.service.image.ImageDeleteException;
import com.shelfsync.converter.service.parser.ParserHandler;
import com.shelfsync.converter.service.parser.ParserHandlerRegistry;
import com.shelfsync.converter.service.parser.UnknownParserException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;

/**
 * Registry, handler, identity, image dedup, backfill; in that order, since dedup and backfill
 * are scoped to the canonical product. Failures of one record come back as an outcome instead
 * of an exception so the batch can go on. Losing the store connection is the exception.
 */
public class ConversionPipeline {
    private static final Logger log = LoggerFactory.getLogger(ConversionPipeline.class);

    private final ParserHandlerRegistry registry;
    private final IdentityResolver identityResolver;
    private final ImageDedupService imageDedup;
    private final NullBackfillService backfill;
    private final CatalogRepository catalog;

    public ConversionPipeline(ParserHandlerRegistry registry, IdentityResolver identityResolver,
                              ImageDedupService imageDedup, NullBackfillService backfill, CatalogRepository catalog) {
        this.registry = registry;
        this.identityResolver = identityResolver;
        this.imageDedup = imageDedup;
        this.backfill = backfill;
        this.catalog = catalog;
    }

    public ConversionOutcome convert(RawProduct raw) {
        ParserHandler handler;
        try {
            handler = registry.resolve(raw.getParser_name());
        } catch (UnknownParserException e) {
            return ConversionOutcome.failure(ConversionOutcome.FailureType.UNKNOWN_PARSER, e.getMessage());
        }
        try {
            NormalizedProduct normalized = handler.normalize(raw);
            String productId = identityResolver.resolve(handler.parserName(), normalized);
            normalized.setCanonical_product_id(productId);

            ImageDedupResult images = imageDedup.dedupe(productId, normalized.getImage_urls());
            normalized.setImage_urls(images.kept());
            normalized.setDuplicate_image_urls(images.removed());
            normalized.setImage_fingerprints(images.fingerprints());

            NormalizedProduct result = backfill.backfill(productId, normalized, catalog.loadHistory(productId));
            log.debug("Converted {} {} -> {}", handler.parserName(), raw.getSource_id(), productId);
            return ConversionOutcome.success(result);
        } catch (ImageDeleteException e) {
            return ConversionOutcome.failure(ConversionOutcome.FailureType.IMAGE_DELETE, e.getMessage());
        } catch (DataAccessResourceFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            return ConversionOutcome.failure(ConversionOutcome.FailureType.CONVERSION_ERROR, e.toString());
        }
    }
}
