package com.shelfsync.converter.service.conversion;

import com.shelfsync.converter.model.RawProduct;
import com.shelfsync.converter.repository.CatalogRepository;
import com.shelfsync.converter.repository.JdbcStoreFactory;
import com.shelfsync.converter.service.backfill.NullBackfillService;
import com.shelfsync.converter.service.identity.IdentityResolver;
import com.shelfsync.converter.service.image.ImageDedupService;
import com.shelfsync.converter.service.image.ImageDeleteException;
import com.shelfsync.converter.service.image.ImageStorageGateway;
import com.shelfsync.converter.service.image.UrlImageFingerprinter;
import com.shelfsync.converter.service.parser.FixPriceHandler;
import com.shelfsync.converter.service.parser.ParserHandlerRegistry;
import com.shelfsync.converter.service.parser.TextNormalizer;
import com.shelfsync.converter.util.JsonSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConversionPipelineTest {
    @TempDir
    Path dir;

    private CatalogRepository catalog;

    @BeforeEach
    public void setUp() {
        catalog = new JdbcStoreFactory(JsonSupport.objectMapper()).openCatalog(dir.resolve("catalog.db").toString());
        catalog.ensureSchema();
    }

    @AfterEach
    public void tearDown() {
        catalog.close();
    }

    private ConversionPipeline pipeline(ImageStorageGateway storage) {
        ParserHandlerRegistry registry = new ParserHandlerRegistry().register(new FixPriceHandler(new TextNormalizer()));
        return new ConversionPipeline(registry, new IdentityResolver(catalog),
                new ImageDedupService(catalog, new UrlImageFingerprinter(), storage, true),
                new NullBackfillService(), catalog);
    }

    private static RawProduct raw(String parser) {
        RawProduct raw = new RawProduct();
        raw.setParser_name(parser);
        raw.setSource_id("fp-1");
        raw.setTitle("Печенье, Юбилейное, 112 г");
        raw.setObserved_at(Instant.parse("2024-01-01T00:00:00Z"));
        raw.setImage_urls(List.of("https://cdn.example/1.jpg", "https://CDN.example/1.jpg?v=2"));
        return raw;
    }

    @Test
    public void successCarriesIdAndDedupedImages() {
        ConversionOutcome outcome = pipeline(ImageStorageGateway.DISABLED).convert(raw("fixprice"));
        assertTrue(outcome.isSuccess());
        assertNotNull(outcome.product().getCanonical_product_id());
        assertEquals(List.of("https://cdn.example/1.jpg"), outcome.product().getImage_urls());
        assertEquals(List.of("https://CDN.example/1.jpg?v=2"), outcome.product().getDuplicate_image_urls());
        assertEquals(1, outcome.product().getImage_fingerprints().size());
    }

    @Test
    public void unknownParserIsAFailureOutcome() {
        ConversionOutcome outcome = pipeline(ImageStorageGateway.DISABLED).convert(raw("magnit"));
        assertFalse(outcome.isSuccess());
        assertEquals(ConversionOutcome.FailureType.UNKNOWN_PARSER, outcome.failureType());
        assertNull(outcome.product());
    }

    @Test
    public void strictDeleteFailureIsAFailureOutcome() {
        ImageStorageGateway failing = new ImageStorageGateway() {
            @Override
            public boolean isManaged(String url) {
                return true;
            }

            @Override
            public void delete(String url) {
                throw new ImageDeleteException(url, "storage returned 503", null);
            }
        };
        ConversionOutcome outcome = pipeline(failing).convert(raw("fixprice"));
        assertEquals(ConversionOutcome.FailureType.IMAGE_DELETE, outcome.failureType());
        assertTrue(outcome.describeFailure().contains("storage returned 503"));
    }
}
