package com.shelfsync.converter.service.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shelfsync.converter.dto.SyncDtos;
import com.shelfsync.converter.model.SyncCursor;
import com.shelfsync.converter.repository.CatalogRepository;
import com.shelfsync.converter.repository.IncompatibleSchemaException;
import com.shelfsync.converter.repository.JdbcStoreFactory;
import com.shelfsync.converter.repository.ReceiverFixture;
import com.shelfsync.converter.repository.StoreFactory;
import com.shelfsync.converter.service.image.ImageDeleteException;
import com.shelfsync.converter.service.image.ImageStorageGateway;
import com.shelfsync.converter.service.image.UrlImageFingerprinter;
import com.shelfsync.converter.service.parser.ChizhikHandler;
import com.shelfsync.converter.service.parser.FixPriceHandler;
import com.shelfsync.converter.service.parser.ParserHandlerRegistry;
import com.shelfsync.converter.service.parser.TextNormalizer;
import com.shelfsync.converter.service.parser.UnknownParserException;
import com.shelfsync.converter.util.JsonSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SyncEngineTest {
    @TempDir
    Path dir;

    private final ObjectMapper mapper = JsonSupport.objectMapper();
    private final TextNormalizer text = new TextNormalizer();
    private final StoreFactory stores = new JdbcStoreFactory(mapper);
    private ReceiverFixture receiver;
    private String catalogLocation;

    @BeforeEach
    public void setUp() {
        receiver = new ReceiverFixture(dir.resolve("receiver.db"));
        catalogLocation = dir.resolve("out/catalog.db").toString();
    }

    @AfterEach
    public void tearDown() {
        receiver.close();
    }

    private SyncEngine engine(ImageStorageGateway storage, boolean strict) {
        ParserHandlerRegistry registry = new ParserHandlerRegistry()
                .register(new FixPriceHandler(text))
                .register(new ChizhikHandler(text));
        return new SyncEngine(stores, registry, text, mapper, new UrlImageFingerprinter(), storage, strict);
    }

    private SyncEngine engine() {
        return engine(ImageStorageGateway.DISABLED, true);
    }

    private SyncJob job(int batchSize, int maxBatches) {
        return new SyncJob(receiver.location(), catalogLocation, "fixprice", batchSize, maxBatches, "run-x", "test");
    }

    private void seed(int count) {
        long artifact = receiver.artifact("run-1", "fixprice", "2024-01-01T10:00:00Z");
        for (int i = 1; i <= count; i++) {
            receiver.product(artifact, "fp-" + i, "Товар " + i + ", Бренд, 100 г", 10.0 * i);
        }
    }

    @Test
    public void fullRunConvertsEveryRowAndSavesCursor() {
        seed(5);
        List<SyncDtos.BatchEvent> events = new ArrayList<>();
        SyncDtos.SyncReport report = engine().run(job(2, 0), events::add);

        assertEquals(5, report.getProcessed());
        assertEquals(0, report.getFailed());
        assertEquals(3, report.getBatches());
        assertEquals(3, events.size());
        assertNotNull(report.getFinished_at());

        try (CatalogRepository catalog = stores.openCatalog(catalogLocation)) {
            SyncCursor cursor = catalog.loadCursor("fixprice").orElseThrow();
            assertEquals("2024-01-01T10:00:00Z", cursor.ingestedAt());
            assertEquals(report.getCursor_product_id().longValue(), cursor.productId());
        }
    }

    @Test
    public void secondRunResumesFromCursor() {
        seed(3);
        engine().run(job(10, 0));

        long artifact = receiver.artifact("run-2", "fixprice", "2024-01-02T10:00:00Z");
        receiver.product(artifact, "fp-1", "Товар 1, Бренд, 100 г", 12.0);
        receiver.product(artifact, "fp-2", "Товар 2, Бренд, 100 г", 20.0);

        SyncDtos.SyncReport second = engine().run(job(10, 0));
        assertEquals(2, second.total());
        // fp-1 changed price, fp-2 did not
        assertEquals(1, second.getProcessed());
        assertEquals(1, second.getSkipped());
        assertEquals("2024-01-02T10:00:00Z", second.getCursor_ingested_at());
    }

    @Test
    public void rerunWithoutNewRowsDoesNothing() {
        seed(2);
        engine().run(job(10, 0));
        SyncDtos.SyncReport again = engine().run(job(10, 0));
        assertEquals(0, again.total());
        assertEquals(0, again.getBatches());
    }

    @Test
    public void maxBatchesStopsEarly() {
        seed(5);
        SyncDtos.SyncReport report = engine().run(job(2, 1));
        assertEquals(1, report.getBatches());
        assertEquals(2, report.getProcessed());

        SyncDtos.SyncReport rest = engine().run(job(2, 0));
        assertEquals(3, rest.getProcessed());
    }

    @Test
    public void sameSourceKeepsItsCanonicalId() {
        seed(1);
        engine().run(job(10, 0));
        long artifact = receiver.artifact("run-2", "fixprice", "2024-01-03T10:00:00Z");
        receiver.product(artifact, "fp-1", "Товар 1, Бренд, 100 г", 99.0);
        engine().run(job(10, 0));

        try (CatalogRepository catalog = stores.openCatalog(catalogLocation)) {
            String id = catalog.findCanonicalId("fixprice", "source_id", "fp-1").orElseThrow();
            assertEquals(2, catalog.loadHistory(id).size());
            assertEquals(99.0, catalog.loadProjection(id).orElseThrow().getPrice(), 1e-9);
        }
    }

    @Test
    public void failedImageDeleteRollsBackOnlyThatRecord() {
        long artifact = receiver.artifact("run-1", "fixprice", "2024-01-01T10:00:00Z");
        long bad = receiver.product(artifact, "fp-bad", "Плохой товар, Бренд, 100 г", 10.0);
        receiver.image(bad, "https://storage.example/images/a.jpg", 1);
        receiver.image(bad, "https://storage.example/images//a.jpg", 2);
        receiver.product(artifact, "fp-good", "Хороший товар, Бренд, 100 г", 10.0);

        ImageStorageGateway failing = new ImageStorageGateway() {
            @Override
            public boolean isManaged(String url) {
                return true;
            }

            @Override
            public void delete(String url) {
                throw new ImageDeleteException(url, "storage returned 500", null);
            }
        };
        SyncDtos.SyncReport report = engine(failing, true).run(job(10, 0));
        assertEquals(1, report.getProcessed());
        assertEquals(1, report.getFailed());
        assertTrue(report.getFailures().get(0).startsWith("fp-bad"));

        try (CatalogRepository catalog = stores.openCatalog(catalogLocation)) {
            assertTrue(catalog.findCanonicalId("fixprice", "source_id", "fp-bad").isEmpty());
            assertTrue(catalog.findCanonicalId("fixprice", "source_id", "fp-good").isPresent());
        }
    }

    @Test
    public void lenientDeletesKeepTheRecord() {
        long artifact = receiver.artifact("run-1", "fixprice", "2024-01-01T10:00:00Z");
        long product = receiver.product(artifact, "fp-1", "Товар, Бренд, 100 г", 10.0);
        receiver.image(product, "https://storage.example/images/a.jpg", 1);
        receiver.image(product, "https://storage.example/images/a.jpg?v=2", 2);

        ImageStorageGateway failing = new ImageStorageGateway() {
            @Override
            public boolean isManaged(String url) {
                return true;
            }

            @Override
            public void delete(String url) {
                throw new ImageDeleteException(url, "timeout", null);
            }
        };
        SyncDtos.SyncReport report = engine(failing, false).run(job(10, 0));
        assertEquals(1, report.getProcessed());
        assertEquals(0, report.getFailed());
    }

    @Test
    public void incompatibleReceiverLeavesCatalogUntouched() {
        receiver.close();
        receiver = new ReceiverFixture(dir.resolve("old-receiver.db"), false);

        assertThrows(IncompatibleSchemaException.class, () -> engine().run(job(10, 0)));
        assertFalse(Files.exists(Path.of(catalogLocation)));
    }

    @Test
    public void unknownParserFailsBeforeOpeningStores() {
        SyncJob job = new SyncJob(receiver.location(), catalogLocation, "magnit", 10, 0, null, null);
        assertThrows(UnknownParserException.class, () -> engine().run(job));
        assertFalse(Files.exists(Path.of(catalogLocation)));
    }

    @Test
    public void jobValidatesItsParameters() {
        assertThrows(IllegalArgumentException.class, () -> new SyncJob(" ", catalogLocation, "fixprice", 10, 0, null, null));
        assertThrows(IllegalArgumentException.class, () -> new SyncJob("r.db", catalogLocation, "fixprice", 0, 0, null, null));
        assertThrows(IllegalArgumentException.class, () -> new SyncJob("r.db", catalogLocation, "fixprice", 10, -1, null, null));
        assertEquals("fixprice", new SyncJob("r.db", "c.db", " FixPrice ", 10, 0, null, null).parserName());
    }
}
