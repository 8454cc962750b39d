package com.shelfsync.converter.service.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shelfsync.converter.model.CategoryRef;
import com.shelfsync.converter.model.GeoInfo;
import com.shelfsync.converter.model.NormalizedProduct;
import com.shelfsync.converter.repository.CatalogRepository;
import com.shelfsync.converter.repository.JdbcStoreFactory;
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

public class CatalogWriterTest {
    @TempDir
    Path dir;

    private CatalogRepository catalog;
    private CatalogWriter writer;

    @BeforeEach
    public void setUp() {
        ObjectMapper mapper = JsonSupport.objectMapper();
        catalog = new JdbcStoreFactory(mapper).openCatalog(dir.resolve("catalog.db").toString());
        catalog.ensureSchema();
        writer = new CatalogWriter(catalog, new SnapshotHasher(mapper), new ProjectionMerger(mapper), new TextNormalizer());
    }

    @AfterEach
    public void tearDown() {
        catalog.close();
    }

    private static NormalizedProduct product(String runId, String observedAt) {
        NormalizedProduct p = new NormalizedProduct();
        p.setParser_name("fixprice");
        p.setSource_id("fp-1");
        p.setTitle_original("Шоколад молочный");
        p.setBrand("Alpen Gold");
        p.setPrice(89.0);
        p.setRun_id(runId);
        p.setObserved_at(Instant.parse(observedAt));
        p.setCategories(List.of(new CategoryRef("c-1", "Сладости"), new CategoryRef(null, "Шоколад")));
        GeoInfo geo = new GeoInfo("Россия", "Москва", "Москва");
        geo.setLatitude(55.75);
        geo.setLongitude(37.61);
        p.setGeo(geo);
        return p;
    }

    @Test
    public void firstWriteAppendsSnapshotAndProjection() {
        WriteResult result = catalog.inTransaction(() -> writer.write("p-1", product("r1", "2024-01-01T00:00:00Z")));
        assertTrue(result.appended());
        assertEquals(1, catalog.loadHistory("p-1").size());
        NormalizedProduct projection = catalog.loadProjection("p-1").orElseThrow();
        assertEquals("p-1", projection.getCanonical_product_id());
        assertEquals("Alpen Gold", projection.getBrand());
    }

    @Test
    public void unchangedContentDoesNotAppend() {
        WriteResult first = writer.write("p-1", product("r1", "2024-01-01T00:00:00Z"));
        WriteResult second = writer.write("p-1", product("r2", "2024-01-02T00:00:00Z"));

        assertFalse(second.appended());
        assertEquals(first.snapshotId(), second.snapshotId());
        assertEquals(1, catalog.loadHistory("p-1").size());
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), catalog.loadProjection("p-1").orElseThrow().getObserved_at());
    }

    @Test
    public void changedContentAppendsAndKeepsOlderSnapshots() {
        writer.write("p-1", product("r1", "2024-01-01T00:00:00Z"));
        NormalizedProduct changed = product("r2", "2024-01-02T00:00:00Z");
        changed.setPrice(79.0);
        changed.setBrand(null);
        WriteResult result = writer.write("p-1", changed);

        assertTrue(result.appended());
        assertEquals(2, catalog.loadHistory("p-1").size());
        assertEquals(89.0, catalog.loadHistory("p-1").get(0).product().getPrice(), 1e-9);

        NormalizedProduct projection = catalog.loadProjection("p-1").orElseThrow();
        assertEquals(79.0, projection.getPrice(), 1e-9);
        assertEquals("Alpen Gold", projection.getBrand());
    }

    @Test
    public void productWithoutIdIsRejected() {
        assertThrows(CatalogWriteException.class, () -> writer.write(" ", product("r1", "2024-01-01T00:00:00Z")));
    }

    @Test
    public void failedTransactionLeavesNothingBehind() {
        assertThrows(IllegalStateException.class, () -> catalog.inTransaction(() -> {
            writer.write("p-1", product("r1", "2024-01-01T00:00:00Z"));
            throw new IllegalStateException("record failed");
        }));
        assertTrue(catalog.loadHistory("p-1").isEmpty());
        assertTrue(catalog.loadProjection("p-1").isEmpty());
    }
}
