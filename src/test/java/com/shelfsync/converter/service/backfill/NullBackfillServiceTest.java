package com.shelfsync.converter.service.backfill;

import com.shelfsync.converter.model.NormalizedProduct;
import com.shelfsync.converter.model.PackageUnit;
import com.shelfsync.converter.model.ProductSnapshot;
import com.shelfsync.converter.model.Unit;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NullBackfillServiceTest {
    private final NullBackfillService service = new NullBackfillService();

    private static NormalizedProduct record(String brand, String observedAt) {
        NormalizedProduct p = new NormalizedProduct();
        p.setParser_name("fixprice");
        p.setBrand(brand);
        p.setObserved_at(observedAt != null ? Instant.parse(observedAt) : null);
        return p;
    }

    private static ProductSnapshot snapshot(long id, NormalizedProduct p) {
        return new ProductSnapshot(id, "p-1", "fixprice", null, null, "h" + id, p.getObserved_at(), p.getObserved_at(), p);
    }

    @Test
    public void populatedFieldsAreNeverOverwritten() {
        NormalizedProduct candidate = record("Current", "2024-03-01T00:00:00Z");
        List<ProductSnapshot> history = List.of(snapshot(1, record("Old", "2024-01-01T00:00:00Z")));
        assertEquals("Current", service.backfill("p-1", candidate, history).getBrand());
    }

    @Test
    public void mostRecentNonEmptyValueWins() {
        NormalizedProduct older = record("Oldest", "2024-01-01T00:00:00Z");
        NormalizedProduct newer = record("Newer", "2024-02-01T00:00:00Z");
        NormalizedProduct blank = record("  ", "2024-02-15T00:00:00Z");
        NormalizedProduct candidate = record(null, "2024-03-01T00:00:00Z");

        NormalizedProduct out = service.backfill("p-1", candidate,
                List.of(snapshot(1, older), snapshot(2, newer), snapshot(3, blank)));
        assertEquals("Newer", out.getBrand());
    }

    @Test
    public void snapshotsFromTheFutureAreIgnored() {
        NormalizedProduct past = record("Past", "2024-01-01T00:00:00Z");
        NormalizedProduct future = record("Future", "2024-06-01T00:00:00Z");
        NormalizedProduct candidate = record(null, "2024-03-01T00:00:00Z");

        NormalizedProduct out = service.backfill("p-1", candidate, List.of(snapshot(1, past), snapshot(2, future)));
        assertEquals("Past", out.getBrand());
    }

    @Test
    public void fieldsWithoutHistoryStayEmpty() {
        NormalizedProduct candidate = record(null, null);
        candidate.setDescription("kept");
        NormalizedProduct out = service.backfill("p-1", candidate, List.of(snapshot(1, record(null, null))));
        assertNull(out.getBrand());
        assertEquals("kept", out.getDescription());
        assertNull(out.getComposition_original());
    }

    @Test
    public void inputsAreNotMutated() {
        NormalizedProduct past = record("Past", "2024-01-01T00:00:00Z");
        NormalizedProduct candidate = record(null, "2024-03-01T00:00:00Z");

        NormalizedProduct out = service.backfill("p-1", candidate, List.of(snapshot(1, past)));
        assertNotSame(candidate, out);
        assertNull(candidate.getBrand());
        assertEquals("Past", past.getBrand());
    }

    @Test
    public void packageIsCopiedAsAPairForPieceGoods() {
        NormalizedProduct past = record(null, "2024-01-01T00:00:00Z");
        past.setPackage_quantity(0.5);
        past.setPackage_unit(PackageUnit.LTR);
        NormalizedProduct candidate = record(null, "2024-03-01T00:00:00Z");
        candidate.setUnit(Unit.PCE);

        NormalizedProduct out = service.backfill("p-1", candidate, List.of(snapshot(1, past)));
        assertEquals(0.5, out.getPackage_quantity(), 1e-9);
        assertEquals(PackageUnit.LTR, out.getPackage_unit());
    }

    @Test
    public void bulkProductsNeverGetAPackage() {
        NormalizedProduct past = record(null, "2024-01-01T00:00:00Z");
        past.setPackage_quantity(1.0);
        past.setPackage_unit(PackageUnit.KGM);
        NormalizedProduct candidate = record(null, "2024-03-01T00:00:00Z");
        candidate.setUnit(Unit.KGM);

        NormalizedProduct out = service.backfill("p-1", candidate, List.of(snapshot(1, past)));
        assertNull(out.getPackage_quantity());
        assertNull(out.getPackage_unit());
    }
}
