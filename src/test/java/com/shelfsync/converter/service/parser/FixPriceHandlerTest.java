package com.shelfsync.converter.service.parser;

import com.shelfsync.converter.model.GeoInfo;
import com.shelfsync.converter.model.NormalizedProduct;
import com.shelfsync.converter.model.PackageUnit;
import com.shelfsync.converter.model.RawProduct;
import com.shelfsync.converter.model.Unit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FixPriceHandlerTest {
    private final FixPriceHandler handler = new FixPriceHandler(new TextNormalizer());

    private static RawProduct raw(String title) {
        RawProduct raw = new RawProduct();
        raw.setParser_name("fixprice");
        raw.setSource_id("fp-1");
        raw.setTitle(title);
        return raw;
    }

    @Test
    public void gramsBecomeKilogramPackage() {
        NormalizedProduct p = handler.normalize(raw("Chocolate 200 g"));
        assertEquals(Unit.PCE, p.getUnit());
        assertEquals(0.2, p.getPackage_quantity(), 1e-9);
        assertEquals(PackageUnit.KGM, p.getPackage_unit());
    }

    @Test
    public void litresStayLitres() {
        NormalizedProduct p = handler.normalize(raw("Milk 1 L"));
        assertEquals(Unit.PCE, p.getUnit());
        assertEquals(1.0, p.getPackage_quantity(), 1e-9);
        assertEquals(PackageUnit.LTR, p.getPackage_unit());
    }

    @Test
    public void soldByWeightHasNoCountOrPackage() {
        NormalizedProduct p = handler.normalize(raw("Potatoes by weight"));
        assertEquals(Unit.KGM, p.getUnit());
        assertNull(p.getAvailable_count());
        assertNull(p.getPackage_quantity());
        assertNull(p.getPackage_unit());
    }

    @Test
    public void commaSeparatedTitleYieldsNameAndBrand() {
        NormalizedProduct p = handler.normalize(raw("Шоколад молочный, Alpen Gold, 85 г"));
        assertEquals("Шоколад молочный", p.getTitle_original());
        assertEquals("Alpen Gold", p.getBrand());
        assertEquals("шоколад молочный alpen gold", p.getTitle_normalized());
        assertEquals(0.085, p.getPackage_quantity(), 1e-9);
        assertEquals(PackageUnit.KGM, p.getPackage_unit());
    }

    @Test
    public void appliesCategoryGeoAndCompositionRules() {
        RawProduct raw = raw("Сок яблочный 1 л");
        raw.setCategory("Напитки и соки");
        raw.setGeo(new GeoInfo("Российская Федерация", null, null));
        raw.setComposition("<p>Сахар ,какао-масло</p>");

        NormalizedProduct p = handler.normalize(raw);
        assertEquals("Напитки и соки", p.getCategory_raw());
        assertEquals("напитки", p.getCategory_normalized());
        assertEquals("россия", p.getGeo_normalized());
        assertEquals("Сахар ,какао-масло", p.getComposition_original());
        assertEquals("сахар, какао-масло", p.getComposition_normalized());
    }

    @Test
    public void receiverDeclaredValuesWinOverTitle() {
        RawProduct raw = raw("Chocolate 200 g");
        raw.setPackage_quantity(0.25);
        raw.setPackage_unit(PackageUnit.KGM);
        raw.setAvailable_count(3.0);

        NormalizedProduct p = handler.normalize(raw);
        assertEquals(0.25, p.getPackage_quantity(), 1e-9);
        assertEquals(3.0, p.getAvailable_count(), 1e-9);
    }

    @Test
    public void halfDeclaredPackageFallsBackToParsedPair() {
        RawProduct raw = raw("Milk 1 L");
        raw.setPackage_unit(PackageUnit.KGM);

        NormalizedProduct p = handler.normalize(raw);
        assertEquals(1.0, p.getPackage_quantity(), 1e-9);
        assertEquals(PackageUnit.LTR, p.getPackage_unit());
    }

    @Test
    public void declaredBulkUnitClearsCountAndPackage() {
        RawProduct raw = raw("Яблоки 1 кг");
        raw.setUnit(Unit.KGM);
        raw.setAvailable_count(4.0);

        NormalizedProduct p = handler.normalize(raw);
        assertEquals(Unit.KGM, p.getUnit());
        assertNull(p.getAvailable_count());
        assertNull(p.getPackage_quantity());
        assertNull(p.getPackage_unit());
    }

    @Test
    public void sameInputGivesEqualRecords() {
        NormalizedProduct a = handler.normalize(raw("Печенье, Юбилейное, 112 г"));
        NormalizedProduct b = handler.normalize(raw("Печенье, Юбилейное, 112 г"));
        assertEquals(a.getTitle_normalized(), b.getTitle_normalized());
        assertEquals(a.getBrand(), b.getBrand());
        assertEquals(a.getPackage_quantity(), b.getPackage_quantity());
    }
}
