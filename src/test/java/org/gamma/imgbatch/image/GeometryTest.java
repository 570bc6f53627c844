package org.gamma.imgbatch.image;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GeometryTest {

    private static BinaryMask horizontalLine(int length) {
        BinaryMask mask = new BinaryMask(length + 2, 3);
        for (int x = 1; x <= length; x++) mask.set(x, 1, true);
        return mask;
    }

    @Test
    void testMeasure_straightLine() {
        Geometry.Measurement m = Geometry.measure(horizontalLine(10), List.of());

        assertEquals(9.0, m.length(), 1e-9);
        assertEquals(1, m.objectCount());
        assertEquals(1.0, m.meanDiameter(), 1e-6);
        assertTrue(m.lengthByDiameter().isEmpty());
    }

    @Test
    void testMeasure_lengthByDiameterClass() {
        Geometry.Measurement m = Geometry.measure(horizontalLine(10), List.of(2.0));

        assertEquals(Map.of("<2.0", 9.0, ">=2.0", 0.0), m.lengthByDiameter());
    }

    @Test
    void testMeasure_emptyMask() {
        Geometry.Measurement m = Geometry.measure(new BinaryMask(5, 5), null);
        assertEquals(0.0, m.length());
        assertEquals(0, m.objectCount());
        assertEquals(0.0, m.meanDiameter());
    }

    @Test
    void testPixelLengths_isolatedPixelCountsOne() {
        BinaryMask mask = new BinaryMask(3, 3);
        mask.set(1, 1, true);
        float[] lengths = Geometry.pixelLengths(mask);
        assertEquals(1f, lengths[4]);
        assertEquals(0f, lengths[0]);
    }

    @Test
    void testPixelLengths_diagonalLinkCountsRootTwo() {
        BinaryMask mask = new BinaryMask(4, 4);
        mask.set(1, 1, true);
        mask.set(2, 2, true);
        float[] lengths = Geometry.pixelLengths(mask);
        assertEquals(Math.sqrt(2), lengths[5] + lengths[10], 1e-6);
    }

    @Test
    void testDiameterClasses() {
        List<Double> bins = List.of(2.0, 5.0);
        assertEquals(List.of("<2.0", "2.0-5.0", ">=5.0"), Geometry.diameterClasses(bins));
        assertEquals("<2.0", Geometry.diameterClass(bins, 1.0));
        assertEquals("2.0-5.0", Geometry.diameterClass(bins, 2.0));
        assertEquals(">=5.0", Geometry.diameterClass(bins, 5.0));
        assertTrue(Geometry.diameterClasses(List.of()).isEmpty());
    }
}
