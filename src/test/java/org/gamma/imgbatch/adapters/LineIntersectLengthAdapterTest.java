package org.gamma.imgbatch.adapters;

import org.gamma.imgbatch.config.AlgorithmParams;
import org.gamma.imgbatch.config.ConfigurationException;
import org.gamma.imgbatch.config.GridParams;
import org.gamma.imgbatch.image.ImageCodec;
import org.gamma.imgbatch.image.TestImages;
import org.gamma.imgbatch.plugin.ProcessingOutcome;
import org.gamma.imgbatch.table.ResultRow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LineIntersectLengthAdapterTest {

    @TempDir
    Path tmp;

    private final LineIntersectLengthAdapter adapter = new LineIntersectLengthAdapter(new ImageCodec());

    private static AlgorithmParams grid(Integer size) {
        return new AlgorithmParams(null, null, null, null, null, null, null, null, new GridParams(size, null, null));
    }

    @Test
    void testProcess_countsCrossingsOfMask() throws IOException {
        Path mask = TestImages.writePng(tmp.resolve("in/a/mask.png"),
                TestImages.rectangles(20, 20, new int[]{5, 0, 1, 20}, new int[]{0, 3, 20, 1}));

        ProcessingOutcome outcome = adapter.process(ThresholdSegmentationAdapterTest.workItem(mask), grid(10));

        assertTrue(outcome.isClean());
        assertNull(outcome.artifact());
        ResultRow row = outcome.rows().get(0);
        assertEquals(10, row.get("GridSizePixels"));
        assertEquals(4, row.get("CrossingCount"));
        assertEquals(11.0 / 14.0 * 10 * 4, (Double) row.get("LengthPixels"), 1e-9);
    }

    @Test
    void testValidate_gridSizeRequired() throws ConfigurationException {
        adapter.validate(grid(14));
        assertThrows(ConfigurationException.class, () -> adapter.validate(AlgorithmParams.empty()));
        assertThrows(ConfigurationException.class, () -> adapter.validate(grid(null)));
        assertThrows(ConfigurationException.class, () -> adapter.validate(grid(-3)));
    }

    @Test
    void testLayoutDefaults() {
        assertFalse(adapter.producesArtifacts());
        assertEquals("Tennant Results.csv", adapter.defaultTableName());
        assertEquals(Path.of("in", "Tennant Results.csv"), adapter.defaultTablePath(Path.of("in"), Path.of("out")));
    }
}
