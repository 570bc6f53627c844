package org.gamma.imgbatch.adapters;

import org.gamma.imgbatch.config.AlgorithmParams;
import org.gamma.imgbatch.config.ConfigurationException;
import org.gamma.imgbatch.config.SegmentationParams;
import org.gamma.imgbatch.image.BinaryMask;
import org.gamma.imgbatch.image.Filters;
import org.gamma.imgbatch.image.Geometry;
import org.gamma.imgbatch.image.GrayImage;
import org.gamma.imgbatch.image.ImageCodec;
import org.gamma.imgbatch.image.Morphology;
import org.gamma.imgbatch.plugin.ProcessingOutcome;
import org.gamma.imgbatch.plugin.StageReport;
import org.gamma.imgbatch.processing.WorkItem;
import org.gamma.imgbatch.table.ResultRow;
import org.gamma.imgbatch.table.TableSchema;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shared pipeline of the segmentation adapters: foreground response, threshold, small-object removal and
 * skeleton geometry. The artifact is the object mask.
 */
public abstract class AbstractSegmentationAdapter extends AbstractImageAdapter {

    private static final Set<String> BANDS = Set.of("gray", "red", "green", "blue");

    protected AbstractSegmentationAdapter(ImageCodec codec) {
        super(codec);
    }

    @Override
    public Optional<TableSchema> schema(AlgorithmParams params) {
        SegmentationParams seg = params.segmentation();
        boolean binned = seg != null && seg.diameterBins() != null && !seg.diameterBins().isEmpty();
        return Optional.of(binned ? TableSchema.SEGMENTATION_BINNED : TableSchema.SEGMENTATION);
    }

    @Override
    public void validate(AlgorithmParams params) throws ConfigurationException {
        SegmentationParams seg = params.segmentation();
        if (seg == null) return;
        if (seg.band() != null && !BANDS.contains(seg.band().toLowerCase()))
            throw new ConfigurationException("segmentation.band must be one of " + BANDS + ", got '" + seg.band() + "'");
        if (seg.threshold() != null && (seg.threshold() < 0 || seg.threshold() > 1))
            throw new ConfigurationException("segmentation.threshold must lie in [0, 1], got " + seg.threshold());
        if (seg.minObjectSize() != null && seg.minObjectSize() < 0)
            throw new ConfigurationException("segmentation.minObjectSize must not be negative");
        List<Double> bins = seg.diameterBins();
        if (bins != null) {
            for (int i = 1; i < bins.size(); i++) {
                if (bins.get(i) <= bins.get(i - 1))
                    throw new ConfigurationException("segmentation.diameterBins must be strictly ascending: " + bins);
            }
        }
    }

    /**
     * Foreground response of the image; brighter means more likely object unless {@link #inverted} says otherwise.
     */
    protected abstract GrayImage response(GrayImage band, AlgorithmParams params, StageReport report);

    /**
     * Fixed threshold for the response, or {@code null} for Otsu.
     */
    protected abstract Double threshold(AlgorithmParams params);

    protected boolean inverted(AlgorithmParams params) {
        SegmentationParams seg = params.segmentation();
        return seg != null && Boolean.TRUE.equals(seg.invert());
    }

    @Override
    protected ProcessingOutcome analyze(WorkItem item, BufferedImage image, AlgorithmParams params) {
        SegmentationParams seg = params.segmentation();
        StageReport report = new StageReport(item.displayName());

        GrayImage band = GrayImage.fromImage(image, seg == null ? null : seg.band());
        boolean stretch = seg != null && Boolean.TRUE.equals(seg.contrastStretch());
        final GrayImage source = band;
        band = report.run("contrastStretch", stretch ? seg : null, band, () -> Filters.contrastStretch(source));

        GrayImage response = response(band, params, report);
        Double fixed = threshold(params);
        double threshold = fixed != null ? fixed : Filters.otsuThreshold(response);
        BinaryMask mask = BinaryMask.threshold(response, threshold, inverted(params));
        int minSize = seg == null || seg.minObjectSize() == null ? 0 : seg.minObjectSize();
        mask = Morphology.removeSmallObjects(mask, minSize);

        List<Double> bins = seg == null ? null : seg.diameterBins();
        boolean binned = bins != null && !bins.isEmpty();
        Geometry.Measurement m = Geometry.measure(mask, binned ? bins : null);
        List<ResultRow> rows = new ArrayList<>();
        if (binned) {
            for (Map.Entry<String, Double> e : m.lengthByDiameter().entrySet()) {
                rows.add(ResultRow.builder()
                        .add("ImageName", item.displayName())
                        .add("DiameterClass", e.getKey())
                        .add("Length", e.getValue())
                        .build());
            }
        } else {
            rows.add(ResultRow.builder()
                    .add("ImageName", item.displayName())
                    .add("Length", m.length())
                    .add("ObjectCount", m.objectCount())
                    .add("MeanDiameter", m.meanDiameter())
                    .build());
        }
        return ProcessingOutcome.success(mask.toImage(), rows, report.degradedCount());
    }
}
