package org.gamma.imgbatch.adapters;

import org.gamma.imgbatch.config.AlgorithmParams;
import org.gamma.imgbatch.config.AlgorithmType;
import org.gamma.imgbatch.config.ConfigurationException;
import org.gamma.imgbatch.image.BinaryMask;
import org.gamma.imgbatch.image.GrayImage;
import org.gamma.imgbatch.image.Grids;
import org.gamma.imgbatch.image.ImageCodec;
import org.gamma.imgbatch.plugin.ProcessingOutcome;
import org.gamma.imgbatch.processing.WorkItem;
import org.gamma.imgbatch.table.ResultRow;
import org.gamma.imgbatch.table.TableSchema;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;

/**
 * Estimates object length on binary masks (segmentation artifacts) with the line-intersect method:
 * {@code length = 11/14 * gridSize * crossings}. Writes rows only.
 */
public class LineIntersectLengthAdapter extends AbstractImageAdapter {

    public LineIntersectLengthAdapter(ImageCodec codec) {
        super(codec);
    }

    @Override
    public AlgorithmType type() {
        return AlgorithmType.TENNANT;
    }

    @Override
    public String defaultTableName() {
        return "Tennant Results.csv";
    }

    @Override
    public boolean producesArtifacts() {
        return false;
    }

    @Override
    public Optional<TableSchema> schema(AlgorithmParams params) {
        return Optional.of(TableSchema.GRID);
    }

    @Override
    public void validate(AlgorithmParams params) throws ConfigurationException {
        if (params.grid() == null || params.grid().size() == null)
            throw new ConfigurationException("grid.size is required for line-intersect measurement");
        if (params.grid().size() <= 0)
            throw new ConfigurationException("grid.size must be positive");
    }

    @Override
    protected ProcessingOutcome analyze(WorkItem item, BufferedImage image, AlgorithmParams params) {
        int size = params.grid().size();
        BinaryMask mask = BinaryMask.threshold(GrayImage.fromImage(image, "gray"), 0.0, false);
        int crossings = Grids.countCrossings(mask, size);
        ResultRow row = ResultRow.builder()
                .add("ImageName", item.displayName())
                .add("GridSizePixels", size)
                .add("CrossingCount", crossings)
                .add("LengthPixels", Grids.tennantLength(size, crossings))
                .build();
        return ProcessingOutcome.success(null, List.of(row));
    }
}
