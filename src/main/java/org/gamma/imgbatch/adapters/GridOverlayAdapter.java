package org.gamma.imgbatch.adapters;

import org.gamma.imgbatch.config.AlgorithmParams;
import org.gamma.imgbatch.config.AlgorithmType;
import org.gamma.imgbatch.config.ConfigurationException;
import org.gamma.imgbatch.config.GridParams;
import org.gamma.imgbatch.image.Grids;
import org.gamma.imgbatch.image.ImageCodec;
import org.gamma.imgbatch.plugin.ProcessingOutcome;
import org.gamma.imgbatch.processing.WorkItem;
import org.gamma.imgbatch.table.ResultRow;
import org.gamma.imgbatch.table.TableSchema;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Draws a square grid over each image for manual line-intersect scoring. The table lists every image with its grid
 * size; crossing counts and lengths are left blank for the scorer.
 */
public class GridOverlayAdapter extends AbstractImageAdapter {

    static final int DEFAULT_SIZE = 50;
    static final List<Integer> DEFAULT_COLOR = List.of(200, 0, 0);
    static final int DEFAULT_WEIGHT = 1;

    public GridOverlayAdapter(ImageCodec codec) {
        super(codec);
    }

    @Override
    public AlgorithmType type() {
        return AlgorithmType.FISHNET;
    }

    @Override
    public String defaultOutputDirName() {
        return "fishnet";
    }

    @Override
    public String defaultOutputExtension(String inputExtension) {
        return inputExtension;
    }

    @Override
    public String defaultTableName() {
        return "fishnet_images.csv";
    }

    @Override
    public Path defaultTablePath(Path inputRoot, Path outputRoot) {
        return outputRoot.resolve(defaultTableName());
    }

    @Override
    public Optional<TableSchema> schema(AlgorithmParams params) {
        return Optional.of(TableSchema.GRID);
    }

    @Override
    public void validate(AlgorithmParams params) throws ConfigurationException {
        GridParams grid = params.grid();
        if (grid == null) return;
        if (grid.size() != null && grid.size() <= 0) throw new ConfigurationException("grid.size must be positive");
        if (grid.weight() != null && grid.weight() <= 0) throw new ConfigurationException("grid.weight must be positive");
        if (grid.color() != null) {
            if (grid.color().size() != 3)
                throw new ConfigurationException("grid.color needs 3 values (8-bit RGB), got " + grid.color());
            for (Integer c : grid.color()) {
                if (c == null || c < 0 || c > 255)
                    throw new ConfigurationException("grid.color values must lie in [0, 255]: " + grid.color());
            }
        }
    }

    static int size(GridParams grid) {
        return grid == null || grid.size() == null ? DEFAULT_SIZE : grid.size();
    }

    @Override
    protected ProcessingOutcome analyze(WorkItem item, BufferedImage image, AlgorithmParams params) {
        GridParams grid = params.grid();
        int size = size(grid);
        List<Integer> rgb = grid == null || grid.color() == null ? DEFAULT_COLOR : grid.color();
        int weight = grid == null || grid.weight() == null ? DEFAULT_WEIGHT : grid.weight();

        BufferedImage overlay = Grids.drawGrid(image, size, new Color(rgb.get(0), rgb.get(1), rgb.get(2)), weight);
        ResultRow row = ResultRow.builder()
                .add("ImageName", item.displayName())
                .add("GridSizePixels", size)
                .add("CrossingCount", null)
                .add("LengthPixels", null)
                .build();
        return ProcessingOutcome.success(overlay, List.of(row));
    }
}
