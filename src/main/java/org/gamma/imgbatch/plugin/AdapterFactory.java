package org.gamma.imgbatch.plugin;

import org.gamma.imgbatch.adapters.GridOverlayAdapter;
import org.gamma.imgbatch.adapters.LineIntersectLengthAdapter;
import org.gamma.imgbatch.adapters.PreprocessingActionsAdapter;
import org.gamma.imgbatch.adapters.PreprocessingFiltersAdapter;
import org.gamma.imgbatch.adapters.RidgeSegmentationAdapter;
import org.gamma.imgbatch.adapters.ThresholdSegmentationAdapter;
import org.gamma.imgbatch.config.AlgorithmType;
import org.gamma.imgbatch.image.ImageCodec;

import java.util.Objects;

/**
 * Maps a configured algorithm family to a fresh adapter.
 */
public final class AdapterFactory {

    private AdapterFactory() {
    }

    public static ProcessorAdapter create(AlgorithmType type) {
        return create(type, new ImageCodec());
    }

    public static ProcessorAdapter create(AlgorithmType type, ImageCodec codec) {
        Objects.requireNonNull(type, "type");
        return switch (type) {
            case THRESHOLDING -> new ThresholdSegmentationAdapter(codec);
            case RIDGE_FILTER -> new RidgeSegmentationAdapter(codec);
            case PREPROCESSING_ACTIONS -> new PreprocessingActionsAdapter(codec);
            case PREPROCESSING_FILTERS -> new PreprocessingFiltersAdapter(codec);
            case FISHNET -> new GridOverlayAdapter(codec);
            case TENNANT -> new LineIntersectLengthAdapter(codec);
        };
    }
}
