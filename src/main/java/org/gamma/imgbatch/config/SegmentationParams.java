package org.gamma.imgbatch.config;

import java.util.List;

// band: gray | red | green | blue. threshold in [0,1]; null selects Otsu.
public record SegmentationParams(String band, Boolean contrastStretch, Double threshold, Boolean invert,
                                 Integer minObjectSize, List<Double> diameterBins) {
}
