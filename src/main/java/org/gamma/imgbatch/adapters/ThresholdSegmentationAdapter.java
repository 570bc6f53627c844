package org.gamma.imgbatch.adapters;

import org.gamma.imgbatch.config.AlgorithmParams;
import org.gamma.imgbatch.config.AlgorithmType;
import org.gamma.imgbatch.image.GrayImage;
import org.gamma.imgbatch.image.ImageCodec;
import org.gamma.imgbatch.plugin.StageReport;

/**
 * Segments objects by a global threshold on one band.
 */
public class ThresholdSegmentationAdapter extends AbstractSegmentationAdapter {

    public ThresholdSegmentationAdapter(ImageCodec codec) {
        super(codec);
    }

    @Override
    public AlgorithmType type() {
        return AlgorithmType.THRESHOLDING;
    }

    @Override
    protected GrayImage response(GrayImage band, AlgorithmParams params, StageReport report) {
        return band;
    }

    @Override
    protected Double threshold(AlgorithmParams params) {
        return params.segmentation() == null ? null : params.segmentation().threshold();
    }
}
