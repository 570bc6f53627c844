package org.gamma.imgbatch.adapters;

import org.gamma.imgbatch.config.AlgorithmParams;
import org.gamma.imgbatch.config.AlgorithmType;
import org.gamma.imgbatch.config.ConfigurationException;
import org.gamma.imgbatch.config.RidgeFilterParams;
import org.gamma.imgbatch.image.Filters;
import org.gamma.imgbatch.image.GrayImage;
import org.gamma.imgbatch.image.ImageCodec;
import org.gamma.imgbatch.plugin.StageReport;

import java.util.List;

/**
 * Segments line-like objects from a multi-scale Hessian ridge response.
 */
public class RidgeSegmentationAdapter extends AbstractSegmentationAdapter {

    static final List<Double> DEFAULT_SIGMAS = List.of(1.0, 2.0, 3.0);
    static final double DEFAULT_BETA = 0.5;
    static final double DEFAULT_GAMMA = 0.05;

    public RidgeSegmentationAdapter(ImageCodec codec) {
        super(codec);
    }

    @Override
    public AlgorithmType type() {
        return AlgorithmType.RIDGE_FILTER;
    }

    @Override
    public void validate(AlgorithmParams params) throws ConfigurationException {
        super.validate(params);
        RidgeFilterParams ridge = params.ridgeFilter();
        if (ridge == null) return;
        if (ridge.sigmas() != null) {
            if (ridge.sigmas().isEmpty()) throw new ConfigurationException("ridgeFilter.sigmas must not be empty");
            for (Double s : ridge.sigmas()) {
                if (s == null || s <= 0) throw new ConfigurationException("ridgeFilter.sigmas must be positive: " + ridge.sigmas());
            }
        }
        if (ridge.beta() != null && ridge.beta() <= 0) throw new ConfigurationException("ridgeFilter.beta must be positive");
        if (ridge.gamma() != null && ridge.gamma() <= 0) throw new ConfigurationException("ridgeFilter.gamma must be positive");
        if (ridge.threshold() != null && (ridge.threshold() < 0 || ridge.threshold() > 1))
            throw new ConfigurationException("ridgeFilter.threshold must lie in [0, 1], got " + ridge.threshold());
    }

    @Override
    protected GrayImage response(GrayImage band, AlgorithmParams params, StageReport report) {
        RidgeFilterParams ridge = params.ridgeFilter();
        List<Double> sigmas = ridge == null || ridge.sigmas() == null ? DEFAULT_SIGMAS : ridge.sigmas();
        double beta = ridge == null || ridge.beta() == null ? DEFAULT_BETA : ridge.beta();
        double gamma = ridge == null || ridge.gamma() == null ? DEFAULT_GAMMA : ridge.gamma();
        boolean dark = ridge != null && Boolean.TRUE.equals(ridge.darkRidges());
        return Filters.ridgeFilter(band, sigmas, beta, gamma, dark);
    }

    @Override
    protected Double threshold(AlgorithmParams params) {
        return params.ridgeFilter() == null ? null : params.ridgeFilter().threshold();
    }

    // the response is bright on ridges whatever their polarity
    @Override
    protected boolean inverted(AlgorithmParams params) {
        return false;
    }
}
