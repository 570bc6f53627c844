package org.gamma.imgbatch.config;

/**
 * Algorithm configuration bundle of a batch job. Every section is optional: a missing section
 * disables the corresponding stage, it is never an error by itself.
 */
public record AlgorithmParams(SegmentationParams segmentation,
                              RidgeFilterParams ridgeFilter,
                              BrightfieldParams brightfield,
                              SmoothingParams smoothing,
                              RegistrationParams registration,
                              BlurCheckParams blurCheck,
                              TemperatureCheckParams temperatureCheck,
                              ContrastCheckParams contrastCheck,
                              GridParams grid) {

    public static AlgorithmParams empty() {
        return new AlgorithmParams(null, null, null, null, null, null, null, null, null);
    }
}
