package org.gamma.imgbatch.config;

/**
 * Algorithm family a batch job runs on each image.
 */
public enum AlgorithmType {
    THRESHOLDING,
    RIDGE_FILTER,
    PREPROCESSING_ACTIONS,
    PREPROCESSING_FILTERS,
    FISHNET,
    TENNANT
}
