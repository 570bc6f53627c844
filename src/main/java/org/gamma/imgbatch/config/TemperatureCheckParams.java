package org.gamma.imgbatch.config;

// Percentile bounds select the pixels whose mean colour is compared against neutral grey.
public record TemperatureCheckParams(Double lowerPercentile, Double upperPercentile, Double maxDistance) {
}
