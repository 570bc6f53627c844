package org.gamma.imgbatch.config;

public record ContrastCheckParams(Double fractionThreshold, Double lowerPercentile, Double upperPercentile) {
}
