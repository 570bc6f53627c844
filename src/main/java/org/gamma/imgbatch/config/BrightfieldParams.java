package org.gamma.imgbatch.config;

// referenceName is looked up in the directory of each image. correctionFactor null means "auto" (reference mean).
public record BrightfieldParams(String referenceName, Double sigma, Double correctionFactor) {
}
