package org.gamma.imgbatch.config;

public record SmoothingParams(Double sigma) {
}
