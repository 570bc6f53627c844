package org.gamma.imgbatch.config;

import java.util.List;

// Multi-scale Hessian ridge filter. threshold applies to the normalized response; null selects Otsu.
public record RidgeFilterParams(List<Double> sigmas, Double beta, Double gamma, Boolean darkRidges, Double threshold) {
}
