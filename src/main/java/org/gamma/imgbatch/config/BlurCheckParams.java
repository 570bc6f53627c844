package org.gamma.imgbatch.config;

// An image is rejected as motion-blurred when the gradient energy of one axis exceeds the other by more than ratio.
public record BlurCheckParams(Double ratio, Integer band, Boolean center) {
}
