package org.gamma.imgbatch.config;

import java.util.List;

// color is 8-bit RGB; weight is the line width in pixels.
public record GridParams(Integer size, List<Integer> color, Integer weight) {
}
