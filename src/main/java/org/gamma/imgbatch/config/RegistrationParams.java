package org.gamma.imgbatch.config;

public record RegistrationParams(Integer templateBand, Integer maxShift) {
}
