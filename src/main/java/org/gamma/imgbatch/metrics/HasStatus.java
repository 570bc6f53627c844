package org.gamma.imgbatch.metrics;

public interface HasStatus {
    Status status();
}
