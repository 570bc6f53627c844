package org.gamma.imgbatch.metrics;

import java.time.Duration;

public record ItemInfo(String displayName, Status status, Duration duration, String threadName, int rowsWritten,
                       String message, Throwable failureCause) implements HasStatus {
}
