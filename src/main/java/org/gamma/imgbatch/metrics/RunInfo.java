package org.gamma.imgbatch.metrics;

import java.time.Duration;
import java.util.List;

public record RunInfo(String jobName, Status status, Duration duration, int totalItems, int succeeded, int partial,
                      int skipped, int failed, int notDispatched, long rowsWritten, List<ItemInfo> itemInfo,
                      Throwable failureCause) implements HasStatus {

    public int completed() {
        return succeeded + partial + skipped + failed;
    }
}
