package org.gamma.imgbatch.processing;

import org.gamma.imgbatch.plugin.ProcessingOutcome;

import java.time.Duration;

public record CompletedItem(WorkItem item, ProcessingOutcome outcome, Duration duration, String threadName) {
}
