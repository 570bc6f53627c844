package org.gamma.imgbatch.metrics;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTrackerTest {

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testOnItemCompleted_countsEveryTickAcrossThreads() throws InterruptedException {
        ProgressTracker tracker = new ProgressTracker("job", 200);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 200; i++) {
            final Status status = i % 3 == 0 ? Status.SKIPPED : Status.PASS;
            final String name = "img" + i;
            executor.submit(() -> tracker.onItemCompleted(name, status));
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(4, TimeUnit.SECONDS));

        assertEquals(200, tracker.completed());
        assertEquals(200, tracker.total());
    }
}
