package org.gamma.imgbatch.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyUtilsTest {

    private record TestResult(String data) {}

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() {
        if (executor != null && !executor.isTerminated()) {
            ConcurrencyUtils.shutdownExecutorService(executor, "tearDownExecutor");
        }
    }

    @Test
    void testWaitForCompletableFuturesAndCollect_emptyList() {
        List<CompletableFuture<TestResult>> futures = Collections.emptyList();
        List<TestResult> results = ConcurrencyUtils.waitForCompletableFuturesAndCollect("TestLevel", futures, "emptyTest");
        assertTrue(results.isEmpty(), "Result list should be empty for empty input list.");
    }

    @Test
    @Timeout(value = 2, unit = TimeUnit.SECONDS)
    void testWaitForCompletableFuturesAndCollect_oneFails() {
        List<CompletableFuture<TestResult>> futures = new ArrayList<>();
        futures.add(CompletableFuture.supplyAsync(() -> new TestResult("Result1"), executor));
        futures.add(CompletableFuture.supplyAsync(() -> {
            throw new CompletionException("Simulated failure for testing", new RuntimeException("Simulated cause"));
        }, executor));
        futures.add(CompletableFuture.supplyAsync(() -> {
            try { Thread.sleep(50); } catch (InterruptedException e) { Thread.currentThread().interrupt(); }
            return new TestResult("Result3");
        }, executor));

        List<TestResult> results = ConcurrencyUtils.waitForCompletableFuturesAndCollect("TestLevel", futures, "oneFailsTest");

        assertEquals(2, results.size(), "Should collect results from succeeding futures only.");
        assertTrue(results.stream().anyMatch(r -> "Result1".equals(r.data)));
        assertTrue(results.stream().anyMatch(r -> "Result3".equals(r.data)));
    }

    @Test
    void testCreatePlatformThreadFactory_namesThreadsInSequence() {
        ThreadFactory factory = ConcurrencyUtils.createPlatformThreadFactory("Job-Worker-");
        Thread first = factory.newThread(() -> {});
        Thread second = factory.newThread(() -> {});
        assertEquals("Job-Worker-1", first.getName());
        assertEquals("Job-Worker-2", second.getName());
        assertFalse(first.isDaemon(), "Worker threads must keep the JVM alive until the run drains.");
    }

    @Test
    void testShutdownExecutorService_nullExecutor() {
        assertDoesNotThrow(() -> ConcurrencyUtils.shutdownExecutorService(null, "NullTestExecutor"));
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testShutdownExecutorService_normalShutdown() {
        ExecutorService localExecutor = Executors.newFixedThreadPool(1);
        localExecutor.submit(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        ConcurrencyUtils.shutdownExecutorService(localExecutor, "NormalShutdownTest");
        assertTrue(localExecutor.isTerminated(), "Executor should be terminated after shutdown.");
    }

    @Test
    void testUnwrap_stripsWrapperLayers() {
        IllegalStateException root = new IllegalStateException("root");
        Throwable wrapped = new CompletionException(new ExecutionException(root));
        assertSame(root, ConcurrencyUtils.unwrap(wrapped));
        assertSame(root, ConcurrencyUtils.unwrap(root));
    }
}
