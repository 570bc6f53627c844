package org.gamma.imgbatch.processing;

import org.gamma.imgbatch.config.SkipPolicy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides from the artifacts on disk whether an item was handled by an earlier run.
 * Called on the worker thread; items never share paths, so no locking is needed.
 */
public class IdempotencyGuard {

    private static final Logger LOGGER = Logger.getLogger(IdempotencyGuard.class.getName());

    private final SkipPolicy policy;

    public IdempotencyGuard(SkipPolicy policy) {
        this.policy = policy == null ? SkipPolicy.SKIP_EXISTING : policy;
    }

    public boolean shouldSkip(WorkItem item) {
        boolean skip = switch (policy) {
            case SKIP_EXISTING -> Files.exists(item.outputPath()) || Files.exists(item.failurePath());
            case REDO_FAILURES -> Files.exists(item.outputPath());
            case OVERWRITE -> false;
        };
        if (skip) LOGGER.log(Level.INFO, "{0} already processed", item.displayName());
        return skip;
    }

    /**
     * Removes the artifact a previous run left in the other bucket once the item has a new one in {@code written}.
     */
    public void removeStale(WorkItem item, Path written) {
        if (policy == SkipPolicy.SKIP_EXISTING) return;
        Path stale = written.equals(item.outputPath()) ? item.failurePath() : item.outputPath();
        try {
            if (Files.deleteIfExists(stale))
                LOGGER.log(Level.FINE, "Removed stale artifact {0}", stale);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Couldn''t remove stale artifact {0}: {1}", new Object[]{stale, e.getMessage()});
        }
    }

    public SkipPolicy policy() {
        return policy;
    }
}
