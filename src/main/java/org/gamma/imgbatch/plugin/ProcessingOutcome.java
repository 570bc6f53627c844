package org.gamma.imgbatch.plugin;

import org.gamma.imgbatch.table.ResultRow;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;

/**
 * Result of one adapter invocation. Transient: consumed by the engine, never persisted.
 *
 * @param artifact       derived image to store, may be {@code null}
 * @param rows           table rows without the engine-stamped timestamp; empty when none
 * @param degradedStages number of sub-stages that failed or rejected the image; non-zero sends the artifact to the failure tree
 */
public record ProcessingOutcome(Kind kind, BufferedImage artifact, List<ResultRow> rows, int degradedStages,
                                String reason, Throwable cause) {

    public enum Kind {
        SUCCESS,
        SKIPPED,
        FAILED
    }

    public ProcessingOutcome {
        Objects.requireNonNull(kind, "kind");
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static ProcessingOutcome success(BufferedImage artifact, List<ResultRow> rows, int degradedStages) {
        return new ProcessingOutcome(Kind.SUCCESS, artifact, rows, degradedStages, null, null);
    }

    public static ProcessingOutcome success(BufferedImage artifact, List<ResultRow> rows) {
        return success(artifact, rows, 0);
    }

    public static ProcessingOutcome skipped() {
        return new ProcessingOutcome(Kind.SKIPPED, null, List.of(), 0, "already processed", null);
    }

    public static ProcessingOutcome failed(String reason, Throwable cause) {
        return new ProcessingOutcome(Kind.FAILED, null, List.of(), 0, reason, cause);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean isClean() {
        return kind == Kind.SUCCESS && degradedStages == 0;
    }
}
