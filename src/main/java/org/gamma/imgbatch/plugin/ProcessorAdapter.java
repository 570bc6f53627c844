package org.gamma.imgbatch.plugin;

import org.gamma.imgbatch.config.AlgorithmParams;
import org.gamma.imgbatch.config.AlgorithmType;
import org.gamma.imgbatch.config.ConfigurationException;
import org.gamma.imgbatch.processing.WorkItem;
import org.gamma.imgbatch.table.TableSchema;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Wraps one image algorithm family behind a uniform contract.
 * <p>
 * Implementations are stateless with respect to the batch: everything an invocation needs arrives in the
 * {@link WorkItem} and the parameters, so one instance serves all workers concurrently.
 */
public interface ProcessorAdapter {

    AlgorithmType type();

    /**
     * Checks the algorithm parameters once, before any image is processed.
     *
     * @throws ConfigurationException when configured parameters are semantically invalid
     */
    void validate(AlgorithmParams params) throws ConfigurationException;

    /**
     * Schema of the rows this adapter produces, or empty when it writes no table.
     */
    Optional<TableSchema> schema(AlgorithmParams params);

    /**
     * Processes one image. Must not throw: faults are returned as {@link ProcessingOutcome.Kind#FAILED}.
     */
    ProcessingOutcome process(WorkItem item, AlgorithmParams params);

    /**
     * Output directory created inside the input root when none is configured.
     */
    default String defaultOutputDirName() {
        return "Analyzed";
    }

    /**
     * Failure directory created inside the output root when none is configured.
     */
    default String failureDirName() {
        return "FAILED";
    }

    /**
     * Result table file created inside the input root when none is configured.
     */
    default String defaultTableName() {
        return "Results.txt";
    }

    default Path defaultTablePath(Path inputRoot, Path outputRoot) {
        return inputRoot.resolve(defaultTableName());
    }

    /**
     * Adapters that only measure return {@code false}; no output or failure tree is mirrored for them.
     */
    default boolean producesArtifacts() {
        return true;
    }

    default String defaultOutputExtension(String inputExtension) {
        return ".png";
    }
}
