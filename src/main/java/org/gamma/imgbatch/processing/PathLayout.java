package org.gamma.imgbatch.processing;

import org.gamma.imgbatch.config.BatchJobItem;
import org.gamma.imgbatch.plugin.ProcessorAdapter;

import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Roots and files of one job after applying the adapter's defaults.
 *
 * @param tablePath {@code null} when the adapter writes no table
 * @param inPlace   output root equals the input root; the output tree is then not excluded from scanning
 */
public record PathLayout(Path inputRoot, Path outputRoot, Path failureRoot, Path tablePath, String outputExtension,
                         boolean inPlace) {

    private static final Logger LOGGER = Logger.getLogger(PathLayout.class.getName());

    public static PathLayout resolve(BatchJobItem job, ProcessorAdapter adapter, boolean writesTable) {
        Path inputRoot = job.inputRoot();
        Path outputRoot = job.outputRoot() != null ? job.outputRoot() : inputRoot.resolve(adapter.defaultOutputDirName());
        Path failureRoot = job.failureRoot() != null ? job.failureRoot() : outputRoot.resolve(adapter.failureDirName());
        String outputExtension = job.outputExtension() != null && !job.outputExtension().isBlank()
                ? job.outputExtension() : adapter.defaultOutputExtension(job.extension());
        if (!outputExtension.startsWith(".")) outputExtension = "." + outputExtension;

        Path tablePath = null;
        if (writesTable) {
            tablePath = job.tablePath() != null ? job.tablePath() : adapter.defaultTablePath(inputRoot, outputRoot);
        } else if (job.tablePath() != null) {
            LOGGER.log(Level.WARNING, "Job {0}: {1} writes no result table, ignoring tablePath {2}",
                    new Object[]{job.displayName(), adapter.type(), job.tablePath()});
        }

        boolean inPlace = outputRoot.toAbsolutePath().normalize().equals(inputRoot.toAbsolutePath().normalize());
        return new PathLayout(inputRoot, outputRoot, failureRoot, tablePath, outputExtension, inPlace);
    }

    /**
     * Whether artifacts land on their own input files: in place, with the input extension kept.
     */
    public boolean overwritesInputs(String inputExtension) {
        if (!inPlace || inputExtension == null) return false;
        return outputExtension.equals(inputExtension.startsWith(".") ? inputExtension : "." + inputExtension);
    }
}
