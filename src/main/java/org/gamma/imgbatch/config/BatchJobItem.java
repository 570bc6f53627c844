package org.gamma.imgbatch.config;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One batch job of the configuration file. Optional paths left {@code null} are resolved by the engine
 * from the input root and the algorithm's defaults.
 *
 * @param jobName          name used in logs and the run summary
 * @param active           inactive jobs are skipped by the runner; {@code null} means active
 * @param algorithm        algorithm family to run
 * @param inputRoot        root of the image tree
 * @param extension        literal, case-sensitive file name suffix of the input images, e.g. {@code ".png"}
 * @param outputRoot       root of the mirrored output tree
 * @param outputExtension  extension of written artifacts
 * @param failureRoot      root of the mirrored failure tree
 * @param tablePath        result table file
 * @param overwriteTable   truncate an existing table instead of appending
 * @param saveArtifacts    write derived images; {@code null} means true
 * @param parallelism      worker count; {@code null}, 0 or 1 runs sequentially
 * @param skipPolicy       reprocessing policy; {@code null} means {@link SkipPolicy#SKIP_EXISTING}
 * @param tableDelimiter   {@code ","} (default), {@code "\t"} or {@code "tab"}
 * @param algorithmParams  opaque bundle handed to the adapter
 */
public record BatchJobItem(String jobName, Boolean active, AlgorithmType algorithm, Path inputRoot, String extension,
                           Path outputRoot, String outputExtension, Path failureRoot, Path tablePath,
                           boolean overwriteTable, Boolean saveArtifacts, Integer parallelism, SkipPolicy skipPolicy,
                           String tableDelimiter, AlgorithmParams algorithmParams) {

    public boolean enabled() {
        return active == null || active;
    }

    public boolean shouldSaveArtifacts() {
        return saveArtifacts == null || saveArtifacts;
    }

    public int effectiveParallelism() {
        return parallelism == null ? 1 : Math.max(1, parallelism);
    }

    public SkipPolicy effectiveSkipPolicy() {
        return skipPolicy == null ? SkipPolicy.SKIP_EXISTING : skipPolicy;
    }

    public AlgorithmParams params() {
        return algorithmParams == null ? AlgorithmParams.empty() : algorithmParams;
    }

    public char delimiterChar() {
        if (tableDelimiter == null || tableDelimiter.isEmpty()) return ',';
        if ("tab".equalsIgnoreCase(tableDelimiter) || "\\t".equals(tableDelimiter)) return '\t';
        return tableDelimiter.charAt(0);
    }

    public String displayName() {
        return jobName != null && !jobName.isBlank() ? jobName : String.valueOf(algorithm);
    }

    /**
     * Checks the job-level settings. Algorithm parameters are checked by the adapter.
     *
     * @throws ConfigurationException when a required setting is missing or invalid
     */
    public void validate() throws ConfigurationException {
        if (algorithm == null)
            throw new ConfigurationException("Job '" + displayName() + "': 'algorithm' is required");
        if (inputRoot == null)
            throw new ConfigurationException("Job '" + displayName() + "': 'inputRoot' is required");
        if (!Files.isDirectory(inputRoot))
            throw new ConfigurationException("Job '" + displayName() + "': input root is not a directory: " + inputRoot);
        if (extension == null || extension.isBlank())
            throw new ConfigurationException("Job '" + displayName() + "': 'extension' is required");
        if (parallelism != null && parallelism < 0)
            throw new ConfigurationException("Job '" + displayName() + "': 'parallelism' must not be negative");
        if (tableDelimiter != null && tableDelimiter.length() > 1 && delimiterChar() != '\t')
            throw new ConfigurationException("Job '" + displayName() + "': unsupported table delimiter '" + tableDelimiter + "'");
        if (delimiterChar() == '"' || delimiterChar() == '\n' || delimiterChar() == '\r')
            throw new ConfigurationException("Job '" + displayName() + "': unsupported table delimiter '" + tableDelimiter + "'");
    }
}
