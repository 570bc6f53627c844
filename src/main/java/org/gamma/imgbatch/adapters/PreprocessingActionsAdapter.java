package org.gamma.imgbatch.adapters;

import org.gamma.imgbatch.config.AlgorithmParams;
import org.gamma.imgbatch.config.AlgorithmType;
import org.gamma.imgbatch.config.BrightfieldParams;
import org.gamma.imgbatch.config.ConfigurationException;
import org.gamma.imgbatch.config.RegistrationParams;
import org.gamma.imgbatch.config.SmoothingParams;
import org.gamma.imgbatch.image.ColorCorrection;
import org.gamma.imgbatch.image.GrayImage;
import org.gamma.imgbatch.image.ImageCodec;
import org.gamma.imgbatch.plugin.ProcessingOutcome;
import org.gamma.imgbatch.plugin.StageReport;
import org.gamma.imgbatch.processing.WorkItem;
import org.gamma.imgbatch.table.TableSchema;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;

/**
 * Corrects images: brightfield flattening against a per-directory reference, smoothing and band registration.
 * Images on which any configured correction failed go to the failure tree.
 */
public class PreprocessingActionsAdapter extends AbstractImageAdapter {

    static final double DEFAULT_REFERENCE_SIGMA = 10.0;
    static final int DEFAULT_MAX_SHIFT = 10;

    // blurred reference per input directory
    private final Map<Path, GrayImage[]> references = new ConcurrentHashMap<>();

    public PreprocessingActionsAdapter(ImageCodec codec) {
        super(codec);
    }

    @Override
    public AlgorithmType type() {
        return AlgorithmType.PREPROCESSING_ACTIONS;
    }

    @Override
    public String defaultOutputDirName() {
        return "Preprocessed";
    }

    @Override
    public String failureDirName() {
        return "FAILED PROCESSES";
    }

    @Override
    public Optional<TableSchema> schema(AlgorithmParams params) {
        return Optional.empty();
    }

    @Override
    public void validate(AlgorithmParams params) throws ConfigurationException {
        BrightfieldParams bf = params.brightfield();
        if (bf != null) {
            if (bf.referenceName() == null || bf.referenceName().isBlank())
                throw new ConfigurationException("brightfield.referenceName is required");
            if (bf.sigma() != null && bf.sigma() < 0)
                throw new ConfigurationException("brightfield.sigma must not be negative");
            if (bf.correctionFactor() != null && bf.correctionFactor() <= 0)
                throw new ConfigurationException("brightfield.correctionFactor must be positive");
        }
        SmoothingParams smoothing = params.smoothing();
        if (smoothing != null && (smoothing.sigma() == null || smoothing.sigma() <= 0))
            throw new ConfigurationException("smoothing.sigma must be positive");
        RegistrationParams reg = params.registration();
        if (reg != null) {
            if (reg.templateBand() != null && (reg.templateBand() < 0 || reg.templateBand() > 2))
                throw new ConfigurationException("registration.templateBand must be 0, 1 or 2");
            if (reg.maxShift() != null && reg.maxShift() < 0)
                throw new ConfigurationException("registration.maxShift must not be negative");
        }
    }

    @Override
    protected ProcessingOutcome analyze(WorkItem item, BufferedImage image, AlgorithmParams params) throws IOException {
        BrightfieldParams bf = params.brightfield();
        GrayImage[] reference = bf == null ? null : reference(item.inputPath().getParent(), bf);

        StageReport report = new StageReport(item.displayName());
        BufferedImage current = image;
        final BufferedImage original = current;
        current = report.run("brightfield", bf, current,
                () -> ColorCorrection.brightfieldCorrect(original, reference, bf.correctionFactor()));

        SmoothingParams smoothing = params.smoothing();
        final BufferedImage corrected = current;
        current = report.run("smoothing", smoothing, current,
                () -> ColorCorrection.smooth(corrected, smoothing.sigma()));

        RegistrationParams reg = params.registration();
        final BufferedImage smoothed = current;
        current = report.run("registration", reg, current, () -> ColorCorrection.registerBands(smoothed,
                reg.templateBand() == null ? 1 : reg.templateBand(),
                reg.maxShift() == null ? DEFAULT_MAX_SHIFT : reg.maxShift()));

        if (report.degradedCount() > 0)
            logger.log(Level.INFO, "Something failed: {0} {1}", new Object[]{item.displayName(), report.stages()});
        return ProcessingOutcome.success(current, List.of(), report.degradedCount());
    }

    /**
     * Loads and blurs the directory's reference image once.
     *
     * @throws IOException when the reference is missing or unreadable; every image of the directory fails then
     */
    GrayImage[] reference(Path directory, BrightfieldParams bf) throws IOException {
        GrayImage[] cached = references.get(directory);
        if (cached != null) return cached;
        Path refPath = directory.resolve(bf.referenceName());
        if (!Files.isRegularFile(refPath))
            throw new IOException("Brightfield reference image not found: " + refPath);
        double sigma = bf.sigma() == null ? DEFAULT_REFERENCE_SIGMA : bf.sigma();
        GrayImage[] blurred = ColorCorrection.blurReference(codec.read(refPath), sigma);
        GrayImage[] previous = references.putIfAbsent(directory, blurred);
        return previous != null ? previous : blurred;
    }
}
