package org.gamma.imgbatch.adapters;

import org.gamma.imgbatch.config.AlgorithmParams;
import org.gamma.imgbatch.config.AlgorithmType;
import org.gamma.imgbatch.config.BlurCheckParams;
import org.gamma.imgbatch.config.ConfigurationException;
import org.gamma.imgbatch.config.ContrastCheckParams;
import org.gamma.imgbatch.config.TemperatureCheckParams;
import org.gamma.imgbatch.image.GrayImage;
import org.gamma.imgbatch.image.ImageCodec;
import org.gamma.imgbatch.image.QualityChecks;
import org.gamma.imgbatch.plugin.ProcessingOutcome;
import org.gamma.imgbatch.plugin.StageReport;
import org.gamma.imgbatch.processing.WorkItem;
import org.gamma.imgbatch.table.TableSchema;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;

/**
 * Screens images for motion blur, colour cast and low contrast. The image itself is passed through unchanged,
 * into the failure tree when a check rejects it.
 */
public class PreprocessingFiltersAdapter extends AbstractImageAdapter {

    public PreprocessingFiltersAdapter(ImageCodec codec) {
        super(codec);
    }

    @Override
    public AlgorithmType type() {
        return AlgorithmType.PREPROCESSING_FILTERS;
    }

    @Override
    public String defaultOutputDirName() {
        return "Screened";
    }

    @Override
    public String failureDirName() {
        return "DID NOT PASS";
    }

    @Override
    public Optional<TableSchema> schema(AlgorithmParams params) {
        return Optional.empty();
    }

    @Override
    public void validate(AlgorithmParams params) throws ConfigurationException {
        BlurCheckParams blur = params.blurCheck();
        if (blur != null) {
            if (blur.ratio() == null || blur.ratio() < 1)
                throw new ConfigurationException("blurCheck.ratio must be at least 1");
            if (blur.band() != null && (blur.band() < 0 || blur.band() > 2))
                throw new ConfigurationException("blurCheck.band must be 0, 1 or 2");
        }
        TemperatureCheckParams temp = params.temperatureCheck();
        if (temp != null) {
            if (temp.maxDistance() == null || temp.maxDistance() < 0)
                throw new ConfigurationException("temperatureCheck.maxDistance must not be negative");
            checkPercentiles("temperatureCheck", temp.lowerPercentile(), temp.upperPercentile(), 0, 100);
        }
        ContrastCheckParams contrast = params.contrastCheck();
        if (contrast != null) {
            if (contrast.fractionThreshold() == null || contrast.fractionThreshold() < 0 || contrast.fractionThreshold() > 1)
                throw new ConfigurationException("contrastCheck.fractionThreshold must lie in [0, 1]");
            checkPercentiles("contrastCheck", contrast.lowerPercentile(), contrast.upperPercentile(), 1, 99);
        }
    }

    private static void checkPercentiles(String section, Double lower, Double upper, double defaultLower,
                                         double defaultUpper) throws ConfigurationException {
        double lo = lower == null ? defaultLower : lower;
        double hi = upper == null ? defaultUpper : upper;
        if (lo < 0 || hi > 100 || lo >= hi)
            throw new ConfigurationException(section + " percentiles must satisfy 0 <= lower < upper <= 100");
    }

    @Override
    protected ProcessingOutcome analyze(WorkItem item, BufferedImage image, AlgorithmParams params) {
        StageReport report = new StageReport(item.displayName());

        BlurCheckParams blur = params.blurCheck();
        report.check("blur", blur, () -> QualityChecks.notMotionBlurred(
                GrayImage.channel(image, blur.band() == null ? 1 : blur.band()),
                blur.ratio(), Boolean.TRUE.equals(blur.center())));

        TemperatureCheckParams temp = params.temperatureCheck();
        report.check("temperature", temp, () -> QualityChecks.neutralTemperature(image,
                temp.lowerPercentile() == null ? 0 : temp.lowerPercentile(),
                temp.upperPercentile() == null ? 100 : temp.upperPercentile(),
                temp.maxDistance()));

        ContrastCheckParams contrast = params.contrastCheck();
        report.check("contrast", contrast, () -> QualityChecks.sufficientContrast(GrayImage.fromImage(image, "gray"),
                contrast.fractionThreshold(),
                contrast.lowerPercentile() == null ? 1 : contrast.lowerPercentile(),
                contrast.upperPercentile() == null ? 99 : contrast.upperPercentile()));

        logger.fine((report.degradedCount() == 0 ? "PASSED: " : "DID NOT PASS: ") + item.displayName());
        return ProcessingOutcome.success(image, List.of(), report.degradedCount());
    }
}
