package org.gamma.imgbatch.adapters;

import org.gamma.imgbatch.config.AlgorithmParams;
import org.gamma.imgbatch.image.ImageCodec;
import org.gamma.imgbatch.plugin.ProcessingOutcome;
import org.gamma.imgbatch.plugin.ProcessorAdapter;
import org.gamma.imgbatch.processing.WorkItem;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads the input image and turns every fault of the algorithm into a {@code FAILED} outcome.
 */
public abstract class AbstractImageAdapter implements ProcessorAdapter {

    protected final Logger logger = Logger.getLogger(getClass().getName());
    protected final ImageCodec codec;

    protected AbstractImageAdapter(ImageCodec codec) {
        this.codec = codec;
    }

    @Override
    public final ProcessingOutcome process(WorkItem item, AlgorithmParams params) {
        BufferedImage image;
        try {
            image = codec.read(item.inputPath());
        } catch (IOException e) {
            logger.log(Level.WARNING, "Couldn''t load {0}: {1}", new Object[]{item.displayName(), e.getMessage()});
            return ProcessingOutcome.failed("Couldn't load image: " + e.getMessage(), e);
        }
        try {
            return analyze(item, image, params);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProcessingOutcome.failed("Interrupted", e);
        } catch (Exception e) {
            logger.log(Level.WARNING, "{0} failed on {1}: {2}", new Object[]{type(), item.displayName(), e.toString()});
            return ProcessingOutcome.failed(e.toString(), e);
        }
    }

    /**
     * Runs the algorithm on a loaded image. Exceptions fail the item.
     */
    protected abstract ProcessingOutcome analyze(WorkItem item, BufferedImage image, AlgorithmParams params)
            throws Exception;
}
