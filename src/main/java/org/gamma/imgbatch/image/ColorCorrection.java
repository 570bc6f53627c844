package org.gamma.imgbatch.image;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Whole-image corrections applied per colour channel. Channel arrays are indexed red, green, blue.
 */
public final class ColorCorrection {

    static {
        Mats.load();
    }

    private ColorCorrection() {
    }

    /**
     * Blurred channels of a brightfield reference image, computed once per directory.
     */
    public static GrayImage[] blurReference(BufferedImage reference, double sigma) {
        GrayImage[] channels = new GrayImage[3];
        for (int c = 0; c < 3; c++) channels[c] = Filters.gaussianBlur(GrayImage.channel(reference, c), sigma);
        return channels;
    }

    /**
     * Divides each channel by the blurred reference and rescales by {@code factor}, or by the reference channel's
     * mean when {@code factor} is {@code null}. Where the reference is black the channel is kept.
     *
     * @throws IllegalArgumentException when the reference has another size
     */
    public static BufferedImage brightfieldCorrect(BufferedImage image, GrayImage[] reference, Double factor) {
        if (image.getWidth() != reference[0].width() || image.getHeight() != reference[0].height()) {
            throw new IllegalArgumentException("Reference image is " + reference[0].width() + "x" + reference[0].height()
                    + ", image is " + image.getWidth() + "x" + image.getHeight());
        }
        GrayImage[] out = new GrayImage[3];
        for (int c = 0; c < 3; c++) {
            Mat channel = GrayImage.channel(image, c).toMat();
            Mat ref = reference[c].toMat();
            Mat corrected = new Mat();
            Mat black = new Mat();
            try {
                double scale = factor != null ? factor : Core.mean(ref).val[0];
                Core.divide(channel, ref, corrected, scale);
                Core.compare(ref, Scalar.all(1e-6), black, Core.CMP_LE);
                channel.copyTo(corrected, black);
                out[c] = GrayImage.fromMat(corrected);
            } finally {
                channel.release();
                ref.release();
                corrected.release();
                black.release();
            }
        }
        return toRgb(out);
    }

    /**
     * Gaussian smoothing of every channel, alpha included.
     */
    public static BufferedImage smooth(BufferedImage image, double sigma) {
        Mat bgr = Mats.toColorMat(image);
        try {
            Imgproc.GaussianBlur(bgr, bgr, new Size(0, 0), sigma, sigma, Core.BORDER_REPLICATE);
            return Mats.toImage(bgr);
        } finally {
            bgr.release();
        }
    }

    /**
     * Shifts every channel onto {@code templateBand} by the integer offset, within {@code maxShift}, that best
     * matches it by squared difference.
     */
    public static BufferedImage registerBands(BufferedImage image, int templateBand, int maxShift) {
        if (image.getColorModel().getNumColorComponents() < 3)
            throw new IllegalArgumentException("Band registration needs a colour image");
        if (templateBand < 0 || templateBand > 2)
            throw new IllegalArgumentException("Template band must be 0, 1 or 2, got " + templateBand);
        GrayImage template = GrayImage.channel(image, templateBand);
        GrayImage[] out = new GrayImage[3];
        for (int c = 0; c < 3; c++) {
            GrayImage channel = GrayImage.channel(image, c);
            if (c == templateBand) {
                out[c] = channel;
                continue;
            }
            int[] shift = bestShift(template, channel, maxShift);
            out[c] = shift(channel, shift[0], shift[1]);
        }
        return toRgb(out);
    }

    /**
     * Offset {@code {dx, dy}} such that {@code template(x, y)} matches {@code moving(x - dx, y - dy)}. The centre of
     * {@code moving}, cropped by {@code maxShift} on each side, is searched for in {@code template}.
     */
    static int[] bestShift(GrayImage template, GrayImage moving, int maxShift) {
        if (maxShift <= 0) return new int[]{0, 0};
        int w = moving.width();
        int h = moving.height();
        if (w <= 2 * maxShift || h <= 2 * maxShift)
            throw new IllegalArgumentException("Image of " + w + "x" + h + " is too small for a shift of " + maxShift);
        Mat search = template.toMat();
        Mat full = moving.toMat();
        Mat result = new Mat();
        try {
            Mat patch = full.submat(maxShift, h - maxShift, maxShift, w - maxShift);
            Imgproc.matchTemplate(search, patch, result, Imgproc.TM_SQDIFF);
            Core.MinMaxLocResult best = Core.minMaxLoc(result);
            // ties, as on flat images, resolve to no shift
            double tolerance = 1e-5 * Core.norm(patch, Core.NORM_L2SQR) + 1e-12;
            if (result.get(maxShift, maxShift)[0] <= best.minVal + tolerance) return new int[]{0, 0};
            return new int[]{(int) best.minLoc.x - maxShift, (int) best.minLoc.y - maxShift};
        } finally {
            search.release();
            full.release();
            result.release();
        }
    }

    /**
     * {@code out(x, y) = src(x - dx, y - dy)}, replicating the border.
     */
    static GrayImage shift(GrayImage src, int dx, int dy) {
        Mat mat = src.toMat();
        Mat translation = new Mat(2, 3, CvType.CV_64F);
        Mat out = new Mat();
        try {
            translation.put(0, 0, 1, 0, dx, 0, 1, dy);
            Imgproc.warpAffine(mat, out, translation, mat.size(), Imgproc.INTER_NEAREST, Core.BORDER_REPLICATE);
            return GrayImage.fromMat(out);
        } finally {
            mat.release();
            translation.release();
            out.release();
        }
    }

    /**
     * Packs three channels, clipped to [0, 1], into an 8-bit RGB image.
     */
    public static BufferedImage toRgb(GrayImage[] channels) {
        List<Mat> bgr = new ArrayList<>();
        for (int c = 2; c >= 0; c--) bgr.add(channels[c].toMat());
        Mat merged = new Mat();
        Mat bytes = new Mat();
        try {
            Core.merge(bgr, merged);
            merged.convertTo(bytes, CvType.CV_8U, 255.0);
            return Mats.toImage(bytes);
        } finally {
            bgr.forEach(Mat::release);
            merged.release();
            bytes.release();
        }
    }
}
