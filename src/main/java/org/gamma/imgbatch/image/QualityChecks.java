package org.gamma.imgbatch.image;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;

import java.awt.image.BufferedImage;

/**
 * Screening checks. Each returns {@code true} when the image passes.
 */
public final class QualityChecks {

    static {
        Mats.load();
    }

    private QualityChecks() {
    }

    /**
     * Motion blur smears one axis: the gradient energy along it drops relative to the other axis. Gradients are
     * forward differences between neighbouring pixels.
     *
     * @param center use only the central half of the image
     */
    public static boolean notMotionBlurred(GrayImage band, double ratio, boolean center) {
        Mat full = band.toMat();
        Mat dx = new Mat();
        Mat dy = new Mat();
        try {
            Mat roi = full;
            if (center) {
                int x0 = band.width() / 4;
                int y0 = band.height() / 4;
                int w = Math.min(Math.max(2, band.width() / 2), band.width() - x0);
                int h = Math.min(Math.max(2, band.height() / 2), band.height() - y0);
                roi = full.submat(new Rect(x0, y0, w, h));
            }
            if (roi.cols() < 2 || roi.rows() < 2) return true;
            Core.subtract(roi.colRange(1, roi.cols()), roi.colRange(0, roi.cols() - 1), dx);
            Core.subtract(roi.rowRange(1, roi.rows()), roi.rowRange(0, roi.rows() - 1), dy);
            double gx = Core.norm(dx, Core.NORM_L2SQR);
            double gy = Core.norm(dy, Core.NORM_L2SQR);
            double lo = Math.min(gx, gy);
            double hi = Math.max(gx, gy);
            if (hi == 0) return true;
            return lo > 0 && hi / lo <= ratio;
        } finally {
            full.release();
            dx.release();
            dy.release();
        }
    }

    /**
     * Distance of the mean chromaticity of mid-luminance pixels from neutral grey.
     */
    public static double temperatureDistance(BufferedImage image, double lowerPercentile, double upperPercentile) {
        GrayImage luma = GrayImage.fromImage(image, "gray");
        float lo = luma.percentile(lowerPercentile);
        float hi = luma.percentile(upperPercentile);
        Mat lumaMat = luma.toMat();
        Mat bgr = Mats.toMat(image);
        Mat selected = new Mat();
        try {
            Core.inRange(lumaMat, Scalar.all(lo), Scalar.all(hi), selected);
            if (bgr.channels() < 3 || Core.countNonZero(selected) == 0) return 0;
            double[] mean = Core.mean(bgr, selected).val;
            double b = mean[0];
            double g = mean[1];
            double r = mean[2];
            double sum = r + g + b;
            if (sum == 0) return 0;
            double third = 1.0 / 3.0;
            double cr = r / sum - third;
            double cg = g / sum - third;
            double cb = b / sum - third;
            return Math.sqrt(cr * cr + cg * cg + cb * cb);
        } finally {
            lumaMat.release();
            bgr.release();
            selected.release();
        }
    }

    public static boolean neutralTemperature(BufferedImage image, double lowerPercentile, double upperPercentile,
                                             double maxDistance) {
        return temperatureDistance(image, lowerPercentile, upperPercentile) <= maxDistance;
    }

    /**
     * Passes when the spread between the two luminance percentiles exceeds {@code fractionThreshold} of the range.
     */
    public static boolean sufficientContrast(GrayImage luma, double fractionThreshold, double lowerPercentile,
                                             double upperPercentile) {
        return luma.percentile(upperPercentile) - luma.percentile(lowerPercentile) > fractionThreshold;
    }
}
