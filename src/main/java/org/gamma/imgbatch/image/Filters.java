package org.gamma.imgbatch.image;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Linear filters and global thresholds on {@link GrayImage}s.
 */
public final class Filters {

    static {
        Mats.load();
    }

    private Filters() {
    }

    /**
     * Gaussian blur with the kernel size OpenCV derives from {@code sigma}; borders are replicated.
     */
    public static GrayImage gaussianBlur(GrayImage src, double sigma) {
        if (sigma <= 0) return src.copy();
        Mat mat = src.toMat();
        try {
            Imgproc.GaussianBlur(mat, mat, new Size(0, 0), sigma, sigma, Core.BORDER_REPLICATE);
            return GrayImage.fromMat(mat);
        } finally {
            mat.release();
        }
    }

    /**
     * Linear stretch of the 2nd..98th percentile range onto [0, 1], clipping outside values.
     */
    public static GrayImage contrastStretch(GrayImage src) {
        float lo = src.percentile(2);
        float hi = src.percentile(98);
        float range = hi - lo;
        if (range <= 0) return new GrayImage(src.width(), src.height());
        Mat mat = src.toMat();
        try {
            mat.convertTo(mat, CvType.CV_32F, 1.0 / range, -lo / range);
            Core.min(mat, Scalar.all(1), mat);
            Core.max(mat, Scalar.all(0), mat);
            return GrayImage.fromMat(mat);
        } finally {
            mat.release();
        }
    }

    /**
     * Linear rescale of the full value range onto [0, 1]; a constant image becomes 0.
     */
    public static GrayImage normalize(GrayImage src) {
        Mat mat = src.toMat();
        try {
            Core.normalize(mat, mat, 0, 1, Core.NORM_MINMAX);
            return GrayImage.fromMat(mat);
        } finally {
            mat.release();
        }
    }

    /**
     * Otsu's threshold over the 8-bit quantization of values in [0, 1].
     */
    public static double otsuThreshold(GrayImage image) {
        Mat mat = image.toMat();
        Mat bytes = new Mat();
        Mat ignored = new Mat();
        try {
            mat.convertTo(bytes, CvType.CV_8U, 255.0);
            double t = Imgproc.threshold(bytes, ignored, 0, 255, Imgproc.THRESH_BINARY | Imgproc.THRESH_OTSU);
            return (t + 0.5) / 255.0;
        } finally {
            mat.release();
            bytes.release();
            ignored.release();
        }
    }

    /**
     * Multi-scale Hessian ridge (vesselness) response, normalized to [0, 1]. Second derivatives come from
     * scale-normalized Sobel operators on the Gaussian-smoothed image.
     *
     * @param darkRidges respond to dark lines on a bright background instead of bright lines
     */
    public static GrayImage ridgeFilter(GrayImage src, List<Double> sigmas, double beta, double gamma,
                                        boolean darkRidges) {
        int n = src.width() * src.height();
        float[] response = new float[n];
        float[] xx = new float[n];
        float[] yy = new float[n];
        float[] xy = new float[n];
        Mat smoothed = new Mat();
        Mat dxx = new Mat();
        Mat dyy = new Mat();
        Mat dxy = new Mat();
        Mat input = src.toMat();
        try {
            for (double sigma : sigmas) {
                Imgproc.GaussianBlur(input, smoothed, new Size(0, 0), sigma, sigma, Core.BORDER_REPLICATE);
                // the 3x3 Sobel kernels carry a factor 4 over plain finite differences
                double scale = sigma * sigma / 4.0;
                Imgproc.Sobel(smoothed, dxx, CvType.CV_32F, 2, 0, 3, scale, 0, Core.BORDER_REPLICATE);
                Imgproc.Sobel(smoothed, dyy, CvType.CV_32F, 0, 2, 3, scale, 0, Core.BORDER_REPLICATE);
                Imgproc.Sobel(smoothed, dxy, CvType.CV_32F, 1, 1, 3, scale, 0, Core.BORDER_REPLICATE);
                dxx.get(0, 0, xx);
                dyy.get(0, 0, yy);
                dxy.get(0, 0, xy);
                for (int i = 0; i < n; i++) {
                    float v = vesselness(xx[i], yy[i], xy[i], beta, gamma, darkRidges);
                    if (v > response[i]) response[i] = v;
                }
            }
        } finally {
            input.release();
            smoothed.release();
            dxx.release();
            dyy.release();
            dxy.release();
        }
        return normalize(new GrayImage(src.width(), src.height(), response));
    }

    private static float vesselness(double hxx, double hyy, double hxy, double beta, double gamma,
                                    boolean darkRidges) {
        double tmp = Math.sqrt((hxx - hyy) * (hxx - hyy) + 4 * hxy * hxy);
        double l1 = 0.5 * (hxx + hyy + tmp);
        double l2 = 0.5 * (hxx + hyy - tmp);
        if (Math.abs(l1) > Math.abs(l2)) {
            double swap = l1;
            l1 = l2;
            l2 = swap;
        }
        // |l1| <= |l2|; a bright ridge has a strongly negative l2
        if (darkRidges ? l2 < 0 : l2 > 0) return 0f;
        double rb = l2 == 0 ? 0 : l1 / l2;
        double structure = Math.sqrt(l1 * l1 + l2 * l2);
        return (float) (Math.exp(-(rb * rb) / (2 * beta * beta))
                * (1 - Math.exp(-(structure * structure) / (2 * gamma * gamma))));
    }
}
