package org.gamma.imgbatch.image;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.awt.image.BufferedImage;

/**
 * Foreground/background mask, row-major.
 */
public final class BinaryMask {

    static {
        Mats.load();
    }

    private final int width;
    private final int height;
    private final boolean[] bits;

    public BinaryMask(int width, int height) {
        this.width = width;
        this.height = height;
        this.bits = new boolean[width * height];
    }

    public boolean get(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height && bits[y * width + x];
    }

    public void set(int x, int y, boolean value) {
        bits[y * width + x] = value;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int count() {
        int n = 0;
        for (boolean b : bits) if (b) n++;
        return n;
    }

    public BinaryMask copy() {
        BinaryMask m = new BinaryMask(width, height);
        System.arraycopy(bits, 0, m.bits, 0, bits.length);
        return m;
    }

    /**
     * Foreground where {@code value > threshold}, or {@code value <= threshold} when inverted.
     */
    public static BinaryMask threshold(GrayImage image, double threshold, boolean invert) {
        Mat src = image.toMat();
        Mat dst = new Mat();
        try {
            Imgproc.threshold(src, dst, threshold, 255, invert ? Imgproc.THRESH_BINARY_INV : Imgproc.THRESH_BINARY);
            return fromMat(dst);
        } finally {
            src.release();
            dst.release();
        }
    }

    /**
     * Any non-zero value of a single-channel mat is foreground.
     */
    public static BinaryMask fromMat(Mat mat) {
        Mat bytes = new Mat();
        try {
            Core.compare(mat, Scalar.all(0), bytes, Core.CMP_NE);
            byte[] values = new byte[mat.rows() * mat.cols()];
            bytes.get(0, 0, values);
            BinaryMask mask = new BinaryMask(mat.cols(), mat.rows());
            for (int i = 0; i < values.length; i++) mask.bits[i] = values[i] != 0;
            return mask;
        } finally {
            bytes.release();
        }
    }

    /**
     * {@code CV_8UC1} mat, 255 for foreground and 0 for background.
     */
    public Mat toMat() {
        byte[] values = new byte[bits.length];
        for (int i = 0; i < bits.length; i++) values[i] = bits[i] ? (byte) 255 : 0;
        Mat mat = new Mat(height, width, CvType.CV_8UC1);
        mat.put(0, 0, values);
        return mat;
    }

    /**
     * Black background, white foreground.
     */
    public BufferedImage toImage() {
        Mat mat = toMat();
        try {
            return Mats.toImage(mat);
        } finally {
            mat.release();
        }
    }
}
