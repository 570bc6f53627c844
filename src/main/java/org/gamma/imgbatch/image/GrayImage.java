package org.gamma.imgbatch.image;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Single-band float image, row-major. Values of converted 8- and 16-bit images lie in [0, 1].
 */
public final class GrayImage {

    static {
        Mats.load();
    }

    private final int width;
    private final int height;
    private final float[] data;

    public GrayImage(int width, int height) {
        this(width, height, new float[width * height]);
    }

    public GrayImage(int width, int height, float[] data) {
        if (data.length != width * height)
            throw new IllegalArgumentException("Expected " + width * height + " values, got " + data.length);
        this.width = width;
        this.height = height;
        this.data = data;
    }

    /**
     * Extracts a band of {@code image}: {@code gray} (luma), {@code red}, {@code green} or {@code blue}.
     *
     * @throws IllegalArgumentException when a colour band is requested from a single-band image
     */
    public static GrayImage fromImage(BufferedImage image, String band) {
        String b = band == null ? "gray" : band.toLowerCase();
        Mat mat = Mats.toMat(image);
        Mat scaled = new Mat();
        try {
            if (mat.channels() == 1) {
                if (!b.equals("gray"))
                    throw new IllegalArgumentException("Band '" + b + "' requested but the image has no colour bands");
                return fromMat(mat);
            }
            mat.convertTo(scaled, CvType.CV_32F, 1.0 / 255.0);
            Mat single = new Mat();
            try {
                switch (b) {
                    case "gray" -> Imgproc.cvtColor(scaled, single, Imgproc.COLOR_BGR2GRAY);
                    case "red" -> Core.extractChannel(scaled, single, 2);
                    case "green" -> Core.extractChannel(scaled, single, 1);
                    case "blue" -> Core.extractChannel(scaled, single, 0);
                    default -> throw new IllegalArgumentException("Unknown band '" + band + "'");
                }
                return fromMat(single);
            } finally {
                single.release();
            }
        } finally {
            mat.release();
            scaled.release();
        }
    }

    /**
     * Channel {@code c} (0 = red, 1 = green, 2 = blue) of an RGB image; single-band images return their only band.
     */
    public static GrayImage channel(BufferedImage image, int c) {
        if (image.getColorModel().getNumColorComponents() < 3) return fromImage(image, "gray");
        return fromImage(image, switch (c) {
            case 0 -> "red";
            case 1 -> "green";
            default -> "blue";
        });
    }

    /**
     * Single-channel mat of any depth; 8- and 16-bit unsigned values are scaled onto [0, 1].
     */
    public static GrayImage fromMat(Mat mat) {
        if (mat.channels() != 1) throw new IllegalArgumentException("Expected one channel, got " + mat.channels());
        double scale = switch (mat.depth()) {
            case CvType.CV_8U -> 1.0 / 255.0;
            case CvType.CV_16U -> 1.0 / 65535.0;
            default -> 1.0;
        };
        Mat floats = new Mat();
        try {
            mat.convertTo(floats, CvType.CV_32F, scale);
            GrayImage image = new GrayImage(mat.cols(), mat.rows());
            floats.get(0, 0, image.data);
            return image;
        } finally {
            floats.release();
        }
    }

    /**
     * A new {@code CV_32FC1} mat holding a copy of the values.
     */
    public Mat toMat() {
        Mat mat = new Mat(height, width, CvType.CV_32FC1);
        mat.put(0, 0, data);
        return mat;
    }

    public float get(int x, int y) {
        return data[y * width + x];
    }

    /**
     * Value with coordinates clamped to the image border.
     */
    public float getClamped(int x, int y) {
        x = Math.max(0, Math.min(width - 1, x));
        y = Math.max(0, Math.min(height - 1, y));
        return data[y * width + x];
    }

    public void set(int x, int y, float value) {
        data[y * width + x] = value;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public float[] data() {
        return data;
    }

    public GrayImage copy() {
        return new GrayImage(width, height, Arrays.copyOf(data, data.length));
    }

    public double mean() {
        double sum = 0;
        for (float v : data) sum += v;
        return data.length == 0 ? 0 : sum / data.length;
    }

    /**
     * Value at percentile {@code p} in [0, 100], nearest rank.
     */
    public float percentile(double p) {
        if (data.length == 0) return 0f;
        float[] sorted = Arrays.copyOf(data, data.length);
        Arrays.sort(sorted);
        int idx = (int) Math.round(p / 100.0 * (sorted.length - 1));
        return sorted[Math.max(0, Math.min(sorted.length - 1, idx))];
    }
}
