package org.gamma.imgbatch.image;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.awt.Color;
import java.awt.image.BufferedImage;

/**
 * Square grids for line-intersect counting.
 */
public final class Grids {

    static {
        Mats.load();
    }

    private Grids() {
    }

    /**
     * Copy of {@code image} with grid lines every {@code size} pixels, starting at the origin. Alpha is kept; grey
     * images come back as colour.
     */
    public static BufferedImage drawGrid(BufferedImage image, int size, Color color, int weight) {
        Mat mat = Mats.toColorMat(image);
        try {
            Scalar lineColor = mat.channels() == 4
                    ? new Scalar(255, color.getBlue(), color.getGreen(), color.getRed())
                    : new Scalar(color.getBlue(), color.getGreen(), color.getRed());
            int w = mat.cols();
            int h = mat.rows();
            for (int x = 0; x < w; x += size) {
                Imgproc.line(mat, new Point(x, 0), new Point(x, h - 1), lineColor, weight, Imgproc.LINE_8);
            }
            for (int y = 0; y < h; y += size) {
                Imgproc.line(mat, new Point(0, y), new Point(w - 1, y), lineColor, weight, Imgproc.LINE_8);
            }
            return Mats.toImage(mat);
        } finally {
            mat.release();
        }
    }

    /**
     * Number of times foreground runs cross the grid lines at multiples of {@code size}.
     */
    public static int countCrossings(BinaryMask mask, int size) {
        Mat mat = mask.toMat();
        Mat transposed = new Mat();
        try {
            Core.transpose(mat, transposed);
            int crossings = 0;
            for (int y = 0; y < mat.rows(); y += size) crossings += runStarts(mat.row(y));
            for (int x = 0; x < transposed.rows(); x += size) crossings += runStarts(transposed.row(x));
            return crossings;
        } finally {
            mat.release();
            transposed.release();
        }
    }

    private static int runStarts(Mat line) {
        int n = line.cols();
        if (n == 0) return 0;
        int starts = line.get(0, 0)[0] != 0 ? 1 : 0;
        if (n == 1) return starts;
        Mat notPrevious = new Mat();
        Mat rising = new Mat();
        try {
            Core.bitwise_not(line.colRange(0, n - 1), notPrevious);
            Core.bitwise_and(line.colRange(1, n), notPrevious, rising);
            return starts + Core.countNonZero(rising);
        } finally {
            notPrevious.release();
            rising.release();
        }
    }

    /**
     * Line-intersect length estimate: {@code 11/14 * size * crossings}.
     */
    public static double tennantLength(int size, int crossings) {
        return 11.0 / 14.0 * size * crossings;
    }
}
