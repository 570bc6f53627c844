package org.gamma.imgbatch.image;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Connected components, skeletons and distance maps on {@link BinaryMask}s. Connectivity is 8 throughout.
 */
public final class Morphology {

    static {
        Mats.load();
    }

    /**
     * Hit-or-miss elements for thinning: 1 foreground, -1 background, 0 don't care. Each is used in its four
     * rotations.
     */
    private static final int[][] THINNING_ELEMENTS = {
            {-1, -1, -1, 0, 1, 0, 1, 1, 1},
            {0, -1, -1, 1, 1, -1, 0, 1, 0}
    };

    private Morphology() {
    }

    /**
     * Labels connected foreground components, starting at 1; background stays 0.
     */
    public static int[] label(BinaryMask mask, int[] componentCount) {
        Mat src = mask.toMat();
        Mat labels = new Mat();
        try {
            int n = Imgproc.connectedComponents(src, labels, 8, CvType.CV_32S);
            if (componentCount != null && componentCount.length > 0) componentCount[0] = n - 1;
            int[] out = new int[mask.width() * mask.height()];
            labels.get(0, 0, out);
            return out;
        } finally {
            src.release();
            labels.release();
        }
    }

    public static int countObjects(BinaryMask mask) {
        int[] count = new int[1];
        label(mask, count);
        return count[0];
    }

    /**
     * Copy of {@code mask} without components smaller than {@code minSize} pixels.
     */
    public static BinaryMask removeSmallObjects(BinaryMask mask, int minSize) {
        if (minSize <= 1) return mask.copy();
        Mat src = mask.toMat();
        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        try {
            int n = Imgproc.connectedComponentsWithStats(src, labels, stats, centroids, 8, CvType.CV_32S);
            boolean[] keep = new boolean[n];
            for (int i = 1; i < n; i++) keep[i] = stats.get(i, Imgproc.CC_STAT_AREA)[0] >= minSize;
            int[] ids = new int[mask.width() * mask.height()];
            labels.get(0, 0, ids);
            BinaryMask out = new BinaryMask(mask.width(), mask.height());
            for (int i = 0; i < ids.length; i++) {
                if (keep[ids[i]]) out.set(i % mask.width(), i / mask.width(), true);
            }
            return out;
        } finally {
            src.release();
            labels.release();
            stats.release();
            centroids.release();
        }
    }

    /**
     * Morphological thinning by repeated hit-or-miss until no pixel changes. The result is one pixel wide and keeps
     * the topology of the input.
     */
    public static BinaryMask skeletonize(BinaryMask mask) {
        List<Mat> elements = thinningElements();
        Mat src = mask.toMat();
        Mat current = new Mat();
        Mat hits = new Mat();
        try {
            // hit-or-miss treats pixels outside the image as matching both ways
            Core.copyMakeBorder(src, current, 1, 1, 1, 1, Core.BORDER_CONSTANT, Scalar.all(0));
            boolean changed = true;
            while (changed) {
                changed = false;
                for (Mat element : elements) {
                    Imgproc.morphologyEx(current, hits, Imgproc.MORPH_HITMISS, element);
                    if (Core.countNonZero(hits) > 0) {
                        Core.subtract(current, hits, current);
                        changed = true;
                    }
                }
            }
            return BinaryMask.fromMat(current.submat(1, current.rows() - 1, 1, current.cols() - 1));
        } finally {
            src.release();
            current.release();
            hits.release();
            elements.forEach(Mat::release);
        }
    }

    private static List<Mat> thinningElements() {
        List<Mat> elements = new ArrayList<>();
        int[][] rotated = THINNING_ELEMENTS.clone();
        for (int turn = 0; turn < 4; turn++) {
            for (int i = 0; i < rotated.length; i++) {
                Mat element = new Mat(3, 3, CvType.CV_16S);
                short[] values = new short[9];
                for (int k = 0; k < 9; k++) values[k] = (short) rotated[i][k];
                element.put(0, 0, values);
                elements.add(element);
                rotated[i] = rotateClockwise(rotated[i]);
            }
        }
        return elements;
    }

    private static int[] rotateClockwise(int[] e) {
        int[] r = new int[9];
        for (int row = 0; row < 3; row++) {
            for (int col = 0; col < 3; col++) r[col * 3 + (2 - row)] = e[row * 3 + col];
        }
        return r;
    }

    /**
     * Euclidean distance of each foreground pixel to the nearest background pixel. Pixels outside the image count
     * as background.
     */
    public static float[] distanceMap(BinaryMask mask) {
        Mat src = mask.toMat();
        Mat padded = new Mat();
        Mat distance = new Mat();
        try {
            Core.copyMakeBorder(src, padded, 1, 1, 1, 1, Core.BORDER_CONSTANT, Scalar.all(0));
            Imgproc.distanceTransform(padded, distance, Imgproc.DIST_L2, Imgproc.DIST_MASK_PRECISE);
            Mat inner = distance.submat(1, distance.rows() - 1, 1, distance.cols() - 1).clone();
            float[] d = new float[mask.width() * mask.height()];
            inner.get(0, 0, d);
            inner.release();
            return d;
        } finally {
            src.release();
            padded.release();
            distance.release();
        }
    }
}
