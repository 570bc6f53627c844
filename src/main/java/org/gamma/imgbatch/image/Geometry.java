package org.gamma.imgbatch.image;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Length and diameter measurements of segmented objects, taken on their skeleton.
 */
public final class Geometry {

    static {
        Mats.load();
    }

    private static final double DIAGONAL = Math.sqrt(2);

    private Geometry() {
    }

    /**
     * Summary of one segmentation mask, lengths and diameters in pixels.
     */
    public record Measurement(double length, int objectCount, double meanDiameter, Map<String, Double> lengthByDiameter) {
    }

    public static Measurement measure(BinaryMask mask, List<Double> diameterBins) {
        BinaryMask skeleton = Morphology.skeletonize(mask);
        float[] distance = Morphology.distanceMap(mask);
        float[] lengths = pixelLengths(skeleton);

        List<String> classes = diameterBins == null ? List.of() : diameterClasses(diameterBins);
        Map<String, Double> byClass = new LinkedHashMap<>();
        for (String c : classes) byClass.put(c, 0.0);

        int w = mask.width();
        double length = 0;
        double diameterSum = 0;
        int skeletonPixels = 0;
        for (int i = 0; i < lengths.length; i++) {
            if (!skeleton.get(i % w, i / w)) continue;
            double diameter = 2.0 * distance[i] - 1.0;
            length += lengths[i];
            diameterSum += diameter;
            skeletonPixels++;
            if (!classes.isEmpty()) byClass.merge(diameterClass(diameterBins, diameter), (double) lengths[i], Double::sum);
        }
        double meanDiameter = skeletonPixels == 0 ? 0 : diameterSum / skeletonPixels;
        return new Measurement(length, Morphology.countObjects(mask), meanDiameter, byClass);
    }

    /**
     * Per skeleton pixel, half of the links to its skeleton neighbours (1 straight, sqrt 2 diagonal), so each link
     * is counted once overall. An isolated pixel counts 1; background pixels are 0.
     */
    static float[] pixelLengths(BinaryMask skeleton) {
        Mat src = skeleton.toMat();
        Mat ones = new Mat();
        Mat links = new Mat();
        Mat neighbours = new Mat();
        Mat linkKernel = new Mat(3, 3, CvType.CV_32F);
        Mat neighbourKernel = new Mat(3, 3, CvType.CV_32F);
        try {
            src.convertTo(ones, CvType.CV_32F, 1.0 / 255.0);
            float d = (float) (DIAGONAL / 2);
            linkKernel.put(0, 0, d, 0.5f, d, 0.5f, 0f, 0.5f, d, 0.5f, d);
            neighbourKernel.put(0, 0, 1f, 1f, 1f, 1f, 0f, 1f, 1f, 1f, 1f);
            Imgproc.filter2D(ones, links, CvType.CV_32F, linkKernel, new Point(-1, -1), 0, Core.BORDER_CONSTANT);
            Imgproc.filter2D(ones, neighbours, CvType.CV_32F, neighbourKernel, new Point(-1, -1), 0,
                    Core.BORDER_CONSTANT);

            int n = skeleton.width() * skeleton.height();
            float[] l = new float[n];
            float[] count = new float[n];
            links.get(0, 0, l);
            neighbours.get(0, 0, count);
            for (int i = 0; i < n; i++) {
                if (!skeleton.get(i % skeleton.width(), i / skeleton.width())) l[i] = 0f;
                else if (count[i] < 0.5f) l[i] = 1f;
            }
            return l;
        } finally {
            src.release();
            ones.release();
            links.release();
            neighbours.release();
            linkKernel.release();
            neighbourKernel.release();
        }
    }

    /**
     * Class labels for ascending bin edges {@code [b0, ..., bn]}: {@code <b0}, {@code b0-b1}, ..., {@code >=bn}.
     */
    public static List<String> diameterClasses(List<Double> bins) {
        List<String> classes = new ArrayList<>();
        if (bins.isEmpty()) return classes;
        classes.add("<" + bins.get(0));
        for (int i = 1; i < bins.size(); i++) classes.add(bins.get(i - 1) + "-" + bins.get(i));
        classes.add(">=" + bins.get(bins.size() - 1));
        return classes;
    }

    static String diameterClass(List<Double> bins, double diameter) {
        for (int i = 0; i < bins.size(); i++) {
            if (diameter < bins.get(i)) {
                return i == 0 ? "<" + bins.get(0) : bins.get(i - 1) + "-" + bins.get(i);
            }
        }
        return ">=" + bins.get(bins.size() - 1);
    }
}
