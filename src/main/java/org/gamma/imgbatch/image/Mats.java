package org.gamma.imgbatch.image;

import nu.pattern.OpenCV;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Conversions between {@link BufferedImage} and OpenCV {@link Mat}. Colour mats use OpenCV's BGR byte order,
 * or ABGR when alpha is kept.
 */
public final class Mats {

    static {
        OpenCV.loadLocally();
    }

    private Mats() {
    }

    /**
     * Makes sure the native library is loaded before any {@link Mat} is created.
     */
    public static void load() {
        // class initialization does the work
    }

    /**
     * 8-bit BGR for colour images, 8- or 16-bit single channel for grey ones. Alpha is dropped.
     */
    public static Mat toMat(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        if (image.getColorModel().getNumColorComponents() < 3) {
            if (image.getType() == BufferedImage.TYPE_USHORT_GRAY) {
                Mat mat = new Mat(h, w, CvType.CV_16UC1);
                mat.put(0, 0, (short[]) image.getRaster().getDataElements(0, 0, w, h, null));
                return mat;
            }
            BufferedImage gray = image.getType() == BufferedImage.TYPE_BYTE_GRAY
                    ? image : redraw(image, BufferedImage.TYPE_BYTE_GRAY);
            Mat mat = new Mat(h, w, CvType.CV_8UC1);
            mat.put(0, 0, (byte[]) gray.getRaster().getDataElements(0, 0, w, h, null));
            return mat;
        }
        BufferedImage bgr = redraw(image, BufferedImage.TYPE_3BYTE_BGR);
        Mat mat = new Mat(h, w, CvType.CV_8UC3);
        mat.put(0, 0, ((DataBufferByte) bgr.getRaster().getDataBuffer()).getData());
        return mat;
    }

    /**
     * Like {@link #toMat} for opaque images; images with alpha become 4-channel ABGR and grey ones BGR.
     */
    public static Mat toColorMat(BufferedImage image) {
        boolean alpha = image.getColorModel().hasAlpha();
        BufferedImage converted = redraw(image, alpha ? BufferedImage.TYPE_4BYTE_ABGR : BufferedImage.TYPE_3BYTE_BGR);
        Mat mat = new Mat(image.getHeight(), image.getWidth(), alpha ? CvType.CV_8UC4 : CvType.CV_8UC3);
        mat.put(0, 0, ((DataBufferByte) converted.getRaster().getDataBuffer()).getData());
        return mat;
    }

    /**
     * 8-bit mats only: one channel becomes grey, three BGR, four ABGR.
     */
    public static BufferedImage toImage(Mat mat) {
        if (mat.depth() != CvType.CV_8U)
            throw new IllegalArgumentException("Expected an 8-bit mat, got " + CvType.typeToString(mat.type()));
        int type = switch (mat.channels()) {
            case 1 -> BufferedImage.TYPE_BYTE_GRAY;
            case 3 -> BufferedImage.TYPE_3BYTE_BGR;
            case 4 -> BufferedImage.TYPE_4BYTE_ABGR;
            default -> throw new IllegalArgumentException("Unsupported channel count " + mat.channels());
        };
        BufferedImage image = new BufferedImage(mat.cols(), mat.rows(), type);
        Mat source = mat.isContinuous() ? mat : mat.clone();
        source.get(0, 0, ((DataBufferByte) image.getRaster().getDataBuffer()).getData());
        return image;
    }

    private static BufferedImage redraw(BufferedImage image, int type) {
        BufferedImage out = new BufferedImage(image.getWidth(), image.getHeight(), type);
        Graphics2D g = out.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return out;
    }
}
