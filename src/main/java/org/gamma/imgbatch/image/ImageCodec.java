package org.gamma.imgbatch.image;

import org.gamma.imgbatch.util.Utils;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Set;

/**
 * Reads and writes images through {@link ImageIO}.
 */
public class ImageCodec {

    private static final Set<String> OPAQUE_FORMATS = Set.of("jpeg", "bmp");

    /**
     * @throws IOException when the file cannot be read or no reader understands it
     */
    public BufferedImage read(Path path) throws IOException {
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) throw new IOException("Unsupported or corrupt image: " + path);
        return image;
    }

    /**
     * Writes {@code image} in the format implied by the file extension. The file appears under its final name
     * only once it is complete.
     */
    public void write(BufferedImage image, Path path) throws IOException {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) throw new IOException("No image format for file without extension: " + path);
        String format = Utils.formatName(fileName.substring(dot));
        BufferedImage toWrite = OPAQUE_FORMATS.contains(format) ? withoutAlpha(image) : image;

        Path tmp = path.resolveSibling("." + fileName + ".tmp");
        try {
            if (!ImageIO.write(toWrite, format, tmp.toFile()))
                throw new IOException("No image writer for format '" + format + "'");
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    static BufferedImage withoutAlpha(BufferedImage image) {
        if (!image.getColorModel().hasAlpha()) return image;
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
