package org.gamma.imgbatch.util;

import java.util.ArrayList;
import java.util.List;

/**
 * String helpers for delimited table cells and file names.
 */
public final class Utils {

    private Utils() {
    }

    /**
     * Quotes a cell when it contains the delimiter, a quote or a line break; embedded quotes are doubled.
     */
    public static String escapeField(String field, char delimiter) {
        if (field == null) {
            return "";
        } else {
            boolean mustQuote = field.indexOf(delimiter) >= 0 || field.contains("\"") || field.contains("\n") || field.contains("\r");
            String escaped = field.replace("\"", "\"\"");
            return mustQuote ? "\"" + escaped + "\"" : escaped;
        }
    }

    /**
     * Splits one delimited line, honouring double-quoted cells.
     */
    public static List<String> splitDelimitedLine(String line, char delimiter) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
            } else if (c == delimiter) {
                cells.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        cells.add(current.toString());
        return cells;
    }

    /**
     * File name without its last extension ({@code "img.tar.png" -> "img.tar"}).
     */
    public static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Format name for {@link javax.imageio.ImageIO} derived from an extension such as {@code ".tif"}.
     */
    public static String formatName(String extension) {
        String ext = extension.startsWith(".") ? extension.substring(1) : extension;
        ext = ext.toLowerCase();
        if (ext.equals("jpg")) return "jpeg";
        if (ext.equals("tif")) return "tiff";
        return ext;
    }
}
