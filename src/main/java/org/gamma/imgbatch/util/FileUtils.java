package org.gamma.imgbatch.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileUtils {

    /**
     * Literal, case-sensitive suffix match on the file name. A blank extension matches everything.
     */
    public static boolean matchesExtension(final Path file, final String extension) {
        if (extension == null || extension.isEmpty()) return true;
        return file.getFileName().toString().endsWith(extension);
    }

    /**
     * True when {@code path} equals {@code root} or lies below it. Both are compared in absolute, normalized form.
     */
    public static boolean isUnder(final Path path, final Path root) {
        if (root == null) return false;
        return path.toAbsolutePath().normalize().startsWith(root.toAbsolutePath().normalize());
    }

    /**
     * Relative path rendered with {@code /} separators, empty for the root itself.
     */
    public static String toSlashPath(final Path relative) {
        if (relative == null || relative.toString().isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (Path part : relative) {
            if (!sb.isEmpty()) sb.append('/');
            sb.append(part);
        }
        return sb.toString();
    }

    /**
     * Creates the directory and any missing parents. Existing directories are not an error.
     */
    public static Path ensureDirectory(final Path dir) throws IOException {
        if (!Files.isDirectory(dir)) Files.createDirectories(dir);
        return dir;
    }
}
