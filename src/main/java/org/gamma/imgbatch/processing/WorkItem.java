package org.gamma.imgbatch.processing;

import java.nio.file.Path;

/**
 * One unit of batch work: an input image and the two places its artifact may end up.
 *
 * @param relativeSubpath directory of the input relative to the input root, {@code /}-separated, empty at the root
 * @param displayName     {@code relativeSubpath/fileName}; used in logs and as the table's image name
 */
public record WorkItem(Path inputPath, Path outputPath, Path failurePath, String relativeSubpath, String displayName) {
}
