package org.gamma.imgbatch.processing;

import org.gamma.imgbatch.util.FileUtils;
import org.gamma.imgbatch.util.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Matching input images below a root, in sorted depth-first order.
 * <p>
 * Enumeration is lazy. Each directory's mirror under the output and the failure root is created the first time
 * the directory is entered, so the trees only contain subpaths that were actually walked. The output and failure
 * roots themselves are never scanned, unless the output is written in place.
 */
public class PathSet implements Iterable<WorkItem> {

    private static final Logger LOGGER = Logger.getLogger(PathSet.class.getName());

    private final PathLayout layout;
    private final String extension;
    private final boolean mirrorTrees;
    private final List<Path> excludedRoots = new ArrayList<>();

    public PathSet(PathLayout layout, String extension) {
        this(layout, extension, true);
    }

    /**
     * @param mirrorTrees create the output and failure mirrors while enumerating
     */
    public PathSet(PathLayout layout, String extension, boolean mirrorTrees) {
        this.layout = layout;
        this.extension = extension;
        this.mirrorTrees = mirrorTrees;
        if (!layout.inPlace()) excludedRoots.add(layout.outputRoot());
        if (!FileUtils.isUnder(layout.inputRoot(), layout.failureRoot())) excludedRoots.add(layout.failureRoot());
    }

    /**
     * Full pre-pass over the tree. Creates nothing.
     */
    public int count() {
        int count = 0;
        Walker walker = new Walker(false);
        while (walker.hasNext()) {
            walker.next();
            count++;
        }
        return count;
    }

    /**
     * Lazy enumeration that mirrors directories as it goes.
     */
    @Override
    public Iterator<WorkItem> iterator() {
        return new Walker(mirrorTrees);
    }

    public Stream<WorkItem> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(),
                Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    WorkItem toWorkItem(Path file) {
        Path relative = layout.inputRoot().relativize(file.getParent());
        String subpath = FileUtils.toSlashPath(relative);
        String fileName = file.getFileName().toString();
        String outputName = Utils.baseName(fileName) + layout.outputExtension();
        return new WorkItem(file,
                layout.outputRoot().resolve(relative).resolve(outputName),
                layout.failureRoot().resolve(relative).resolve(outputName),
                subpath,
                subpath.isEmpty() ? fileName : subpath + "/" + fileName);
    }

    private boolean isExcluded(Path dir) {
        for (Path root : excludedRoots) {
            if (FileUtils.isUnder(dir, root)) return true;
        }
        return false;
    }

    private void mirror(Path dir) {
        Path relative = layout.inputRoot().relativize(dir);
        for (Path root : List.of(layout.outputRoot(), layout.failureRoot())) {
            Path target = root.resolve(relative);
            try {
                FileUtils.ensureDirectory(target);
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Couldn''t create directory {0}: {1}", new Object[]{target, e.getMessage()});
            }
        }
    }

    private List<Path> list(Path dir) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.sorted().toList();
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Couldn''t list directory {0}, skipping it: {1}", new Object[]{dir, e.getMessage()});
            return List.of();
        }
    }

    private class Walker implements Iterator<WorkItem> {
        private final boolean mirroring;
        private final Deque<Iterator<Path>> stack = new ArrayDeque<>();
        private WorkItem next;

        Walker(boolean mirroring) {
            this.mirroring = mirroring;
            if (Files.isDirectory(layout.inputRoot())) enter(layout.inputRoot());
        }

        private void enter(Path dir) {
            if (mirroring) mirror(dir);
            stack.push(list(dir).iterator());
        }

        private void advance() {
            while (next == null && !stack.isEmpty()) {
                Iterator<Path> top = stack.peek();
                if (!top.hasNext()) {
                    stack.pop();
                    continue;
                }
                Path entry = top.next();
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    if (!isExcluded(entry)) enter(entry);
                } else if (Files.isRegularFile(entry) && FileUtils.matchesExtension(entry, extension)) {
                    next = toWorkItem(entry);
                }
            }
        }

        @Override
        public boolean hasNext() {
            advance();
            return next != null;
        }

        @Override
        public WorkItem next() {
            if (!hasNext()) throw new NoSuchElementException();
            WorkItem item = next;
            next = null;
            return item;
        }
    }
}
