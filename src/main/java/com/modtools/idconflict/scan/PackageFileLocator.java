package com.modtools.idconflict.scan;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the candidate package files under a scan root, from an inventory snapshot when one
 * matches the root, otherwise by walking the directory tree.
 */
public class PackageFileLocator {
    private static final Logger log = LoggerFactory.getLogger(PackageFileLocator.class);

    public List<Path> locate(Path root, ScanOptions options, AtomicBoolean cancel, ScanDiagnostics diagnostics) {
        if (options.isUseInventory()) {
            Optional<List<Path>> fromInventory = fromInventory(root, options.getInventorySnapshot());
            if (fromInventory.isPresent()) {
                log.debug("Using inventory snapshot: {} packages", fromInventory.get().size());
                return sorted(fromInventory.get());
            }
        }
        return sorted(walk(root, options, cancel, diagnostics));
    }

    /**
     * Package files listed by the snapshot, if it was taken of {@code root} and lists any.
     */
    Optional<List<Path>> fromInventory(Path root, InventorySnapshot snapshot) {
        if (snapshot == null) {
            return Optional.empty();
        }
        if (!snapshot.isRootedAt(root)) {
            log.debug("Inventory snapshot root {} does not match {}", snapshot.getRoot(), root);
            return Optional.empty();
        }
        List<Path> packages = snapshot.existingPackages();
        return packages.isEmpty() ? Optional.empty() : Optional.of(packages);
    }

    List<Path> walk(Path root, ScanOptions options, AtomicBoolean cancel, ScanDiagnostics diagnostics) {
        List<Path> found = new ArrayList<>();
        int maxDepth = options.isRecursive() ? Integer.MAX_VALUE : 1;
        try {
            Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), maxDepth, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    return isCancelled(cancel) ? FileVisitResult.TERMINATE : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (isCancelled(cancel)) {
                        return FileVisitResult.TERMINATE;
                    }
                    if (attrs.isRegularFile() && options.matchesExtension(file.getFileName().toString())) {
                        found.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    String message = "Cannot read " + file + " (" + exc.getMessage() + ")";
                    log.warn(message);
                    diagnostics.getWarnings().add(message);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            String message = "Directory walk of " + root + " failed (" + e.getMessage() + ")";
            log.error(message, e);
            diagnostics.getErrors().add(message);
        }
        return found;
    }

    private static List<Path> sorted(List<Path> paths) {
        List<Path> copy = new ArrayList<>(paths);
        copy.sort(Comparator.comparing(Path::toString));
        return copy;
    }

    private static boolean isCancelled(AtomicBoolean cancel) {
        return cancel != null && cancel.get();
    }
}
