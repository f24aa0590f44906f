package com.modtools.idconflict.scan;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A previously recorded listing of a mods folder. Entry paths are relative to {@link #root}.
 */
@Value
@Builder
public class InventorySnapshot {

    public static final String PACKAGE_TYPE = "package";

    @NonNull
    Path root;

    @Singular
    List<Entry> entries;

    @Value
    @Builder
    public static class Entry {
        @NonNull
        String path;
        long mtime;
        long size;
        String type;

        public boolean isPackage() {
            return type != null && PACKAGE_TYPE.equals(type.toLowerCase(Locale.ROOT));
        }
    }

    /**
     * True when this snapshot was taken of exactly {@code scanRoot}.
     */
    public boolean isRootedAt(Path scanRoot) {
        return normalize(root).equals(normalize(scanRoot));
    }

    /**
     * Package entries resolved against the root that still exist as regular files.
     */
    public List<Path> existingPackages() {
        Path base = normalize(root);
        List<Path> result = new ArrayList<>();
        for (Entry entry : entries) {
            if (!entry.isPackage()) {
                continue;
            }
            Path full = base.resolve(entry.getPath()).normalize();
            if (Files.isRegularFile(full)) {
                result.add(full);
            }
        }
        return result;
    }

    private static Path normalize(Path p) {
        return p.toAbsolutePath().normalize();
    }
}
