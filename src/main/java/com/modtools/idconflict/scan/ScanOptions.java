package com.modtools.idconflict.scan;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for one scan, passed explicitly to {@link ScanOrchestrator#scan}.
 */
@Value
@Builder(toBuilder = true)
public class ScanOptions {

    public static final int MIN_WORKERS = 2;
    public static final int MAX_WORKERS = 8;

    /** Descend into sub-folders when walking the root. */
    @Builder.Default
    boolean recursive = true;

    /** Prefer the inventory snapshot over a directory walk when its root matches. */
    @Builder.Default
    boolean useInventory = true;

    /** Skip the tail-scanning fallback of the reader. */
    @Builder.Default
    boolean fastMode = false;

    /** File name suffixes of candidate packages, compared case-insensitively. */
    @Builder.Default
    Set<String> extensions = Set.of(".package");

    /** Worker threads for parsing; 0 picks {@code clamp(cpuCount, 2, 8)}. */
    @Builder.Default
    int workerCount = 0;

    /** Up to this many candidates are parsed on the calling thread. */
    @Builder.Default
    int sequentialThreshold = 4;

    /** Optional filesystem inventory used instead of a walk. */
    InventorySnapshot inventorySnapshot;

    public static ScanOptions defaults() {
        return ScanOptions.builder().build();
    }

    public int resolvedWorkerCount() {
        if (workerCount > 0) {
            return workerCount;
        }
        int cpus = Runtime.getRuntime().availableProcessors();
        return Math.max(MIN_WORKERS, Math.min(MAX_WORKERS, cpus));
    }

    public Set<String> normalizedExtensions() {
        return extensions.stream()
                .map(e -> e.startsWith(".") ? e : "." + e)
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean matchesExtension(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return normalizedExtensions().stream().anyMatch(lower::endsWith);
    }
}
