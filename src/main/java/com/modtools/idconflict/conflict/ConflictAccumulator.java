package com.modtools.idconflict.conflict;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.modtools.idconflict.model.ContributingFile;
import com.modtools.idconflict.model.ResourceKey;

/**
 * Folds per-file parse results into a key -> files mapping.
 *
 * Not thread-safe: a single consumer thread feeds it. The result does not depend on the order
 * in which files are added.
 */
public class ConflictAccumulator {

    private final FileMetadataProbe probe;
    private final Map<ResourceKey, List<ContributingFile>> filesByKey = new HashMap<>();

    private int filesWithKeys;
    private long keysSeen;

    public ConflictAccumulator() {
        this(new FileMetadataProbe());
    }

    public ConflictAccumulator(FileMetadataProbe probe) {
        this.probe = probe;
    }

    /**
     * Records that {@code path} defines {@code keys}. Files without keys, and files that vanished
     * before they could be stat-ed, contribute nothing.
     *
     * @return true when the file was attached to at least one key
     */
    public boolean add(Path path, Collection<ResourceKey> keys) {
        if (keys == null || keys.isEmpty()) {
            return false;
        }
        Optional<ContributingFile> described = probe.describe(path);
        if (described.isEmpty()) {
            return false;
        }
        ContributingFile file = described.get();
        boolean attached = false;
        for (ResourceKey key : new LinkedHashSet<>(keys)) {
            if (key.isEmpty()) {
                continue;
            }
            filesByKey.computeIfAbsent(key, k -> new ArrayList<>(2)).add(file);
            keysSeen++;
            attached = true;
        }
        if (attached) {
            filesWithKeys++;
        }
        return attached;
    }

    /**
     * Keys defined by two or more files, with their files.
     */
    public Map<ResourceKey, List<ContributingFile>> conflicts() {
        Map<ResourceKey, List<ContributingFile>> result = new LinkedHashMap<>();
        filesByKey.forEach((key, files) -> {
            if (files.size() >= 2) {
                result.put(key, List.copyOf(files));
            }
        });
        return result;
    }

    public int distinctKeyCount() {
        return filesByKey.size();
    }

    public int getFilesWithKeys() {
        return filesWithKeys;
    }

    public long getKeysSeen() {
        return keysSeen;
    }
}
