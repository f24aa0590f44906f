package com.modtools.idconflict.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One package file that defines at least one resource key.
 * The same instance is shared by every conflict record the file takes part in.
 */
@Value
public class ContributingFile {

    @NonNull
    Path path;

    @NonNull
    Instant modified;

    long size;

    boolean hasCompanionScript;

    @NonNull
    SortedSet<String> keywordTags;

    @Builder
    public ContributingFile(@NonNull Path path, @NonNull Instant modified, long size,
                            boolean hasCompanionScript, Set<String> keywordTags) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0: " + size);
        }
        this.path = path;
        this.modified = modified;
        this.size = size;
        this.hasCompanionScript = hasCompanionScript;
        this.keywordTags = keywordTags == null
                ? new TreeSet<>()
                : new TreeSet<>(keywordTags);
    }

    public String getFileName() {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }

    public Path getFolder() {
        Path parent = path.getParent();
        return parent != null ? parent : path;
    }

    public SortedSet<String> getKeywordTags() {
        return Collections.unmodifiableSortedSet(keywordTags);
    }
}
