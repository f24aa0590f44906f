package com.modtools.idconflict.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

import lombok.Getter;
import lombok.NonNull;

/**
 * A resource key defined by two or more package files, with its classification.
 *
 * Instances are immutable. Files are kept ordered by path so that two scans over the same
 * files produce equal records regardless of the order in which parse results arrived.
 */
@Getter
public final class ConflictRecord {

    public static final Comparator<ConflictRecord> BY_PRIORITY = Comparator
            .comparing(ConflictRecord::getPriority)
            .thenComparing(ConflictRecord::getKey);

    private final ResourceKey key;
    private final List<ContributingFile> files;
    private final ResourceCategory category;
    private final String label;
    private final Severity severity;
    private final ConflictPriority priority;
    private final Instant latestModified;

    public ConflictRecord(@NonNull ResourceKey key, @NonNull List<ContributingFile> files,
                          @NonNull Classification classification) {
        if (files.size() < 2) {
            throw new IllegalArgumentException("A conflict needs at least two files, got "
                    + files.size() + " for " + key);
        }
        List<ContributingFile> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparing(f -> f.getPath().toString()));
        this.key = key;
        this.files = Collections.unmodifiableList(sorted);
        this.category = classification.getCategory();
        this.label = classification.getLabel();
        this.severity = classification.getSeverity();
        this.priority = classification.getPriority();
        this.latestModified = classification.getLatestModified();
    }

    public int getFileCount() {
        return files.size();
    }

    public boolean isHasScript() {
        return files.stream().anyMatch(ContributingFile::isHasCompanionScript);
    }

    /** Union of the keyword tags of all contributing files. */
    public SortedSet<String> getKeywords() {
        SortedSet<String> all = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (ContributingFile file : files) {
            all.addAll(file.getKeywordTags());
        }
        return all;
    }

    public String getKeywordSummary() {
        return String.join(", ", getKeywords());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConflictRecord)) return false;
        ConflictRecord other = (ConflictRecord) o;
        return key.equals(other.key)
                && files.equals(other.files)
                && category == other.category
                && label.equals(other.label)
                && severity == other.severity
                && priority.equals(other.priority)
                && Objects.equals(latestModified, other.latestModified);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, files, category, label, severity, priority, latestModified);
    }

    @Override
    public String toString() {
        return "ConflictRecord{" + key.toHexString() + ", " + severity + ", " + category
                + ", files=" + files.size() + "}";
    }
}
