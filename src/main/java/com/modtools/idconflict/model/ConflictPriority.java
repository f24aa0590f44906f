package com.modtools.idconflict.model;

import java.util.Comparator;

import lombok.Value;

/**
 * Sort tuple {@code (severityRank, categoryRank, -fileCount)}; smaller sorts first.
 */
@Value
public class ConflictPriority implements Comparable<ConflictPriority> {

    private static final Comparator<ConflictPriority> ORDER = Comparator
            .comparingInt(ConflictPriority::getSeverityRank)
            .thenComparingInt(ConflictPriority::getCategoryRank)
            .thenComparingLong(ConflictPriority::getNegatedFileCount);

    int severityRank;
    int categoryRank;
    long negatedFileCount;

    public static ConflictPriority of(Severity severity, ResourceCategory category, int fileCount) {
        return new ConflictPriority(severity.getRank(), category.getRank(), -(long) fileCount);
    }

    @Override
    public int compareTo(ConflictPriority other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + severityRank + ", " + categoryRank + ", " + negatedFileCount + ")";
    }
}
