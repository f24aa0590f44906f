package com.modtools.idconflict.model;

/**
 * Collision severity, declared from most to least urgent.
 */
public enum Severity {
    CRITICAL("Critical", 0),
    HIGH("High", 1),
    MODERATE("Moderate", 2),
    LOW("Low", 3);

    private final String displayName;
    private final int rank;

    Severity(String displayName, int rank) {
        this.displayName = displayName;
        this.rank = rank;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getRank() {
        return rank;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
