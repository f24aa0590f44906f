package com.modtools.idconflict.model;

/**
 * Broad resource families, in report order (Gameplay first).
 */
public enum ResourceCategory {
    GAMEPLAY("Gameplay"),
    SCRIPT("Script"),
    BUILD_BUY("Build/Buy"),
    CAS("CAS"),
    TEXTURE("Texture"),
    AUDIO("Audio"),
    OTHER("Other");

    private final String displayName;

    ResourceCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getRank() {
        return ordinal();
    }

    @Override
    public String toString() {
        return displayName;
    }
}
