package com.modtools.idconflict.report;

import java.nio.file.Path;
import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * A conflicting mod folder worth checking for an update, with the reasons that flagged it.
 */
@Value
public class ModUpdateNotice {

    @NonNull
    Path folder;

    @NonNull
    List<String> reasons;

    public String getFolderName() {
        Path name = folder.getFileName();
        return name != null ? name.toString() : folder.toString();
    }

    /**
     * {@code "FolderName (reason; reason)"}.
     */
    public String toDisplayLine() {
        return getFolderName() + " (" + String.join("; ", reasons) + ")";
    }
}
