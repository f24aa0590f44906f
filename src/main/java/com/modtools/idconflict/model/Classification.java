package com.modtools.idconflict.model;

import java.time.Instant;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Derived metadata for one collision. Computed from a key and its file list.
 */
@Value
@Builder
public class Classification {

    @NonNull
    ResourceCategory category;

    @NonNull
    String label;

    @NonNull
    Severity severity;

    @NonNull
    ConflictPriority priority;

    /** Newest modification time across the contributing files, null when none is known. */
    Instant latestModified;
}
