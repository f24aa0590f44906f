package com.modtools.idconflict.scan;

import java.util.List;

import com.modtools.idconflict.model.ConflictRecord;

import lombok.NonNull;
import lombok.Value;

/**
 * Result of a scan. A cancelled scan never carries records.
 */
@Value
public class ScanOutcome {

    @NonNull
    List<ConflictRecord> records;

    @NonNull
    ScanStats stats;

    @NonNull
    ScanDiagnostics diagnostics;

    public static ScanOutcome completed(List<ConflictRecord> records, ScanStats stats, ScanDiagnostics diagnostics) {
        return new ScanOutcome(List.copyOf(records), stats, diagnostics);
    }

    public static ScanOutcome cancelled(ScanStats stats, ScanDiagnostics diagnostics) {
        return new ScanOutcome(List.of(), stats.toBuilder().cancelled(true).build(), diagnostics);
    }

    public boolean isCancelled() {
        return stats.isCancelled();
    }
}
