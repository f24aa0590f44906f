package com.modtools.idconflict.scan;

import lombok.Builder;
import lombok.Value;

/**
 * Summary of a scan run.
 */
@Value
@Builder(toBuilder = true)
public class ScanStats {

    int filesTotal;
    int filesParsedWithEntries;
    long totalEntriesFound;
    int cacheHits;
    double elapsedSeconds;
    boolean cancelled;
}
