package com.modtools.idconflict.cli.model;

import java.nio.file.Path;
import java.time.LocalDate;

import com.modtools.idconflict.scan.ScanOptions;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Normalized values the command runs with.
 */
@Data
@AllArgsConstructor
public class ValidatedScanOptions {
    Path root;
    ScanOptions scanOptions;
    /** Null when caching is disabled. */
    Path cacheFile;
    /** Null when no snapshot was given. */
    Path inventoryFile;
    Path reportFile;
    Path loadOrderFile;
    /** Null when no update check was requested. */
    Path installedModsFile;
    LocalDate latestPatch;
}
