package com.modtools.idconflict;

import com.modtools.idconflict.cli.ScanCommand;
import picocli.CommandLine;

/**
 * Main entry point for the mod ID conflict scanner.
 * Scans a mods folder for package files that define the same resource key and reports the collisions.
 */
public class IdConflictApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ScanCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
