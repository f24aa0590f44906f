package com.modtools.idconflict.cli.output;

import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modtools.idconflict.cli.model.ValidatedScanOptions;
import com.modtools.idconflict.model.ConflictRecord;
import com.modtools.idconflict.model.ContributingFile;
import com.modtools.idconflict.model.Severity;
import com.modtools.idconflict.report.ModUpdateNotice;
import com.modtools.idconflict.scan.ScanDiagnostics;
import com.modtools.idconflict.scan.ScanOptions;
import com.modtools.idconflict.scan.ScanOutcome;
import com.modtools.idconflict.scan.ScanProgressListener;
import com.modtools.idconflict.scan.ScanStats;

/**
 * Responsible only for printing CLI output for the "scan" command.
 * No validation, no scanning.
 */
public class ScanResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ScanResultsPrinter.class);

    static final int TOP_CONFLICTS = 10;

    public void printBanner(ValidatedScanOptions v) {
        ScanOptions o = v.getScanOptions();
        log.info("=================================================");
        log.info("Mod ID Conflict Scanner");
        log.info("=================================================");
        log.info("Mods Folder: {}", v.getRoot());
        log.info("Extensions: {}", String.join(", ", o.getExtensions()));
        log.info("Recursive: {}", o.isRecursive());
        log.info("Tail Scanning: {}", o.isFastMode() ? "off (--fast)" : "on");
        log.info("Workers: {}", o.getWorkerCount() > 0 ? o.getWorkerCount() : "auto (" + o.resolvedWorkerCount() + ")");
        log.info("Parse Cache: {}", v.getCacheFile() != null ? v.getCacheFile() : "disabled");
        log.info("Inventory Snapshot: {}", v.getInventoryFile() != null ? v.getInventoryFile() : "None");
        if (v.getInstalledModsFile() != null) {
            log.info("Installed Mods: {}", v.getInstalledModsFile());
            log.info("Latest Patch: {}", v.getLatestPatch() != null ? v.getLatestPatch() : "unknown");
        }
        log.info("=================================================");
    }

    /**
     * Logs progress every tenth of the candidate list, and once at the end.
     */
    public ScanProgressListener progressListener() {
        return new ScanProgressListener() {
            private int lastDecile = -1;

            @Override
            public void onProgress(int processed, int total) {
                int decile = total == 0 ? 10 : processed * 10 / total;
                if (decile != lastDecile) {
                    lastDecile = decile;
                    log.info("Scanned {}/{} packages", processed, total);
                }
            }
        };
    }

    public void printSummary(ScanOutcome outcome) {
        ScanStats stats = outcome.getStats();
        List<ConflictRecord> records = outcome.getRecords();

        log.info("");
        log.info("=================================================");
        log.info("SCAN COMPLETE");
        log.info("=================================================");
        log.info("Packages Scanned: {}", stats.getFilesTotal());
        log.info("Packages With Index Entries: {}", stats.getFilesParsedWithEntries());
        log.info("Index Entries: {}", stats.getTotalEntriesFound());
        log.info("Cache Hits: {}", stats.getCacheHits());
        log.info("Elapsed: {}s", String.format(Locale.ROOT, "%.1f", stats.getElapsedSeconds()));
        log.info("");
        log.info("Conflicts: {}", records.size());
        for (Severity severity : Severity.values()) {
            long count = records.stream().filter(r -> r.getSeverity() == severity).count();
            if (count > 0) {
                log.info("  {}: {}", severity.getDisplayName(), count);
            }
        }

        if (!records.isEmpty()) {
            log.info("");
            log.info("Most urgent:");
            records.stream().limit(TOP_CONFLICTS).forEach(this::printRecord);
            if (records.size() > TOP_CONFLICTS) {
                log.info("  ... {} more (use --report for the full list)", records.size() - TOP_CONFLICTS);
            }
        }

        printDiagnostics(outcome.getDiagnostics());
        log.info("=================================================");
    }

    public void printUpdateCheck(List<ModUpdateNotice> notices) {
        log.info("");
        if (notices.isEmpty()) {
            log.info("Update check: no conflicting mod needs attention");
            return;
        }
        log.info("Check for updates:");
        notices.forEach(notice -> log.info("  - {}", notice.toDisplayLine()));
    }

    public void printCancelled(ScanOutcome outcome) {
        ScanStats stats = outcome.getStats();
        log.warn("Scan cancelled after {}s; no results were kept and the parse cache was not updated",
                String.format(Locale.ROOT, "%.1f", stats.getElapsedSeconds()));
    }

    private void printRecord(ConflictRecord record) {
        log.info("  [{}] {} {} ({} files)", record.getSeverity().getDisplayName(), record.getKey().toHexString(),
                record.getLabel(), record.getFileCount());
        for (ContributingFile file : record.getFiles()) {
            log.info("      {}{}", file.getPath(), file.isHasCompanionScript() ? " [script]" : "");
        }
    }

    private void printDiagnostics(ScanDiagnostics diagnostics) {
        if (!diagnostics.hasErrors() && !diagnostics.hasWarnings()) {
            return;
        }
        log.info("");
        log.info("Diagnostics:");
        diagnostics.getErrors().forEach(e -> log.error("  {}", e));
        diagnostics.getWarnings().forEach(w -> log.warn("  {}", w));
    }
}
