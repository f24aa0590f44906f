package com.modtools.idconflict.cli;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modtools.idconflict.cli.exception.OptionsValidationException;
import com.modtools.idconflict.cli.model.ScanCommandOptions;
import com.modtools.idconflict.cli.model.ValidatedScanOptions;
import com.modtools.idconflict.cli.output.ScanResultsPrinter;
import com.modtools.idconflict.cli.validation.ScanOptionsValidator;
import com.modtools.idconflict.report.ConflictReportRenderer;
import com.modtools.idconflict.report.InstalledMod;
import com.modtools.idconflict.report.InstalledModsLoader;
import com.modtools.idconflict.report.LoadOrderSuggester;
import com.modtools.idconflict.report.ModUpdateChecker;
import com.modtools.idconflict.report.ModUpdateNotice;
import com.modtools.idconflict.report.ReportException;
import com.modtools.idconflict.scan.InventorySnapshot;
import com.modtools.idconflict.scan.InventorySnapshotLoader;
import com.modtools.idconflict.scan.ParseCacheStore;
import com.modtools.idconflict.scan.ScanDiagnostics;
import com.modtools.idconflict.scan.ScanOptions;
import com.modtools.idconflict.scan.ScanOrchestrator;
import com.modtools.idconflict.scan.ScanOutcome;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that scans a mods folder for resource ID conflicts.
 */
@Command(
        name = "scan",
        mixinStandardHelpOptions = true,
        version = "mod-id-conflicts 1.0.0",
        description = "Finds package files in a mods folder that define the same resource key, "
                + "ranks the collisions and optionally writes a report and a load-order suggestion."
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_INVALID_OPTIONS = 2;
    public static final int EXIT_CANCELLED = 130;

    static final String BASE_PACKAGE = "com.modtools.idconflict";
    private static final long SHUTDOWN_GRACE_MS = 2000;

    @Mixin
    private ScanCommandOptions options = new ScanCommandOptions();

    private final ScanOptionsValidator validator;
    private final ScanResultsPrinter printer;
    private final ConflictReportRenderer reportRenderer;
    private final LoadOrderSuggester loadOrderSuggester;
    private final InstalledModsLoader installedModsLoader = new InstalledModsLoader();

    public ScanCommand() {
        this(new ScanOptionsValidator());
    }

    public ScanCommand(ScanOptionsValidator validator) {
        this(validator, new ScanResultsPrinter(), new ConflictReportRenderer(), new LoadOrderSuggester());
    }

    public ScanCommand(ScanOptionsValidator validator, ScanResultsPrinter printer,
                       ConflictReportRenderer reportRenderer, LoadOrderSuggester loadOrderSuggester) {
        this.validator = validator;
        this.printer = printer;
        this.reportRenderer = reportRenderer;
        this.loadOrderSuggester = loadOrderSuggester;
    }

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            setPackageLogLevel(Level.DEBUG);
        }

        ValidatedScanOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            log.error("Invalid options:");
            e.getErrors().forEach(error -> log.error("  {}", error));
            return EXIT_INVALID_OPTIONS;
        }

        printer.printBanner(validated);

        ScanOrchestrator orchestrator = new ScanOrchestrator(
                validated.getCacheFile() != null ? new ParseCacheStore(validated.getCacheFile()) : null);
        AtomicBoolean cancel = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            cancel.set(true);
            orchestrator.cancel();
            awaitQuietly(finished);
        }, "scan-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            ScanDiagnostics diagnostics = new ScanDiagnostics();
            ScanOutcome outcome = orchestrator.scan(validated.getRoot(), withInventory(validated, diagnostics), cancel,
                    printer.progressListener(), diagnostics);
            if (outcome.isCancelled()) {
                printer.printCancelled(outcome);
                return EXIT_CANCELLED;
            }
            printer.printSummary(outcome);
            List<ModUpdateNotice> updateNotices = checkUpdates(validated, outcome);
            writeOutputs(validated, outcome, updateNotices);
            return EXIT_OK;
        } catch (ReportException e) {
            log.error("{}: {}", e.getMessage(), e.getCause() != null ? e.getCause().toString() : "unknown cause");
            return EXIT_FAILURE;
        } catch (Exception e) {
            log.error("Scan failed with exception", e);
            return EXIT_FAILURE;
        } finally {
            finished.countDown();
            removeHook(hook);
        }
    }

    private ScanOptions withInventory(ValidatedScanOptions validated, ScanDiagnostics diagnostics) {
        ScanOptions scanOptions = validated.getScanOptions();
        if (validated.getInventoryFile() == null) {
            return scanOptions;
        }
        InventorySnapshot snapshot = new InventorySnapshotLoader()
                .load(validated.getInventoryFile(), diagnostics);
        return scanOptions.toBuilder()
                .inventorySnapshot(snapshot)
                .useInventory(snapshot != null)
                .build();
    }

    private List<ModUpdateNotice> checkUpdates(ValidatedScanOptions validated, ScanOutcome outcome) {
        if (validated.getInstalledModsFile() == null || outcome.getRecords().isEmpty()) {
            return List.of();
        }
        Map<String, InstalledMod> installed = installedModsLoader.load(validated.getInstalledModsFile(),
                validated.getRoot());
        List<ModUpdateNotice> notices = new ModUpdateChecker(validated.getLatestPatch(), ZoneId.systemDefault())
                .check(outcome.getRecords(), installed);
        printer.printUpdateCheck(notices);
        return notices;
    }

    private void writeOutputs(ValidatedScanOptions validated, ScanOutcome outcome, List<ModUpdateNotice> updateNotices) {
        Path root = validated.getRoot();
        if (validated.getReportFile() != null) {
            reportRenderer.write(root, outcome, updateNotices, validated.getReportFile());
        }
        if (validated.getLoadOrderFile() != null) {
            loadOrderSuggester.write(root, outcome.getRecords(), validated.getLoadOrderFile());
        }
    }

    static void setPackageLogLevel(Level level) {
        org.slf4j.Logger logger = LoggerFactory.getLogger(BASE_PACKAGE);
        if (logger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) logger).setLevel(level);
        }
    }

    private static void awaitQuietly(CountDownLatch finished) {
        try {
            finished.await(SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down, leaving shutdown hook in place");
        }
    }
}
