package com.modtools.idconflict.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.modtools.idconflict.cli.exception.OptionsValidationException;
import com.modtools.idconflict.cli.model.ScanCommandOptions;
import com.modtools.idconflict.cli.model.ValidatedScanOptions;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ScanOptionsValidator.
 */
class ScanOptionsValidatorTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() throws IOException {
        Path mods = Files.createDirectories(tempDir.resolve("Mods"));
        Path defaultCache = tempDir.resolve("home/cache.json");

        ValidatedScanOptions v = new ScanOptionsValidator(defaultCache).validate(parse("--root", mods.toString()));

        assertThat(v.getRoot()).isEqualTo(mods.toAbsolutePath().normalize());
        assertThat(v.getCacheFile()).isEqualTo(defaultCache.toAbsolutePath().normalize());
        assertThat(v.getInventoryFile()).isNull();
        assertThat(v.getReportFile()).isNull();
        assertThat(v.getScanOptions().isRecursive()).isTrue();
        assertThat(v.getScanOptions().isFastMode()).isFalse();
        assertThat(v.getScanOptions().getExtensions()).containsExactly(".package");
        assertThat(v.getScanOptions().getWorkerCount()).isZero();
    }

    @Test
    void testFlagsAreCarriedOver() throws IOException {
        Path mods = Files.createDirectories(tempDir.resolve("Mods"));
        Path inventory = Files.writeString(tempDir.resolve("inventory.json"), "{}");

        ValidatedScanOptions v = new ScanOptionsValidator().validate(parse(
                "-r", mods.toString(), "--no-cache", "--no-recursive", "--fast", "--workers", "4",
                "-e", "PKG", "--extension", ".package", "--inventory", inventory.toString(),
                "--report", tempDir.resolve("report.txt").toString()));

        assertThat(v.getCacheFile()).isNull();
        assertThat(v.getInventoryFile()).isEqualTo(inventory.toAbsolutePath().normalize());
        assertThat(v.getReportFile()).isEqualTo(tempDir.resolve("report.txt").toAbsolutePath().normalize());
        assertThat(v.getScanOptions().isRecursive()).isFalse();
        assertThat(v.getScanOptions().isFastMode()).isTrue();
        assertThat(v.getScanOptions().isUseInventory()).isTrue();
        assertThat(v.getScanOptions().getWorkerCount()).isEqualTo(4);
        assertThat(v.getScanOptions().getExtensions()).containsExactlyInAnyOrder(".pkg", ".package");
    }

    @Test
    void testCollectsEveryProblem() throws IOException {
        Path notADir = Files.writeString(tempDir.resolve("file.txt"), "x");
        Path sameTarget = tempDir.resolve("out.txt");

        assertThatThrownBy(() -> new ScanOptionsValidator().validate(parse(
                "--root", notADir.toString(),
                "--cache", tempDir.resolve("c.json").toString(), "--no-cache",
                "--inventory", tempDir.resolve("missing.json").toString(),
                "--workers=-1",
                "--extension", " ",
                "--report", sameTarget.toString(), "--load-order", sameTarget.toString())))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(6)
                        .anyMatch(m -> m.startsWith("Mods folder does not exist"))
                        .anyMatch(m -> m.contains("--no-cache"))
                        .anyMatch(m -> m.startsWith("Inventory snapshot does not exist"))
                        .anyMatch(m -> m.startsWith("Worker count"))
                        .anyMatch(m -> m.startsWith("Extension must not be blank"))
                        .anyMatch(m -> m.contains("different files")));
    }

    @Test
    void testDirectoryAsReportTargetIsRejected() throws IOException {
        Path mods = Files.createDirectories(tempDir.resolve("Mods"));

        assertThatThrownBy(() -> new ScanOptionsValidator().validate(parse(
                "--root", mods.toString(), "--no-cache", "--report", tempDir.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Report target is a directory");
    }

    @Test
    void testLoadOrderWithoutFileWritesIntoModsFolder() throws IOException {
        Path mods = Files.createDirectories(tempDir.resolve("Mods"));

        ValidatedScanOptions v = new ScanOptionsValidator().validate(parse(
                "--root", mods.toString(), "--no-cache", "--load-order"));

        assertThat(v.getLoadOrderFile()).isEqualTo(mods.toAbsolutePath().normalize().resolve("load_order_suggestion.json"));
    }

    @Test
    void testLoadOrderIsOffByDefault() throws IOException {
        Path mods = Files.createDirectories(tempDir.resolve("Mods"));

        ValidatedScanOptions v = new ScanOptionsValidator().validate(parse("--root", mods.toString(), "--no-cache"));

        assertThat(v.getLoadOrderFile()).isNull();
        assertThat(v.getInstalledModsFile()).isNull();
        assertThat(v.getLatestPatch()).isNull();
    }

    @Test
    void testUpdateCheckOptions() throws IOException {
        Path mods = Files.createDirectories(tempDir.resolve("Mods"));
        Path installed = Files.writeString(tempDir.resolve("installed_mods.json"), "[]");

        ValidatedScanOptions v = new ScanOptionsValidator().validate(parse("--root", mods.toString(), "--no-cache",
                "--installed-mods", installed.toString(), "--latest-patch", "2024-03-01"));

        assertThat(v.getInstalledModsFile()).isEqualTo(installed.toAbsolutePath().normalize());
        assertThat(v.getLatestPatch()).isEqualTo(LocalDate.of(2024, 3, 1));
    }

    @Test
    void testUpdateCheckProblemsAreReported() throws IOException {
        Path mods = Files.createDirectories(tempDir.resolve("Mods"));

        assertThatThrownBy(() -> new ScanOptionsValidator().validate(parse("--root", mods.toString(), "--no-cache",
                "--installed-mods", tempDir.resolve("missing.json").toString(), "--latest-patch", "March")))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(2)
                        .anyMatch(m -> m.startsWith("Installed mods file does not exist"))
                        .anyMatch(m -> m.startsWith("Latest patch date must be yyyy-MM-dd")));

        assertThatThrownBy(() -> new ScanOptionsValidator().validate(parse("--root", mods.toString(), "--no-cache",
                "--latest-patch", "2024-03-01")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--latest-patch requires --installed-mods");
    }

    private static ScanCommandOptions parse(String... args) {
        ScanCommandOptions options = new ScanCommandOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
