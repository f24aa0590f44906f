package com.modtools.idconflict.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for InventorySnapshotLoader.
 */
class InventorySnapshotLoaderTest {

    @TempDir
    Path tempDir;

    private final InventorySnapshotLoader loader = new InventorySnapshotLoader();

    @Test
    void testLoadsRootAndEntries() throws IOException {
        Path file = Files.writeString(tempDir.resolve("inventory.json"), "{"
                + "\"root\": \"/games/Mods\","
                + "\"entries\": ["
                + "  {\"path\": \"A/a.package\", \"mtime\": 1700000000, \"size\": 1024, \"type\": \"package\"},"
                + "  {\"path\": \"A/a.ts4script\", \"mtime\": 1700000000, \"size\": 2048, \"type\": \"script\"},"
                + "  {\"mtime\": 1}"
                + "]}");

        InventorySnapshot snapshot = loader.load(file, new ScanDiagnostics());

        assertThat(snapshot).isNotNull();
        assertThat(snapshot.getRoot()).isEqualTo(Path.of("/games/Mods"));
        assertThat(snapshot.getEntries()).hasSize(2);
        assertThat(snapshot.getEntries().get(0).isPackage()).isTrue();
        assertThat(snapshot.getEntries().get(0).getSize()).isEqualTo(1024);
        assertThat(snapshot.getEntries().get(1).isPackage()).isFalse();
    }

    @Test
    void testSnapshotWithoutRootIsRejected() throws IOException {
        Path file = Files.writeString(tempDir.resolve("inventory.json"), "{\"entries\": []}");
        ScanDiagnostics diagnostics = new ScanDiagnostics();

        assertThat(loader.load(file, diagnostics)).isNull();
        assertThat(diagnostics.getWarnings()).hasSize(1);
    }

    @Test
    void testUnreadableSnapshotIsRejected() throws IOException {
        Path file = Files.writeString(tempDir.resolve("inventory.json"), "not json at all");
        ScanDiagnostics diagnostics = new ScanDiagnostics();

        assertThat(loader.load(file, diagnostics)).isNull();
        assertThat(diagnostics.hasWarnings()).isTrue();
    }
}
