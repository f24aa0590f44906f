package com.modtools.idconflict.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.modtools.idconflict.model.ResourceKey;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ParseCacheStore persistence and ParseCache merging.
 */
class ParseCacheStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void testMissingFileLoadsEmpty() {
        ScanDiagnostics diagnostics = new ScanDiagnostics();

        ParseCache cache = new ParseCacheStore(tempDir.resolve("none.json")).load(diagnostics);

        assertThat(cache.isEmpty()).isTrue();
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void testSavedCacheLoadsBackWithUnsignedValues() throws IOException {
        ResourceKey key = ResourceKey.of(0xF0000001, 0x80000000, 0xFFFFFFFFFFFFFFFEL);
        ParseCacheStore store = new ParseCacheStore(tempDir.resolve("nested/cache.json"));

        store.save(ParseCache.of(Map.of("/mods/a.package|10|20", List.of(key))));

        String json = Files.readString(store.getFile());
        assertThat(json).contains("4026531841", "2147483648", "18446744073709551614");
        assertThat(store.load(null).lookup("/mods/a.package|10|20")).containsExactly(key);
    }

    @Test
    void testLegacyFieldNameIsAccepted() throws IOException {
        Path file = Files.writeString(tempDir.resolve("cache.json"),
                "{\"/mods/a.package|1|2\": {\"tgis\": [[1, 2, 3]]}}");

        ParseCache cache = new ParseCacheStore(file).load(null);

        assertThat(cache.lookup("/mods/a.package|1|2")).containsExactly(ResourceKey.of(1, 2, 3));
    }

    @Test
    void testMalformedEntriesAreSkipped() throws IOException {
        Path file = Files.writeString(tempDir.resolve("cache.json"), "{"
                + "\"good|1|2\": {\"keys\": [[1, 2, 3]]},"
                + "\"short|1|2\": {\"keys\": [[1, 2]]},"
                + "\"negative|1|2\": {\"keys\": [[-1, 2, 3]]},"
                + "\"text|1|2\": \"oops\""
                + "}");

        ParseCache cache = new ParseCacheStore(file).load(null);

        assertThat(cache.asMap()).containsOnlyKeys("good|1|2");
    }

    @Test
    void testNonObjectRootIsReportedAndIgnored() throws IOException {
        Path file = Files.writeString(tempDir.resolve("cache.json"), "[1, 2, 3]");
        ScanDiagnostics diagnostics = new ScanDiagnostics();

        assertThat(new ParseCacheStore(file).load(diagnostics).isEmpty()).isTrue();
        assertThat(diagnostics.getWarnings()).hasSize(1);
    }

    @Test
    void testSaveLeavesNoTempFiles() throws IOException {
        ParseCacheStore store = new ParseCacheStore(tempDir.resolve("cache.json"));

        store.save(ParseCache.of(Map.of("a|1|2", List.of(ResourceKey.of(1, 1, 1)))));
        store.save(ParseCache.of(Map.of("a|1|3", List.of(ResourceKey.of(1, 1, 2)))));

        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("cache.json");
        }
        assertThat(store.load(null).asMap()).containsOnlyKeys("a|1|3");
    }

    @Test
    void testMergeReplacesOlderStateOfSamePath() {
        ParseCache prior = ParseCache.of(Map.of(
                "/mods/a.package|10|100", List.of(ResourceKey.of(1, 1, 1)),
                "/mods/b.package|10|100", List.of(ResourceKey.of(2, 2, 2))));

        ParseCache merged = prior.mergedWith(List.of(
                new ParseCacheEntry("/mods/a.package", 12, 200, List.of(ResourceKey.of(3, 3, 3)))));

        assertThat(merged.asMap()).containsOnlyKeys("/mods/a.package|12|200", "/mods/b.package|10|100");
        assertThat(prior.size()).isEqualTo(2);
        assertThat(prior.lookup("/mods/a.package|10|100")).isNotNull();
    }

    @Test
    void testPathOfHandlesPipesInPath() {
        assertThat(ParseCacheEntry.pathOf("/mods/odd|name.package|10|100")).isEqualTo("/mods/odd|name.package");
        assertThat(ParseCacheEntry.pathOf("garbage")).isEqualTo("garbage");
    }
}
