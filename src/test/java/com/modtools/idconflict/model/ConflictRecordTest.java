package com.modtools.idconflict.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConflictRecord invariants.
 */
class ConflictRecordTest {

    private static final ResourceKey KEY = ResourceKey.of(0x0333406C, 0, 1);
    private static final Instant MODIFIED = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void testRejectsFewerThanTwoFiles() {
        assertThatThrownBy(() -> new ConflictRecord(KEY, List.of(file("Mods/a.package", false, Set.of())), classification(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least two files");
    }

    @Test
    void testFilesAreOrderedByPath() {
        ConflictRecord record = new ConflictRecord(KEY, List.of(
                file("Mods/z/z.package", false, Set.of()),
                file("Mods/a/a.package", false, Set.of())), classification(2));

        assertThat(record.getFiles()).extracting(ContributingFile::getFileName)
                .containsExactly("a.package", "z.package");
        assertThatThrownBy(() -> record.getFiles().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testScriptFlagAndKeywordsAggregateOverFiles() {
        ConflictRecord record = new ConflictRecord(KEY, List.of(
                file("Mods/a/a.package", false, Set.of("WickedWhims")),
                file("Mods/b/b.package", true, Set.of("Basemental", "WickedWhims"))), classification(2));

        assertThat(record.isHasScript()).isTrue();
        assertThat(record.getKeywords()).containsExactly("Basemental", "WickedWhims");
        assertThat(record.getKeywordSummary()).isEqualTo("Basemental, WickedWhims");
    }

    @Test
    void testNegativeSizeIsRejected() {
        assertThatThrownBy(() -> ContributingFile.builder()
                .path(Path.of("Mods/a.package"))
                .modified(MODIFIED)
                .size(-1)
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static ContributingFile file(String path, boolean script, Set<String> tags) {
        return ContributingFile.builder()
                .path(Path.of(path))
                .modified(MODIFIED)
                .size(10)
                .hasCompanionScript(script)
                .keywordTags(tags)
                .build();
    }

    private static Classification classification(int fileCount) {
        return Classification.builder()
                .category(ResourceCategory.TEXTURE)
                .label("Image Resource")
                .severity(Severity.HIGH)
                .priority(ConflictPriority.of(Severity.HIGH, ResourceCategory.TEXTURE, fileCount))
                .latestModified(MODIFIED)
                .build();
    }
}
