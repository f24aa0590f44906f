package com.modtools.idconflict.conflict;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

import com.modtools.idconflict.model.Classification;
import com.modtools.idconflict.model.ConflictPriority;
import com.modtools.idconflict.model.ConflictRecord;
import com.modtools.idconflict.model.ContributingFile;
import com.modtools.idconflict.model.ResourceCategory;
import com.modtools.idconflict.model.ResourceKey;
import com.modtools.idconflict.model.Severity;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConflictClassifier severity rules and record ordering.
 */
class ConflictClassifierTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final Instant LONG_AGO = NOW.minus(Duration.ofDays(90));

    private static final int TUNING = 0x01B2D882;
    private static final int OBJECT_CATALOG = 0x0355E0A6;
    private static final int CAS_PART_THUMBNAIL = 0x03555A5D;
    private static final int AUDIO_STREAM = 0x0621661E;
    private static final int ANIMATION_CLIP = 0xE06C2907;
    private static final int UNKNOWN_TYPE = 0x12345678;

    private final ConflictClassifier classifier = new ConflictClassifier(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void testCriticalTypeIsCritical() {
        Classification c = classifier.classify(ResourceKey.of(TUNING, 0, 1), files(2, LONG_AGO, false));

        assertThat(c.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(c.getCategory()).isEqualTo(ResourceCategory.GAMEPLAY);
        assertThat(c.getLabel()).isEqualTo("Tuning");
    }

    @Test
    void testGameplayCategoryIsAlwaysCritical() {
        // Animation clips are Gameplay but not in the critical type list.
        Classification c = classifier.classify(ResourceKey.of(ANIMATION_CLIP, 0, 1), files(2, LONG_AGO, false));

        assertThat(c.getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void testCompanionScriptRaisesToHigh() {
        Classification c = classifier.classify(ResourceKey.of(AUDIO_STREAM, 0, 1), files(2, LONG_AGO, true));

        assertThat(c.getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void testHighImpactTypeIsHigh() {
        Classification c = classifier.classify(ResourceKey.of(OBJECT_CATALOG, 0, 1), files(2, LONG_AGO, false));

        assertThat(c.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(c.getCategory()).isEqualTo(ResourceCategory.BUILD_BUY);
    }

    @Test
    void testThreeFilesAreHigh() {
        Classification c = classifier.classify(ResourceKey.of(AUDIO_STREAM, 0, 1), files(3, LONG_AGO, false));

        assertThat(c.getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void testCasAndTextureAreModerate() {
        Classification c = classifier.classify(ResourceKey.of(CAS_PART_THUMBNAIL, 0, 1), files(2, LONG_AGO, false));

        assertThat(c.getSeverity()).isEqualTo(Severity.MODERATE);
    }

    @Test
    void testUnknownTypeIsLow() {
        Classification c = classifier.classify(ResourceKey.of(UNKNOWN_TYPE, 0, 1), files(2, LONG_AGO, false));

        assertThat(c.getSeverity()).isEqualTo(Severity.LOW);
        assertThat(c.getCategory()).isEqualTo(ResourceCategory.OTHER);
        assertThat(c.getLabel()).isEqualTo(ResourceCatalog.UNKNOWN_LABEL);
    }

    @Test
    void testRecentChangeEscalatesToHigh() {
        Classification recent = classifier.classify(ResourceKey.of(UNKNOWN_TYPE, 0, 1),
                files(2, NOW.minus(Duration.ofDays(3)), false));
        Classification boundary = classifier.classify(ResourceKey.of(UNKNOWN_TYPE, 0, 1),
                files(2, NOW.minus(Duration.ofDays(14)), false));
        Classification old = classifier.classify(ResourceKey.of(UNKNOWN_TYPE, 0, 1),
                files(2, NOW.minus(Duration.ofDays(16)), false));

        assertThat(recent.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(boundary.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(old.getSeverity()).isEqualTo(Severity.LOW);
    }

    @Test
    void testRecentChangeNeverLowersCritical() {
        Classification c = classifier.classify(ResourceKey.of(TUNING, 0, 1), files(2, NOW, false));

        assertThat(c.getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void testLatestModifiedIsNewestFile() {
        List<ContributingFile> files = List.of(
                file("Mods/a/a.package", LONG_AGO, false),
                file("Mods/b/b.package", LONG_AGO.plusSeconds(60), false));

        assertThat(classifier.classify(ResourceKey.of(UNKNOWN_TYPE, 0, 1), files).getLatestModified())
                .isEqualTo(LONG_AGO.plusSeconds(60));
    }

    @Test
    void testPriorityTuple() {
        Classification c = classifier.classify(ResourceKey.of(OBJECT_CATALOG, 0, 1), files(4, LONG_AGO, false));

        assertThat(c.getPriority()).isEqualTo(new ConflictPriority(1, 2, -4));
    }

    @Test
    void testRecordsSortedMostUrgentFirst() {
        Map<ResourceKey, List<ContributingFile>> conflicts = new LinkedHashMap<>();
        ResourceKey low = ResourceKey.of(UNKNOWN_TYPE, 0, 1);
        ResourceKey moderate = ResourceKey.of(CAS_PART_THUMBNAIL, 0, 1);
        ResourceKey highTwo = ResourceKey.of(OBJECT_CATALOG, 0, 1);
        ResourceKey highFour = ResourceKey.of(OBJECT_CATALOG, 0, 2);
        ResourceKey critical = ResourceKey.of(TUNING, 0, 1);
        conflicts.put(low, files(2, LONG_AGO, false));
        conflicts.put(moderate, files(2, LONG_AGO, false));
        conflicts.put(highTwo, files(2, LONG_AGO, false));
        conflicts.put(highFour, files(4, LONG_AGO, false));
        conflicts.put(critical, files(2, LONG_AGO, false));

        List<ConflictRecord> records = classifier.buildRecords(conflicts);

        assertThat(records).extracting(ConflictRecord::getKey)
                .containsExactly(critical, highFour, highTwo, moderate, low);
    }

    @Test
    void testEqualPriorityFallsBackToKeyOrder() {
        Map<ResourceKey, List<ContributingFile>> conflicts = new LinkedHashMap<>();
        ResourceKey second = ResourceKey.of(UNKNOWN_TYPE, 0, 0xF000000000000000L);
        ResourceKey first = ResourceKey.of(UNKNOWN_TYPE, 0, 5);
        conflicts.put(second, files(2, LONG_AGO, false));
        conflicts.put(first, files(2, LONG_AGO, false));

        assertThat(classifier.buildRecords(conflicts)).extracting(ConflictRecord::getKey)
                .containsExactly(first, second);
    }

    private static List<ContributingFile> files(int count, Instant modified, boolean script) {
        return IntStream.range(0, count)
                .mapToObj(i -> file("Mods/mod" + i + "/mod" + i + ".package", modified, script && i == 0))
                .toList();
    }

    private static ContributingFile file(String path, Instant modified, boolean script) {
        return ContributingFile.builder()
                .path(Path.of(path))
                .modified(modified)
                .size(100)
                .hasCompanionScript(script)
                .build();
    }
}
