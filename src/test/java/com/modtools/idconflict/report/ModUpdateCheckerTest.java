package com.modtools.idconflict.report;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ModUpdateChecker.
 */
class ModUpdateCheckerTest {

    private static final LocalDate PATCH = LocalDate.of(2024, 3, 1);

    @Test
    void testFlagsEveryConflictingFolderOnceInRecordOrder() {
        Map<String, InstalledMod> installed = Map.of(
                InstalledModsLoader.folderKey(ReportFixtures.MODS.resolve("WickedWhims")), InstalledMod.builder()
                        .targetFolder("WickedWhims")
                        .modVersion("2.0")
                        .installedOn(LocalDate.of(2024, 1, 10))
                        .url("https://example.com/ww")
                        .build());

        List<ModUpdateNotice> notices = new ModUpdateChecker(PATCH, ZoneOffset.UTC)
                .check(ReportFixtures.records(), installed);

        assertThat(notices).extracting(ModUpdateNotice::getFolderName).containsExactly("Other", "WickedWhims", "Third");
        assertThat(notices.get(0).getReasons())
                .containsExactly(ModUpdateChecker.NOT_LISTED, ModUpdateChecker.FILES_BEFORE_PATCH);
        assertThat(notices.get(1).getReasons()).containsExactly(
                "installed version: 2.0",
                "installed on 2024-01-10",
                ModUpdateChecker.INSTALLED_BEFORE_PATCH,
                "url: https://example.com/ww",
                ModUpdateChecker.FILES_BEFORE_PATCH);
        assertThat(notices.get(1).toDisplayLine()).startsWith("WickedWhims (installed version: 2.0; installed on");
    }

    @Test
    void testListedFolderWithoutDetailsIsNotFlaggedWhenPatchUnknown() {
        Map<String, InstalledMod> installed = Map.of(
                InstalledModsLoader.folderKey(ReportFixtures.MODS.resolve("Other")),
                InstalledMod.builder().targetFolder("Other").build());

        List<ModUpdateNotice> notices = new ModUpdateChecker(null, ZoneOffset.UTC)
                .check(ReportFixtures.records(), installed);

        assertThat(notices).extracting(ModUpdateNotice::getFolderName).containsExactly("WickedWhims", "Third");
        assertThat(notices).allSatisfy(n -> assertThat(n.getReasons()).containsExactly(ModUpdateChecker.NOT_LISTED));
    }

    @Test
    void testRecentInstallAndFilesAreNotCalledOut() {
        Map<String, InstalledMod> installed = Map.of(
                InstalledModsLoader.folderKey(ReportFixtures.MODS.resolve("Other")),
                InstalledMod.builder().targetFolder("Other").installedOn(LocalDate.of(2024, 5, 1)).build());

        List<ModUpdateNotice> notices = new ModUpdateChecker(LocalDate.of(2024, 1, 1), ZoneOffset.UTC)
                .check(ReportFixtures.records(), installed);

        assertThat(notices.get(0).getFolderName()).isEqualTo("Other");
        assertThat(notices.get(0).getReasons()).containsExactly("installed on 2024-05-01");
    }

    @Test
    void testNoRecordsNoNotices() {
        assertThat(new ModUpdateChecker(PATCH, ZoneOffset.UTC).check(List.of(), Map.of())).isEmpty();
    }
}
