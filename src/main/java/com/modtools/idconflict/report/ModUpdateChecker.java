package com.modtools.idconflict.report;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.modtools.idconflict.model.ConflictRecord;
import com.modtools.idconflict.model.ContributingFile;

/**
 * Flags conflicting mod folders that may need an update.
 *
 * A folder is flagged when it is missing from the installed mods list, or when the list records
 * anything about it (version, install date, download url). Install dates and file modification
 * dates older than the latest game patch are called out. Each folder is reported once, in the
 * order its first file appears in the conflict list.
 */
public class ModUpdateChecker {

    static final String NOT_LISTED = "not listed in installed mods";
    static final String INSTALLED_BEFORE_PATCH = "installed before the latest game patch";
    static final String FILES_BEFORE_PATCH = "files older than the latest game patch";

    private final LocalDate latestPatch;
    private final ZoneId zone;

    /**
     * @param latestPatch release date of the latest game patch, null when unknown
     */
    public ModUpdateChecker(LocalDate latestPatch, ZoneId zone) {
        this.latestPatch = latestPatch;
        this.zone = zone;
    }

    public List<ModUpdateNotice> check(List<ConflictRecord> records, Map<String, InstalledMod> installed) {
        Map<Path, Boolean> staleFolders = new LinkedHashMap<>();
        for (ConflictRecord record : records) {
            for (ContributingFile file : record.getFiles()) {
                staleFolders.merge(file.getFolder(), predatesPatch(file), Boolean::logicalOr);
            }
        }

        List<ModUpdateNotice> notices = new ArrayList<>();
        staleFolders.forEach((folder, stale) -> {
            List<String> reasons = reasonsFor(installed.get(InstalledModsLoader.folderKey(folder)));
            if (stale) {
                reasons.add(FILES_BEFORE_PATCH);
            }
            if (!reasons.isEmpty()) {
                notices.add(new ModUpdateNotice(folder, List.copyOf(reasons)));
            }
        });
        return notices;
    }

    private List<String> reasonsFor(InstalledMod mod) {
        List<String> reasons = new ArrayList<>();
        if (mod == null) {
            reasons.add(NOT_LISTED);
            return reasons;
        }
        if (mod.getModVersion() != null) {
            reasons.add("installed version: " + mod.getModVersion());
        }
        if (mod.getInstalledOn() != null) {
            reasons.add("installed on " + mod.getInstalledOn());
            if (latestPatch != null && mod.getInstalledOn().isBefore(latestPatch)) {
                reasons.add(INSTALLED_BEFORE_PATCH);
            }
        }
        if (mod.getUrl() != null) {
            reasons.add("url: " + mod.getUrl());
        }
        return reasons;
    }

    private boolean predatesPatch(ContributingFile file) {
        return latestPatch != null && file.getModified().atZone(zone).toLocalDate().isBefore(latestPatch);
    }
}
