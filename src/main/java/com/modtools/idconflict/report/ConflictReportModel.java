package com.modtools.idconflict.report;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Template data for the text report. Everything is pre-formatted so the template only lays it out.
 */
@Value
@Builder
public class ConflictReportModel {

    String modsRoot;
    String generatedAt;
    int filesTotal;
    int filesWithEntries;
    long entriesFound;
    int cacheHits;
    String elapsed;

    @Singular
    List<String> warnings;

    @Singular
    List<RecordLine> records;

    /** Empty unless an installed mods list was checked. */
    @Singular
    List<String> updateNotices;

    @Value
    @Builder
    public static class RecordLine {
        String severity;
        String key;
        String category;
        String label;
        int fileCount;
        String newest;
        String keywords;

        @Singular
        List<FileLine> files;
    }

    @Value
    @Builder
    public static class FileLine {
        String name;
        String folder;
        String modified;
        boolean script;
    }
}
