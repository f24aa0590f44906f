package com.modtools.idconflict.reader;

import java.nio.charset.StandardCharsets;

/**
 * Offsets and limits of the DBPF package header and index as observed across producing tools.
 */
public interface DbpfConstants {
    int HEADER_SIZE = 96;
    byte[] MAGIC = "DBPF".getBytes(StandardCharsets.US_ASCII);

    int INDEX_COUNT_OFF = 36;
    int INDEX_OFFSET_OFF = 40;
    int INDEX_SIZE_OFF = 44;

    int LEGACY_INDEX_COUNT_OFF = 32;
    int LEGACY_INDEX_OFFSET_OFF = 48;
    int LEGACY_INDEX_SIZE_OFF = 52;

    // Declared index sizes above this are treated as out of range.
    int MAX_INDEX_BYTES = 64 * 1024 * 1024;

    int KEY_BYTES = 16;
    int[] CANDIDATE_ENTRY_WIDTHS = { 16, 24, 28, 32, 36, 40 };

    int TAIL_SCAN_MAX_BYTES = 8 * 1024 * 1024;
    int TAIL_RECORD_SIZE = 24;
    int TAIL_SCAN_STEP = 4;
}
