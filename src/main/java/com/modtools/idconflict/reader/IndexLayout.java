package com.modtools.idconflict.reader;

import java.nio.ByteBuffer;

import lombok.Value;

/**
 * Index location read from a package header: declared entry count, table offset and table size.
 * All three are unsigned 32-bit values widened to long.
 */
@Value
class IndexLayout {

    long count;
    long offset;
    long size;

    static IndexLayout primary(ByteBuffer header) {
        return read(header, DbpfConstants.INDEX_COUNT_OFF, DbpfConstants.INDEX_OFFSET_OFF, DbpfConstants.INDEX_SIZE_OFF);
    }

    static IndexLayout legacy(ByteBuffer header) {
        return read(header, DbpfConstants.LEGACY_INDEX_COUNT_OFF, DbpfConstants.LEGACY_INDEX_OFFSET_OFF,
                DbpfConstants.LEGACY_INDEX_SIZE_OFF);
    }

    /**
     * Picks the primary layout unless its table runs past the end of the file, is empty or is
     * larger than {@link DbpfConstants#MAX_INDEX_BYTES}, in which case the legacy field positions
     * are used. Returns a layout with no table when neither yields a usable offset and size.
     */
    static IndexLayout resolve(ByteBuffer header, long fileSize) {
        IndexLayout layout = primary(header);
        if (layout.offset + layout.size > fileSize || layout.size == 0 || layout.isOversized()) {
            layout = legacy(header);
        }
        if (layout.offset <= 0 || layout.offset > fileSize || layout.isOversized()) {
            return new IndexLayout(layout.count, 0, 0);
        }
        return layout;
    }

    boolean hasTable() {
        return offset > 0 && size > 0;
    }

    private boolean isOversized() {
        return size > DbpfConstants.MAX_INDEX_BYTES;
    }

    private static IndexLayout read(ByteBuffer header, int countOff, int offsetOff, int sizeOff) {
        return new IndexLayout(
                Integer.toUnsignedLong(header.getInt(countOff)),
                Integer.toUnsignedLong(header.getInt(offsetOff)),
                Integer.toUnsignedLong(header.getInt(sizeOff)));
    }
}
