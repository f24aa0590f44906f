package com.modtools.idconflict.reader;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modtools.idconflict.model.ResourceKey;

/**
 * Recovers resource keys from a raw index table whose record width is unknown.
 *
 * Producing tools disagree on the width of an index row, so every candidate width is tried
 * and the one that yields the most non-empty keys wins. Only the leading 16 bytes of a row
 * are interpreted: {@code type, group, instanceHigh, instanceLow}, little-endian.
 */
public class IndexTableDecoder {
    private static final Logger log = LoggerFactory.getLogger(IndexTableDecoder.class);

    private final int[] candidateWidths;

    public IndexTableDecoder() {
        this(DbpfConstants.CANDIDATE_ENTRY_WIDTHS);
    }

    IndexTableDecoder(int[] candidateWidths) {
        this.candidateWidths = candidateWidths.clone();
    }

    /**
     * @param table     raw index bytes
     * @param countHint declared entry count, {@code 0} when unknown
     * @param cancel    checked between widths and between rows
     * @return keys of the best-scoring width, in table order; empty if no width yields a key
     */
    public List<ResourceKey> decode(byte[] table, long countHint, AtomicBoolean cancel) {
        ByteBuffer buf = ByteBuffer.wrap(table).order(ByteOrder.LITTLE_ENDIAN);

        List<ResourceKey> best = List.of();
        int bestWidth = -1;

        for (int width : candidateWidths) {
            if (isCancelled(cancel)) {
                break;
            }
            long rows = table.length / width;
            if (countHint > 0) {
                rows = Math.min(countHint, rows);
            }
            if (rows <= 0) {
                continue;
            }

            List<ResourceKey> keys = new ArrayList<>();
            for (int row = 0; row < rows; row++) {
                if (isCancelled(cancel)) {
                    break;
                }
                int base = row * width;
                if (base + DbpfConstants.KEY_BYTES > table.length) {
                    break;
                }
                ResourceKey key = ResourceKey.fromWords(
                        buf.getInt(base),
                        buf.getInt(base + 4),
                        buf.getInt(base + 8),
                        buf.getInt(base + 12));
                if (!key.isEmpty()) {
                    keys.add(key);
                }
            }

            if (keys.size() > best.size()) {
                best = keys;
                bestWidth = width;
            }
        }

        log.trace("Index table of {} bytes: best width {} with {} keys", table.length, bestWidth, best.size());
        return best;
    }

    private static boolean isCancelled(AtomicBoolean cancel) {
        return cancel != null && cancel.get();
    }
}
