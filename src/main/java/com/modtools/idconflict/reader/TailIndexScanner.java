package com.modtools.idconflict.reader;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import com.modtools.idconflict.model.ResourceKey;

/**
 * Fallback for packages whose header does not lead to a usable index: searches the trailing
 * bytes of the file for plausible 24-byte index records
 * {@code (type, group, instanceHigh, instanceLow, payloadOffset, payloadSize)}.
 *
 * A candidate is accepted only when its key is non-empty and its payload range lies inside the file.
 */
public class TailIndexScanner {

    /**
     * @param tail     the last {@code min(8 MiB, fileSize)} bytes of the file
     * @param fileSize size of the whole file, used to validate payload ranges
     * @return distinct keys in first-seen order
     */
    public List<ResourceKey> scan(byte[] tail, long fileSize, AtomicBoolean cancel) {
        ByteBuffer buf = ByteBuffer.wrap(tail).order(ByteOrder.LITTLE_ENDIAN);
        Set<ResourceKey> found = new LinkedHashSet<>();

        for (int pos = 0; pos + DbpfConstants.TAIL_RECORD_SIZE <= tail.length; pos += DbpfConstants.TAIL_SCAN_STEP) {
            if (cancel != null && cancel.get()) {
                break;
            }
            ResourceKey key = ResourceKey.fromWords(
                    buf.getInt(pos),
                    buf.getInt(pos + 4),
                    buf.getInt(pos + 8),
                    buf.getInt(pos + 12));
            if (key.isEmpty()) {
                continue;
            }
            long payloadOffset = Integer.toUnsignedLong(buf.getInt(pos + 16));
            long payloadSize = Integer.toUnsignedLong(buf.getInt(pos + 20));
            if (isPlausiblePayload(payloadOffset, payloadSize, fileSize)) {
                found.add(key);
            }
        }
        return new ArrayList<>(found);
    }

    static boolean isPlausiblePayload(long payloadOffset, long payloadSize, long fileSize) {
        return payloadSize > 0
                && payloadOffset >= 0
                && payloadOffset < fileSize
                && payloadOffset + payloadSize <= fileSize;
    }
}
