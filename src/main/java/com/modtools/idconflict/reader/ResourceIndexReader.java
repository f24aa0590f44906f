package com.modtools.idconflict.reader;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modtools.idconflict.model.ResourceKey;

/**
 * Reads the set of resource keys a DBPF package defines.
 *
 * Reading never throws: a missing signature, a truncated header or an I/O failure all yield
 * whatever was recovered so far, usually an empty list. Index tables are read in one buffer
 * of at most {@link DbpfConstants#MAX_INDEX_BYTES}; larger declared sizes count as out of range.
 *
 * Steps:
 * - verify the 96-byte header and its {@code DBPF} signature
 * - locate the index table via the primary header layout, retrying the legacy layout
 * - decode the table with {@link IndexTableDecoder}
 * - if nothing was found and fallback is allowed, scan the file tail with {@link TailIndexScanner}
 *
 * Instances hold no mutable state and may be shared between worker threads.
 */
public class ResourceIndexReader {
    private static final Logger log = LoggerFactory.getLogger(ResourceIndexReader.class);

    private final IndexTableDecoder tableDecoder;
    private final TailIndexScanner tailScanner;

    public ResourceIndexReader() {
        this(new IndexTableDecoder(), new TailIndexScanner());
    }

    public ResourceIndexReader(IndexTableDecoder tableDecoder, TailIndexScanner tailScanner) {
        this.tableDecoder = tableDecoder;
        this.tailScanner = tailScanner;
    }

    public List<ResourceKey> read(Path path) {
        return read(path, true, null);
    }

    /**
     * @param path              package file
     * @param allowTailFallback when false ("fast mode") the trailer is never consulted
     * @param cancel            cooperative cancellation flag, may be null
     */
    public List<ResourceKey> read(Path path, boolean allowTailFallback, AtomicBoolean cancel) {
        List<ResourceKey> recovered = new ArrayList<>();
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long fileSize = channel.size();

            ByteBuffer header = readFully(channel, 0, DbpfConstants.HEADER_SIZE);
            if (header.remaining() < DbpfConstants.HEADER_SIZE || !hasMagic(header)) {
                log.trace("Not a package (short header or missing signature): {}", path);
                return recovered;
            }

            IndexLayout layout = IndexLayout.resolve(header, fileSize);
            if (layout.hasTable()) {
                int available = (int) Math.min(layout.getSize(), fileSize - layout.getOffset());
                byte[] table = readBytes(channel, layout.getOffset(), available);
                recovered.addAll(tableDecoder.decode(table, layout.getCount(), cancel));
            }

            if (!recovered.isEmpty() || !allowTailFallback || isCancelled(cancel)) {
                return recovered;
            }

            int tailLength = (int) Math.min(DbpfConstants.TAIL_SCAN_MAX_BYTES, fileSize);
            byte[] tail = readBytes(channel, fileSize - tailLength, tailLength);
            recovered.addAll(tailScanner.scan(tail, fileSize, cancel));
            if (!recovered.isEmpty()) {
                log.debug("Recovered {} keys from the tail of {}", recovered.size(), path);
            }
            return recovered;
        } catch (IOException | RuntimeException e) {
            log.debug("Package read failure for {} ({})", path, e.toString());
            return recovered;
        }
    }

    private static boolean hasMagic(ByteBuffer header) {
        byte[] magic = new byte[DbpfConstants.MAGIC.length];
        header.get(0, magic);
        return Arrays.equals(magic, DbpfConstants.MAGIC);
    }

    /**
     * Reads up to {@code length} bytes at {@code position}; the result is shorter only at end of file.
     */
    private static ByteBuffer readFully(FileChannel channel, long position, int length) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(Math.max(0, length)).order(ByteOrder.LITTLE_ENDIAN);
        long pos = position;
        while (buf.hasRemaining()) {
            int n = channel.read(buf, pos);
            if (n < 0) {
                break;
            }
            pos += n;
        }
        buf.flip();
        return buf;
    }

    private static byte[] readBytes(FileChannel channel, long position, int length) throws IOException {
        ByteBuffer buf = readFully(channel, position, length);
        return buf.limit() == buf.capacity() ? buf.array() : Arrays.copyOf(buf.array(), buf.limit());
    }

    private static boolean isCancelled(AtomicBoolean cancel) {
        return cancel != null && cancel.get();
    }
}
