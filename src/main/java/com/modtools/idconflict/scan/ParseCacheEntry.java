package com.modtools.idconflict.scan;

import java.util.List;

import com.modtools.idconflict.model.ResourceKey;

import lombok.NonNull;
import lombok.Value;

/**
 * Keys parsed from one file, valid while the file keeps the same size and modification second.
 */
@Value
public class ParseCacheEntry {

    @NonNull
    String path;

    long size;

    /** Modification time in whole epoch seconds. */
    long mtime;

    @NonNull
    List<ResourceKey> keys;

    public ParseCacheEntry(@NonNull String path, long size, long mtime, @NonNull List<ResourceKey> keys) {
        this.path = path;
        this.size = size;
        this.mtime = mtime;
        this.keys = List.copyOf(keys);
    }

    /** {@code path|size|mtime}. */
    public String cacheKey() {
        return cacheKey(path, size, mtime);
    }

    public static String cacheKey(String path, long size, long mtime) {
        return path + "|" + size + "|" + mtime;
    }

    /**
     * Path part of a cache key; the key itself when it does not have the expected shape.
     */
    public static String pathOf(String cacheKey) {
        int last = cacheKey.lastIndexOf('|');
        if (last <= 0) {
            return cacheKey;
        }
        int previous = cacheKey.lastIndexOf('|', last - 1);
        return previous <= 0 ? cacheKey : cacheKey.substring(0, previous);
    }
}
