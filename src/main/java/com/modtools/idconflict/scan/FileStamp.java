package com.modtools.idconflict.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;

import com.modtools.idconflict.model.ResourceKey;

/**
 * Size and whole-second modification time of a file at the moment it was looked at.
 */
record FileStamp(String path, long size, long mtime) {

    static FileStamp of(Path file) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        return new FileStamp(file.toString(), attrs.size(), attrs.lastModifiedTime().toMillis() / 1000L);
    }

    String cacheKey() {
        return ParseCacheEntry.cacheKey(path, size, mtime);
    }

    ParseCacheEntry withKeys(List<ResourceKey> keys) {
        return new ParseCacheEntry(path, size, mtime, keys);
    }
}
