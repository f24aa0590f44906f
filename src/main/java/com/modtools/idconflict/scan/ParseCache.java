package com.modtools.idconflict.scan;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.modtools.idconflict.model.ResourceKey;

/**
 * Immutable snapshot of parsed key lists indexed by {@code path|size|mtime}.
 *
 * A scan reads from one snapshot and produces a new one through {@link #mergedWith}.
 */
public final class ParseCache {

    private static final ParseCache EMPTY = new ParseCache(Map.of());

    private final Map<String, List<ResourceKey>> entries;

    private ParseCache(Map<String, List<ResourceKey>> entries) {
        this.entries = entries;
    }

    public static ParseCache empty() {
        return EMPTY;
    }

    public static ParseCache of(Map<String, List<ResourceKey>> entries) {
        Map<String, List<ResourceKey>> copy = new LinkedHashMap<>();
        entries.forEach((key, keys) -> copy.put(key, List.copyOf(keys)));
        return new ParseCache(Collections.unmodifiableMap(copy));
    }

    /**
     * @return the cached keys, or null on a miss
     */
    public List<ResourceKey> lookup(String cacheKey) {
        return entries.get(cacheKey);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Map<String, List<ResourceKey>> asMap() {
        return entries;
    }

    /**
     * Returns a new cache holding this cache's entries plus {@code fresh}. Entries of this cache
     * describing an older state of a path that {@code fresh} covers are dropped.
     */
    public ParseCache mergedWith(Collection<ParseCacheEntry> fresh) {
        if (fresh.isEmpty()) {
            return this;
        }
        Set<String> refreshedPaths = fresh.stream()
                .map(ParseCacheEntry::getPath)
                .collect(Collectors.toSet());

        Map<String, List<ResourceKey>> merged = new LinkedHashMap<>();
        entries.forEach((key, keys) -> {
            if (!refreshedPaths.contains(ParseCacheEntry.pathOf(key))) {
                merged.put(key, keys);
            }
        });
        for (ParseCacheEntry entry : fresh) {
            merged.put(entry.cacheKey(), entry.getKeys());
        }
        return new ParseCache(Collections.unmodifiableMap(merged));
    }
}
