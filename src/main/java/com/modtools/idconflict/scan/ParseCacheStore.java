package com.modtools.idconflict.scan;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modtools.idconflict.model.ResourceKey;

/**
 * JSON persistence of the parse cache:
 * {@code {"path|size|mtime": {"keys": [[type, group, instance], ...]}}} with unsigned decimal numbers.
 *
 * A missing or malformed file loads as an empty cache. Writes go to a sibling temp file that is
 * then moved over the target.
 */
public class ParseCacheStore {
    private static final Logger log = LoggerFactory.getLogger(ParseCacheStore.class);

    static final String KEYS_FIELD = "keys";
    // Field name used by caches written before the rename.
    static final String LEGACY_KEYS_FIELD = "tgis";

    private final Path file;
    private final ObjectMapper mapper;

    public ParseCacheStore(Path file) {
        this(file, new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ParseCacheStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    public Path getFile() {
        return file;
    }

    public ParseCache load(ScanDiagnostics diagnostics) {
        if (!Files.exists(file)) {
            return ParseCache.empty();
        }
        try {
            JsonNode root = mapper.readTree(file.toFile());
            if (root == null || !root.isObject()) {
                warn(diagnostics, "Parse cache " + file + " is not a JSON object, starting with an empty cache");
                return ParseCache.empty();
            }
            Map<String, List<ResourceKey>> entries = new LinkedHashMap<>();
            int skipped = 0;
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                List<ResourceKey> keys = decodeKeys(field.getValue());
                if (keys == null) {
                    skipped++;
                    continue;
                }
                entries.put(field.getKey(), keys);
            }
            if (skipped > 0) {
                log.debug("Skipped {} malformed parse cache entries in {}", skipped, file);
            }
            log.debug("Loaded {} parse cache entries from {}", entries.size(), file);
            return ParseCache.of(entries);
        } catch (IOException | RuntimeException e) {
            warn(diagnostics, "Parse cache " + file + " is unreadable (" + e.getMessage() + "), starting with an empty cache");
            return ParseCache.empty();
        }
    }

    public void save(ParseCache cache) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        cache.asMap().forEach((cacheKey, keys) -> {
            ObjectNode entry = root.putObject(cacheKey);
            ArrayNode array = entry.putArray(KEYS_FIELD);
            for (ResourceKey key : keys) {
                ArrayNode triple = array.addArray();
                triple.add(key.typeIdUnsigned());
                triple.add(key.groupIdUnsigned());
                triple.add(new BigInteger(Long.toUnsignedString(key.getInstanceId())));
            }
        });

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, toBytes(root));
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Wrote {} parse cache entries to {}", cache.size(), file);
    }

    private byte[] toBytes(JsonNode root) throws JsonProcessingException {
        return mapper.writeValueAsBytes(root);
    }

    /**
     * @return the decoded key list, or null when the entry does not have the expected shape
     */
    private static List<ResourceKey> decodeKeys(JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            return null;
        }
        JsonNode array = entry.has(KEYS_FIELD) ? entry.get(KEYS_FIELD) : entry.get(LEGACY_KEYS_FIELD);
        if (array == null || !array.isArray()) {
            return null;
        }
        List<ResourceKey> keys = new ArrayList<>(array.size());
        for (JsonNode triple : array) {
            if (!triple.isArray() || triple.size() != 3) {
                return null;
            }
            for (JsonNode n : triple) {
                if (!n.isIntegralNumber() || n.bigIntegerValue().signum() < 0) {
                    return null;
                }
            }
            keys.add(ResourceKey.of(
                    triple.get(0).bigIntegerValue().intValue(),
                    triple.get(1).bigIntegerValue().intValue(),
                    triple.get(2).bigIntegerValue().longValue()));
        }
        return keys;
    }

    private static void warn(ScanDiagnostics diagnostics, String message) {
        log.warn(message);
        if (diagnostics != null) {
            diagnostics.getWarnings().add(message);
        }
    }
}
