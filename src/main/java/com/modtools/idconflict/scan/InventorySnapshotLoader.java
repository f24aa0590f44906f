package com.modtools.idconflict.scan;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads an inventory snapshot: {@code {"root": "...", "entries": [{"path", "mtime", "size", "type"}]}}.
 */
public class InventorySnapshotLoader {
    private static final Logger log = LoggerFactory.getLogger(InventorySnapshotLoader.class);

    private final ObjectMapper mapper;

    public InventorySnapshotLoader() {
        this(new ObjectMapper());
    }

    public InventorySnapshotLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @return the snapshot, or null when the file is unreadable or has no root
     */
    public InventorySnapshot load(Path file, ScanDiagnostics diagnostics) {
        try {
            JsonNode root = mapper.readTree(file.toFile());
            String rootPath = root == null ? "" : root.path("root").asText("");
            if (rootPath.isBlank()) {
                note(diagnostics, "Inventory snapshot " + file + " has no root, ignoring it");
                return null;
            }
            InventorySnapshot.InventorySnapshotBuilder builder = InventorySnapshot.builder().root(Path.of(rootPath));
            for (JsonNode node : root.path("entries")) {
                String rel = node.path("path").asText("");
                if (rel.isBlank()) {
                    continue;
                }
                builder.entry(InventorySnapshot.Entry.builder()
                        .path(rel)
                        .mtime(node.path("mtime").asLong(0))
                        .size(node.path("size").asLong(0))
                        .type(node.path("type").asText(""))
                        .build());
            }
            InventorySnapshot snapshot = builder.build();
            log.debug("Loaded inventory snapshot of {} with {} entries", snapshot.getRoot(), snapshot.getEntries().size());
            return snapshot;
        } catch (IOException | RuntimeException e) {
            note(diagnostics, "Inventory snapshot " + file + " is unreadable (" + e.getMessage() + "), ignoring it");
            return null;
        }
    }

    private static void note(ScanDiagnostics diagnostics, String message) {
        log.warn(message);
        if (diagnostics != null) {
            diagnostics.getWarnings().add(message);
        }
    }
}
