package com.modtools.idconflict.report;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the installer's {@code installed_mods.json}, a JSON array of
 * {@code {"target_folder", "mod_version", "installed_at", "url"}} objects.
 *
 * Entries are keyed by {@link #folderKey(Path)} of their target folder; relative folders are
 * resolved against the mods root. An unreadable file yields an empty map.
 */
public class InstalledModsLoader {
    private static final Logger log = LoggerFactory.getLogger(InstalledModsLoader.class);

    private static final List<Function<String, LocalDate>> DATE_PARSERS = List.of(
            v -> OffsetDateTime.parse(v).toLocalDate(),
            v -> LocalDateTime.parse(v).toLocalDate(),
            LocalDate::parse);

    private final ObjectMapper mapper;

    public InstalledModsLoader() {
        this(new ObjectMapper());
    }

    public InstalledModsLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Map<String, InstalledMod> load(Path file, Path modsRoot) {
        Map<String, InstalledMod> result = new HashMap<>();
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            log.warn("Installed mods file {} is unreadable ({}), treating every mod as unlisted", file, e.getMessage());
            return result;
        }
        if (root == null || !root.isArray()) {
            log.warn("Installed mods file {} is not a JSON array, treating every mod as unlisted", file);
            return result;
        }
        for (JsonNode node : root) {
            String target = text(node, "target_folder");
            if (target == null) {
                continue;
            }
            Path folder = modsRoot.resolve(target);
            result.put(folderKey(folder), InstalledMod.builder()
                    .targetFolder(target)
                    .modVersion(text(node, "mod_version"))
                    .installedOn(parseDate(text(node, "installed_at")))
                    .url(text(node, "url"))
                    .build());
        }
        log.debug("Loaded {} installed mod entries from {}", result.size(), file);
        return result;
    }

    /**
     * Case-insensitive lookup key of a folder.
     */
    public static String folderKey(Path folder) {
        return folder.toAbsolutePath().normalize().toString().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts ISO-8601 timestamps with or without offset, or a plain date. Returns null otherwise.
     */
    static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        DateTimeParseException last = null;
        for (Function<String, LocalDate> parser : DATE_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        log.debug("Unparseable install date '{}' ({})", value, last.getMessage());
        return null;
    }

    private static String text(JsonNode node, String field) {
        String value = node.path(field).asText("").trim();
        return value.isEmpty() ? null : value;
    }
}
