package com.modtools.idconflict.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modtools.idconflict.model.ConflictRecord;
import com.modtools.idconflict.model.ContributingFile;

/**
 * Turns a sorted conflict list into a per-folder load-order suggestion.
 *
 * Each folder appears once, at the position of the first record that mentions it, carrying that
 * record's severity, category and priority. The list is then ordered by priority; the sort is
 * stable so folders of equal priority keep record order.
 */
public class LoadOrderSuggester {
    private static final Logger log = LoggerFactory.getLogger(LoadOrderSuggester.class);

    public static final String DEFAULT_FILE_NAME = "load_order_suggestion.json";

    private final ObjectMapper mapper;
    private final Clock clock;

    public LoadOrderSuggester() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT), Clock.systemDefaultZone());
    }

    public LoadOrderSuggester(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    public List<LoadOrderEntry> suggest(List<ConflictRecord> records) {
        List<LoadOrderEntry> entries = new ArrayList<>();
        Set<String> seenFolders = new HashSet<>();
        for (ConflictRecord record : records) {
            for (ContributingFile file : record.getFiles()) {
                String folder = file.getFolder().toString();
                if (!seenFolders.add(folder)) {
                    continue;
                }
                entries.add(new LoadOrderEntry(folder, record.getSeverity(), record.getCategory(),
                        record.getPriority(), List.copyOf(file.getKeywordTags())));
            }
        }
        entries.sort(Comparator.comparing(LoadOrderEntry::getPriority));
        return entries;
    }

    public ObjectNode toJson(Path modsRoot, List<ConflictRecord> records) {
        ObjectNode root = mapper.createObjectNode();
        root.put("generatedAt", LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS)
                .format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        root.put("modsRoot", modsRoot.toAbsolutePath().normalize().toString());
        ArrayNode entries = root.putArray("entries");
        for (LoadOrderEntry entry : suggest(records)) {
            ObjectNode node = entries.addObject();
            node.put("folder", entry.getFolder());
            node.put("severity", entry.getSeverity().getDisplayName());
            node.put("category", entry.getCategory().getDisplayName());
            ArrayNode priority = node.putArray("priority");
            priority.add(entry.getPriority().getSeverityRank());
            priority.add(entry.getPriority().getCategoryRank());
            priority.add(entry.getPriority().getNegatedFileCount());
            ArrayNode keywords = node.putArray("keywords");
            entry.getKeywords().forEach(keywords::add);
        }
        return root;
    }

    /**
     * Writes the suggestion to {@code target} and returns the number of folder entries.
     */
    public int write(Path modsRoot, List<ConflictRecord> records, Path target) {
        ObjectNode json = toJson(modsRoot, records);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(target.toFile(), json);
        } catch (IOException e) {
            throw new ReportException("Failed to write load-order suggestion to " + target, e);
        }
        int count = json.get("entries").size();
        log.info("Load-order suggestion written to {} ({} entries)", target, count);
        return count;
    }
}
