package com.modtools.idconflict.conflict;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.modtools.idconflict.model.Classification;
import com.modtools.idconflict.model.ConflictPriority;
import com.modtools.idconflict.model.ConflictRecord;
import com.modtools.idconflict.model.ContributingFile;
import com.modtools.idconflict.model.ResourceCategory;
import com.modtools.idconflict.model.ResourceKey;
import com.modtools.idconflict.model.Severity;

/**
 * Derives category, label, severity and priority for a collision.
 *
 * Severity rules, first match wins:
 * 1. CRITICAL for a critical type or any Gameplay resource
 * 2. HIGH when a file ships a companion script, for a high-impact type, or with 3+ files
 * 3. MODERATE for CAS and Texture resources
 * 4. LOW otherwise
 *
 * A non-critical collision whose newest file changed within {@link #RECENT_WINDOW} is raised to HIGH.
 */
public class ConflictClassifier {

    public static final Duration RECENT_WINDOW = Duration.ofDays(14);

    private final Clock clock;

    public ConflictClassifier() {
        this(Clock.systemDefaultZone());
    }

    public ConflictClassifier(Clock clock) {
        this.clock = clock;
    }

    public Classification classify(ResourceKey key, List<ContributingFile> files) {
        ResourceCatalog.TypeInfo info = ResourceCatalog.lookup(key.getTypeId());
        ResourceCategory category = info.category();

        Instant latest = null;
        boolean hasScript = false;
        for (ContributingFile file : files) {
            if (latest == null || file.getModified().isAfter(latest)) {
                latest = file.getModified();
            }
            hasScript |= file.isHasCompanionScript();
        }

        Severity severity;
        if (ResourceCatalog.isCriticalType(key.getTypeId()) || category == ResourceCategory.GAMEPLAY) {
            severity = Severity.CRITICAL;
        } else if (hasScript || ResourceCatalog.isHighImpactType(key.getTypeId()) || files.size() >= 3) {
            severity = Severity.HIGH;
        } else if (category == ResourceCategory.CAS || category == ResourceCategory.TEXTURE) {
            severity = Severity.MODERATE;
        } else {
            severity = Severity.LOW;
        }

        if (severity != Severity.CRITICAL && latest != null && isRecent(latest)) {
            severity = Severity.HIGH;
        }

        return Classification.builder()
                .category(category)
                .label(info.label())
                .severity(severity)
                .priority(ConflictPriority.of(severity, category, files.size()))
                .latestModified(latest)
                .build();
    }

    /**
     * Classifies every collision and returns the records most urgent first.
     */
    public List<ConflictRecord> buildRecords(Map<ResourceKey, List<ContributingFile>> conflicts) {
        List<ConflictRecord> records = new ArrayList<>(conflicts.size());
        conflicts.forEach((key, files) -> records.add(new ConflictRecord(key, files, classify(key, files))));
        records.sort(ConflictRecord.BY_PRIORITY);
        return records;
    }

    private boolean isRecent(Instant modified) {
        Duration age = Duration.between(modified, clock.instant());
        if (age.isNegative()) {
            return true;
        }
        return age.toDays() <= RECENT_WINDOW.toDays();
    }
}
