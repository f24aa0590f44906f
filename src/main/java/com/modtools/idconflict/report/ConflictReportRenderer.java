package com.modtools.idconflict.report;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modtools.idconflict.model.ConflictRecord;
import com.modtools.idconflict.model.ContributingFile;
import com.modtools.idconflict.scan.ScanOutcome;
import com.modtools.idconflict.scan.ScanStats;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders scan results as a plain-text report using the {@code conflict-report.ftl} template.
 */
public class ConflictReportRenderer {
    private static final Logger log = LoggerFactory.getLogger(ConflictReportRenderer.class);

    static final String TEMPLATE_NAME = "conflict-report.ftl";

    private final Configuration freemarkerConfig;
    private final Clock clock;
    private final DateTimeFormatter timestampFormat;

    public ConflictReportRenderer() {
        this(Clock.systemDefaultZone(), ZoneId.systemDefault());
    }

    public ConflictReportRenderer(Clock clock, ZoneId zone) {
        this.freemarkerConfig = createFreemarkerConfig();
        this.clock = clock;
        this.timestampFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm", Locale.ROOT).withZone(zone);
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(Path modsRoot, ScanOutcome outcome) {
        return render(modsRoot, outcome, List.of());
    }

    public String render(Path modsRoot, ScanOutcome outcome, List<ModUpdateNotice> updateNotices) {
        StringWriter out = new StringWriter();
        render(toModel(modsRoot, outcome, updateNotices), out);
        return out.toString();
    }

    public void write(Path modsRoot, ScanOutcome outcome, Path target) {
        write(modsRoot, outcome, List.of(), target);
    }

    /**
     * Writes the report to {@code target}, creating parent directories as needed.
     */
    public void write(Path modsRoot, ScanOutcome outcome, List<ModUpdateNotice> updateNotices, Path target) {
        ConflictReportModel model = toModel(modsRoot, outcome, updateNotices);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                render(model, writer);
            }
        } catch (IOException e) {
            throw new ReportException("Failed to write report to " + target, e);
        }
        log.info("Conflict report written to {} ({} conflicts)", target, model.getRecords().size());
    }

    private void render(ConflictReportModel model, Writer out) {
        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            template.process(model, out);
        } catch (IOException | TemplateException e) {
            throw new ReportException("Failed to render " + TEMPLATE_NAME, e);
        }
    }

    ConflictReportModel toModel(Path modsRoot, ScanOutcome outcome, List<ModUpdateNotice> updateNotices) {
        ScanStats stats = outcome.getStats();
        ConflictReportModel.ConflictReportModelBuilder builder = ConflictReportModel.builder()
                .modsRoot(modsRoot.toAbsolutePath().normalize().toString())
                .generatedAt(format(clock.instant()))
                .filesTotal(stats.getFilesTotal())
                .filesWithEntries(stats.getFilesParsedWithEntries())
                .entriesFound(stats.getTotalEntriesFound())
                .cacheHits(stats.getCacheHits())
                .elapsed(String.format(Locale.ROOT, "%.1fs", stats.getElapsedSeconds()))
                .warnings(outcome.getDiagnostics().getErrors())
                .warnings(outcome.getDiagnostics().getWarnings());

        for (ConflictRecord record : outcome.getRecords()) {
            ConflictReportModel.RecordLine.RecordLineBuilder line = ConflictReportModel.RecordLine.builder()
                    .severity(record.getSeverity().getDisplayName())
                    .key(record.getKey().toHexString())
                    .category(record.getCategory().getDisplayName())
                    .label(record.getLabel())
                    .fileCount(record.getFileCount())
                    .newest(format(record.getLatestModified()))
                    .keywords(record.getKeywordSummary());
            for (ContributingFile file : record.getFiles()) {
                line.file(ConflictReportModel.FileLine.builder()
                        .name(file.getFileName())
                        .folder(file.getFolder().toString())
                        .modified(format(file.getModified()))
                        .script(file.isHasCompanionScript())
                        .build());
            }
            builder.record(line.build());
        }
        updateNotices.forEach(notice -> builder.updateNotice(notice.toDisplayLine()));
        return builder.build();
    }

    private String format(Instant instant) {
        return instant != null ? timestampFormat.format(instant) : "-";
    }
}
