package com.modtools.idconflict.conflict;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modtools.idconflict.model.ContributingFile;

/**
 * Collects the per-file facts attached to a conflict: stat data, companion script presence
 * and brand keyword tags.
 */
public class FileMetadataProbe {
    private static final Logger log = LoggerFactory.getLogger(FileMetadataProbe.class);

    public static final String COMPANION_SCRIPT_EXTENSION = ".ts4script";

    /**
     * @return the file description, or empty when the file can no longer be stat-ed
     */
    public Optional<ContributingFile> describe(Path packagePath) {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(packagePath, BasicFileAttributes.class);
        } catch (IOException e) {
            log.debug("Cannot stat {} ({})", packagePath, e.toString());
            return Optional.empty();
        }
        return Optional.of(ContributingFile.builder()
                .path(packagePath)
                .modified(attrs.lastModifiedTime().toInstant())
                .size(attrs.size())
                .hasCompanionScript(folderHasCompanionScript(packagePath))
                .keywordTags(ResourceCatalog.matchBrands(packagePath.toString()))
                .build());
    }

    /**
     * True when the package's own folder holds at least one script archive.
     */
    public boolean folderHasCompanionScript(Path packagePath) {
        Path folder = packagePath.toAbsolutePath().getParent();
        if (folder == null) {
            return false;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(folder)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString().toLowerCase(Locale.ROOT);
                if (name.endsWith(COMPANION_SCRIPT_EXTENSION)) {
                    return true;
                }
            }
        } catch (IOException e) {
            log.debug("Cannot list {} ({})", folder, e.toString());
        }
        return false;
    }
}
