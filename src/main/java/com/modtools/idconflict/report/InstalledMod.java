package com.modtools.idconflict.report;

import java.time.LocalDate;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One entry of the installer's {@code installed_mods.json}: where a mod was extracted and what
 * was recorded about it. Every field except the folder may be missing.
 */
@Value
@Builder
public class InstalledMod {

    @NonNull
    String targetFolder;

    String modVersion;

    LocalDate installedOn;

    String url;
}
