package com.modtools.idconflict.report;

import java.util.List;

import com.modtools.idconflict.model.ConflictPriority;
import com.modtools.idconflict.model.ResourceCategory;
import com.modtools.idconflict.model.Severity;

import lombok.Value;

/**
 * One mod folder in a load-order suggestion, ranked by the most urgent conflict it takes part in.
 */
@Value
public class LoadOrderEntry {
    String folder;
    Severity severity;
    ResourceCategory category;
    ConflictPriority priority;
    List<String> keywords;
}
