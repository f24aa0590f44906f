package com.modtools.idconflict.scan;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Degraded-mode notes gathered during a scan (cache problems, unreadable folders).
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ScanDiagnostics {
  private final List<String> errors = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }
}
