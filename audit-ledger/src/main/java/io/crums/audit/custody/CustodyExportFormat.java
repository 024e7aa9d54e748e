/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.custody;


import java.util.Optional;

/**
 * Chain of custody export formats.
 */
public enum CustodyExportFormat {

  /** The custody ledger's full-fidelity JSON export. Re-importable. */
  JSON,
  /** Fixed columns, one row per entry. */
  CSV,
  /** Human readable report. */
  TEXT;


  /** Looks up the format by name, ignoring case. */
  public static Optional<CustodyExportFormat> forName(String name) {
    if (name != null) {
      for (var format : values())
        if (format.name().equalsIgnoreCase(name.strip()))
          return Optional.of(format);
    }
    return Optional.empty();
  }

}
