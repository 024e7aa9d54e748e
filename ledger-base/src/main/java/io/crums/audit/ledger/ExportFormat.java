/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


import java.util.Optional;

/**
 * Ledger export formats.
 *
 * @see Ledger#export(ExportFormat)
 */
public enum ExportFormat {

  /** Full fidelity: header fields and every entry, hashes included. Re-importable. */
  JSON(LedgerConstants.JSON_EXT),
  /** One row per entry, one column per top-level payload field. */
  CSV(LedgerConstants.CSV_EXT);


  private final String ext;

  private ExportFormat(String ext) {
    this.ext = ext;
  }


  /** Returns the conventional file extension (includes the dot). */
  public String extension() {
    return ext;
  }


  /**
   * Looks up the format by name, ignoring case.
   *
   * @return empty if unknown
   */
  public static Optional<ExportFormat> forName(String name) {
    if (name != null) {
      for (var format : values())
        if (format.name().equalsIgnoreCase(name.strip()))
          return Optional.of(format);
    }
    return Optional.empty();
  }

}
