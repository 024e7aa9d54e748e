/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;

import java.util.Objects;

/**
 * A single verification finding against a ledger entry.
 *
 * @param index         zero-based position in the ledger
 * @param entryId       the entry's id
 * @param violation     what's wrong
 * @param expectedHash  the hash the entry should carry (recomputed, or the predecessor's)
 * @param actualHash    the hash the entry does carry
 */
public record EntryDiagnostic(
    int index,
    String entryId,
    Violation violation,
    String expectedHash,
    String actualHash) {

  public EntryDiagnostic {
    if (index < 0)
      throw new IllegalArgumentException("index " + index);
    Objects.requireNonNull(entryId, "null entryId");
    Objects.requireNonNull(violation, "null violation");
    Objects.requireNonNull(expectedHash, "null expectedHash");
    Objects.requireNonNull(actualHash, "null actualHash");
  }


  @Override
  public String toString() {
    return "[" + index + "] " + entryId + ": " + violation.description() +
        " (expected '" + expectedHash + "', actual '" + actualHash + "')";
  }

}
