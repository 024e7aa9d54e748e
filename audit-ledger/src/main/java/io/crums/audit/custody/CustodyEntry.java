/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.custody;


import static io.crums.audit.custody.CustodyConstants.*;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.crums.audit.ledger.LedgerEntry;

/**
 * Typed view of a custody {@linkplain LedgerEntry ledger entry}.
 * Note {@code hashBefore} and {@code hashAfter} are hashes of the
 * physical document, not of ledger entries.
 */
public final class CustodyEntry {

  private final long documentId;
  private final LedgerEntry entry;


  public CustodyEntry(long documentId, LedgerEntry entry) {
    this.documentId = documentId;
    this.entry = Objects.requireNonNull(entry, "null entry");
  }


  public LedgerEntry ledgerEntry() {
    return entry;
  }

  public long documentId() {
    return documentId;
  }

  public String entryId() {
    return entry.entryId();
  }

  public Instant timestamp() {
    return entry.timestamp();
  }

  /** Returns the action, or the empty string if missing. */
  public String action() {
    return entry.getString(ACTION).orElse("");
  }

  /** Returns the custodian's user id, or the empty string if missing. */
  public String userId() {
    return entry.getString(USER_ID).orElse("");
  }

  public Optional<String> location() {
    return entry.getString(LOCATION);
  }

  public Optional<String> hashBefore() {
    return entry.getString(HASH_BEFORE);
  }

  public Optional<String> hashAfter() {
    return entry.getString(HASH_AFTER);
  }


  @SuppressWarnings("unchecked")
  public Map<String, Object> details() {
    return entry.get(DETAILS)
        .filter(Map.class::isInstance)
        .map(d -> (Map<String, Object>) d)
        .orElse(Map.of());
  }


  @Override
  public boolean equals(Object o) {
    return o == this ||
        o instanceof CustodyEntry &&
        ((CustodyEntry) o).documentId == documentId &&
        ((CustodyEntry) o).entry.equals(entry);
  }

  @Override
  public int hashCode() {
    return entry.hashCode();
  }

  @Override
  public String toString() {
    return "CustodyEntry[doc=" + documentId + ", " + entryId() + ", " + timestamp() +
        ", " + action() + ", " + userId() + "]";
  }

}
