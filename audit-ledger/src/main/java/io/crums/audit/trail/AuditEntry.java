/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.trail;


import static io.crums.audit.trail.TrailConstants.*;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.crums.audit.ledger.LedgerEntry;

/**
 * Typed view of an audit trail {@linkplain LedgerEntry ledger entry}.
 */
public final class AuditEntry {

  private final LedgerEntry entry;


  public AuditEntry(LedgerEntry entry) {
    this.entry = Objects.requireNonNull(entry, "null entry");
  }


  /** Returns the underlying ledger entry. */
  public LedgerEntry ledgerEntry() {
    return entry;
  }

  public String entryId() {
    return entry.entryId();
  }

  public Instant timestamp() {
    return entry.timestamp();
  }

  /** Returns the action name, or {@code "unknown"} if missing. */
  public String action() {
    return entry.getString(ACTION).orElse("unknown");
  }

  public Optional<String> userId() {
    return entry.getString(USER_ID);
  }


  /**
   * Returns the document id, if present and integral.
   */
  public Optional<Long> documentId() {
    return entry.get(DOCUMENT_ID)
        .filter(Long.class::isInstance)
        .map(Long.class::cast);
  }


  /** Returns the details map (empty if missing or not a map). */
  @SuppressWarnings("unchecked")
  public Map<String, Object> details() {
    return entry.get(DETAILS)
        .filter(Map.class::isInstance)
        .map(d -> (Map<String, Object>) d)
        .orElse(Map.of());
  }

  public Optional<String> ipAddress() {
    return entry.getString(IP_ADDRESS);
  }

  public Optional<String> userAgent() {
    return entry.getString(USER_AGENT);
  }

  public String chainHash() {
    return entry.chainHash();
  }


  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof AuditEntry && ((AuditEntry) o).entry.equals(entry);
  }

  @Override
  public int hashCode() {
    return entry.hashCode();
  }

  @Override
  public String toString() {
    return "AuditEntry[" + entryId() + ", " + timestamp() + ", " + action() +
        userId().map(u -> ", user=" + u).orElse("") +
        documentId().map(d -> ", doc=" + d).orElse("") + "]";
  }

}
