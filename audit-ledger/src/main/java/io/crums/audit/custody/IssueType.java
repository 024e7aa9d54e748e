/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.custody;

/**
 * Custody domain anomalies. These are distinct from cryptographic
 * tampering, which the ledger's own verification reports.
 */
public enum IssueType {

  /** An entry is timestamped before its predecessor. */
  TIMESTAMP_OUT_OF_ORDER("Timestamp out of order"),
  /** An entry's {@code hash_before} differs from its predecessor's {@code hash_after}. */
  HASH_CHAIN_BROKEN("Hash chain broken"),
  MISSING_USER("Missing user ID"),
  MISSING_ACTION("Missing action");


  private final String description;

  private IssueType(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }

}
