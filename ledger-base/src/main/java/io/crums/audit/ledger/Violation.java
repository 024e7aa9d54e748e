/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;

/**
 * Kinds of cryptographic inconsistency {@linkplain Ledger#verify() verification}
 * detects.
 */
public enum Violation {

  /** The payload no longer hashes to the recorded {@code content_hash}. */
  CONTENT_HASH_MISMATCH,
  /** The payload and {@code previous_hash} no longer hash to the recorded {@code chain_hash}. */
  CHAIN_HASH_MISMATCH,
  /** The {@code previous_hash} is not the predecessor's {@code chain_hash}. */
  BROKEN_LINK,
  /** The first entry's {@code previous_hash} is not the empty sentinel. */
  BAD_GENESIS;


  /** Human readable description. */
  public String description() {
    switch (this) {
    case CONTENT_HASH_MISMATCH:   return "Content hash mismatch";
    case CHAIN_HASH_MISMATCH:     return "Chain hash mismatch";
    case BROKEN_LINK:             return "Previous hash does not match predecessor's chain hash";
    case BAD_GENESIS:             return "First entry does not start the chain";
    default:
      throw new RuntimeException("unaccounted violation " + this);
    }
  }

}
