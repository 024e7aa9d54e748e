/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;

/**
 * Failure kinds reported through {@linkplain Result}s.
 */
public enum ErrorKind {

  /** I/O failure writing or reading a ledger file. Not fatal to the caller. */
  PERSISTENCE,
  /** Encryption or decryption failure. Data falls back to plaintext. */
  ENCRYPTION,
  /** A persisted ledger could not be loaded. */
  UNREADABLE_LEDGER,
  /** No such active session. */
  SESSION_NOT_FOUND,
  /** No custody chain for the document. */
  DOCUMENT_NOT_FOUND,
  /** Unknown export format name. */
  UNSUPPORTED_FORMAT;


  /** Returns the lowercase name. */
  public String code() {
    return name().toLowerCase();
  }
}
