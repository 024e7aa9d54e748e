/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


import java.io.IOException;
import java.util.List;

/**
 * Durable destination of a {@linkplain Ledger}'s entries. Invoked only under
 * the ledger's lock, so implementations need not be thread-safe.
 *
 * @see LedgerFile
 */
public interface LedgerSink extends AutoCloseable {

  /**
   * Durably appends the given entries, in order. On return the entries are
   * on disk. On failure nothing is appended (partial writes are rolled back),
   * and the same entries will be offered again.
   *
   * @param entries  non-empty, in append order
   *
   * @return number of entries written in plaintext because encryption failed
   */
  int write(List<LedgerEntry> entries) throws IOException;


  /** Releases resources. Does not throw. */
  @Override
  void close();

}
