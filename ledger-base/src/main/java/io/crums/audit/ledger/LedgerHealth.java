/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


import java.time.Instant;

/**
 * Persistence health of a ledger. Volatile ledgers are always healthy.
 *
 * @param pendingEntries      entries committed in memory but not yet on disk
 * @param failures            number of failed write attempts since opened
 * @param plaintextFallbacks  number of records written unencrypted because encryption failed
 * @param lastError           detail of the most recent write failure, or {@code null}
 * @param lastFailure         time of the most recent write failure, or {@code null}
 */
public record LedgerHealth(
    int pendingEntries,
    long failures,
    long plaintextFallbacks,
    String lastError,
    Instant lastFailure) {


  public LedgerHealth {
    if (pendingEntries < 0 || failures < 0 || plaintextFallbacks < 0)
      throw new IllegalArgumentException(
          "negative count: " + pendingEntries + "/" + failures + "/" + plaintextFallbacks);
  }


  /** Returns {@code true} iff every committed entry is on disk. */
  public boolean isHealthy() {
    return pendingEntries == 0;
  }
}
