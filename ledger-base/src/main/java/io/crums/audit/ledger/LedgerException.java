/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


/**
 * Base exception in the <code>ledger-base</code> module. Mostly thrown
 * as a result of I/O trouble or data corruption.
 */
@SuppressWarnings("serial")
public class LedgerException extends RuntimeException {

  public LedgerException(String message) {
    super(message);
  }

  public LedgerException(Throwable cause) {
    super(cause);
  }

  public LedgerException(String message, Throwable cause) {
    super(message, cause);
  }

}
