/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


/**
 * Failure writing or reading persistent ledger state.
 *
 * @see ErrorKind#PERSISTENCE
 */
@SuppressWarnings("serial")
public class PersistenceException extends LedgerException {

  public PersistenceException(String message) {
    super(message);
  }

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }

}
