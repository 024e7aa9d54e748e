/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;

import java.io.File;

/**
 * A persisted ledger could not be read back in full: a record is torn or
 * unparseable, the header is bad, or the format version is unknown. The
 * ledger is never loaded partially.
 *
 * @see ErrorKind#UNREADABLE_LEDGER
 */
@SuppressWarnings("serial")
public class UnreadableLedgerException extends LedgerException {

  private final File file;
  private final int lineNo;


  /**
   * @param file    the ledger file
   * @param lineNo  1-based line number of the offending record; zero if not line-specific
   * @param message detail
   */
  public UnreadableLedgerException(File file, int lineNo, String message) {
    this(file, lineNo, message, null);
  }


  public UnreadableLedgerException(File file, int lineNo, String message, Throwable cause) {
    super(
        "unreadable ledger " + file + (lineNo > 0 ? " (line " + lineNo + ")" : "") + ": " + message,
        cause);
    this.file = file;
    this.lineNo = lineNo;
  }


  /** Returns the ledger file. */
  public File file() {
    return file;
  }

  /** Returns the 1-based line number of the bad record, or zero. */
  public int lineNo() {
    return lineNo;
  }

}
