/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.custody;

/**
 * Custody payload field names and other constants.
 */
public class CustodyConstants {

  /** Custody ledger names are this prefix followed by the document id. */
  public final static String LEDGER_PREFIX = "custody_";

  /** Prefix of the action names mirrored to the audit trail. */
  public final static String AUDIT_ACTION_PREFIX = "custody_";

  public final static String ACTION = "action";
  public final static String USER_ID = "user_id";
  public final static String DOCUMENT_ID = "document_id";
  public final static String DETAILS = "details";
  public final static String LOCATION = "location";
  public final static String HASH_BEFORE = "hash_before";
  public final static String HASH_AFTER = "hash_after";
  public final static String CUSTODY_ENTRY_ID = "custody_entry_id";

  public final static String LOG_NAME = "audit.custody";


  /** Returns the ledger name for the given document. */
  public static String ledgerName(long documentId) {
    return LEDGER_PREFIX + documentId;
  }


  /**
   * Returns the document id encoded in the given ledger name, or {@code null}
   * if it's not a custody ledger name.
   */
  public static Long documentId(String ledgerName) {
    if (!ledgerName.startsWith(LEDGER_PREFIX))
      return null;
    try {
      return Long.parseLong(ledgerName.substring(LEDGER_PREFIX.length()));
    } catch (NumberFormatException nfx) {
      return null;
    }
  }


  private CustodyConstants() {  }

}
