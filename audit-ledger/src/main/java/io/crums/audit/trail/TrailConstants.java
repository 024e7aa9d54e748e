/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.trail;

import java.lang.System.Logger;

/**
 * Audit trail payload field names and other constants.
 */
public class TrailConstants {

  /** Name of the audit trail's ledger. */
  public final static String AUDIT_LEDGER = "audit_chain";

  public final static String ACTION = "action";
  public final static String USER_ID = "user_id";
  public final static String DOCUMENT_ID = "document_id";
  public final static String DETAILS = "details";
  public final static String IP_ADDRESS = "ip_address";
  public final static String USER_AGENT = "user_agent";

  /** Number of entries in the top-actions and top-users statistics. */
  public final static int TOP_COUNT = 10;


  /**
   * The module's logger name.
   *
   * @see #getLogger()
   */
  public final static String LOG_NAME = "audit.trail";


  /**
   * Returns the module logger.
   */
  public static Logger getLogger() {
    return System.getLogger(LOG_NAME);
  }


  private TrailConstants() {  }

}
