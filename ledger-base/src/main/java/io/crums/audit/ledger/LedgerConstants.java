/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;

import java.lang.System.Logger;

import io.crums.audit.hash.Digest;
import io.crums.audit.hash.Digests;

/**
 * Library constants.
 */
public class LedgerConstants {


  /**
   * Digest used by the library is statically defined here. Currently SHA-256.
   *
   * @see Digests#SHA_256
   */
  public final static Digest DIGEST = Digests.SHA_256;

  /**
   * Ledger format version. Identifies both the hash algorithm and the
   * canonical payload serialization.
   */
  public final static int VERSION = 1;

  /**
   * Ledger file extension (includes the dot).
   */
  public final static String LEDGER_EXT = ".ledger";

  /**
   * CSV file extension (includes the dot).
   */
  public final static String CSV_EXT = ".csv";

  /**
   * JSON file extension (includes the dot).
   */
  public final static String JSON_EXT = ".json";


  // JSON / CSV field names

  public final static String VERSION_TAG = "version";
  public final static String DIGEST_TAG = "digest";
  public final static String LEDGER_TAG = "ledger";
  public final static String CREATED_TAG = "created";
  public final static String EXPORTED_AT = "exported_at";
  public final static String TOTAL_ENTRIES = "total_entries";
  public final static String ENTRIES = "entries";

  public final static String ENTRY_ID = "entry_id";
  public final static String TIMESTAMP = "timestamp";
  public final static String PAYLOAD = "payload";
  public final static String CONTENT_HASH = "content_hash";
  public final static String PREVIOUS_HASH = "previous_hash";
  public final static String CHAIN_HASH = "chain_hash";


  /**
   * The module's logger name.
   *
   * @see #getLogger()
   */
  public final static String LOG_NAME = "audit.ledger";


  /**
   * Returns the module logger.
   *
   * @see #LOG_NAME
   */
  public static Logger getLogger() {
    return System.getLogger(LOG_NAME);
  }



  private LedgerConstants() {  }

}
