/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.session;

/**
 * Session field names, audit action names, and other constants.
 */
public class SessionConstants {

  /** Sessions file name. */
  public final static String SESSIONS_FILE = "sessions.json";

  public final static String SESSION_START = "session_start";
  public final static String SESSION_END = "session_end";

  public final static String SESSION_ID = "session_id";
  public final static String USER_ID = "user_id";
  public final static String IP_ADDRESS = "ip_address";
  public final static String USER_AGENT = "user_agent";
  public final static String START_TIME = "start_time";
  public final static String LAST_ACTIVITY = "last_activity";
  public final static String END_TIME = "end_time";
  public final static String IS_ACTIVE = "is_active";
  public final static String DURATION_SECONDS = "duration_seconds";
  public final static String ACTIVITY_COUNT = "activity_count";
  public final static String ACTIVITIES = "activities";
  public final static String TIMESTAMP = "timestamp";
  public final static String ACTION = "action";
  public final static String DETAILS = "details";
  public final static String DOCUMENT_ID = "document_id";
  public final static String REASON = "reason";

  public final static String LOG_NAME = "audit.session";


  private SessionConstants() {  }

}
