/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.session;

/**
 * Kinds of suspicious activity.
 *
 * @see AnomalyThresholds
 */
public enum FindingType {

  /** Too many concurrently active sessions. Attribute: {@code session_count}. */
  MULTIPLE_CONCURRENT_SESSIONS("multiple_concurrent_sessions", Severity.MEDIUM),
  /** A recent session with too many activities, too fast. Attributes: {@code session_id}, {@code activity_rate}. */
  RAPID_ACTIVITY_PATTERN("rapid_activity_pattern", Severity.HIGH),
  /** Too many distinct IPs across recent sessions. Attributes: {@code ip_count}, {@code ip_addresses}. */
  MULTIPLE_IP_ADDRESSES("multiple_ip_addresses", Severity.MEDIUM);


  private final String code;
  private final Severity severity;

  private FindingType(String code, Severity severity) {
    this.code = code;
    this.severity = severity;
  }


  /** Returns the lowercase, underscored name. */
  public String code() {
    return code;
  }

  public Severity severity() {
    return severity;
  }

}
