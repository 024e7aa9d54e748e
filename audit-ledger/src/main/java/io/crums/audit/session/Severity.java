/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.session;

/** Finding severity. */
public enum Severity {
  LOW,
  MEDIUM,
  HIGH;

  public String code() {
    return name().toLowerCase();
  }
}
