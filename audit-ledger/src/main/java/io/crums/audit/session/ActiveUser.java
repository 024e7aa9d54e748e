/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.session;


import java.time.Instant;
import java.util.List;

/**
 * A user with active sessions.
 *
 * @param userId              the user
 * @param sessionCount        number of active sessions
 * @param totalActivities     activities across the active sessions
 * @param firstSessionStart   start of the earliest active session
 * @param lastActivity        latest activity across active sessions
 * @param ipAddresses         distinct IPs of the active sessions, sorted
 */
public record ActiveUser(
    String userId, int sessionCount, int totalActivities, Instant firstSessionStart,
    Instant lastActivity, List<String> ipAddresses) {

  public ActiveUser {
    ipAddresses = List.copyOf(ipAddresses);
  }

}
