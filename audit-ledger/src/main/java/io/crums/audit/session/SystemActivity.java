/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.session;


import java.time.Instant;
import java.util.List;

/**
 * System-wide activity statistics.
 *
 * @param activeSessions    number of active sessions
 * @param totalUsers        number of users with sessions
 * @param totalSessions     number of sessions, active or not
 * @param activityLastHour  activities in the last hour
 * @param activityLastDay   activities in the last 24 hours
 * @param topActiveUsers    most active users over the last 24 hours, most active first
 * @param generatedAt       when computed
 */
public record SystemActivity(
    int activeSessions,
    int totalUsers,
    int totalSessions,
    int activityLastHour,
    int activityLastDay,
    List<UserCount> topActiveUsers,
    Instant generatedAt) {

  /** A user's activity count. */
  public record UserCount(String userId, int activityCount) {  }


  public SystemActivity {
    topActiveUsers = List.copyOf(topActiveUsers);
  }

}
