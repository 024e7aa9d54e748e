/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.session;

/**
 * Thresholds of the {@linkplain SessionTracker#detectSuspiciousActivity(String)
 * suspicious activity} heuristics. Each is exceeded only when strictly
 * surpassed.
 *
 * @param maxConcurrentSessions   max concurrently active sessions per user
 * @param rapidMinActivities      a session must have more activities than this to be rated
 * @param rapidMaxRate            max activities per second
 * @param rapidRecentSessions     number of a user's most recent sessions rated
 * @param maxDistinctIps          max distinct IP addresses across recent sessions
 * @param ipRecentSessions        number of a user's most recent sessions whose IPs are counted
 */
public record AnomalyThresholds(
    int maxConcurrentSessions,
    int rapidMinActivities,
    double rapidMaxRate,
    int rapidRecentSessions,
    int maxDistinctIps,
    int ipRecentSessions) {

  /** 3 sessions; 100 activities at 2/s over the last 5 sessions; 5 IPs over the last 10 sessions. */
  public final static AnomalyThresholds DEFAULT = new AnomalyThresholds(3, 100, 2.0, 5, 5, 10);


  public AnomalyThresholds {
    if (maxConcurrentSessions < 0 || rapidMinActivities < 0 || !(rapidMaxRate >= 0) ||
        rapidRecentSessions < 0 || maxDistinctIps < 0 || ipRecentSessions < 0)
      throw new IllegalArgumentException(
          "negative threshold: " + maxConcurrentSessions + ", " + rapidMinActivities + ", " +
          rapidMaxRate + ", " + rapidRecentSessions + ", " + maxDistinctIps + ", " + ipRecentSessions);
  }

}
