/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.session;


import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A user's activity over a time window. Sessions overlapping the window are
 * counted; activities are counted only if inside the window. Lists hold
 * distinct values, sorted.
 */
public record ActivitySummary(
    String userId,
    int totalSessions,
    int activeSessions,
    int totalActivities,
    List<String> uniqueActions,
    List<Long> documentsAccessed,
    List<String> ipAddresses,
    List<String> userAgents,
    Instant firstActivity,
    Instant lastActivity,
    Duration totalTime) {

  public ActivitySummary {
    uniqueActions = List.copyOf(uniqueActions);
    documentsAccessed = List.copyOf(documentsAccessed);
    ipAddresses = List.copyOf(ipAddresses);
    userAgents = List.copyOf(userAgents);
  }


  public Optional<Instant> first() {
    return Optional.ofNullable(firstActivity);
  }

  public Optional<Instant> last() {
    return Optional.ofNullable(lastActivity);
  }

}
