/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.trail;


import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregate audit trail statistics.
 *
 * @param totalEntries          number of entries
 * @param earliest              earliest entry time ({@code null} if empty)
 * @param latest                latest entry time ({@code null} if empty)
 * @param topActions            most frequent actions, most frequent first
 * @param topUsers              most active users, most active first
 * @param documentsAccessed     number of distinct documents
 * @param uniqueUsers           number of distinct users
 * @param persistenceFailures   failed write attempts since opened
 * @param pendingEntries        entries not yet written to disk
 * @param lastPersistenceError  detail of the last write failure ({@code null} if none)
 */
public record AuditStatistics(
    int totalEntries,
    Instant earliest,
    Instant latest,
    List<Count> topActions,
    List<Count> topUsers,
    int documentsAccessed,
    int uniqueUsers,
    long persistenceFailures,
    int pendingEntries,
    String lastPersistenceError) {


  /**
   * A name and how many times it occurred.
   */
  public record Count(String name, int count) implements Comparable<Count> {

    private final static Comparator<Count> ORDER =
        Comparator.comparingInt(Count::count).reversed().thenComparing(Count::name);

    /** Descending by count; ties, by name. */
    @Override
    public int compareTo(Count other) {
      return ORDER.compare(this, other);
    }
  }


  public AuditStatistics {
    topActions = List.copyOf(topActions);
    topUsers = List.copyOf(topUsers);
  }


  public Optional<Instant> earliestTime() {
    return Optional.ofNullable(earliest);
  }

  public Optional<Instant> latestTime() {
    return Optional.ofNullable(latest);
  }


  /**
   * Returns the top {@code max} counts of the given tallies.
   */
  static List<Count> top(Map<String, Integer> tallies, int max) {
    List<Count> counts = new ArrayList<>(tallies.size());
    tallies.forEach((name, count) -> counts.add(new Count(name, count)));
    counts.sort(null);
    return counts.size() > max ? counts.subList(0, max) : counts;
  }

}
