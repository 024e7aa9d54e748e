/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.custody;


import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Summary of a document's chain of custody. The lists hold distinct
 * values in first-seen order.
 *
 * @param documentId    the document
 * @param totalEntries  number of entries (positive)
 * @param first         the first entry
 * @param last          the last entry
 * @param custodians    distinct user ids
 * @param locations     distinct locations
 * @param actions       distinct actions
 */
public record CustodySummary(
    long documentId,
    int totalEntries,
    CustodyEntry first,
    CustodyEntry last,
    List<String> custodians,
    List<String> locations,
    List<String> actions) {

  public CustodySummary {
    Objects.requireNonNull(first, "null first");
    Objects.requireNonNull(last, "null last");
    custodians = List.copyOf(custodians);
    locations = List.copyOf(locations);
    actions = List.copyOf(actions);
  }


  public Instant start() {
    return first.timestamp();
  }

  public Instant end() {
    return last.timestamp();
  }

  /** Returns the time from the first to the last entry. */
  public Duration timeSpan() {
    return Duration.between(start(), end());
  }

}
