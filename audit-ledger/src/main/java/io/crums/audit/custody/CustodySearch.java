/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.custody;


import java.time.Instant;

/**
 * Cross-document custody search criteria. {@code null} fields don't filter;
 * time bounds are inclusive.
 */
public record CustodySearch(
    String userId, String action, String location, Instant from, Instant to) {

  /** Matches everything. */
  public final static CustodySearch ALL = new CustodySearch(null, null, null, null, null);


  public CustodySearch withUser(String userId) {
    return new CustodySearch(userId, action, location, from, to);
  }

  public CustodySearch withAction(String action) {
    return new CustodySearch(userId, action, location, from, to);
  }

  public CustodySearch atLocation(String location) {
    return new CustodySearch(userId, action, location, from, to);
  }

  public CustodySearch between(Instant from, Instant to) {
    return new CustodySearch(userId, action, location, from, to);
  }


  public boolean matches(CustodyEntry entry) {
    if (userId != null && !userId.equals(entry.userId()))
      return false;
    if (action != null && !action.equals(entry.action()))
      return false;
    if (location != null && !location.equals(entry.location().orElse(null)))
      return false;
    Instant time = entry.timestamp();
    if (from != null && time.isBefore(from))
      return false;
    return to == null || !time.isAfter(to);
  }

}
