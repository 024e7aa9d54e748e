/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.trail;


import static io.crums.audit.trail.TrailConstants.*;

import java.time.Instant;

import io.crums.audit.ledger.LedgerQuery;

/**
 * Combined audit trail filter. {@code null} fields don't filter.
 *
 * @param userId      acting user
 * @param documentId  subject document
 * @param action      action name
 * @param from        inclusive lower time bound
 * @param to          inclusive upper time bound
 * @param limit       if positive, only the last {@code limit} matches are returned
 */
public record AuditFilter(
    String userId, Long documentId, String action, Instant from, Instant to, int limit) {

  /** Matches everything. */
  public final static AuditFilter ALL = new AuditFilter(null, null, null, null, null, 0);


  public AuditFilter {
    if (limit < 0)
      throw new IllegalArgumentException("limit " + limit);
  }

  public AuditFilter withUser(String userId) {
    return new AuditFilter(userId, documentId, action, from, to, limit);
  }

  public AuditFilter withDocument(Long documentId) {
    return new AuditFilter(userId, documentId, action, from, to, limit);
  }

  public AuditFilter withAction(String action) {
    return new AuditFilter(userId, documentId, action, from, to, limit);
  }

  public AuditFilter between(Instant from, Instant to) {
    return new AuditFilter(userId, documentId, action, from, to, limit);
  }

  public AuditFilter withLimit(int limit) {
    return new AuditFilter(userId, documentId, action, from, to, limit);
  }


  /** Returns the equivalent ledger query. */
  public LedgerQuery toQuery() {
    var query = LedgerQuery.ALL.from(from).to(to);
    if (userId != null)
      query = query.where(USER_ID, userId);
    if (documentId != null)
      query = query.where(DOCUMENT_ID, documentId);
    if (action != null)
      query = query.where(ACTION, action);
    if (limit > 0)
      query = query.tail(limit);
    return query;
  }

}
