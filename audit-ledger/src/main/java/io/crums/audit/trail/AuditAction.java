/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.trail;


import static io.crums.audit.trail.TrailConstants.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.crums.audit.ledger.Payloads;

/**
 * An action to be recorded on the {@linkplain AuditTrail}. Only the
 * {@code action} name is required.
 *
 * @param action      action name (e.g. {@code "upload"}, {@code "login"})
 * @param userId      acting user, if any
 * @param documentId  subject document, if any
 * @param details     free-form details; {@code null} counts as empty
 * @param ipAddress   client address, if known
 * @param userAgent   client description, if known
 */
public record AuditAction(
    String action,
    String userId,
    Long documentId,
    Map<String, ?> details,
    String ipAddress,
    String userAgent) {


  public AuditAction {
    Objects.requireNonNull(action, "null action");
    details = Payloads.freeze(details);
  }


  /** Returns an action with no other fields set. */
  public static AuditAction of(String action) {
    return new AuditAction(action, null, null, null, null, null);
  }


  public AuditAction byUser(String userId) {
    return new AuditAction(action, userId, documentId, details, ipAddress, userAgent);
  }


  public AuditAction onDocument(Long documentId) {
    return new AuditAction(action, userId, documentId, details, ipAddress, userAgent);
  }


  public AuditAction withDetails(Map<String, ?> details) {
    return new AuditAction(action, userId, documentId, details, ipAddress, userAgent);
  }


  public AuditAction fromClient(String ipAddress, String userAgent) {
    return new AuditAction(action, userId, documentId, details, ipAddress, userAgent);
  }


  /**
   * Returns the ledger payload. Absent optional fields are omitted;
   * {@code details} is always present.
   */
  public Map<String, Object> toPayload() {
    var payload = new LinkedHashMap<String, Object>();
    payload.put(ACTION, action);
    payload.put(USER_ID, userId);
    payload.put(DOCUMENT_ID, documentId);
    payload.put(DETAILS, details);
    payload.put(IP_ADDRESS, ipAddress);
    payload.put(USER_AGENT, userAgent);
    return Payloads.withoutNulls(payload);
  }

}
