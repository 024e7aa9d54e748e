/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.session;


import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.crums.audit.ledger.Payloads;

/**
 * A suspicious activity finding.
 *
 * @param type        what was found
 * @param userId      whose
 * @param severity    how bad
 * @param detectedAt  when detected
 * @param attributes  type-specific values (see {@linkplain FindingType})
 */
public record Finding(
    FindingType type, String userId, Severity severity, Instant detectedAt,
    Map<String, Object> attributes) {

  public Finding {
    Objects.requireNonNull(type, "null type");
    Objects.requireNonNull(userId, "null userId");
    Objects.requireNonNull(severity, "null severity");
    Objects.requireNonNull(detectedAt, "null detectedAt");
    attributes = Payloads.freeze(attributes);
  }


  /** Creates a finding with the type's default severity. */
  public Finding(FindingType type, String userId, Instant detectedAt, Map<String, ?> attributes) {
    this(type, userId, type.severity(), detectedAt, Payloads.freeze(attributes));
  }


  /** Returns the named attribute, or {@code null}. */
  public Object get(String attribute) {
    return attributes.get(attribute);
  }


  /** Returns this finding as a flat, JSON-ready map. */
  public Map<String, Object> toMap() {
    var map = new LinkedHashMap<String, Object>();
    map.put("type", type.code());
    map.put("user_id", userId);
    map.put("severity", severity.code());
    map.put("detected_at", detectedAt.toString());
    map.putAll(attributes);
    return map;
  }

}
