/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.custody;


import java.util.Objects;

/**
 * A custody anomaly found on verification.
 *
 * @param index     zero-based entry index
 * @param entryId   the entry's id
 * @param type      what's wrong
 * @param expected  expected value (predecessor's timestamp or {@code hash_after}); may be {@code null}
 * @param actual    actual value; may be {@code null}
 */
public record CustodyIssue(int index, String entryId, IssueType type, String expected, String actual) {

  public CustodyIssue {
    Objects.requireNonNull(entryId, "null entryId");
    Objects.requireNonNull(type, "null type");
  }


  @Override
  public String toString() {
    var s = "[" + index + "] " + entryId + ": " + type.description();
    return expected == null && actual == null ?
        s : s + " (expected '" + expected + "', actual '" + actual + "')";
  }

}
