/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.custody;


import java.util.List;
import java.util.Objects;

import io.crums.audit.ledger.VerificationReport;

/**
 * Verification result of a document's chain of custody: the ledger's
 * cryptographic report, plus custody domain issues.
 *
 * @param documentId      the document
 * @param report          the custody ledger's verification report
 * @param issues          domain anomalies, in entry order
 * @param verifiedEntries entries with neither cryptographic diagnostics nor issues
 */
public record CustodyVerification(
    long documentId, VerificationReport report, List<CustodyIssue> issues, int verifiedEntries) {

  public CustodyVerification {
    Objects.requireNonNull(report, "null report");
    issues = List.copyOf(issues);
  }


  /** Returns {@code true} iff the ledger verifies and there are no issues. */
  public boolean valid() {
    return report.valid() && issues.isEmpty();
  }


  public int totalEntries() {
    return report.totalEntries();
  }

}
