/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Outcome of {@linkplain Ledger#verify() verifying} a ledger. An entry may
 * show up in both the tampered and broken-link lists.
 *
 * @param valid             {@code true} iff there are no diagnostics
 * @param totalEntries      number of entries checked
 * @param verifiedEntries   number of entries with no diagnostic
 * @param tamperedEntries   entries that no longer match their own hashes
 * @param brokenLinks       entries whose link to their predecessor is broken
 */
public record VerificationReport(
    boolean valid,
    int totalEntries,
    int verifiedEntries,
    List<EntryDiagnostic> tamperedEntries,
    List<EntryDiagnostic> brokenLinks) {


  public VerificationReport {
    tamperedEntries = List.copyOf(tamperedEntries);
    brokenLinks = List.copyOf(brokenLinks);
    if (valid != (tamperedEntries.isEmpty() && brokenLinks.isEmpty()))
      throw new IllegalArgumentException(
          "valid=" + valid + " with " + tamperedEntries.size() + " tampered, " +
          brokenLinks.size() + " broken links");
  }


  /**
   * Verifies the given entries in order.
   *
   * @param entries the ledger's entries, in append order
   * @param scheme  the hashing rules the entries were written with
   */
  public static VerificationReport verify(List<LedgerEntry> entries, HashScheme scheme) {
    List<EntryDiagnostic> tampered = new ArrayList<>();
    List<EntryDiagnostic> broken = new ArrayList<>();
    int verified = 0;

    final int count = entries.size();
    String prevChainHash = scheme.sentinel();

    for (int index = 0; index < count; ++index) {
      LedgerEntry entry = entries.get(index);
      boolean ok = true;

      String canonical = Payloads.canonical(entry.payload());

      String contentHash = scheme.contentHash(canonical);
      if (!contentHash.equals(entry.contentHash())) {
        ok = false;
        tampered.add(new EntryDiagnostic(
            index, entry.entryId(), Violation.CONTENT_HASH_MISMATCH,
            contentHash, entry.contentHash()));
      }

      String chainHash = scheme.chainHash(canonical, entry.previousHash());
      if (!chainHash.equals(entry.chainHash())) {
        ok = false;
        tampered.add(new EntryDiagnostic(
            index, entry.entryId(), Violation.CHAIN_HASH_MISMATCH,
            chainHash, entry.chainHash()));
      }

      if (!prevChainHash.equals(entry.previousHash())) {
        ok = false;
        broken.add(new EntryDiagnostic(
            index, entry.entryId(),
            index == 0 ? Violation.BAD_GENESIS : Violation.BROKEN_LINK,
            prevChainHash, entry.previousHash()));
      }

      if (ok)
        ++verified;

      prevChainHash = entry.chainHash();
    }

    boolean valid = tampered.isEmpty() && broken.isEmpty();
    return new VerificationReport(valid, count, verified, tampered, broken);
  }



  /**
   * Returns the zero-based indices of entries with any diagnostic, in order.
   */
  public List<Integer> failedIndices() {
    var indices = new TreeSet<Integer>();
    tamperedEntries.forEach(d -> indices.add(d.index()));
    brokenLinks.forEach(d -> indices.add(d.index()));
    return List.copyOf(indices);
  }


  /**
   * Returns this report as a JSON-ready map.
   */
  public Map<String, Object> toMap() {
    return Map.of(
        "is_valid", valid,
        "total_entries", totalEntries,
        "verified_entries", verifiedEntries,
        "tampered_entries", toMaps(tamperedEntries),
        "broken_links", toMaps(brokenLinks));
  }


  static List<Object> toMaps(List<EntryDiagnostic> diagnostics) {
    List<Object> out = new ArrayList<>(diagnostics.size());
    for (var d : diagnostics)
      out.add(Map.of(
          "entry_index", d.index(),
          "entry_id", d.entryId(),
          "issue", d.violation().description(),
          "violation", d.violation().name(),
          "expected_hash", d.expectedHash(),
          "actual_hash", d.actualHash()));
    return out;
  }

}
