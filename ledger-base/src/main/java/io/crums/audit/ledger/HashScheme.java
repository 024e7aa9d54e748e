/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


import java.time.Instant;
import java.util.Map;
import java.util.Objects;

import io.crums.audit.hash.Digest;

/**
 * Versioned rules for hashing ledger entries. A version pins down both the
 * digest and the canonical payload serialization; ledger files and exports
 * record the version they were written with, so that a future change of either
 * never silently invalidates old ledgers.
 *
 * <h2>Version 1</h2>
 * <pre>
 *   content_hash = H(canonical(payload))
 *   chain_hash   = H(canonical(payload) + previous_hash)
 * </pre>
 * <p>
 * where {@code H} is SHA-256 over UTF-8, rendered in lowercase hex; {@code +}
 * is string concatenation; and the first entry's {@code previous_hash} is the
 * empty string.
 * </p>
 *
 * @see Payloads#canonical(Map)
 */
public final class HashScheme {

  /** Version 1: SHA-256 over canonical JSON. */
  public final static HashScheme V1 = new HashScheme(LedgerConstants.VERSION, LedgerConstants.DIGEST);


  /**
   * Returns the scheme for the given version number.
   *
   * @throws IllegalArgumentException if the version is not supported
   */
  public static HashScheme forVersion(int version) throws IllegalArgumentException {
    if (version == V1.version)
      return V1;
    throw new IllegalArgumentException("unsupported ledger version: " + version);
  }



  private final int version;
  private final Digest digest;


  private HashScheme(int version, Digest digest) {
    this.version = version;
    this.digest = Objects.requireNonNull(digest);
  }


  public int version() {
    return version;
  }


  public Digest digest() {
    return digest;
  }


  /** Returns the first entry's {@code previous_hash}. */
  public String sentinel() {
    return digest.sentinelHash();
  }


  /**
   * Returns the hash of the given canonical payload text.
   */
  public String contentHash(String canonicalPayload) {
    return digest.hashHex(canonicalPayload);
  }


  /**
   * Returns the hash linking the given canonical payload text to its predecessor.
   */
  public String chainHash(String canonicalPayload, String previousHash) {
    return digest.hashHex(canonicalPayload + previousHash);
  }


  /**
   * Creates a new, hashed entry.
   *
   * @param entryId       unique id
   * @param timestamp     creation time
   * @param payload       not frozen yet is OK
   * @param previousHash  the predecessor's chain hash (or {@linkplain #sentinel()})
   */
  public LedgerEntry seal(
      String entryId, Instant timestamp, Map<String, ?> payload, String previousHash) {

    Map<String, Object> frozen = Payloads.freeze(payload);
    String canonical = Payloads.canonical(frozen);
    return new LedgerEntry(
        entryId,
        timestamp,
        frozen,
        contentHash(canonical),
        previousHash,
        chainHash(canonical, previousHash));
  }


  @Override
  public String toString() {
    return "v" + version + ":" + digest.hashAlgo();
  }

}
