/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


import static io.crums.audit.ledger.LedgerConstants.*;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.json.simple.JSONObject;

import io.crums.audit.json.JsonEntityParser;
import io.crums.audit.json.JsonParsingException;
import io.crums.audit.json.JsonUtils;

/**
 * An immutable ledger entry. The payload is opaque to the ledger: it's
 * hashed, stored and queried, never interpreted.
 *
 * <p>
 * Instances are usually created by {@linkplain HashScheme#seal(String, Instant, Map, String)
 * sealing} a payload, but the constructor accepts any field values: an entry read
 * back from storage is whatever storage says it is, and whether its hashes still
 * hold is for {@linkplain Ledger#verify()} to say.
 * </p>
 *
 * @param entryId       unique id (a random UUID)
 * @param timestamp     when appended (UTC)
 * @param payload       frozen on construction
 * @param contentHash   hash of the canonical payload
 * @param previousHash  predecessor's {@code chainHash}, or empty if first
 * @param chainHash     hash of the canonical payload concatenated with {@code previousHash}
 *
 * @see #PARSER
 */
public record LedgerEntry(
    String entryId,
    Instant timestamp,
    Map<String, Object> payload,
    String contentHash,
    String previousHash,
    String chainHash) {


  /** JSON parser. */
  public final static JsonEntityParser<LedgerEntry> PARSER = new Parser();


  public LedgerEntry {
    Objects.requireNonNull(entryId, "null entryId");
    Objects.requireNonNull(timestamp, "null timestamp");
    payload = Payloads.freeze(payload);
    Objects.requireNonNull(contentHash, "null contentHash");
    Objects.requireNonNull(previousHash, "null previousHash");
    Objects.requireNonNull(chainHash, "null chainHash");
  }


  /**
   * Returns the named top-level payload value, if present and not null.
   */
  public Optional<Object> get(String field) {
    return Optional.ofNullable(payload.get(field));
  }


  /**
   * Returns the named top-level payload value as a string, if present.
   * Non-string values are rendered via {@code toString()}.
   */
  public Optional<String> getString(String field) {
    return get(field).map(Object::toString);
  }


  /**
   * Returns a copy of this entry with the given payload, all other fields
   * (hashes included) unchanged. Such copies model in-place edits of stored
   * records and do not verify.
   */
  public LedgerEntry withPayload(Map<String, ?> newPayload) {
    return new LedgerEntry(
        entryId, timestamp, Payloads.freeze(newPayload), contentHash, previousHash, chainHash);
  }


  /**
   * Returns a copy of this entry with the given {@code previousHash}, all other
   * fields unchanged.
   */
  public LedgerEntry withPreviousHash(String newPreviousHash) {
    return new LedgerEntry(
        entryId, timestamp, payload, contentHash, newPreviousHash, chainHash);
  }



  public static class Parser implements JsonEntityParser<LedgerEntry> {

    @SuppressWarnings("unchecked")
    @Override
    public JSONObject injectEntity(LedgerEntry entry, JSONObject jObj) {
      jObj.put(ENTRY_ID, entry.entryId());
      jObj.put(TIMESTAMP, entry.timestamp().toString());
      jObj.put(PAYLOAD, entry.payload());
      jObj.put(CONTENT_HASH, entry.contentHash());
      jObj.put(PREVIOUS_HASH, entry.previousHash());
      jObj.put(CHAIN_HASH, entry.chainHash());
      return jObj;
    }

    @SuppressWarnings("unchecked")
    @Override
    public LedgerEntry toEntity(JSONObject jObj) throws JsonParsingException {
      var entryId = JsonUtils.getString(jObj, ENTRY_ID, true);
      var timestamp = JsonUtils.getInstant(jObj, TIMESTAMP, true);
      var payload = JsonUtils.getJsonObject(jObj, PAYLOAD, true);
      var contentHash = JsonUtils.getString(jObj, CONTENT_HASH, true);
      var previousHash = JsonUtils.getString(jObj, PREVIOUS_HASH, true);
      var chainHash = JsonUtils.getString(jObj, CHAIN_HASH, true);
      return new LedgerEntry(
          entryId, timestamp, payload, contentHash, previousHash, chainHash);
    }

  }

}
