/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


import static io.crums.audit.ledger.LedgerConstants.*;

import java.time.Instant;
import java.util.Objects;

import org.json.simple.JSONObject;

import io.crums.audit.json.JsonEntityParser;
import io.crums.audit.json.JsonParsingException;
import io.crums.audit.json.JsonUtils;

/**
 * First line of a ledger file. Always written in plaintext.
 *
 * @param ledger    ledger name
 * @param version   hash scheme version
 * @param digest    hash algorithm name (informational)
 * @param created   when the file was created
 */
public record LedgerHeader(String ledger, int version, String digest, Instant created) {

  /** JSON parser. */
  public final static JsonEntityParser<LedgerHeader> PARSER = new Parser();


  public LedgerHeader {
    Objects.requireNonNull(ledger, "null ledger");
    Objects.requireNonNull(digest, "null digest");
    Objects.requireNonNull(created, "null created");
    if (version <= 0)
      throw new IllegalArgumentException("version " + version);
  }


  /**
   * Returns a header for a new ledger under the given scheme.
   */
  public static LedgerHeader forScheme(String ledger, HashScheme scheme, Instant created) {
    return new LedgerHeader(ledger, scheme.version(), scheme.digest().hashAlgo(), created);
  }


  /**
   * Returns the hash scheme this header names.
   *
   * @throws IllegalArgumentException if the version is unknown
   */
  public HashScheme scheme() throws IllegalArgumentException {
    return HashScheme.forVersion(version);
  }



  public static class Parser implements JsonEntityParser<LedgerHeader> {

    @SuppressWarnings("unchecked")
    @Override
    public JSONObject injectEntity(LedgerHeader header, JSONObject jObj) {
      jObj.put(LEDGER_TAG, header.ledger());
      jObj.put(VERSION_TAG, header.version());
      jObj.put(DIGEST_TAG, header.digest());
      jObj.put(CREATED_TAG, header.created().toString());
      return jObj;
    }

    @Override
    public LedgerHeader toEntity(JSONObject jObj) throws JsonParsingException {
      var ledger = JsonUtils.getString(jObj, LEDGER_TAG, true);
      int version = JsonUtils.getInt(jObj, VERSION_TAG);
      var digest = JsonUtils.getString(jObj, DIGEST_TAG, true);
      var created = JsonUtils.getInstant(jObj, CREATED_TAG, true);
      try {
        return new LedgerHeader(ledger, version, digest, created);
      } catch (IllegalArgumentException iax) {
        throw new JsonParsingException(iax.getMessage(), iax);
      }
    }
  }

}
