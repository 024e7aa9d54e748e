/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


import static io.crums.audit.ledger.LedgerConstants.*;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import io.crums.audit.json.JsonParsingException;
import io.crums.audit.json.JsonUtils;
import io.crums.audit.json.JsonWriter;

/**
 * Ledger export codecs.
 *
 * <h2>JSON</h2>
 * <pre>
 *   {
 *     "digest": "SHA-256",
 *     "entries": [ { entry record }, .. ],
 *     "exported_at": "2026-..Z",
 *     "ledger": "audit_chain",
 *     "total_entries": 2,
 *     "version": 1
 *   }
 * </pre>
 * <p>
 * Entry records carry every field, hashes included, so an export
 * {@linkplain #fromJson(byte[]) reads back} into a ledger that verifies
 * exactly as the exported one did.
 * </p>
 * <h2>CSV</h2>
 * <p>
 * Columns: {@code entry_id, timestamp}, then the union of top-level payload
 * keys (sorted), then {@code content_hash, previous_hash, chain_hash}. Nested
 * values are written as canonical JSON; absent values as empty cells. Quoting
 * per RFC 4180. CSV is a report format: it does not read back.
 * </p>
 */
public class LedgerExports {

  private LedgerExports() {  }


  /**
   * Returns the given entries as a JSON export document.
   */
  @SuppressWarnings("unchecked")
  public static String toJson(
      String ledger, HashScheme scheme, List<LedgerEntry> entries, Instant exportedAt) {

    var jObj = new JSONObject();
    jObj.putAll(Map.of(
        LEDGER_TAG, ledger,
        VERSION_TAG, scheme.version(),
        DIGEST_TAG, scheme.digest().hashAlgo(),
        EXPORTED_AT, exportedAt.toString(),
        TOTAL_ENTRIES, entries.size(),
        ENTRIES, LedgerEntry.PARSER.toJsonArray(entries)));
    return JsonWriter.PRETTY.toJson(jObj);
  }


  /**
   * Reconstructs an in-memory ledger from a JSON export. The entries are
   * taken as-is: tampered exports load fine, and {@linkplain Ledger#verify()
   * verification} says what's wrong with them.
   *
   * @throws JsonParsingException if malformed, or the version is unknown
   */
  public static Ledger fromJson(byte[] json) throws JsonParsingException {
    JSONObject jObj = JsonUtils.parseObject(new String(json, StandardCharsets.UTF_8));
    var ledger = JsonUtils.getString(jObj, LEDGER_TAG, true);
    int version = JsonUtils.getInt(jObj, VERSION_TAG);
    HashScheme scheme;
    try {
      scheme = HashScheme.forVersion(version);
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException(iax.getMessage(), iax);
    }
    JSONArray jEntries = JsonUtils.getJsonArray(jObj, ENTRIES, true);
    var entries = LedgerEntry.PARSER.toEntityList(jEntries);
    return Ledger.restore(ledger, scheme, entries);
  }


  /**
   * Returns the given entries as CSV.
   */
  public static String toCsv(List<LedgerEntry> entries) {
    var keys = new TreeSet<String>();
    entries.forEach(e -> keys.addAll(e.payload().keySet()));

    var csv = new StringBuilder(256 + entries.size() * 256);
    csv.append(ENTRY_ID).append(',').append(TIMESTAMP);
    for (var key : keys)
      appendCell(key, csv.append(','));
    csv.append(',').append(CONTENT_HASH)
        .append(',').append(PREVIOUS_HASH)
        .append(',').append(CHAIN_HASH).append("\r\n");

    for (var entry : entries) {
      appendCell(entry.entryId(), csv);
      csv.append(',').append(entry.timestamp());
      for (var key : keys)
        appendCell(cellValue(entry.payload().get(key)), csv.append(','));
      csv.append(',').append(entry.contentHash())
          .append(',').append(entry.previousHash())
          .append(',').append(entry.chainHash()).append("\r\n");
    }
    return csv.toString();
  }


  private static String cellValue(Object value) {
    if (value == null)
      return "";
    if (value instanceof Map || value instanceof List)
      return JsonWriter.CANONICAL.toJson(value);
    if (value instanceof Double && Double.isFinite((Double) value))
      return JsonWriter.appendDouble((Double) value, new StringBuilder()).toString();
    return value.toString();
  }


  /**
   * Appends the given cell, quoted if it contains a comma, quote, CR or LF.
   */
  public static StringBuilder appendCell(String value, StringBuilder out) {
    boolean quote = false;
    for (int index = value.length(); index-- > 0 && !quote; ) {
      char c = value.charAt(index);
      quote = c == ',' || c == '"' || c == '\n' || c == '\r';
    }
    if (!quote)
      return out.append(value);
    out.append('"');
    for (int index = 0; index < value.length(); ++index) {
      char c = value.charAt(index);
      if (c == '"')
        out.append('"');
      out.append(c);
    }
    return out.append('"');
  }

}
