/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


import static io.crums.audit.ledger.LedgerTest.payload;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.crums.audit.json.JsonParsingException;

/**
 *
 */
public class LedgerExportsTest {


  static Ledger mixed() {
    var ledger = Ledger.newVolatile("mixed");
    ledger.append(payload(
        "action", "upload", "user_id", "alice", "document_id", 7,
        "details", Map.of("filename", "scan.pdf", "size", 1024, "pages", List.of(1, 2))));
    ledger.append(payload("action", "view", "user_id", "bob", "score", 0.5));
    ledger.append(payload("action", "note", "text", "café, \"quoted\"\nline two"));
    ledger.append(payload("action", "big", "n", Long.MAX_VALUE, "ratio", 1e20));
    return ledger;
  }


  @Test
  public void testJsonRoundTrip() {
    var ledger = mixed();
    byte[] json = ledger.export(ExportFormat.JSON);
    var copy = LedgerExports.fromJson(json);
    assertEquals("mixed", copy.name());
    assertEquals(ledger.snapshot(), copy.snapshot());
    assertEquals(ledger.verify(), copy.verify());
    assertTrue(copy.verify().valid());
  }


  @Test
  public void testJsonRoundTripOfTampered() {
    var entries = new ArrayList<>(mixed().snapshot());
    entries.set(1, entries.get(1).withPayload(payload("action", "view", "user_id", "eve")));
    var tampered = Ledger.restore("tampered", entries);
    var copy = LedgerExports.fromJson(tampered.export(ExportFormat.JSON));
    var report = copy.verify();
    assertFalse(report.valid());
    assertEquals(tampered.verify(), report);
    assertEquals(List.of(1), report.failedIndices());
  }


  @Test
  public void testJsonHeader() {
    String json = new String(mixed().export(ExportFormat.JSON), StandardCharsets.UTF_8);
    assertTrue(json.contains("\"version\": 1"));
    assertTrue(json.contains("\"digest\": \"SHA-256\""));
    assertTrue(json.contains("\"total_entries\": 4"));
    assertTrue(json.contains("\"ledger\": \"mixed\""));
  }


  @Test
  public void testUnknownVersionRejected() {
    String json = new String(mixed().export(ExportFormat.JSON), StandardCharsets.UTF_8)
        .replace("\"version\": 1", "\"version\": 9");
    assertThrows(
        JsonParsingException.class,
        () -> LedgerExports.fromJson(json.getBytes(StandardCharsets.UTF_8)));
  }


  @Test
  public void testCsv() {
    var ledger = mixed();
    String csv = new String(ledger.export(ExportFormat.CSV), StandardCharsets.UTF_8);
    String[] rows = csv.split("\r\n", -1);
    // header + 4 rows + trailing empty; row 3 has an embedded (quoted) LF
    assertEquals(6, rows.length);
    assertEquals(
        "entry_id,timestamp,action,details,document_id,n,ratio,score,text,user_id," +
        "content_hash,previous_hash,chain_hash",
        rows[0]);

    var first = ledger.snapshot().get(0);
    assertTrue(rows[1].startsWith(first.entryId() + "," + first.timestamp() + ",upload,"));
    assertTrue(rows[1].contains(
        "\"{\"\"filename\"\":\"\"scan.pdf\"\",\"\"pages\"\":[1,2],\"\"size\"\":1024}\""));
    assertTrue(rows[1].endsWith("," + first.contentHash() + ",," + first.chainHash()));

    assertTrue(rows[2].contains(",0.5,"));
    assertTrue(rows[3].contains("\"café, \"\"quoted\"\"\nline two\""));
    assertTrue(rows[4].contains("," + Long.MAX_VALUE + ",100000000000000000000.0,"));
  }


  @Test
  public void testEmptyCsv() {
    String csv = LedgerExports.toCsv(List.of());
    assertEquals(
        "entry_id,timestamp,content_hash,previous_hash,chain_hash\r\n", csv);
  }

}
