/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.trail;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.audit.ManualClock;
import io.crums.audit.ledger.ErrorKind;
import io.crums.audit.ledger.ExportFormat;
import io.crums.audit.ledger.HashScheme;
import io.crums.audit.ledger.Ledger;
import io.crums.audit.ledger.LedgerEntry;
import io.crums.audit.ledger.LedgerExports;
import io.crums.audit.ledger.LedgerSink;
import io.crums.audit.ledger.LedgerStore;

/**
 *
 */
public class AuditTrailTest {

  final static Instant T0 = Instant.parse("2026-03-01T09:00:00Z");


  private AuditTrail sample(ManualClock clock) {
    var trail = AuditTrail.inMemory(clock);
    trail.record("upload", "alice", 1L, Map.of("file", "a.pdf"), "10.0.0.1", "curl/8");
    clock.advance(Duration.ofMinutes(1));
    trail.record("view", "bob", 1L, null, null, null);
    clock.advance(Duration.ofMinutes(1));
    trail.record("view", "alice", 2L, null, null, null);
    clock.advance(Duration.ofMinutes(1));
    trail.record("analyze", "alice", 2L, Map.of("score", 0.75), null, null);
    clock.advance(Duration.ofMinutes(1));
    trail.record(AuditAction.of("system_start"));
    return trail;
  }


  @Test
  public void testRecord() {
    var trail = AuditTrail.inMemory();
    var result = trail.record("login", "alice");
    assertTrue(result.isOk());
    assertEquals(1, trail.size());
    var entry = trail.entries().get(0);
    assertEquals(result.get(), entry.entryId());
    assertEquals("login", entry.action());
    assertEquals("alice", entry.userId().get());
    assertTrue(entry.documentId().isEmpty());
    assertTrue(entry.details().isEmpty());
    assertTrue(trail.verify().valid());
  }


  @Test
  public void testPayloadOmitsAbsentFields() {
    var trail = AuditTrail.inMemory();
    trail.record("upload", "carol", 9L, null, null, "agent");
    var payload = trail.ledger().last().payload();
    assertEquals(
        List.of("action", "details", "document_id", "user_agent", "user_id"),
        payload.keySet().stream().sorted().toList());
    assertEquals(9L, payload.get("document_id"));
    assertEquals(Map.of(), payload.get("details"));
  }


  @Test
  public void testQueries() {
    var clock = new ManualClock(T0);
    var trail = sample(clock);
    assertEquals(5, trail.size());
    assertEquals(3, trail.byUser("alice").size());
    assertEquals(2, trail.byDocument(1).size());
    assertEquals(2, trail.byActionType("view").size());
    assertEquals(
        List.of("view", "view", "analyze"),
        trail.byTimeRange(T0.plusSeconds(60), T0.plusSeconds(180)).stream().map(AuditEntry::action).toList());

    var lastTwoByAlice = trail.trail(AuditFilter.ALL.withUser("alice").withLimit(2));
    assertEquals(2, lastTwoByAlice.size());
    assertEquals("view", lastTwoByAlice.get(0).action());
    assertEquals("analyze", lastTwoByAlice.get(1).action());

    var aliceOnDoc2 = trail.trail(AuditFilter.ALL.withUser("alice").withDocument(2L));
    assertEquals(2, aliceOnDoc2.size());
    assertEquals(0.75, aliceOnDoc2.get(1).details().get("score"));
  }


  @Test
  public void testStatistics() {
    var clock = new ManualClock(T0);
    var trail = sample(clock);
    var stats = trail.statistics();
    assertEquals(5, stats.totalEntries());
    assertEquals(T0, stats.earliest());
    assertEquals(T0.plusSeconds(240), stats.latest());
    assertEquals(new AuditStatistics.Count("view", 2), stats.topActions().get(0));
    assertEquals(4, stats.topActions().size());
    assertEquals(new AuditStatistics.Count("alice", 3), stats.topUsers().get(0));
    assertEquals(new AuditStatistics.Count("bob", 1), stats.topUsers().get(1));
    assertEquals(2, stats.documentsAccessed());
    assertEquals(2, stats.uniqueUsers());
    assertEquals(0, stats.persistenceFailures());
    assertNull(stats.lastPersistenceError());
  }


  @Test
  public void testEmptyStatistics() {
    var stats = AuditTrail.inMemory().statistics();
    assertEquals(0, stats.totalEntries());
    assertTrue(stats.earliestTime().isEmpty());
    assertTrue(stats.latestTime().isEmpty());
    assertTrue(stats.topActions().isEmpty());
  }


  @Test
  public void testTopActionsCapped() {
    var trail = AuditTrail.inMemory();
    for (int index = 0; index < 15; ++index)
      trail.record("action_" + index, "u");
    trail.record("action_7", "u");
    var top = trail.statistics().topActions();
    assertEquals(TrailConstants.TOP_COUNT, top.size());
    assertEquals(new AuditStatistics.Count("action_7", 2), top.get(0));
    assertEquals("action_0", top.get(1).name());
  }


  @Test
  public void testPersistenceFailureIsNotFatal() {
    var sink = new FailingSink();
    var trail = new AuditTrail(
        new Ledger(TrailConstants.AUDIT_LEDGER, HashScheme.V1, List.of(), sink, Clock.systemUTC()));

    var result = trail.record("delete", "mallory");
    assertTrue(result.isDegraded());
    assertTrue(result.hasValue());
    assertEquals(ErrorKind.PERSISTENCE, result.error().get());
    assertEquals(1, trail.size());

    var stats = trail.statistics();
    assertEquals(1, stats.persistenceFailures());
    assertEquals(1, stats.pendingEntries());
    assertEquals("read-only file system", stats.lastPersistenceError());

    sink.fail = false;
    assertTrue(trail.flush().isOk());
    assertEquals(0, trail.statistics().pendingEntries());
    assertEquals(1, sink.written);
  }


  static class FailingSink implements LedgerSink {
    boolean fail = true;
    int written;

    @Override
    public int write(List<LedgerEntry> entries) throws java.io.IOException {
      if (fail)
        throw new java.io.IOException("read-only file system");
      written += entries.size();
      return 0;
    }

    @Override
    public void close() {  }
  }


  @Test
  public void testPersistentTrail(@TempDir File dir) {
    String firstId;
    try (var store = new LedgerStore(dir)) {
      var trail = AuditTrail.open(store);
      firstId = trail.record("upload", "alice", 3L, Map.of("size", 1024), null, null).get();
      trail.record("view", "bob");
    }
    assertTrue(new File(dir, TrailConstants.AUDIT_LEDGER + ".ledger").isFile());
    try (var store = new LedgerStore(dir)) {
      var trail = AuditTrail.open(store);
      assertEquals(2, trail.size());
      assertEquals(firstId, trail.entries().get(0).entryId());
      assertEquals(1024L, trail.entries().get(0).details().get("size"));
      assertTrue(trail.verify().valid());
    }
  }


  @Test
  public void testExportRoundTrip() {
    var trail = sample(new ManualClock(T0));
    byte[] json = trail.export(ExportFormat.JSON);
    var restored = LedgerExports.fromJson(json);
    assertEquals(trail.ledger().snapshot(), restored.snapshot());
    assertEquals(trail.verify(), restored.verify());

    String csv = new String(trail.export(ExportFormat.CSV), StandardCharsets.UTF_8);
    assertTrue(csv.startsWith("entry_id,timestamp,action,details,document_id,ip_address,user_agent,user_id,"));
    assertEquals(6, csv.split("\r\n").length);

    assertEquals(ErrorKind.UNSUPPORTED_FORMAT, trail.export("xml").error().get());
  }

}
