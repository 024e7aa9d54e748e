/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.session;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.audit.ManualClock;
import io.crums.audit.crypt.AesGcmCipher;
import io.crums.audit.ledger.ErrorKind;
import io.crums.audit.trail.AuditEntry;
import io.crums.audit.trail.AuditTrail;

/**
 *
 */
public class SessionTrackerTest {

  final static Instant T0 = Instant.parse("2026-06-15T08:00:00Z");


  private SessionTracker newTracker(ManualClock clock, AuditTrail trail) {
    return new SessionTracker(null, trail, SessionSettings.DEFAULT, clock);
  }


  @Test
  public void testLifecycle() {
    var clock = new ManualClock(T0);
    var trail = AuditTrail.inMemory(clock);
    var tracker = newTracker(clock, trail);

    String id = tracker.startSession("alice", "10.0.0.7", "firefox");
    clock.advance(Duration.ofMinutes(5));
    var activity = tracker.trackActivity(id, "view_document", 42L, Map.of("page", 3));
    assertTrue(activity.isOk());
    assertEquals(42L, activity.get().details().get("document_id"));
    assertEquals(3L, activity.get().details().get("page"));

    clock.advance(Duration.ofMinutes(5));
    var ended = tracker.endSession(id);
    assertTrue(ended.isOk());
    assertFalse(ended.get().active());
    assertEquals(T0.plusSeconds(600), ended.get().endTime());
    assertEquals(Duration.ofMinutes(10), ended.get().duration(clock.instant()));
    assertEquals(1, ended.get().activityCount());

    var notFound = tracker.trackActivity(id, "view_document", null, null);
    assertEquals(ErrorKind.SESSION_NOT_FOUND, notFound.error().get());
    assertEquals(ErrorKind.SESSION_NOT_FOUND, tracker.endSession(id).error().get());
    assertEquals(ErrorKind.SESSION_NOT_FOUND, tracker.trackActivity("nope", "x", null, null).error().get());

    List<String> actions = trail.entries().stream().map(AuditEntry::action).toList();
    assertEquals(List.of("session_start", "view_document", "session_end"), actions);

    var start = trail.entries().get(0);
    assertEquals("alice", start.userId().get());
    assertEquals("10.0.0.7", start.ipAddress().get());
    assertEquals(id, start.details().get("session_id"));

    var view = trail.entries().get(1);
    assertEquals(42L, view.documentId().get());
    assertEquals(id, view.details().get("session_id"));
    assertEquals("firefox", view.userAgent().get());

    var end = trail.entries().get(2);
    assertEquals(600.0, end.details().get("duration_seconds"));
    assertEquals(1L, end.details().get("activity_count"));
  }


  @Test
  public void testConcurrentSessionsAnomaly() {
    var tracker = new SessionTracker(null);
    for (int count = 0; count < 4; ++count)
      tracker.startSession("dave", null, null);
    tracker.startSession("erin", null, null);

    var findings = tracker.detectSuspiciousActivity(null);
    assertEquals(1, findings.size());
    var finding = findings.get(0);
    assertEquals(FindingType.MULTIPLE_CONCURRENT_SESSIONS, finding.type());
    assertEquals("multiple_concurrent_sessions", finding.type().code());
    assertEquals("dave", finding.userId());
    assertEquals(Severity.MEDIUM, finding.severity());
    assertEquals(4L, finding.get("session_count"));
    assertEquals(4L, finding.toMap().get("session_count"));
    assertEquals("medium", finding.toMap().get("severity"));

    assertTrue(tracker.detectSuspiciousActivity("erin").isEmpty());
  }


  @Test
  public void testThreeSessionsIsNotAnomalous() {
    var tracker = new SessionTracker(null);
    for (int count = 0; count < 3; ++count)
      tracker.startSession("dave", null, null);
    assertTrue(tracker.detectSuspiciousActivity("dave").isEmpty());
  }


  @Test
  public void testRapidActivityAnomaly() {
    var clock = new ManualClock(T0);
    var tracker = newTracker(clock, null);
    String id = tracker.startSession("frank", null, null);
    for (int count = 0; count < 120; ++count) {
      clock.advance(Duration.ofMillis(100));
      assertTrue(tracker.trackActivity(id, "download", (long) count, null).isOk());
    }
    var findings = tracker.detectSuspiciousActivity("frank");
    assertEquals(1, findings.size());
    var finding = findings.get(0);
    assertEquals(FindingType.RAPID_ACTIVITY_PATTERN, finding.type());
    assertEquals(Severity.HIGH, finding.severity());
    assertEquals(id, finding.get("session_id"));
    assertEquals(10.0, (Double) finding.get("activity_rate"), 1e-9);
  }


  @Test
  public void testSlowActivityIsNotRapid() {
    var clock = new ManualClock(T0);
    var tracker = newTracker(clock, null);
    String id = tracker.startSession("gina", null, null);
    for (int count = 0; count < 120; ++count) {
      clock.advance(Duration.ofSeconds(1));
      tracker.trackActivity(id, "view", null, null);
    }
    assertTrue(tracker.detectSuspiciousActivity("gina").isEmpty());
  }


  @Test
  public void testMultipleIpAnomaly() {
    var tracker = new SessionTracker(null);
    for (int index = 0; index < 6; ++index) {
      String id = tracker.startSession("hank", "192.168.1." + index, null);
      tracker.endSession(id);
    }
    var findings = tracker.detectSuspiciousActivity("hank");
    assertEquals(1, findings.size());
    var finding = findings.get(0);
    assertEquals(FindingType.MULTIPLE_IP_ADDRESSES, finding.type());
    assertEquals(6L, finding.get("ip_count"));
    assertEquals(6, ((List<?>) finding.get("ip_addresses")).size());
  }


  @Test
  public void testIpsCountedOverRecentSessionsOnly() {
    var tracker = new SessionTracker(null);
    for (int index = 0; index < 6; ++index)
      tracker.endSession(tracker.startSession("ivan", "10.1.1." + index, null));
    for (int index = 0; index < 10; ++index)
      tracker.endSession(tracker.startSession("ivan", "10.2.2.2", null));
    assertTrue(tracker.detectSuspiciousActivity("ivan").isEmpty());
  }


  @Test
  public void testLazyExpiry() {
    var clock = new ManualClock(T0);
    var trail = AuditTrail.inMemory(clock);
    var tracker = newTracker(clock, trail);
    String idle = tracker.startSession("judy", null, null);
    clock.advance(Duration.ofMinutes(31));

    String fresh = tracker.startSession("kim", null, null);
    var expired = tracker.session(idle).get();
    assertFalse(expired.active());
    assertEquals(T0.plus(Duration.ofMinutes(31)), expired.endTime());
    assertTrue(tracker.session(fresh).get().active());

    var end = trail.byActionType("session_end");
    assertEquals(1, end.size());
    assertEquals("timeout", end.get(0).details().get("reason"));
  }


  @Test
  public void testExpiryOnLookup() {
    var clock = new ManualClock(T0);
    var tracker = newTracker(clock, null);
    String id = tracker.startSession("lena", null, null);
    clock.advance(Duration.ofMinutes(30));
    assertTrue(tracker.trackActivity(id, "view", null, null).isOk());
    clock.advance(Duration.ofMinutes(31));
    assertEquals(ErrorKind.SESSION_NOT_FOUND, tracker.trackActivity(id, "view", null, null).error().get());
    assertFalse(tracker.session(id).get().active());
  }


  @Test
  public void testExpireIdleSessions() {
    var clock = new ManualClock(T0);
    var tracker = newTracker(clock, null);
    tracker.startSession("mo", null, null);
    clock.advance(Duration.ofMinutes(20));
    tracker.startSession("ned", null, null);
    clock.advance(Duration.ofMinutes(15));

    var expired = tracker.expireIdleSessions();
    assertEquals(1, expired.size());
    assertEquals("mo", expired.get(0).userId());
    assertEquals(1, tracker.activeUsers().size());
    assertEquals("ned", tracker.activeUsers().get(0).userId());
  }


  @Test
  public void testUserSessions() {
    var clock = new ManualClock(T0);
    var tracker = newTracker(clock, null);
    String first = tracker.startSession("olga", null, null);
    clock.advance(Duration.ofMinutes(1));
    String second = tracker.startSession("olga", null, null);
    clock.advance(Duration.ofMinutes(1));
    String third = tracker.startSession("olga", null, null);
    tracker.endSession(second);

    var all = tracker.userSessions("olga");
    assertEquals(
        List.of(third, second, first),
        all.stream().map(UserSession::sessionId).toList());
    assertEquals(
        List.of(third, first),
        tracker.userSessions("olga", true, false, 0).stream().map(UserSession::sessionId).toList());
    assertEquals(
        List.of(second),
        tracker.userSessions("olga", false, true, 0).stream().map(UserSession::sessionId).toList());
    assertEquals(1, tracker.userSessions("olga", true, true, 1).size());
    assertTrue(tracker.userSessions("nobody").isEmpty());
  }


  @Test
  public void testActiveUsers() {
    var clock = new ManualClock(T0);
    var tracker = newTracker(clock, null);
    String a = tracker.startSession("pat", "1.1.1.1", null);
    clock.advance(Duration.ofMinutes(1));
    tracker.startSession("pat", "2.2.2.2", null);
    clock.advance(Duration.ofMinutes(1));
    tracker.startSession("quinn", null, null);
    clock.advance(Duration.ofMinutes(1));
    tracker.trackActivity(a, "view", null, null);

    var users = tracker.activeUsers();
    assertEquals(2, users.size());
    var pat = users.get(0);
    assertEquals("pat", pat.userId());
    assertEquals(2, pat.sessionCount());
    assertEquals(1, pat.totalActivities());
    assertEquals(T0, pat.firstSessionStart());
    assertEquals(T0.plusSeconds(180), pat.lastActivity());
    assertEquals(List.of("1.1.1.1", "2.2.2.2"), pat.ipAddresses());
    assertEquals("quinn", users.get(1).userId());
  }


  @Test
  public void testActivitySummary() {
    var clock = new ManualClock(T0);
    var tracker = newTracker(clock, null);
    String id = tracker.startSession("rita", "3.3.3.3", "chrome");
    clock.advance(Duration.ofMinutes(1));
    tracker.trackActivity(id, "view", 5L, null);
    clock.advance(Duration.ofMinutes(1));
    tracker.trackActivity(id, "annotate", 5L, null);
    clock.advance(Duration.ofMinutes(1));
    tracker.trackActivity(id, "view", 6L, null);
    clock.advance(Duration.ofMinutes(1));
    tracker.endSession(id);

    var summary = tracker.activitySummary("rita", null, null);
    assertEquals(1, summary.totalSessions());
    assertEquals(0, summary.activeSessions());
    assertEquals(3, summary.totalActivities());
    assertEquals(List.of("annotate", "view"), summary.uniqueActions());
    assertEquals(List.of(5L, 6L), summary.documentsAccessed());
    assertEquals(List.of("3.3.3.3"), summary.ipAddresses());
    assertEquals(List.of("chrome"), summary.userAgents());
    assertEquals(T0.plusSeconds(60), summary.firstActivity());
    assertEquals(T0.plusSeconds(180), summary.lastActivity());
    assertEquals(Duration.ofMinutes(4), summary.totalTime());

    var window = tracker.activitySummary("rita", T0.plusSeconds(100), T0.plusSeconds(150));
    assertEquals(1, window.totalSessions());
    assertEquals(1, window.totalActivities());
    assertEquals(List.of("annotate"), window.uniqueActions());

    var after = tracker.activitySummary("rita", T0.plus(Duration.ofHours(1)), null);
    assertEquals(0, after.totalSessions());
    assertTrue(after.first().isEmpty());
  }


  @Test
  public void testSystemStats() {
    var clock = new ManualClock(T0);
    var tracker = new SessionTracker(
        null, null, SessionSettings.DEFAULT.withTimeout(Duration.ofHours(2)), clock);
    String a = tracker.startSession("sam", null, null);
    tracker.trackActivity(a, "view", null, null);
    tracker.trackActivity(a, "view", null, null);
    clock.advance(Duration.ofMinutes(2));
    String b = tracker.startSession("tess", null, null);
    tracker.trackActivity(b, "view", null, null);
    clock.advance(Duration.ofMinutes(61));
    tracker.trackActivity(b, "view", null, null);
    tracker.trackActivity(b, "view", null, null);

    var stats = tracker.systemStats();
    assertEquals(2, stats.totalUsers());
    assertEquals(2, stats.totalSessions());
    assertEquals(5, stats.activityLastDay());
    assertEquals(2, stats.activityLastHour());
    assertEquals(
        List.of(new SystemActivity.UserCount("tess", 3), new SystemActivity.UserCount("sam", 2)),
        stats.topActiveUsers());
  }


  @Test
  public void testExportUserActivity() {
    var clock = new ManualClock(T0);
    var tracker = newTracker(clock, null);
    String id = tracker.startSession("uma", "4.4.4.4", "agent, v2");
    tracker.trackActivity(id, "view", 1L, null);
    clock.advance(Duration.ofSeconds(90));
    tracker.endSession(id);

    String csv = new String(tracker.exportUserActivity("uma", "csv", true).get(), StandardCharsets.UTF_8);
    var rows = csv.split("\r\n");
    assertEquals(2, rows.length);
    assertEquals(
        "session_id,start_time,end_time,duration_seconds,activity_count,ip_address,user_agent",
        rows[0]);
    assertEquals(
        id + "," + T0 + "," + T0.plusSeconds(90) + ",90.0,1,4.4.4.4,\"agent, v2\"",
        rows[1]);

    String json = new String(tracker.exportUserActivity("uma", "json", false).get(), StandardCharsets.UTF_8);
    assertTrue(json.contains("\"user_id\": \"uma\""));
    assertTrue(json.contains("\"duration_seconds\": 90.0"));
    assertFalse(json.contains("\"activities\""));
    String full = new String(tracker.exportUserActivity("uma", "json", true).get(), StandardCharsets.UTF_8);
    assertTrue(full.contains("\"activities\""));

    assertEquals(ErrorKind.UNSUPPORTED_FORMAT, tracker.exportUserActivity("uma", "xlsx", true).error().get());
  }


  @Test
  public void testPersistence(@TempDir File dir) {
    var clock = new ManualClock(T0);
    String active;
    String ended;
    try (var tracker = new SessionTracker(
        new SessionStore(dir, null), null, SessionSettings.DEFAULT, clock)) {
      active = tracker.startSession("vic", "5.5.5.5", null);
      tracker.trackActivity(active, "view", 9L, Map.of("note", "first"));
      ended = tracker.startSession("vic", null, null);
      clock.advance(Duration.ofMinutes(1));
      tracker.endSession(ended);
    }
    assertTrue(new File(dir, SessionConstants.SESSIONS_FILE).isFile());

    try (var tracker = new SessionTracker(
        new SessionStore(dir, null), null, SessionSettings.DEFAULT, clock)) {
      var restored = tracker.session(active).get();
      assertTrue(restored.active());
      assertEquals("5.5.5.5", restored.ipAddress());
      assertEquals(1, restored.activityCount());
      assertEquals(9L, restored.activities().get(0).details().get("document_id"));
      assertEquals("first", restored.activities().get(0).details().get("note"));
      assertFalse(tracker.session(ended).get().active());

      assertTrue(tracker.trackActivity(active, "view", null, null).isOk());
      assertEquals(2, tracker.session(active).get().activityCount());
    }
  }


  @Test
  public void testEncryptedPersistence(@TempDir File dir) throws IOException {
    var cipher = new AesGcmCipher(AesGcmCipher.generateKey());
    var clock = new ManualClock(T0);
    String id;
    try (var tracker = new SessionTracker(
        new SessionStore(dir, cipher), null, SessionSettings.DEFAULT, clock)) {
      id = tracker.startSession("wes", "6.6.6.6", null);
    }
    String onDisk = Files.readString(new File(dir, SessionConstants.SESSIONS_FILE).toPath());
    assertFalse(onDisk.startsWith("["));
    assertFalse(onDisk.contains("6.6.6.6"));

    try (var tracker = new SessionTracker(
        new SessionStore(dir, cipher), null, SessionSettings.DEFAULT, clock)) {
      assertEquals("wes", tracker.session(id).get().userId());
    }
  }


  @Test
  public void testUnreadableSessionsFileIsSetAside(@TempDir File dir) throws IOException {
    var file = new File(dir, SessionConstants.SESSIONS_FILE);
    Files.writeString(file.toPath(), "[{\"session_id\": ");
    var clock = new ManualClock(T0);

    try (var tracker = new SessionTracker(
        new SessionStore(dir, null), null, SessionSettings.DEFAULT, clock)) {
      assertTrue(tracker.userSessions("anyone").isEmpty());
      tracker.startSession("xena", null, null);
    }
    var aside = new File(dir, SessionConstants.SESSIONS_FILE + ".unreadable-" + T0.toEpochMilli());
    assertTrue(aside.isFile());
    assertEquals("[{\"session_id\": ", Files.readString(aside.toPath()));
    assertTrue(Files.readString(file.toPath()).contains("xena"));
  }


  @Test
  public void testOutOfRangeNumberSetAside(@TempDir File dir) throws IOException {
    var file = new File(dir, SessionConstants.SESSIONS_FILE);
    String text = "[{\"session_id\":99999999999999999999}]";
    Files.writeString(file.toPath(), text);
    var clock = new ManualClock(T0);

    try (var tracker = new SessionTracker(
        new SessionStore(dir, null), null, SessionSettings.DEFAULT, clock)) {
      assertTrue(tracker.userSessions("anyone").isEmpty());
    }
    var aside = new File(dir, SessionConstants.SESSIONS_FILE + ".unreadable-" + T0.toEpochMilli());
    assertTrue(aside.isFile());
    assertEquals(text, Files.readString(aside.toPath()));
  }


  @Test
  public void testBackgroundSweep() throws InterruptedException {
    var clock = new ManualClock(T0);
    var settings = SessionSettings.DEFAULT.withSweepInterval(Duration.ofMillis(20));
    try (var tracker = new SessionTracker(null, null, settings, clock)) {
      String id = tracker.startSession("yuri", null, null);
      clock.advance(Duration.ofMinutes(45));
      for (int tries = 0; tries < 250 && tracker.session(id).get().active(); ++tries)
        Thread.sleep(20);
      assertFalse(tracker.session(id).get().active());
    }
  }


  @Test
  public void testClosed() {
    var tracker = new SessionTracker(null);
    String id = tracker.startSession("zoe", null, null);
    tracker.close();
    tracker.close();
    assertThrows(IllegalStateException.class, () -> tracker.startSession("zoe", null, null));
    assertTrue(tracker.session(id).isPresent());
  }

}
