/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.config;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.audit.ManualClock;
import io.crums.audit.trail.AuditEntry;

/**
 *
 */
public class AuditSystemTest {

  final static Instant T0 = Instant.parse("2026-07-01T10:00:00Z");


  private AuditConfig config(File dir, boolean encrypt) {
    var props = new Properties();
    props.setProperty(AuditConfig.BASE_DIR, dir.getPath());
    props.setProperty(AuditConfig.DIR, "audit");
    if (encrypt)
      props.setProperty(AuditConfig.KEY_FILE, "audit.key");
    return new AuditConfig(props);
  }


  @Test
  public void testWiring(@TempDir File dir) {
    var clock = new ManualClock(T0);
    String sessionId;
    try (var system = AuditSystem.open(config(dir, false), clock)) {
      sessionId = system.sessions().startSession("alice", "10.0.0.1", null);
      system.sessions().trackActivity(sessionId, "upload", 77L, null);
      system.custody().addEntry(77, "upload", "alice", null, "intake", null, "h0");
      system.auditTrail().record("system_check", null);
    }
    assertTrue(new File(dir, "audit/audit_chain.ledger").isFile());
    assertTrue(new File(dir, "audit/custody/custody_77.ledger").isFile());
    assertTrue(new File(dir, "audit/sessions/sessions.json").isFile());

    try (var system = AuditSystem.open(config(dir, false), clock)) {
      var actions = system.auditTrail().entries().stream().map(AuditEntry::action).toList();
      assertEquals(
          java.util.List.of("session_start", "upload", "custody_upload", "system_check"),
          actions);
      assertTrue(system.auditTrail().verify().valid());
      assertTrue(system.custody().verify(77).get().valid());
      assertTrue(system.sessions().session(sessionId).get().active());
    }
  }


  @Test
  public void testEncrypted(@TempDir File dir) throws IOException {
    var clock = new ManualClock(T0);
    try (var system = AuditSystem.open(config(dir, true), clock)) {
      assertTrue(system.cipher().isPresent());
      system.auditTrail().record("login", "bob", null, null, "192.168.7.7", null);
    }
    assertTrue(new File(dir, "audit.key").isFile());
    var ledgerText = Files.readString(new File(dir, "audit/audit_chain.ledger").toPath());
    assertFalse(ledgerText.contains("192.168.7.7"));

    try (var system = AuditSystem.open(config(dir, true), clock)) {
      var entry = system.auditTrail().entries().get(0);
      assertEquals("192.168.7.7", entry.ipAddress().get());
    }
  }


  @Test
  public void testCloseIsIdempotent(@TempDir File dir) {
    var system = AuditSystem.open(config(dir, false), new ManualClock(T0));
    system.close();
    system.close();
    assertTrue(system.auditTrail().ledger().isClosed());
  }

}
