/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.cli.audl;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.audit.config.AuditConfig;
import io.crums.audit.config.AuditSystem;
import io.crums.audit.ledger.LedgerExports;

/**
 *
 */
public class AudlTest {

  @TempDir
  File dir;

  private File config;

  private StringWriter out;
  private StringWriter err;


  @BeforeEach
  public void setUp() throws IOException {
    config = new File(dir, "audit.properties");
    Files.writeString(config.toPath(), "audit.dir=data\n");
    try (var system = AuditSystem.open(new AuditConfig(config))) {
      var trail = system.auditTrail();
      trail.record("login", "alice");
      trail.record("upload", "alice", 7L, Map.of("file", "scan.pdf"), null, null);
      trail.record("view", "bob", 7L, null, null, null);
      var custody = system.custody();
      custody.addEntry(7, "upload", "alice", null, "intake", null, "h0");
      custody.addEntry(7, "analyze", "bob", null, "lab", "h0", "h1");
    }
    out = new StringWriter();
    err = new StringWriter();
  }


  private int run(String... args) {
    var cl = Audl.newCommandLine();
    cl.setOut(new PrintWriter(out, true));
    cl.setErr(new PrintWriter(err, true));
    String[] full = new String[args.length + 1];
    full[0] = config.getPath();
    System.arraycopy(args, 0, full, 1, args.length);
    return cl.execute(full);
  }


  @Test
  public void testVerify() {
    assertEquals(0, run("verify"));
    var text = out.toString();
    assertTrue(text.contains("audit trail (5 entries)"));
    assertTrue(text.contains("custody 7 (2 entries)"));
    assertFalse(text.contains("TAMPERED"));
  }


  @Test
  public void testVerifyTampered() throws IOException {
    var ledgerFile = new File(dir, "data/audit_chain.ledger").toPath();
    String contents = Files.readString(ledgerFile);
    assertTrue(contents.contains("\"bob\""));
    Files.writeString(ledgerFile, contents.replace("\"bob\"", "\"eve\""));

    assertEquals(Audl.FAIL, run("verify"));
    var text = out.toString();
    assertTrue(text.contains("TAMPERED"));
    assertTrue(text.contains("Content hash mismatch"), text);
  }


  @Test
  public void testVerifyCustodyIssue() {
    try (var system = AuditSystem.open(new AuditConfig(config))) {
      system.custody().addEntry(7, "transfer", "carol", null, null, "not-h1", null);
    }
    assertEquals(Audl.FAIL, run("verify", "--doc", "7"));
    assertTrue(out.toString().contains("ISSUE"));
  }


  @Test
  public void testExport() throws IOException {
    var exportFile = new File(dir, "trail.json");
    assertEquals(0, run("export", "-o", exportFile.getPath()));
    var restored = LedgerExports.fromJson(Files.readAllBytes(exportFile.toPath()));
    assertEquals(5, restored.size());
    assertTrue(restored.verify().valid());

    assertEquals(0, run("export", "-f", "text", "-d", "7"));
    assertTrue(out.toString().startsWith("Chain of Custody Report\n"));
  }


  @Test
  public void testExportBadFormat() {
    assertNotEquals(0, run("export", "-f", "xml"));
    assertTrue(err.toString().contains("unsupported format: xml"));
  }


  @Test
  public void testStats() {
    assertEquals(0, run("stats"));
    var text = out.toString();
    assertTrue(text.contains("entries:   5"));
    assertTrue(text.contains("alice: 3"));
  }


  @Test
  public void testCustody() {
    assertEquals(0, run("custody", "7"));
    var text = out.toString();
    assertTrue(text.contains("custodians: alice, bob"));
    assertTrue(text.contains("locations:  intake, lab"));
    assertNotEquals(0, run("custody", "8"));
  }


  @Test
  public void testSuspicious() {
    assertEquals(0, run("suspicious"));
    assertTrue(out.toString().contains("nothing suspicious"));
  }


  @Test
  public void testMissingConfig() {
    var cl = Audl.newCommandLine();
    cl.setErr(new PrintWriter(err, true));
    assertNotEquals(0, cl.execute(new File(dir, "nope.properties").getPath(), "stats"));
  }

}
