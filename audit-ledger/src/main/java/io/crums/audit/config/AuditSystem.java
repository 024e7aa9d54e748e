/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.config;


import java.lang.System.Logger.Level;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

import io.crums.audit.crypt.AesGcmCipher;
import io.crums.audit.crypt.StreamCipher;
import io.crums.audit.custody.CustodyRegistry;
import io.crums.audit.ledger.LedgerStore;
import io.crums.audit.session.SessionStore;
import io.crums.audit.session.SessionTracker;
import io.crums.audit.trail.AuditTrail;

/**
 * The wired-up audit subsystem: the audit trail, the custody registry and
 * the session tracker, sharing one clock and (optionally) one cipher. The
 * registry and tracker both forward to the trail.
 *
 * <p>
 * Components are opened in dependency order and {@linkplain #close() closed}
 * in reverse.
 * </p>
 */
public class AuditSystem implements AutoCloseable {

  /**
   * Opens the audit system described by the given configuration, using the
   * system UTC clock.
   */
  public static AuditSystem open(AuditConfig config) {
    return open(config, Clock.systemUTC());
  }


  /**
   * Opens the audit system described by the given configuration.
   *
   * @throws io.crums.audit.ledger.UnreadableLedgerException
   *         if the audit trail exists but cannot be read
   */
  public static AuditSystem open(AuditConfig config, Clock clock) {
    Objects.requireNonNull(config, "null config");
    Objects.requireNonNull(clock, "null clock");

    StreamCipher cipher = config.keyFile().map(AesGcmCipher::fromKeyFile).orElse(null);

    var trailStore = new LedgerStore(config.dir(), cipher, clock);
    AuditTrail trail = null;
    LedgerStore custodyStore = null;
    CustodyRegistry custody = null;
    try {
      trail = AuditTrail.open(trailStore);
      custodyStore = new LedgerStore(config.custodyDir(), cipher, clock);
      custody = new CustodyRegistry(custodyStore, trail);
      var sessions = new SessionTracker(
          new SessionStore(config.sessionsDir(), cipher), trail, config.sessionSettings(), clock);

      System.getLogger(LOG_NAME).log(
          Level.INFO,
          "audit system open: " + config.dir() + (cipher == null ? "" : " (encrypted)"));

      return new AuditSystem(config, cipher, trailStore, trail, custodyStore, custody, sessions);

    } catch (RuntimeException rx) {
      if (custody != null)
        custody.close();
      if (custodyStore != null)
        custodyStore.close();
      if (trail != null)
        trail.close();
      trailStore.close();
      throw rx;
    }
  }


  /** Logger name. */
  public final static String LOG_NAME = "audit.system";


  private final AuditConfig config;
  private final StreamCipher cipher;
  private final LedgerStore trailStore;
  private final AuditTrail trail;
  private final LedgerStore custodyStore;
  private final CustodyRegistry custody;
  private final SessionTracker sessions;

  private boolean closed;


  private AuditSystem(
      AuditConfig config, StreamCipher cipher,
      LedgerStore trailStore, AuditTrail trail,
      LedgerStore custodyStore, CustodyRegistry custody,
      SessionTracker sessions) {
    this.config = config;
    this.cipher = cipher;
    this.trailStore = trailStore;
    this.trail = trail;
    this.custodyStore = custodyStore;
    this.custody = custody;
    this.sessions = sessions;
  }


  public AuditConfig config() {
    return config;
  }

  public Optional<StreamCipher> cipher() {
    return Optional.ofNullable(cipher);
  }

  public AuditTrail auditTrail() {
    return trail;
  }

  public CustodyRegistry custody() {
    return custody;
  }

  public SessionTracker sessions() {
    return sessions;
  }


  /**
   * Closes the tracker, the custody registry and then the audit trail
   * (with their stores). Idempotent.
   */
  @Override
  public synchronized void close() {
    if (closed)
      return;
    closed = true;
    sessions.close();
    custody.close();
    custodyStore.close();
    trail.close();
    trailStore.close();
    System.getLogger(LOG_NAME).log(Level.INFO, "audit system closed: " + config.dir());
  }

}
