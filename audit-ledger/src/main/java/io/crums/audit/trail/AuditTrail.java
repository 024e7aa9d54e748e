/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.trail;


import static io.crums.audit.trail.TrailConstants.*;

import java.lang.System.Logger.Level;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.crums.audit.json.JsonWriter;
import io.crums.audit.ledger.ExportFormat;
import io.crums.audit.ledger.Ledger;
import io.crums.audit.ledger.LedgerEntry;
import io.crums.audit.ledger.LedgerStore;
import io.crums.audit.ledger.Result;
import io.crums.audit.ledger.VerificationReport;

/**
 * The process-wide audit trail: every user and system action, on one
 * {@linkplain Ledger ledger} named {@value TrailConstants#AUDIT_LEDGER}.
 *
 * <p>
 * Recording is best-effort from the caller's perspective: a failure to
 * persist never fails the caller's operation. Such failures show up in the
 * returned (degraded) result and in {@linkplain #statistics() statistics}.
 * </p>
 * <p>
 * Instances are thread-safe.
 * </p>
 */
public class AuditTrail implements AutoCloseable {


  /**
   * Opens (or creates) the audit trail in the given store.
   *
   * @throws io.crums.audit.ledger.UnreadableLedgerException
   *         if the trail exists but cannot be read
   */
  public static AuditTrail open(LedgerStore store) {
    return new AuditTrail(store.open(AUDIT_LEDGER));
  }


  /** Returns a new, empty in-memory audit trail. */
  public static AuditTrail inMemory() {
    return inMemory(Clock.systemUTC());
  }


  /** Returns a new, empty in-memory audit trail timestamped by the given clock. */
  public static AuditTrail inMemory(Clock clock) {
    return new AuditTrail(Ledger.newVolatile(AUDIT_LEDGER, clock));
  }



  private final Ledger ledger;


  /**
   * Creates an instance on the given ledger. The ledger is owned by this
   * instance thereafter.
   */
  public AuditTrail(Ledger ledger) {
    this.ledger = Objects.requireNonNull(ledger, "null ledger");
  }


  /** Returns the underlying ledger. */
  public Ledger ledger() {
    return ledger;
  }


  /**
   * Records the given action.
   *
   * @param action      required
   * @param userId      optional
   * @param documentId  optional
   * @param details     optional
   * @param ipAddress   optional
   * @param userAgent   optional
   *
   * @return the entry id (degraded, if not persisted)
   */
  public Result<String> record(
      String action, String userId, Long documentId, Map<String, ?> details,
      String ipAddress, String userAgent) {
    return record(new AuditAction(action, userId, documentId, details, ipAddress, userAgent));
  }


  /** Records the given action by the given user. */
  public Result<String> record(String action, String userId) {
    return record(AuditAction.of(action).byUser(userId));
  }


  /**
   * Records the given action.
   *
   * @return the entry id (degraded, if not persisted)
   */
  public Result<String> record(AuditAction action) {
    var result = ledger.append(action.toPayload());

    var log = getLogger();
    if (log.isLoggable(Level.INFO)) {
      var msg = new StringBuilder("Action: ").append(action.action())
          .append(" | User: ").append(action.userId() == null ? "unknown" : action.userId())
          .append(" | Document: ").append(action.documentId());
      if (!action.details().isEmpty())
        JsonWriter.CANONICAL.append(action.details(), msg.append(" | Details: "));
      log.log(Level.INFO, msg.toString());
    }
    if (result.isDegraded())
      log.log(
          Level.WARNING,
          "audit entry " + result.get().entryId() + " degraded (" +
          result.error().get().code() + "): " + result.message());

    return result.map(LedgerEntry::entryId);
  }


  /** Returns every entry, in order. */
  public List<AuditEntry> entries() {
    return wrap(ledger.snapshot());
  }


  /** Returns the number of entries. */
  public int size() {
    return ledger.size();
  }


  /**
   * Returns the entries matching the given filter, in order.
   */
  public List<AuditEntry> trail(AuditFilter filter) {
    return wrap(ledger.query(filter.toQuery()));
  }


  public List<AuditEntry> byUser(String userId) {
    return trail(AuditFilter.ALL.withUser(Objects.requireNonNull(userId, "null userId")));
  }


  public List<AuditEntry> byDocument(long documentId) {
    return trail(AuditFilter.ALL.withDocument(documentId));
  }


  public List<AuditEntry> byActionType(String action) {
    return trail(AuditFilter.ALL.withAction(Objects.requireNonNull(action, "null action")));
  }


  /**
   * Returns the entries in the given inclusive time range.
   *
   * @param from  {@code null} for no lower bound
   * @param to    {@code null} for no upper bound
   */
  public List<AuditEntry> byTimeRange(Instant from, Instant to) {
    return trail(AuditFilter.ALL.between(from, to));
  }


  private static List<AuditEntry> wrap(List<LedgerEntry> entries) {
    List<AuditEntry> out = new ArrayList<>(entries.size());
    entries.forEach(e -> out.add(new AuditEntry(e)));
    return out;
  }


  /**
   * Returns aggregate statistics over the trail.
   */
  public AuditStatistics statistics() {
    var entries = ledger.snapshot();
    Map<String, Integer> actions = new HashMap<>();
    Map<String, Integer> users = new HashMap<>();
    var documents = new HashSet<Object>();
    Instant earliest = null;
    Instant latest = null;

    for (var e : entries) {
      var entry = new AuditEntry(e);
      actions.merge(entry.action(), 1, Integer::sum);
      entry.userId().ifPresent(u -> users.merge(u, 1, Integer::sum));
      e.get(DOCUMENT_ID).ifPresent(documents::add);
      Instant time = e.timestamp();
      if (earliest == null || time.isBefore(earliest))
        earliest = time;
      if (latest == null || time.isAfter(latest))
        latest = time;
    }
    var health = ledger.health();
    return new AuditStatistics(
        entries.size(),
        earliest,
        latest,
        AuditStatistics.top(actions, TOP_COUNT),
        AuditStatistics.top(users, TOP_COUNT),
        documents.size(),
        users.size(),
        health.failures(),
        health.pendingEntries(),
        health.lastError());
  }


  /** Verifies the trail's ledger. */
  public VerificationReport verify() {
    return ledger.verify();
  }


  /** Exports the trail. */
  public byte[] export(ExportFormat format) {
    return ledger.export(format);
  }


  /** Exports the trail in the named format. */
  public Result<byte[]> export(String format) {
    return ledger.export(format);
  }


  /** Retries writing any entries that failed to persist. */
  public Result<Integer> flush() {
    return ledger.flush();
  }


  @Override
  public void close() {
    ledger.close();
  }

}
