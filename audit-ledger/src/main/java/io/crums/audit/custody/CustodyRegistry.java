/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.custody;


import static io.crums.audit.custody.CustodyConstants.*;

import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import io.crums.audit.ledger.ErrorKind;
import io.crums.audit.ledger.ExportFormat;
import io.crums.audit.ledger.Ledger;
import io.crums.audit.ledger.LedgerEntry;
import io.crums.audit.ledger.LedgerExports;
import io.crums.audit.ledger.LedgerStore;
import io.crums.audit.ledger.Payloads;
import io.crums.audit.ledger.PersistenceException;
import io.crums.audit.ledger.Result;
import io.crums.audit.ledger.UnreadableLedgerException;
import io.crums.audit.trail.AuditAction;
import io.crums.audit.trail.AuditTrail;

/**
 * Per-document chains of custody. Each document has its own {@linkplain Ledger
 * ledger} (named {@code custody_<document-id>}), created on its first entry.
 * Documents are independent lock domains: appends to one document's chain
 * never contend with another's.
 *
 * <h2>Unreadable Chains</h2>
 * <p>
 * Persisted chains are loaded on construction. A chain that cannot be read in
 * full is reported via {@linkplain #unreadableDocuments()}; it's left as is on
 * disk, and adding to it fails with {@linkplain ErrorKind#UNREADABLE_LEDGER}.
 * </p>
 */
public class CustodyRegistry implements AutoCloseable {


  /**
   * Returns a registry whose chains live in memory only.
   *
   * @param trail optional audit trail custody entries are mirrored to
   */
  public static CustodyRegistry inMemory(AuditTrail trail) {
    return inMemory(trail, Clock.systemUTC());
  }


  /**
   * Returns a registry whose chains live in memory only, timestamped by the
   * given clock.
   */
  public static CustodyRegistry inMemory(AuditTrail trail, Clock clock) {
    return new CustodyRegistry(null, trail, clock);
  }



  private final LedgerStore store;
  private final AuditTrail trail;
  private final Clock clock;

  private final ConcurrentHashMap<Long, Ledger> chains = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<Long, String> unreadable = new ConcurrentHashMap<>();


  /**
   * Creates a registry on the given store, loading its existing custody chains.
   *
   * @param store the custody ledgers' store
   * @param trail optional audit trail custody entries are mirrored to
   */
  public CustodyRegistry(LedgerStore store, AuditTrail trail) {
    this(Objects.requireNonNull(store, "null store"), trail, store.clock());
  }


  private CustodyRegistry(LedgerStore store, AuditTrail trail, Clock clock) {
    this.store = store;
    this.trail = trail;
    this.clock = clock;
    if (store != null)
      loadAll();
  }


  private void loadAll() {
    for (var name : store.names(LEDGER_PREFIX)) {
      Long documentId = documentId(name);
      if (documentId == null)
        continue;
      try {
        chains.put(documentId, store.open(name));
      } catch (UnreadableLedgerException | PersistenceException x) {
        unreadable.put(documentId, x.getMessage());
      }
    }
    if (!unreadable.isEmpty())
      System.getLogger(LOG_NAME).log(
          Level.WARNING,
          unreadable.size() + " unreadable custody chain(s): " + new TreeMap<>(unreadable).keySet());
  }


  /**
   * Returns the audit trail custody entries are mirrored to, if any.
   */
  public Optional<AuditTrail> auditTrail() {
    return Optional.ofNullable(trail);
  }


  /**
   * Adds an entry to the given document's chain of custody, creating the
   * chain if need be. If an audit trail is attached, a summary entry with
   * action {@code custody_<action>} is also recorded there.
   *
   * @param documentId  the document
   * @param action      the custody action (e.g. {@code "upload"}, {@code "transfer"})
   * @param userId      the custodian
   * @param details     optional
   * @param location    optional
   * @param hashBefore  optional document hash before the action
   * @param hashAfter   optional document hash after the action
   *
   * @return the new entry's id; degraded if it was not persisted; or an
   *         {@linkplain ErrorKind#UNREADABLE_LEDGER} or {@linkplain ErrorKind#PERSISTENCE}
   *         failure if the chain could not be opened
   */
  public Result<String> addEntry(
      long documentId, String action, String userId, Map<String, ?> details,
      String location, String hashBefore, String hashAfter) {

    Objects.requireNonNull(action, "null action");
    Objects.requireNonNull(userId, "null userId");

    var ledgerResult = ledgerFor(documentId);
    if (!ledgerResult.hasValue())
      return Result.failure(ledgerResult.error().get(), ledgerResult.message());

    var payload = new LinkedHashMap<String, Object>();
    payload.put(ACTION, action);
    payload.put(USER_ID, userId);
    payload.put(DOCUMENT_ID, documentId);
    payload.put(DETAILS, Payloads.freeze(details));
    payload.put(LOCATION, location);
    payload.put(HASH_BEFORE, hashBefore);
    payload.put(HASH_AFTER, hashAfter);

    var result = ledgerResult.get().append(Payloads.withoutNulls(payload));
    String entryId = result.get().entryId();

    if (trail != null) {
      var auditDetails = new LinkedHashMap<String, Object>();
      auditDetails.put(CUSTODY_ENTRY_ID, entryId);
      auditDetails.put(LOCATION, location);
      auditDetails.put(HASH_BEFORE, hashBefore);
      auditDetails.put(HASH_AFTER, hashAfter);
      if (details != null)
        auditDetails.putAll(details);
      try {
        trail.record(
            AuditAction.of(AUDIT_ACTION_PREFIX + action)
            .byUser(userId)
            .onDocument(documentId)
            .withDetails(auditDetails));
      } catch (IllegalStateException isx) {
        // the custody entry is already committed
        System.getLogger(LOG_NAME).log(
            Level.WARNING,
            "audit trail closed; custody entry " + entryId + " not mirrored");
      }
    }
    return result.map(LedgerEntry::entryId);
  }


  /** Adds an entry with no optional fields. */
  public Result<String> addEntry(long documentId, String action, String userId) {
    return addEntry(documentId, action, userId, null, null, null, null);
  }


  private Result<Ledger> ledgerFor(long documentId) {
    String error = unreadable.get(documentId);
    if (error != null)
      return Result.failure(ErrorKind.UNREADABLE_LEDGER, error);
    try {
      return Result.ok(chains.computeIfAbsent(documentId, this::newChain));
    } catch (UnreadableLedgerException ulx) {
      unreadable.put(documentId, ulx.getMessage());
      return Result.failure(ErrorKind.UNREADABLE_LEDGER, ulx.getMessage());
    } catch (PersistenceException px) {
      System.getLogger(LOG_NAME).log(Level.WARNING, px.getMessage());
      return Result.failure(ErrorKind.PERSISTENCE, px.getMessage());
    }
  }


  private Ledger newChain(long documentId) {
    String name = ledgerName(documentId);
    return store == null ? Ledger.newVolatile(name, clock) : store.open(name);
  }


  /**
   * Returns the given document's chain of custody, in order. Empty if there
   * is none.
   */
  public List<CustodyEntry> chain(long documentId) {
    Ledger ledger = chains.get(documentId);
    return ledger == null ? List.of() : wrap(documentId, ledger.snapshot());
  }


  private static List<CustodyEntry> wrap(long documentId, List<LedgerEntry> entries) {
    List<CustodyEntry> out = new ArrayList<>(entries.size());
    entries.forEach(e -> out.add(new CustodyEntry(documentId, e)));
    return out;
  }


  /** Tests whether the given document has a (readable) chain. */
  public boolean hasChain(long documentId) {
    return chains.containsKey(documentId);
  }


  /** Returns the ids of the documents with readable chains, sorted. */
  public List<Long> documentIds() {
    List<Long> ids = new ArrayList<>(chains.keySet());
    ids.sort(null);
    return ids;
  }


  /**
   * Returns the ids of the documents whose persisted chains could not be read,
   * with the reason. Sorted by id.
   */
  public Map<Long, String> unreadableDocuments() {
    return new TreeMap<>(unreadable);
  }


  /**
   * Verifies the given document's chain of custody. Besides the ledger's own
   * (cryptographic) verification, each entry is checked in turn for the first
   * of these anomalies, if any:
   * <ol>
   * <li>{@linkplain IssueType#TIMESTAMP_OUT_OF_ORDER}</li>
   * <li>{@linkplain IssueType#HASH_CHAIN_BROKEN}: both its {@code hash_before} and its
   *     predecessor's {@code hash_after} are present and differ</li>
   * <li>{@linkplain IssueType#MISSING_USER}</li>
   * <li>{@linkplain IssueType#MISSING_ACTION}</li>
   * </ol>
   *
   * @return {@linkplain ErrorKind#DOCUMENT_NOT_FOUND} failure if there's no chain;
   *         {@linkplain ErrorKind#UNREADABLE_LEDGER}, if it can't be read
   */
  public Result<CustodyVerification> verify(long documentId) {
    var chain = readableChain(documentId);
    if (!chain.hasValue())
      return Result.failure(chain.error().get(), chain.message());

    Ledger ledger = chain.get();
    var entries = ledger.snapshot();
    var report = ledger.verify();
    var failed = new HashSet<Integer>(report.failedIndices());

    List<CustodyIssue> issues = new ArrayList<>();
    CustodyEntry prev = null;
    for (int index = 0; index < entries.size(); ++index) {
      var entry = new CustodyEntry(documentId, entries.get(index));
      var issue = check(index, entry, prev);
      if (issue != null) {
        issues.add(issue);
        failed.add(index);
      }
      prev = entry;
    }
    return Result.ok(new CustodyVerification(
        documentId, report, issues, entries.size() - failed.size()));
  }


  private static CustodyIssue check(int index, CustodyEntry entry, CustodyEntry prev) {
    if (prev != null) {
      if (entry.timestamp().isBefore(prev.timestamp()))
        return new CustodyIssue(
            index, entry.entryId(), IssueType.TIMESTAMP_OUT_OF_ORDER,
            prev.timestamp().toString(), entry.timestamp().toString());

      var before = entry.hashBefore();
      var prevAfter = prev.hashAfter();
      if (before.isPresent() && prevAfter.isPresent() && !before.get().equals(prevAfter.get()))
        return new CustodyIssue(
            index, entry.entryId(), IssueType.HASH_CHAIN_BROKEN, prevAfter.get(), before.get());
    }
    if (entry.userId().isBlank())
      return new CustodyIssue(index, entry.entryId(), IssueType.MISSING_USER, null, null);
    if (entry.action().isBlank())
      return new CustodyIssue(index, entry.entryId(), IssueType.MISSING_ACTION, null, null);
    return null;
  }


  /** Looks up the chain once; it may be removed concurrently. */
  private Result<Ledger> readableChain(long documentId) {
    String error = unreadable.get(documentId);
    if (error != null)
      return Result.failure(ErrorKind.UNREADABLE_LEDGER, error);
    Ledger ledger = chains.get(documentId);
    if (ledger == null)
      return Result.failure(
          ErrorKind.DOCUMENT_NOT_FOUND, "no custody chain for document " + documentId);
    return Result.ok(ledger);
  }


  /**
   * Summarizes the given document's chain of custody.
   *
   * @return {@linkplain ErrorKind#DOCUMENT_NOT_FOUND} failure if there's no chain
   */
  public Result<CustodySummary> summary(long documentId) {
    var chain = readableChain(documentId);
    if (!chain.hasValue())
      return Result.failure(chain.error().get(), chain.message());
    var entries = wrap(documentId, chain.get().snapshot());
    if (entries.isEmpty())
      return Result.failure(
          ErrorKind.DOCUMENT_NOT_FOUND, "empty custody chain for document " + documentId);

    Set<String> custodians = new LinkedHashSet<>();
    Set<String> locations = new LinkedHashSet<>();
    Set<String> actions = new LinkedHashSet<>();
    for (var entry : entries) {
      custodians.add(entry.userId());
      entry.location().ifPresent(locations::add);
      actions.add(entry.action());
    }
    return Result.ok(new CustodySummary(
        documentId,
        entries.size(),
        entries.get(0),
        entries.get(entries.size() - 1),
        new ArrayList<>(custodians),
        new ArrayList<>(locations),
        new ArrayList<>(actions)));
  }


  /**
   * Searches every document's chain. Results are ordered by timestamp (ties
   * by document id, then chain order).
   */
  public List<CustodyEntry> search(CustodySearch search) {
    List<CustodyEntry> hits = new ArrayList<>();
    for (Long documentId : documentIds()) {
      Ledger ledger = chains.get(documentId);
      if (ledger == null)
        continue;
      for (var entry : wrap(documentId, ledger.snapshot()))
        if (search.matches(entry))
          hits.add(entry);
    }
    hits.sort(Comparator.comparing(CustodyEntry::timestamp));
    return hits;
  }


  /**
   * Exports the given document's chain of custody.
   *
   * @return {@linkplain ErrorKind#DOCUMENT_NOT_FOUND} failure if there's no chain
   */
  public Result<byte[]> export(long documentId, CustodyExportFormat format) {
    var chain = readableChain(documentId);
    if (!chain.hasValue())
      return Result.failure(chain.error().get(), chain.message());

    Ledger ledger = chain.get();
    String text;
    switch (format) {
    case JSON:
      return Result.ok(ledger.export(ExportFormat.JSON));
    case CSV:
      text = toCsv(wrap(documentId, ledger.snapshot()));
      break;
    case TEXT:
      text = toText(documentId, wrap(documentId, ledger.snapshot()));
      break;
    default:
      throw new RuntimeException("unaccounted format " + format);
    }
    return Result.ok(text.getBytes(StandardCharsets.UTF_8));
  }


  /**
   * Exports the given document's chain of custody in the named format.
   *
   * @return {@linkplain ErrorKind#UNSUPPORTED_FORMAT} failure if the format is unknown
   */
  public Result<byte[]> export(long documentId, String format) {
    var fmt = CustodyExportFormat.forName(format);
    if (fmt.isEmpty())
      return Result.failure(ErrorKind.UNSUPPORTED_FORMAT, "unsupported format: " + format);
    return export(documentId, fmt.get());
  }


  private final static String[] CSV_COLUMNS = {
      "entry_id", DOCUMENT_ID, ACTION, USER_ID, "timestamp",
      LOCATION, HASH_BEFORE, HASH_AFTER, "chain_hash" };


  static String toCsv(List<CustodyEntry> entries) {
    var csv = new StringBuilder(128 + entries.size() * 256);
    csv.append(String.join(",", CSV_COLUMNS)).append("\r\n");
    for (var entry : entries) {
      String[] row = {
          entry.entryId(),
          Long.toString(entry.documentId()),
          entry.action(),
          entry.userId(),
          entry.timestamp().toString(),
          entry.location().orElse(""),
          entry.hashBefore().orElse(""),
          entry.hashAfter().orElse(""),
          entry.ledgerEntry().chainHash(),
      };
      for (int index = 0; index < row.length; ++index) {
        if (index > 0)
          csv.append(',');
        LedgerExports.appendCell(row[index], csv);
      }
      csv.append("\r\n");
    }
    return csv.toString();
  }


  private String toText(long documentId, List<CustodyEntry> entries) {
    var report = new StringBuilder(256 + entries.size() * 256);
    report.append("Chain of Custody Report\n")
        .append("Document ID: ").append(documentId).append('\n')
        .append("Generated: ").append(clock.instant()).append('\n')
        .append("Total Entries: ").append(entries.size()).append("\n\n");

    int number = 0;
    for (var entry : entries) {
      report.append("Entry ").append(++number).append(":\n")
          .append("  ID: ").append(entry.entryId()).append('\n')
          .append("  Action: ").append(entry.action()).append('\n')
          .append("  User: ").append(entry.userId()).append('\n')
          .append("  Timestamp: ").append(entry.timestamp()).append('\n');
      entry.location().ifPresent(
          loc -> report.append("  Location: ").append(loc).append('\n'));
      entry.hashBefore().ifPresent(
          hash -> report.append("  Hash Before: ").append(hash).append('\n'));
      entry.hashAfter().ifPresent(
          hash -> report.append("  Hash After: ").append(hash).append('\n'));
      report.append("  Chain Hash: ").append(entry.ledgerEntry().chainHash()).append("\n\n");
    }
    return report.toString();
  }


  /**
   * Deletes the given document's chain of custody (readable or not).
   *
   * @return {@code true} if there was one
   */
  public boolean delete(long documentId) {
    Ledger ledger = chains.remove(documentId);
    boolean existed = ledger != null;
    if (unreadable.remove(documentId) != null)
      existed = true;
    if (store != null)
      existed = store.delete(ledgerName(documentId)) || existed;
    else if (ledger != null)
      ledger.close();
    return existed;
  }


  /** Closes the chains' ledgers. */
  @Override
  public void close() {
    chains.values().forEach(Ledger::close);
  }

}
