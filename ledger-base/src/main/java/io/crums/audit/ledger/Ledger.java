/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An append-only, hash-linked sequence of {@linkplain LedgerEntry entries}.
 * Each entry's {@code chain_hash} commits to its payload and to its
 * predecessor's {@code chain_hash}, so altering, removing or reordering any
 * persisted entry is detected on {@linkplain #verify() verification}.
 *
 * <h2>Concurrency</h2>
 * <p>
 * Appends are linearized under a per-instance lock: reading the tail, hashing,
 * committing and persisting happen as one step. Reads ({@linkplain #snapshot()},
 * {@linkplain #query(LedgerQuery)}, {@linkplain #verify()}, exports) work off a
 * consistent snapshot of committed entries and never block on appends.
 * </p>
 * <h2>Persistence</h2>
 * <p>
 * A ledger may be backed by a {@linkplain LedgerSink sink} (usually a
 * {@linkplain LedgerFile}). An append is never lost on account of a write
 * failure: the entry stays committed in memory, the result comes back
 * {@linkplain Result#isDegraded() degraded}, and unwritten entries are retried
 * on the next append or {@linkplain #flush()}.
 * </p>
 *
 * @see LedgerStore
 */
public class Ledger implements AutoCloseable {


  /**
   * Returns a new, empty in-memory ledger.
   */
  public static Ledger newVolatile(String name) {
    return newVolatile(name, Clock.systemUTC());
  }


  /**
   * Returns a new, empty in-memory ledger that stamps entries with the given clock.
   */
  public static Ledger newVolatile(String name, Clock clock) {
    return new Ledger(name, HashScheme.V1, List.of(), null, clock);
  }


  /**
   * Returns an in-memory ledger with the given existing entries, taken as-is
   * (they may or may not verify).
   */
  public static Ledger restore(String name, List<LedgerEntry> entries) {
    return restore(name, HashScheme.V1, entries);
  }


  /**
   * Returns an in-memory ledger with the given existing entries under the given scheme.
   */
  public static Ledger restore(String name, HashScheme scheme, List<LedgerEntry> entries) {
    return new Ledger(name, scheme, entries, null, Clock.systemUTC());
  }



  private final String name;
  private final HashScheme scheme;
  private final LedgerSink sink;
  private final Clock clock;

  private final Object lock = new Object();
  private final EntryLog log;

  // guarded by lock
  private int persisted;
  private long failures;
  private long plaintextFallbacks;
  private String lastError;
  private Instant lastFailure;
  private boolean closed;


  /**
   * Full constructor.
   *
   * @param name      ledger name (informational)
   * @param scheme    hashing rules
   * @param entries   existing entries, already persisted (if {@code sink} is not null)
   * @param sink      durable destination; {@code null} for in-memory
   * @param clock     timestamps new entries
   */
  public Ledger(
      String name, HashScheme scheme, List<LedgerEntry> entries, LedgerSink sink, Clock clock) {
    this.name = Objects.requireNonNull(name, "null name");
    this.scheme = Objects.requireNonNull(scheme, "null scheme");
    this.sink = sink;
    this.clock = Objects.requireNonNull(clock, "null clock");
    this.log = new EntryLog(entries);
    this.persisted = entries.size();
  }


  public final String name() {
    return name;
  }


  public final HashScheme scheme() {
    return scheme;
  }


  /** Returns {@code true} iff this ledger is backed by a sink. */
  public final boolean isPersistent() {
    return sink != null;
  }



  /**
   * Appends a new entry with the given payload. The payload is
   * {@linkplain Payloads#freeze(Map) frozen}: values that are not plain JSON
   * are rendered as strings, so the payload's content never causes failure.
   *
   * @param payload {@code null} counts as empty
   *
   * @return the new entry; degraded if it could not be written to disk, or was
   *         written unencrypted
   * @throws IllegalStateException if closed
   */
  public Result<LedgerEntry> append(Map<String, ?> payload) throws IllegalStateException {
    synchronized (lock) {
      if (closed)
        throw new IllegalStateException("ledger closed: " + name);

      LedgerEntry last = log.last();
      String previousHash = last == null ? scheme.sentinel() : last.chainHash();
      LedgerEntry entry = scheme.seal(
          UUID.randomUUID().toString(), clock.instant(), payload, previousHash);
      log.add(entry);

      return writePending(entry);
    }
  }


  /**
   * Retries writing entries that previously failed to persist.
   *
   * @return the number of entries still pending (zero on success);
   *         degraded if any remain
   */
  public Result<Integer> flush() {
    synchronized (lock) {
      if (closed || persisted == log.size())
        return Result.ok(log.size() - persisted);
      var result = writePending(0);
      return result.map(n -> log.size() - persisted);
    }
  }


  // under lock
  private <T> Result<T> writePending(T value) {
    int size = log.size();
    if (sink == null) {
      persisted = size;
      return Result.ok(value);
    }
    var pending = log.snapshot().subList(persisted, size);
    try {
      int fallbacks = sink.write(pending);
      persisted = size;
      if (fallbacks == 0)
        return Result.ok(value);
      plaintextFallbacks += fallbacks;
      return Result.degraded(
          value, ErrorKind.ENCRYPTION,
          fallbacks + " record(s) written unencrypted to ledger " + name);

    } catch (IOException | UncheckedIOException iox) {
      ++failures;
      lastError = String.valueOf(iox.getMessage());
      lastFailure = clock.instant();
      LedgerConstants.getLogger().log(
          Level.WARNING,
          "failed to persist " + pending.size() + " entr" + (pending.size() == 1 ? "y" : "ies") +
          " to ledger " + name + " (will retry): " + lastError);
      return Result.degraded(value, ErrorKind.PERSISTENCE, lastError);
    }
  }


  /**
   * Returns an immutable view of the entries committed so far.
   */
  public List<LedgerEntry> snapshot() {
    return log.snapshot();
  }


  /** Returns the number of committed entries. */
  public int size() {
    return log.size();
  }


  /** Returns {@code true} iff there are no entries. */
  public boolean isEmpty() {
    return log.size() == 0;
  }


  /** Returns the last committed entry, or {@code null} if empty. */
  public LedgerEntry last() {
    return log.last();
  }


  /**
   * Verifies every committed entry.
   */
  public VerificationReport verify() {
    return VerificationReport.verify(log.snapshot(), scheme);
  }


  /**
   * Returns the committed entries matching the given query, in append order.
   */
  public List<LedgerEntry> query(LedgerQuery query) {
    return query.apply(log.snapshot());
  }


  /**
   * Exports the committed entries in the given format (UTF-8).
   */
  public byte[] export(ExportFormat format) {
    var entries = log.snapshot();
    String text;
    switch (format) {
    case JSON:
      text = LedgerExports.toJson(name, scheme, entries, clock.instant());
      break;
    case CSV:
      text = LedgerExports.toCsv(entries);
      break;
    default:
      throw new RuntimeException("unaccounted format " + format);
    }
    return text.getBytes(StandardCharsets.UTF_8);
  }


  /**
   * Exports the committed entries in the named format.
   *
   * @return {@linkplain ErrorKind#UNSUPPORTED_FORMAT} failure, if the format is unknown
   */
  public Result<byte[]> export(String format) {
    var fmt = ExportFormat.forName(format);
    if (fmt.isEmpty())
      return Result.failure(ErrorKind.UNSUPPORTED_FORMAT, "unsupported format: " + format);
    return Result.ok(export(fmt.get()));
  }


  /**
   * Returns the ledger's persistence health.
   */
  public LedgerHealth health() {
    synchronized (lock) {
      return new LedgerHealth(
          log.size() - persisted, failures, plaintextFallbacks, lastError, lastFailure);
    }
  }


  /**
   * Makes a last attempt at writing pending entries and releases the sink.
   * Subsequent appends fail; reads still work. Idempotent.
   */
  @Override
  public void close() {
    synchronized (lock) {
      if (closed)
        return;
      if (persisted != log.size())
        writePending(0);
      closed = true;
      if (sink != null)
        sink.close();
    }
  }


  /** Returns {@code true} iff {@linkplain #close() closed}. */
  public boolean isClosed() {
    synchronized (lock) {
      return closed;
    }
  }


  @Override
  public String toString() {
    return "Ledger[" + name + ", size=" + log.size() + "]";
  }

}
