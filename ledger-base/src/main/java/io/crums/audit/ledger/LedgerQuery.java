/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable ledger query. Filters are ANDed; results are always in append
 * order. Instances are built fluently, starting from {@linkplain #ALL}:
 * <pre>{@code
 *   LedgerQuery.ALL.where("user_id", "alice").from(t0).tail(50)
 * }</pre>
 *
 * <h2>Matching</h2>
 * <p>
 * Field values are compared against top-level payload values after
 * {@linkplain Payloads#freezeValue(Object) freezing}, so {@code 7} matches a
 * stored {@code 7L}. A {@code null} filter value matches entries whose field
 * is absent or null. The time range is inclusive at both ends.
 * </p>
 * <h2>Paging</h2>
 * <p>
 * Either {@linkplain #offset(int) offset} / {@linkplain #limit(int) limit}
 * (from the front), or {@linkplain #tail(int) tail} (the last <em>n</em> matches).
 * Setting one clears the other.
 * </p>
 */
public final class LedgerQuery {

  /** Matches every entry. */
  public final static LedgerQuery ALL =
      new LedgerQuery(Collections.emptyMap(), null, null, 0, -1, -1);


  private final Map<String, Object> fields;
  private final Instant from;
  private final Instant to;
  private final int offset;
  private final int limit;
  private final int tail;


  private LedgerQuery(
      Map<String, Object> fields, Instant from, Instant to, int offset, int limit, int tail) {
    this.fields = fields;
    this.from = from;
    this.to = to;
    this.offset = offset;
    this.limit = limit;
    this.tail = tail;
  }


  /**
   * Returns a copy of this query that also requires the given top-level
   * payload field to equal the given value.
   */
  public LedgerQuery where(String field, Object value) {
    Objects.requireNonNull(field, "null field");
    var copy = new LinkedHashMap<>(fields);
    copy.put(field, Payloads.freezeValue(value));
    return new LedgerQuery(
        Collections.unmodifiableMap(copy), from, to, offset, limit, tail);
  }


  /** Returns a copy of this query with the given inclusive lower time bound. */
  public LedgerQuery from(Instant from) {
    return new LedgerQuery(fields, from, to, offset, limit, tail);
  }


  /** Returns a copy of this query with the given inclusive upper time bound. */
  public LedgerQuery to(Instant to) {
    return new LedgerQuery(fields, from, to, offset, limit, tail);
  }


  /** Returns a copy of this query skipping the first {@code offset} matches. */
  public LedgerQuery offset(int offset) {
    if (offset < 0)
      throw new IllegalArgumentException("offset " + offset);
    return new LedgerQuery(fields, from, to, offset, limit, -1);
  }


  /** Returns a copy of this query returning at most {@code limit} matches. */
  public LedgerQuery limit(int limit) {
    if (limit < 0)
      throw new IllegalArgumentException("limit " + limit);
    return new LedgerQuery(fields, from, to, offset, limit, -1);
  }


  /** Returns a copy of this query returning only the last {@code count} matches. */
  public LedgerQuery tail(int count) {
    if (count < 0)
      throw new IllegalArgumentException("tail " + count);
    return new LedgerQuery(fields, from, to, 0, -1, count);
  }


  /**
   * Tests whether the given entry passes this query's filters
   * (paging aside).
   */
  public boolean matches(LedgerEntry entry) {
    Instant time = entry.timestamp();
    if (from != null && time.isBefore(from))
      return false;
    if (to != null && time.isAfter(to))
      return false;
    var payload = entry.payload();
    for (var e : fields.entrySet())
      if (!Objects.equals(e.getValue(), payload.get(e.getKey())))
        return false;
    return true;
  }


  /**
   * Applies this query to the given entries.
   *
   * @param entries in append order
   * @return read-only list
   */
  public List<LedgerEntry> apply(List<LedgerEntry> entries) {
    List<LedgerEntry> hits = new ArrayList<>();
    for (var entry : entries)
      if (matches(entry))
        hits.add(entry);

    int start, end;
    if (tail >= 0) {
      end = hits.size();
      start = Math.max(0, end - tail);
    } else {
      start = Math.min(offset, hits.size());
      end = limit < 0 ? hits.size() : (int) Math.min((long) start + limit, hits.size());
    }
    return Collections.unmodifiableList(hits.subList(start, end));
  }


  @Override
  public String toString() {
    return "LedgerQuery[fields=" + fields + ", from=" + from + ", to=" + to +
        ", offset=" + offset + ", limit=" + limit + ", tail=" + tail + "]";
  }

}
