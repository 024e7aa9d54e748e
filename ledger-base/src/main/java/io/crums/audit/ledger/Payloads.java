/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import io.crums.audit.json.JsonWriter;

/**
 * Payload freezing and canonicalization.
 *
 * <h2>Frozen Values</h2>
 * <p>
 * A frozen payload is a read-only tree of plain JSON values: {@code null},
 * {@code String}, {@code Boolean}, {@code Long}, {@code Double}, and read-only
 * {@code Map<String, Object>}s and {@code List<Object>}s thereof. It is exactly
 * what a JSON parser hands back on reading the payload's canonical rendering,
 * which is why hashes survive a write / read cycle.
 * </p>
 * <ul>
 * <li>Integral numbers (up to 64 bits) become {@code Long}s; wider ones, strings.</li>
 * <li>{@code Float}s and {@code BigDecimal}s become {@code Double}s.</li>
 * <li>Arrays, collections and iterables become lists.</li>
 * <li>Maps keep their iteration order if ordered ({@code LinkedHashMap},
 *     {@code SortedMap}, or already frozen); o.w. their keys are sorted.</li>
 * <li>Anything else (instants, UUIDs, enums, ..) is rendered via {@code toString()}.</li>
 * </ul>
 */
public class Payloads {

  private Payloads() {  }


  private final static Class<?> FROZEN_MAP =
      Collections.unmodifiableMap(new LinkedHashMap<>()).getClass();


  /**
   * Returns a frozen copy of the given map.
   *
   * @param payload {@code null} counts as empty
   */
  public static Map<String, Object> freeze(Map<String, ?> payload) {
    if (payload == null || payload.isEmpty())
      return Collections.emptyMap();
    return freezeMap(payload);
  }


  /**
   * Returns the frozen form of the given value.
   */
  public static Object freezeValue(Object value) {
    if (value == null || value instanceof String || value instanceof Boolean ||
        value instanceof Long || value instanceof Double)
      return value;

    if (value instanceof CharSequence || value instanceof Character)
      return value.toString();

    if (value instanceof Integer || value instanceof Short || value instanceof Byte ||
        value instanceof AtomicInteger || value instanceof AtomicLong)
      return ((Number) value).longValue();

    if (value instanceof BigInteger) {
      BigInteger big = (BigInteger) value;
      return big.bitLength() < 64 ? (Object) big.longValue() : big.toString();
    }

    if (value instanceof Float)
      return Double.valueOf(value.toString());

    if (value instanceof BigDecimal || value instanceof Number)
      return ((Number) value).doubleValue();

    if (value instanceof Map)
      return freezeMap((Map<?, ?>) value);

    if (value instanceof Iterable) {
      List<Object> list = new ArrayList<>();
      for (Object element : (Iterable<?>) value)
        list.add(freezeValue(element));
      return Collections.unmodifiableList(list);
    }

    if (value.getClass().isArray()) {
      int len = Array.getLength(value);
      List<Object> list = new ArrayList<>(len);
      for (int index = 0; index < len; ++index)
        list.add(freezeValue(Array.get(value, index)));
      return Collections.unmodifiableList(list);
    }

    if (value instanceof Optional)
      return freezeValue(((Optional<?>) value).orElse(null));

    if (value instanceof Enum)
      return ((Enum<?>) value).name();

    return value.toString();
  }


  private static Map<String, Object> freezeMap(Map<?, ?> map) {
    boolean ordered =
        map instanceof LinkedHashMap ||
        map instanceof SortedMap ||
        map.getClass() == FROZEN_MAP;

    Map<String, Object> keyed = ordered ? new LinkedHashMap<>() : new TreeMap<>();
    for (var e : map.entrySet())
      keyed.put(String.valueOf(e.getKey()), freezeValue(e.getValue()));

    return Collections.unmodifiableMap(
        ordered ? keyed : new LinkedHashMap<>(keyed));
  }


  /**
   * Returns the canonical JSON rendering of the given payload. This is the
   * text ledger hashes are computed over.
   *
   * @see JsonWriter#CANONICAL
   */
  public static String canonical(Map<String, ?> payload) {
    return JsonWriter.CANONICAL.toJson(freeze(payload));
  }


  /**
   * Returns a mutable builder-style copy that omits {@code null} values.
   * Used to assemble payloads whose optional fields are absent, not null.
   */
  public static Map<String, Object> withoutNulls(Map<String, ?> fields) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : fields.entrySet())
      if (e.getValue() != null)
        out.put(e.getKey(), e.getValue());
    return out;
  }

}
