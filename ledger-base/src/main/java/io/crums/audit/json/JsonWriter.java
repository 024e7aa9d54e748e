/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.json;


import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders plain Java values ({@code Map}s, {@code List}s, strings, numbers,
 * booleans and {@code null}) as JSON text.
 *
 * <h2>Canonical Form</h2>
 * <p>
 * The {@linkplain #CANONICAL} instance produces the byte-for-byte reproducible
 * rendering ledger hashes are computed over:
 * </p>
 * <ol>
 * <li>No insignificant whitespace.</li>
 * <li>Object members sorted by key (natural {@code String} order).</li>
 * <li>Only ASCII is emitted: other chars, and control chars, are escaped
 * as {@code \}{@code uXXXX} (except the usual short escapes).</li>
 * <li>Integral numbers in plain decimal; floating point numbers in their shortest
 * round-trip decimal, never in exponent notation, always with a fractional part
 * ({@code 1.0}, not {@code 1}). Non-finite values are rendered as strings.</li>
 * </ol>
 * <p>
 * Values of any other type are rendered as strings via {@code toString()}.
 * </p>
 */
public final class JsonWriter {

  /** Compact, sorted-key rendering. */
  public final static JsonWriter CANONICAL = new JsonWriter(true, 0);

  /** Indented (2 spaces), sorted-key rendering. */
  public final static JsonWriter PRETTY = new JsonWriter(true, 2);


  private final boolean sortKeys;
  private final int indent;


  /**
   * @param sortKeys  if {@code true}, object members are written in key order;
   *                  o.w., in iteration order
   * @param indent    number of spaces per nesting level; zero for compact output
   */
  public JsonWriter(boolean sortKeys, int indent) {
    if (indent < 0)
      throw new IllegalArgumentException("indent " + indent);
    this.sortKeys = sortKeys;
    this.indent = indent;
  }


  public String toJson(Object value) {
    return append(value, new StringBuilder(), 0).toString();
  }


  public StringBuilder append(Object value, StringBuilder out) {
    return append(value, out, 0);
  }


  private StringBuilder append(Object value, StringBuilder out, int depth) {
    if (value == null)
      return out.append("null");

    if (value instanceof CharSequence)
      return quote(value.toString(), out);

    if (value instanceof Boolean)
      return out.append(value.toString());

    if (value instanceof Double || value instanceof Float)
      return appendDouble(((Number) value).doubleValue(), out);

    if (value instanceof BigDecimal)
      return appendDecimal((BigDecimal) value, out);

    if (value instanceof Number)
      return out.append(value.toString());

    if (value instanceof Map)
      return appendObject((Map<?, ?>) value, out, depth);

    if (value instanceof Iterable)
      return appendArray(((Iterable<?>) value).iterator(), out, depth);

    if (value.getClass().isArray()) {
      int len = Array.getLength(value);
      List<Object> list = new ArrayList<>(len);
      for (int index = 0; index < len; ++index)
        list.add(Array.get(value, index));
      return appendArray(list.iterator(), out, depth);
    }

    return quote(value.toString(), out);
  }



  private StringBuilder appendObject(Map<?, ?> map, StringBuilder out, int depth) {
    if (map.isEmpty())
      return out.append("{}");

    Map<String, Object> members;
    if (sortKeys) {
      members = new TreeMap<>();
      for (var e : map.entrySet())
        members.put(String.valueOf(e.getKey()), e.getValue());
    } else {
      @SuppressWarnings("unchecked")
      Map<String, Object> m = (Map<String, Object>) map;
      members = m;
    }

    out.append('{');
    boolean first = true;
    for (var e : members.entrySet()) {
      if (!first)
        out.append(',');
      first = false;
      newLine(out, depth + 1);
      quote(String.valueOf(e.getKey()), out).append(':');
      if (indent > 0)
        out.append(' ');
      append(e.getValue(), out, depth + 1);
    }
    newLine(out, depth);
    return out.append('}');
  }


  private StringBuilder appendArray(Iterator<?> iter, StringBuilder out, int depth) {
    if (!iter.hasNext())
      return out.append("[]");

    out.append('[');
    boolean first = true;
    while (iter.hasNext()) {
      if (!first)
        out.append(',');
      first = false;
      newLine(out, depth + 1);
      append(iter.next(), out, depth + 1);
    }
    newLine(out, depth);
    return out.append(']');
  }


  private void newLine(StringBuilder out, int depth) {
    if (indent == 0)
      return;
    out.append('\n');
    for (int count = depth * indent; count-- > 0; )
      out.append(' ');
  }



  /**
   * Appends the canonical rendering of the given double.
   */
  public static StringBuilder appendDouble(double value, StringBuilder out) {
    if (Double.isNaN(value))
      return out.append("\"NaN\"");
    if (Double.isInfinite(value))
      return out.append(value > 0 ? "\"Infinity\"" : "\"-Infinity\"");
    return appendDecimal(new BigDecimal(Double.toString(value)), out);
  }


  private static StringBuilder appendDecimal(BigDecimal value, StringBuilder out) {
    String plain = value.stripTrailingZeros().toPlainString();
    out.append(plain);
    if (plain.indexOf('.') == -1)
      out.append(".0");
    return out;
  }



  /**
   * Appends the given string as a quoted, escaped, ASCII-only JSON string.
   */
  public static StringBuilder quote(String value, StringBuilder out) {
    out.append('"');
    final int len = value.length();
    for (int index = 0; index < len; ++index) {
      char c = value.charAt(index);
      switch (c) {
      case '"':   out.append("\\\""); break;
      case '\\':  out.append("\\\\"); break;
      case '\b':  out.append("\\b");  break;
      case '\f':  out.append("\\f");  break;
      case '\n':  out.append("\\n");  break;
      case '\r':  out.append("\\r");  break;
      case '\t':  out.append("\\t");  break;
      default:
        if (c < 0x20 || c > 0x7e) {
          String hex = Integer.toHexString(c);
          out.append("\\u");
          for (int pad = 4 - hex.length(); pad-- > 0; )
            out.append('0');
          out.append(hex);
        } else
          out.append(c);
      }
    }
    return out.append('"');
  }

}
