/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.json;


import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 *
 */
public class JsonWriterTest {


  @Test
  public void testSortedCompact() {
    var map = new LinkedHashMap<String, Object>();
    map.put("z", 1);
    map.put("a", List.of(true, false));
    map.put("m", Map.of("y", "why", "x", "ex"));
    map.put("n", null);
    assertEquals(
        "{\"a\":[true,false],\"m\":{\"x\":\"ex\",\"y\":\"why\"},\"n\":null,\"z\":1}",
        JsonWriter.CANONICAL.toJson(map));
  }


  @Test
  public void testEscapes() {
    assertEquals("\"tab\\there\"", JsonWriter.CANONICAL.toJson("tab\there"));
    assertEquals("\"q\\\"b\\\\\"", JsonWriter.CANONICAL.toJson("q\"b\\"));
    assertEquals("\"caf\\u00e9\"", JsonWriter.CANONICAL.toJson("café"));
    assertEquals("\"\\u0001\\n\"", JsonWriter.CANONICAL.toJson("\u0001\n"));
    assertEquals("\"\\u007f\"", JsonWriter.CANONICAL.toJson("\u007f"));
  }


  @Test
  public void testNumbers() {
    assertEquals("42", JsonWriter.CANONICAL.toJson(42));
    assertEquals("-7", JsonWriter.CANONICAL.toJson(-7L));
    assertEquals("1.0", JsonWriter.CANONICAL.toJson(1.0));
    assertEquals("0.25", JsonWriter.CANONICAL.toJson(0.25));
    assertEquals("0.1", JsonWriter.CANONICAL.toJson(0.1));
    assertEquals("0.0", JsonWriter.CANONICAL.toJson(-0.0));
    assertEquals("100000000000000000000.0", JsonWriter.CANONICAL.toJson(1e20));
    assertEquals("0.000001", JsonWriter.CANONICAL.toJson(1e-6));
    assertEquals("2.5", JsonWriter.CANONICAL.toJson(new BigDecimal("2.50")));
    assertEquals("\"NaN\"", JsonWriter.CANONICAL.toJson(Double.NaN));
    assertEquals("\"-Infinity\"", JsonWriter.CANONICAL.toJson(Double.NEGATIVE_INFINITY));
  }


  @Test
  public void testArray() {
    assertEquals("[1,\"b\"]", JsonWriter.CANONICAL.toJson(new Object[] { 1, "b" }));
    assertEquals("[]", JsonWriter.CANONICAL.toJson(Arrays.asList()));
  }


  @Test
  public void testPretty() {
    var map = new LinkedHashMap<String, Object>();
    map.put("b", List.of(1));
    map.put("a", "x");
    assertEquals(
        "{\n  \"a\": \"x\",\n  \"b\": [\n    1\n  ]\n}",
        JsonWriter.PRETTY.toJson(map));
  }


  @Test
  public void testParsesBack() {
    var map = new LinkedHashMap<String, Object>();
    map.put("s", "ünïcode \"q\" \\ \t");
    map.put("d", 0.1);
    map.put("l", Long.MIN_VALUE);
    var parsed = JsonUtils.parseObject(JsonWriter.CANONICAL.toJson(map));
    assertEquals(map, parsed);
  }

}
