/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.json;

import java.time.Instant;
import java.time.format.DateTimeParseException;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * Typed accessors over {@code json.simple} objects.
 */
public class JsonUtils {

  private JsonUtils() {  }


  /**
   * Parses and returns the given text as a JSON object.
   *
   * @throws JsonParsingException if malformed or not an object
   */
  public static JSONObject parseObject(String json) throws JsonParsingException {
    Object parsed;
    try {
      parsed = new JSONParser().parse(json);
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json: " + abbreviate(json), px);
    } catch (NumberFormatException nfx) {
      // out-of-range integer literals
      throw new JsonParsingException("bad number in json: " + abbreviate(json), nfx);
    }
    if (!(parsed instanceof JSONObject))
      throw new JsonParsingException("not a JSON object: " + abbreviate(json));
    return (JSONObject) parsed;
  }


  public static String getString(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected '" + name + "' missing");
      return null;
    }
    if (!(value instanceof String))
      throw new JsonParsingException("'" + name + "' expects a simple string: " + value);
    return value.toString();
  }


  public static Number getNumber(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected numeral '" + name + "' missing");
      return null;
    }
    try {
      return (Number) value;
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("'" + name + "' expects a numeral: " + value, ccx);
    }
  }


  public static int getInt(JSONObject jObj, String name) throws JsonParsingException {
    return getNumber(jObj, name, true).intValue();
  }


  /**
   * Returns the named ISO-8601 instant.
   */
  public static Instant getInstant(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    String value = getString(jObj, name, require);
    if (value == null)
      return null;
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException dtpx) {
      throw new JsonParsingException("'" + name + "' expects an ISO-8601 instant: " + value, dtpx);
    }
  }


  public static JSONArray getJsonArray(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected JSON array '" + name + "' missing");
      return null;
    }
    try {
      return (JSONArray) value;
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("'" + name + "' expects a JSON array: " + value, ccx);
    }
  }


  public static JSONObject getJsonObject(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected JSON object '" + name + "' missing");
      return null;
    }
    try {
      return (JSONObject) value;
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("'" + name + "' expects a JSON object: " + value, ccx);
    }
  }



  @SuppressWarnings("unchecked")
  public static boolean addIfPresent(JSONObject jObj, String name, Object value) {
    if (value == null)
      return false;
    jObj.put(name, value);
    return true;
  }


  /** Shortens long input for use in exception messages. */
  static String abbreviate(String json) {
    if (json == null)
      return "null";
    return json.length() <= 64 ? json : json.substring(0, 64) + "..";
  }

}
