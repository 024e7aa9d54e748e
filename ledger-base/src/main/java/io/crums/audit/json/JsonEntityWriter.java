/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.json;

import java.util.List;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Writes an entity in JSON form.
 *
 * @param <T> the entity type
 */
public interface JsonEntityWriter<T> {


  /**
   * Puts the entity's fields into {@code jObj} and returns it.
   */
  JSONObject injectEntity(T entity, JSONObject jObj);


  /** Returns the entity as a new JSON object. */
  default JSONObject toJsonObject(T entity) {
    return injectEntity(entity, new JSONObject());
  }


  @SuppressWarnings("unchecked")
  default JSONArray toJsonArray(List<T> entities) {
    var jArray = new JSONArray();
    entities.forEach(e -> jArray.add(toJsonObject(e)));
    return jArray;
  }


  /**
   * Returns the entity as one line of canonical JSON: compact, keys sorted.
   * This is the form ledger files store records in.
   *
   * @see JsonWriter#CANONICAL
   */
  default String toJsonLine(T entity) {
    return JsonWriter.CANONICAL.toJson(toJsonObject(entity));
  }

}
