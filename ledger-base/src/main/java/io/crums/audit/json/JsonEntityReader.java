/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.json;


import java.util.ArrayList;
import java.util.List;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Reads an entity from its JSON form.
 *
 * @param <T> the entity type
 */
public interface JsonEntityReader<T> {


  /**
   * Reads the entity from the given parsed object.
   *
   * @throws JsonParsingException if a field is missing or has the wrong type
   */
  T toEntity(JSONObject jObj) throws JsonParsingException;


  /**
   * Parses the given text (typically a single record line) and reads
   * the entity from it.
   *
   * @throws JsonParsingException if the text is not a JSON object, or
   *         if the object doesn't describe an entity
   */
  default T toEntity(String json) throws JsonParsingException {
    return toEntity(JsonUtils.parseObject(json));
  }


  /**
   * Reads each element of the given array as an entity.
   *
   * @param jArray {@code null} reads as empty
   *
   * @return read-only list, in array order
   */
  default List<T> toEntityList(JSONArray jArray) throws JsonParsingException {
    if (jArray == null || jArray.isEmpty())
      return List.of();

    var entities = new ArrayList<T>(jArray.size());
    int index = 0;
    for (Object element : jArray) {
      if (element instanceof JSONObject jObj)
        entities.add(toEntity(jObj));
      else
        throw new JsonParsingException("element [" + index + "] is not an object: " + element);
      ++index;
    }
    return List.copyOf(entities);
  }

}
