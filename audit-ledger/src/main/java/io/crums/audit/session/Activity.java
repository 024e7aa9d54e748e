/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.session;


import static io.crums.audit.session.SessionConstants.*;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

import org.json.simple.JSONObject;

import io.crums.audit.json.JsonEntityParser;
import io.crums.audit.json.JsonParsingException;
import io.crums.audit.json.JsonUtils;
import io.crums.audit.ledger.Payloads;

/**
 * A user action within a session.
 *
 * @param timestamp when
 * @param action    what
 * @param details   frozen; includes {@code document_id}, if any
 */
public record Activity(Instant timestamp, String action, Map<String, Object> details) {

  public final static JsonEntityParser<Activity> PARSER = new Parser();


  public Activity {
    Objects.requireNonNull(timestamp, "null timestamp");
    Objects.requireNonNull(action, "null action");
    details = Payloads.freeze(details);
  }


  public static class Parser implements JsonEntityParser<Activity> {

    @SuppressWarnings("unchecked")
    @Override
    public JSONObject injectEntity(Activity activity, JSONObject jObj) {
      jObj.put(TIMESTAMP, activity.timestamp().toString());
      jObj.put(ACTION, activity.action());
      jObj.put(DETAILS, activity.details());
      return jObj;
    }

    @SuppressWarnings("unchecked")
    @Override
    public Activity toEntity(JSONObject jObj) throws JsonParsingException {
      return new Activity(
          JsonUtils.getInstant(jObj, TIMESTAMP, true),
          JsonUtils.getString(jObj, ACTION, true),
          JsonUtils.getJsonObject(jObj, DETAILS, false));
    }
  }

}
