/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.session;


import static io.crums.audit.session.SessionConstants.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.json.simple.JSONObject;

import io.crums.audit.json.JsonEntityParser;
import io.crums.audit.json.JsonParsingException;
import io.crums.audit.json.JsonUtils;

/**
 * Immutable snapshot of a user session.
 *
 * @param sessionId     random UUID
 * @param userId        the user
 * @param ipAddress     client address, or {@code null}
 * @param userAgent     client description, or {@code null}
 * @param startTime     when started
 * @param lastActivity  time of the last activity (initially the start time)
 * @param endTime       when ended, or {@code null} if active
 * @param active        {@code true} until ended or expired
 * @param activities    in order
 */
public record UserSession(
    String sessionId,
    String userId,
    String ipAddress,
    String userAgent,
    Instant startTime,
    Instant lastActivity,
    Instant endTime,
    boolean active,
    List<Activity> activities) {


  /** JSON parser. */
  public final static JsonEntityParser<UserSession> PARSER = new Parser();


  public UserSession {
    Objects.requireNonNull(sessionId, "null sessionId");
    Objects.requireNonNull(userId, "null userId");
    Objects.requireNonNull(startTime, "null startTime");
    Objects.requireNonNull(lastActivity, "null lastActivity");
    activities = List.copyOf(activities);
    if (active == (endTime != null))
      throw new IllegalArgumentException(
          "active=" + active + " with endTime " + endTime + " (session " + sessionId + ")");
  }


  public Optional<Instant> end() {
    return Optional.ofNullable(endTime);
  }


  public int activityCount() {
    return activities.size();
  }


  /**
   * Returns the session's duration: from start to end, or to {@code now}
   * if still active.
   */
  public Duration duration(Instant now) {
    return Duration.between(startTime, endTime == null ? now : endTime);
  }


  /** Returns the given duration in (fractional) seconds. */
  static double seconds(Duration duration) {
    return duration.toNanos() / 1e9;
  }



  public static class Parser implements JsonEntityParser<UserSession> {

    @SuppressWarnings("unchecked")
    @Override
    public JSONObject injectEntity(UserSession session, JSONObject jObj) {
      jObj.put(SESSION_ID, session.sessionId());
      jObj.put(USER_ID, session.userId());
      JsonUtils.addIfPresent(jObj, IP_ADDRESS, session.ipAddress());
      JsonUtils.addIfPresent(jObj, USER_AGENT, session.userAgent());
      jObj.put(START_TIME, session.startTime().toString());
      jObj.put(LAST_ACTIVITY, session.lastActivity().toString());
      if (session.endTime() != null) {
        jObj.put(END_TIME, session.endTime().toString());
        jObj.put(DURATION_SECONDS, seconds(session.duration(session.endTime())));
      }
      jObj.put(IS_ACTIVE, session.active());
      jObj.put(ACTIVITY_COUNT, session.activityCount());
      jObj.put(ACTIVITIES, Activity.PARSER.toJsonArray(session.activities()));
      return jObj;
    }

    @Override
    public UserSession toEntity(JSONObject jObj) throws JsonParsingException {
      var sessionId = JsonUtils.getString(jObj, SESSION_ID, true);
      var userId = JsonUtils.getString(jObj, USER_ID, true);
      var ip = JsonUtils.getString(jObj, IP_ADDRESS, false);
      var agent = JsonUtils.getString(jObj, USER_AGENT, false);
      var start = JsonUtils.getInstant(jObj, START_TIME, true);
      var last = JsonUtils.getInstant(jObj, LAST_ACTIVITY, true);
      var end = JsonUtils.getInstant(jObj, END_TIME, false);
      Object active = jObj.get(IS_ACTIVE);
      if (!(active instanceof Boolean))
        throw new JsonParsingException("'" + IS_ACTIVE + "' expects a boolean: " + active);
      var activities = Activity.PARSER.toEntityList(JsonUtils.getJsonArray(jObj, ACTIVITIES, false));
      try {
        return new UserSession(
            sessionId, userId, ip, agent, start, last, end, (Boolean) active, activities);
      } catch (IllegalArgumentException iax) {
        throw new JsonParsingException(iax.getMessage(), iax);
      }
    }
  }

}
