/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.session;


import static io.crums.audit.session.SessionConstants.*;

import java.io.IOException;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.json.simple.JSONObject;

import io.crums.audit.json.JsonWriter;
import io.crums.audit.ledger.ErrorKind;
import io.crums.audit.ledger.ExportFormat;
import io.crums.audit.ledger.LedgerExports;
import io.crums.audit.ledger.PersistenceException;
import io.crums.audit.ledger.Result;
import io.crums.audit.ledger.UnreadableLedgerException;
import io.crums.audit.trail.AuditAction;
import io.crums.audit.trail.AuditTrail;

/**
 * Tracks user sessions and their activities, forwarding each event to an
 * optional {@linkplain AuditTrail}.
 *
 * <h2>Lifecycle</h2>
 * <p>
 * A session is active from {@linkplain #startSession(String, String, String) start}
 * until it is {@linkplain #endSession(String) ended} or expires. A session
 * expires once idle longer than the configured timeout. Expiry is checked
 * lazily (on every new session, and on every activity against the idle
 * session) and, if {@linkplain SessionSettings#sweeps() configured}, by a
 * background sweep. Ended sessions are retained for reporting.
 * </p>
 * <h2>Concurrency</h2>
 * <p>
 * Instances are thread-safe. Session state and the sessions file are
 * updated under one lock; audit events are forwarded after the lock
 * is released.
 * </p>
 */
public class SessionTracker implements AutoCloseable {

  /** Max number of users reported in {@linkplain #systemStats()}. */
  public final static int TOP_USERS = 10;

  private final static String TIMEOUT_REASON = "timeout";


  /** Mutable session state. Guarded by the tracker's lock. */
  private static class Session {

    final String sessionId;
    final String userId;
    final String ipAddress;
    final String userAgent;
    final Instant startTime;
    final List<Activity> activities;
    Instant lastActivity;
    Instant endTime;

    Session(String userId, String ipAddress, String userAgent, Instant startTime) {
      this.sessionId = UUID.randomUUID().toString();
      this.userId = userId;
      this.ipAddress = ipAddress;
      this.userAgent = userAgent;
      this.startTime = startTime;
      this.lastActivity = startTime;
      this.activities = new ArrayList<>();
    }

    Session(UserSession saved) {
      this.sessionId = saved.sessionId();
      this.userId = saved.userId();
      this.ipAddress = saved.ipAddress();
      this.userAgent = saved.userAgent();
      this.startTime = saved.startTime();
      this.lastActivity = saved.lastActivity();
      this.endTime = saved.endTime();
      this.activities = new ArrayList<>(saved.activities());
    }

    boolean isActive() {
      return endTime == null;
    }

    UserSession snapshot() {
      return new UserSession(
          sessionId, userId, ipAddress, userAgent, startTime, lastActivity,
          endTime, endTime == null, activities);
    }
  }



  private final SessionStore store;
  private final AuditTrail trail;
  private final SessionSettings settings;
  private final Clock clock;

  private final Object lock = new Object();

  // guarded by lock
  private final Map<String, Session> sessions = new HashMap<>();
  private final Map<String, List<Session>> byUser = new LinkedHashMap<>();
  private boolean dirty;
  private boolean closed;

  private final ScheduledExecutorService sweeper;


  /**
   * In-memory tracker with default settings, forwarding to the given trail.
   *
   * @param trail optional (may be {@code null})
   */
  public SessionTracker(AuditTrail trail) {
    this(null, trail, SessionSettings.DEFAULT, Clock.systemUTC());
  }


  /**
   * Full constructor. Saved sessions, if any, are loaded from the store.
   * An unreadable sessions file is moved aside (never overwritten) and the
   * tracker starts empty.
   *
   * @param store     optional (may be {@code null})
   * @param trail     optional (may be {@code null})
   * @param settings  timeout, sweep and anomaly settings
   * @param clock     stamps sessions and activities
   *
   * @throws PersistenceException on I/O error reading the store
   */
  public SessionTracker(
      SessionStore store, AuditTrail trail, SessionSettings settings, Clock clock)
      throws PersistenceException {
    this.store = store;
    this.trail = trail;
    this.settings = Objects.requireNonNull(settings, "null settings");
    this.clock = Objects.requireNonNull(clock, "null clock");

    if (store != null)
      load();

    if (settings.sweeps()) {
      sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
        var thread = new Thread(r, "session-sweep");
        thread.setDaemon(true);
        return thread;
      });
      long millis = settings.sweepInterval().toMillis();
      sweeper.scheduleWithFixedDelay(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
    } else
      sweeper = null;
  }


  private void load() {
    List<UserSession> saved;
    try {
      saved = store.load();
    } catch (UnreadableLedgerException ulx) {
      var moved = store.quarantine(Long.toString(clock.millis()));
      SessionStore.getLogger().log(
          Level.ERROR, ulx.getMessage() + " (moved to " + moved + "); starting with no sessions");
      return;
    }
    for (var s : saved) {
      var session = new Session(s);
      sessions.put(session.sessionId, session);
      byUser.computeIfAbsent(session.userId, u -> new ArrayList<>()).add(session);
    }
    SessionStore.getLogger().log(
        Level.INFO, "loaded " + saved.size() + " session(s) from " + store.file());
  }


  public SessionSettings settings() {
    return settings;
  }


  /**
   * Starts and returns a new session for the given user. Idle sessions
   * (anyone's) are expired first.
   *
   * @param userId    required
   * @param ipAddress optional
   * @param userAgent optional
   *
   * @return the new session's id
   */
  public String startSession(String userId, String ipAddress, String userAgent) {
    Objects.requireNonNull(userId, "null userId");
    List<AuditAction> events = new ArrayList<>();
    Session session;
    synchronized (lock) {
      checkOpen();
      Instant now = clock.instant();
      expireIdle(now, events);

      session = new Session(userId, ipAddress, userAgent, now);
      sessions.put(session.sessionId, session);
      byUser.computeIfAbsent(userId, u -> new ArrayList<>()).add(session);
      save();
    }
    var details = new LinkedHashMap<String, Object>();
    details.put(SESSION_ID, session.sessionId);
    details.put(START_TIME, session.startTime.toString());
    events.add(
        AuditAction.of(SESSION_START).byUser(userId)
        .withDetails(details).fromClient(ipAddress, userAgent));
    forward(events);
    return session.sessionId;
  }


  /**
   * Records an activity in the given session.
   *
   * @param sessionId   the session
   * @param action      what was done
   * @param documentId  optional; if present, also added to the activity's details
   * @param details     optional
   *
   * @return the recorded activity; {@linkplain ErrorKind#SESSION_NOT_FOUND} if
   *         the session is unknown, ended, or has just expired; degraded if
   *         the sessions file could not be written
   */
  public Result<Activity> trackActivity(
      String sessionId, String action, Long documentId, Map<String, ?> details) {
    Objects.requireNonNull(action, "null action");
    List<AuditAction> events = new ArrayList<>();
    Session session;
    Activity activity;
    boolean saved;
    synchronized (lock) {
      checkOpen();
      Instant now = clock.instant();
      session = sessions.get(sessionId);
      if (session != null && session.isActive() && isIdle(session, now)) {
        expire(session, now, events);
        save();
      }
      if (session == null || !session.isActive()) {
        activity = null;
        saved = true;
      } else {
        var activityDetails = new LinkedHashMap<String, Object>();
        if (details != null)
          activityDetails.putAll(details);
        if (documentId != null)
          activityDetails.put(DOCUMENT_ID, documentId);
        activity = new Activity(now, action, activityDetails);
        session.activities.add(activity);
        session.lastActivity = now;
        saved = save();
      }
    }
    if (activity != null) {
      var auditDetails = new LinkedHashMap<String, Object>();
      auditDetails.put(SESSION_ID, session.sessionId);
      auditDetails.putAll(activity.details());
      events.add(
          AuditAction.of(action).byUser(session.userId).onDocument(documentId)
          .withDetails(auditDetails).fromClient(session.ipAddress, session.userAgent));
    }
    forward(events);

    if (activity == null)
      return Result.failure(ErrorKind.SESSION_NOT_FOUND, "no active session " + sessionId);
    return saved ?
        Result.ok(activity) :
        Result.degraded(activity, ErrorKind.PERSISTENCE, "failed to save " + store.file());
  }


  /**
   * Ends the given session.
   *
   * @return the ended session; {@linkplain ErrorKind#SESSION_NOT_FOUND} if
   *         unknown or already ended; degraded if the sessions file could not
   *         be written
   */
  public Result<UserSession> endSession(String sessionId) {
    List<AuditAction> events = new ArrayList<>();
    UserSession ended;
    boolean saved;
    synchronized (lock) {
      checkOpen();
      var session = sessions.get(sessionId);
      if (session == null || !session.isActive())
        return Result.failure(ErrorKind.SESSION_NOT_FOUND, "no active session " + sessionId);
      ended = end(session, clock.instant(), null, events);
      saved = save();
    }
    forward(events);
    return saved ?
        Result.ok(ended) :
        Result.degraded(ended, ErrorKind.PERSISTENCE, "failed to save " + store.file());
  }


  /**
   * Ends every active session idle longer than the timeout.
   *
   * @return the expired sessions
   */
  public List<UserSession> expireIdleSessions() {
    List<AuditAction> events = new ArrayList<>();
    List<UserSession> expired;
    synchronized (lock) {
      if (closed)
        return List.of();
      expired = expireIdle(clock.instant(), events);
      if (!expired.isEmpty())
        save();
    }
    forward(events);
    return expired;
  }


  private void sweep() {
    try {
      var expired = expireIdleSessions();
      if (!expired.isEmpty())
        SessionStore.getLogger().log(Level.INFO, "expired " + expired.size() + " idle session(s)");
    } catch (RuntimeException rx) {
      SessionStore.getLogger().log(Level.WARNING, "session sweep failed: " + rx, rx);
    }
  }


  // under lock
  private List<UserSession> expireIdle(Instant now, List<AuditAction> events) {
    List<UserSession> expired = new ArrayList<>();
    for (var session : sessions.values())
      if (session.isActive() && isIdle(session, now))
        expired.add(expire(session, now, events));
    return expired;
  }


  private boolean isIdle(Session session, Instant now) {
    return Duration.between(session.lastActivity, now).compareTo(settings.timeout()) > 0;
  }


  private UserSession expire(Session session, Instant now, List<AuditAction> events) {
    return end(session, now, TIMEOUT_REASON, events);
  }


  // under lock
  private UserSession end(Session session, Instant now, String reason, List<AuditAction> events) {
    session.endTime = now;
    var ended = session.snapshot();
    var details = new LinkedHashMap<String, Object>();
    details.put(SESSION_ID, session.sessionId);
    details.put(DURATION_SECONDS, UserSession.seconds(ended.duration(now)));
    details.put(ACTIVITY_COUNT, ended.activityCount());
    if (reason != null)
      details.put(REASON, reason);
    events.add(AuditAction.of(SESSION_END).byUser(session.userId).withDetails(details));
    return ended;
  }


  // under lock; returns false on failure
  private boolean save() {
    if (store == null)
      return true;
    List<UserSession> all = new ArrayList<>(sessions.size());
    byUser.values().forEach(list -> list.forEach(s -> all.add(s.snapshot())));
    try {
      store.save(all);
      dirty = false;
      return true;
    } catch (IOException | RuntimeException x) {
      dirty = true;
      SessionStore.getLogger().log(
          Level.WARNING,
          "failed to save " + all.size() + " session(s) to " + store.file() + ": " + x.getMessage());
      return false;
    }
  }


  private void forward(List<AuditAction> events) {
    if (trail == null)
      return;
    for (var event : events) {
      try {
        trail.record(event);
      } catch (IllegalStateException isx) {
        SessionStore.getLogger().log(
            Level.WARNING, "audit trail closed; dropped '" + event.action() + "' event");
      }
    }
  }


  private void checkOpen() {
    if (closed)
      throw new IllegalStateException("session tracker closed");
  }


  /** Returns the given session, if it exists. */
  public Optional<UserSession> session(String sessionId) {
    synchronized (lock) {
      var session = sessions.get(sessionId);
      return session == null ? Optional.empty() : Optional.of(session.snapshot());
    }
  }


  /**
   * Returns the given user's sessions, most recent first.
   *
   * @param includeActive include active sessions
   * @param includeEnded  include ended sessions
   * @param limit         max number of sessions returned; zero (or less) for no limit
   */
  public List<UserSession> userSessions(
      String userId, boolean includeActive, boolean includeEnded, int limit) {
    List<UserSession> out = new ArrayList<>();
    synchronized (lock) {
      for (var session : byUser.getOrDefault(userId, List.of())) {
        if (session.isActive() ? includeActive : includeEnded)
          out.add(session.snapshot());
      }
    }
    out.sort(Comparator.comparing(UserSession::startTime).reversed());
    return limit > 0 && out.size() > limit ? List.copyOf(out.subList(0, limit)) : out;
  }


  /** Returns all the given user's sessions, most recent first. */
  public List<UserSession> userSessions(String userId) {
    return userSessions(userId, true, true, 0);
  }


  /**
   * Returns the users with active sessions, most recently active first.
   */
  public List<ActiveUser> activeUsers() {
    List<ActiveUser> out = new ArrayList<>();
    synchronized (lock) {
      for (var e : byUser.entrySet()) {
        int count = 0;
        int activities = 0;
        Instant first = null;
        Instant last = null;
        var ips = new TreeSet<String>();
        for (var session : e.getValue()) {
          if (!session.isActive())
            continue;
          ++count;
          activities += session.activities.size();
          if (first == null || session.startTime.isBefore(first))
            first = session.startTime;
          if (last == null || session.lastActivity.isAfter(last))
            last = session.lastActivity;
          if (session.ipAddress != null)
            ips.add(session.ipAddress);
        }
        if (count > 0)
          out.add(new ActiveUser(e.getKey(), count, activities, first, last, new ArrayList<>(ips)));
      }
    }
    out.sort(Comparator.comparing(ActiveUser::lastActivity).reversed());
    return out;
  }


  /**
   * Summarizes the given user's activity in the given (inclusive) time window.
   *
   * @param from  {@code null} for no lower bound
   * @param to    {@code null} for no upper bound
   */
  public ActivitySummary activitySummary(String userId, Instant from, Instant to) {
    int total = 0;
    int active = 0;
    int activityCount = 0;
    var actions = new TreeSet<String>();
    var documents = new TreeSet<Long>();
    var ips = new TreeSet<String>();
    var agents = new TreeSet<String>();
    Instant first = null;
    Instant last = null;
    Duration time = Duration.ZERO;

    synchronized (lock) {
      Instant now = clock.instant();
      for (var session : byUser.getOrDefault(userId, List.of())) {
        Instant end = session.endTime == null ? now : session.endTime;
        if (from != null && end.isBefore(from) || to != null && session.startTime.isAfter(to))
          continue;
        ++total;
        if (session.isActive())
          ++active;
        time = time.plus(Duration.between(session.startTime, end));
        if (session.ipAddress != null)
          ips.add(session.ipAddress);
        if (session.userAgent != null)
          agents.add(session.userAgent);

        for (var activity : session.activities) {
          Instant at = activity.timestamp();
          if (from != null && at.isBefore(from) || to != null && at.isAfter(to))
            continue;
          ++activityCount;
          actions.add(activity.action());
          Object doc = activity.details().get(DOCUMENT_ID);
          if (doc instanceof Long)
            documents.add((Long) doc);
          if (first == null || at.isBefore(first))
            first = at;
          if (last == null || at.isAfter(last))
            last = at;
        }
      }
    }
    return new ActivitySummary(
        userId, total, active, activityCount,
        new ArrayList<>(actions), new ArrayList<>(documents),
        new ArrayList<>(ips), new ArrayList<>(agents),
        first, last, time);
  }


  /**
   * Returns system-wide activity statistics.
   */
  public SystemActivity systemStats() {
    synchronized (lock) {
      Instant now = clock.instant();
      Instant hourAgo = now.minus(Duration.ofHours(1));
      Instant dayAgo = now.minus(Duration.ofDays(1));
      int active = 0;
      int lastHour = 0;
      int lastDay = 0;
      Map<String, Integer> counts = new HashMap<>();
      for (var session : sessions.values()) {
        if (session.isActive())
          ++active;
        for (var activity : session.activities) {
          if (activity.timestamp().isAfter(hourAgo))
            ++lastHour;
          if (activity.timestamp().isAfter(dayAgo)) {
            ++lastDay;
            counts.merge(session.userId, 1, Integer::sum);
          }
        }
      }
      var top = new ArrayList<SystemActivity.UserCount>();
      counts.forEach((user, count) -> top.add(new SystemActivity.UserCount(user, count)));
      top.sort(
          Comparator.comparingInt(SystemActivity.UserCount::activityCount).reversed()
          .thenComparing(SystemActivity.UserCount::userId));
      return new SystemActivity(
          active, byUser.size(), sessions.size(), lastHour, lastDay,
          top.size() > TOP_USERS ? top.subList(0, TOP_USERS) : top,
          now);
    }
  }


  /**
   * Exports the given user's sessions, most recent first.
   *
   * @param format          {@code json} or {@code csv}
   * @param includeDetails  if {@code false}, activities are left out of the JSON
   *                        export (CSV never includes them)
   *
   * @return UTF-8 bytes; {@linkplain ErrorKind#UNSUPPORTED_FORMAT} if the format
   *         is unknown
   */
  public Result<byte[]> exportUserActivity(String userId, String format, boolean includeDetails) {
    var fmt = ExportFormat.forName(format);
    if (fmt.isEmpty())
      return Result.failure(ErrorKind.UNSUPPORTED_FORMAT, "unsupported format: " + format);

    var userSessions = userSessions(userId);
    Instant now = clock.instant();
    String text;
    switch (fmt.get()) {
    case JSON:
      text = toJson(userId, userSessions, includeDetails, now);
      break;
    case CSV:
      text = toCsv(userSessions, now);
      break;
    default:
      throw new RuntimeException("unaccounted format " + fmt.get());
    }
    return Result.ok(text.getBytes(StandardCharsets.UTF_8));
  }


  @SuppressWarnings("unchecked")
  private static String toJson(
      String userId, List<UserSession> userSessions, boolean includeDetails, Instant now) {
    var list = new ArrayList<JSONObject>(userSessions.size());
    for (var session : userSessions) {
      var jObj = UserSession.PARSER.toJsonObject(session);
      jObj.put(DURATION_SECONDS, UserSession.seconds(session.duration(now)));
      if (!includeDetails)
        jObj.remove(ACTIVITIES);
      list.add(jObj);
    }
    var export = new LinkedHashMap<String, Object>();
    export.put(USER_ID, userId);
    export.put("exported_at", now.toString());
    export.put("sessions", list);
    return JsonWriter.PRETTY.toJson(export);
  }


  private final static String[] CSV_COLUMNS = {
      SESSION_ID, START_TIME, END_TIME, DURATION_SECONDS, ACTIVITY_COUNT, IP_ADDRESS, USER_AGENT
  };

  private static String toCsv(List<UserSession> userSessions, Instant now) {
    var csv = new StringBuilder();
    csv.append(String.join(",", CSV_COLUMNS)).append("\r\n");
    for (var session : userSessions) {
      LedgerExports.appendCell(session.sessionId(), csv);
      csv.append(',').append(session.startTime()).append(',');
      if (session.endTime() != null)
        csv.append(session.endTime());
      csv.append(',');
      JsonWriter.appendDouble(UserSession.seconds(session.duration(now)), csv);
      csv.append(',').append(session.activityCount()).append(',');
      if (session.ipAddress() != null)
        LedgerExports.appendCell(session.ipAddress(), csv);
      csv.append(',');
      if (session.userAgent() != null)
        LedgerExports.appendCell(session.userAgent(), csv);
      csv.append("\r\n");
    }
    return csv.toString();
  }


  /**
   * Runs the suspicious activity heuristics for the given user, or for
   * every user. The heuristics are independent: a user may trigger more
   * than one.
   *
   * @param userId {@code null} for all users
   *
   * @see AnomalyThresholds
   */
  public List<Finding> detectSuspiciousActivity(String userId) {
    var thresholds = settings.thresholds();
    List<Finding> findings = new ArrayList<>();
    synchronized (lock) {
      Instant now = clock.instant();
      List<String> users = userId == null ? new ArrayList<>(byUser.keySet()) : List.of(userId);
      for (var user : users) {
        var userSessions = byUser.getOrDefault(user, List.of());

        long activeCount = userSessions.stream().filter(Session::isActive).count();
        if (activeCount > thresholds.maxConcurrentSessions())
          findings.add(new Finding(
              FindingType.MULTIPLE_CONCURRENT_SESSIONS, user, now,
              Map.of("session_count", activeCount)));

        for (var session : tail(userSessions, thresholds.rapidRecentSessions())) {
          int count = session.activities.size();
          if (count <= thresholds.rapidMinActivities())
            continue;
          double span = UserSession.seconds(Duration.between(session.startTime, session.lastActivity));
          if (span <= 0)
            continue;
          double rate = count / span;
          if (rate > thresholds.rapidMaxRate()) {
            var attributes = new LinkedHashMap<String, Object>();
            attributes.put(SESSION_ID, session.sessionId);
            attributes.put("activity_rate", rate);
            findings.add(new Finding(FindingType.RAPID_ACTIVITY_PATTERN, user, now, attributes));
          }
        }

        var ips = new TreeSet<String>();
        for (var session : tail(userSessions, thresholds.ipRecentSessions()))
          if (session.ipAddress != null)
            ips.add(session.ipAddress);
        if (ips.size() > thresholds.maxDistinctIps()) {
          var attributes = new LinkedHashMap<String, Object>();
          attributes.put("ip_count", ips.size());
          attributes.put("ip_addresses", new ArrayList<>(ips));
          findings.add(new Finding(FindingType.MULTIPLE_IP_ADDRESSES, user, now, attributes));
        }
      }
    }
    for (var finding : findings)
      SessionStore.getLogger().log(
          Level.WARNING,
          "suspicious activity (" + finding.severity().code() + "): " +
          finding.type().code() + " by user " + finding.userId());
    return findings;
  }


  private static List<Session> tail(List<Session> list, int count) {
    return list.size() <= count ? list : list.subList(list.size() - count, list.size());
  }


  /**
   * Stops the background sweep (if any) and retries a failed save.
   * Idempotent. Active sessions stay active (and are restored on the
   * next startup).
   */
  @Override
  public void close() {
    synchronized (lock) {
      if (closed)
        return;
      closed = true;
      if (dirty)
        save();
    }
    if (sweeper != null)
      sweeper.shutdownNow();
  }

}
