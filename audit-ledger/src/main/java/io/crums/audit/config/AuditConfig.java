/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.config;


import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

import io.crums.audit.session.AnomalyThresholds;
import io.crums.audit.session.SessionSettings;

/**
 * Audit system configuration.
 *
 * <h2>Quirks and Features</h2>
 * <p>
 * A simple properties file is used to store configuration. Only
 * {@linkplain #DIR} is required; the rest have defaults.
 * </p>
 * <h3>Relative Paths</h3>
 * <p>
 * Filepaths may be specified in either absolute or relative form. For relative
 * paths, <em>paths are resolved relative to the location of the configuration
 * file.</em> (When constructed directly from {@code Properties}, relative
 * paths resolve against {@linkplain #BASE_DIR}, if set; o.w., the working
 * directory.)
 * </p>
 */
public class AuditConfig {

  /**
   * Every property known to this configuration is prefixed with this value.
   */
  public final static String ROOT = "audit.";

  /**
   * The name of the base directory path. <em>This value should not be set in the properties file.</em>
   * It is set dynamically to the parent directory of the configuration file.
   */
  public final static String BASE_DIR = ROOT + "base.dir";
  /**
   * Directory the audit trail ledger lives in. Required.
   */
  public final static String DIR = ROOT + "dir";
  /**
   * Directory the custody ledgers live in. Defaults to {@code custody} under {@linkplain #DIR}.
   */
  public final static String CUSTODY_DIR = ROOT + "custody.dir";
  /**
   * Directory the sessions file lives in. Defaults to {@code sessions} under {@linkplain #DIR}.
   */
  public final static String SESSIONS_DIR = ROOT + "sessions.dir";
  /**
   * Path to a Base64 AES-256 key file. If set, ledgers and sessions are
   * encrypted at rest; if the file does not exist, a new key is generated
   * and saved there.
   */
  public final static String KEY_FILE = ROOT + "key.file";

  public final static String SESSION_TIMEOUT_MINUTES = ROOT + "session.timeout.minutes";
  /** Zero (the default) means idle sessions are expired lazily only. */
  public final static String SESSION_SWEEP_SECONDS = ROOT + "session.sweep.seconds";

  public final static String ANOMALY_MAX_CONCURRENT = ROOT + "anomaly.max.concurrent";
  public final static String ANOMALY_RAPID_MIN_ACTIVITIES = ROOT + "anomaly.rapid.min.activities";
  public final static String ANOMALY_RAPID_RATE = ROOT + "anomaly.rapid.rate";
  public final static String ANOMALY_RAPID_RECENT_SESSIONS = ROOT + "anomaly.rapid.recent.sessions";
  public final static String ANOMALY_IP_MAX_DISTINCT = ROOT + "anomaly.ip.max.distinct";
  public final static String ANOMALY_IP_RECENT_SESSIONS = ROOT + "anomaly.ip.recent.sessions";


  /**
   * Names of the properties known to this configuration.
   */
  public final static List<String> PROP_NAMES = List.of(
      BASE_DIR,
      DIR,
      CUSTODY_DIR,
      SESSIONS_DIR,
      KEY_FILE,
      SESSION_TIMEOUT_MINUTES,
      SESSION_SWEEP_SECONDS,
      ANOMALY_MAX_CONCURRENT,
      ANOMALY_RAPID_MIN_ACTIVITIES,
      ANOMALY_RAPID_RATE,
      ANOMALY_RAPID_RECENT_SESSIONS,
      ANOMALY_IP_MAX_DISTINCT,
      ANOMALY_IP_RECENT_SESSIONS);


  /**
   * Loads the given properties file, setting {@linkplain #BASE_DIR} to its
   * parent directory.
   */
  public static Properties loadProperties(File propertiesFile) {
    Properties props = new Properties();
    try (var in = new FileInputStream(propertiesFile)) {
      props.load(in);
    } catch (FileNotFoundException fnfx) {
      throw new IllegalArgumentException("properties file does not exist: " + propertiesFile);
    } catch (IOException iox) {
      throw new IllegalArgumentException("failed to read properties file: " + propertiesFile, iox);
    }
    File baseDir = propertiesFile.getAbsoluteFile().getParentFile();
    props.put(BASE_DIR, baseDir.getAbsolutePath());
    return props;
  }



  private final File baseDir;
  private final File dir;
  private final File custodyDir;
  private final File sessionsDir;
  private final File keyFile;
  private final SessionSettings sessionSettings;


  public AuditConfig(File propertiesFile) {
    this(loadProperties(propertiesFile));
  }


  /**
   * @throws IllegalArgumentException if a required property is missing, or
   *         a value is malformed
   */
  public AuditConfig(Properties props) {
    String base = props.getProperty(BASE_DIR);
    this.baseDir = isSet(base) ? new File(base).getAbsoluteFile() : new File("").getAbsoluteFile();

    for (var name : props.stringPropertyNames())
      if (name.startsWith(ROOT) && !PROP_NAMES.contains(name))
        System.getLogger(AuditSystem.LOG_NAME).log(
            Level.WARNING, "ignoring unknown property " + name);

    String dirPath = props.getProperty(DIR);
    enforceRequired(DIR, dirPath);
    this.dir = resolve(dirPath);

    String custodyPath = props.getProperty(CUSTODY_DIR);
    this.custodyDir = isSet(custodyPath) ? resolve(custodyPath) : new File(dir, "custody");

    String sessionsPath = props.getProperty(SESSIONS_DIR);
    this.sessionsDir = isSet(sessionsPath) ? resolve(sessionsPath) : new File(dir, "sessions");

    String keyPath = props.getProperty(KEY_FILE);
    this.keyFile = isSet(keyPath) ? resolve(keyPath) : null;

    var defaults = AnomalyThresholds.DEFAULT;
    var thresholds = new AnomalyThresholds(
        getInt(props, ANOMALY_MAX_CONCURRENT, defaults.maxConcurrentSessions()),
        getInt(props, ANOMALY_RAPID_MIN_ACTIVITIES, defaults.rapidMinActivities()),
        getDouble(props, ANOMALY_RAPID_RATE, defaults.rapidMaxRate()),
        getInt(props, ANOMALY_RAPID_RECENT_SESSIONS, defaults.rapidRecentSessions()),
        getInt(props, ANOMALY_IP_MAX_DISTINCT, defaults.maxDistinctIps()),
        getInt(props, ANOMALY_IP_RECENT_SESSIONS, defaults.ipRecentSessions()));

    long timeout = getInt(props, SESSION_TIMEOUT_MINUTES, (int) SessionSettings.DEFAULT_TIMEOUT.toMinutes());
    if (timeout <= 0)
      throw new IllegalArgumentException(SESSION_TIMEOUT_MINUTES + ": " + timeout);
    long sweep = getInt(props, SESSION_SWEEP_SECONDS, 0);

    this.sessionSettings = new SessionSettings(
        Duration.ofMinutes(timeout), Duration.ofSeconds(sweep), thresholds);
  }


  private File resolve(String path) {
    File file = new File(path);
    return file.isAbsolute() ? file : new File(baseDir, path);
  }


  private void enforceRequired(String name, String value) {
    if (!isSet(value))
      throw new IllegalArgumentException("required property not set: " + name);
  }


  private boolean isSet(String value) {
    return value != null && !value.isBlank();
  }


  private int getInt(Properties props, String name, int defaultValue) {
    String value = props.getProperty(name);
    if (!isSet(value))
      return defaultValue;
    try {
      int n = Integer.parseInt(value.strip());
      if (n < 0)
        throw new IllegalArgumentException(name + ": " + value);
      return n;
    } catch (NumberFormatException nfx) {
      throw new IllegalArgumentException(name + ": " + value, nfx);
    }
  }


  private double getDouble(Properties props, String name, double defaultValue) {
    String value = props.getProperty(name);
    if (!isSet(value))
      return defaultValue;
    try {
      double d = Double.parseDouble(value.strip());
      if (!(d >= 0) || Double.isInfinite(d))
        throw new IllegalArgumentException(name + ": " + value);
      return d;
    } catch (NumberFormatException nfx) {
      throw new IllegalArgumentException(name + ": " + value, nfx);
    }
  }


  /** Directory relative paths are resolved against. */
  public File baseDir() {
    return baseDir;
  }

  /** Audit trail directory. */
  public File dir() {
    return dir;
  }

  public File custodyDir() {
    return custodyDir;
  }

  public File sessionsDir() {
    return sessionsDir;
  }

  /** Key file, if encryption is configured. */
  public Optional<File> keyFile() {
    return Optional.ofNullable(keyFile);
  }

  public SessionSettings sessionSettings() {
    return sessionSettings;
  }


  /**
   * Returns this configuration as properties (paths absolute, defaults filled in).
   */
  public Properties toProperties() {
    Properties props = new Properties();
    props.put(DIR, dir.getPath());
    props.put(CUSTODY_DIR, custodyDir.getPath());
    props.put(SESSIONS_DIR, sessionsDir.getPath());
    if (keyFile != null)
      props.put(KEY_FILE, keyFile.getPath());
    var s = sessionSettings;
    var t = s.thresholds();
    props.put(SESSION_TIMEOUT_MINUTES, Long.toString(s.timeout().toMinutes()));
    props.put(SESSION_SWEEP_SECONDS, Long.toString(s.sweepInterval().toSeconds()));
    props.put(ANOMALY_MAX_CONCURRENT, Integer.toString(t.maxConcurrentSessions()));
    props.put(ANOMALY_RAPID_MIN_ACTIVITIES, Integer.toString(t.rapidMinActivities()));
    props.put(ANOMALY_RAPID_RATE, Double.toString(t.rapidMaxRate()));
    props.put(ANOMALY_RAPID_RECENT_SESSIONS, Integer.toString(t.rapidRecentSessions()));
    props.put(ANOMALY_IP_MAX_DISTINCT, Integer.toString(t.maxDistinctIps()));
    props.put(ANOMALY_IP_RECENT_SESSIONS, Integer.toString(t.ipRecentSessions()));
    return props;
  }


  @Override
  public boolean equals(Object o) {
    return o == this ||
        o instanceof AuditConfig other &&
        dir.equals(other.dir) &&
        custodyDir.equals(other.custodyDir) &&
        sessionsDir.equals(other.sessionsDir) &&
        Objects.equals(keyFile, other.keyFile) &&
        sessionSettings.equals(other.sessionSettings);
  }


  @Override
  public int hashCode() {
    return Objects.hash(dir, custodyDir, sessionsDir, keyFile, sessionSettings);
  }

}
