/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.session;


import java.time.Duration;
import java.util.Objects;

/**
 * Session tracker settings.
 *
 * @param timeout         idle time after which an active session expires
 * @param sweepInterval   if positive, idle sessions are also expired periodically
 *                        in the background; o.w., only lazily, on lookups and new sessions
 * @param thresholds      anomaly thresholds
 */
public record SessionSettings(Duration timeout, Duration sweepInterval, AnomalyThresholds thresholds) {

  public final static Duration DEFAULT_TIMEOUT = Duration.ofMinutes(30);

  /** 30 minute timeout, lazy expiry, default thresholds. */
  public final static SessionSettings DEFAULT =
      new SessionSettings(DEFAULT_TIMEOUT, Duration.ZERO, AnomalyThresholds.DEFAULT);


  public SessionSettings {
    Objects.requireNonNull(timeout, "null timeout");
    Objects.requireNonNull(sweepInterval, "null sweepInterval");
    Objects.requireNonNull(thresholds, "null thresholds");
    if (timeout.isNegative() || timeout.isZero())
      throw new IllegalArgumentException("timeout " + timeout);
    if (sweepInterval.isNegative())
      throw new IllegalArgumentException("sweepInterval " + sweepInterval);
  }


  public boolean sweeps() {
    return !sweepInterval.isZero();
  }

  public SessionSettings withTimeout(Duration timeout) {
    return new SessionSettings(timeout, sweepInterval, thresholds);
  }

  public SessionSettings withSweepInterval(Duration sweepInterval) {
    return new SessionSettings(timeout, sweepInterval, thresholds);
  }
}
