package org.proxyrotor.impl;

import java.time.Instant;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * Result of the latest health probe of one proxy. Alive and latency live in one immutable object
 * so that a reader can never see an alive proxy without a latency.
 */
@NullMarked
public final class ProbeOutcome {

  /** State of an entry that was never probed. */
  public static final ProbeOutcome UNCHECKED = new ProbeOutcome(false, -1, null, null);

  private final boolean alive;
  private final long latencyMs;
  @Nullable private final String error;
  @Nullable private final Instant checkedAt;

  private ProbeOutcome(
      boolean alive, long latencyMs, @Nullable String error, @Nullable Instant checkedAt) {
    this.alive = alive;
    this.latencyMs = latencyMs;
    this.error = error;
    this.checkedAt = checkedAt;
  }

  public static ProbeOutcome alive(long latencyMs, Instant checkedAt) {
    if (latencyMs < 0) {
      throw new IllegalArgumentException("latency cannot be negative: " + latencyMs);
    }
    return new ProbeOutcome(true, latencyMs, null, checkedAt);
  }

  public static ProbeOutcome dead(String error, Instant checkedAt) {
    return new ProbeOutcome(false, -1, error, checkedAt);
  }

  public boolean isAlive() {
    return alive;
  }

  /** Probe round trip in milliseconds, {@code -1} unless alive. */
  public long getLatencyMs() {
    return latencyMs;
  }

  @Nullable
  public String getError() {
    return error;
  }

  @Nullable
  public Instant getCheckedAt() {
    return checkedAt;
  }

  @Override
  public String toString() {
    return alive ? "alive (" + latencyMs + " ms)" : "dead (" + error + ")";
  }
}
