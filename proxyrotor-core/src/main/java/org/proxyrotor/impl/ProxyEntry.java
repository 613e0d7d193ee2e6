package org.proxyrotor.impl;

import static java.util.Objects.requireNonNull;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.proxyrotor.ProxyDescriptor;

/**
 * Runtime record of one configured proxy. Its identity is stable for the life of the pool; the
 * probe outcome and failure counter are updated concurrently by health checks and dispatches.
 */
@NullMarked
public final class ProxyEntry {
  private final ProxyDescriptor descriptor;
  private final int index;
  private volatile ProbeOutcome outcome = ProbeOutcome.UNCHECKED;
  private final AtomicInteger consecutiveFailures = new AtomicInteger();

  ProxyEntry(ProxyDescriptor descriptor, int index) {
    this.descriptor = requireNonNull(descriptor, "descriptor cannot be null");
    this.index = index;
  }

  public ProxyDescriptor getDescriptor() {
    return descriptor;
  }

  /** Position in the configured list; breaks latency ties in the live set. */
  public int getIndex() {
    return index;
  }

  public ProbeOutcome getOutcome() {
    return outcome;
  }

  public boolean isAlive() {
    return outcome.isAlive();
  }

  public long getLatencyMs() {
    return outcome.getLatencyMs();
  }

  @Nullable
  public Instant getLastCheckedAt() {
    return outcome.getCheckedAt();
  }

  @Nullable
  public String getLastError() {
    return outcome.getError();
  }

  public int getConsecutiveFailures() {
    return consecutiveFailures.get();
  }

  void recordProbe(ProbeOutcome probeOutcome) {
    this.outcome = requireNonNull(probeOutcome);
  }

  void recordSuccess() {
    consecutiveFailures.set(0);
  }

  void recordFailure() {
    consecutiveFailures.incrementAndGet();
  }

  @Override
  public String toString() {
    return descriptor.toString();
  }
}
