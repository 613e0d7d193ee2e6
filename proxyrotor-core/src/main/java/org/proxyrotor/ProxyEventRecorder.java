package org.proxyrotor;

import java.util.Map;

/**
 * Receives observability events from a {@link ProxyPool}. Implementations must be thread safe and
 * must not throw: recording never changes dispatch behaviour.
 */
@FunctionalInterface
public interface ProxyEventRecorder {

  /** Discards every event. Used when logging is disabled. */
  ProxyEventRecorder NO_OP = (kind, details) -> {};

  /**
   * Records one event.
   *
   * @param kind what happened
   * @param details event attributes in insertion order, e.g. {@code proxy}, {@code attempt},
   *     {@code correlationId}
   */
  void record(ProxyEventKind kind, Map<String, Object> details);
}
