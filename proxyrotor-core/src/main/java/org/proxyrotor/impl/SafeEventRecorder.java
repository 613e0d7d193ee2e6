package org.proxyrotor.impl;

import java.util.Map;
import org.proxyrotor.ProxyEventKind;
import org.proxyrotor.ProxyEventRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Shields the pool from recorders that throw. */
class SafeEventRecorder implements ProxyEventRecorder {
  private static final Logger LOG = LoggerFactory.getLogger(SafeEventRecorder.class);

  private final ProxyEventRecorder delegate;

  SafeEventRecorder(ProxyEventRecorder delegate) {
    this.delegate = delegate;
  }

  @Override
  public void record(ProxyEventKind kind, Map<String, Object> details) {
    try {
      delegate.record(kind, details);
    } catch (RuntimeException e) {
      LOG.warn("Event recorder failed on {} event", kind, e);
    }
  }
}
