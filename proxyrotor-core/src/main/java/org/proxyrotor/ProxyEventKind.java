package org.proxyrotor;

/** Kinds of events a {@link ProxyPool} reports to its {@link ProxyEventRecorder}. */
public enum ProxyEventKind {
  /** An attempt is about to go through a proxy. */
  PROXY_SELECTED,
  /** An attempt through a proxy timed out or broke. */
  PROXY_FAILED,
  /** A request used up its rotation budget. */
  REQUEST_EXHAUSTED,
  /** A health-check pass finished and a new live set was published. */
  HEALTH_CHECK_COMPLETED
}
