package org.proxyrotor.extras;

/** Enumeration of supported log formats for the {@link ActivityLogger}. */
public enum LogFormat {
  /** Plain text. timestamp EVENT key=value key=value ... */
  TEXT,

  /** JSON Format. One JSON object per event. */
  JSON,

  /** Labeled Tab-Separated Values (LTSV). label:value\tlabel2:value2 */
  LTSV
}
