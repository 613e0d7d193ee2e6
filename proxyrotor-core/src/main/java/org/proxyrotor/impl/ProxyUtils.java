package org.proxyrotor.impl;

import java.time.Duration;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

/** Helpers for reading pool settings out of a {@link Properties} file. */
public final class ProxyUtils {

  private ProxyUtils() {}

  /**
   * Returns the trimmed value of {@code key}, or {@code null} when it is absent or blank.
   */
  @Nullable
  public static String extractString(Properties props, String key) {
    return StringUtils.trimToNull(props.getProperty(key));
  }

  public static boolean extractBooleanDefaultFalse(Properties props, String key) {
    String value = extractString(props, key);
    return value != null && Boolean.parseBoolean(value);
  }

  /**
   * @throws IllegalArgumentException when the value is present but not a number
   */
  public static int extractInt(Properties props, String key, int defaultValue) {
    String value = extractString(props, key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + key + " is not an integer: " + value, e);
    }
  }

  public static long extractLong(Properties props, String key, long defaultValue) {
    String value = extractString(props, key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + key + " is not a number: " + value, e);
    }
  }

  /** Reads a millisecond count as a {@link Duration}. */
  public static Duration extractMillis(Properties props, String key, Duration defaultValue) {
    return Duration.ofMillis(extractLong(props, key, defaultValue.toMillis()));
  }
}
