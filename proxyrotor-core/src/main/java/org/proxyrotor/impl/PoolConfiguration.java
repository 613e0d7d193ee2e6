package org.proxyrotor.impl;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.NullMarked;

/** Immutable, validated settings of one pool. */
@NullMarked
public final class PoolConfiguration {

  public static final int DEFAULT_ON_ERROR_RETRIES = 0;
  public static final int DEFAULT_ON_TIMEOUT_RETRIES = 0;
  public static final Duration DEFAULT_MAX_TIMEOUT = Duration.ofSeconds(5);
  public static final String DEFAULT_HEALTH_CHECK_URL = "https://httpbin.org/ip";
  public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(60);
  public static final int DEFAULT_CHANGE_PROXY_LOOP = 1;
  public static final int DEFAULT_PROBE_CONCURRENCY = 16;
  public static final String DEFAULT_USER_AGENT = "ProxyRotor/1.0";
  public static final int DEFAULT_MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

  private final int onErrorRetries;
  private final int onTimeoutRetries;
  private final Duration maxTimeout;
  private final String healthCheckUrl;
  private final Duration healthCheckInterval;
  private final int changeProxyLoop;
  private final boolean disableLogging;
  private final int probeConcurrency;
  private final String userAgent;
  private final int maxResponseBytes;

  /** @throws IllegalArgumentException when any value is out of range */
  public PoolConfiguration(
      int onErrorRetries,
      int onTimeoutRetries,
      Duration maxTimeout,
      String healthCheckUrl,
      Duration healthCheckInterval,
      int changeProxyLoop,
      boolean disableLogging,
      int probeConcurrency,
      String userAgent,
      int maxResponseBytes) {
    if (onErrorRetries < 0) {
      throw new IllegalArgumentException("onErrorRetries cannot be negative: " + onErrorRetries);
    }
    if (onTimeoutRetries < 0) {
      throw new IllegalArgumentException(
          "onTimeoutRetries cannot be negative: " + onTimeoutRetries);
    }
    if (maxTimeout.isNegative() || maxTimeout.isZero()) {
      throw new IllegalArgumentException("maxTimeout must be positive: " + maxTimeout);
    }
    if (healthCheckInterval.isNegative() || healthCheckInterval.isZero()) {
      throw new IllegalArgumentException(
          "healthCheckInterval must be positive: " + healthCheckInterval);
    }
    if (changeProxyLoop < 1) {
      throw new IllegalArgumentException("changeProxyLoop must be at least 1: " + changeProxyLoop);
    }
    if (probeConcurrency < 1) {
      throw new IllegalArgumentException(
          "probeConcurrency must be at least 1: " + probeConcurrency);
    }
    if (maxResponseBytes < 1) {
      throw new IllegalArgumentException(
          "maxResponseBytes must be positive: " + maxResponseBytes);
    }
    validateHealthCheckUrl(healthCheckUrl);
    this.onErrorRetries = onErrorRetries;
    this.onTimeoutRetries = onTimeoutRetries;
    this.maxTimeout = maxTimeout;
    this.healthCheckUrl = healthCheckUrl;
    this.healthCheckInterval = healthCheckInterval;
    this.changeProxyLoop = changeProxyLoop;
    this.disableLogging = disableLogging;
    this.probeConcurrency = probeConcurrency;
    this.userAgent = userAgent;
    this.maxResponseBytes = maxResponseBytes;
  }

  /** A configuration with every default. */
  public static PoolConfiguration defaults() {
    return new PoolConfiguration(
        DEFAULT_ON_ERROR_RETRIES,
        DEFAULT_ON_TIMEOUT_RETRIES,
        DEFAULT_MAX_TIMEOUT,
        DEFAULT_HEALTH_CHECK_URL,
        DEFAULT_HEALTH_CHECK_INTERVAL,
        DEFAULT_CHANGE_PROXY_LOOP,
        false,
        DEFAULT_PROBE_CONCURRENCY,
        DEFAULT_USER_AGENT,
        DEFAULT_MAX_RESPONSE_BYTES);
  }

  private static void validateHealthCheckUrl(String url) {
    if (StringUtils.isBlank(url)) {
      throw new IllegalArgumentException("healthCheckUrl cannot be blank");
    }
    URI uri;
    try {
      uri = URI.create(url.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid healthCheckUrl: " + url, e);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException("healthCheckUrl must be http or https: " + url);
    }
    if (StringUtils.isEmpty(uri.getHost())) {
      throw new IllegalArgumentException("healthCheckUrl has no host: " + url);
    }
  }

  public int getOnErrorRetries() {
    return onErrorRetries;
  }

  public int getOnTimeoutRetries() {
    return onTimeoutRetries;
  }

  public Duration getMaxTimeout() {
    return maxTimeout;
  }

  public String getHealthCheckUrl() {
    return healthCheckUrl;
  }

  public Duration getHealthCheckInterval() {
    return healthCheckInterval;
  }

  public int getChangeProxyLoop() {
    return changeProxyLoop;
  }

  public boolean isDisableLogging() {
    return disableLogging;
  }

  public int getProbeConcurrency() {
    return probeConcurrency;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public int getMaxResponseBytes() {
    return maxResponseBytes;
  }

  @Override
  public String toString() {
    return "PoolConfiguration{onErrorRetries="
        + onErrorRetries
        + ", onTimeoutRetries="
        + onTimeoutRetries
        + ", maxTimeout="
        + maxTimeout
        + ", healthCheckUrl="
        + healthCheckUrl
        + ", healthCheckInterval="
        + healthCheckInterval
        + ", changeProxyLoop="
        + changeProxyLoop
        + ", probeConcurrency="
        + probeConcurrency
        + "}";
  }
}
