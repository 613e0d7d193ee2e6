package org.proxyrotor;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a request used up its rotation budget. The cause is the last {@link
 * ProxyTimeoutException} or {@link ProxyTransportException} observed.
 */
public class AllProxiesFailedException extends ProxyPoolException {
  private static final long serialVersionUID = 1L;

  private final int proxiesTried;
  private final int attempts;
  @Nullable private final String lastProxy;

  public AllProxiesFailedException(
      int proxiesTried, int attempts, @Nullable String lastProxy, @Nullable Throwable lastCause) {
    super(
        "All proxies failed: "
            + proxiesTried
            + " proxies tried in "
            + attempts
            + " attempts, last proxy "
            + lastProxy
            + (lastCause != null ? ": " + lastCause.getMessage() : ""),
        lastCause);
    this.proxiesTried = proxiesTried;
    this.attempts = attempts;
    this.lastProxy = lastProxy;
  }

  public int getProxiesTried() {
    return proxiesTried;
  }

  public int getAttempts() {
    return attempts;
  }

  @Nullable
  public String getLastProxy() {
    return lastProxy;
  }
}
