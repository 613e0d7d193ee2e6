package org.proxyrotor;

import java.time.Duration;

/** A single attempt through a proxy exceeded its deadline. The tunnel has been torn down. */
public class ProxyTimeoutException extends ProxyPoolException {
  private static final long serialVersionUID = 1L;

  private final String proxy;
  private final Duration timeout;

  public ProxyTimeoutException(String proxy, Duration timeout) {
    this(proxy, timeout, null);
  }

  public ProxyTimeoutException(String proxy, Duration timeout, Throwable cause) {
    super("Request through " + proxy + " timed out after " + timeout.toMillis() + " ms", cause);
    this.proxy = proxy;
    this.timeout = timeout;
  }

  /** The {@code host:port} of the proxy the attempt went through. */
  public String getProxy() {
    return proxy;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
