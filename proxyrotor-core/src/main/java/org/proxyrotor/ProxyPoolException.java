package org.proxyrotor;

/** Base class of every failure surfaced by a {@link ProxyPool}. */
public class ProxyPoolException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ProxyPoolException(String message) {
    super(message);
  }

  public ProxyPoolException(String message, Throwable cause) {
    super(message, cause);
  }
}
