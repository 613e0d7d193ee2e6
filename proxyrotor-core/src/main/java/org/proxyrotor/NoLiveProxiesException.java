package org.proxyrotor;

/** Thrown when a request is dispatched while no proxy is currently marked alive. */
public class NoLiveProxiesException extends ProxyPoolException {
  private static final long serialVersionUID = 1L;

  public NoLiveProxiesException() {
    super("No live proxies available");
  }
}
