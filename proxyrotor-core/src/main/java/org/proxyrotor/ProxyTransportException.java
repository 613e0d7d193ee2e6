package org.proxyrotor;

/**
 * A single attempt through a proxy failed below the HTTP layer: the proxy could not be reached,
 * refused the credentials, rejected the tunnel, or the exchange broke.
 */
public class ProxyTransportException extends ProxyPoolException {
  private static final long serialVersionUID = 1L;

  /** What part of the tunneled exchange failed. */
  public enum Reason {
    /** The TCP connection to the proxy could not be established. */
    CONNECT,
    /** The proxy refused the configured credentials. */
    AUTHENTICATION,
    /** The proxy refused to open the tunnel to the target. */
    TUNNEL_REJECTED,
    /** The origin answered something that is not HTTP/1.x. */
    PROTOCOL,
    /** The tunnel broke while writing or reading. */
    IO
  }

  private final String proxy;
  private final Reason reason;

  public ProxyTransportException(String proxy, Reason reason, String message) {
    super(message);
    this.proxy = proxy;
    this.reason = reason;
  }

  public ProxyTransportException(String proxy, Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.proxy = proxy;
    this.reason = reason;
  }

  /** The {@code host:port} of the proxy the attempt went through. */
  public String getProxy() {
    return proxy;
  }

  public Reason getReason() {
    return reason;
  }
}
