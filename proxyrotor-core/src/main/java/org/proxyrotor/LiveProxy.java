package org.proxyrotor;

/**
 * A snapshot copy of one entry of the live set, as returned by {@link
 * ProxyPool#getLiveProxiesList()}.
 */
public final class LiveProxy {
  private final String host;
  private final int port;
  private final long latencyMs;

  public LiveProxy(String host, int port, long latencyMs) {
    this.host = host;
    this.port = port;
    this.latencyMs = latencyMs;
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  /** Round trip of the last successful health probe, in milliseconds. */
  public long getLatencyMs() {
    return latencyMs;
  }

  @Override
  public String toString() {
    return host + ":" + port + " (" + latencyMs + " ms)";
  }
}
