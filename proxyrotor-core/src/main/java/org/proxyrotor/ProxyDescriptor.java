package org.proxyrotor;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * Describes one upstream SOCKS5 proxy: its address and optional credentials. Descriptors are the
 * construction input of a {@link ProxyPool}; the pool keeps its own runtime state for each of them.
 */
@NullMarked
public final class ProxyDescriptor {
  private final String host;
  private final int port;
  @Nullable private final String username;
  @Nullable private final String password;

  public ProxyDescriptor(
      String host, int port, @Nullable String username, @Nullable String password) {
    this.host = requireNonNull(host, "host cannot be null");
    this.port = port;
    this.username = username;
    this.password = password;
  }

  public static ProxyDescriptor of(String host, int port) {
    return new ProxyDescriptor(host, port, null, null);
  }

  public static ProxyDescriptor withCredentials(
      String host, int port, String username, String password) {
    return new ProxyDescriptor(host, port, username, password);
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  @Nullable
  public String getUsername() {
    return username;
  }

  @Nullable
  public String getPassword() {
    return password;
  }

  /** True when a username is configured; the password may still be empty. */
  public boolean hasCredentials() {
    return username != null && !username.isEmpty();
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) return true;
    if (!(o instanceof ProxyDescriptor)) return false;
    ProxyDescriptor that = (ProxyDescriptor) o;
    return port == that.port
        && host.equals(that.host)
        && Objects.equals(username, that.username)
        && Objects.equals(password, that.password);
  }

  @Override
  public int hashCode() {
    return Objects.hash(host, port, username, password);
  }

  @Override
  public String toString() {
    return host + ":" + port;
  }
}
