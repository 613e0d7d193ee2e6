package org.proxyrotor;

import static java.util.Objects.requireNonNull;

import java.net.URI;
import java.util.Locale;
import org.jspecify.annotations.NullMarked;

/** An absolute {@code http} or {@code https} URL and the {@link RequestOptions} to send it with. */
@NullMarked
public final class ProxyRequest {

  private final URI uri;
  private final RequestOptions options;

  private ProxyRequest(URI uri, RequestOptions options) {
    this.uri = uri;
    this.options = options;
  }

  public static ProxyRequest of(String url) {
    return of(url, RequestOptions.DEFAULT);
  }

  /**
   * @throws IllegalArgumentException when the URL is not absolute or its scheme is neither {@code
   *     http} nor {@code https}
   */
  public static ProxyRequest of(String url, RequestOptions options) {
    requireNonNull(url, "url cannot be null");
    URI uri = URI.create(url.trim());
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException("Only http and https URLs are supported: " + url);
    }
    if (uri.getHost() == null || uri.getHost().isEmpty()) {
      throw new IllegalArgumentException("URL has no host: " + url);
    }
    return new ProxyRequest(uri, requireNonNull(options, "options cannot be null"));
  }

  public URI getUri() {
    return uri;
  }

  public String getUrl() {
    return uri.toString();
  }

  public RequestOptions getOptions() {
    return options;
  }

  public boolean isSecure() {
    return "https".equalsIgnoreCase(uri.getScheme());
  }

  public String getHost() {
    String host = uri.getHost();
    // IPv6 literals come back bracketed
    if (host.startsWith("[") && host.endsWith("]")) {
      return host.substring(1, host.length() - 1);
    }
    return host;
  }

  public int getPort() {
    if (uri.getPort() != -1) {
      return uri.getPort();
    }
    return isSecure() ? 443 : 80;
  }

  /** Value of the {@code Host} header: the host, plus the port when it is not the default one. */
  public String getHostHeader() {
    return uri.getPort() == -1 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
  }

  /** The request target sent on the request line: raw path and query, never the fragment. */
  public String getPathAndQuery() {
    String path = uri.getRawPath();
    if (path == null || path.isEmpty()) {
      path = "/";
    }
    return uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery();
  }

  @Override
  public String toString() {
    return options.getMethod() + " " + uri;
  }
}
