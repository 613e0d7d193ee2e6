package org.proxyrotor;

import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import java.time.Duration;
import java.util.Locale;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.proxyrotor.impl.HeaderAdapters;

/**
 * Per-request settings: method, headers, body and an optional timeout that overrides the pool's
 * {@code maxTimeout} for this request only. Instances are immutable and can be shared.
 */
@NullMarked
public final class RequestOptions {

  public static final RequestOptions DEFAULT = builder().build();

  private final HttpMethod method;
  private final HttpHeaders headers;
  private final RequestBody body;
  @Nullable private final Duration timeout;

  private RequestOptions(
      HttpMethod method, HttpHeaders headers, RequestBody body, @Nullable Duration timeout) {
    this.method = method;
    this.headers = headers;
    this.body = body;
    this.timeout = timeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  public HttpMethod getMethod() {
    return method;
  }

  /** A copy of the normalised request headers. */
  public HttpHeaders getHeaders() {
    return headers.copy();
  }

  public RequestBody getBody() {
    return body;
  }

  /** The timeout override, or {@code null} to use the pool's {@code maxTimeout}. */
  @Nullable
  public Duration getTimeout() {
    return timeout;
  }

  public Builder toBuilder() {
    Builder builder = new Builder().method(method).body(body);
    builder.headers.add(headers);
    builder.timeout = timeout;
    return builder;
  }

  public static final class Builder {
    private HttpMethod method = HttpMethod.GET;
    private final HttpHeaders headers = new DefaultHttpHeaders();
    private RequestBody body = RequestBody.empty();
    @Nullable private Duration timeout;

    private Builder() {}

    /** Default = GET */
    @CanIgnoreReturnValue
    public Builder method(String method) {
      return method(HttpMethod.valueOf(method.trim().toUpperCase(Locale.ROOT)));
    }

    @CanIgnoreReturnValue
    public Builder method(HttpMethod method) {
      this.method = requireNonNull(method, "method cannot be null");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder header(String name, Object value) {
      headers.add(name, value);
      return this;
    }

    /**
     * Adds every header of the given container. Accepts a {@code Map}, an iterable of map entries
     * (including Netty {@link HttpHeaders}) or a {@link java.net.http.HttpHeaders}.
     */
    @CanIgnoreReturnValue
    public Builder headers(@Nullable Object headerBag) {
      HeaderAdapters.addAll(headers, headerBag);
      return this;
    }

    /** Default = empty body */
    @CanIgnoreReturnValue
    public Builder body(RequestBody body) {
      this.body = requireNonNull(body, "body cannot be null");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder body(String text) {
      return body(RequestBody.of(text));
    }

    @CanIgnoreReturnValue
    public Builder json(Object value) {
      return body(RequestBody.json(value));
    }

    /** Default = the pool's {@code maxTimeout} */
    @CanIgnoreReturnValue
    public Builder timeout(Duration timeout) {
      if (timeout.isNegative() || timeout.isZero()) {
        throw new IllegalArgumentException("Request timeout must be positive: " + timeout);
      }
      this.timeout = timeout;
      return this;
    }

    public RequestOptions build() {
      return new RequestOptions(method, headers.copy(), body, timeout);
    }
  }
}
