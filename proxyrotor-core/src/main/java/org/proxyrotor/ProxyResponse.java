package org.proxyrotor;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpUtil;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.proxyrotor.impl.JsonCodec;

/**
 * A fully buffered HTTP response received through one proxy. The body is exposed exactly as the
 * origin sent it (no decompression) and can be read once, through exactly one of {@link #text()},
 * {@link #json()}, {@link #json(Class)}, {@link #bytes()} or {@link #stream()}. Use {@link #copy()}
 * before reading to get an independent second reader.
 */
@NullMarked
public final class ProxyResponse {

  private final String url;
  private final int status;
  private final String statusText;
  private final HttpHeaders headers;
  private final byte[] body;
  private final ProxyDescriptor proxy;
  private final AtomicBoolean bodyUsed = new AtomicBoolean(false);

  public ProxyResponse(
      String url,
      int status,
      String statusText,
      HttpHeaders headers,
      byte[] body,
      ProxyDescriptor proxy) {
    this.url = requireNonNull(url, "url cannot be null");
    this.status = status;
    this.statusText = requireNonNull(statusText, "statusText cannot be null");
    this.headers = requireNonNull(headers, "headers cannot be null");
    this.body = requireNonNull(body, "body cannot be null");
    this.proxy = requireNonNull(proxy, "proxy cannot be null");
  }

  public String getUrl() {
    return url;
  }

  public int getStatus() {
    return status;
  }

  public String getStatusText() {
    return statusText;
  }

  /** True for a 2xx status. */
  public boolean ok() {
    return status >= 200 && status < 300;
  }

  /** Case-insensitive response headers. */
  public HttpHeaders getHeaders() {
    return headers;
  }

  @Nullable
  public String header(String name) {
    return headers.get(name);
  }

  @Nullable
  public String contentType() {
    return headers.get(HttpHeaderNames.CONTENT_TYPE);
  }

  /** Length of the buffered body, which always matches what a read returns. */
  public int contentLength() {
    return body.length;
  }

  /** The proxy that served this response. */
  public ProxyDescriptor getProxy() {
    return proxy;
  }

  public boolean bodyUsed() {
    return bodyUsed.get();
  }

  /** Decodes the body with the charset of the {@code Content-Type}, UTF-8 when absent. */
  public String text() {
    consume();
    return decode();
  }

  /**
   * Parses the body as JSON. A body that is not valid JSON comes back as a {@link TextNode}
   * holding the raw text.
   */
  public JsonNode json() {
    consume();
    if (body.length == 0) {
      return TextNode.valueOf("");
    }
    try {
      return JsonCodec.MAPPER.readTree(body);
    } catch (IOException e) {
      return TextNode.valueOf(decode());
    }
  }

  /** Binds the JSON body to {@code type}. */
  public <T> T json(Class<T> type) {
    consume();
    try {
      return JsonCodec.MAPPER.readValue(body, type);
    } catch (IOException e) {
      throw new ProxyPoolException(
          "Response body from " + url + " is not a JSON " + type.getSimpleName(), e);
    }
  }

  public byte[] bytes() {
    consume();
    return body.clone();
  }

  public InputStream stream() {
    consume();
    return new ByteArrayInputStream(body);
  }

  /**
   * An independent response over the same status, headers and body, with its own unread body.
   *
   * @throws BodyAlreadyConsumedException when this response's body was already read
   */
  public ProxyResponse copy() {
    if (bodyUsed.get()) {
      throw new BodyAlreadyConsumedException();
    }
    return new ProxyResponse(url, status, statusText, headers.copy(), body, proxy);
  }

  private void consume() {
    if (!bodyUsed.compareAndSet(false, true)) {
      throw new BodyAlreadyConsumedException();
    }
  }

  private String decode() {
    String contentType = contentType();
    Charset charset =
        contentType == null
            ? StandardCharsets.UTF_8
            : HttpUtil.getCharset(contentType, StandardCharsets.UTF_8);
    return new String(body, charset);
  }

  @Override
  public String toString() {
    return status + " " + statusText + " " + url + " via " + proxy;
  }
}
