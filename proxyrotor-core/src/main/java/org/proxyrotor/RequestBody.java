package org.proxyrotor;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.proxyrotor.impl.JsonCodec;

/**
 * The payload of a {@link ProxyRequest}. Bodies are sent byte for byte; the pool never re-encodes
 * them. A body may be sent more than once when a request is retried, so every variant replays the
 * same bytes on each attempt.
 */
@NullMarked
public abstract class RequestBody {

  public static final String TEXT_PLAIN = "text/plain; charset=UTF-8";
  public static final String APPLICATION_JSON = "application/json";
  public static final String FORM_URLENCODED = "application/x-www-form-urlencoded";
  public static final String OCTET_STREAM = "application/octet-stream";

  private static final byte[] NO_BYTES = new byte[0];
  private static final RequestBody EMPTY = new BufferedBody(NO_BYTES, null);

  /** Value sent as {@code Content-Type} unless the caller set that header. */
  @Nullable
  public abstract String contentType();

  /**
   * The full payload. Callers must not modify the returned array.
   *
   * @throws UncheckedIOException when a streamed body cannot be read
   */
  public abstract byte[] bytes();

  public boolean isEmpty() {
    return bytes().length == 0;
  }

  public static RequestBody empty() {
    return EMPTY;
  }

  public static RequestBody of(byte[] bytes, @Nullable String contentType) {
    return new BufferedBody(bytes.clone(), contentType);
  }

  public static RequestBody of(String text) {
    return of(text, TEXT_PLAIN);
  }

  public static RequestBody of(String text, @Nullable String contentType) {
    return new BufferedBody(text.getBytes(StandardCharsets.UTF_8), contentType);
  }

  /**
   * A JSON body. Strings are taken to be JSON already and sent as they are; any other value is
   * serialized with Jackson.
   */
  public static RequestBody json(Object value) {
    if (value instanceof String) {
      return of((String) value, APPLICATION_JSON);
    }
    try {
      return new BufferedBody(JsonCodec.MAPPER.writeValueAsBytes(value), APPLICATION_JSON);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize request body as JSON", e);
    }
  }

  /**
   * A body read from a stream. The stream is drained the first time the body is needed and
   * closed afterwards; retries reuse the buffered bytes.
   */
  public static RequestBody of(InputStream stream, @Nullable String contentType) {
    return new StreamedBody(stream, contentType);
  }

  /** An {@code application/x-www-form-urlencoded} body, fields in iteration order. */
  public static RequestBody form(Map<String, ?> fields) {
    return form(fields.entrySet());
  }

  /** An {@code application/x-www-form-urlencoded} body; repeated names are kept. */
  public static RequestBody form(Iterable<? extends Map.Entry<String, ?>> fields) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, ?> field : fields) {
      if (field.getValue() == null) {
        continue;
      }
      if (sb.length() > 0) {
        sb.append('&');
      }
      sb.append(URLEncoder.encode(field.getKey(), StandardCharsets.UTF_8))
          .append('=')
          .append(URLEncoder.encode(String.valueOf(field.getValue()), StandardCharsets.UTF_8));
    }
    return of(sb.toString(), FORM_URLENCODED);
  }

  private static final class BufferedBody extends RequestBody {
    private final byte[] bytes;
    @Nullable private final String contentType;

    BufferedBody(byte[] bytes, @Nullable String contentType) {
      this.bytes = bytes;
      this.contentType = contentType;
    }

    @Override
    @Nullable
    public String contentType() {
      return contentType;
    }

    @Override
    public byte[] bytes() {
      return bytes;
    }
  }

  private static final class StreamedBody extends RequestBody {
    @Nullable private InputStream stream;
    @Nullable private final String contentType;
    private byte @Nullable [] buffered;

    StreamedBody(InputStream stream, @Nullable String contentType) {
      this.stream = requireNonNull(stream, "stream cannot be null");
      this.contentType = contentType;
    }

    @Override
    @Nullable
    public String contentType() {
      return contentType;
    }

    @Override
    public synchronized byte[] bytes() {
      if (buffered == null) {
        if (stream == null) {
          throw new UncheckedIOException(new IOException("Request body stream failed earlier"));
        }
        try (InputStream in = stream) {
          buffered = in.readAllBytes();
        } catch (IOException e) {
          throw new UncheckedIOException("Could not read request body stream", e);
        } finally {
          stream = null;
        }
      }
      return buffered;
    }
  }
}
