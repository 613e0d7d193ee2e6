package org.proxyrotor.extras;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import org.proxyrotor.ProxyEventKind;
import org.proxyrotor.ProxyEventRecorder;
import org.proxyrotor.impl.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ProxyEventRecorder} that logs pool activity. Failures and exhausted requests are logged
 * at WARN, everything else at INFO.
 */
public class ActivityLogger implements ProxyEventRecorder {

  private static final Logger LOG = LoggerFactory.getLogger(ActivityLogger.class);
  public static final String ISO_8601_PATTERN = "yyyy-MM-dd'T'HH:mm:ss.SSSZ";

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern(ISO_8601_PATTERN, Locale.US);

  private final LogFormat logFormat;
  private final Clock clock;

  public ActivityLogger(LogFormat logFormat) {
    this(logFormat, Clock.systemUTC());
  }

  ActivityLogger(LogFormat logFormat, Clock clock) {
    this.logFormat = logFormat;
    this.clock = clock;
  }

  @Override
  public void record(ProxyEventKind kind, Map<String, Object> details) {
    String message = formatLogEntry(kind, details);
    if (kind == ProxyEventKind.PROXY_FAILED || kind == ProxyEventKind.REQUEST_EXHAUSTED) {
      warn(message);
    } else {
      log(message);
    }
  }

  protected void log(String message) {
    LOG.info(message);
  }

  protected void warn(String message) {
    LOG.warn(message);
  }

  String formatLogEntry(ProxyEventKind kind, Map<String, Object> details) {
    String timestamp = ZonedDateTime.now(clock).format(TIMESTAMP_FORMAT);
    StringBuilder sb = new StringBuilder();

    switch (logFormat) {
      case TEXT:
        sb.append(timestamp).append(' ').append(kind);
        for (Map.Entry<String, Object> detail : details.entrySet()) {
          sb.append(' ').append(detail.getKey()).append('=').append(detail.getValue());
        }
        break;

      case JSON:
        ObjectNode node = JsonCodec.MAPPER.createObjectNode();
        node.put("timestamp", timestamp);
        node.put("event", kind.name());
        for (Map.Entry<String, Object> detail : details.entrySet()) {
          node.set(detail.getKey(), JsonCodec.MAPPER.valueToTree(detail.getValue()));
        }
        try {
          sb.append(JsonCodec.MAPPER.writeValueAsString(node));
        } catch (JsonProcessingException e) {
          // an ObjectNode of plain values always serializes
          throw new IllegalStateException(e);
        }
        break;

      case LTSV:
        sb.append("time:").append(timestamp).append('\t');
        sb.append("event:").append(kind);
        for (Map.Entry<String, Object> detail : details.entrySet()) {
          sb.append('\t')
              .append(detail.getKey())
              .append(':')
              .append(ltsvValue(detail.getValue()));
        }
        break;
    }

    return sb.toString();
  }

  // LTSV values cannot contain tabs or line breaks
  private static String ltsvValue(Object value) {
    return String.valueOf(value).replace('\t', ' ').replace('\n', ' ').replace('\r', ' ');
  }
}
