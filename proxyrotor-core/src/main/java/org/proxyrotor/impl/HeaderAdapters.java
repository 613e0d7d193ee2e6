package org.proxyrotor.impl;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * Converts the header representations callers hand us into one canonical, case-insensitive
 * {@link HttpHeaders}. Accepted inputs:
 *
 * <ul>
 *   <li>{@code Map<String, ?>}, values being strings, iterables, arrays or anything with a useful
 *       {@code toString()}
 *   <li>any {@code Iterable<Map.Entry<String, ?>>}, which covers Netty's own {@link HttpHeaders}
 *   <li>{@link java.net.http.HttpHeaders}
 * </ul>
 *
 * Null names and null values are dropped.
 */
@NullMarked
public final class HeaderAdapters {

  private HeaderAdapters() {}

  public static HttpHeaders normalize(@Nullable Object headerBag) {
    HttpHeaders headers = new DefaultHttpHeaders();
    addAll(headers, headerBag);
    return headers;
  }

  public static void addAll(HttpHeaders target, @Nullable Object headerBag) {
    if (headerBag == null) {
      return;
    }
    if (headerBag instanceof java.net.http.HttpHeaders) {
      for (Map.Entry<String, List<String>> entry :
          ((java.net.http.HttpHeaders) headerBag).map().entrySet()) {
        addValue(target, entry.getKey(), entry.getValue());
      }
    } else if (headerBag instanceof Map) {
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) headerBag).entrySet()) {
        addValue(target, entry.getKey(), entry.getValue());
      }
    } else if (headerBag instanceof Iterable) {
      for (Object element : (Iterable<?>) headerBag) {
        if (!(element instanceof Map.Entry)) {
          throw new IllegalArgumentException(
              "Unsupported header element type: " + element.getClass().getName());
        }
        Map.Entry<?, ?> entry = (Map.Entry<?, ?>) element;
        addValue(target, entry.getKey(), entry.getValue());
      }
    } else {
      throw new IllegalArgumentException(
          "Unsupported header container type: " + headerBag.getClass().getName());
    }
  }

  private static void addValue(HttpHeaders target, @Nullable Object name, @Nullable Object value) {
    if (name == null || value == null) {
      return;
    }
    String headerName = name.toString().trim();
    if (headerName.isEmpty()) {
      return;
    }
    if (value instanceof Iterable) {
      for (Object single : (Iterable<?>) value) {
        if (single != null) {
          target.add(headerName, single.toString());
        }
      }
    } else if (value instanceof Object[]) {
      for (Object single : (Object[]) value) {
        if (single != null) {
          target.add(headerName, single.toString());
        }
      }
    } else {
      target.add(headerName, value.toString());
    }
  }
}
