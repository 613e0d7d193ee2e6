package org.proxyrotor;

import java.time.Duration;

/**
 * Performs one HTTP exchange through one upstream proxy. The pool calls this once per attempt; an
 * implementation opens a fresh tunnel, sends the request, buffers the response and closes the
 * tunnel before returning or throwing.
 *
 * <p>Implementations must report failures as {@link ProxyTimeoutException} when the deadline
 * expired and {@link ProxyTransportException} for everything else below HTTP, so the pool can apply
 * the right retry budget. Any HTTP status, including 4xx and 5xx, is a successful exchange.
 */
public interface TunnelTransport extends AutoCloseable {

  ProxyResponse exchange(ProxyRequest request, ProxyDescriptor proxy, Duration timeout);

  /** Releases I/O resources. Exchanges still in flight may fail afterwards. */
  @Override
  default void close() {}
}
