package org.proxyrotor;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A set of SOCKS5 proxies that is health checked in the background and used to send HTTP
 * requests with automatic failover. Create one with {@link
 * org.proxyrotor.impl.DefaultProxyPool#bootstrap()}.
 *
 * <p>Requests issued before the first health pass finished wait for it. A request that finds no
 * live proxy fails with {@link NoLiveProxiesException} without touching the network.
 */
public interface ProxyPool extends AutoCloseable {

  /** Sends a {@code GET} to {@code url}. */
  ProxyResponse request(String url);

  ProxyResponse request(String url, RequestOptions options);

  /**
   * Sends the request through the current proxy, retrying and rotating on timeouts and transport
   * errors. Any HTTP status counts as success.
   *
   * @throws NoLiveProxiesException when the live set is empty
   * @throws AllProxiesFailedException when the rotation budget is used up
   */
  ProxyResponse request(ProxyRequest request);

  /** Same as {@link #request(ProxyRequest)}, on the pool's dispatch threads. */
  CompletableFuture<ProxyResponse> requestAsync(ProxyRequest request);

  /**
   * Completes once the first health pass finished with a copy of the live proxies, fastest first.
   * Completes with an empty list if the pool is stopped before that pass ran.
   */
  CompletableFuture<List<LiveProxy>> getLiveProxiesList();

  /** The configured proxies, alive or not, in configuration order. */
  List<ProxyDescriptor> getProxies();

  /** Stops health checking. Idempotent. Requests can still be sent over the last live set. */
  void stop();

  /** Stops the pool and releases its threads and network resources. Idempotent. */
  @Override
  void close();
}
