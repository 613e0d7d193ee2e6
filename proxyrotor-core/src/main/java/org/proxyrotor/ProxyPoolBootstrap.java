package org.proxyrotor;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Duration;
import java.util.Collection;
import org.jspecify.annotations.NullMarked;

/**
 * Configures and starts a {@link ProxyPool}. Sensible defaults are available for all parameters, so
 * {@link #start()} can be called right after adding proxies.
 */
@NullMarked
public interface ProxyPoolBootstrap {

  /**
   * Give the pool a name (used for naming threads, useful for logging).
   *
   * <p>Default = ProxyRotor
   */
  @CanIgnoreReturnValue
  ProxyPoolBootstrap withName(String name);

  /** Adds the given proxies after any already configured. */
  @CanIgnoreReturnValue
  ProxyPoolBootstrap withProxies(Collection<ProxyDescriptor> proxies);

  @CanIgnoreReturnValue
  ProxyPoolBootstrap withProxy(ProxyDescriptor proxy);

  /**
   * Extra attempts on the same proxy after a transport error, before rotating.
   *
   * <p>Default = 0
   */
  @CanIgnoreReturnValue
  ProxyPoolBootstrap withOnErrorRetries(int retries);

  /**
   * Extra attempts on the same proxy after a timeout, before rotating.
   *
   * <p>Default = 0
   */
  @CanIgnoreReturnValue
  ProxyPoolBootstrap withOnTimeoutRetries(int retries);

  /**
   * Deadline of each attempt and of each health probe.
   *
   * <p>Default = 5 seconds
   */
  @CanIgnoreReturnValue
  ProxyPoolBootstrap withMaxTimeout(Duration timeout);

  /**
   * URL fetched through every proxy to decide whether it is alive.
   *
   * <p>Default = https://httpbin.org/ip
   */
  @CanIgnoreReturnValue
  ProxyPoolBootstrap withHealthCheckUrl(String url);

  /**
   * Delay between the end of one health pass and the start of the next.
   *
   * <p>Default = 60 seconds
   */
  @CanIgnoreReturnValue
  ProxyPoolBootstrap withHealthCheckInterval(Duration interval);

  /**
   * How many times a single request may cycle through the whole live set before giving up.
   *
   * <p>Default = 1
   */
  @CanIgnoreReturnValue
  ProxyPoolBootstrap withChangeProxyLoop(int loops);

  /**
   * Suppresses the activity log.
   *
   * <p>Default = false
   */
  @CanIgnoreReturnValue
  ProxyPoolBootstrap withDisableLogging(boolean disableLogging);

  /**
   * Maximum number of proxies probed at the same time.
   *
   * <p>Default = 16
   */
  @CanIgnoreReturnValue
  ProxyPoolBootstrap withProbeConcurrency(int concurrency);

  /**
   * User-Agent sent with health probes.
   *
   * <p>Default = ProxyRotor/1.0
   */
  @CanIgnoreReturnValue
  ProxyPoolBootstrap withUserAgent(String userAgent);

  /**
   * Largest response body that is buffered; bigger responses fail the attempt.
   *
   * <p>Default = 16 MiB
   */
  @CanIgnoreReturnValue
  ProxyPoolBootstrap withMaxResponseBytes(int maxResponseBytes);

  /**
   * Where pool events go. A recorder set here is used even when logging is disabled.
   *
   * <p>Default = an {@link org.proxyrotor.extras.ActivityLogger} in TEXT format, or nothing when
   * logging is disabled
   */
  @CanIgnoreReturnValue
  ProxyPoolBootstrap withEventRecorder(ProxyEventRecorder recorder);

  /**
   * Tags every request with a token shared by all of its attempts.
   *
   * <p>Default = none
   */
  @CanIgnoreReturnValue
  ProxyPoolBootstrap withCorrelationIdSource(CorrelationIdSource source);

  /**
   * Replaces the Netty SOCKS5 transport, for instance with a test double. The pool closes the
   * transport when it is closed.
   */
  @CanIgnoreReturnValue
  ProxyPoolBootstrap withTransport(TunnelTransport transport);

  /**
   * Builds and starts the pool. The first health pass begins immediately.
   *
   * @throws IllegalArgumentException when the configuration is invalid
   */
  ProxyPool start();
}
