package org.proxyrotor.impl;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import org.jspecify.annotations.Nullable;
import org.proxyrotor.AllProxiesFailedException;
import org.proxyrotor.CorrelationIdSource;
import org.proxyrotor.NoLiveProxiesException;
import org.proxyrotor.ProxyEventKind;
import org.proxyrotor.ProxyEventRecorder;
import org.proxyrotor.ProxyPoolException;
import org.proxyrotor.ProxyRequest;
import org.proxyrotor.ProxyResponse;
import org.proxyrotor.ProxyTimeoutException;
import org.proxyrotor.ProxyTransportException;
import org.proxyrotor.TunnelTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends one logical request, retrying on the same proxy and rotating to the next one on failure.
 *
 * <p>Each proxy gets {@code onTimeoutRetries} extra attempts after timeouts and {@code
 * onErrorRetries} after transport errors; the two budgets are independent and start afresh for
 * every proxy. A request gives up once it rotated away from {@code changeProxyLoop} times the
 * size of the live set, read when rotating.
 *
 * <p>Only the first proxy of a request comes from the shared {@link RotationSelector}. Rotations
 * walk the live set from the failed proxy onwards, so concurrent requests moving the shared cursor
 * never send a request back to a proxy it just gave up on.
 */
public class FailoverDispatcher {
  private static final Logger LOG = LoggerFactory.getLogger(FailoverDispatcher.class);

  private final ProxyRecordStore store;
  private final RotationSelector selector;
  private final TunnelTransport transport;
  private final PoolConfiguration configuration;
  private final ProxyEventRecorder recorder;
  @Nullable private final CorrelationIdSource correlationIds;

  public FailoverDispatcher(
      ProxyRecordStore store,
      RotationSelector selector,
      TunnelTransport transport,
      PoolConfiguration configuration,
      ProxyEventRecorder recorder,
      @Nullable CorrelationIdSource correlationIds) {
    this.store = store;
    this.selector = selector;
    this.transport = transport;
    this.configuration = configuration;
    this.recorder = recorder;
    this.correlationIds = correlationIds;
  }

  /**
   * @throws NoLiveProxiesException when no proxy is alive, before any attempt
   * @throws AllProxiesFailedException when every allowed attempt failed
   */
  public ProxyResponse dispatch(ProxyRequest request) {
    awaitFirstPass();
    bufferBody(request);

    @Nullable String correlationId = correlationIds != null ? correlationIds.nextId() : null;
    Duration timeout =
        request.getOptions().getTimeout() != null
            ? request.getOptions().getTimeout()
            : configuration.getMaxTimeout();

    ProxyEntry entry = selector.next();
    int position = Math.max(0, store.currentLiveSet().getEntries().indexOf(entry));
    int timeoutRetriesLeft = configuration.getOnTimeoutRetries();
    int errorRetriesLeft = configuration.getOnErrorRetries();
    int proxiesTried = 0;
    int attempts = 0;
    ProxyPoolException lastCause;

    while (true) {
      attempts++;
      recordSelected(request, entry, attempts, correlationId);
      try {
        ProxyResponse response = transport.exchange(request, entry.getDescriptor(), timeout);
        store.recordDispatchOutcome(entry, true);
        return response;
      } catch (ProxyTimeoutException e) {
        lastCause = e;
        recordFailed(request, entry, attempts, correlationId, e, "timeout");
        if (timeoutRetriesLeft > 0) {
          timeoutRetriesLeft--;
          LOG.debug("Retrying {} on {} after timeout", request, entry);
          continue;
        }
      } catch (ProxyTransportException e) {
        lastCause = e;
        recordFailed(request, entry, attempts, correlationId, e, e.getReason().name());
        if (errorRetriesLeft > 0) {
          errorRetriesLeft--;
          LOG.debug("Retrying {} on {} after {}", request, entry, e.getReason());
          continue;
        }
      }

      // rotate away from the exhausted proxy
      store.recordDispatchOutcome(entry, false);
      proxiesTried++;
      LiveSet live = store.currentLiveSet();
      if (live.isEmpty() || proxiesTried >= configuration.getChangeProxyLoop() * live.size()) {
        throw exhausted(request, entry, proxiesTried, attempts, correlationId, lastCause);
      }
      position = following(live, entry, position);
      entry = live.get(position);
      // keep later requests starting where a sequential rotation would leave them
      selector.advance();
      timeoutRetriesLeft = configuration.getOnTimeoutRetries();
      errorRetriesLeft = configuration.getOnErrorRetries();
    }
  }

  /**
   * Index of the entry after {@code failed} in {@code live}. When {@code failed} left the live set
   * the walk continues from {@code position}.
   */
  static int following(LiveSet live, ProxyEntry failed, int position) {
    int index = live.getEntries().indexOf(failed);
    return ((index >= 0 ? index : position) + 1) % live.size();
  }

  private void awaitFirstPass() {
    if (store.hasPublished()) {
      return;
    }
    try {
      store.awaitFirstPublish().get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProxyPoolException("Interrupted while waiting for the first health check", e);
    } catch (ExecutionException e) {
      throw new ProxyPoolException("First health check failed", e.getCause());
    }
  }

  // streamed bodies are drained once here so every attempt sends the same bytes
  private static void bufferBody(ProxyRequest request) {
    try {
      request.getOptions().getBody().bytes();
    } catch (UncheckedIOException e) {
      throw new ProxyPoolException("Could not read request body", e.getCause());
    }
  }

  private AllProxiesFailedException exhausted(
      ProxyRequest request,
      ProxyEntry last,
      int proxiesTried,
      int attempts,
      @Nullable String correlationId,
      ProxyPoolException lastCause) {
    LOG.warn(
        "Giving up on {} after {} attempts over {} proxies, last proxy {}",
        request,
        attempts,
        proxiesTried,
        last);
    Map<String, Object> details = details(request, last, attempts, correlationId);
    details.put("proxiesTried", proxiesTried);
    details.put("error", String.valueOf(lastCause.getMessage()));
    recorder.record(ProxyEventKind.REQUEST_EXHAUSTED, details);
    return new AllProxiesFailedException(proxiesTried, attempts, last.toString(), lastCause);
  }

  private void recordSelected(
      ProxyRequest request, ProxyEntry entry, int attempt, @Nullable String correlationId) {
    recorder.record(
        ProxyEventKind.PROXY_SELECTED, details(request, entry, attempt, correlationId));
  }

  private void recordFailed(
      ProxyRequest request,
      ProxyEntry entry,
      int attempt,
      @Nullable String correlationId,
      ProxyPoolException failure,
      String kind) {
    Map<String, Object> details = details(request, entry, attempt, correlationId);
    details.put("failure", kind);
    details.put("error", String.valueOf(failure.getMessage()));
    recorder.record(ProxyEventKind.PROXY_FAILED, details);
  }

  private static Map<String, Object> details(
      ProxyRequest request, ProxyEntry entry, int attempt, @Nullable String correlationId) {
    Map<String, Object> details = new LinkedHashMap<>();
    if (correlationId != null) {
      details.put("correlationId", correlationId);
    }
    details.put("method", request.getOptions().getMethod().name());
    details.put("url", request.getUrl());
    details.put("proxy", entry.toString());
    details.put("attempt", attempt);
    return details;
  }
}
