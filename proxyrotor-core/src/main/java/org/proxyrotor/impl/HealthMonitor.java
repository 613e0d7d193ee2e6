package org.proxyrotor.impl;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.jspecify.annotations.Nullable;
import org.proxyrotor.ProxyEventKind;
import org.proxyrotor.ProxyEventRecorder;
import org.proxyrotor.ProxyPoolException;
import org.proxyrotor.ProxyRequest;
import org.proxyrotor.ProxyResponse;
import org.proxyrotor.RequestOptions;
import org.proxyrotor.TunnelTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically probes every proxy and publishes the resulting {@link LiveSet}.
 *
 * <p>The first pass starts as soon as {@link #start()} is called. Later passes start {@code
 * healthCheckInterval} after the previous one finished, so passes never overlap. Within a pass
 * all proxies are probed concurrently on a bounded executor and the new live set is published once
 * every probe settled.
 */
public class HealthMonitor {
  private static final Logger LOG = LoggerFactory.getLogger(HealthMonitor.class);

  private final ProxyRecordStore store;
  private final TunnelTransport transport;
  private final PoolConfiguration configuration;
  private final ProxyEventRecorder recorder;
  private final Clock clock;
  private final ScheduledExecutorService scheduler;
  private final ExecutorService probeExecutor;
  private final ProxyRequest probeRequest;

  private final AtomicBoolean started = new AtomicBoolean(false);

  /** True once {@link #stop()} ran. No pass starts afterwards. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  private final AtomicLong completedPasses = new AtomicLong();
  @Nullable private volatile ScheduledFuture<?> schedule;

  public HealthMonitor(
      String poolName,
      ProxyRecordStore store,
      TunnelTransport transport,
      PoolConfiguration configuration,
      ProxyEventRecorder recorder) {
    this(poolName, store, transport, configuration, recorder, Clock.systemUTC());
  }

  HealthMonitor(
      String poolName,
      ProxyRecordStore store,
      TunnelTransport transport,
      PoolConfiguration configuration,
      ProxyEventRecorder recorder,
      Clock clock) {
    this.store = store;
    this.transport = transport;
    this.configuration = configuration;
    this.recorder = recorder;
    this.clock = clock;
    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(
            new CategorizedThreadFactory(poolName, "HealthCheck"));
    this.probeExecutor =
        Executors.newFixedThreadPool(
            configuration.getProbeConcurrency(), new CategorizedThreadFactory(poolName, "Probe"));
    this.probeRequest =
        ProxyRequest.of(
            configuration.getHealthCheckUrl(),
            RequestOptions.builder()
                .header("User-Agent", configuration.getUserAgent())
                .header("Accept", "*/*")
                .timeout(configuration.getMaxTimeout())
                .build());
  }

  /** Schedules the passes. The first one runs right away. Calling this twice has no effect. */
  public void start() {
    if (stopped.get() || !started.compareAndSet(false, true)) {
      return;
    }
    long intervalMs = configuration.getHealthCheckInterval().toMillis();
    schedule =
        scheduler.scheduleWithFixedDelay(
            this::scheduledPass, 0, intervalMs, TimeUnit.MILLISECONDS);
    LOG.info(
        "Health checking {} proxies every {} ms against {}",
        store.allEntries().size(),
        intervalMs,
        configuration.getHealthCheckUrl());
  }

  private void scheduledPass() {
    if (stopped.get()) {
      return;
    }
    try {
      checkNow();
    } catch (RuntimeException e) {
      // an exception escaping here cancels all later passes
      LOG.error("Health check pass failed", e);
    }
  }

  /**
   * Runs one pass on the calling thread and publishes its result.
   *
   * @return the published live set
   */
  public synchronized LiveSet checkNow() {
    long startNanos = System.nanoTime();
    List<ProxyEntry> entries = store.allEntries();
    List<CompletableFuture<Void>> probes = new ArrayList<>(entries.size());
    for (ProxyEntry entry : entries) {
      CompletableFuture<Void> probe;
      try {
        probe = CompletableFuture.runAsync(() -> probeAndRecord(entry), probeExecutor);
      } catch (RejectedExecutionException e) {
        // the pool is shutting down; leave the remaining entries as they were
        LOG.debug("Probe of {} not started, monitor stopped", entry);
        break;
      }
      probes.add(probe);
    }
    CompletableFuture.allOf(probes.toArray(new CompletableFuture<?>[0])).join();

    LiveSet live = store.snapshotLiveSet();
    store.publishLiveSet(live);
    long pass = completedPasses.incrementAndGet();
    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    LOG.debug(
        "Health pass {} done in {} ms: {} of {} proxies alive",
        pass,
        durationMs,
        live.size(),
        entries.size());

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("pass", pass);
    details.put("total", entries.size());
    details.put("alive", live.size());
    details.put("durationMs", durationMs);
    recorder.record(ProxyEventKind.HEALTH_CHECK_COMPLETED, details);
    return live;
  }

  private void probeAndRecord(ProxyEntry entry) {
    store.updateProbe(entry, probe(entry));
  }

  /** Probes one proxy. Never throws: every failure becomes a dead outcome. */
  ProbeOutcome probe(ProxyEntry entry) {
    Duration timeout = configuration.getMaxTimeout();
    long startNanos = System.nanoTime();
    try {
      ProxyResponse response = transport.exchange(probeRequest, entry.getDescriptor(), timeout);
      long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
      if (response.ok()) {
        return ProbeOutcome.alive(latencyMs, clock.instant());
      }
      return ProbeOutcome.dead("HTTP " + response.getStatus(), clock.instant());
    } catch (ProxyPoolException e) {
      return ProbeOutcome.dead(String.valueOf(e.getMessage()), clock.instant());
    } catch (RuntimeException e) {
      LOG.warn("Unexpected error probing {}", entry, e);
      return ProbeOutcome.dead(e.toString(), clock.instant());
    }
  }

  /** Number of passes that completed so far. */
  public long getCompletedPasses() {
    return completedPasses.get();
  }

  public boolean isStopped() {
    return stopped.get();
  }

  /**
   * Cancels the schedule and releases anyone waiting for a first pass that will now never come. A
   * pass that is already running finishes, but no new pass starts. Idempotent.
   */
  public void stop() {
    if (stopped.compareAndSet(false, true)) {
      ScheduledFuture<?> current = schedule;
      if (current != null) {
        current.cancel(false);
      }
      scheduler.shutdown();
      probeExecutor.shutdown();
      store.releaseWaiters();
      LOG.info("Health checking stopped after {} passes", completedPasses.get());
    }
  }
}
