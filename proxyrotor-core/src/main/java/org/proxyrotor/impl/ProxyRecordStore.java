package org.proxyrotor.impl;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.proxyrotor.ProxyDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns every {@link ProxyEntry} of a pool and the currently visible {@link LiveSet}. Readers get
 * the latest published set without blocking; the health monitor replaces it wholesale after each
 * pass.
 */
public class ProxyRecordStore {
  private static final Logger LOG = LoggerFactory.getLogger(ProxyRecordStore.class);

  private final List<ProxyEntry> entries;
  private final Clock clock;
  private final AtomicReference<LiveSet> liveSet = new AtomicReference<>(LiveSet.empty());
  private final AtomicLong sequence = new AtomicLong();
  private final CompletableFuture<LiveSet> firstPublish = new CompletableFuture<>();

  public ProxyRecordStore(Collection<ProxyDescriptor> descriptors) {
    this(descriptors, Clock.systemUTC());
  }

  public ProxyRecordStore(Collection<ProxyDescriptor> descriptors, Clock clock) {
    List<ProxyEntry> list = new ArrayList<>(descriptors.size());
    int index = 0;
    for (ProxyDescriptor descriptor : descriptors) {
      list.add(new ProxyEntry(descriptor, index++));
    }
    this.entries = Collections.unmodifiableList(list);
    this.clock = clock;
  }

  /** Every configured entry in configuration order; the list never changes. */
  public List<ProxyEntry> allEntries() {
    return entries;
  }

  /** Stores the probe result. A passed probe also clears the entry's failure counter. */
  public void updateProbe(ProxyEntry entry, ProbeOutcome outcome) {
    entry.recordProbe(outcome);
    if (outcome.isAlive()) {
      entry.recordSuccess();
    } else {
      LOG.debug("Proxy {} failed its health check: {}", entry, outcome.getError());
    }
  }

  /** A successful dispatch resets the entry's failure counter, a failed one increments it. */
  public void recordDispatchOutcome(ProxyEntry entry, boolean success) {
    if (success) {
      entry.recordSuccess();
    } else {
      entry.recordFailure();
    }
  }

  /** Builds a snapshot of the entries that are alive right now. Does not publish it. */
  public LiveSet snapshotLiveSet() {
    return LiveSet.of(sequence.incrementAndGet(), clock.instant(), entries);
  }

  public void publishLiveSet(LiveSet set) {
    liveSet.set(set);
    if (firstPublish.complete(set)) {
      LOG.debug("First live set published with {} proxies", set.size());
    }
  }

  public LiveSet currentLiveSet() {
    return liveSet.get();
  }

  /** Completes when the first live set is published, or when {@link #releaseWaiters()} ran. */
  public CompletableFuture<LiveSet> awaitFirstPublish() {
    return firstPublish;
  }

  public boolean hasPublished() {
    return firstPublish.isDone();
  }

  /**
   * Releases callers waiting for a first live set that will never come; they see the current,
   * empty, set.
   */
  void releaseWaiters() {
    firstPublish.complete(liveSet.get());
  }
}
