package org.proxyrotor.impl;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.proxyrotor.LiveProxy;

/**
 * Immutable snapshot of the alive proxies, fastest first. Entries with equal latency keep their
 * configuration order. Each published set carries a higher sequence number than the one before.
 */
public final class LiveSet {

  private static final LiveSet EMPTY =
      new LiveSet(0, Instant.EPOCH, Collections.emptyList(), new long[0]);

  private final long sequence;
  private final Instant publishedAt;
  private final List<ProxyEntry> entries;
  // latency of each entry when the snapshot was taken
  private final long[] latencies;

  private LiveSet(long sequence, Instant publishedAt, List<ProxyEntry> entries, long[] latencies) {
    this.sequence = sequence;
    this.publishedAt = publishedAt;
    this.entries = entries;
    this.latencies = latencies;
  }

  public static LiveSet empty() {
    return EMPTY;
  }

  /** Snapshots the entries that are alive right now. */
  static LiveSet of(long sequence, Instant publishedAt, List<ProxyEntry> allEntries) {
    List<Member> members = new ArrayList<>();
    for (ProxyEntry entry : allEntries) {
      ProbeOutcome outcome = entry.getOutcome();
      if (outcome.isAlive()) {
        members.add(new Member(entry, outcome.getLatencyMs()));
      }
    }
    members.sort(
        Comparator.comparingLong((Member m) -> m.latencyMs)
            .thenComparingInt(m -> m.entry.getIndex()));
    List<ProxyEntry> sorted = new ArrayList<>(members.size());
    long[] latencies = new long[members.size()];
    for (int i = 0; i < members.size(); i++) {
      sorted.add(members.get(i).entry);
      latencies[i] = members.get(i).latencyMs;
    }
    return new LiveSet(sequence, publishedAt, Collections.unmodifiableList(sorted), latencies);
  }

  private static final class Member {
    final ProxyEntry entry;
    final long latencyMs;

    Member(ProxyEntry entry, long latencyMs) {
      this.entry = entry;
      this.latencyMs = latencyMs;
    }
  }

  public long getSequence() {
    return sequence;
  }

  public Instant getPublishedAt() {
    return publishedAt;
  }

  public List<ProxyEntry> getEntries() {
    return entries;
  }

  public ProxyEntry get(int index) {
    return entries.get(index);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public List<LiveProxy> toLiveProxies() {
    List<LiveProxy> result = new ArrayList<>(entries.size());
    for (int i = 0; i < entries.size(); i++) {
      ProxyEntry entry = entries.get(i);
      result.add(
          new LiveProxy(
              entry.getDescriptor().getHost(), entry.getDescriptor().getPort(), latencies[i]));
    }
    return result;
  }

  @Override
  public String toString() {
    return "LiveSet#" + sequence + entries;
  }
}
