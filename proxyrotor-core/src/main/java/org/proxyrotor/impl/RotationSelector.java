package org.proxyrotor.impl;

import java.util.concurrent.atomic.AtomicReference;
import org.proxyrotor.NoLiveProxiesException;

/**
 * Round-robin cursor over the published {@link LiveSet}. The cursor and the snapshot it points
 * into are one immutable value replaced by compare-and-set, so a caller never reads an index of one
 * snapshot against the entries of another.
 *
 * <p>When the live set changes size, or the cursor points past its end, the cursor restarts at the
 * fastest proxy.
 */
public class RotationSelector {

  private static final class Cursor {
    final LiveSet snapshot;
    final int index;

    Cursor(LiveSet snapshot, int index) {
      this.snapshot = snapshot;
      this.index = index;
    }
  }

  private final ProxyRecordStore store;
  private final AtomicReference<Cursor> cursor =
      new AtomicReference<>(new Cursor(LiveSet.empty(), 0));

  public RotationSelector(ProxyRecordStore store) {
    this.store = store;
  }

  /**
   * The entry under the cursor.
   *
   * @throws NoLiveProxiesException when the live set is empty
   */
  public ProxyEntry current() {
    while (true) {
      Cursor seen = cursor.get();
      LiveSet live = store.currentLiveSet();
      if (live.isEmpty()) {
        throw new NoLiveProxiesException();
      }
      Cursor aligned = align(seen, live);
      if (aligned == seen || cursor.compareAndSet(seen, aligned)) {
        return live.get(aligned.index);
      }
    }
  }

  /** Moves the cursor to the next entry, wrapping after the last one. No-op on an empty set. */
  public void advance() {
    while (true) {
      Cursor seen = cursor.get();
      LiveSet live = store.currentLiveSet();
      if (live.isEmpty()) {
        return;
      }
      Cursor aligned = align(seen, live);
      if (cursor.compareAndSet(seen, new Cursor(live, (aligned.index + 1) % live.size()))) {
        return;
      }
    }
  }

  /**
   * Returns the entry under the cursor and advances past it in one atomic step, so concurrent
   * callers are spread over the live set.
   *
   * @throws NoLiveProxiesException when the live set is empty
   */
  public ProxyEntry next() {
    while (true) {
      Cursor seen = cursor.get();
      LiveSet live = store.currentLiveSet();
      if (live.isEmpty()) {
        throw new NoLiveProxiesException();
      }
      Cursor aligned = align(seen, live);
      if (cursor.compareAndSet(seen, new Cursor(live, (aligned.index + 1) % live.size()))) {
        return live.get(aligned.index);
      }
    }
  }

  private static Cursor align(Cursor seen, LiveSet live) {
    if (seen.snapshot == live) {
      return seen;
    }
    if (seen.snapshot.size() != live.size() || seen.index >= live.size()) {
      return new Cursor(live, 0);
    }
    return new Cursor(live, seen.index);
  }
}
