package org.proxyrotor.impl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.proxyrotor.ProxyEventKind;
import org.proxyrotor.ProxyEventRecorder;

/** Keeps every event for later assertions. */
final class RecordingEventRecorder implements ProxyEventRecorder {

  static final class Event {
    final ProxyEventKind kind;
    final Map<String, Object> details;

    Event(ProxyEventKind kind, Map<String, Object> details) {
      this.kind = kind;
      this.details = details;
    }

    Object get(String key) {
      return details.get(key);
    }

    @Override
    public String toString() {
      return kind + " " + details;
    }
  }

  private final List<Event> events = new ArrayList<>();

  @Override
  public synchronized void record(ProxyEventKind kind, Map<String, Object> details) {
    events.add(new Event(kind, new LinkedHashMap<>(details)));
  }

  synchronized List<Event> all() {
    return new ArrayList<>(events);
  }

  synchronized List<Event> of(ProxyEventKind kind) {
    List<Event> matching = new ArrayList<>();
    for (Event event : events) {
      if (event.kind == kind) {
        matching.add(event);
      }
    }
    return matching;
  }

  synchronized void clear() {
    events.clear();
  }
}
