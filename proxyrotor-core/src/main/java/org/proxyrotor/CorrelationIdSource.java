package org.proxyrotor;

/** Supplies opaque tokens that tag every attempt belonging to the same logical request. */
@FunctionalInterface
public interface CorrelationIdSource {
  String nextId();
}
