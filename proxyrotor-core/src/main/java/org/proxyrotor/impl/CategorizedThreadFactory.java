package org.proxyrotor.impl;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Names threads {@code <pool name>-<category>-<n>} so thread dumps show which pool and which
 * concern a thread belongs to. All threads are daemons, so a forgotten pool never keeps the JVM
 * alive.
 */
public class CategorizedThreadFactory implements ThreadFactory {
  private static final Logger LOG = LoggerFactory.getLogger(CategorizedThreadFactory.class);

  private final String name;
  private final String category;
  private final AtomicInteger threadCount = new AtomicInteger(0);

  private static final Thread.UncaughtExceptionHandler UNCAUGHT_EXCEPTION_HANDLER =
      (t, e) -> LOG.error("Uncaught throwable in thread: {}", t.getName(), e);

  public CategorizedThreadFactory(String name, String category) {
    this.name = name;
    this.category = category;
  }

  @Override
  public Thread newThread(Runnable r) {
    Thread t = new Thread(r, name + "-" + category + "-" + threadCount.getAndIncrement());
    t.setDaemon(true);
    t.setUncaughtExceptionHandler(UNCAUGHT_EXCEPTION_HANDLER);
    return t;
  }
}
