package org.proxyrotor.impl;

import static java.util.Objects.requireNonNull;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.proxyrotor.CorrelationIdSource;
import org.proxyrotor.LiveProxy;
import org.proxyrotor.ProxyDescriptor;
import org.proxyrotor.ProxyEventRecorder;
import org.proxyrotor.ProxyPool;
import org.proxyrotor.ProxyPoolBootstrap;
import org.proxyrotor.ProxyRequest;
import org.proxyrotor.ProxyResponse;
import org.proxyrotor.RequestOptions;
import org.proxyrotor.TunnelTransport;
import org.proxyrotor.extras.ActivityLogger;
import org.proxyrotor.extras.LogFormat;
import org.proxyrotor.extras.ProxyListParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Primary implementation of a {@link ProxyPool}.
 *
 * <p>{@link DefaultProxyPool} is configured and started through {@link #bootstrap()} or {@link
 * #bootstrapFromFile(String)}, and then calling {@link ProxyPoolBootstrap#start()}. For example:
 *
 * <pre>
 * ProxyPool pool =
 *     DefaultProxyPool.bootstrap()
 *         .withProxy(ProxyDescriptor.of(&quot;10.0.0.1&quot;, 1080))
 *         .withMaxTimeout(Duration.ofSeconds(3))
 *         .start();
 * </pre>
 */
@NullMarked
public class DefaultProxyPool implements ProxyPool {

  private static final Logger LOG = LoggerFactory.getLogger(DefaultProxyPool.class);

  public static final String DEFAULT_PROXY_POOL_NAME = "ProxyRotor";

  static final String ON_ERROR_RETRIES = "on_error_retries";
  static final String ON_TIMEOUT_RETRIES = "on_timeout_retries";
  static final String MAX_TIMEOUT_MS = "max_timeout_ms";
  static final String HEALTH_CHECK_URL = "health_check_url";
  static final String HEALTH_CHECK_INTERVAL_MS = "health_check_interval_ms";
  static final String CHANGE_PROXY_LOOP = "change_proxy_loop";
  static final String DISABLE_LOGGING = "disable_logging";
  static final String PROBE_CONCURRENCY = "probe_concurrency";
  static final String ACTIVITY_LOG_FORMAT = "activity_log_format";
  static final String PROXIES = "proxies";
  static final String PROXIES_FILE = "proxies_file";

  private final String name;
  private final PoolConfiguration configuration;
  private final ProxyRecordStore store;
  private final HealthMonitor healthMonitor;
  private final FailoverDispatcher dispatcher;
  private final TunnelTransport transport;
  private final ExecutorService dispatchExecutor;

  /** True once {@link #stop()} or {@link #close()} ran. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  private final AtomicBoolean closed = new AtomicBoolean(false);

  /** Bootstrap a new {@link DefaultProxyPool} starting from scratch. */
  public static ProxyPoolBootstrap bootstrap() {
    return new DefaultProxyPoolBootstrap();
  }

  /**
   * Bootstrap a new {@link DefaultProxyPool} using defaults from the given properties file.
   *
   * @throws IllegalArgumentException when the file cannot be read
   */
  public static ProxyPoolBootstrap bootstrapFromFile(String path) {
    final File propsFile = new File(path);
    Properties props = new Properties();

    if (propsFile.isFile()) {
      try (InputStream is = new FileInputStream(propsFile)) {
        props.load(is);
      } catch (final IOException e) {
        LOG.error("Could not load props file", e);
        throw new IllegalArgumentException("Could not load props file. " + e.getMessage(), e);
      }
    } else {
      String cause = !propsFile.exists() ? "absent" : "a directory";
      LOG.error("Could not load props file. file is {}", cause);
      throw new IllegalArgumentException("Could not load props file. file is " + cause);
    }

    return new DefaultProxyPoolBootstrap(props, propsFile.getAbsoluteFile().getParentFile());
  }

  private DefaultProxyPool(
      String name,
      PoolConfiguration configuration,
      List<ProxyDescriptor> proxies,
      TunnelTransport transport,
      ProxyEventRecorder recorder,
      @Nullable CorrelationIdSource correlationIds) {
    this.name = name;
    this.configuration = configuration;
    this.transport = transport;
    this.store = new ProxyRecordStore(proxies);
    ProxyEventRecorder safeRecorder = new SafeEventRecorder(recorder);
    this.healthMonitor = new HealthMonitor(name, store, transport, configuration, safeRecorder);
    this.dispatcher =
        new FailoverDispatcher(
            store,
            new RotationSelector(store),
            transport,
            configuration,
            safeRecorder,
            correlationIds);
    this.dispatchExecutor =
        Executors.newCachedThreadPool(new CategorizedThreadFactory(name, "Dispatch"));
  }

  private DefaultProxyPool start() {
    LOG.info(
        "Starting proxy pool {} with {} proxies, {}",
        name,
        store.allEntries().size(),
        configuration);
    healthMonitor.start();
    return this;
  }

  @Override
  public ProxyResponse request(String url) {
    return request(ProxyRequest.of(url));
  }

  @Override
  public ProxyResponse request(String url, RequestOptions options) {
    return request(ProxyRequest.of(url, options));
  }

  @Override
  public ProxyResponse request(ProxyRequest request) {
    return dispatcher.dispatch(requireNonNull(request, "request cannot be null"));
  }

  @Override
  public CompletableFuture<ProxyResponse> requestAsync(ProxyRequest request) {
    requireNonNull(request, "request cannot be null");
    return CompletableFuture.supplyAsync(() -> dispatcher.dispatch(request), dispatchExecutor);
  }

  @Override
  public CompletableFuture<List<LiveProxy>> getLiveProxiesList() {
    return store.awaitFirstPublish().thenApply(first -> store.currentLiveSet().toLiveProxies());
  }

  @Override
  public List<ProxyDescriptor> getProxies() {
    List<ProxyDescriptor> proxies = new ArrayList<>(store.allEntries().size());
    for (ProxyEntry entry : store.allEntries()) {
      proxies.add(entry.getDescriptor());
    }
    return Collections.unmodifiableList(proxies);
  }

  public String getName() {
    return name;
  }

  public PoolConfiguration getConfiguration() {
    return configuration;
  }

  /** Runtime records of every configured proxy, for diagnostics. */
  public List<ProxyEntry> getEntries() {
    return store.allEntries();
  }

  /** Runs a health pass right now, on the calling thread. */
  public List<LiveProxy> checkNow() {
    return healthMonitor.checkNow().toLiveProxies();
  }

  HealthMonitor getHealthMonitor() {
    return healthMonitor;
  }

  @Override
  public void stop() {
    if (stopped.compareAndSet(false, true)) {
      LOG.info("Stopping proxy pool {}", name);
      healthMonitor.stop();
    }
  }

  @Override
  public void close() {
    stop();
    if (closed.compareAndSet(false, true)) {
      dispatchExecutor.shutdown();
      try {
        transport.close();
      } catch (RuntimeException e) {
        LOG.warn("Error closing transport of proxy pool {}", name, e);
      }
      LOG.info("Done shutting down proxy pool {}", name);
    }
  }

  private static class DefaultProxyPoolBootstrap implements ProxyPoolBootstrap {
    private String name = DEFAULT_PROXY_POOL_NAME;
    private final List<ProxyDescriptor> proxies = new ArrayList<>();
    private int onErrorRetries = PoolConfiguration.DEFAULT_ON_ERROR_RETRIES;
    private int onTimeoutRetries = PoolConfiguration.DEFAULT_ON_TIMEOUT_RETRIES;
    private Duration maxTimeout = PoolConfiguration.DEFAULT_MAX_TIMEOUT;
    private String healthCheckUrl = PoolConfiguration.DEFAULT_HEALTH_CHECK_URL;
    private Duration healthCheckInterval = PoolConfiguration.DEFAULT_HEALTH_CHECK_INTERVAL;
    private int changeProxyLoop = PoolConfiguration.DEFAULT_CHANGE_PROXY_LOOP;
    private boolean disableLogging;
    private int probeConcurrency = PoolConfiguration.DEFAULT_PROBE_CONCURRENCY;
    private String userAgent = PoolConfiguration.DEFAULT_USER_AGENT;
    private int maxResponseBytes = PoolConfiguration.DEFAULT_MAX_RESPONSE_BYTES;
    private LogFormat logFormat = LogFormat.TEXT;
    @Nullable private ProxyEventRecorder recorder;
    @Nullable private CorrelationIdSource correlationIds;
    @Nullable private TunnelTransport transport;

    private DefaultProxyPoolBootstrap() {}

    private DefaultProxyPoolBootstrap(Properties props, @Nullable File baseDirectory) {
      onErrorRetries = ProxyUtils.extractInt(props, ON_ERROR_RETRIES, onErrorRetries);
      onTimeoutRetries = ProxyUtils.extractInt(props, ON_TIMEOUT_RETRIES, onTimeoutRetries);
      maxTimeout = ProxyUtils.extractMillis(props, MAX_TIMEOUT_MS, maxTimeout);
      healthCheckInterval =
          ProxyUtils.extractMillis(props, HEALTH_CHECK_INTERVAL_MS, healthCheckInterval);
      changeProxyLoop = ProxyUtils.extractInt(props, CHANGE_PROXY_LOOP, changeProxyLoop);
      disableLogging = ProxyUtils.extractBooleanDefaultFalse(props, DISABLE_LOGGING);
      probeConcurrency = ProxyUtils.extractInt(props, PROBE_CONCURRENCY, probeConcurrency);
      String url = ProxyUtils.extractString(props, HEALTH_CHECK_URL);
      if (url != null) {
        healthCheckUrl = url;
      }
      String format = ProxyUtils.extractString(props, ACTIVITY_LOG_FORMAT);
      if (format != null) {
        try {
          logFormat = LogFormat.valueOf(format.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
          LOG.warn("Unknown activity log format requested in properties: {}", format);
        }
      }
      String inline = ProxyUtils.extractString(props, PROXIES);
      if (inline != null) {
        proxies.addAll(ProxyListParser.parseList(inline));
      }
      String file = ProxyUtils.extractString(props, PROXIES_FILE);
      if (file != null) {
        Path path = Path.of(file);
        if (!path.isAbsolute() && baseDirectory != null) {
          path = baseDirectory.toPath().resolve(path);
        }
        proxies.addAll(ProxyListParser.parseFile(path));
      }
    }

    @Override
    public ProxyPoolBootstrap withName(String name) {
      this.name = name;
      return this;
    }

    @Override
    public ProxyPoolBootstrap withProxies(Collection<ProxyDescriptor> proxies) {
      this.proxies.addAll(proxies);
      return this;
    }

    @Override
    public ProxyPoolBootstrap withProxy(ProxyDescriptor proxy) {
      this.proxies.add(requireNonNull(proxy, "proxy cannot be null"));
      return this;
    }

    @Override
    public ProxyPoolBootstrap withOnErrorRetries(int retries) {
      this.onErrorRetries = retries;
      return this;
    }

    @Override
    public ProxyPoolBootstrap withOnTimeoutRetries(int retries) {
      this.onTimeoutRetries = retries;
      return this;
    }

    @Override
    public ProxyPoolBootstrap withMaxTimeout(Duration timeout) {
      this.maxTimeout = timeout;
      return this;
    }

    @Override
    public ProxyPoolBootstrap withHealthCheckUrl(String url) {
      this.healthCheckUrl = url;
      return this;
    }

    @Override
    public ProxyPoolBootstrap withHealthCheckInterval(Duration interval) {
      this.healthCheckInterval = interval;
      return this;
    }

    @Override
    public ProxyPoolBootstrap withChangeProxyLoop(int loops) {
      this.changeProxyLoop = loops;
      return this;
    }

    @Override
    public ProxyPoolBootstrap withDisableLogging(boolean disableLogging) {
      this.disableLogging = disableLogging;
      return this;
    }

    @Override
    public ProxyPoolBootstrap withProbeConcurrency(int concurrency) {
      this.probeConcurrency = concurrency;
      return this;
    }

    @Override
    public ProxyPoolBootstrap withUserAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    @Override
    public ProxyPoolBootstrap withMaxResponseBytes(int maxResponseBytes) {
      this.maxResponseBytes = maxResponseBytes;
      return this;
    }

    @Override
    public ProxyPoolBootstrap withEventRecorder(ProxyEventRecorder recorder) {
      this.recorder = recorder;
      return this;
    }

    @Override
    public ProxyPoolBootstrap withCorrelationIdSource(CorrelationIdSource source) {
      this.correlationIds = source;
      return this;
    }

    @Override
    public ProxyPoolBootstrap withTransport(TunnelTransport transport) {
      this.transport = transport;
      return this;
    }

    @Override
    public ProxyPool start() {
      return build().start();
    }

    private DefaultProxyPool build() {
      PoolConfiguration configuration =
          new PoolConfiguration(
              onErrorRetries,
              onTimeoutRetries,
              maxTimeout,
              healthCheckUrl,
              healthCheckInterval,
              changeProxyLoop,
              disableLogging,
              probeConcurrency,
              userAgent,
              maxResponseBytes);
      for (ProxyDescriptor proxy : proxies) {
        validate(proxy);
      }
      return new DefaultProxyPool(
          name,
          configuration,
          new ArrayList<>(proxies),
          transport != null ? transport : new NettyTunnelTransport(name, maxResponseBytes),
          determineRecorder(),
          correlationIds);
    }

    private ProxyEventRecorder determineRecorder() {
      if (recorder != null) {
        return recorder;
      }
      return disableLogging ? ProxyEventRecorder.NO_OP : new ActivityLogger(logFormat);
    }

    private static void validate(ProxyDescriptor proxy) {
      if (proxy.getHost().isBlank()) {
        throw new IllegalArgumentException("Proxy host cannot be blank");
      }
      if (proxy.getPort() < 1 || proxy.getPort() > 65535) {
        throw new IllegalArgumentException(
            "Proxy port must be between 1 and 65535: " + proxy.getPort());
      }
    }
  }
}
