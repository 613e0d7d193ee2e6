package org.proxyrotor;

import java.io.File;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.UnrecognizedOptionException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.core.config.Configurator;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.proxyrotor.extras.ActivityLogger;
import org.proxyrotor.extras.LogFormat;
import org.proxyrotor.extras.ProxyListParser;
import org.proxyrotor.extras.SnowflakeIdSource;
import org.proxyrotor.impl.DefaultProxyPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Health checks a list of SOCKS5 proxies and optionally fetches a URL through them. */
public class Launcher {

  private static final Logger LOG = LoggerFactory.getLogger(Launcher.class);

  private static final String OPTION_HELP = "help";
  private static final String OPTION_CONFIG = "config";
  private static final String OPTION_LOG_CONFIG = "log_config";
  private static final String OPTION_SERVER = "server";
  private static final String OPTION_NAME = "name";
  private static final String OPTION_PROXIES = "proxies";
  private static final String OPTION_PROXIES_FILE = "proxies_file";
  private static final String OPTION_HEALTH_CHECK_URL = "health_check_url";
  private static final String OPTION_HEALTH_CHECK_INTERVAL = "health_check_interval";
  private static final String OPTION_MAX_TIMEOUT = "max_timeout";
  private static final String OPTION_ON_ERROR_RETRIES = "on_error_retries";
  private static final String OPTION_ON_TIMEOUT_RETRIES = "on_timeout_retries";
  private static final String OPTION_CHANGE_PROXY_LOOP = "change_proxy_loop";
  private static final String OPTION_ACTIVITY_LOG_FORMAT = "activity_log_format";
  private static final String OPTION_DISABLE_LOGGING = "disable_logging";
  private static final String OPTION_URL = "url";
  private static final String OPTION_METHOD = "method";
  private static final String OPTION_HEADER = "header";
  private static final String OPTION_DATA = "data";
  private static final String OPTION_LIST_LIVE = "list_live";

  private final PrintStream out;

  public Launcher() {
    this(System.out);
  }

  Launcher(PrintStream out) {
    this.out = out;
  }

  /**
   * Starts the pool from the command line.
   *
   * @param args Any command line arguments.
   */
  public static void main(final String... args) {
    Launcher launcher = new Launcher();
    launcher.start(args);
  }

  protected void start(String[] args) {
    final Options options = buildOptions();

    CommandLine cmd = parseCommandLine(args, options);

    configureLogging(cmd);

    LOG.info("Running ProxyRotor with args: {}", Arrays.asList(args));

    if (cmd.hasOption(OPTION_HELP)) {
      printHelp(options, null);
      return;
    }

    ProxyPoolBootstrap bootstrap;
    if (cmd.hasOption(OPTION_CONFIG)) {
      String poolConfigurationPath = cmd.getOptionValue(OPTION_CONFIG);
      LOG.info("Using configuration file: {}", poolConfigurationPath);
      bootstrap = DefaultProxyPool.bootstrapFromFile(poolConfigurationPath);
    } else {
      bootstrap = DefaultProxyPool.bootstrap();
    }

    try {
      if (cmd.hasOption(OPTION_PROXIES)) {
        bootstrap.withProxies(ProxyListParser.parseList(cmd.getOptionValue(OPTION_PROXIES)));
      }
      if (cmd.hasOption(OPTION_PROXIES_FILE)) {
        bootstrap.withProxies(
            ProxyListParser.parseFile(Path.of(cmd.getOptionValue(OPTION_PROXIES_FILE))));
      }
    } catch (IllegalArgumentException | UncheckedIOException e) {
      printHelp(options, "Invalid proxy list: " + e.getMessage());
      return;
    }

    if (cmd.hasOption(OPTION_NAME)) {
      final String val = cmd.getOptionValue(OPTION_NAME);
      LOG.info("Running with name: '{}'", val);
      bootstrap.withName(val);
    }

    if (cmd.hasOption(OPTION_HEALTH_CHECK_URL)) {
      bootstrap.withHealthCheckUrl(cmd.getOptionValue(OPTION_HEALTH_CHECK_URL));
    }

    try {
      if (cmd.hasOption(OPTION_HEALTH_CHECK_INTERVAL)) {
        bootstrap.withHealthCheckInterval(
            Duration.ofMillis(Long.parseLong(cmd.getOptionValue(OPTION_HEALTH_CHECK_INTERVAL))));
      }
      if (cmd.hasOption(OPTION_MAX_TIMEOUT)) {
        bootstrap.withMaxTimeout(
            Duration.ofMillis(Long.parseLong(cmd.getOptionValue(OPTION_MAX_TIMEOUT))));
      }
      if (cmd.hasOption(OPTION_ON_ERROR_RETRIES)) {
        bootstrap.withOnErrorRetries(
            Integer.parseInt(cmd.getOptionValue(OPTION_ON_ERROR_RETRIES)));
      }
      if (cmd.hasOption(OPTION_ON_TIMEOUT_RETRIES)) {
        bootstrap.withOnTimeoutRetries(
            Integer.parseInt(cmd.getOptionValue(OPTION_ON_TIMEOUT_RETRIES)));
      }
      if (cmd.hasOption(OPTION_CHANGE_PROXY_LOOP)) {
        bootstrap.withChangeProxyLoop(
            Integer.parseInt(cmd.getOptionValue(OPTION_CHANGE_PROXY_LOOP)));
      }
    } catch (final NumberFormatException e) {
      printHelp(options, "Unexpected number: " + e.getMessage());
      return;
    }

    if (cmd.hasOption(OPTION_DISABLE_LOGGING)) {
      bootstrap.withDisableLogging(true);
    } else if (cmd.hasOption(OPTION_ACTIVITY_LOG_FORMAT)) {
      String format = cmd.getOptionValue(OPTION_ACTIVITY_LOG_FORMAT);
      try {
        LogFormat logFormat = LogFormat.valueOf(format.toUpperCase(Locale.ROOT));
        bootstrap.withEventRecorder(new ActivityLogger(logFormat));
        LOG.info("Using activity log format: {}", logFormat);
      } catch (IllegalArgumentException e) {
        printHelp(options, "Unknown activity log format: " + format);
        return;
      }
    }

    RequestOptions requestOptions = null;
    if (cmd.hasOption(OPTION_URL)) {
      try {
        requestOptions = buildRequestOptions(cmd);
      } catch (IllegalArgumentException e) {
        printHelp(options, e.getMessage());
        return;
      }
    }

    LOG.info("About to start...");
    ProxyPool pool;
    try {
      pool = bootstrap.withCorrelationIdSource(new SnowflakeIdSource()).start();
    } catch (IllegalArgumentException e) {
      printHelp(options, "Invalid configuration: " + e.getMessage());
      return;
    }

    try {
      if (cmd.hasOption(OPTION_LIST_LIVE) || requestOptions == null) {
        printLiveProxies(pool.getLiveProxiesList().join());
      }
      if (requestOptions != null) {
        fetch(pool, cmd.getOptionValue(OPTION_URL), requestOptions);
      }
    } finally {
      if (cmd.hasOption(OPTION_SERVER)) {
        runAsServer(pool);
      } else {
        pool.close();
      }
    }
  }

  private RequestOptions buildRequestOptions(CommandLine cmd) {
    RequestOptions.Builder builder = RequestOptions.builder();
    if (cmd.hasOption(OPTION_METHOD)) {
      builder.method(cmd.getOptionValue(OPTION_METHOD));
    }
    String[] headers = cmd.getOptionValues(OPTION_HEADER);
    if (headers != null) {
      for (String header : headers) {
        String name = StringUtils.substringBefore(header, ":").trim();
        if (name.isEmpty() || !header.contains(":")) {
          throw new IllegalArgumentException("Header must look like 'Name: value': " + header);
        }
        builder.header(name, StringUtils.substringAfter(header, ":").trim());
      }
    }
    if (cmd.hasOption(OPTION_DATA)) {
      builder.body(
          RequestBody.of(
              cmd.getOptionValue(OPTION_DATA).getBytes(StandardCharsets.UTF_8),
              RequestBody.FORM_URLENCODED));
    }
    return builder.build();
  }

  @SuppressWarnings("java:S106")
  private void fetch(ProxyPool pool, String url, RequestOptions requestOptions) {
    try {
      ProxyResponse response = pool.request(url, requestOptions);
      LOG.info("{}", response);
      System.err.println(
          response.getStatus() + " " + response.getStatusText() + " via " + response.getProxy());
      out.println(response.text());
    } catch (IllegalArgumentException e) {
      LOG.error("Invalid request: {}", e.getMessage());
      System.err.println("Invalid request: " + e.getMessage());
    } catch (ProxyPoolException e) {
      LOG.error("Request to {} failed", url, e);
      System.err.println("Request failed: " + e.getMessage());
    }
  }

  private void printLiveProxies(List<LiveProxy> live) {
    out.println(live.size() + " live proxies");
    for (LiveProxy proxy : live) {
      out.println(proxy.getHost() + ":" + proxy.getPort() + "\t" + proxy.getLatencyMs() + " ms");
    }
  }

  private void runAsServer(ProxyPool pool) {
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  LOG.info("Shutting down...");
                  pool.close();
                }));
    try {
      Thread.currentThread().join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      pool.close();
    }
  }

  @SuppressWarnings("java:S106")
  private void configureLogging(CommandLine cmd) {
    if (cmd.hasOption(OPTION_LOG_CONFIG)) {
      String optionValue = cmd.getOptionValue(OPTION_LOG_CONFIG);
      File logConfigPath = new File(optionValue);
      if (logConfigPath.exists()) {
        Configurator.initialize(null, logConfigPath.getAbsolutePath());
      }
    } else {
      // default log4j2 file shipped with the jar
      ClassLoader classLoader = Launcher.class.getClassLoader();
      URL defaultLogConfigUrl = classLoader.getResource("proxyrotor_default_log4j2.xml");
      if (defaultLogConfigUrl != null) {
        Configurator.initialize(null, defaultLogConfigUrl.toString());
        System.err.println("using 'proxyrotor_default_log4j2.xml'");
      }
    }
  }

  private @NonNull CommandLine parseCommandLine(String[] args, Options options) {
    final CommandLineParser parser = new DefaultParser();
    CommandLine cmd;
    try {
      cmd = parser.parse(options, args);
      if (cmd.getArgs().length > 0) {
        throw new UnrecognizedOptionException(
            "Extra arguments were provided in " + Arrays.asList(args));
      }
    } catch (final ParseException e) {
      printHelp(options, "Could not parse command line: " + Arrays.asList(args));
      throw new IllegalArgumentException("Could not parse command line: " + Arrays.asList(args), e);
    }
    return cmd;
  }

  protected @NonNull Options buildOptions() {
    final Options options = new Options();
    options.addOption(
        null, OPTION_CONFIG, true, "Path to pool configuration file (relative or absolute).");
    options.addOption(
        null,
        OPTION_LOG_CONFIG,
        true,
        "Path to log4j configuration file (relative to current directory or absolute).");
    options.addOption(null, OPTION_HELP, false, "Display command line help.");
    options.addOption(
        null, OPTION_SERVER, false, "Keep health checking until the process is killed.");
    options.addOption(null, OPTION_NAME, true, "name of the pool, used in thread names.");
    options.addOption(
        null, OPTION_PROXIES, true, "Comma separated proxies: socks5://[user:pass@]host:port.");
    options.addOption(
        null, OPTION_PROXIES_FILE, true, "File with one proxy per line ('#' starts a comment).");
    options.addOption(null, OPTION_HEALTH_CHECK_URL, true, "URL probed through every proxy.");
    options.addOption(
        null, OPTION_HEALTH_CHECK_INTERVAL, true, "Milliseconds between health check passes.");
    options.addOption(
        null, OPTION_MAX_TIMEOUT, true, "Deadline of each attempt and probe in milliseconds.");
    options.addOption(
        null, OPTION_ON_ERROR_RETRIES, true, "Retries on the same proxy after a transport error.");
    options.addOption(
        null, OPTION_ON_TIMEOUT_RETRIES, true, "Retries on the same proxy after a timeout.");
    options.addOption(
        null, OPTION_CHANGE_PROXY_LOOP, true, "How many times a request may cycle the live set.");
    options.addOption(
        null, OPTION_ACTIVITY_LOG_FORMAT, true, "Activity log format: TEXT, JSON, LTSV");
    options.addOption(null, OPTION_DISABLE_LOGGING, false, "Do not log pool activity.");
    options.addOption(null, OPTION_URL, true, "URL to fetch through the pool.");
    options.addOption(null, OPTION_METHOD, true, "HTTP method of the request (default GET).");
    options.addOption(
        null, OPTION_HEADER, true, "Request header 'Name: value'; may be repeated.");
    options.addOption(null, OPTION_DATA, true, "Request body, sent url-encoded.");
    options.addOption(null, OPTION_LIST_LIVE, false, "Print the live proxies.");
    return options;
  }

  @SuppressWarnings("java:S106")
  private void printHelp(final Options options, final @Nullable String errorMessage) {
    if (!StringUtils.isBlank(errorMessage)) {
      LOG.error(errorMessage);
      // log4j is not yet loaded at this point in some cases
      System.err.println(errorMessage);
    }

    final HelpFormatter formatter = new HelpFormatter();
    formatter.printHelp("proxyrotor", options);
  }
}
