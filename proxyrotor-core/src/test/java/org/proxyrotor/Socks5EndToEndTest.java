package org.proxyrotor;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.binaryEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.github.tomakehurst.wiremock.WireMockServer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.proxyrotor.ProxyTransportException.Reason;
import org.proxyrotor.impl.DefaultProxyPool;
import org.proxyrotor.impl.NettyTunnelTransport;
import org.proxyrotor.socks.TestSocks5Server;

/** Sends real requests through a SOCKS5 server on the loopback interface. */
@Timeout(30)
public final class Socks5EndToEndTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(3);

  private WireMockServer mockServer;
  private TestSocks5Server socks;
  private TestSocks5Server secondSocks;
  private ProxyPool pool;
  private EventLoopGroup group;
  private NettyTunnelTransport transport;

  @BeforeEach
  void setUp() throws Exception {
    mockServer = new WireMockServer(options().dynamicPort().dynamicHttpsPort());
    mockServer.start();
    mockServer.stubFor(
        get(urlEqualTo("/ip"))
            .willReturn(aResponse().withStatus(200).withBody("{\"origin\":\"127.0.0.1\"}")));
    socks = TestSocks5Server.start();
    group = new NioEventLoopGroup(2);
    SslContext trustAll =
        SslContextBuilder.forClient().trustManager(InsecureTrustManagerFactory.INSTANCE).build();
    transport = new NettyTunnelTransport(group, trustAll, 1024);
  }

  @AfterEach
  void tearDown() {
    try {
      if (pool != null) {
        pool.close();
      }
      transport.close();
      group.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
      socks.close();
      if (secondSocks != null) {
        secondSocks.close();
      }
    } finally {
      mockServer.stop();
    }
  }

  private String url(String path) {
    return "http://localhost:" + mockServer.port() + path;
  }

  private ProxyPool startPool(ProxyDescriptor... proxies) {
    ProxyPoolBootstrap bootstrap =
        DefaultProxyPool.bootstrap()
            .withName("EndToEnd")
            .withHealthCheckUrl(url("/ip"))
            .withMaxTimeout(TIMEOUT)
            .withDisableLogging(true);
    for (ProxyDescriptor proxy : proxies) {
      bootstrap.withProxy(proxy);
    }
    pool = bootstrap.start();
    return pool;
  }

  @Test
  void getIsTunnelledAndResolvedByTheProxy() throws Exception {
    mockServer.stubFor(
        get(urlEqualTo("/hello")).willReturn(aResponse().withStatus(200).withBody("hello")));
    startPool(socks.descriptor());

    List<LiveProxy> live = pool.getLiveProxiesList().get(10, TimeUnit.SECONDS);
    ProxyResponse response = pool.request(url("/hello"));

    assertThat(live).extracting(LiveProxy::getPort).containsExactly(socks.getPort());
    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.text()).isEqualTo("hello");
    assertThat(response.getProxy()).isEqualTo(socks.descriptor());
    assertThat(socks.getDestinations())
        .last()
        .asString()
        .startsWith("DOMAIN")
        .endsWith("localhost:" + mockServer.port());
    mockServer.verify(
        getRequestedFor(urlEqualTo("/hello"))
            .withHeader("Host", equalTo("localhost:" + mockServer.port())));
  }

  @Test
  void credentialsAreSentToTheProxy() {
    socks.close();
    socks = TestSocks5Server.startWithCredentials("alice", "secret");
    mockServer.stubFor(get(urlEqualTo("/private")).willReturn(aResponse().withBody("ok")));

    ProxyResponse response =
        transport.exchange(
            ProxyRequest.of(url("/private")), socks.descriptor("alice", "secret"), TIMEOUT);

    assertThat(response.text()).isEqualTo("ok");
  }

  @Test
  void wrongCredentialsFailWithAuthentication() throws Exception {
    socks.close();
    socks = TestSocks5Server.startWithCredentials("alice", "secret");

    ProxyTransportException failure =
        catchThrowableOfType(
            ProxyTransportException.class,
            () ->
                transport.exchange(
                    ProxyRequest.of(url("/ip")), socks.descriptor("alice", "wrong"), TIMEOUT));
    startPool(socks.descriptor("alice", "wrong"));

    assertThat(failure.getReason()).isEqualTo(Reason.AUTHENTICATION);
    assertThat(pool.getLiveProxiesList().get(10, TimeUnit.SECONDS)).isEmpty();
    assertThatThrownBy(() -> pool.request(url("/ip"))).isInstanceOf(NoLiveProxiesException.class);
  }

  @Test
  void binaryBodiesSurviveTheTunnel() {
    byte[] upload = new byte[256];
    for (int i = 0; i < upload.length; i++) {
      upload[i] = (byte) i;
    }
    byte[] download = {0, (byte) 0xff, 13, 10, 0, 42};
    mockServer.stubFor(
        post(urlEqualTo("/upload"))
            .withRequestBody(binaryEqualTo(upload))
            .willReturn(aResponse().withStatus(201).withBody(download)));

    ProxyResponse response =
        transport.exchange(
            ProxyRequest.of(
                url("/upload"),
                RequestOptions.builder()
                    .method("POST")
                    .body(RequestBody.of(upload, RequestBody.OCTET_STREAM))
                    .build()),
            socks.descriptor(),
            TIMEOUT);

    assertThat(response.getStatus()).isEqualTo(201);
    assertThat(response.bytes()).containsExactly(download);
    mockServer.verify(
        postRequestedFor(urlEqualTo("/upload"))
            .withHeader("Content-Type", equalTo(RequestBody.OCTET_STREAM)));
  }

  @Test
  void httpsIsNegotiatedInsideTheTunnel() {
    mockServer.stubFor(get(urlEqualTo("/secure")).willReturn(aResponse().withBody("secure")));

    ProxyResponse response =
        transport.exchange(
            ProxyRequest.of("https://localhost:" + mockServer.httpsPort() + "/secure"),
            socks.descriptor(),
            TIMEOUT);

    assertThat(response.text()).isEqualTo("secure");
    assertThat(socks.getDestinations()).last().asString().endsWith(":" + mockServer.httpsPort());
  }

  @Test
  void silentProxyTimesOut() throws Exception {
    try (ServerSocket blackhole = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      ProxyDescriptor silent = ProxyDescriptor.of("127.0.0.1", blackhole.getLocalPort());
      long start = System.nanoTime();

      assertThatThrownBy(
              () -> transport.exchange(ProxyRequest.of(url("/ip")), silent, Duration.ofMillis(300)))
          .isInstanceOf(ProxyTimeoutException.class);
      assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(2500);
    }
  }

  @Test
  void closedProxyPortFailsToConnect() throws Exception {
    int port;
    try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      port = socket.getLocalPort();
    }

    ProxyTransportException failure =
        catchThrowableOfType(
            ProxyTransportException.class,
            () ->
                transport.exchange(
                    ProxyRequest.of(url("/ip")), ProxyDescriptor.of("127.0.0.1", port), TIMEOUT));

    assertThat(failure.getReason()).isEqualTo(Reason.CONNECT);
  }

  @Test
  void refusedTunnelFailsOverToTheNextProxy() throws Exception {
    mockServer.stubFor(get(urlEqualTo("/data")).willReturn(aResponse().withBody("data")));
    secondSocks = TestSocks5Server.start();
    startPool(socks.descriptor(), secondSocks.descriptor());
    assertThat(pool.getLiveProxiesList().get(10, TimeUnit.SECONDS)).hasSize(2);
    socks.setRejectConnects(true);
    int refusedBefore = socks.getDestinations().size();

    ProxyResponse first = pool.request(url("/data"));
    ProxyResponse second = pool.request(url("/data"));

    assertThat(first.getProxy()).isEqualTo(secondSocks.descriptor());
    assertThat(second.getProxy()).isEqualTo(secondSocks.descriptor());
    assertThat(socks.getDestinations().size()).isGreaterThan(refusedBefore);
    assertThat(
            catchThrowableOfType(
                    ProxyTransportException.class,
                    () ->
                        transport.exchange(
                            ProxyRequest.of(url("/data")), socks.descriptor(), TIMEOUT))
                .getReason())
        .isEqualTo(Reason.TUNNEL_REJECTED);
  }

  @Test
  void errorStatusIsReturnedAsIs() {
    mockServer.stubFor(
        get(urlEqualTo("/missing")).willReturn(aResponse().withStatus(404).withBody("nope")));
    startPool(socks.descriptor());

    ProxyResponse response = pool.request(url("/missing"));

    assertThat(response.getStatus()).isEqualTo(404);
    assertThat(response.ok()).isFalse();
    assertThat(response.text()).isEqualTo("nope");
  }

  @Test
  void oversizedResponseFailsTheAttempt() {
    mockServer.stubFor(
        get(urlEqualTo("/large")).willReturn(aResponse().withBody(new byte[4096])));

    assertThatThrownBy(
            () -> transport.exchange(ProxyRequest.of(url("/large")), socks.descriptor(), TIMEOUT))
        .isInstanceOf(ProxyTransportException.class);
  }

  @Test
  void closingThePoolReleasesItsThreads() throws Exception {
    startPool(socks.descriptor());
    pool.getLiveProxiesList().get(10, TimeUnit.SECONDS);

    long start = System.nanoTime();
    pool.close();
    pool.close();

    assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(5000);
  }
}
