package org.proxyrotor.impl;

import static org.assertj.core.api.Assertions.assertThat;

import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.proxy.ProxyConnectException;
import io.netty.handler.timeout.ReadTimeoutException;
import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import javax.net.ssl.SSLHandshakeException;
import org.junit.jupiter.api.Test;
import org.proxyrotor.ProxyDescriptor;
import org.proxyrotor.ProxyPoolException;
import org.proxyrotor.ProxyRequest;
import org.proxyrotor.ProxyTimeoutException;
import org.proxyrotor.ProxyTransportException;
import org.proxyrotor.ProxyTransportException.Reason;
import org.proxyrotor.RequestBody;
import org.proxyrotor.RequestOptions;

class NettyTunnelTransportTest {

  private static final ProxyDescriptor PROXY = ProxyDescriptor.of("127.0.0.1", 1080);
  private static final Duration TIMEOUT = Duration.ofSeconds(2);

  private static ProxyPoolException classify(Throwable cause) {
    return NettyTunnelTransport.classify(cause, PROXY, TIMEOUT);
  }

  // same shape as the messages of Socks5ProxyHandler
  private static ProxyConnectException handshakeFailure(String detail) {
    return new ProxyConnectException("socks5, none, /127.0.0.1:1080 => example.com:80, " + detail);
  }

  private static Reason reasonOf(Throwable cause) {
    ProxyPoolException classified = classify(cause);
    assertThat(classified).isInstanceOf(ProxyTransportException.class);
    return ((ProxyTransportException) classified).getReason();
  }

  @Test
  void timeoutsAreClassifiedAsTimeouts() {
    assertThat(classify(new ConnectTimeoutException("connect timed out")))
        .isInstanceOf(ProxyTimeoutException.class);
    assertThat(classify(ReadTimeoutException.INSTANCE)).isInstanceOf(ProxyTimeoutException.class);
    assertThat(classify(handshakeFailure("timeout"))).isInstanceOf(ProxyTimeoutException.class);
  }

  @Test
  void socksHandshakeFailuresAreClassifiedByMessage() {
    assertThat(reasonOf(handshakeFailure("authStatus: FAILURE"))).isEqualTo(Reason.AUTHENTICATION);
    assertThat(reasonOf(handshakeFailure("unexpected authMethod: GSSAPI")))
        .isEqualTo(Reason.AUTHENTICATION);
    assertThat(reasonOf(handshakeFailure("status: FORBIDDEN"))).isEqualTo(Reason.TUNNEL_REJECTED);
    assertThat(reasonOf(handshakeFailure("disconnected"))).isEqualTo(Reason.IO);
    assertThat(reasonOf(handshakeFailure("unexpected message"))).isEqualTo(Reason.PROTOCOL);
  }

  @Test
  void socketFailuresAreClassified() {
    assertThat(reasonOf(new ConnectException("Connection refused"))).isEqualTo(Reason.CONNECT);
    assertThat(reasonOf(new IOException("Connection reset by peer"))).isEqualTo(Reason.IO);
    assertThat(reasonOf(new IllegalStateException("odd"))).isEqualTo(Reason.IO);
  }

  @Test
  void tlsFailuresAreProtocolErrors() {
    assertThat(reasonOf(new SSLHandshakeException("bad certificate"))).isEqualTo(Reason.PROTOCOL);
    assertThat(reasonOf(new DecoderException(new SSLHandshakeException("bad certificate"))))
        .isEqualTo(Reason.PROTOCOL);
    assertThat(reasonOf(new DecoderException("invalid version format")))
        .isEqualTo(Reason.PROTOCOL);
  }

  @Test
  void poolExceptionsPassThrough() {
    ProxyTimeoutException timeout = new ProxyTimeoutException(PROXY.toString(), TIMEOUT);
    assertThat(classify(timeout)).isSameAs(timeout);
  }

  @Test
  void getRequestHasHostAndNoBody() {
    FullHttpRequest request =
        NettyTunnelTransport.toHttpRequest(ProxyRequest.of("http://example.com:8080/a/b?x=1"));
    try {
      assertThat(request.method().name()).isEqualTo("GET");
      assertThat(request.uri()).isEqualTo("/a/b?x=1");
      assertThat(request.headers().get(HttpHeaderNames.HOST)).isEqualTo("example.com:8080");
      assertThat(request.headers().get(HttpHeaderNames.CONNECTION)).isEqualTo("close");
      assertThat(request.headers().contains(HttpHeaderNames.CONTENT_LENGTH)).isFalse();
      assertThat(request.content().readableBytes()).isZero();
    } finally {
      request.release();
    }
  }

  @Test
  void postRequestCarriesBodyAndHeaders() {
    ProxyRequest proxyRequest =
        ProxyRequest.of(
            "https://example.com/submit",
            RequestOptions.builder()
                .method("POST")
                .header("X-Trace", "abc")
                .json("{\"a\":1}")
                .build());

    FullHttpRequest request = NettyTunnelTransport.toHttpRequest(proxyRequest);
    try {
      assertThat(request.headers().get(HttpHeaderNames.HOST)).isEqualTo("example.com");
      assertThat(request.headers().get("x-trace")).isEqualTo("abc");
      assertThat(request.headers().get(HttpHeaderNames.CONTENT_TYPE))
          .isEqualTo(RequestBody.APPLICATION_JSON);
      assertThat(request.headers().getInt(HttpHeaderNames.CONTENT_LENGTH)).isEqualTo(7);
      assertThat(request.content().toString(StandardCharsets.UTF_8)).isEqualTo("{\"a\":1}");
    } finally {
      request.release();
    }
  }

  @Test
  void emptyPostStillAnnouncesItsLength() {
    FullHttpRequest request =
        NettyTunnelTransport.toHttpRequest(
            ProxyRequest.of(
                "http://example.com/", RequestOptions.builder().method("POST").build()));
    try {
      assertThat(request.headers().getInt(HttpHeaderNames.CONTENT_LENGTH)).isZero();
      assertThat(request.headers().contains(HttpHeaderNames.CONTENT_TYPE)).isFalse();
    } finally {
      request.release();
    }
  }

  @Test
  void explicitHeadersWin() {
    FullHttpRequest request =
        NettyTunnelTransport.toHttpRequest(
            ProxyRequest.of(
                "http://example.com/",
                RequestOptions.builder()
                    .method("PUT")
                    .header("Host", "virtual.example")
                    .header("Content-Type", "text/csv")
                    .body("a,b")
                    .build()));
    try {
      assertThat(request.headers().get(HttpHeaderNames.HOST)).isEqualTo("virtual.example");
      assertThat(request.headers().getAll(HttpHeaderNames.CONTENT_TYPE))
          .containsExactly("text/csv");
    } finally {
      request.release();
    }
  }
}
