package org.proxyrotor.impl;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.ConnectTimeoutException;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.proxy.ProxyConnectException;
import io.netty.handler.proxy.Socks5ProxyHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.resolver.NoopAddressResolverGroup;
import java.io.IOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.net.ssl.SSLException;
import org.jspecify.annotations.Nullable;
import org.proxyrotor.ProxyDescriptor;
import org.proxyrotor.ProxyPoolException;
import org.proxyrotor.ProxyRequest;
import org.proxyrotor.ProxyResponse;
import org.proxyrotor.ProxyTimeoutException;
import org.proxyrotor.ProxyTransportException;
import org.proxyrotor.ProxyTransportException.Reason;
import org.proxyrotor.RequestBody;
import org.proxyrotor.TunnelTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TunnelTransport} that opens one Netty channel per exchange. The pipeline is
 *
 * <pre>
 *   Socks5ProxyHandler -&gt; [SslHandler] -&gt; HttpClientCodec -&gt; HttpObjectAggregator -&gt;
 *   TunnelResponseHandler
 * </pre>
 *
 * The target address is handed to the proxy unresolved, so DNS resolution happens on the proxy.
 * Connect, SOCKS handshake, TLS handshake, write and read share a single deadline; when it expires
 * the channel is closed and a {@link ProxyTimeoutException} is thrown.
 */
public class NettyTunnelTransport implements TunnelTransport {
  private static final Logger LOG = LoggerFactory.getLogger(NettyTunnelTransport.class);

  private final EventLoopGroup group;
  private final boolean ownsGroup;
  private final SslContext sslContext;
  private final int maxResponseBytes;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public NettyTunnelTransport(String poolName, int maxResponseBytes) {
    this(
        new NioEventLoopGroup(0, new CategorizedThreadFactory(poolName, "Tunnel")),
        true,
        defaultSslContext(),
        maxResponseBytes);
  }

  /** Uses a caller-owned event loop group, which {@link #close()} leaves running. */
  public NettyTunnelTransport(EventLoopGroup group, SslContext sslContext, int maxResponseBytes) {
    this(group, false, sslContext, maxResponseBytes);
  }

  private NettyTunnelTransport(
      EventLoopGroup group, boolean ownsGroup, SslContext sslContext, int maxResponseBytes) {
    this.group = group;
    this.ownsGroup = ownsGroup;
    this.sslContext = sslContext;
    this.maxResponseBytes = maxResponseBytes;
  }

  private static SslContext defaultSslContext() {
    try {
      return SslContextBuilder.forClient().build();
    } catch (SSLException e) {
      throw new IllegalStateException("Could not create TLS client context", e);
    }
  }

  @Override
  public ProxyResponse exchange(ProxyRequest request, ProxyDescriptor proxy, Duration timeout) {
    if (closed.get()) {
      throw new IllegalStateException("Transport already closed");
    }
    long deadlineNanos = System.nanoTime() + timeout.toNanos();
    int timeoutMillis = (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
    CompletableFuture<ProxyResponse> result = new CompletableFuture<>();
    FullHttpRequest httpRequest = toHttpRequest(request);

    Bootstrap bootstrap =
        new Bootstrap()
            .group(group)
            .channel(NioSocketChannel.class)
            .resolver(NoopAddressResolverGroup.INSTANCE)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis)
            .handler(
                new ChannelInitializer<SocketChannel>() {
                  @Override
                  protected void initChannel(SocketChannel ch) {
                    ChannelPipeline pipeline = ch.pipeline();
                    Socks5ProxyHandler socks = socksHandler(proxy);
                    socks.setConnectTimeoutMillis(timeoutMillis);
                    pipeline.addLast("socks", socks);
                    if (request.isSecure()) {
                      SslHandler ssl =
                          sslContext.newHandler(ch.alloc(), request.getHost(), request.getPort());
                      ssl.setHandshakeTimeoutMillis(timeoutMillis);
                      pipeline.addLast("ssl", ssl);
                    }
                    pipeline.addLast("codec", new HttpClientCodec());
                    pipeline.addLast("aggregator", new HttpObjectAggregator(maxResponseBytes));
                    pipeline.addLast(
                        "handler",
                        new TunnelResponseHandler(httpRequest, request.getUrl(), proxy, result));
                  }
                });

    ChannelFuture connectFuture;
    try {
      connectFuture =
          bootstrap.connect(
              InetSocketAddress.createUnresolved(request.getHost(), request.getPort()));
    } catch (RuntimeException e) {
      httpRequest.release();
      throw new ProxyTransportException(
          proxy.toString(), Reason.CONNECT, "Could not open channel: " + e.getMessage(), e);
    }
    connectFuture.addListener(
        (ChannelFutureListener)
            future -> {
              if (!future.isSuccess()) {
                result.completeExceptionally(future.cause());
              }
            });
    Channel channel = connectFuture.channel();

    try {
      long remaining = deadlineNanos - System.nanoTime();
      return result.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      throw new ProxyTimeoutException(proxy.toString(), timeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProxyPoolException("Interrupted while waiting for " + request, e);
    } catch (ExecutionException e) {
      throw classify(e.getCause(), proxy, timeout);
    } finally {
      channel.close();
    }
  }

  private static Socks5ProxyHandler socksHandler(ProxyDescriptor proxy) {
    InetSocketAddress proxyAddress = new InetSocketAddress(proxy.getHost(), proxy.getPort());
    if (proxy.hasCredentials()) {
      String password = proxy.getPassword();
      return new Socks5ProxyHandler(
          proxyAddress, proxy.getUsername(), password != null ? password : "");
    }
    return new Socks5ProxyHandler(proxyAddress);
  }

  static FullHttpRequest toHttpRequest(ProxyRequest request) {
    RequestBody body = request.getOptions().getBody();
    byte[] content = body.bytes();
    HttpMethod method = request.getOptions().getMethod();
    FullHttpRequest httpRequest =
        new DefaultFullHttpRequest(
            HttpVersion.HTTP_1_1,
            method,
            request.getPathAndQuery(),
            Unpooled.wrappedBuffer(content));
    HttpHeaders headers = httpRequest.headers();
    headers.add(request.getOptions().getHeaders());
    if (!headers.contains(HttpHeaderNames.HOST)) {
      headers.set(HttpHeaderNames.HOST, request.getHostHeader());
    }
    headers.set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
    if (!headers.contains(HttpHeaderNames.CONTENT_LENGTH)
        && !headers.contains(HttpHeaderNames.TRANSFER_ENCODING)
        && (content.length > 0 || permitsBody(method))) {
      headers.set(HttpHeaderNames.CONTENT_LENGTH, content.length);
    }
    String contentType = body.contentType();
    if (contentType != null
        && content.length > 0
        && !headers.contains(HttpHeaderNames.CONTENT_TYPE)) {
      headers.set(HttpHeaderNames.CONTENT_TYPE, contentType);
    }
    return httpRequest;
  }

  private static boolean permitsBody(HttpMethod method) {
    return HttpMethod.POST.equals(method)
        || HttpMethod.PUT.equals(method)
        || HttpMethod.PATCH.equals(method);
  }

  /** Maps a Netty failure onto the pool's exception taxonomy. */
  static ProxyPoolException classify(
      @Nullable Throwable cause, ProxyDescriptor proxy, Duration timeout) {
    String proxyName = proxy.toString();
    if (cause == null) {
      return new ProxyTransportException(proxyName, Reason.IO, "Exchange failed");
    }
    if (cause instanceof ProxyPoolException) {
      return (ProxyPoolException) cause;
    }
    if (cause instanceof ConnectTimeoutException
        || cause instanceof ReadTimeoutException
        || cause instanceof SocketTimeoutException) {
      return new ProxyTimeoutException(proxyName, timeout, cause);
    }
    if (cause instanceof ProxyConnectException) {
      String message = String.valueOf(cause.getMessage());
      if (message.endsWith(", timeout")) {
        return new ProxyTimeoutException(proxyName, timeout, cause);
      }
      if (message.contains("authStatus:") || message.contains("authMethod:")) {
        return new ProxyTransportException(
            proxyName, Reason.AUTHENTICATION, "Proxy refused the credentials: " + message, cause);
      }
      if (message.contains("status:")) {
        return new ProxyTransportException(
            proxyName, Reason.TUNNEL_REJECTED, "Proxy refused the tunnel: " + message, cause);
      }
      if (message.endsWith(", disconnected")) {
        return new ProxyTransportException(
            proxyName, Reason.IO, "Proxy closed the connection during the handshake", cause);
      }
      return new ProxyTransportException(
          proxyName, Reason.PROTOCOL, "SOCKS5 handshake failed: " + message, cause);
    }
    if (cause instanceof ConnectException
        || cause instanceof NoRouteToHostException
        || cause instanceof UnresolvedAddressException) {
      return new ProxyTransportException(
          proxyName, Reason.CONNECT, "Could not connect to proxy: " + cause, cause);
    }
    if (cause instanceof SSLException) {
      return new ProxyTransportException(
          proxyName, Reason.PROTOCOL, "TLS failure through proxy: " + cause.getMessage(), cause);
    }
    if (cause instanceof DecoderException) {
      // SslHandler wraps handshake failures in a DecoderException
      if (cause.getCause() instanceof SSLException) {
        return classify(cause.getCause(), proxy, timeout);
      }
      return new ProxyTransportException(
          proxyName, Reason.PROTOCOL, "Invalid HTTP response: " + cause.getMessage(), cause);
    }
    if (cause instanceof IOException) {
      return new ProxyTransportException(
          proxyName, Reason.IO, String.valueOf(cause.getMessage()), cause);
    }
    return new ProxyTransportException(proxyName, Reason.IO, cause.toString(), cause);
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true) && ownsGroup) {
      LOG.debug("Shutting down tunnel event loop");
      group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }
  }
}
