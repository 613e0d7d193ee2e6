package org.proxyrotor.impl;

import static java.util.Objects.requireNonNull;

import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import org.proxyrotor.ProxyDescriptor;
import org.proxyrotor.ProxyResponse;

/**
 * Last handler of a tunnel pipeline. Once the tunnel (and TLS, for https) is up it writes the
 * request, then turns the aggregated response into a {@link ProxyResponse}. Every outcome,
 * including an early close, completes the future exactly once.
 */
class TunnelResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {

  private final FullHttpRequest request;
  private final String url;
  private final ProxyDescriptor proxy;
  private final CompletableFuture<ProxyResponse> result;

  TunnelResponseHandler(
      FullHttpRequest request,
      String url,
      ProxyDescriptor proxy,
      CompletableFuture<ProxyResponse> result) {
    this.request = requireNonNull(request, "request cannot be null");
    this.url = url;
    this.proxy = proxy;
    this.result = result;
  }

  @Override
  public void channelActive(ChannelHandlerContext ctx) throws Exception {
    ctx.writeAndFlush(request)
        .addListener(
            (ChannelFutureListener)
                future -> {
                  if (!future.isSuccess()) {
                    result.completeExceptionally(future.cause());
                    future.channel().close();
                  }
                });
    super.channelActive(ctx);
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response) {
    byte[] body = ByteBufUtil.getBytes(response.content());
    HttpHeaders headers = new DefaultHttpHeaders().add(response.headers());
    // the aggregated body is no longer chunked, report its real length
    headers.remove(HttpHeaderNames.TRANSFER_ENCODING);
    headers.set(HttpHeaderNames.CONTENT_LENGTH, body.length);
    result.complete(
        new ProxyResponse(
            url,
            response.status().code(),
            response.status().reasonPhrase(),
            headers,
            body,
            proxy));
    ctx.close();
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    result.completeExceptionally(
        new IOException("Connection closed before a response was received"));
    super.channelInactive(ctx);
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    result.completeExceptionally(cause);
    ctx.close();
  }

  @Override
  public void handlerRemoved(ChannelHandlerContext ctx) {
    // a request never written still holds its buffer
    if (request.refCnt() > 0) {
      request.release(request.refCnt());
    }
  }
}
