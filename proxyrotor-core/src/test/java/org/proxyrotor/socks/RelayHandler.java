package org.proxyrotor.socks;

import static java.util.Objects.requireNonNull;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandler;
import io.netty.channel.ChannelInboundHandlerAdapter;

/** A {@link ChannelInboundHandler} that writes all incoming data to the other side of a tunnel. */
class RelayHandler extends ChannelInboundHandlerAdapter {
  private final Channel sink;

  RelayHandler(final Channel sink) {
    this.sink = requireNonNull(sink, "sink cannot be null");
  }

  @Override
  public void channelRead(final ChannelHandlerContext ctx, final Object msg) {
    sink.writeAndFlush(msg);
  }

  @Override
  public void channelInactive(final ChannelHandlerContext ctx) {
    closeOnFlush(sink);
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    closeOnFlush(ctx.channel());
  }

  static void closeOnFlush(Channel channel) {
    if (channel.isActive()) {
      channel.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
    }
  }
}
