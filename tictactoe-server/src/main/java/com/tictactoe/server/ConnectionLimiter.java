package com.tictactoe.server;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.AttributeKey;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Caps the number of simultaneously connected clients.
 *
 * Sits first in every pipeline. A connection over the cap gets one
 * pre-encoded rejection line and is closed; its channelActive event is not
 * propagated, so the game handler never registers a player for it. Anything
 * such a connection sends before the close completes is dropped here.
 */
@ChannelHandler.Sharable
public class ConnectionLimiter extends ChannelInboundHandlerAdapter {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionLimiter.class);

    private static final AttributeKey<Boolean> ADMITTED = AttributeKey.valueOf("tictactoe.admitted");

    private final int maxConnections;
    private final byte[] rejectionLine;
    private final AtomicInteger activeConnections = new AtomicInteger();

    /**
     * @param maxConnections how many clients may be connected at once
     * @param rejectionJson  message sent to refused clients, without the line terminator
     */
    public ConnectionLimiter(int maxConnections, String rejectionJson) {
        this.maxConnections = maxConnections;
        this.rejectionLine = (rejectionJson + "\n").getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        int count = activeConnections.incrementAndGet();
        if (count > maxConnections) {
            activeConnections.decrementAndGet();
            logger.warn("Connection limit of {} reached, refusing {}", maxConnections, ctx.channel().remoteAddress());
            ByteBuf line = Unpooled.wrappedBuffer(rejectionLine);
            ctx.writeAndFlush(line).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        ctx.channel().attr(ADMITTED).set(Boolean.TRUE);
        super.channelActive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (!Boolean.TRUE.equals(ctx.channel().attr(ADMITTED).get())) {
            ReferenceCountUtil.release(msg);
            return;
        }
        super.channelRead(ctx, msg);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (Boolean.TRUE.equals(ctx.channel().attr(ADMITTED).getAndSet(null))) {
            activeConnections.decrementAndGet();
        }
        super.channelInactive(ctx);
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    public int getMaxConnections() {
        return maxConnections;
    }
}
