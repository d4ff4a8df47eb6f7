package com.tictactoe;

import com.tictactoe.server.ConnectionLimiter;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.DefaultChannelId;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.*;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for admission and refusal at the front of the pipeline.
 */
@DisplayName("Connection Limiter Tests")
class ConnectionLimiterTest {

    private static final String REJECTION = "{\"type\":\"error\",\"data\":{\"code\":\"server_full\"}}";

    private static ByteBuf line(String text) {
        return Unpooled.copiedBuffer(text + "\n", StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Admitted connections pass reads through")
    void testAdmittedReads() {
        ConnectionLimiter limiter = new ConnectionLimiter(1, REJECTION);
        EmbeddedChannel channel = new EmbeddedChannel(DefaultChannelId.newInstance(), limiter);

        assertEquals(1, limiter.getActiveConnections());
        channel.writeInbound(line("{\"type\":\"join\"}"));
        ByteBuf read = channel.readInbound();
        assertNotNull(read);
        read.release();

        channel.close();
        assertEquals(0, limiter.getActiveConnections());
    }

    @Test
    @DisplayName("Connections over the limit get the rejection line and are closed")
    void testRefusal() {
        ConnectionLimiter limiter = new ConnectionLimiter(1, REJECTION);
        new EmbeddedChannel(DefaultChannelId.newInstance(), limiter);
        EmbeddedChannel refused = new EmbeddedChannel(DefaultChannelId.newInstance(), limiter);

        ByteBuf sent = refused.readOutbound();
        assertEquals(REJECTION + "\n", sent.toString(StandardCharsets.UTF_8));
        sent.release();
        assertFalse(refused.isOpen());
        assertEquals(1, limiter.getActiveConnections());
    }

    @Test
    @DisplayName("Reads on connections that were never admitted are dropped and released")
    void testUnadmittedReadsDropped() {
        ConnectionLimiter limiter = new ConnectionLimiter(1, REJECTION);
        // Active before the limiter is in place, so it was never admitted
        EmbeddedChannel channel = new EmbeddedChannel(DefaultChannelId.newInstance(), new ChannelInboundHandlerAdapter());
        channel.pipeline().addFirst(limiter);

        ByteBuf msg = line("{\"type\":\"join\"}");
        channel.writeInbound(msg);

        assertNull(channel.readInbound(), "Nothing should reach the rest of the pipeline");
        assertEquals(0, msg.refCnt());
    }
}
