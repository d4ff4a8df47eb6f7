package com.tictactoe.handler;

import com.tictactoe.player.Player;
import com.tictactoe.player.PlayerRegistry;
import com.tictactoe.protocol.ChatRequest;
import com.tictactoe.protocol.ErrorCode;
import com.tictactoe.protocol.JoinRequest;
import com.tictactoe.protocol.MessageSerializer;
import com.tictactoe.protocol.MoveRequest;
import com.tictactoe.protocol.ProtocolException;
import com.tictactoe.protocol.QuitRequest;
import com.tictactoe.protocol.Request;
import com.tictactoe.protocol.Responses;
import com.tictactoe.service.Broadcaster;
import com.tictactoe.service.GameService;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles one client connection: turns each received line into a typed
 * request and hands it to the {@link GameService}.
 *
 * Threading Model:
 * - Each channel is handled by a single Netty worker thread, so requests from
 *   one client are processed in order
 * - Requests from the two players of a game arrive on different threads; the
 *   game state they touch is guarded by the session itself
 *
 * Never block in this handler. Nothing here waits for the other player.
 */
public class GameMessageHandler extends SimpleChannelInboundHandler<String> {

    private static final Logger logger = LoggerFactory.getLogger(GameMessageHandler.class);

    private final PlayerRegistry playerRegistry;
    private final GameService gameService;
    private final MessageSerializer serializer;
    private final Broadcaster broadcaster;
    private final Responses responses;

    public GameMessageHandler(PlayerRegistry playerRegistry, GameService gameService, MessageSerializer serializer,
                              Broadcaster broadcaster, Responses responses) {
        this.playerRegistry = playerRegistry;
        this.gameService = gameService;
        this.serializer = serializer;
        this.broadcaster = broadcaster;
        this.responses = responses;
    }

    /**
     * Called when a new connection is established.
     */
    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        Player player = playerRegistry.connect(ctx.channel());
        logger.info("New connection: {} from {}", player.getId(), ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    /**
     * Called when the connection is closed, by either side or by a transport
     * error. Treated as an implicit quit.
     */
    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        Player player = playerRegistry.disconnect(ctx.channel());
        if (player != null) {
            gameService.disconnect(player);
            logger.info("Connection closed: {} ({})", player.getId(), player.getDisplayName());
        }
        super.channelInactive(ctx);
    }

    /**
     * Called for every complete line received.
     */
    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line) {
        if (line.isBlank()) {
            return;
        }

        Player player = playerRegistry.getByChannel(ctx.channel());
        if (player == null) {
            logger.debug("Ignoring message from unregistered channel {}", ctx.channel().id());
            return;
        }

        try {
            Request request = serializer.decodeRequest(line);
            handleRequest(player, request);
        } catch (ProtocolException e) {
            logger.debug("Protocol error from {}: {}", player.getId(), e.getMessage());
            broadcaster.sendTo(player, responses.error(e.getErrorCode(), e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Failed to process message from {}: {}", player.getId(), line, e);
            broadcaster.sendTo(player, responses.error(ErrorCode.INTERNAL_ERROR, "Internal server error."));
        }
    }

    /**
     * Routes the request to the matching game operation.
     */
    private void handleRequest(Player player, Request request) {
        logger.debug("Received {} from {}", request.getType().getWireName(), player.getId());

        switch (request.getType()) {
            case JOIN -> gameService.join(player, (JoinRequest) request);
            case MOVE -> gameService.move(player, (MoveRequest) request);
            case CHAT -> gameService.chat(player, (ChatRequest) request);
            case QUIT -> gameService.quit(player, (QuitRequest) request);
        }
    }

    // === Netty Event Handlers ===

    /**
     * Drops connections that have been silent for too long.
     */
    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            if (e.state() == IdleState.READER_IDLE) {
                logger.warn("Connection idle timeout, closing: {}", ctx.channel().id());
                ctx.close();
            }
        }
        super.userEventTriggered(ctx, evt);
    }

    /**
     * An over-long line is answered with an error and the connection stays
     * usable; any other failure closes the connection.
     */
    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Player player = playerRegistry.getByChannel(ctx.channel());
        if (cause instanceof TooLongFrameException && player != null) {
            logger.debug("Oversized message from {}: {}", player.getId(), cause.getMessage());
            broadcaster.sendTo(player, responses.error(ErrorCode.MESSAGE_TOO_LONG, "Message is too long."));
            return;
        }
        logger.warn("Connection error on {}, closing", ctx.channel().id(), cause);
        ctx.close();
    }
}
