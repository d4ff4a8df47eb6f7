package com.tictactoe.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.tictactoe.protocol.Message;
import com.tictactoe.protocol.MessageSerializer;
import com.tictactoe.protocol.ProtocolException;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Prints server messages for the console client and keeps {@link ClientState}
 * current.
 */
public class ClientMessageHandler extends SimpleChannelInboundHandler<String> {

    private static final Logger logger = LoggerFactory.getLogger(ClientMessageHandler.class);

    private final ClientState state;
    private final MessageSerializer serializer;
    private final PrintStream out;

    public ClientMessageHandler(ClientState state, MessageSerializer serializer, PrintStream out) {
        this.state = state;
        this.serializer = serializer;
        this.out = out;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line) {
        if (line.isBlank()) {
            return;
        }
        Message message;
        try {
            message = serializer.deserialize(line);
        } catch (ProtocolException e) {
            logger.warn("Ignoring unreadable server message: {}", line);
            return;
        }
        JsonNode data = message.getData();

        switch (message.getType()) {
            case JOIN_ACK -> onJoinAck(data);
            case MOVE_ACK -> onMoveAck(data);
            case CHAT_BROADCAST -> out.println(text(data, "username") + ": " + text(data, "message"));
            case QUIT_ACK -> {
                out.println(text(data, "message"));
                state.finish();
            }
            case ERROR -> onError(data);
            default -> logger.warn("Unexpected message type from server: {}", message.getType());
        }
    }

    private void onJoinAck(JsonNode data) {
        if ("success".equals(text(data, "status"))) {
            String symbol = text(data, "player_symbol");
            state.startGame(text(data, "game_id"), symbol);
            out.println("Game started against " + text(data, "opponent") + "! You are '" + symbol + "'.");
            out.println(state.isMyTurn() ? "You move first." : "Waiting for your opponent to move.");
        } else {
            out.println(text(data, "message"));
        }
    }

    private void onMoveAck(JsonNode data) {
        if (!"success".equals(text(data, "status"))) {
            out.println("Move failed: " + text(data, "message"));
            return;
        }
        out.println();
        out.print(BoardRenderer.render(data.get("game_state")));
        out.println();

        String winner = text(data, "winner");
        if (winner != null) {
            if ("draw".equals(winner)) {
                out.println("The game ended in a draw.");
            } else if (winner.equals(state.getUsername())) {
                out.println("Congratulations, you won!");
            } else {
                out.println(winner + " has won the game.");
            }
            state.finish();
            return;
        }

        String next = text(data, "next_player");
        state.setMyTurn(state.getUsername().equals(next));
        out.println(state.isMyTurn() ? "Your turn." : "It's " + next + "'s turn.");
    }

    private void onError(JsonNode data) {
        String code = text(data, "code");
        out.println("Error from server [" + code + "]: " + text(data, "message"));
        if ("server_full".equals(code)) {
            state.finish();
        }
    }

    private static String text(JsonNode data, String field) {
        JsonNode node = data.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (!state.isFinished()) {
            out.println("Disconnected from server.");
            state.finish();
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("Connection error", cause);
        ctx.close();
    }
}
