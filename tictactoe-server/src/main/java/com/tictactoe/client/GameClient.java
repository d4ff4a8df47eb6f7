package com.tictactoe.client;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tictactoe.protocol.Message;
import com.tictactoe.protocol.MessageSerializer;
import com.tictactoe.protocol.MessageType;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.LineEncoder;
import io.netty.handler.codec.string.LineSeparator;
import io.netty.handler.codec.string.StringDecoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Network side of the console client: one connection, one event loop thread.
 */
public class GameClient {

    private static final Logger logger = LoggerFactory.getLogger(GameClient.class);
    private static final int MAX_LINE_LENGTH = 8192;

    private final String host;
    private final int port;
    private final ClientState state;
    private final MessageSerializer serializer;
    private final PrintStream out;

    private EventLoopGroup group;
    private Channel channel;

    public GameClient(String host, int port, String username, PrintStream out) {
        this.host = host;
        this.port = port;
        this.state = new ClientState(username);
        this.serializer = new MessageSerializer();
        this.out = out;
    }

    /**
     * Connects and sends the join request.
     */
    public void connect() throws InterruptedException {
        group = new NioEventLoopGroup(1);

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new LineBasedFrameDecoder(MAX_LINE_LENGTH));
                        pipeline.addLast(new StringDecoder(StandardCharsets.UTF_8));
                        pipeline.addLast(new LineEncoder(LineSeparator.UNIX, StandardCharsets.UTF_8));
                        pipeline.addLast(new ClientMessageHandler(state, serializer, out));
                    }
                });

        try {
            channel = bootstrap.connect(host, port).sync().channel();
        } catch (Exception e) {
            group.shutdownGracefully();
            throw e;
        }
        logger.info("Connected to server at {}:{}", host, port);

        ObjectNode data = serializer.createObjectNode();
        data.put("username", state.getUsername());
        send(MessageType.JOIN, data);
    }

    /**
     * Sends the command to the server. Moves, chat and quit need a running game.
     *
     * @return false if there is no game to send it to
     */
    public boolean execute(ClientCommand command) {
        String gameId = state.getGameId();
        if (gameId == null || !state.isInGame()) {
            out.println("No game in progress yet.");
            return false;
        }

        ObjectNode data = serializer.createObjectNode();
        data.put("game_id", gameId);
        switch (command.getKind()) {
            case MOVE -> {
                data.putArray("position").add(command.getRow()).add(command.getCol());
                send(MessageType.MOVE, data);
            }
            case CHAT -> {
                data.put("message", command.getText());
                send(MessageType.CHAT, data);
            }
            case QUIT -> send(MessageType.QUIT, data);
        }
        return true;
    }

    private void send(MessageType type, ObjectNode data) {
        Message message = Message.builder()
                .type(type)
                .data(data)
                .build();
        channel.writeAndFlush(serializer.serialize(message));
    }

    public ClientState getState() {
        return state;
    }

    public void close() {
        if (channel != null) {
            channel.close();
        }
        if (group != null) {
            group.shutdownGracefully();
        }
        logger.info("Disconnected from server");
    }
}
