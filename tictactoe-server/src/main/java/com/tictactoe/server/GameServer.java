package com.tictactoe.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.LineEncoder;
import io.netty.handler.codec.string.LineSeparator;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.timeout.IdleStateHandler;

import com.tictactoe.config.ServerConfig;
import com.tictactoe.game.GameRegistry;
import com.tictactoe.game.Matchmaker;
import com.tictactoe.handler.GameMessageHandler;
import com.tictactoe.player.PlayerRegistry;
import com.tictactoe.protocol.ErrorCode;
import com.tictactoe.protocol.MessageSerializer;
import com.tictactoe.protocol.Responses;
import com.tictactoe.service.Broadcaster;
import com.tictactoe.service.GameService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * TCP game server using Netty's NIO. Clients exchange newline-delimited JSON.
 *
 * Threading Model:
 * - Boss Group: 1 thread that accepts incoming connections
 * - Worker Group: N threads (CPU cores) that handle I/O and run the game logic
 *   for the channels assigned to them
 *
 * Each connection is pinned to one worker thread; the two players of a game
 * are usually on different threads, which is why sessions lock themselves.
 */
public class GameServer {

    private static final Logger logger = LoggerFactory.getLogger(GameServer.class);

    private final ServerConfig config;
    private final MessageSerializer serializer;
    private final Responses responses;
    private final Broadcaster broadcaster;
    private final PlayerRegistry playerRegistry;
    private final GameRegistry gameRegistry;
    private final Matchmaker matchmaker;
    private final GameService gameService;
    private final ConnectionLimiter connectionLimiter;

    // Netty event loop groups
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public GameServer(ServerConfig config) {
        this.config = config;
        this.serializer = new MessageSerializer();
        this.responses = new Responses(serializer);
        this.broadcaster = new Broadcaster(serializer);
        this.playerRegistry = new PlayerRegistry();
        this.gameRegistry = new GameRegistry();
        this.matchmaker = new Matchmaker(gameRegistry);
        this.gameService = new GameService(playerRegistry, gameRegistry, matchmaker, broadcaster, responses);
        this.connectionLimiter = new ConnectionLimiter(config.getMaxWorkers(),
                serializer.serialize(responses.error(ErrorCode.SERVER_FULL, "Server is full, try again later.")));
    }

    /**
     * Starts the server and blocks until it is shut down.
     */
    public void start() throws InterruptedException {
        try {
            bind();
            // Block until the server channel is closed
            serverChannel.closeFuture().sync();
        } finally {
            shutdown();
        }
    }

    /**
     * Binds the listening socket and returns once connections are being
     * accepted.
     */
    public void bind() throws InterruptedException {
        // Boss group: accepts incoming connections (1 thread is enough)
        bossGroup = new NioEventLoopGroup(1);

        // Worker group: handles I/O for accepted connections
        // Default: 2 * number of CPU cores
        workerGroup = new NioEventLoopGroup();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // TCP options
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true) // Moves are tiny, send them immediately
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();

                        // Refuse clients beyond max-workers before anything else runs
                        pipeline.addLast(connectionLimiter);

                        // Drop silent clients; 0 disables
                        if (config.getIdleTimeoutSeconds() > 0) {
                            pipeline.addLast(new IdleStateHandler(config.getIdleTimeoutSeconds(), 0, 0, TimeUnit.SECONDS));
                        }

                        // One JSON object per line
                        pipeline.addLast(new LineBasedFrameDecoder(config.getMaxLineLength()));
                        pipeline.addLast(new StringDecoder(StandardCharsets.UTF_8));
                        pipeline.addLast(new LineEncoder(LineSeparator.UNIX, StandardCharsets.UTF_8));

                        // Game protocol
                        pipeline.addLast(new GameMessageHandler(playerRegistry, gameService, serializer,
                                broadcaster, responses));
                    }
                });

        try {
            serverChannel = bootstrap.bind(config.getHost(), config.getPort()).sync().channel();
        } catch (Exception e) {
            logger.error("Failed to bind {}:{}", config.getHost(), config.getPort());
            shutdown();
            throw e;
        }

        logger.info("Server started successfully!");
        logger.info("Listening on {}:{} (max clients: {})", config.getHost(), getBoundPort(), config.getMaxWorkers());
    }

    /**
     * Gracefully shuts down the server.
     * - Stops accepting new connections
     * - Closes client connections as the event loops terminate
     * - Releases all resources
     */
    public void shutdown() {
        logger.info("Shutting down server...");

        if (serverChannel != null) {
            serverChannel.close();
        }

        // Graceful shutdown of event loops
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }

        logger.info("Server shutdown complete.");
    }

    /**
     * The port actually bound, useful when the configured port is 0.
     */
    public int getBoundPort() {
        if (serverChannel == null) {
            return config.getPort();
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public ServerConfig getConfig() {
        return config;
    }

    public PlayerRegistry getPlayerRegistry() {
        return playerRegistry;
    }

    public GameRegistry getGameRegistry() {
        return gameRegistry;
    }

    public Matchmaker getMatchmaker() {
        return matchmaker;
    }

    public ConnectionLimiter getConnectionLimiter() {
        return connectionLimiter;
    }
}
