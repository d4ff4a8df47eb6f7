package com.tictactoe;

import com.tictactoe.config.ServerConfig;
import com.tictactoe.server.GameServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the TicTacToe match server.
 *
 * Usage: {@code Main [--host 127.0.0.1] [--port 65432] [--max-workers 10] [--idle-timeout 300]}
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ServerConfig config = ServerConfig.fromArgs(args);

        logger.info("===========================================");
        logger.info("  TicTacToe Match Server");
        logger.info("  Starting on {}:{}", config.getHost(), config.getPort());
        logger.info("===========================================");

        GameServer server = new GameServer(config);

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping server...");
            server.shutdown();
        }));

        try {
            server.start();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted, stopping server");
        } catch (Exception e) {
            logger.error("Failed to start server", e);
            System.exit(1);
        }
    }
}
