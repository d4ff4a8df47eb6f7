package com.tictactoe.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Console client.
 *
 * Usage: {@code ClientMain [--host 127.0.0.1] [--port 65432] [--username Player]}
 */
public class ClientMain {

    private static final Logger logger = LoggerFactory.getLogger(ClientMain.class);

    private static final String DEFAULT_HOST = "127.0.0.1";
    private static final int DEFAULT_PORT = 65432;
    private static final String DEFAULT_USERNAME = "Player";

    public static void main(String[] args) {
        String host = DEFAULT_HOST;
        int port = DEFAULT_PORT;
        String username = DEFAULT_USERNAME;

        for (int i = 0; i + 1 < args.length; i += 2) {
            switch (args[i]) {
                case "--host" -> host = args[i + 1];
                case "--port" -> {
                    try {
                        port = Integer.parseInt(args[i + 1]);
                    } catch (NumberFormatException e) {
                        logger.warn("Invalid port argument '{}', using default port {}", args[i + 1], DEFAULT_PORT);
                    }
                }
                case "--username" -> username = args[i + 1];
                default -> logger.warn("Ignoring unknown argument '{}'", args[i]);
            }
        }

        GameClient client = new GameClient(host, port, username, System.out);
        try {
            client.connect();
            runInputLoop(client);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("Client failed", e);
            System.exit(1);
        } finally {
            client.close();
        }
    }

    private static void runInputLoop(GameClient client) throws IOException {
        ClientState state = client.getState();
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        System.out.println("Commands: row,col | chat <message> | quit");
        String line;
        while (!state.isFinished() && (line = in.readLine()) != null) {
            if (state.isFinished()) {
                break;
            }
            try {
                ClientCommand command = ClientCommand.parse(line);
                client.execute(command);
                if (command.getKind() == ClientCommand.Kind.QUIT) {
                    break;
                }
            } catch (IllegalArgumentException e) {
                System.out.println(e.getMessage());
            }
        }
    }
}
