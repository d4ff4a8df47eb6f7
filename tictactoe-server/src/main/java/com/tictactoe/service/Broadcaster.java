package com.tictactoe.service;

import com.tictactoe.game.GameSession;
import com.tictactoe.player.Player;
import com.tictactoe.protocol.Message;
import com.tictactoe.protocol.MessageSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers server messages to players.
 *
 * A message is serialized once and written to each recipient. A recipient
 * whose connection is gone is skipped and logged; that never affects delivery
 * to the other participant. Callers must not hold a session lock while
 * broadcasting.
 */
public class Broadcaster {

    private static final Logger logger = LoggerFactory.getLogger(Broadcaster.class);

    private final MessageSerializer serializer;

    public Broadcaster(MessageSerializer serializer) {
        this.serializer = serializer;
    }

    /**
     * Sends a message to both participants of a game, X first.
     */
    public void broadcast(GameSession session, Message message) {
        String json = serializer.serialize(message);
        deliver(session.getPlayerX(), message, json);
        deliver(session.getPlayerO(), message, json);
    }

    /**
     * Sends a message to a single player.
     *
     * @return false if the player's connection was already closed
     */
    public boolean sendTo(Player player, Message message) {
        return deliver(player, message, serializer.serialize(message));
    }

    private boolean deliver(Player player, Message message, String json) {
        boolean sent = player.send(json);
        if (!sent) {
            logger.info("Skipped {} for disconnected player {}", message.getType().getWireName(), player.getDisplayName());
        }
        return sent;
    }
}
