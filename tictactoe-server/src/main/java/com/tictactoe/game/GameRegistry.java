package com.tictactoe.game;

import com.tictactoe.player.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * All live games, keyed by game id.
 *
 * Connections only ever hold a game id and look the session up here; each
 * session carries its own lock, so the map itself is the only shared structure.
 *
 * Thread Safety:
 * - ConcurrentHashMap for session storage
 * - remove(id, session) so a stale teardown never removes a different game
 */
public class GameRegistry {

    private static final Logger logger = LoggerFactory.getLogger(GameRegistry.class);

    private final Map<String, GameSession> games;

    public GameRegistry() {
        this.games = new ConcurrentHashMap<>();
    }

    /**
     * Creates and registers a new game between two players. X moves first.
     */
    public GameSession create(Player playerX, Player playerO) {
        GameSession session = new GameSession(playerX, playerO);
        games.put(session.getGameId(), session);
        logger.info("Game {} started: {} (X) vs {} (O)",
                session.getGameId(), playerX.getDisplayName(), playerO.getDisplayName());
        return session;
    }

    /**
     * Gets a game by id, or null if unknown or already torn down.
     */
    public GameSession get(String gameId) {
        return gameId == null ? null : games.get(gameId);
    }

    /**
     * Removes the given session if it is still the one registered under its id.
     *
     * @return true if this call removed it
     */
    public boolean remove(GameSession session) {
        boolean removed = games.remove(session.getGameId(), session);
        if (removed) {
            logger.debug("Game {} removed ({} live)", session.getGameId(), games.size());
        }
        return removed;
    }

    public Collection<GameSession> getAllGames() {
        return games.values();
    }

    public int getGameCount() {
        return games.size();
    }

    public boolean hasGame(String gameId) {
        return games.containsKey(gameId);
    }
}
