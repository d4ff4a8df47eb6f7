package com.tictactoe.game;

import com.tictactoe.player.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Pairs joining players into games.
 *
 * Holds at most one waiting player. The slot is only reachable through
 * {@link #tryPair} and {@link #withdraw}, both of which run under the same
 * lock, so two racing joins can never both see an empty slot.
 */
public class Matchmaker {

    private static final Logger logger = LoggerFactory.getLogger(Matchmaker.class);

    private final GameRegistry gameRegistry;
    private final Object slotLock = new Object();

    // Guarded by slotLock
    private Player waiting;

    public Matchmaker(GameRegistry gameRegistry) {
        this.gameRegistry = gameRegistry;
    }

    /**
     * Either parks the player in the waiting slot or pairs it with the player
     * already there.
     *
     * On pairing, the earlier player becomes X and the caller becomes O, and
     * both are bound to the new game before the lock is released. A waiting
     * player whose connection has already dropped is discarded and the caller
     * takes the slot instead.
     *
     * @return the new game, or empty if the caller is now waiting
     * @throws IllegalStateException if the player is not idle
     */
    public Optional<GameSession> tryPair(Player player) {
        synchronized (slotLock) {
            if (!player.markWaiting()) {
                throw new IllegalStateException("Player " + player.getId() + " is already " + player.getStatus());
            }

            if (waiting != null && !waiting.isActive()) {
                logger.info("Discarding stale waiting player {}", waiting.getDisplayName());
                waiting.cancelWaiting();
                waiting = null;
            }

            if (waiting == null) {
                waiting = player;
                logger.info("{} is waiting for an opponent", player.getDisplayName());
                return Optional.empty();
            }

            Player opponent = waiting;
            waiting = null;

            GameSession session = gameRegistry.create(opponent, player);
            opponent.enterGame(session.getGameId());
            player.enterGame(session.getGameId());
            return Optional.of(session);
        }
    }

    /**
     * Empties the slot if the given player holds it. Used when a waiting player
     * disconnects before an opponent arrives.
     *
     * @return true if the player was waiting and has been removed
     */
    public boolean withdraw(Player player) {
        synchronized (slotLock) {
            if (waiting != player) {
                return false;
            }
            waiting = null;
            player.cancelWaiting();
            logger.info("{} stopped waiting", player.getDisplayName());
            return true;
        }
    }

    /** Whether someone currently holds the waiting slot. */
    public boolean hasWaitingPlayer() {
        synchronized (slotLock) {
            return waiting != null;
        }
    }
}
