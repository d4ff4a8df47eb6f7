package com.tictactoe.player;

import io.netty.channel.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A connected client.
 *
 * Each connection gets one Player that tracks:
 * - Unique player ID
 * - The Netty channel used to push messages
 * - Display name and optional avatar chosen on join
 * - Matchmaking/game membership
 *
 * Thread Safety:
 * - ID and channel are immutable after creation
 * - Everything else uses atomic references; the matchmaker and the game
 *   service update membership from other connections' threads
 */
public class Player {

    private static final Logger logger = LoggerFactory.getLogger(Player.class);

    private final String id;
    private final Channel channel;

    private final AtomicReference<String> displayName;
    private final AtomicReference<String> avatar;
    private final AtomicReference<PlayerStatus> status;
    private final AtomicReference<String> currentGameId;

    public Player(Channel channel) {
        this.id = UUID.randomUUID().toString();
        this.channel = channel;
        this.displayName = new AtomicReference<>("Anonymous");
        this.avatar = new AtomicReference<>(null);
        this.status = new AtomicReference<>(PlayerStatus.IDLE);
        this.currentGameId = new AtomicReference<>(null);
    }

    public String getId() {
        return id;
    }

    public Channel getChannel() {
        return channel;
    }

    public String getDisplayName() {
        return displayName.get();
    }

    public void setDisplayName(String name) {
        displayName.set(name);
    }

    public String getAvatar() {
        return avatar.get();
    }

    public void setAvatar(String value) {
        avatar.set(value);
    }

    public PlayerStatus getStatus() {
        return status.get();
    }

    public String getCurrentGameId() {
        return currentGameId.get();
    }

    // === Membership transitions (driven by Matchmaker and GameService) ===

    /**
     * Moves an idle player into the waiting state.
     *
     * @return false if the player was not idle
     */
    public boolean markWaiting() {
        return status.compareAndSet(PlayerStatus.IDLE, PlayerStatus.WAITING);
    }

    /**
     * Drops a waiting player back to idle without entering a game.
     */
    public void cancelWaiting() {
        status.compareAndSet(PlayerStatus.WAITING, PlayerStatus.IDLE);
    }

    /**
     * Binds the player to a game. The game id is published before the status so
     * that anyone observing IN_GAME also sees the id.
     */
    public void enterGame(String gameId) {
        currentGameId.set(gameId);
        status.set(PlayerStatus.IN_GAME);
    }

    /**
     * Releases membership of the given game. A stale game id is ignored so a
     * late teardown cannot clobber a newer game.
     *
     * @return true if the player was released from that game
     */
    public boolean leaveGame(String gameId) {
        if (currentGameId.compareAndSet(gameId, null)) {
            status.set(PlayerStatus.IDLE);
            return true;
        }
        return false;
    }

    // === Delivery ===

    /**
     * Writes one JSON line to this client. Netty queues writes issued from other
     * threads onto the channel's event loop.
     *
     * @return false if the connection is already gone; the message is dropped
     */
    public boolean send(String json) {
        if (!isActive()) {
            logger.debug("Dropping message for inactive player {}", id);
            return false;
        }
        channel.writeAndFlush(json).addListener(future -> {
            if (!future.isSuccess()) {
                logger.warn("Failed to deliver message to player {}", id, future.cause());
            }
        });
        return true;
    }

    public boolean isActive() {
        return channel != null && channel.isActive();
    }

    @Override
    public String toString() {
        return "Player{" +
                "id='" + id + '\'' +
                ", name='" + displayName.get() + '\'' +
                ", status=" + status.get() +
                ", gameId='" + currentGameId.get() + '\'' +
                ", active=" + isActive() +
                '}';
    }
}
