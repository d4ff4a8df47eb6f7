package com.tictactoe.player;

import io.netty.channel.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Tracks every connected player, independent of matchmaking and games.
 *
 * Thread Safety:
 * - ConcurrentHashMap keyed by channel id
 * - All methods can be called from any thread safely
 */
public class PlayerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(PlayerRegistry.class);

    static final String DEFAULT_NAME_PREFIX = "Player_";
    private static final String SUFFIX_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int SUFFIX_LENGTH = 6;

    // Channel ID -> player, for lookups from Netty handlers
    private final Map<String, Player> playersByChannelId;

    public PlayerRegistry() {
        this.playersByChannelId = new ConcurrentHashMap<>();
    }

    /**
     * Creates and registers a player for a newly connected channel.
     */
    public Player connect(Channel channel) {
        Player player = new Player(channel);
        String channelId = channel.id().asLongText();

        playersByChannelId.put(channelId, player);

        logger.debug("Player registered: {} (channel: {}, total: {})",
                player.getId(), channelId, playersByChannelId.size());
        return player;
    }

    /**
     * Removes the player when its connection closes.
     *
     * @return the removed player, or null if the channel was unknown
     */
    public Player disconnect(Channel channel) {
        String channelId = channel.id().asLongText();
        Player player = playersByChannelId.remove(channelId);

        if (player != null) {
            logger.debug("Player unregistered: {} (channel: {}, total: {})",
                    player.getId(), channelId, playersByChannelId.size());
        }
        return player;
    }

    /**
     * Applies the name and avatar a client chose on join. A missing or blank
     * name is replaced by a generated {@code Player_<suffix>}.
     */
    public void identify(Player player, String requestedName, String avatar) {
        String name = requestedName == null || requestedName.isBlank()
                ? generateDisplayName()
                : requestedName.trim();
        player.setDisplayName(name);
        player.setAvatar(avatar);
    }

    public Player getByChannel(Channel channel) {
        return playersByChannelId.get(channel.id().asLongText());
    }

    static String generateDisplayName() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(DEFAULT_NAME_PREFIX);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(SUFFIX_ALPHABET.charAt(random.nextInt(SUFFIX_ALPHABET.length())));
        }
        return sb.toString();
    }
}
