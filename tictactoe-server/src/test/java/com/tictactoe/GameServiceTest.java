package com.tictactoe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tictactoe.game.GameRegistry;
import com.tictactoe.game.Matchmaker;
import com.tictactoe.player.Player;
import com.tictactoe.player.PlayerRegistry;
import com.tictactoe.player.PlayerStatus;
import com.tictactoe.protocol.ChatRequest;
import com.tictactoe.protocol.JoinRequest;
import com.tictactoe.protocol.MessageSerializer;
import com.tictactoe.protocol.MoveRequest;
import com.tictactoe.protocol.QuitRequest;
import com.tictactoe.protocol.Responses;
import com.tictactoe.service.Broadcaster;
import com.tictactoe.service.GameService;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the request flows behind each message type, with in-memory
 * connections standing in for sockets.
 */
@DisplayName("Game Service Tests")
class GameServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private GameRegistry gameRegistry;
    private Matchmaker matchmaker;
    private GameService service;

    private Player alice;
    private Player bob;

    @BeforeEach
    void setUp() {
        MessageSerializer serializer = new MessageSerializer();
        gameRegistry = new GameRegistry();
        matchmaker = new Matchmaker(gameRegistry);
        service = new GameService(new PlayerRegistry(), gameRegistry, matchmaker,
                new Broadcaster(serializer), new Responses(serializer));

        alice = TestPlayers.newPlayer("unnamed");
        bob = TestPlayers.newPlayer("unnamed");
    }

    private JsonNode next(Player player) throws Exception {
        EmbeddedChannel channel = TestPlayers.channelOf(player);
        String json = channel.readOutbound();
        assertNotNull(json, "Expected a message for " + player.getDisplayName());
        return objectMapper.readTree(json);
    }

    private void assertNothingPending(Player player) {
        Object pending = TestPlayers.channelOf(player).readOutbound();
        assertNull(pending, "Unexpected message: " + pending);
    }

    /** Joins Alice then Bob and drains their join acks. */
    private String startGame() throws Exception {
        service.join(alice, new JoinRequest("Alice", null));
        next(alice);
        service.join(bob, new JoinRequest("Bob", null));
        String gameId = next(bob).get("data").get("game_id").asText();
        next(alice);
        return gameId;
    }

    // ==========================================
    // Test: Join
    // ==========================================

    @Test
    @DisplayName("Walkthrough: join, move, rejected move, move")
    void testScenario() throws Exception {
        service.join(alice, new JoinRequest("Alice", null));
        JsonNode waiting = next(alice);
        assertEquals("join_ack", waiting.get("type").asText());
        assertEquals("waiting", waiting.get("data").get("status").asText());

        service.join(bob, new JoinRequest("Bob", null));
        JsonNode bobAck = next(bob);
        JsonNode aliceAck = next(alice);
        assertEquals("success", bobAck.get("data").get("status").asText());
        assertEquals("success", aliceAck.get("data").get("status").asText());
        String gameId = aliceAck.get("data").get("game_id").asText();
        assertEquals(gameId, bobAck.get("data").get("game_id").asText());
        assertEquals("X", aliceAck.get("data").get("player_symbol").asText());
        assertEquals("O", bobAck.get("data").get("player_symbol").asText());
        assertEquals("Bob", aliceAck.get("data").get("opponent").asText());

        // Alice takes the corner; both see it
        service.move(alice, new MoveRequest(gameId, new int[]{0, 0}));
        for (Player player : new Player[]{alice, bob}) {
            JsonNode ack = next(player);
            assertEquals("move_ack", ack.get("type").asText());
            JsonNode data = ack.get("data");
            assertEquals("success", data.get("status").asText());
            assertEquals("X", data.get("game_state").get(0).get(0).asText());
            assertEquals("Bob", data.get("next_player").asText());
            assertTrue(data.get("winner").isNull());
            assertEquals(1, data.get("version").asLong());
        }

        // Bob tries the same cell; only Bob hears about it
        service.move(bob, new MoveRequest(gameId, new int[]{0, 0}));
        JsonNode rejected = next(bob).get("data");
        assertEquals("failure", rejected.get("status").asText());
        assertEquals("invalid_move", rejected.get("code").asText());
        assertEquals("X", rejected.get("game_state").get(0).get(0).asText());
        assertNothingPending(alice);

        service.move(bob, new MoveRequest(gameId, new int[]{1, 1}));
        JsonNode accepted = next(alice).get("data");
        assertEquals("O", accepted.get("game_state").get(1).get(1).asText());
        assertEquals("Alice", accepted.get("next_player").asText());
        next(bob);
    }

    @Test
    @DisplayName("Missing username gets a generated name")
    void testGeneratedName() throws Exception {
        service.join(alice, new JoinRequest(null, null));
        next(alice);
        assertTrue(alice.getDisplayName().startsWith("Player_"), alice.getDisplayName());
        assertTrue(alice.getDisplayName().length() > "Player_".length());
    }

    @Test
    @DisplayName("Joining twice is rejected")
    void testAlreadyJoined() throws Exception {
        service.join(alice, new JoinRequest("Alice", "cat.png"));
        next(alice);
        assertEquals("cat.png", alice.getAvatar());

        service.join(alice, new JoinRequest("Alice", null));
        JsonNode error = next(alice);
        assertEquals("error", error.get("type").asText());
        assertEquals("already_joined", error.get("data").get("code").asText());
    }

    // ==========================================
    // Test: Moves
    // ==========================================

    @Test
    @DisplayName("Moving out of turn yields not_your_turn")
    void testNotYourTurn() throws Exception {
        String gameId = startGame();

        service.move(bob, new MoveRequest(gameId, new int[]{1, 1}));
        JsonNode data = next(bob).get("data");
        assertEquals("failure", data.get("status").asText());
        assertEquals("not_your_turn", data.get("code").asText());
        assertNothingPending(alice);
    }

    @Test
    @DisplayName("Out-of-range positions yield invalid_move")
    void testOutOfBounds() throws Exception {
        String gameId = startGame();

        service.move(alice, new MoveRequest(gameId, new int[]{3, 1}));
        JsonNode data = next(alice).get("data");
        assertEquals("failure", data.get("status").asText());
        assertEquals("invalid_move", data.get("code").asText());
    }

    @Test
    @DisplayName("Unknown game id yields invalid_game")
    void testUnknownGame() throws Exception {
        startGame();

        service.move(alice, new MoveRequest("no-such-game", new int[]{0, 0}));
        JsonNode error = next(alice);
        assertEquals("error", error.get("type").asText());
        assertEquals("invalid_game", error.get("data").get("code").asText());
    }

    @Test
    @DisplayName("Outsiders cannot act on someone else's game")
    void testNotInGame() throws Exception {
        String gameId = startGame();
        Player mallory = TestPlayers.newPlayer("Mallory");

        service.move(mallory, new MoveRequest(gameId, new int[]{0, 0}));
        assertEquals("not_in_game", next(mallory).get("data").get("code").asText());
        assertNothingPending(alice);
        assertNothingPending(bob);
    }

    @Test
    @DisplayName("A winning move names the winner and frees both players")
    void testWinEndsGame() throws Exception {
        String gameId = startGame();
        int[][] script = {{0, 0}, {1, 0}, {0, 1}, {1, 1}, {0, 2}};
        JsonNode last = null;
        for (int i = 0; i < script.length; i++) {
            service.move(i % 2 == 0 ? alice : bob, new MoveRequest(gameId, script[i]));
            last = next(alice);
            next(bob);
        }

        assertEquals("Alice", last.get("data").get("winner").asText());
        assertTrue(last.get("data").get("next_player").isNull());
        assertFalse(gameRegistry.hasGame(gameId));
        assertEquals(PlayerStatus.IDLE, alice.getStatus());
        assertEquals(PlayerStatus.IDLE, bob.getStatus());

        // Both may queue up again
        service.join(alice, new JoinRequest("Alice", null));
        assertEquals("waiting", next(alice).get("data").get("status").asText());
    }

    @Test
    @DisplayName("Filling the board without a line reports a draw")
    void testDraw() throws Exception {
        String gameId = startGame();
        int[][] script = {{0, 0}, {0, 1}, {0, 2}, {1, 1}, {1, 0}, {1, 2}, {2, 1}, {2, 0}, {2, 2}};
        JsonNode last = null;
        for (int i = 0; i < script.length; i++) {
            service.move(i % 2 == 0 ? alice : bob, new MoveRequest(gameId, script[i]));
            last = next(bob);
            next(alice);
        }
        assertEquals("draw", last.get("data").get("winner").asText());
    }

    // ==========================================
    // Test: Chat
    // ==========================================

    @Test
    @DisplayName("Chat reaches both players, sender included")
    void testChat() throws Exception {
        String gameId = startGame();

        service.chat(bob, new ChatRequest(gameId, "good luck"));
        for (Player player : new Player[]{alice, bob}) {
            JsonNode message = next(player);
            assertEquals("chat_broadcast", message.get("type").asText());
            assertEquals("Bob", message.get("data").get("username").asText());
            assertEquals("good luck", message.get("data").get("message").asText());
        }
    }

    @Test
    @DisplayName("Chat ignores whose turn it is")
    void testChatOutOfTurn() throws Exception {
        String gameId = startGame();
        service.chat(bob, new ChatRequest(gameId, "my turn?"));
        service.chat(bob, new ChatRequest(gameId, "still not"));

        assertEquals("my turn?", next(alice).get("data").get("message").asText());
        assertEquals("still not", next(alice).get("data").get("message").asText());
    }

    // ==========================================
    // Test: Quit and Disconnect
    // ==========================================

    @Test
    @DisplayName("Quit acks the quitter and tells the opponent once")
    void testQuit() throws Exception {
        String gameId = startGame();

        service.quit(alice, new QuitRequest(gameId));

        JsonNode ack = next(alice);
        assertEquals("quit_ack", ack.get("type").asText());
        assertEquals("success", ack.get("data").get("status").asText());
        assertNothingPending(alice);

        JsonNode notice = next(bob);
        assertEquals("quit_ack", notice.get("type").asText());
        assertEquals("opponent_left", notice.get("data").get("reason").asText());
        assertTrue(notice.get("data").get("message").asText().contains("Alice"));
        assertNothingPending(bob);

        assertFalse(gameRegistry.hasGame(gameId));
        assertEquals(PlayerStatus.IDLE, alice.getStatus());
        assertEquals(PlayerStatus.IDLE, bob.getStatus());

        // The game is gone for everyone
        service.move(bob, new MoveRequest(gameId, new int[]{0, 0}));
        assertEquals("invalid_game", next(bob).get("data").get("code").asText());
    }

    @Test
    @DisplayName("Disconnect notifies only the survivor")
    void testDisconnectMidGame() throws Exception {
        String gameId = startGame();
        service.move(alice, new MoveRequest(gameId, new int[]{0, 0}));
        next(alice);
        next(bob);

        TestPlayers.channelOf(bob).close();
        service.disconnect(bob);

        JsonNode notice = next(alice);
        assertEquals("opponent_disconnected", notice.get("data").get("reason").asText());
        assertNothingPending(alice);
        assertFalse(gameRegistry.hasGame(gameId));
    }

    @Test
    @DisplayName("Disconnecting while waiting frees the slot")
    void testDisconnectWhileWaiting() throws Exception {
        service.join(alice, new JoinRequest("Alice", null));
        next(alice);

        TestPlayers.channelOf(alice).close();
        service.disconnect(alice);
        assertFalse(matchmaker.hasWaitingPlayer());

        service.join(bob, new JoinRequest("Bob", null));
        assertEquals("waiting", next(bob).get("data").get("status").asText());
    }

    @Test
    @DisplayName("Disconnect after the game ended sends nothing")
    void testDisconnectAfterGameOver() throws Exception {
        String gameId = startGame();
        service.quit(alice, new QuitRequest(gameId));
        next(alice);
        next(bob);

        service.disconnect(alice);
        service.disconnect(bob);
        assertNothingPending(alice);
        assertNothingPending(bob);
    }
}
