package com.tictactoe;

import com.fasterxml.jackson.databind.JsonNode;
import com.tictactoe.config.ServerConfig;
import com.tictactoe.server.GameServer;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests over real sockets against a server bound to an ephemeral port.
 */
@DisplayName("Networking Tests")
class NetworkingTest {

    private GameServer server;
    private final List<TestClient> clients = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        server = new GameServer(ServerConfig.builder().port(0).build());
        server.bind();
    }

    @AfterEach
    void tearDown() throws Exception {
        for (TestClient client : clients) {
            client.close();
        }
        server.shutdown();
    }

    private TestClient connect() throws Exception {
        TestClient client = new TestClient(server.getBoundPort());
        clients.add(client);
        return client;
    }

    // ==========================================
    // Test: Full game over TCP
    // ==========================================

    @Test
    @DisplayName("Two clients pair up and play to a win")
    void testFullGame() throws Exception {
        TestClient alice = connect();
        TestClient bob = connect();

        alice.join("Alice");
        assertEquals("waiting", alice.next().get("data").get("status").asText());

        bob.join("Bob");
        JsonNode bobAck = bob.next();
        JsonNode aliceAck = alice.next();
        String gameId = bobAck.get("data").get("game_id").asText();
        assertEquals(gameId, aliceAck.get("data").get("game_id").asText());
        assertEquals("X", aliceAck.get("data").get("player_symbol").asText());
        assertEquals("O", bobAck.get("data").get("player_symbol").asText());

        int[][] script = {{0, 0}, {1, 1}, {0, 1}, {2, 2}, {0, 2}};
        JsonNode last = null;
        for (int i = 0; i < script.length; i++) {
            TestClient mover = i % 2 == 0 ? alice : bob;
            mover.move(gameId, script[i][0], script[i][1]);
            last = alice.next();
            JsonNode seenByBob = bob.next();
            assertEquals("move_ack", last.get("type").asText());
            assertEquals(last.get("data").get("version").asLong(), seenByBob.get("data").get("version").asLong());
        }

        assertEquals("Alice", last.get("data").get("winner").asText());
        assertTrue(last.get("data").get("next_player").isNull());
        assertEquals(0, server.getGameRegistry().getGameCount());
        System.out.println("✓ Full game played over TCP");
    }

    @Test
    @DisplayName("Rejected move only reaches the mover")
    void testRejectedMove() throws Exception {
        TestClient alice = connect();
        TestClient bob = connect();
        alice.join("Alice");
        alice.next();
        bob.join("Bob");
        String gameId = bob.next().get("data").get("game_id").asText();
        alice.next();

        alice.move(gameId, 0, 0);
        alice.next();
        bob.next();

        bob.move(gameId, 0, 0);
        JsonNode rejected = bob.next();
        assertEquals("move_ack", rejected.get("type").asText());
        assertEquals("failure", rejected.get("data").get("status").asText());
        assertEquals("invalid_move", rejected.get("data").get("code").asText());
        assertNull(alice.next(300), "Alice should not hear about Bob's rejected move");
    }

    @Test
    @DisplayName("Coordinates too large for an int are an invalid move, not a protocol error")
    void testHugeCoordinates() throws Exception {
        TestClient alice = connect();
        TestClient bob = connect();
        alice.join("Alice");
        alice.next();
        bob.join("Bob");
        String gameId = bob.next().get("data").get("game_id").asText();
        alice.next();

        alice.sendRaw("{\"type\": \"move\", \"data\": {\"game_id\": \"" + gameId
                + "\", \"position\": [5000000000, 0]}}");
        JsonNode rejected = alice.next();
        assertEquals("move_ack", rejected.get("type").asText());
        assertEquals("failure", rejected.get("data").get("status").asText());
        assertEquals("invalid_move", rejected.get("data").get("code").asText());
        assertNull(bob.next(300));

        alice.move(gameId, 0, 0);
        assertEquals("success", alice.next().get("data").get("status").asText());
    }

    @Test
    @DisplayName("Chat is broadcast to both players")
    void testChat() throws Exception {
        TestClient alice = connect();
        TestClient bob = connect();
        alice.join("Alice");
        alice.next();
        bob.join("Bob");
        String gameId = bob.next().get("data").get("game_id").asText();
        alice.next();

        alice.chat(gameId, "gl hf");
        for (TestClient client : List.of(alice, bob)) {
            JsonNode chat = client.next();
            assertEquals("chat_broadcast", chat.get("type").asText());
            assertEquals("Alice", chat.get("data").get("username").asText());
            assertEquals("gl hf", chat.get("data").get("message").asText());
        }
    }

    @Test
    @DisplayName("Quit ends the game for both sides")
    void testQuit() throws Exception {
        TestClient alice = connect();
        TestClient bob = connect();
        alice.join("Alice");
        alice.next();
        bob.join("Bob");
        String gameId = bob.next().get("data").get("game_id").asText();
        alice.next();

        bob.quit(gameId);
        JsonNode ack = bob.next();
        assertEquals("quit_ack", ack.get("type").asText());
        assertFalse(ack.get("data").has("reason"));

        JsonNode notice = alice.next();
        assertEquals("quit_ack", notice.get("type").asText());
        assertEquals("opponent_left", notice.get("data").get("reason").asText());
        assertEquals("Bob has left the game.", notice.get("data").get("message").asText());
    }

    // ==========================================
    // Test: Bad input keeps the connection
    // ==========================================

    @Test
    @DisplayName("Malformed lines get an error and the connection stays usable")
    void testMalformedInput() throws Exception {
        TestClient client = connect();

        client.sendRaw("this is not json");
        JsonNode error = client.next();
        assertEquals("error", error.get("type").asText());
        assertEquals("invalid_json", error.get("data").get("code").asText());

        client.sendRaw("{\"type\": \"teleport\", \"data\": {}}");
        assertEquals("unknown_type", client.next().get("data").get("code").asText());

        client.sendRaw("{\"type\": \"move\", \"data\": {\"game_id\": \"g\"}}");
        assertEquals("missing_data", client.next().get("data").get("code").asText());

        client.join("Alice");
        assertEquals("join_ack", client.next().get("type").asText());
    }

    @Test
    @DisplayName("Blank lines are ignored")
    void testBlankLines() throws Exception {
        TestClient client = connect();
        client.sendRaw("");
        client.sendRaw("   ");
        client.join("Alice");

        assertEquals("join_ack", client.next().get("type").asText());
        assertNull(client.next(200));
    }

    @Test
    @DisplayName("Several pairs play side by side")
    void testParallelGames() throws Exception {
        int pairs = 5;
        List<TestClient[]> games = new ArrayList<>();
        List<String> gameIds = new ArrayList<>();
        for (int i = 0; i < pairs; i++) {
            TestClient x = connect();
            TestClient o = connect();
            x.join("X" + i);
            x.next();
            o.join("O" + i);
            gameIds.add(o.next().get("data").get("game_id").asText());
            x.next();
            games.add(new TestClient[]{x, o});
        }
        assertEquals(pairs, server.getGameRegistry().getGameCount());

        for (int i = 0; i < pairs; i++) {
            TestClient[] game = games.get(i);
            game[0].move(gameIds.get(i), 1, 1);
        }
        for (int i = 0; i < pairs; i++) {
            TestClient[] game = games.get(i);
            JsonNode seen = game[1].next();
            assertEquals(gameIds.get(i), seen.get("data").get("game_id").asText());
            assertEquals("O" + i, seen.get("data").get("next_player").asText());
            game[0].next();
        }
        System.out.println("✓ " + pairs + " games ran independently");
    }
}
