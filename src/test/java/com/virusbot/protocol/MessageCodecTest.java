package com.virusbot.protocol;

import com.virusbot.exception.ProtocolException;
import com.virusbot.model.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MessageCodec decoding and encoding.
 */
class MessageCodecTest {

    private ObjectMapper objectMapper;
    private MessageCodec codec;

    @BeforeEach
    void setUp() {
        objectMapper = JsonMapper.builder().build();
        codec = new MessageCodec(objectMapper);
    }

    @Nested
    @DisplayName("Decoding")
    class DecodeTests {

        @Test
        @DisplayName("welcome carries the user id and name")
        void welcome() {
            ServerMessage message = codec.decode("{\"type\":\"welcome\",\"userId\":\"u-1\",\"username\":\"VirusBot\"}");

            assertEquals(new WelcomeMessage("u-1", "VirusBot"), message);
        }

        @Test
        @DisplayName("game_start with a board")
        void gameStartWithBoard() {
            String json = """
                    {"type":"game_start",
                     "board":[[17,0,0],[0,0,0],[0,0,18]],
                     "players":[
                       {"id":1,"name":"Bot","symbol":1,"position":{"row":0,"col":0},"isAI":true},
                       {"id":2,"name":"Human","symbol":2,"position":{"row":2,"col":2}}],
                     "currentPlayer":1,
                     "yourPlayerId":1}
                    """;

            GameStartMessage start = (GameStartMessage) codec.decode(json);

            assertFalse(start.hasDimensionsOnly());
            assertEquals(1, start.ownPlayerId());
            assertEquals(3, start.board().length);
            assertEquals(17, start.board()[0][0]);
            assertEquals(2, start.players().size());
            assertTrue(start.players().get(0).ai());
            assertEquals(new Position(2, 2), start.players().get(1).position());
        }

        @Test
        @DisplayName("game_start with dimensions only")
        void gameStartWithDimensions() {
            String json = "{\"type\":\"game_start\",\"gameId\":\"g-7\",\"opponentId\":\"u-2\","
                    + "\"opponentUsername\":\"Rival\",\"yourPlayer\":2,\"rows\":10,\"cols\":10}";

            GameStartMessage start = (GameStartMessage) codec.decode(json);

            assertTrue(start.hasDimensionsOnly());
            assertEquals(2, start.ownPlayerId());
            assertEquals("g-7", start.gameId());
            assertTrue(start.playersOrEmpty().isEmpty());
        }

        @Test
        @DisplayName("move_made and turn_change")
        void moveAndTurn() {
            assertEquals(new MoveMadeMessage("g-1", 3, 4, 2, 1),
                    codec.decode("{\"type\":\"move_made\",\"gameId\":\"g-1\",\"row\":3,\"col\":4,\"player\":2,\"movesLeft\":1}"));
            assertEquals(new TurnChangeMessage("g-1", 1, 3),
                    codec.decode("{\"type\":\"turn_change\",\"gameId\":\"g-1\",\"player\":1,\"movesLeft\":3}"));
        }

        @Test
        @DisplayName("missing numbers decode as zero")
        void missingNumbersAreZero() {
            MoveMadeMessage move = (MoveMadeMessage) codec.decode("{\"type\":\"move_made\",\"row\":1,\"col\":2,\"player\":1}");

            assertEquals(0, move.movesLeft());
            assertNull(move.gameId());
        }

        @Test
        @DisplayName("game_end and challenge_received")
        void endAndChallenge() {
            assertEquals(new GameEndMessage(2, List.of(1), "Player 2 wins"),
                    codec.decode("{\"type\":\"game_end\",\"winner\":2,\"eliminated\":[1],\"message\":\"Player 2 wins\"}"));
            assertEquals(new ChallengeMessage("c-9", "u-3", "Alice"),
                    codec.decode("{\"type\":\"challenge_received\",\"challengeId\":\"c-9\",\"fromUserId\":\"u-3\",\"fromUsername\":\"Alice\"}"));
        }

        @Test
        @DisplayName("unknown types decode to an UNKNOWN message")
        void unknownType() {
            ServerMessage message = codec.decode("{\"type\":\"lobby_update\",\"lobbyId\":\"x\"}");

            assertEquals(MessageType.UNKNOWN, message.type());
            assertEquals("lobby_update", ((UnknownMessage) message).wireType());
        }

        @Test
        @DisplayName("malformed input raises ProtocolException")
        void malformedInput() {
            assertThrows(ProtocolException.class, () -> codec.decode("not json"));
            assertThrows(ProtocolException.class, () -> codec.decode("{\"userId\":\"u-1\"}"));
            assertThrows(ProtocolException.class, () -> codec.decode(""));
            assertThrows(ProtocolException.class, () -> codec.decode("[1,2,3]"));
        }

        @Test
        @DisplayName("a non-square board raises ProtocolException")
        void nonSquareBoard() {
            assertThrows(ProtocolException.class,
                    () -> codec.decode("{\"type\":\"game_start\",\"board\":[[0,0],[0]],\"currentPlayer\":1,\"yourPlayerId\":1}"));
            assertThrows(ProtocolException.class,
                    () -> codec.decode("{\"type\":\"game_start\",\"yourPlayer\":1,\"rows\":10,\"cols\":8}"));
        }

        @Test
        @DisplayName("oversized dimensions raise ProtocolException instead of allocating a board")
        void oversizedBoard() {
            ProtocolException e = assertThrows(ProtocolException.class,
                    () -> codec.decode("{\"type\":\"game_start\",\"yourPlayer\":1,\"rows\":50000,\"cols\":50000}"));
            assertTrue(e.getMessage().contains("too large"));

            int limit = MessageCodec.MAX_BOARD_SIZE;
            GameStartMessage largest = (GameStartMessage) codec.decode(
                    "{\"type\":\"game_start\",\"yourPlayer\":1,\"rows\":" + limit + ",\"cols\":" + limit + "}");
            assertEquals(limit, largest.rows());
        }

        @Test
        @DisplayName("moves and turns of a player outside 1..4 raise ProtocolException")
        void invalidPlayer() {
            assertThrows(ProtocolException.class,
                    () -> codec.decode("{\"type\":\"move_made\",\"gameId\":\"g-1\",\"row\":0,\"col\":1,\"player\":7,\"movesLeft\":2}"));
            assertThrows(ProtocolException.class,
                    () -> codec.decode("{\"type\":\"move_made\",\"gameId\":\"g-1\",\"row\":0,\"col\":1,\"movesLeft\":2}"));
            assertThrows(ProtocolException.class,
                    () -> codec.decode("{\"type\":\"turn_change\",\"gameId\":\"g-1\",\"player\":0,\"movesLeft\":3}"));
        }
    }

    @Nested
    @DisplayName("Encoding")
    class EncodeTests {

        private Map<?, ?> parse(String json) {
            return objectMapper.readValue(json, Map.class);
        }

        @Test
        @DisplayName("move fields sit at the top level")
        void moveIsFlat() {
            Map<?, ?> json = parse(codec.encode(MoveCommand.of(new Position(3, 4), "g-1")));

            assertEquals(Map.of("type", "move", "row", 3, "col", 4, "gameId", "g-1"), json);
        }

        @Test
        @DisplayName("accept_challenge carries the challenge id at the top level")
        void acceptIsFlat() {
            Map<?, ?> json = parse(codec.encode(new AcceptChallengeCommand("c-9")));

            assertEquals(Map.of("type", "accept_challenge", "challengeId", "c-9"), json);
        }

        @Test
        @DisplayName("lobby commands nest their fields under data")
        void lobbyCommandsAreNested() {
            Map<?, ?> join = parse(codec.encode(new JoinLobbyCommand("L-1")));
            Map<?, ?> create = parse(codec.encode(new CreateLobbyCommand(10)));

            assertEquals(Map.of("type", "join_lobby", "data", Map.of("lobbyId", "L-1")), join);
            assertEquals(Map.of("type", "create_lobby", "data", Map.of("boardSize", 10)), create);
        }
    }
}
