package com.virusbot.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.virusbot.exception.ProtocolException;
import com.virusbot.model.CellState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.ObjectReader;

/**
 * JSON encoding of the game server protocol. Every message is a flat JSON object whose
 * {@code type} field selects the message class.
 */
@Component
@Slf4j
public class MessageCodec {

    static final int MAX_BOARD_SIZE = 100;

    private final ObjectMapper objectMapper;
    private final ObjectReader reader;

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.reader = objectMapper.reader()
                .without(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Decode one text frame.
     *
     * @throws ProtocolException if the text is not a JSON object with a {@code type},
     *                           a {@code game_start} board is not square or larger than
     *                           {@value #MAX_BOARD_SIZE}, or a move or turn names a
     *                           player outside 1..{@value CellState#MAX_PLAYER}
     */
    public ServerMessage decode(String text) {
        if (text == null || text.isBlank()) {
            throw new ProtocolException("Empty message");
        }

        Envelope envelope = read(text, Envelope.class);
        if (envelope.type() == null || envelope.type().isBlank()) {
            throw new ProtocolException("Message has no type");
        }

        MessageType type = MessageType.fromWire(envelope.type());
        ServerMessage message = switch (type) {
            case WELCOME -> read(text, WelcomeMessage.class);
            case USERS_UPDATE -> read(text, UsersUpdateMessage.class);
            case CHALLENGE_RECEIVED -> read(text, ChallengeMessage.class);
            case GAME_START -> validate(read(text, GameStartMessage.class));
            case MOVE_MADE -> validate(read(text, MoveMadeMessage.class));
            case TURN_CHANGE -> validate(read(text, TurnChangeMessage.class));
            case GAME_END -> read(text, GameEndMessage.class);
            default -> new UnknownMessage(envelope.type());
        };
        log.trace("Decoded {} message", envelope.type());
        return message;
    }

    public String encode(OutboundMessage message) {
        try {
            return objectMapper.writeValueAsString(message.toPayload());
        } catch (JacksonException e) {
            throw new ProtocolException("Cannot encode " + message.type() + " message", e);
        }
    }

    private <T> T read(String text, Class<T> type) {
        try {
            T value = reader.forType(type).readValue(text);
            if (value == null) {
                throw new ProtocolException("Message is JSON null");
            }
            return value;
        } catch (JacksonException e) {
            throw new ProtocolException("Malformed message: " + e.getOriginalMessage(), e);
        }
    }

    private static GameStartMessage validate(GameStartMessage message) {
        int[][] board = message.board();
        if (board == null) {
            if (!message.hasDimensionsOnly()) {
                throw new ProtocolException("game_start carries neither a board nor dimensions");
            }
            if (message.rows() != message.cols()) {
                throw new ProtocolException("game_start board is not square: "
                        + message.rows() + "x" + message.cols());
            }
            checkBoardSize(message.rows());
            return message;
        }
        if (board.length == 0) {
            throw new ProtocolException("game_start board is empty");
        }
        checkBoardSize(board.length);
        for (int[] row : board) {
            if (row == null || row.length != board.length) {
                throw new ProtocolException("game_start board is not square");
            }
        }
        return message;
    }

    private static void checkBoardSize(int size) {
        if (size > MAX_BOARD_SIZE) {
            throw new ProtocolException("game_start board too large: " + size + "x" + size);
        }
    }

    private static MoveMadeMessage validate(MoveMadeMessage message) {
        checkPlayer("move_made", message.player());
        return message;
    }

    private static TurnChangeMessage validate(TurnChangeMessage message) {
        checkPlayer("turn_change", message.player());
        return message;
    }

    private static void checkPlayer(String type, int player) {
        if (player < 1 || player > CellState.MAX_PLAYER) {
            throw new ProtocolException(type + " names an invalid player: " + player);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Envelope(String type) {
    }
}
