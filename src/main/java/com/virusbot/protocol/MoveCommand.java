package com.virusbot.protocol;

import com.virusbot.model.Position;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Claims one cell. The server expects the fields at the top level, not under {@code data}.
 */
public record MoveCommand(int row, int col, String gameId) implements OutboundMessage {

    public static MoveCommand of(Position target, String gameId) {
        return new MoveCommand(target.row(), target.col(), gameId);
    }

    @Override
    public MessageType type() {
        return MessageType.MOVE;
    }

    @Override
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type().getWireName());
        payload.put("row", row);
        payload.put("col", col);
        payload.put("gameId", gameId == null ? "" : gameId);
        return payload;
    }
}
