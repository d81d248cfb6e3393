package com.virusbot.protocol;

import java.util.LinkedHashMap;
import java.util.Map;

public record CreateLobbyCommand(int boardSize) implements OutboundMessage {

    @Override
    public MessageType type() {
        return MessageType.CREATE_LOBBY;
    }

    @Override
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type().getWireName());
        payload.put("data", Map.of("boardSize", boardSize));
        return payload;
    }
}
