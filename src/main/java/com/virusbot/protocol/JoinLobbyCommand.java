package com.virusbot.protocol;

import java.util.LinkedHashMap;
import java.util.Map;

public record JoinLobbyCommand(String lobbyId) implements OutboundMessage {

    @Override
    public MessageType type() {
        return MessageType.JOIN_LOBBY;
    }

    @Override
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type().getWireName());
        payload.put("data", Map.of("lobbyId", lobbyId));
        return payload;
    }
}
