package com.virusbot.protocol;

import java.util.LinkedHashMap;
import java.util.Map;

public record AcceptChallengeCommand(String challengeId) implements OutboundMessage {

    @Override
    public MessageType type() {
        return MessageType.ACCEPT_CHALLENGE;
    }

    @Override
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type().getWireName());
        payload.put("challengeId", challengeId);
        return payload;
    }
}
