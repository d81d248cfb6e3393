package com.virusbot.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WelcomeMessage(String userId, String username) implements ServerMessage {

    @Override
    public MessageType type() {
        return MessageType.WELCOME;
    }
}
