package com.virusbot.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TurnChangeMessage(String gameId, int player, int movesLeft) implements ServerMessage {

    @Override
    public MessageType type() {
        return MessageType.TURN_CHANGE;
    }
}
