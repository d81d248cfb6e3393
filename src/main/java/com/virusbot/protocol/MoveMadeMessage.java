package com.virusbot.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MoveMadeMessage(String gameId, int row, int col, int player, int movesLeft) implements ServerMessage {

    @Override
    public MessageType type() {
        return MessageType.MOVE_MADE;
    }
}
