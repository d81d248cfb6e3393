package com.virusbot.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GameEndMessage(int winner, List<Integer> eliminated, String message) implements ServerMessage {

    @Override
    public MessageType type() {
        return MessageType.GAME_END;
    }
}
