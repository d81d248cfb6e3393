package com.virusbot.protocol;

/**
 * A message whose type the bot does not handle.
 */
public record UnknownMessage(String wireType) implements ServerMessage {

    @Override
    public MessageType type() {
        return MessageType.UNKNOWN;
    }
}
