package com.virusbot.protocol;

/**
 * A decoded message received from the game server.
 */
public interface ServerMessage {

    MessageType type();
}
