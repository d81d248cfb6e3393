package com.virusbot.protocol;

import java.util.Map;

/**
 * A command sent to the game server. {@link #toPayload()} is the JSON object as written
 * on the wire, including its {@code type} field.
 */
public interface OutboundMessage {

    MessageType type();

    Map<String, Object> toPayload();
}
