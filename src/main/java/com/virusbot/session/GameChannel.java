package com.virusbot.session;

import com.virusbot.protocol.OutboundMessage;

/**
 * Outgoing side of the server connection.
 */
public interface GameChannel {

    /**
     * @throws com.virusbot.exception.TransportException if the message cannot be sent
     */
    void send(OutboundMessage message);
}
