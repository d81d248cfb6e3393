package com.virusbot.exception;

/**
 * A server message that cannot be decoded or is structurally invalid.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
