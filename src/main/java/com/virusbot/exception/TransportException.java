package com.virusbot.exception;

/**
 * Connecting to the game server or sending to it failed.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
