package com.virusbot.protocol;

import java.util.Arrays;

/**
 * Message types of the game server protocol, by wire name.
 */
public enum MessageType {
    WELCOME("welcome"),
    USERS_UPDATE("users_update"),
    CHALLENGE_RECEIVED("challenge_received"),
    GAME_START("game_start"),
    MOVE_MADE("move_made"),
    TURN_CHANGE("turn_change"),
    GAME_END("game_end"),

    MOVE("move"),
    ACCEPT_CHALLENGE("accept_challenge"),
    JOIN_LOBBY("join_lobby"),
    CREATE_LOBBY("create_lobby"),

    UNKNOWN("");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static MessageType fromWire(String wireName) {
        if (wireName == null || wireName.isEmpty()) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
