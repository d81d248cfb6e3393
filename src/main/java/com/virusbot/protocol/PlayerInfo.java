package com.virusbot.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.virusbot.model.Position;

/**
 * Roster entry of a {@code game_start} message; {@code position} is the player's base.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlayerInfo(
        int id,
        String name,
        int symbol,
        Position position,
        @JsonProperty("isAI") boolean ai
) {
}
