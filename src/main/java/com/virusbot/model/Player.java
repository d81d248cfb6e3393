package com.virusbot.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * A participant of the game. Territory is not stored here; it is whatever the
 * board says the player owns.
 */
@Value
@Builder(toBuilder = true)
@With
public class Player {

    int id;

    String name;

    Position basePosition;

    @Builder.Default
    boolean alive = true;

    /** Whether the one-time pair of neutral blocks has been placed. */
    @Builder.Default
    boolean blocksUsed = false;
}
