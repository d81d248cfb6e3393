package com.virusbot.model;

/**
 * Kind of cell action.
 */
public enum MoveType {
    /** Claim an empty cell. */
    GROW,
    /** Capture an attackable opponent cell. */
    ATTACK
}
