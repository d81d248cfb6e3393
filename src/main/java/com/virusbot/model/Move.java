package com.virusbot.model;

/**
 * A single cell action: expand from {@code origin} into {@code target}.
 * For the initial placement the origin is the target itself.
 */
public record Move(MoveType type, Position target, Position origin) {

    public static Move grow(Position target, Position origin) {
        return new Move(MoveType.GROW, target, origin);
    }

    public static Move attack(Position target, Position origin) {
        return new Move(MoveType.ATTACK, target, origin);
    }

    public boolean isAttack() {
        return type == MoveType.ATTACK;
    }
}
