package dev.holdem.hand.betting;

/**
 * Actions a player can take when it is their turn.
 */
public enum ActionType {
    FOLD,
    CHECK,
    CALL,
    /** Raise to a total bet this round; with nothing to call this opens the betting. */
    RAISE,
    ALL_IN
}
