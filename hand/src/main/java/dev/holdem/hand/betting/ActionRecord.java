package dev.holdem.hand.betting;

/**
 * One accepted action in the hand history.
 *
 * @param kind what happened, including blind posts
 * @param amount chips moved from the stack by this action
 * @param betTo the player's total bet this round after the action
 * @param potTotal pot after the action
 */
public record ActionRecord(Street street, int seat, Kind kind, long amount, long betTo, long potTotal) {

    public enum Kind {
        SMALL_BLIND,
        BIG_BLIND,
        FOLD,
        CHECK,
        CALL,
        BET,
        RAISE,
        ALL_IN
    }
}
