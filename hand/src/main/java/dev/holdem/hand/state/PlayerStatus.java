package dev.holdem.hand.state;

/**
 * A player's status in the current hand.
 */
public enum PlayerStatus {
    /** In the hand and able to act. */
    ACTIVE,
    /** Gave up the hand; chips already committed stay in the pot. */
    FOLDED,
    /** Committed the whole stack; stays in the hand without acting. */
    ALL_IN,
    /** Not dealt into the hand. */
    SITTING_OUT
}
