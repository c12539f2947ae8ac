package dev.holdem.handflow;

import dev.holdem.hand.betting.Street;

/**
 * States of the hand state machine.
 *
 * <p>Transitions are linear, except that any betting state may jump straight
 * to {@link #HAND_COMPLETE} when a single player is left in the hand.
 */
public enum HandPhase {
    HAND_SETUP,
    PRE_FLOP_BETTING,
    FLOP,
    FLOP_BETTING,
    TURN,
    TURN_BETTING,
    RIVER,
    RIVER_BETTING,
    SHOWDOWN,
    HAND_COMPLETE;

    public boolean isBetting() {
        return this == PRE_FLOP_BETTING || this == FLOP_BETTING || this == TURN_BETTING || this == RIVER_BETTING;
    }

    public boolean isReveal() {
        return this == FLOP || this == TURN || this == RIVER;
    }

    public HandPhase next() {
        if (this == HAND_COMPLETE) {
            throw new IllegalStateException("HAND_COMPLETE is terminal");
        }
        return values()[ordinal() + 1];
    }

    public boolean canTransitionTo(HandPhase target) {
        if (this == HAND_COMPLETE) {
            return false;
        }
        return target == next() || (isBetting() && target == HAND_COMPLETE);
    }

    /**
     * Street a betting or reveal state belongs to, or null for the other states.
     */
    public Street street() {
        switch (this) {
            case PRE_FLOP_BETTING:
                return Street.PRE_FLOP;
            case FLOP:
            case FLOP_BETTING:
                return Street.FLOP;
            case TURN:
            case TURN_BETTING:
                return Street.TURN;
            case RIVER:
            case RIVER_BETTING:
                return Street.RIVER;
            default:
                return null;
        }
    }
}
