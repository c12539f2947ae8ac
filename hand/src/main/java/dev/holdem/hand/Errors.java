package dev.holdem.hand;

/**
 * Exception types raised by the hold'em engine.
 */
public class Errors {

    private Errors() {}

    /**
     * Base exception for all engine errors.
     */
    public static class HoldemError extends RuntimeException {
        public HoldemError(String message) {
            super(message);
        }

        public HoldemError(String message, Throwable cause) {
            super(message, cause);
        }

        /**
         * Returns true if the caller may retry with a different action.
         */
        public boolean isRecoverable() {
            return false;
        }

        /**
         * Returns true if the current hand cannot continue.
         */
        public boolean isFatal() {
            return false;
        }
    }

    /**
     * Thrown when an action is not permitted in the current betting state.
     *
     * <p>The betting state is unchanged when this is thrown, so the same actor
     * can be asked again:
     * <pre>{@code
     * try {
     *     round.apply(seat, PlayerAction.raiseTo(25));
     * } catch (Errors.IllegalActionError e) {
     *     if (e.getReason() == Errors.Reason.BELOW_MINIMUM_RAISE) { ... }
     * }
     * }</pre>
     */
    public static class IllegalActionError extends HoldemError {
        private final Reason reason;

        public IllegalActionError(Reason reason, String message) {
            super(message);
            this.reason = reason;
        }

        public Reason getReason() {
            return reason;
        }

        public static IllegalActionError notYourTurn(int seat, int expectedSeat) {
            return new IllegalActionError(Reason.NOT_YOUR_TURN,
                "Seat " + seat + " acted out of turn, action is on seat " + expectedSeat);
        }

        public static IllegalActionError roundComplete() {
            return new IllegalActionError(Reason.ROUND_COMPLETE, "Betting round is complete");
        }

        public static IllegalActionError cannotCheck(long toCall) {
            return new IllegalActionError(Reason.CANNOT_CHECK, "Cannot check, must call " + toCall + " or fold");
        }

        public static IllegalActionError nothingToCall() {
            return new IllegalActionError(Reason.NOTHING_TO_CALL, "Nothing to call");
        }

        public static IllegalActionError belowMinimumRaise(long raiseTo, long minimumRaiseTo) {
            return new IllegalActionError(Reason.BELOW_MINIMUM_RAISE,
                "Raise to " + raiseTo + " is below the minimum raise to " + minimumRaiseTo);
        }

        public static IllegalActionError bettingNotReopened() {
            return new IllegalActionError(Reason.BETTING_NOT_REOPENED,
                "Betting was not reopened, only call or fold are allowed");
        }

        public static IllegalActionError playerNotActive(int seat) {
            return new IllegalActionError(Reason.PLAYER_NOT_ACTIVE, "Seat " + seat + " cannot act in this hand");
        }

        public static IllegalActionError noHandInProgress() {
            return new IllegalActionError(Reason.NO_HAND_IN_PROGRESS, "No hand is awaiting an action");
        }

        @Override
        public boolean isRecoverable() {
            return true;
        }
    }

    /**
     * Thrown when a raise needs more chips than the player holds.
     * The player can shove {@link #getAvailableStack()} with an all-in instead.
     */
    public static class InsufficientStackError extends IllegalActionError {
        private final long required;
        private final long availableStack;

        public InsufficientStackError(long required, long availableStack) {
            super(Reason.INSUFFICIENT_STACK,
                "Action needs " + required + " chips but only " + availableStack + " remain, go all-in instead");
            this.required = required;
            this.availableStack = availableStack;
        }

        public long getRequired() {
            return required;
        }

        public long getAvailableStack() {
            return availableStack;
        }
    }

    /**
     * Thrown when a card is dealt from an exhausted deck.
     */
    public static class EmptyDeckError extends HoldemError {
        public EmptyDeckError(int requested, int remaining) {
            super("Cannot deal " + requested + " card(s), " + remaining + " remain in the deck");
        }

        @Override
        public boolean isFatal() {
            return true;
        }
    }

    /**
     * Thrown when the chips awarded at showdown differ from the chips contributed.
     */
    public static class PotConservationError extends HoldemError {
        private final long contributed;
        private final long awarded;

        public PotConservationError(long contributed, long awarded) {
            super("Pot conservation violated: contributed " + contributed + " but awarded " + awarded);
            this.contributed = contributed;
            this.awarded = awarded;
        }

        public long getContributed() {
            return contributed;
        }

        public long getAwarded() {
            return awarded;
        }

        @Override
        public boolean isFatal() {
            return true;
        }
    }

    /**
     * Thrown by an action source when a pending request is abandoned,
     * e.g. on input timeout or closed input.
     */
    public static class ActionAbortedError extends HoldemError {
        public ActionAbortedError(String message) {
            super(message);
        }

        public ActionAbortedError(String message, Throwable cause) {
            super(message, cause);
        }

        @Override
        public boolean isRecoverable() {
            return true;
        }
    }

    /**
     * Thrown after a hand was aborted by a fatal error and every stack was
     * restored to its value before the hand.
     */
    public static class HandAbortedError extends HoldemError {
        private final long handNumber;

        public HandAbortedError(long handNumber, Throwable cause) {
            super("Hand #" + handNumber + " aborted: " + cause.getMessage(), cause);
            this.handNumber = handNumber;
        }

        public long getHandNumber() {
            return handNumber;
        }

        @Override
        public boolean isFatal() {
            return true;
        }
    }

    /**
     * Specific constraint an illegal action violated.
     */
    public enum Reason {
        NOT_YOUR_TURN,
        ROUND_COMPLETE,
        CANNOT_CHECK,
        NOTHING_TO_CALL,
        BELOW_MINIMUM_RAISE,
        BETTING_NOT_REOPENED,
        INSUFFICIENT_STACK,
        PLAYER_NOT_ACTIVE,
        NO_HAND_IN_PROGRESS
    }
}
