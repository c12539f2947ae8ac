package dev.holdem.handflow;

/**
 * What the engine does when an action request is abandoned.
 */
public enum AbortPolicy {
    /** Ask the same player again. */
    REPROMPT,
    /** Treat the abandoned request as a fold. */
    FOLD
}
