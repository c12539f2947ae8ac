package dev.holdem.handflow;

import dev.holdem.hand.Errors;
import dev.holdem.hand.betting.ActionRequest;
import dev.holdem.hand.betting.PlayerAction;

/**
 * Supplies the action for the player whose turn it is: a console prompt, a
 * scripted test or an automated strategy.
 */
public interface ActionSource {

    /**
     * Blocks until the player decides.
     *
     * @param request options for the player to act
     * @param view the table as that player sees it
     * @throws Errors.ActionAbortedError if the request is abandoned
     */
    PlayerAction nextAction(ActionRequest request, TableSnapshot view);

    /**
     * Called when the chosen action was rejected; the same player is asked again.
     */
    default void onIllegalAction(ActionRequest request, Errors.IllegalActionError error) {
    }

    /**
     * True once the source can never supply another action, e.g. its input
     * stream has ended. An abandoned request from a closed source aborts the hand.
     */
    default boolean isClosed() {
        return false;
    }
}
