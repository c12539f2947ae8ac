package dev.holdem.hand.betting;

import java.util.Set;

/**
 * What the player to act may do.
 *
 * @param toCall chips needed to match the bet to call
 * @param minRaiseTo smallest legal raise-to total, or 0 when raising is not allowed
 * @param maxRaiseTo largest raise-to total the stack covers
 */
public record ActionRequest(
    Street street,
    int seat,
    long betToCall,
    long toCall,
    long minRaiseTo,
    long maxRaiseTo,
    long stack,
    Set<ActionType> legalActions
) {
    public ActionRequest {
        legalActions = Set.copyOf(legalActions);
    }

    public boolean canRaise() {
        return legalActions.contains(ActionType.RAISE);
    }
}
