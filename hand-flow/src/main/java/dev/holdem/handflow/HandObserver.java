package dev.holdem.handflow;

import dev.holdem.hand.betting.ActionRecord;
import dev.holdem.hand.betting.Street;
import dev.holdem.hand.cards.Card;

import java.util.List;

/**
 * Receives spectator views as a hand progresses. Observers never change engine state.
 */
public interface HandObserver {

    default void onHandStarted(TableSnapshot view) {
    }

    default void onAction(ActionRecord action, TableSnapshot view) {
    }

    default void onCommunityCards(Street street, List<Card> cards, TableSnapshot view) {
    }

    default void onHandComplete(HandResult result, TableSnapshot view) {
    }

    default void onHandAborted(long handNumber, Throwable cause) {
    }
}
