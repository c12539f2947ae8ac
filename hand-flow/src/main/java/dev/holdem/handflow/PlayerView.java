package dev.holdem.handflow;

import dev.holdem.hand.cards.Card;
import dev.holdem.hand.state.PlayerStatus;

import java.util.List;

/**
 * Read-only view of one seat.
 *
 * @param holeCards the player's cards when the viewer may see them, empty otherwise
 */
public record PlayerView(
    int seat,
    String id,
    String name,
    long stack,
    PlayerStatus status,
    long betThisRound,
    long totalInvested,
    List<Card> holeCards,
    boolean button,
    boolean smallBlind,
    boolean bigBlind
) {
    public PlayerView {
        holeCards = List.copyOf(holeCards);
    }

    public boolean cardsVisible() {
        return !holeCards.isEmpty();
    }
}
