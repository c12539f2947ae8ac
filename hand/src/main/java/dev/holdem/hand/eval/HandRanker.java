package dev.holdem.hand.eval;

import dev.holdem.hand.cards.Card;

import java.util.List;

/**
 * Ranks a player's hole cards together with the board.
 */
@FunctionalInterface
public interface HandRanker {

    HandRank rank(List<Card> holeCards, List<Card> board);

    static HandRanker standard() {
        return HandEvaluator::evaluate;
    }
}
