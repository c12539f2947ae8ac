package dev.holdem.hand.eval;

import dev.holdem.hand.cards.Card;
import dev.holdem.hand.cards.Suit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ranks five to seven cards.
 *
 * <p>With more than five cards every five-card subset is scored and the
 * strongest one is returned (21 subsets for seven cards).
 */
public final class HandEvaluator {

    private HandEvaluator() {}

    public static HandRank evaluate(List<Card> holeCards, List<Card> board) {
        List<Card> all = new ArrayList<>(holeCards.size() + board.size());
        all.addAll(holeCards);
        all.addAll(board);
        return evaluate(all);
    }

    /**
     * @throws IllegalArgumentException if fewer than 5 or more than 7 cards are
     *         given, or a card appears twice
     */
    public static HandRank evaluate(Collection<Card> cards) {
        if (cards.size() < 5 || cards.size() > 7) {
            throw new IllegalArgumentException("Expected 5 to 7 cards, got " + cards.size());
        }
        if (new HashSet<>(cards).size() != cards.size()) {
            throw new IllegalArgumentException("Duplicate card in " + cards);
        }

        List<Card> list = new ArrayList<>(cards);
        int n = list.size();
        HandRank best = null;
        Card[] five = new Card[5];
        for (int a = 0; a < n - 4; a++) {
            for (int b = a + 1; b < n - 3; b++) {
                for (int c = b + 1; c < n - 2; c++) {
                    for (int d = c + 1; d < n - 1; d++) {
                        for (int e = d + 1; e < n; e++) {
                            five[0] = list.get(a);
                            five[1] = list.get(b);
                            five[2] = list.get(c);
                            five[3] = list.get(d);
                            five[4] = list.get(e);
                            HandRank rank = evaluateFive(five);
                            if (best == null || rank.compareTo(best) > 0) {
                                best = rank;
                            }
                        }
                    }
                }
            }
        }
        return best;
    }

    static HandRank evaluateFive(Card[] five) {
        List<Card> sorted = new ArrayList<>(List.of(five));
        sorted.sort(Comparator.comparingInt((Card c) -> c.rank().value()).reversed());

        boolean flush = true;
        Suit suit = sorted.get(0).suit();
        for (Card c : sorted) {
            if (c.suit() != suit) {
                flush = false;
                break;
            }
        }

        int straightHigh = straightHigh(sorted);

        // rank value -> count, iterated high to low
        Map<Integer, Integer> counts = new TreeMap<>(Comparator.reverseOrder());
        for (Card c : sorted) {
            counts.merge(c.rank().value(), 1, Integer::sum);
        }
        List<Integer> groupRanks = new ArrayList<>(counts.keySet());
        groupRanks.sort(Comparator.comparingInt((Integer r) -> counts.get(r))
            .thenComparingInt(r -> r)
            .reversed());
        int topCount = counts.get(groupRanks.get(0));
        int secondCount = groupRanks.size() > 1 ? counts.get(groupRanks.get(1)) : 0;

        if (straightHigh > 0 && flush) {
            return new HandRank(HandCategory.STRAIGHT_FLUSH, List.of(straightHigh), straightOrder(sorted, straightHigh));
        }
        if (topCount == 4) {
            return new HandRank(HandCategory.FOUR_OF_A_KIND, groupRanks, groupOrder(sorted, groupRanks));
        }
        if (topCount == 3 && secondCount == 2) {
            return new HandRank(HandCategory.FULL_HOUSE, groupRanks, groupOrder(sorted, groupRanks));
        }
        if (flush) {
            return new HandRank(HandCategory.FLUSH, groupRanks, sorted);
        }
        if (straightHigh > 0) {
            return new HandRank(HandCategory.STRAIGHT, List.of(straightHigh), straightOrder(sorted, straightHigh));
        }
        if (topCount == 3) {
            return new HandRank(HandCategory.THREE_OF_A_KIND, groupRanks, groupOrder(sorted, groupRanks));
        }
        if (topCount == 2 && secondCount == 2) {
            return new HandRank(HandCategory.TWO_PAIR, groupRanks, groupOrder(sorted, groupRanks));
        }
        if (topCount == 2) {
            return new HandRank(HandCategory.ONE_PAIR, groupRanks, groupOrder(sorted, groupRanks));
        }
        return new HandRank(HandCategory.HIGH_CARD, groupRanks, sorted);
    }

    /**
     * High card of the straight, 5 for A-2-3-4-5, or 0 when the cards do not
     * form a straight. Expects cards sorted high to low.
     */
    private static int straightHigh(List<Card> sorted) {
        int[] v = new int[5];
        for (int i = 0; i < 5; i++) {
            v[i] = sorted.get(i).rank().value();
        }
        boolean consecutive = true;
        for (int i = 1; i < 5; i++) {
            if (v[i - 1] - v[i] != 1) {
                consecutive = false;
                break;
            }
        }
        if (consecutive) {
            return v[0];
        }
        if (v[0] == 14 && v[1] == 5 && v[2] == 4 && v[3] == 3 && v[4] == 2) {
            return 5;
        }
        return 0;
    }

    // Wheel puts the ace last.
    private static List<Card> straightOrder(List<Card> sorted, int high) {
        if (high != 5) {
            return sorted;
        }
        List<Card> order = new ArrayList<>(sorted.subList(1, 5));
        order.add(sorted.get(0));
        return order;
    }

    private static List<Card> groupOrder(List<Card> sorted, List<Integer> groupRanks) {
        List<Card> order = new ArrayList<>(5);
        for (int rank : groupRanks) {
            for (Card c : sorted) {
                if (c.rank().value() == rank) {
                    order.add(c);
                }
            }
        }
        return order;
    }
}
