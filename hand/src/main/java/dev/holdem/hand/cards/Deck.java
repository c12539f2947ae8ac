package dev.holdem.hand.cards;

import dev.holdem.hand.Errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * The 52 cards not yet dealt in the current hand.
 *
 * <p>Deals come off the top in shuffle order. Two decks built with the same
 * seed produce the same sequence of deals.
 */
public class Deck {

    public static final int SIZE = 52;

    private final LinkedList<Card> cards = new LinkedList<>();
    private final Random rng;
    private final List<Card> stackedOrder;

    private Deck(Random rng, List<Card> stackedOrder) {
        this.rng = rng;
        this.stackedOrder = stackedOrder;
        reset();
    }

    public static Deck shuffled(Random rng) {
        return new Deck(rng, null);
    }

    public static Deck seeded(long seed) {
        return new Deck(new Random(seed), null);
    }

    /**
     * A deck whose top cards are {@code top} in order, followed by the rest of
     * the 52 cards in a fixed order. Reset restores the same arrangement.
     */
    public static Deck stacked(List<Card> top) {
        Set<Card> seen = new HashSet<>();
        for (Card card : top) {
            if (!seen.add(card)) {
                throw new IllegalArgumentException("Duplicate card in stacked deck: " + card);
            }
        }
        List<Card> order = new ArrayList<>(top);
        for (Card card : fullSet()) {
            if (!seen.contains(card)) {
                order.add(card);
            }
        }
        return new Deck(null, List.copyOf(order));
    }

    /**
     * Restores all 52 cards and reshuffles them.
     */
    public void reset() {
        cards.clear();
        if (stackedOrder != null) {
            cards.addAll(stackedOrder);
            return;
        }
        cards.addAll(fullSet());
        Collections.shuffle(cards, rng);
    }

    /**
     * Removes and returns the top card.
     *
     * @throws Errors.EmptyDeckError if no cards remain
     */
    public Card deal() {
        if (cards.isEmpty()) {
            throw new Errors.EmptyDeckError(1, 0);
        }
        return cards.poll();
    }

    /**
     * Removes and returns the top {@code n} cards.
     *
     * @throws Errors.EmptyDeckError if fewer than {@code n} cards remain; no card is removed
     */
    public List<Card> deal(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Cannot deal a negative number of cards: " + n);
        }
        if (n > cards.size()) {
            throw new Errors.EmptyDeckError(n, cards.size());
        }
        List<Card> dealt = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            dealt.add(cards.poll());
        }
        return dealt;
    }

    public int remaining() {
        return cards.size();
    }

    private static List<Card> fullSet() {
        List<Card> all = new ArrayList<>(SIZE);
        for (Suit suit : Suit.values()) {
            for (Rank rank : Rank.values()) {
                all.add(new Card(rank, suit));
            }
        }
        return all;
    }
}
