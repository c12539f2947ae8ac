package dev.holdem.hand.cards;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable playing card.
 */
public record Card(Rank rank, Suit suit) implements Comparable<Card> {

    public Card {
        Objects.requireNonNull(rank, "rank");
        Objects.requireNonNull(suit, "suit");
    }

    public static Card of(Rank rank, Suit suit) {
        return new Card(rank, suit);
    }

    /**
     * Parses short notation such as {@code "As"}, {@code "Td"} or {@code "9♠"}.
     */
    public static Card parse(String text) {
        if (text == null || text.length() != 2) {
            throw new IllegalArgumentException("Card must be two characters: " + text);
        }
        return new Card(Rank.fromChar(text.charAt(0)), Suit.fromChar(text.charAt(1)));
    }

    /**
     * Parses a whitespace separated list of cards, e.g. {@code "As Ks 2s"}.
     */
    public static List<Card> parseAll(String text) {
        List<Card> cards = new ArrayList<>();
        for (String token : text.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                cards.add(parse(token));
            }
        }
        return cards;
    }

    public String toSymbolString() {
        return "" + rank.symbol() + suit.symbol();
    }

    @Override
    public int compareTo(Card other) {
        int byRank = Integer.compare(rank.value(), other.rank.value());
        return byRank != 0 ? byRank : suit.compareTo(other.suit);
    }

    @Override
    public String toString() {
        return "" + rank.symbol() + suit.letter();
    }
}
