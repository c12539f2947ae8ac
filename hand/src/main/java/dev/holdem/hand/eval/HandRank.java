package dev.holdem.hand.eval;

import dev.holdem.hand.cards.Card;
import dev.holdem.hand.cards.Rank;

import java.util.List;
import java.util.Objects;

/**
 * Comparable strength of a five-card hand.
 *
 * <p>Ordering is by category, then by the tiebreak ranks in order. Two ranks
 * that compare equal are an exact tie; the cards that made them may differ
 * in suit and do not take part in equality.
 */
public final class HandRank implements Comparable<HandRank> {

    private final HandCategory category;
    private final List<Integer> tiebreakers;
    private final List<Card> bestFive;

    HandRank(HandCategory category, List<Integer> tiebreakers, List<Card> bestFive) {
        this.category = category;
        this.tiebreakers = List.copyOf(tiebreakers);
        this.bestFive = List.copyOf(bestFive);
    }

    public HandCategory getCategory() {
        return category;
    }

    /**
     * Rank values that break ties inside the category, most significant first.
     * A wheel straight reports a high card of 5.
     */
    public List<Integer> getTiebreakers() {
        return tiebreakers;
    }

    /**
     * The five cards forming the hand, ordered by significance.
     */
    public List<Card> getBestFive() {
        return bestFive;
    }

    public boolean beats(HandRank other) {
        return compareTo(other) > 0;
    }

    public boolean ties(HandRank other) {
        return compareTo(other) == 0;
    }

    /**
     * Human readable description, e.g. {@code "Two Pair, Kings and Fives"}.
     */
    public String describe() {
        String name = category.displayName();
        switch (category) {
            case STRAIGHT_FLUSH:
                if (tiebreakers.get(0) == 14) {
                    return "Royal Flush";
                }
                return name + ", " + name(0) + " high";
            case FULL_HOUSE:
                return name + ", " + plural(0) + " full of " + plural(1);
            case TWO_PAIR:
                return name + ", " + plural(0) + " and " + plural(1);
            case FOUR_OF_A_KIND:
            case THREE_OF_A_KIND:
            case ONE_PAIR:
                return name + ", " + plural(0);
            case FLUSH:
            case STRAIGHT:
                return name + ", " + name(0) + " high";
            default:
                return name + ", " + name(0);
        }
    }

    private String name(int index) {
        return Rank.fromValue(tiebreakers.get(index)).displayName();
    }

    private String plural(int index) {
        return Rank.fromValue(tiebreakers.get(index)).pluralName();
    }

    @Override
    public int compareTo(HandRank other) {
        int byCategory = category.compareTo(other.category);
        if (byCategory != 0) {
            return byCategory;
        }
        int n = Math.min(tiebreakers.size(), other.tiebreakers.size());
        for (int i = 0; i < n; i++) {
            int cmp = Integer.compare(tiebreakers.get(i), other.tiebreakers.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(tiebreakers.size(), other.tiebreakers.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HandRank)) return false;
        HandRank that = (HandRank) o;
        return category == that.category && tiebreakers.equals(that.tiebreakers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, tiebreakers);
    }

    @Override
    public String toString() {
        return category + tiebreakers.toString();
    }
}
