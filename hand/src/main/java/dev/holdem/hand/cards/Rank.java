package dev.holdem.hand.cards;

/**
 * Card rank, valued 2 through 14 with the ace high.
 */
public enum Rank {
    TWO(2, '2', "Two", "Twos"),
    THREE(3, '3', "Three", "Threes"),
    FOUR(4, '4', "Four", "Fours"),
    FIVE(5, '5', "Five", "Fives"),
    SIX(6, '6', "Six", "Sixes"),
    SEVEN(7, '7', "Seven", "Sevens"),
    EIGHT(8, '8', "Eight", "Eights"),
    NINE(9, '9', "Nine", "Nines"),
    TEN(10, 'T', "Ten", "Tens"),
    JACK(11, 'J', "Jack", "Jacks"),
    QUEEN(12, 'Q', "Queen", "Queens"),
    KING(13, 'K', "King", "Kings"),
    ACE(14, 'A', "Ace", "Aces");

    private final int value;
    private final char symbol;
    private final String displayName;
    private final String pluralName;

    Rank(int value, char symbol, String displayName, String pluralName) {
        this.value = value;
        this.symbol = symbol;
        this.displayName = displayName;
        this.pluralName = pluralName;
    }

    public int value() {
        return value;
    }

    public char symbol() {
        return symbol;
    }

    public String displayName() {
        return displayName;
    }

    public String pluralName() {
        return pluralName;
    }

    public static Rank fromValue(int value) {
        if (value < 2 || value > 14) {
            throw new IllegalArgumentException("Rank value out of range: " + value);
        }
        return values()[value - 2];
    }

    public static Rank fromChar(char c) {
        char upper = Character.toUpperCase(c);
        for (Rank rank : values()) {
            if (rank.symbol == upper) {
                return rank;
            }
        }
        throw new IllegalArgumentException("Unknown rank: " + c);
    }
}
