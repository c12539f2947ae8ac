package dev.holdem.hand.cards;

/**
 * Card suit.
 */
public enum Suit {
    CLUBS('c', '♣'),
    DIAMONDS('d', '♦'),
    HEARTS('h', '♥'),
    SPADES('s', '♠');

    private final char letter;
    private final char symbol;

    Suit(char letter, char symbol) {
        this.letter = letter;
        this.symbol = symbol;
    }

    public char letter() {
        return letter;
    }

    public char symbol() {
        return symbol;
    }

    public static Suit fromChar(char c) {
        for (Suit suit : values()) {
            if (suit.letter == Character.toLowerCase(c) || suit.symbol == c) {
                return suit;
            }
        }
        throw new IllegalArgumentException("Unknown suit: " + c);
    }
}
