package dev.holdem.hand.betting;

/**
 * Betting rounds of a hand, each tied to a community card stage.
 */
public enum Street {
    PRE_FLOP(0),
    FLOP(3),
    TURN(1),
    RIVER(1);

    private final int cardsRevealed;

    Street(int cardsRevealed) {
        this.cardsRevealed = cardsRevealed;
    }

    /**
     * Community cards revealed before this street's betting.
     */
    public int cardsRevealed() {
        return cardsRevealed;
    }

    public String displayName() {
        switch (this) {
            case PRE_FLOP: return "Pre-Flop";
            case FLOP: return "Flop";
            case TURN: return "Turn";
            default: return "River";
        }
    }
}
