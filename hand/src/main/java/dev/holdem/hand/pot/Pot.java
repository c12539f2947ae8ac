package dev.holdem.hand.pot;

import java.util.List;

/**
 * One pot tier: an amount and the seats that can win it.
 *
 * @param tier 0 for the main pot, 1.. for side pots
 */
public record Pot(int tier, long amount, List<Integer> eligibleSeats) {

    public Pot {
        eligibleSeats = List.copyOf(eligibleSeats);
    }

    public boolean isMain() {
        return tier == 0;
    }

    public String label() {
        return tier == 0 ? "main" : "side " + tier;
    }
}
