package dev.holdem.hand.pot;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one pot tier.
 *
 * @param pot the tier that was awarded
 * @param winnerSeats seats holding the best eligible hand, in odd-chip order
 * @param payouts chips paid to each winner
 */
public record PotAward(Pot pot, List<Integer> winnerSeats, Map<Integer, Long> payouts) {

    public PotAward {
        winnerSeats = List.copyOf(winnerSeats);
        payouts = Map.copyOf(payouts);
    }

    public boolean isSplit() {
        return winnerSeats.size() > 1;
    }

    public long totalPaid() {
        long total = 0;
        for (long amount : payouts.values()) {
            total += amount;
        }
        return total;
    }
}
