package dev.holdem.hand.pot;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * All pot tiers of a hand and who was paid what.
 */
public record PotResolution(List<PotAward> awards, boolean uncontested) {

    public PotResolution {
        awards = List.copyOf(awards);
    }

    public long totalAwarded() {
        long total = 0;
        for (PotAward award : awards) {
            total += award.totalPaid();
        }
        return total;
    }

    public Map<Integer, Long> payoutsBySeat() {
        Map<Integer, Long> bySeat = new TreeMap<>();
        for (PotAward award : awards) {
            award.payouts().forEach((seat, amount) -> bySeat.merge(seat, amount, Long::sum));
        }
        return bySeat;
    }
}
