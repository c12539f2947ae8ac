package dev.holdem.handflow;

import dev.holdem.hand.betting.ActionRecord;
import dev.holdem.hand.cards.Card;
import dev.holdem.hand.eval.HandRank;
import dev.holdem.hand.pot.PotAward;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Terminal outcome of a hand, published at HAND_COMPLETE.
 *
 * @param wonByFold true when everyone else folded and no hands were compared
 * @param showdownRanks rank of every hand shown down, by seat; empty when won by fold
 * @param finalStacks stack of every seated player after the payouts, by seat
 */
public record HandResult(
    long handNumber,
    List<PotAward> awards,
    boolean wonByFold,
    Map<Integer, HandRank> showdownRanks,
    Map<Integer, List<Card>> shownCards,
    List<Card> board,
    Map<Integer, Long> finalStacks,
    List<ActionRecord> history
) {
    public HandResult {
        awards = List.copyOf(awards);
        showdownRanks = Map.copyOf(showdownRanks);
        shownCards = Map.copyOf(shownCards);
        board = List.copyOf(board);
        finalStacks = Map.copyOf(finalStacks);
        history = List.copyOf(history);
    }

    /**
     * Seats that won chips from any tier, ascending.
     */
    public List<Integer> winners() {
        TreeSet<Integer> seats = new TreeSet<>();
        for (PotAward award : awards) {
            seats.addAll(award.winnerSeats());
        }
        return List.copyOf(seats);
    }

    public long totalAwarded() {
        long total = 0;
        for (PotAward award : awards) {
            total += award.totalPaid();
        }
        return total;
    }

    public long amountWon(int seat) {
        long total = 0;
        for (PotAward award : awards) {
            total += award.payouts().getOrDefault(seat, 0L);
        }
        return total;
    }

    /**
     * Description of the seat's showdown hand, e.g. {@code "Flush, Ace high"}, or null.
     */
    public String describe(int seat) {
        HandRank rank = showdownRanks.get(seat);
        return rank == null ? null : rank.describe();
    }
}
