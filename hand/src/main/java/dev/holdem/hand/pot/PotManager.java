package dev.holdem.hand.pot;

import dev.holdem.hand.Errors;
import dev.holdem.hand.eval.HandRank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Chip ledger for one hand.
 *
 * <p>Every chip moved from a stack into the pot is recorded against its seat.
 * The cumulative contribution per seat decides the side-pot tiers: one tier
 * per distinct all-in level, then one pot above the highest of them open to
 * every player who can still bet. Folded players' chips stay in the tiers
 * they reached and are never returned.
 */
public class PotManager {
    private static final Logger logger = LoggerFactory.getLogger(PotManager.class);

    private final Map<Integer, Long> contributions = new TreeMap<>();
    private final Map<Integer, Long> streetContributions = new TreeMap<>();
    private final Set<Integer> folded = new HashSet<>();
    private final Set<Integer> allIn = new HashSet<>();

    /**
     * Registers a seat taking part in the hand, so it appears in tiers even
     * before it has put chips in.
     */
    public void register(int seat) {
        contributions.putIfAbsent(seat, 0L);
    }

    public void contribute(int seat, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Contribution must not be negative: " + amount);
        }
        contributions.merge(seat, amount, Long::sum);
        streetContributions.merge(seat, amount, Long::sum);
    }

    public void fold(int seat) {
        folded.add(seat);
    }

    /**
     * Marks a seat that has no chips left behind; its contribution caps the
     * tiers it can win.
     */
    public void allIn(int seat) {
        allIn.add(seat);
    }

    /**
     * Starts a new street; street totals reset, hand totals carry on.
     */
    public void nextStreet() {
        streetContributions.clear();
    }

    public long total() {
        long total = 0;
        for (long amount : contributions.values()) {
            total += amount;
        }
        return total;
    }

    public long contributionOf(int seat) {
        return contributions.getOrDefault(seat, 0L);
    }

    public long streetContributionOf(int seat) {
        return streetContributions.getOrDefault(seat, 0L);
    }

    public Map<Integer, Long> contributions() {
        return Collections.unmodifiableMap(contributions);
    }

    public boolean hasFolded(int seat) {
        return folded.contains(seat);
    }

    /**
     * Partitions the contributions into tiers, main pot first. Each later tier
     * has a strictly smaller eligible set. A player who can still bet is
     * eligible for every tier, so unmatched bets in a running round never
     * open a side pot on their own.
     */
    public List<Pot> pots() {
        TreeSet<Long> levels = new TreeSet<>();
        List<Integer> open = new ArrayList<>();
        for (Map.Entry<Integer, Long> e : contributions.entrySet()) {
            int seat = e.getKey();
            if (folded.contains(seat)) {
                continue;
            }
            if (allIn.contains(seat)) {
                if (e.getValue() > 0) {
                    levels.add(e.getValue());
                }
            } else {
                open.add(seat);
            }
        }

        List<Pot> pots = new ArrayList<>();
        long previous = 0;
        for (long level : levels) {
            List<Integer> eligible = new ArrayList<>();
            for (Map.Entry<Integer, Long> e : contributions.entrySet()) {
                int seat = e.getKey();
                if (!folded.contains(seat) && (!allIn.contains(seat) || e.getValue() >= level)) {
                    eligible.add(seat);
                }
            }
            pots.add(new Pot(pots.size(), slice(previous, level), eligible));
            previous = level;
        }

        long rest = slice(previous, Long.MAX_VALUE);
        if (rest == 0) {
            return pots;
        }
        if (!open.isEmpty()) {
            pots.add(new Pot(pots.size(), rest, open));
        } else if (pots.isEmpty()) {
            pots.add(new Pot(0, rest, liveSeats()));
        } else {
            // chips above every all-in level came from folded seats
            Pot last = pots.remove(pots.size() - 1);
            pots.add(new Pot(last.tier(), last.amount() + rest, last.eligibleSeats()));
        }
        return pots;
    }

    private long slice(long from, long to) {
        long amount = 0;
        for (long c : contributions.values()) {
            amount += Math.max(0, Math.min(c, to) - Math.min(c, from));
        }
        return amount;
    }

    /**
     * Awards every tier to its best eligible hands.
     *
     * @param ranks hand rank of every seat still in the hand
     * @param oddChipOrder seats in the order remainder chips are handed out
     * @throws Errors.PotConservationError if the payouts do not add up to the contributions
     */
    public PotResolution resolve(Map<Integer, HandRank> ranks, List<Integer> oddChipOrder) {
        List<PotAward> awards = new ArrayList<>();
        for (Pot pot : pots()) {
            HandRank best = null;
            for (int seat : pot.eligibleSeats()) {
                HandRank rank = ranks.get(seat);
                if (rank == null) {
                    throw new IllegalArgumentException("No hand rank for eligible seat " + seat);
                }
                if (best == null || rank.compareTo(best) > 0) {
                    best = rank;
                }
            }

            List<Integer> winners = new ArrayList<>();
            for (int seat : oddChipOrder) {
                if (pot.eligibleSeats().contains(seat) && ranks.get(seat).compareTo(best) == 0) {
                    winners.add(seat);
                }
            }
            if (winners.isEmpty()) {
                throw new IllegalArgumentException("Odd-chip order " + oddChipOrder
                    + " misses the eligible seats of the " + pot.label() + " pot");
            }
            awards.add(split(pot, winners));
        }

        PotResolution resolution = new PotResolution(awards, false);
        checkConservation(resolution);
        return resolution;
    }

    /**
     * Gives the whole pot to the last player left after everyone else folded.
     */
    public PotResolution awardAll(int seat) {
        long total = total();
        Pot pot = new Pot(0, total, List.of(seat));
        Map<Integer, Long> payouts = new HashMap<>();
        payouts.put(seat, total);
        PotResolution resolution = new PotResolution(List.of(new PotAward(pot, List.of(seat), payouts)), true);
        checkConservation(resolution);
        return resolution;
    }

    private PotAward split(Pot pot, List<Integer> winners) {
        long share = pot.amount() / winners.size();
        long remainder = pot.amount() % winners.size();
        Map<Integer, Long> payouts = new HashMap<>();
        for (int i = 0; i < winners.size(); i++) {
            payouts.put(winners.get(i), share + (i < remainder ? 1 : 0));
        }
        return new PotAward(pot, winners, payouts);
    }

    private void checkConservation(PotResolution resolution) {
        long contributed = total();
        long awarded = resolution.totalAwarded();
        if (contributed != awarded) {
            logger.error("pot_conservation_violated", kv("contributed", contributed), kv("awarded", awarded));
            throw new Errors.PotConservationError(contributed, awarded);
        }
    }

    private List<Integer> liveSeats() {
        List<Integer> live = new ArrayList<>();
        for (int seat : contributions.keySet()) {
            if (!folded.contains(seat)) {
                live.add(seat);
            }
        }
        return live;
    }
}
