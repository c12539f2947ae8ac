package dev.holdem.hand.pot;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which tied winner receives the chips left over when a pot does not
 * split evenly. Remainder chips are handed out one at a time in this order.
 */
public enum OddChipPolicy {

    /** First winner clockwise from the button. */
    LEFT_OF_DEALER {
        @Override
        public List<Integer> order(List<Integer> seats, int buttonSeat) {
            List<Integer> sorted = new ArrayList<>(seats);
            sorted.sort(null);
            List<Integer> order = new ArrayList<>(sorted.size());
            for (int seat : sorted) {
                if (seat > buttonSeat) {
                    order.add(seat);
                }
            }
            for (int seat : sorted) {
                if (seat <= buttonSeat) {
                    order.add(seat);
                }
            }
            return order;
        }
    },

    /** Lowest seat number first, regardless of the button. */
    LOWEST_SEAT {
        @Override
        public List<Integer> order(List<Integer> seats, int buttonSeat) {
            List<Integer> sorted = new ArrayList<>(seats);
            sorted.sort(null);
            return sorted;
        }
    };

    public abstract List<Integer> order(List<Integer> seats, int buttonSeat);
}
