package dev.holdem.handflow;

import dev.holdem.hand.betting.Street;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandPhaseTest {

    @Test
    void test_phases_run_in_deal_order() {
        HandPhase phase = HandPhase.HAND_SETUP;
        int steps = 0;
        while (phase != HandPhase.HAND_COMPLETE) {
            HandPhase next = phase.next();
            assertTrue(phase.canTransitionTo(next));
            phase = next;
            steps++;
        }
        assertEquals(HandPhase.values().length - 1, steps);
    }

    @ParameterizedTest
    @EnumSource(value = HandPhase.class, names = {"PRE_FLOP_BETTING", "FLOP_BETTING", "TURN_BETTING", "RIVER_BETTING"})
    void test_betting_phases_may_end_the_hand(HandPhase phase) {
        assertTrue(phase.isBetting());
        assertTrue(phase.canTransitionTo(HandPhase.HAND_COMPLETE));
    }

    @Test
    void test_reveal_phases_cannot_end_the_hand() {
        assertFalse(HandPhase.FLOP.canTransitionTo(HandPhase.HAND_COMPLETE));
        assertFalse(HandPhase.SHOWDOWN.canTransitionTo(HandPhase.FLOP));
        assertFalse(HandPhase.HAND_SETUP.canTransitionTo(HandPhase.FLOP));
    }

    @Test
    void test_no_skipping_streets() {
        assertFalse(HandPhase.PRE_FLOP_BETTING.canTransitionTo(HandPhase.TURN));
        assertFalse(HandPhase.FLOP_BETTING.canTransitionTo(HandPhase.SHOWDOWN));
    }

    @Test
    void test_hand_complete_is_terminal() {
        assertFalse(HandPhase.HAND_COMPLETE.canTransitionTo(HandPhase.HAND_SETUP));
        assertThrows(IllegalStateException.class, HandPhase.HAND_COMPLETE::next);
    }

    @Test
    void test_street_of_phase() {
        assertEquals(Street.PRE_FLOP, HandPhase.PRE_FLOP_BETTING.street());
        assertEquals(Street.FLOP, HandPhase.FLOP.street());
        assertEquals(Street.TURN, HandPhase.TURN_BETTING.street());
        assertEquals(Street.RIVER, HandPhase.RIVER.street());
        assertNull(HandPhase.SHOWDOWN.street());
        assertNull(HandPhase.HAND_SETUP.street());
    }
}
