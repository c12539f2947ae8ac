package dev.holdem.table;

import dev.holdem.hand.Errors;
import dev.holdem.hand.betting.ActionRequest;
import dev.holdem.hand.betting.ActionType;
import dev.holdem.hand.betting.PlayerAction;
import dev.holdem.hand.betting.Street;
import dev.holdem.hand.state.Player;
import dev.holdem.handflow.GameEngine;
import dev.holdem.handflow.TableConfig;
import dev.holdem.handflow.TableSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleActionSourceTest {

    private static final ActionRequest FACING_BET = new ActionRequest(Street.PRE_FLOP, 0, 20, 20, 40, 1000, 1000,
        EnumSet.of(ActionType.FOLD, ActionType.CALL, ActionType.RAISE, ActionType.ALL_IN));

    private static final ActionRequest UNOPENED = new ActionRequest(Street.FLOP, 1, 0, 0, 20, 980, 980,
        EnumSet.of(ActionType.FOLD, ActionType.CHECK, ActionType.RAISE, ActionType.ALL_IN));

    private ByteArrayOutputStream buffer;
    private PrintStream out;
    private ActionRequest request;
    private TableSnapshot view;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        GameEngine engine = new GameEngine(TableConfig.defaults().withSeed(1L), List.of(
            new Player("p0", "Alice", 0, 1000),
            new Player("p1", "Bob", 1, 1000)));
        engine.startHand();
        request = engine.pendingRequest().orElseThrow();
        view = engine.snapshot(request.seat());
    }

    private ConsoleActionSource source(String input) {
        return new ConsoleActionSource(new BufferedReader(new StringReader(input)), out);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    // --- parsing ---

    @Test
    void test_parse_simple_commands() {
        assertEquals(PlayerAction.fold(), ConsoleActionSource.parse("fold", FACING_BET));
        assertEquals(PlayerAction.fold(), ConsoleActionSource.parse(" F ", FACING_BET));
        assertEquals(PlayerAction.check(), ConsoleActionSource.parse("check", UNOPENED));
        assertEquals(PlayerAction.check(), ConsoleActionSource.parse("x", UNOPENED));
        assertEquals(PlayerAction.call(), ConsoleActionSource.parse("c", FACING_BET));
        assertEquals(PlayerAction.allIn(), ConsoleActionSource.parse("allin", FACING_BET));
        assertEquals(PlayerAction.allIn(), ConsoleActionSource.parse("all in", FACING_BET));
    }

    @Test
    void test_parse_raise_amounts() {
        assertEquals(PlayerAction.raiseTo(60), ConsoleActionSource.parse("raise 60", FACING_BET));
        assertEquals(PlayerAction.raiseTo(40), ConsoleActionSource.parse("bet 40", UNOPENED));
        assertEquals(PlayerAction.raiseTo(100), ConsoleActionSource.parse("r 100", FACING_BET));
    }

    @Test
    void test_parse_rejects_bad_input() {
        assertThrows(IllegalArgumentException.class, () -> ConsoleActionSource.parse("dance", FACING_BET));
        assertThrows(IllegalArgumentException.class, () -> ConsoleActionSource.parse("raise", FACING_BET));
        assertThrows(IllegalArgumentException.class, () -> ConsoleActionSource.parse("raise lots", FACING_BET));
        assertThrows(IllegalArgumentException.class, () -> ConsoleActionSource.parse("", FACING_BET));
    }

    @Test
    void test_prompt_lists_legal_options() {
        assertEquals("Alice (stack 1000) [fold, call 20, raise <40-1000>, allin]: ",
            ConsoleActionSource.prompt("Alice", FACING_BET));
        assertEquals("Bob (stack 980) [fold, check, bet <20-980>, allin]: ",
            ConsoleActionSource.prompt("Bob", UNOPENED));
    }

    // --- reading ---

    @Test
    void test_reprompts_after_unknown_command() {
        ConsoleActionSource source = source("dance\ncall\n");

        PlayerAction action = source.nextAction(request, view);

        assertEquals(PlayerAction.call(), action);
        assertTrue(output().contains("Unknown command 'dance'"));
        assertTrue(output().contains("Alice (stack 990)"));
        assertFalse(source.isClosed());
    }

    @Test
    void test_end_of_input_closes_source() {
        ConsoleActionSource source = source("");

        assertThrows(Errors.ActionAbortedError.class, () -> source.nextAction(request, view));
        assertTrue(source.isClosed());
    }

    @Test
    void test_board_shows_own_cards_only() {
        source("fold\n").nextAction(request, view);

        assertTrue(output().contains("Alice: "));
        assertFalse(output().contains("Bob: "));
    }

    @Test
    void test_reports_illegal_action_with_all_in_hint() {
        ConsoleActionSource source = source("");

        source.onIllegalAction(FACING_BET, new Errors.InsufficientStackError(1500, 1000));

        assertTrue(output().contains("Illegal action: "));
        assertTrue(output().contains("You can go all-in for 1000"));
    }
}
