package dev.holdem.handflow;

import dev.holdem.hand.Errors;
import dev.holdem.hand.betting.ActionRecord;
import dev.holdem.hand.betting.ActionRequest;
import dev.holdem.hand.betting.PlayerAction;
import dev.holdem.hand.cards.Card;
import dev.holdem.hand.cards.Deck;
import dev.holdem.hand.eval.HandCategory;
import dev.holdem.hand.eval.HandRanker;
import dev.holdem.hand.pot.Pot;
import dev.holdem.hand.state.Player;
import dev.holdem.hand.state.PlayerStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameEngineTest {

    private static final TableConfig CONFIG = TableConfig.defaults().withSeed(11L);

    private static List<Player> players(long... stacks) {
        List<Player> players = new ArrayList<>();
        for (int seat = 0; seat < stacks.length; seat++) {
            players.add(new Player("p" + seat, "Player " + seat, seat, stacks[seat]));
        }
        return players;
    }

    /** Deals cards in order: hole cards clockwise from left of the button, then the board. */
    private static GameEngine stacked(String cards, HandRanker ranker, long... stacks) {
        return new GameEngine(CONFIG, players(stacks), () -> Deck.stacked(Card.parseAll(cards)), ranker);
    }

    private static long totalChips(GameEngine engine) {
        return engine.getPlayers().stream().mapToLong(Player::getStack).sum();
    }

    // --- setup ---

    @Test
    void test_start_hand_posts_blinds_and_deals_two_cards_each() {
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000, 1000));

        TableSnapshot view = engine.startHand();

        assertThat(view.handNumber()).isEqualTo(1);
        assertThat(view.phase()).isEqualTo(HandPhase.PRE_FLOP_BETTING);
        assertThat(view.buttonSeat()).isZero();
        assertThat(view.potTotal()).isEqualTo(30);
        assertThat(view.betToCall()).isEqualTo(20);
        assertThat(view.actionOn()).isZero();
        assertThat(view.history()).extracting(ActionRecord::kind)
            .containsExactly(ActionRecord.Kind.SMALL_BLIND, ActionRecord.Kind.BIG_BLIND);
        assertThat(view.player(1).orElseThrow().smallBlind()).isTrue();
        assertThat(view.player(2).orElseThrow().bigBlind()).isTrue();
        for (Player p : engine.getPlayers()) {
            assertThat(p.getHoleCards()).hasSize(2);
        }
    }

    @Test
    void test_unmatched_blinds_show_one_pot_open_to_every_player() {
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000, 1000));

        TableSnapshot view = engine.startHand();

        assertThat(view.pots()).hasSize(1);
        assertThat(view.pots().get(0).amount()).isEqualTo(30);
        assertThat(view.pots().get(0).eligibleSeats()).containsExactly(0, 1, 2);
    }

    @Test
    void test_side_pot_appears_only_once_bets_pass_an_all_in() {
        GameEngine engine = new GameEngine(CONFIG, players(100, 1000, 1000));
        engine.startHand();

        TableSnapshot view = engine.act(0, PlayerAction.allIn());
        assertThat(view.pots()).extracting(Pot::amount).containsExactly(130L);
        assertThat(view.pots().get(0).eligibleSeats()).containsExactly(0, 1, 2);

        engine.act(1, PlayerAction.call());
        view = engine.act(2, PlayerAction.raiseTo(300));

        assertThat(view.pots()).extracting(Pot::amount).containsExactly(300L, 200L);
        assertThat(view.pots().get(0).eligibleSeats()).containsExactly(0, 1, 2);
        assertThat(view.pots().get(1).eligibleSeats()).containsExactly(1, 2);
        assertThat(view.actionOn()).isEqualTo(1);
    }

    @Test
    void test_heads_up_button_posts_small_blind_and_acts_first() {
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000));

        TableSnapshot view = engine.startHand();

        assertThat(view.player(0).orElseThrow().button()).isTrue();
        assertThat(view.player(0).orElseThrow().smallBlind()).isTrue();
        assertThat(view.player(1).orElseThrow().bigBlind()).isTrue();
        assertThat(view.actionOn()).isZero();
    }

    @Test
    void test_button_rotates_between_hands() {
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000, 1000));
        engine.playHand(new ScriptedActionSource());

        TableSnapshot view = engine.startHand();

        assertThat(view.buttonSeat()).isEqualTo(1);
        assertThat(view.handNumber()).isEqualTo(2);
    }

    @Test
    void test_start_hand_twice_rejected() {
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000));
        engine.startHand();

        assertThatThrownBy(engine::startHand).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void test_needs_two_players_with_chips() {
        GameEngine engine = new GameEngine(CONFIG, players(1000, 0));

        assertThatThrownBy(engine::startHand).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void test_duplicate_seats_rejected() {
        List<Player> players = List.of(new Player("a", "A", 1, 100), new Player("b", "B", 1, 100));

        assertThatThrownBy(() -> new GameEngine(CONFIG, players)).isInstanceOf(IllegalArgumentException.class);
    }

    // --- outcomes ---

    @Test
    void test_flush_beats_pair_of_queens() {
        // seat 1 (big blind) is dealt first heads-up
        GameEngine engine = stacked("Qh Qd As Ks 2s 5s 9s Kd 3c", HandRanker.standard(), 1000, 1000);

        HandResult result = engine.playHand(new ScriptedActionSource()
            .then(PlayerAction.allIn())
            .then(PlayerAction.call()));

        assertThat(result.wonByFold()).isFalse();
        assertThat(result.winners()).containsExactly(0);
        assertThat(result.showdownRanks().get(0).getCategory()).isEqualTo(HandCategory.FLUSH);
        assertThat(result.showdownRanks().get(1).getCategory()).isEqualTo(HandCategory.ONE_PAIR);
        assertThat(result.describe(0)).isEqualTo("Flush, Ace high");
        assertThat(result.amountWon(0)).isEqualTo(2000);
        assertThat(result.finalStacks()).containsEntry(0, 2000L).containsEntry(1, 0L);
        assertThat(result.board()).containsExactlyElementsOf(Card.parseAll("2s 5s 9s Kd 3c"));
    }

    @Test
    void test_everyone_folds_to_big_blind_without_ranking() {
        AtomicInteger rankings = new AtomicInteger();
        HandRanker counting = (hole, board) -> {
            rankings.incrementAndGet();
            return HandRanker.standard().rank(hole, board);
        };
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000, 1000),
            () -> Deck.seeded(3), counting);

        HandResult result = engine.playHand(new ScriptedActionSource()
            .then(PlayerAction.fold())
            .then(PlayerAction.fold()));

        assertThat(rankings.get()).isZero();
        assertThat(result.wonByFold()).isTrue();
        assertThat(result.showdownRanks()).isEmpty();
        assertThat(result.shownCards()).isEmpty();
        assertThat(result.winners()).containsExactly(2);
        assertThat(result.finalStacks()).containsEntry(0, 1000L).containsEntry(1, 990L).containsEntry(2, 1010L);
        assertThat(engine.getPhase()).isEqualTo(HandPhase.HAND_COMPLETE);
    }

    @Test
    void test_three_way_all_in_builds_side_pot() {
        // button seat 0, dealing starts with seat 1
        GameEngine engine = stacked("Kh Kd Qh Qd Ah Ad 2c 7d 9h Js 3s", HandRanker.standard(), 100, 300, 300);

        HandResult result = engine.playHand(new ScriptedActionSource()
            .then(PlayerAction.allIn())
            .then(PlayerAction.allIn())
            .then(PlayerAction.call()));

        assertThat(result.awards()).hasSize(2);
        assertThat(result.awards().get(0).pot().amount()).isEqualTo(300);
        assertThat(result.awards().get(0).winnerSeats()).containsExactly(0);
        assertThat(result.awards().get(1).pot().amount()).isEqualTo(400);
        assertThat(result.awards().get(1).winnerSeats()).containsExactly(1);
        assertThat(result.finalStacks()).containsEntry(0, 300L).containsEntry(1, 400L).containsEntry(2, 0L);
        assertThat(result.totalAwarded()).isEqualTo(700);
    }

    @Test
    void test_board_tie_splits_pot() {
        GameEngine engine = stacked("2c 3d 2h 3h Ts Js Qd Kh Ac", HandRanker.standard(), 1000, 1000);

        HandResult result = engine.playHand(new ScriptedActionSource());

        assertThat(result.awards().get(0).isSplit()).isTrue();
        assertThat(result.finalStacks()).containsEntry(0, 1000L).containsEntry(1, 1000L);
    }

    @Test
    void test_no_card_is_dealt_twice() {
        GameEngine engine = new GameEngine(TableConfig.defaults().withSeed(99L), players(1000, 1000, 1000, 1000, 1000, 1000));

        HandResult result = engine.playHand(new ScriptedActionSource());

        Set<Card> seen = new HashSet<>(result.board());
        for (Player p : engine.getPlayers()) {
            seen.addAll(p.getHoleCards());
        }
        assertThat(result.board()).hasSize(5);
        assertThat(seen).hasSize(6 * 2 + 5);
    }

    @Test
    void test_chips_are_conserved_over_many_hands() {
        GameEngine engine = new GameEngine(TableConfig.defaults().withSeed(5L), players(1000, 1000, 1000, 1000));

        for (int hand = 0; hand < 10; hand++) {
            engine.playHand(new ScriptedActionSource().then(PlayerAction.raiseTo(60)));
            assertThat(totalChips(engine)).isEqualTo(4000);
        }
    }

    // --- actions ---

    @Test
    void test_illegal_action_leaves_state_unchanged() {
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000, 1000));
        TableSnapshot before = engine.startHand();

        assertThatThrownBy(() -> engine.act(0, PlayerAction.raiseTo(25)))
            .isInstanceOfSatisfying(Errors.IllegalActionError.class,
                e -> assertThat(e.getReason()).isEqualTo(Errors.Reason.BELOW_MINIMUM_RAISE));

        TableSnapshot after = engine.snapshot(TableSnapshot.SPECTATOR);
        assertThat(after.potTotal()).isEqualTo(before.potTotal());
        assertThat(after.actionOn()).isEqualTo(before.actionOn());
        assertThat(after.history()).isEqualTo(before.history());
    }

    @Test
    void test_act_out_of_turn_rejected() {
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000, 1000));
        engine.startHand();

        assertThatThrownBy(() -> engine.act(2, PlayerAction.call()))
            .isInstanceOfSatisfying(Errors.IllegalActionError.class,
                e -> assertThat(e.getReason()).isEqualTo(Errors.Reason.NOT_YOUR_TURN));
    }

    @Test
    void test_folded_player_cannot_act() {
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000, 1000));
        engine.startHand();
        engine.act(0, PlayerAction.fold());

        assertThatThrownBy(() -> engine.act(0, PlayerAction.call()))
            .isInstanceOfSatisfying(Errors.IllegalActionError.class,
                e -> assertThat(e.getReason()).isEqualTo(Errors.Reason.PLAYER_NOT_ACTIVE));
    }

    @Test
    void test_act_without_hand_rejected() {
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000));

        assertThatThrownBy(() -> engine.act(0, PlayerAction.check()))
            .isInstanceOfSatisfying(Errors.IllegalActionError.class,
                e -> assertThat(e.getReason()).isEqualTo(Errors.Reason.NO_HAND_IN_PROGRESS));
    }

    @Test
    void test_play_hand_reprompts_after_illegal_action() {
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000));
        ScriptedActionSource source = new ScriptedActionSource()
            .then(PlayerAction.check())
            .then(PlayerAction.call());

        engine.playHand(source);

        assertThat(source.rejections).hasSize(1);
        assertThat(source.rejections.get(0).getReason()).isEqualTo(Errors.Reason.CANNOT_CHECK);
        assertThat(source.requests.get(0).seat()).isEqualTo(source.requests.get(1).seat());
    }

    @Test
    void test_pending_request_describes_options() {
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000, 1000));
        engine.startHand();

        ActionRequest request = engine.pendingRequest().orElseThrow();

        assertThat(request.seat()).isZero();
        assertThat(request.toCall()).isEqualTo(20);
        assertThat(request.minRaiseTo()).isEqualTo(40);
    }

    @Test
    void test_post_flop_action_starts_left_of_button() {
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000, 1000));
        engine.startHand();
        engine.act(0, PlayerAction.call());
        engine.act(1, PlayerAction.call());
        TableSnapshot view = engine.act(2, PlayerAction.check());

        assertThat(view.phase()).isEqualTo(HandPhase.FLOP_BETTING);
        assertThat(view.board()).hasSize(3);
        assertThat(view.actionOn()).isEqualTo(1);
        assertThat(view.betToCall()).isZero();
    }

    // --- abort policy ---

    @Test
    void test_abort_policy_fold_folds_abandoned_request() {
        GameEngine engine = new GameEngine(CONFIG.withAbortPolicy(AbortPolicy.FOLD), players(1000, 1000));
        ActionSource timingOut = (request, view) -> {
            throw new Errors.ActionAbortedError("timed out");
        };

        HandResult result = engine.playHand(timingOut);

        assertThat(result.wonByFold()).isTrue();
        assertThat(result.winners()).containsExactly(1);
    }

    @Test
    void test_reprompt_policy_asks_again() {
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000));
        AtomicInteger calls = new AtomicInteger();
        ActionSource flaky = (request, view) -> {
            if (calls.incrementAndGet() == 1) {
                throw new Errors.ActionAbortedError("timed out");
            }
            return PlayerAction.fold();
        };

        HandResult result = engine.playHand(flaky);

        assertThat(calls.get()).isEqualTo(2);
        assertThat(result.wonByFold()).isTrue();
    }

    // --- fatal errors ---

    @Test
    void test_empty_deck_aborts_hand_and_restores_stacks() {
        List<HandObserverRecorder.Event> seen = new ArrayList<>();
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000), () -> {
            Deck deck = Deck.seeded(1);
            deck.deal(48);
            return deck;
        }, HandRanker.standard());
        engine.addObserver(new HandObserverRecorder(seen));
        engine.startHand();
        engine.act(0, PlayerAction.call());

        assertThatThrownBy(() -> engine.act(1, PlayerAction.check()))
            .isInstanceOfSatisfying(Errors.HandAbortedError.class, e -> {
                assertThat(e.getCause()).isInstanceOf(Errors.EmptyDeckError.class);
                assertThat(e.getHandNumber()).isEqualTo(1);
                assertThat(e.isFatal()).isTrue();
            });
        assertThat(engine.isHandInProgress()).isFalse();
        assertThat(engine.getPlayers()).extracting(Player::getStack).containsExactly(1000L, 1000L);
        assertThat(seen).contains(HandObserverRecorder.Event.ABORTED);
    }

    @Test
    void test_failing_ranker_aborts_hand() {
        HandRanker broken = (hole, board) -> {
            throw new IllegalStateException("broken ranker");
        };
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000), () -> Deck.seeded(2), broken);

        assertThatThrownBy(() -> engine.playHand(new ScriptedActionSource()))
            .isInstanceOf(Errors.HandAbortedError.class);
        assertThat(totalChips(engine)).isEqualTo(2000);
        assertThat(engine.getPlayers()).allSatisfy(p -> assertThat(p.getStatus()).isEqualTo(PlayerStatus.ACTIVE));
    }

    // --- snapshots ---

    @Test
    void test_snapshot_hides_other_players_cards() {
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000, 1000));
        engine.startHand();

        TableSnapshot mine = engine.snapshot(0);
        TableSnapshot spectator = engine.snapshot(TableSnapshot.SPECTATOR);

        assertThat(mine.player(0).orElseThrow().holeCards()).hasSize(2);
        assertThat(mine.player(1).orElseThrow().holeCards()).isEmpty();
        assertThat(spectator.players()).allSatisfy(p -> assertThat(p.cardsVisible()).isFalse());
    }

    @Test
    void test_showdown_reveals_only_players_who_reached_it() {
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000, 1000));

        engine.playHand(new ScriptedActionSource().then(PlayerAction.fold()));

        TableSnapshot spectator = engine.snapshot(TableSnapshot.SPECTATOR);
        assertThat(spectator.player(0).orElseThrow().status()).isEqualTo(PlayerStatus.FOLDED);
        assertThat(spectator.player(0).orElseThrow().cardsVisible()).isFalse();
        assertThat(spectator.player(1).orElseThrow().cardsVisible()).isTrue();
        assertThat(spectator.player(2).orElseThrow().cardsVisible()).isTrue();
    }

    @Test
    void test_observers_see_every_stage() {
        List<HandObserverRecorder.Event> seen = new ArrayList<>();
        GameEngine engine = new GameEngine(CONFIG, players(1000, 1000));
        engine.addObserver(new HandObserverRecorder(seen));

        engine.playHand(new ScriptedActionSource());

        assertThat(seen.get(0)).isEqualTo(HandObserverRecorder.Event.STARTED);
        assertThat(seen).filteredOn(e -> e == HandObserverRecorder.Event.COMMUNITY_CARDS).hasSize(3);
        assertThat(seen.get(seen.size() - 1)).isEqualTo(HandObserverRecorder.Event.COMPLETE);
    }
}
