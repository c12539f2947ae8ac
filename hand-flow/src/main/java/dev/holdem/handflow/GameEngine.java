package dev.holdem.handflow;

import dev.holdem.hand.Errors;
import dev.holdem.hand.betting.ActionRecord;
import dev.holdem.hand.betting.ActionRequest;
import dev.holdem.hand.betting.BettingRound;
import dev.holdem.hand.betting.PlayerAction;
import dev.holdem.hand.betting.Street;
import dev.holdem.hand.cards.Card;
import dev.holdem.hand.cards.Deck;
import dev.holdem.hand.eval.HandRank;
import dev.holdem.hand.eval.HandRanker;
import dev.holdem.hand.pot.PotAward;
import dev.holdem.hand.pot.PotManager;
import dev.holdem.hand.pot.PotResolution;
import dev.holdem.hand.state.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Hand state machine for one table.
 *
 * <p>Drives a hand from {@link HandPhase#HAND_SETUP} to
 * {@link HandPhase#HAND_COMPLETE}: rotates the button, posts the blinds, deals
 * hole cards, runs one {@link BettingRound} per street, reveals the board and
 * settles the pots. When everyone but one player folds, the pot goes to that
 * player without any hand being ranked.
 *
 * <p>The engine is single-threaded. It suspends whenever a player has to act;
 * callers either push actions with {@link #act(int, PlayerAction)} or let
 * {@link #playHand(ActionSource)} pull them.
 *
 * <p>A fatal error ({@link Errors.HoldemError#isFatal()}) or any unexpected
 * failure aborts the hand: every stack is put back to its value before the
 * hand and {@link Errors.HandAbortedError} is thrown.
 */
public class GameEngine {
    private static final Logger logger = LoggerFactory.getLogger(GameEngine.class);

    private final TableConfig config;
    private final List<Player> players;
    private final Supplier<Deck> deckSupplier;
    private final HandRanker ranker;
    private final List<HandObserver> observers = new CopyOnWriteArrayList<>();

    private long handsStarted;
    private int buttonSeat = -1;
    private HandProcess process;

    public GameEngine(TableConfig config, List<Player> players) {
        this(config, players, defaultDecks(config), HandRanker.standard());
    }

    /**
     * @param deckSupplier called once per hand for a deck ready to deal from
     * @param ranker ranks the hands shown down
     */
    public GameEngine(TableConfig config, List<Player> players, Supplier<Deck> deckSupplier, HandRanker ranker) {
        this.config = config;
        this.deckSupplier = deckSupplier;
        this.ranker = ranker;

        List<Player> sorted = new ArrayList<>(players);
        sorted.sort(Comparator.comparingInt(Player::getSeat));
        Set<Integer> seats = new HashSet<>();
        for (Player p : sorted) {
            if (!seats.add(p.getSeat())) {
                throw new IllegalArgumentException("Seat " + p.getSeat() + " is taken twice");
            }
        }
        if (sorted.size() > config.maxPlayers()) {
            throw new IllegalArgumentException(
                sorted.size() + " players exceed the table limit of " + config.maxPlayers());
        }
        this.players = List.copyOf(sorted);
    }

    private static Supplier<Deck> defaultDecks(TableConfig config) {
        Deck deck = config.seed() == null ? Deck.shuffled(new Random()) : Deck.seeded(config.seed());
        return () -> {
            deck.reset();
            return deck;
        };
    }

    public void addObserver(HandObserver observer) {
        observers.add(observer);
    }

    // --- Hand lifecycle ---

    /**
     * Sets up the next hand and runs it up to the first decision.
     *
     * @return the table as a spectator sees it
     * @throws IllegalStateException if a hand is still running or fewer than
     *         the minimum number of players can play
     * @throws Errors.HandAbortedError if the hand could not be set up
     */
    public TableSnapshot startHand() {
        if (isHandInProgress()) {
            throw new IllegalStateException("Hand #" + process.getHandNumber() + " is still in progress");
        }
        List<Player> eligible = new ArrayList<>();
        for (Player p : players) {
            if (p.canPlay()) {
                eligible.add(p);
            }
        }
        if (eligible.size() < config.minPlayers()) {
            throw new IllegalStateException("Need at least " + config.minPlayers()
                + " players with chips, have " + eligible.size());
        }

        handsStarted++;
        process = new HandProcess(handsStarted);
        for (Player p : players) {
            process.getSavedStacks().put(p.getSeat(), p.getStack());
        }

        guarded(() -> setUp(eligible));
        return snapshot(TableSnapshot.SPECTATOR);
    }

    private void setUp(List<Player> eligible) {
        for (Player p : players) {
            p.resetForNewHand();
        }
        process.getHandPlayers().addAll(eligible);

        buttonSeat = buttonSeat < 0 ? eligible.get(0).getSeat() : nextSeat(eligible, buttonSeat);
        process.setButtonSeat(buttonSeat);
        if (eligible.size() == 2) {
            // heads-up: the button posts the small blind
            process.setSmallBlindSeat(buttonSeat);
        } else {
            process.setSmallBlindSeat(nextSeat(eligible, buttonSeat));
        }
        process.setBigBlindSeat(nextSeat(eligible, process.getSmallBlindSeat()));

        PotManager pot = process.getPot();
        for (Player p : eligible) {
            pot.register(p.getSeat());
        }

        logger.info("hand_started",
            kv("hand_number", process.getHandNumber()), kv("button", buttonSeat),
            kv("small_blind_seat", process.getSmallBlindSeat()), kv("big_blind_seat", process.getBigBlindSeat()),
            kv("players", eligible.size()));

        postBlind(playerAt(process.getSmallBlindSeat()), config.smallBlind(), ActionRecord.Kind.SMALL_BLIND);
        postBlind(playerAt(process.getBigBlindSeat()), config.bigBlind(), ActionRecord.Kind.BIG_BLIND);

        dealHoleCards(eligible);

        transition(HandPhase.PRE_FLOP_BETTING);
        int firstToAct = eligible.size() == 2 ? process.getSmallBlindSeat() : nextSeat(eligible, process.getBigBlindSeat());
        process.setRound(BettingRound.open(Street.PRE_FLOP, eligible, firstToAct, config.bigBlind(), pot,
            process.getHistory()));

        TableSnapshot view = snapshot(TableSnapshot.SPECTATOR);
        for (HandObserver observer : observers) {
            observer.onHandStarted(view);
        }
        advance();
    }

    private void postBlind(Player player, long amount, ActionRecord.Kind kind) {
        long moved = player.commit(amount);
        process.getPot().contribute(player.getSeat(), moved);
        if (player.isAllIn()) {
            process.getPot().allIn(player.getSeat());
        }
        ActionRecord record = new ActionRecord(Street.PRE_FLOP, player.getSeat(), kind, moved,
            player.getBetThisRound(), process.getPot().total());
        process.getHistory().add(record);
        logger.info("blind_posted", kv("seat", player.getSeat()), kv("blind", kind), kv("amount", moved));
    }

    private void dealHoleCards(List<Player> eligible) {
        Deck deck = deckSupplier.get();
        process.setDeck(deck);
        int start = nextSeat(eligible, buttonSeat);
        for (Player p : clockwiseFrom(eligible, start)) {
            p.dealHoleCards(deck.deal(2));
        }
    }

    /**
     * Applies an action for the player whose turn it is and runs the hand
     * forward to the next decision or to the end.
     *
     * @return the table as the acting player sees it afterwards
     * @throws Errors.IllegalActionError if the action is not allowed; nothing changes
     * @throws Errors.HandAbortedError if the hand had to be aborted
     */
    public TableSnapshot act(int seat, PlayerAction action) {
        if (!isAwaitingAction()) {
            throw Errors.IllegalActionError.noHandInProgress();
        }
        if (!process.isDealtIn(seat) || !playerAt(seat).isActive()) {
            throw rejected(seat, action, Errors.IllegalActionError.playerNotActive(seat));
        }

        ActionRecord accepted = apply(seat, action);
        guarded(() -> {
            TableSnapshot view = snapshot(TableSnapshot.SPECTATOR);
            for (HandObserver observer : observers) {
                observer.onAction(accepted, view);
            }
            advance();
        });
        return snapshot(seat);
    }

    private ActionRecord apply(int seat, PlayerAction action) {
        try {
            return process.getRound().apply(seat, action);
        } catch (Errors.IllegalActionError e) {
            throw rejected(seat, action, e);
        }
    }

    private Errors.IllegalActionError rejected(int seat, PlayerAction action, Errors.IllegalActionError e) {
        logger.warn("illegal_action", kv("seat", seat), kv("action", action), kv("reason", e.getReason()));
        return e;
    }

    /**
     * Plays the current hand to the end, starting a new one if none is running.
     *
     * <p>Illegal actions are reported back to the source and the same player
     * is asked again. An abandoned request is asked again or folded, as the
     * table's {@link AbortPolicy} says; a source that is closed for good
     * aborts the hand.
     */
    public HandResult playHand(ActionSource source) {
        if (!isHandInProgress()) {
            startHand();
        }
        while (!process.isComplete()) {
            ActionRequest request = pendingRequest()
                .orElseThrow(() -> new IllegalStateException("Hand stalled in " + process.getPhase()));
            PlayerAction action;
            try {
                action = source.nextAction(request, snapshot(request.seat()));
            } catch (Errors.ActionAbortedError e) {
                if (source.isClosed()) {
                    throw abort(e);
                }
                if (config.abortPolicy() == AbortPolicy.FOLD) {
                    logger.warn("action_aborted", kv("seat", request.seat()), kv("policy", "fold"));
                    action = PlayerAction.fold();
                } else {
                    logger.warn("action_aborted", kv("seat", request.seat()), kv("policy", "reprompt"));
                    continue;
                }
            }
            try {
                act(request.seat(), action);
            } catch (Errors.IllegalActionError e) {
                source.onIllegalAction(request, e);
            }
        }
        return process.getResult();
    }

    /**
     * Aborts the running hand and puts every stack back.
     *
     * @return the error describing the abort, for the caller to throw
     */
    public Errors.HandAbortedError abort(Throwable cause) {
        if (!isHandInProgress()) {
            throw new IllegalStateException("No hand in progress to abort");
        }
        long handNumber = process.getHandNumber();
        for (Player p : players) {
            Long saved = process.getSavedStacks().get(p.getSeat());
            if (saved != null) {
                p.restoreStack(saved);
            }
        }
        process = null;
        logger.error("hand_aborted", kv("hand_number", handNumber), kv("cause", cause.toString()));
        for (HandObserver observer : observers) {
            observer.onHandAborted(handNumber, cause);
        }
        return new Errors.HandAbortedError(handNumber, cause);
    }

    private void guarded(Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            throw abort(e);
        }
    }

    // --- State machine ---

    private void advance() {
        while (true) {
            HandPhase phase = process.getPhase();
            if (phase.isBetting()) {
                if (!process.getRound().isComplete()) {
                    return;
                }
                if (process.inHandCount() <= 1) {
                    finishUncontested();
                    return;
                }
                transition(phase.next());
            } else if (phase.isReveal()) {
                reveal(phase.street());
                transition(phase.next());
            } else if (phase == HandPhase.SHOWDOWN) {
                showdown();
                return;
            } else {
                return;
            }
        }
    }

    private void transition(HandPhase target) {
        HandPhase current = process.getPhase();
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal hand transition " + current + " -> " + target);
        }
        process.setPhase(target);
        logger.debug("phase_changed", kv("from", current), kv("to", target));
    }

    private void reveal(Street street) {
        List<Card> cards = process.getDeck().deal(street.cardsRevealed());
        process.getBoard().addAll(cards);
        logger.info("community_cards_dealt", kv("street", street), kv("cards", cards),
            kv("board", process.getBoard()));

        for (Player p : process.getHandPlayers()) {
            p.resetForNewRound();
        }
        process.getPot().nextStreet();
        process.setRound(BettingRound.open(street, process.getHandPlayers(), nextSeatAfter(buttonSeat),
            config.bigBlind(), process.getPot(), process.getHistory()));

        TableSnapshot view = snapshot(TableSnapshot.SPECTATOR);
        for (HandObserver observer : observers) {
            observer.onCommunityCards(street, List.copyOf(cards), view);
        }
    }

    private void finishUncontested() {
        Player winner = null;
        for (Player p : process.getHandPlayers()) {
            if (p.isInHand()) {
                winner = p;
            }
        }
        PotResolution resolution = process.getPot().awardAll(winner.getSeat());
        transition(HandPhase.HAND_COMPLETE);
        complete(resolution, Map.of(), Map.of());
    }

    private void showdown() {
        Map<Integer, HandRank> ranks = new TreeMap<>();
        Map<Integer, List<Card>> shown = new TreeMap<>();
        for (Player p : process.getHandPlayers()) {
            if (p.isInHand()) {
                ranks.put(p.getSeat(), ranker.rank(p.getHoleCards(), process.getBoard()));
                shown.put(p.getSeat(), p.getHoleCards());
            }
        }
        List<Integer> oddChipOrder = config.oddChipPolicy().order(new ArrayList<>(ranks.keySet()), buttonSeat);
        PotResolution resolution = process.getPot().resolve(ranks, oddChipOrder);
        transition(HandPhase.HAND_COMPLETE);
        complete(resolution, ranks, shown);
    }

    private void complete(PotResolution resolution, Map<Integer, HandRank> ranks, Map<Integer, List<Card>> shown) {
        for (PotAward award : resolution.awards()) {
            award.payouts().forEach((seat, amount) -> playerAt(seat).award(amount));
            logger.info("pot_awarded", kv("pot", award.pot().label()), kv("amount", award.pot().amount()),
                kv("winners", award.winnerSeats()));
        }

        Map<Integer, Long> finalStacks = new LinkedHashMap<>();
        for (Player p : players) {
            finalStacks.put(p.getSeat(), p.getStack());
        }
        HandResult result = new HandResult(process.getHandNumber(), resolution.awards(), resolution.uncontested(),
            ranks, shown, process.getBoard(), finalStacks, process.getHistory());
        process.setResult(result);
        process.discardResources();

        logger.info("hand_complete", kv("hand_number", result.handNumber()),
            kv("won_by_fold", result.wonByFold()), kv("winners", result.winners()));

        TableSnapshot view = snapshot(TableSnapshot.SPECTATOR);
        for (HandObserver observer : observers) {
            observer.onHandComplete(result, view);
        }
    }

    // --- Queries ---

    public boolean isHandInProgress() {
        return process != null && !process.isComplete();
    }

    private boolean isAwaitingAction() {
        return isHandInProgress() && process.getPhase().isBetting() && !process.getRound().isComplete();
    }

    /**
     * Options for the player whose turn it is, or empty when nobody has to act.
     */
    public Optional<ActionRequest> pendingRequest() {
        if (!isAwaitingAction()) {
            return Optional.empty();
        }
        return Optional.of(process.getRound().request());
    }

    /**
     * Outcome of the last hand that completed, if it is still the latest hand.
     */
    public Optional<HandResult> getResult() {
        return process == null ? Optional.empty() : Optional.ofNullable(process.getResult());
    }

    public HandPhase getPhase() {
        return process == null ? HandPhase.HAND_SETUP : process.getPhase();
    }

    public long getHandNumber() {
        return process == null ? handsStarted : process.getHandNumber();
    }

    public int getButtonSeat() {
        return buttonSeat;
    }

    public List<Player> getPlayers() {
        return players;
    }

    /**
     * The table as {@code viewerSeat} sees it. Hole cards are visible to
     * their owner, and after a showdown the cards of every player who
     * reached it are visible to all. Pass {@link TableSnapshot#SPECTATOR}
     * for a view with no private cards.
     */
    public TableSnapshot snapshot(int viewerSeat) {
        if (process == null) {
            List<PlayerView> views = new ArrayList<>();
            for (Player p : players) {
                views.add(new PlayerView(p.getSeat(), p.getId(), p.getName(), p.getStack(), p.getStatus(),
                    0, 0, List.of(), p.getSeat() == buttonSeat, false, false));
            }
            return new TableSnapshot(handsStarted, HandPhase.HAND_SETUP, null, List.of(), List.of(), 0,
                buttonSeat, -1, 0, views, List.of());
        }

        HandResult result = process.getResult();
        List<PlayerView> views = new ArrayList<>();
        for (Player p : players) {
            boolean visible = p.getSeat() == viewerSeat
                || (result != null && result.shownCards().containsKey(p.getSeat()));
            views.add(new PlayerView(p.getSeat(), p.getId(), p.getName(), p.getStack(), p.getStatus(),
                p.getBetThisRound(), p.getTotalInvested(), visible ? p.getHoleCards() : List.of(),
                p.getSeat() == process.getButtonSeat(), p.getSeat() == process.getSmallBlindSeat(),
                p.getSeat() == process.getBigBlindSeat()));
        }

        BettingRound round = process.getRound();
        PotManager pot = process.getPot();
        return new TableSnapshot(process.getHandNumber(), process.getPhase(), process.getPhase().street(),
            process.getBoard(), pot.pots(), pot.total(), process.getButtonSeat(),
            round == null ? -1 : round.getActionOn(), round == null ? 0 : round.getBetToCall(),
            views, process.getHistory());
    }

    // --- Seats ---

    private Player playerAt(int seat) {
        for (Player p : players) {
            if (p.getSeat() == seat) {
                return p;
            }
        }
        throw new IllegalArgumentException("No player in seat " + seat);
    }

    private int nextSeatAfter(int seat) {
        return nextSeat(process.getHandPlayers(), seat);
    }

    private static int nextSeat(List<Player> ordered, int seat) {
        for (Player p : ordered) {
            if (p.getSeat() > seat) {
                return p.getSeat();
            }
        }
        return ordered.get(0).getSeat();
    }

    private static List<Player> clockwiseFrom(List<Player> ordered, int startSeat) {
        List<Player> result = new ArrayList<>(ordered.size());
        int start = 0;
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).getSeat() == startSeat) {
                start = i;
                break;
            }
        }
        for (int i = 0; i < ordered.size(); i++) {
            result.add(ordered.get((start + i) % ordered.size()));
        }
        return result;
    }
}
