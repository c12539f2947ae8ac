package dev.holdem.table;

import dev.holdem.hand.Errors;
import dev.holdem.hand.cards.Deck;
import dev.holdem.hand.eval.HandRanker;
import dev.holdem.hand.state.Player;
import dev.holdem.handflow.ActionSource;
import dev.holdem.handflow.GameEngine;
import dev.holdem.handflow.HandObserver;
import dev.holdem.handflow.HandResult;
import dev.holdem.handflow.TableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * A single table playing hand after hand.
 *
 * <p>Players are seated in the order given, each with the starting stack.
 * A player whose stack runs out is busted and sits out every later hand.
 * Sitting out and back in takes effect from the next hand. The session ends
 * once fewer players than the table minimum can play.
 */
public class TableSession {
    private static final Logger logger = LoggerFactory.getLogger(TableSession.class);

    private final TableConfig config;
    private final GameEngine engine;
    private final List<HandResult> results = new ArrayList<>();

    public TableSession(TableConfig config, List<String> names) {
        this.config = config;
        this.engine = new GameEngine(config, seat(config, names));
    }

    public TableSession(TableConfig config, List<String> names, Supplier<Deck> decks, HandRanker ranker) {
        this.config = config;
        this.engine = new GameEngine(config, seat(config, names), decks, ranker);
    }

    private static List<Player> seat(TableConfig config, List<String> names) {
        if (names.size() < config.minPlayers() || names.size() > config.maxPlayers()) {
            throw new IllegalArgumentException("Table seats " + config.minPlayers() + " to "
                + config.maxPlayers() + " players, got " + names.size());
        }
        List<Player> players = new ArrayList<>();
        for (int seat = 0; seat < names.size(); seat++) {
            String name = names.get(seat);
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Player in seat " + seat + " needs a name");
            }
            players.add(new Player("player-" + (seat + 1), name.trim(), seat, config.startingStack()));
        }
        return players;
    }

    public void addObserver(HandObserver observer) {
        engine.addObserver(observer);
    }

    /**
     * Takes the player out of the next hands until {@link #sitIn(int)}.
     */
    public void sitOut(int seat) {
        Player player = player(seat);
        player.setSittingOutRequested(true);
        logger.info("player_sat_out", kv("seat", seat), kv("name", player.getName()));
    }

    /**
     * Brings a sitting-out player back from the next hand.
     *
     * @throws IllegalStateException if the player has no chips left
     */
    public void sitIn(int seat) {
        Player player = player(seat);
        if (player.getStack() == 0) {
            throw new IllegalStateException(player.getName() + " is busted and cannot sit in");
        }
        player.setSittingOutRequested(false);
        logger.info("player_sat_in", kv("seat", seat), kv("name", player.getName()));
    }

    /**
     * True while enough players can be dealt into another hand.
     */
    public boolean canContinue() {
        return engine.isHandInProgress() || playableCount() >= config.minPlayers();
    }

    /**
     * Plays one hand to completion.
     *
     * @throws Errors.HandAbortedError if the hand was aborted; stacks are as before it
     */
    public HandResult playHand(ActionSource source) {
        List<Player> before = new ArrayList<>();
        for (Player p : engine.getPlayers()) {
            if (p.getStack() > 0) {
                before.add(p);
            }
        }

        HandResult result = engine.playHand(source);
        results.add(result);

        for (Player p : before) {
            if (p.getStack() == 0) {
                logger.info("player_busted", kv("seat", p.getSeat()), kv("name", p.getName()),
                    kv("hand_number", result.handNumber()));
            }
        }
        return result;
    }

    /**
     * Plays hands until the table breaks up, the source closes or
     * {@code maxHands} hands were dealt.
     *
     * @param maxHands hand limit, or 0 for no limit
     * @return the completed hands, in order
     */
    public List<HandResult> run(ActionSource source, int maxHands) {
        int dealt = 0;
        while (canContinue() && (maxHands <= 0 || dealt < maxHands)) {
            dealt++;
            try {
                playHand(source);
            } catch (Errors.HandAbortedError e) {
                if (source.isClosed()) {
                    logger.warn("session_stopped", kv("hand_number", e.getHandNumber()), kv("reason", "input closed"));
                    break;
                }
                logger.error("hand_skipped", kv("hand_number", e.getHandNumber()), kv("cause", e.getMessage()));
            }
        }
        logger.info("session_finished", kv("hands", results.size()),
            kv("winner", getWinner().map(Player::getName).orElse(null)));
        return List.copyOf(results);
    }

    /**
     * The last player holding chips, once everyone else has busted.
     */
    public Optional<Player> getWinner() {
        Player withChips = null;
        for (Player p : engine.getPlayers()) {
            if (p.getStack() > 0) {
                if (withChips != null) {
                    return Optional.empty();
                }
                withChips = p;
            }
        }
        return Optional.ofNullable(withChips);
    }

    public List<Player> getPlayers() {
        return engine.getPlayers();
    }

    public List<HandResult> getResults() {
        return List.copyOf(results);
    }

    public GameEngine getEngine() {
        return engine;
    }

    private int playableCount() {
        int count = 0;
        for (Player p : engine.getPlayers()) {
            if (p.canPlay()) {
                count++;
            }
        }
        return count;
    }

    private Player player(int seat) {
        for (Player p : engine.getPlayers()) {
            if (p.getSeat() == seat) {
                return p;
            }
        }
        throw new IllegalArgumentException("No player in seat " + seat);
    }
}
