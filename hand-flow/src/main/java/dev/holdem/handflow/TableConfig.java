package dev.holdem.handflow;

import dev.holdem.hand.pot.OddChipPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Table settings shared by every hand.
 *
 * @param seed shuffle seed for reproducible deals, or null for a random shuffle
 */
public record TableConfig(
    long smallBlind,
    long bigBlind,
    long startingStack,
    int minPlayers,
    int maxPlayers,
    Long seed,
    OddChipPolicy oddChipPolicy,
    AbortPolicy abortPolicy
) {
    private static final Logger logger = LoggerFactory.getLogger(TableConfig.class);

    public static final long DEFAULT_SMALL_BLIND = 10;
    public static final long DEFAULT_BIG_BLIND = 20;
    public static final long DEFAULT_STARTING_STACK = 1000;
    /** Two hole cards each plus five on the board must fit in one deck. */
    public static final int MAX_SEATS_PER_DECK = 22;

    public static final String ENV_SMALL_BLIND = "HOLDEM_SMALL_BLIND";
    public static final String ENV_BIG_BLIND = "HOLDEM_BIG_BLIND";
    public static final String ENV_STARTING_STACK = "HOLDEM_STARTING_STACK";
    public static final String ENV_SEED = "HOLDEM_SEED";
    public static final String ENV_ODD_CHIP_POLICY = "HOLDEM_ODD_CHIP_POLICY";
    public static final String ENV_ABORT_POLICY = "HOLDEM_ABORT_POLICY";

    public TableConfig {
        Objects.requireNonNull(oddChipPolicy, "oddChipPolicy");
        Objects.requireNonNull(abortPolicy, "abortPolicy");
        if (smallBlind <= 0) {
            throw new IllegalArgumentException("Small blind must be positive: " + smallBlind);
        }
        if (bigBlind < smallBlind) {
            throw new IllegalArgumentException("Big blind " + bigBlind + " is below the small blind " + smallBlind);
        }
        if (startingStack <= 0) {
            throw new IllegalArgumentException("Starting stack must be positive: " + startingStack);
        }
        if (minPlayers < 2 || maxPlayers < minPlayers || maxPlayers > MAX_SEATS_PER_DECK) {
            throw new IllegalArgumentException(
                "Seat bounds must satisfy 2 <= min <= max <= " + MAX_SEATS_PER_DECK + ": " + minPlayers + ".." + maxPlayers);
        }
    }

    public static TableConfig defaults() {
        return new TableConfig(DEFAULT_SMALL_BLIND, DEFAULT_BIG_BLIND, DEFAULT_STARTING_STACK,
            2, 9, null, OddChipPolicy.LEFT_OF_DEALER, AbortPolicy.REPROMPT);
    }

    public TableConfig withBlinds(long smallBlind, long bigBlind) {
        return new TableConfig(smallBlind, bigBlind, startingStack, minPlayers, maxPlayers, seed, oddChipPolicy, abortPolicy);
    }

    public TableConfig withStartingStack(long startingStack) {
        return new TableConfig(smallBlind, bigBlind, startingStack, minPlayers, maxPlayers, seed, oddChipPolicy, abortPolicy);
    }

    public TableConfig withSeatBounds(int minPlayers, int maxPlayers) {
        return new TableConfig(smallBlind, bigBlind, startingStack, minPlayers, maxPlayers, seed, oddChipPolicy, abortPolicy);
    }

    public TableConfig withSeed(Long seed) {
        return new TableConfig(smallBlind, bigBlind, startingStack, minPlayers, maxPlayers, seed, oddChipPolicy, abortPolicy);
    }

    public TableConfig withOddChipPolicy(OddChipPolicy oddChipPolicy) {
        return new TableConfig(smallBlind, bigBlind, startingStack, minPlayers, maxPlayers, seed, oddChipPolicy, abortPolicy);
    }

    public TableConfig withAbortPolicy(AbortPolicy abortPolicy) {
        return new TableConfig(smallBlind, bigBlind, startingStack, minPlayers, maxPlayers, seed, oddChipPolicy, abortPolicy);
    }

    /**
     * Reads settings from environment variables. Missing values keep their
     * defaults; unparsable values are logged and ignored.
     */
    public static TableConfig fromEnvironment(Map<String, String> env) {
        TableConfig defaults = defaults();
        long smallBlind = parseLong(env, ENV_SMALL_BLIND, defaults.smallBlind());
        long bigBlind = parseLong(env, ENV_BIG_BLIND, Math.max(defaults.bigBlind(), smallBlind * 2));
        long startingStack = parseLong(env, ENV_STARTING_STACK, defaults.startingStack());
        Long seed = parseLong(env, ENV_SEED, null);
        OddChipPolicy oddChip = parseEnum(env, ENV_ODD_CHIP_POLICY, OddChipPolicy.class, defaults.oddChipPolicy());
        AbortPolicy abort = parseEnum(env, ENV_ABORT_POLICY, AbortPolicy.class, defaults.abortPolicy());

        try {
            return new TableConfig(smallBlind, bigBlind, startingStack, defaults.minPlayers(), defaults.maxPlayers(),
                seed, oddChip, abort);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid table settings from environment ({}), using defaults", e.getMessage());
            return defaults.withSeed(seed).withOddChipPolicy(oddChip).withAbortPolicy(abort);
        }
    }

    private static Long parseLong(Map<String, String> env, String key, Long fallback) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} env var '{}', using default {}", key, value, fallback);
            return fallback;
        }
    }

    private static <E extends Enum<E>> E parseEnum(Map<String, String> env, String key, Class<E> type, E fallback) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid {} env var '{}', using default {}", key, value, fallback);
            return fallback;
        }
    }
}
