package dev.holdem.hand.betting;

import java.util.Locale;
import java.util.Objects;

/**
 * An action submitted for the player whose turn it is.
 *
 * @param amount for {@link ActionType#RAISE} the total this round the player
 *               raises to; zero for every other type
 */
public record PlayerAction(ActionType type, long amount) {

    public PlayerAction {
        Objects.requireNonNull(type, "type");
        if (type == ActionType.RAISE && amount <= 0) {
            throw new IllegalArgumentException("Raise amount must be positive: " + amount);
        }
        if (type != ActionType.RAISE && amount != 0) {
            throw new IllegalArgumentException(type + " does not take an amount");
        }
    }

    public static PlayerAction fold() {
        return new PlayerAction(ActionType.FOLD, 0);
    }

    public static PlayerAction check() {
        return new PlayerAction(ActionType.CHECK, 0);
    }

    public static PlayerAction call() {
        return new PlayerAction(ActionType.CALL, 0);
    }

    public static PlayerAction raiseTo(long amount) {
        return new PlayerAction(ActionType.RAISE, amount);
    }

    public static PlayerAction allIn() {
        return new PlayerAction(ActionType.ALL_IN, 0);
    }

    @Override
    public String toString() {
        return type == ActionType.RAISE ? "raise " + amount : type.name().toLowerCase(Locale.ROOT);
    }
}
