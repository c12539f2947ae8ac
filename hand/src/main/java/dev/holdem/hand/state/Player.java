package dev.holdem.hand.state;

import dev.holdem.hand.cards.Card;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A seated player. The stack carries over between hands, everything else is
 * reset when a hand starts.
 */
public class Player {

    private final String id;
    private final String name;
    private final int seat;
    private long stack;
    private PlayerStatus status = PlayerStatus.SITTING_OUT;
    private final List<Card> holeCards = new ArrayList<>(2);
    private long betThisRound;
    private long totalInvested;
    private boolean sittingOutRequested;

    public Player(String id, String name, int seat, long stack) {
        if (stack < 0) {
            throw new IllegalArgumentException("Stack must not be negative: " + stack);
        }
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.seat = seat;
        this.stack = stack;
    }

    public String getId() { return id; }

    public String getName() { return name; }

    public int getSeat() { return seat; }

    public long getStack() { return stack; }

    public PlayerStatus getStatus() { return status; }
    public void setStatus(PlayerStatus status) { this.status = status; }

    public List<Card> getHoleCards() { return Collections.unmodifiableList(holeCards); }

    public long getBetThisRound() { return betThisRound; }

    public long getTotalInvested() { return totalInvested; }

    public boolean isSittingOutRequested() { return sittingOutRequested; }
    public void setSittingOutRequested(boolean sittingOutRequested) { this.sittingOutRequested = sittingOutRequested; }

    public boolean isActive() { return status == PlayerStatus.ACTIVE; }

    public boolean hasFolded() { return status == PlayerStatus.FOLDED; }

    public boolean isAllIn() { return status == PlayerStatus.ALL_IN; }

    /**
     * Still contesting the pot: active or all-in.
     */
    public boolean isInHand() {
        return status == PlayerStatus.ACTIVE || status == PlayerStatus.ALL_IN;
    }

    /**
     * Can be dealt into the next hand.
     */
    public boolean canPlay() {
        return stack > 0 && !sittingOutRequested;
    }

    /**
     * Prepares for a new hand: active when the player can play, sitting out otherwise.
     */
    public void resetForNewHand() {
        holeCards.clear();
        betThisRound = 0;
        totalInvested = 0;
        status = canPlay() ? PlayerStatus.ACTIVE : PlayerStatus.SITTING_OUT;
    }

    public void resetForNewRound() {
        betThisRound = 0;
    }

    public void dealHoleCards(List<Card> cards) {
        holeCards.clear();
        holeCards.addAll(cards);
    }

    /**
     * Moves chips from the stack into the pot. Goes all-in when the stack runs out.
     *
     * @return the chips actually moved, capped at the stack
     */
    public long commit(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Commit must not be negative: " + amount);
        }
        long moved = Math.min(amount, stack);
        stack -= moved;
        betThisRound += moved;
        totalInvested += moved;
        if (stack == 0 && status == PlayerStatus.ACTIVE) {
            status = PlayerStatus.ALL_IN;
        }
        return moved;
    }

    public void award(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Award must not be negative: " + amount);
        }
        stack += amount;
    }

    /**
     * Puts the stack back to a saved value when a hand is aborted.
     */
    public void restoreStack(long savedStack) {
        this.stack = savedStack;
        holeCards.clear();
        betThisRound = 0;
        totalInvested = 0;
        status = canPlay() ? PlayerStatus.ACTIVE : PlayerStatus.SITTING_OUT;
    }

    @Override
    public String toString() {
        return name + " (seat " + seat + ", stack " + stack + ", " + status + ")";
    }
}
