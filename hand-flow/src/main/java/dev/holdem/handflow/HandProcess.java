package dev.holdem.handflow;

import dev.holdem.hand.betting.ActionRecord;
import dev.holdem.hand.betting.BettingRound;
import dev.holdem.hand.cards.Card;
import dev.holdem.hand.cards.Deck;
import dev.holdem.hand.pot.PotManager;
import dev.holdem.hand.state.Player;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * State owned by a single hand.
 *
 * <p>Created at HAND_SETUP and dropped by the engine once the next hand
 * starts. Only player stacks outlive it.
 */
public class HandProcess {
    private final long handNumber;

    // State machine
    private HandPhase phase = HandPhase.HAND_SETUP;

    // Hand-scoped resources
    private Deck deck;
    private final List<Card> board = new ArrayList<>(5);
    private final PotManager pot = new PotManager();
    private BettingRound round;
    private final List<ActionRecord> history = new ArrayList<>();

    // Players dealt in, ordered by seat
    private final List<Player> handPlayers = new ArrayList<>();
    private final Map<Integer, Long> savedStacks = new HashMap<>();

    // Position tracking
    private int buttonSeat = -1;
    private int smallBlindSeat = -1;
    private int bigBlindSeat = -1;

    private HandResult result;

    public HandProcess(long handNumber) {
        this.handNumber = handNumber;
    }

    public long getHandNumber() { return handNumber; }
    public HandPhase getPhase() { return phase; }
    public void setPhase(HandPhase phase) { this.phase = phase; }
    public Deck getDeck() { return deck; }
    public void setDeck(Deck deck) { this.deck = deck; }
    public List<Card> getBoard() { return board; }
    public PotManager getPot() { return pot; }
    public BettingRound getRound() { return round; }
    public void setRound(BettingRound round) { this.round = round; }
    public List<ActionRecord> getHistory() { return history; }
    public List<Player> getHandPlayers() { return handPlayers; }
    public Map<Integer, Long> getSavedStacks() { return savedStacks; }
    public int getButtonSeat() { return buttonSeat; }
    public void setButtonSeat(int buttonSeat) { this.buttonSeat = buttonSeat; }
    public int getSmallBlindSeat() { return smallBlindSeat; }
    public void setSmallBlindSeat(int smallBlindSeat) { this.smallBlindSeat = smallBlindSeat; }
    public int getBigBlindSeat() { return bigBlindSeat; }
    public void setBigBlindSeat(int bigBlindSeat) { this.bigBlindSeat = bigBlindSeat; }
    public HandResult getResult() { return result; }
    public void setResult(HandResult result) { this.result = result; }

    public boolean isComplete() {
        return phase == HandPhase.HAND_COMPLETE;
    }

    /**
     * Seat is dealt into this hand, folded or not.
     */
    public boolean isDealtIn(int seat) {
        for (Player p : handPlayers) {
            if (p.getSeat() == seat) {
                return true;
            }
        }
        return false;
    }

    public int inHandCount() {
        int count = 0;
        for (Player p : handPlayers) {
            if (p.isInHand()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Releases the deck and the betting round once the hand is over.
     */
    public void discardResources() {
        deck = null;
        round = null;
    }
}
