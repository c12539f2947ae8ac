package dev.holdem.hand.betting;

import dev.holdem.hand.Errors;
import dev.holdem.hand.pot.PotManager;
import dev.holdem.hand.state.Player;
import dev.holdem.hand.state.PlayerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Betting round controller for one street.
 *
 * <p>Moves from {@link State#AWAITING_ACTION} to {@link State#ROUND_COMPLETE}
 * once no player is left to act. Each action is validated against the bet to
 * call and the actor's stack; a rejected action throws
 * {@link Errors.IllegalActionError} and leaves the round untouched.
 *
 * <p>A full raise (at least the minimum increment) reopens the action for
 * every other active player. An all-in that does not reach a full raise makes
 * the others call the larger amount but does not let players who already
 * acted raise again.
 */
public class BettingRound {
    private static final Logger logger = LoggerFactory.getLogger(BettingRound.class);

    public enum State {
        AWAITING_ACTION,
        ROUND_COMPLETE
    }

    private final Street street;
    private final Map<Integer, Player> players = new LinkedHashMap<>();
    private final List<Integer> seatOrder = new ArrayList<>();
    private final PotManager pot;
    private final long bigBlind;
    private final List<ActionRecord> history;

    private final Deque<Integer> pending = new ArrayDeque<>();
    private final Set<Integer> actedSinceFullRaise = new HashSet<>();
    private long betToCall;
    private long lastRaiseSize;
    private int lastAggressor = -1;

    private BettingRound(Street street, List<Player> handPlayers, PotManager pot, long bigBlind,
                         List<ActionRecord> history) {
        this.street = street;
        this.pot = pot;
        this.bigBlind = bigBlind;
        this.history = history;
        for (Player p : handPlayers) {
            players.put(p.getSeat(), p);
            seatOrder.add(p.getSeat());
        }
        Collections.sort(seatOrder);
    }

    /**
     * Opens the betting for a street.
     *
     * @param handPlayers every player dealt into the hand, folded and all-in included
     * @param firstToAct seat the action starts from; skipped if it cannot act
     * @param history hand history the accepted actions are appended to
     */
    public static BettingRound open(Street street, List<Player> handPlayers, int firstToAct, long bigBlind,
                                    PotManager pot, List<ActionRecord> history) {
        BettingRound round = new BettingRound(street, handPlayers, pot, bigBlind, history);
        round.start(firstToAct);
        return round;
    }

    private void start(int firstToAct) {
        for (Player p : players.values()) {
            betToCall = Math.max(betToCall, p.getBetThisRound());
        }
        lastRaiseSize = bigBlind;

        if (inHandCount() <= 1) {
            return;
        }
        List<Integer> actors = activeSeatsFrom(firstToAct, -1);
        if (actors.size() == 1 && players.get(actors.get(0)).getBetThisRound() >= betToCall) {
            // nobody left to bet against
            return;
        }
        pending.addAll(actors);
    }

    /**
     * Applies an action for the player whose turn it is.
     *
     * @return the accepted action as recorded in the hand history
     * @throws Errors.IllegalActionError if the action is not allowed now
     */
    public ActionRecord apply(int seat, PlayerAction action) {
        if (isComplete()) {
            throw Errors.IllegalActionError.roundComplete();
        }
        int expected = pending.peekFirst();
        if (seat != expected) {
            throw Errors.IllegalActionError.notYourTurn(seat, expected);
        }

        Player player = players.get(seat);
        ActionRecord record;
        switch (action.type()) {
            case FOLD:
                record = fold(player);
                break;
            case CHECK:
                record = check(player);
                break;
            case CALL:
                record = call(player);
                break;
            case RAISE:
                record = raise(player, action.amount());
                break;
            case ALL_IN:
                record = allIn(player);
                break;
            default:
                throw new IllegalStateException("Unhandled action " + action.type());
        }

        if (inHandCount() <= 1) {
            pending.clear();
        }

        history.add(record);
        logger.info("action_taken",
            kv("street", street), kv("seat", seat), kv("action", record.kind()),
            kv("amount", record.amount()), kv("bet_to_call", betToCall), kv("pot_total", record.potTotal()));
        return record;
    }

    private ActionRecord fold(Player player) {
        player.setStatus(PlayerStatus.FOLDED);
        pot.fold(player.getSeat());
        pending.removeFirst();
        return record(player, ActionRecord.Kind.FOLD, 0);
    }

    private ActionRecord check(Player player) {
        long toCall = toCall(player);
        if (toCall > 0) {
            throw Errors.IllegalActionError.cannotCheck(toCall);
        }
        pending.removeFirst();
        actedSinceFullRaise.add(player.getSeat());
        return record(player, ActionRecord.Kind.CHECK, 0);
    }

    private ActionRecord call(Player player) {
        long toCall = toCall(player);
        if (toCall <= 0) {
            throw Errors.IllegalActionError.nothingToCall();
        }
        long moved = commit(player, toCall);
        pending.removeFirst();
        actedSinceFullRaise.add(player.getSeat());
        return record(player, player.isAllIn() ? ActionRecord.Kind.ALL_IN : ActionRecord.Kind.CALL, moved);
    }

    private ActionRecord raise(Player player, long raiseTo) {
        int seat = player.getSeat();
        if (!mayRaise(seat)) {
            throw Errors.IllegalActionError.bettingNotReopened();
        }
        long needed = raiseTo - player.getBetThisRound();
        if (needed > player.getStack()) {
            throw new Errors.InsufficientStackError(needed, player.getStack());
        }
        long minRaiseTo = minRaiseTo();
        if (raiseTo < minRaiseTo) {
            throw Errors.IllegalActionError.belowMinimumRaise(raiseTo, minRaiseTo);
        }

        ActionRecord.Kind kind = betToCall == 0 ? ActionRecord.Kind.BET : ActionRecord.Kind.RAISE;
        long moved = commit(player, needed);
        lastRaiseSize = raiseTo - betToCall;
        betToCall = raiseTo;
        lastAggressor = seat;
        reopen(seat, true);
        return record(player, player.isAllIn() ? ActionRecord.Kind.ALL_IN : kind, moved);
    }

    private ActionRecord allIn(Player player) {
        int seat = player.getSeat();
        long newBet = player.getBetThisRound() + player.getStack();

        if (newBet <= betToCall) {
            long moved = commit(player, player.getStack());
            pending.removeFirst();
            actedSinceFullRaise.add(seat);
            return record(player, ActionRecord.Kind.ALL_IN, moved);
        }

        if (!mayRaise(seat)) {
            throw Errors.IllegalActionError.bettingNotReopened();
        }
        long raiseSize = newBet - betToCall;
        boolean fullRaise = raiseSize >= minIncrement();
        long moved = commit(player, player.getStack());
        if (fullRaise) {
            lastRaiseSize = raiseSize;
        }
        betToCall = newBet;
        lastAggressor = seat;
        reopen(seat, fullRaise);
        return record(player, ActionRecord.Kind.ALL_IN, moved);
    }

    /**
     * Everyone else still able to act has to respond to the new bet. Only a
     * full raise gives players who already acted the right to raise again.
     */
    private void reopen(int raiserSeat, boolean fullRaise) {
        pending.clear();
        pending.addAll(activeSeatsFrom(nextSeat(raiserSeat), raiserSeat));
        if (fullRaise) {
            actedSinceFullRaise.clear();
        }
        actedSinceFullRaise.add(raiserSeat);
    }

    private long commit(Player player, long amount) {
        long moved = player.commit(amount);
        pot.contribute(player.getSeat(), moved);
        if (player.isAllIn()) {
            pot.allIn(player.getSeat());
        }
        return moved;
    }

    private ActionRecord record(Player player, ActionRecord.Kind kind, long amount) {
        return new ActionRecord(street, player.getSeat(), kind, amount, player.getBetThisRound(), pot.total());
    }

    // --- Queries ---

    public Street getStreet() {
        return street;
    }

    public State getState() {
        return isComplete() ? State.ROUND_COMPLETE : State.AWAITING_ACTION;
    }

    public boolean isComplete() {
        return pending.isEmpty();
    }

    /**
     * Seat whose turn it is, or -1 when the round is complete.
     */
    public int getActionOn() {
        Integer seat = pending.peekFirst();
        return seat == null ? -1 : seat;
    }

    public List<Integer> getPendingSeats() {
        return List.copyOf(pending);
    }

    public long getBetToCall() {
        return betToCall;
    }

    public int getLastAggressor() {
        return lastAggressor;
    }

    /**
     * Smallest raise increment: the big blind or the last full raise, whichever is larger.
     */
    public long minIncrement() {
        return Math.max(bigBlind, lastRaiseSize);
    }

    public long minRaiseTo() {
        return betToCall + minIncrement();
    }

    /**
     * True when every active player has matched the bet to call.
     */
    public boolean isSettled() {
        for (Player p : players.values()) {
            if (p.isActive() && p.getBetThisRound() != betToCall) {
                return false;
            }
        }
        return true;
    }

    /**
     * Options for the player whose turn it is.
     *
     * @throws Errors.IllegalActionError if the round is complete
     */
    public ActionRequest request() {
        if (isComplete()) {
            throw Errors.IllegalActionError.roundComplete();
        }
        Player player = players.get(pending.peekFirst());
        long toCall = toCall(player);
        long stack = player.getStack();
        long maxRaiseTo = player.getBetThisRound() + stack;
        boolean canRaise = mayRaise(player.getSeat());

        Set<ActionType> legal = EnumSet.of(ActionType.FOLD);
        legal.add(toCall > 0 ? ActionType.CALL : ActionType.CHECK);
        if (canRaise && maxRaiseTo >= minRaiseTo()) {
            legal.add(ActionType.RAISE);
        }
        if (canRaise || stack <= toCall) {
            legal.add(ActionType.ALL_IN);
        }

        return new ActionRequest(street, player.getSeat(), betToCall, Math.min(toCall, stack),
            legal.contains(ActionType.RAISE) ? minRaiseTo() : 0, maxRaiseTo, stack, legal);
    }

    private long toCall(Player player) {
        return betToCall - player.getBetThisRound();
    }

    private boolean mayRaise(int seat) {
        return !actedSinceFullRaise.contains(seat);
    }

    private int inHandCount() {
        int count = 0;
        for (Player p : players.values()) {
            if (p.isInHand()) {
                count++;
            }
        }
        return count;
    }

    private int nextSeat(int seat) {
        for (int s : seatOrder) {
            if (s > seat) {
                return s;
            }
        }
        return seatOrder.get(0);
    }

    /**
     * Active seats clockwise starting at {@code startSeat}, leaving out {@code excludeSeat}.
     */
    private List<Integer> activeSeatsFrom(int startSeat, int excludeSeat) {
        List<Integer> ordered = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < seatOrder.size(); i++) {
            if (seatOrder.get(i) >= startSeat) {
                start = i;
                break;
            }
        }
        for (int i = 0; i < seatOrder.size(); i++) {
            int seat = seatOrder.get((start + i) % seatOrder.size());
            if (seat != excludeSeat && players.get(seat).isActive()) {
                ordered.add(seat);
            }
        }
        return ordered;
    }
}
