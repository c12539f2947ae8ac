package dev.holdem.prjoutput;

import dev.holdem.hand.betting.ActionRecord;
import dev.holdem.hand.betting.Street;
import dev.holdem.hand.cards.Card;
import dev.holdem.hand.pot.Pot;
import dev.holdem.hand.pot.PotAward;
import dev.holdem.handflow.HandResult;
import dev.holdem.handflow.PlayerView;
import dev.holdem.handflow.TableSnapshot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders table views and hand events as human-readable text.
 */
public class TextRenderer {

    private static final int WIDTH = 60;
    private static final int BOX_WIDTH = 38;
    // Screen slot for the n-th seated player, clockwise around the table
    private static final int[] SLOT_FOR_PLAYER = {4, 0, 1, 3, 8, 2, 7, 6, 5};

    private final Map<Integer, String> playerNames = new HashMap<>();

    /**
     * Set display name for a seat.
     */
    public void setPlayerName(int seat, String name) {
        playerNames.put(seat, name);
    }

    /**
     * Learns the names of everyone seated in the view.
     */
    public void rememberNames(TableSnapshot view) {
        for (PlayerView p : view.players()) {
            setPlayerName(p.seat(), p.name());
        }
    }

    /**
     * Get display name for a seat (or the seat number if unknown).
     */
    private String getPlayerName(int seat) {
        return playerNames.getOrDefault(seat, "Seat " + seat);
    }

    public String renderHandStarted(TableSnapshot view) {
        rememberNames(view);
        return String.format("=== Hand #%d started (dealer: %s) ===",
            view.handNumber(), getPlayerName(view.buttonSeat()));
    }

    public String renderAction(ActionRecord action) {
        String player = getPlayerName(action.seat());
        switch (action.kind()) {
            case SMALL_BLIND:
                return String.format("%s posts small blind %d", player, action.amount());
            case BIG_BLIND:
                return String.format("%s posts big blind %d", player, action.amount());
            case FOLD:
                return String.format("%s folds", player);
            case CHECK:
                return String.format("%s checks (pot: %d)", player, action.potTotal());
            case CALL:
                return String.format("%s calls %d (pot: %d)", player, action.amount(), action.potTotal());
            case BET:
                return String.format("%s bets %d (pot: %d)", player, action.betTo(), action.potTotal());
            case RAISE:
                return String.format("%s raises to %d (pot: %d)", player, action.betTo(), action.potTotal());
            case ALL_IN:
                return String.format("%s is all-in for %d (pot: %d)", player, action.amount(), action.potTotal());
            default:
                return "[" + action.kind() + "]";
        }
    }

    public String renderCommunityCards(Street street, List<Card> cards) {
        return String.format("%s: %s", street.displayName(), renderCards(cards));
    }

    /**
     * Renders the outcome, one line per pot tier plus the hands shown.
     */
    public String renderResult(HandResult result) {
        List<String> lines = new ArrayList<>();
        for (Map.Entry<Integer, List<Card>> shown : result.shownCards().entrySet()) {
            int seat = shown.getKey();
            lines.add(String.format("%s shows %s (%s)",
                getPlayerName(seat), renderCards(shown.getValue()), result.describe(seat)));
        }
        for (PotAward award : result.awards()) {
            lines.add(renderAward(award, result));
        }
        lines.add(String.format("Hand #%d complete", result.handNumber()));
        return String.join(System.lineSeparator(), lines);
    }

    private String renderAward(PotAward award, HandResult result) {
        Pot pot = award.pot();
        String label = capitalize(pot.label()) + " pot";
        if (result.wonByFold()) {
            int winner = award.winnerSeats().get(0);
            return String.format("%s wins %d uncontested", getPlayerName(winner), award.totalPaid());
        }
        if (!award.isSplit()) {
            int winner = award.winnerSeats().get(0);
            return String.format("%s (%d): %s wins %d with %s",
                label, pot.amount(), getPlayerName(winner), award.totalPaid(), result.describe(winner));
        }
        StringBuilder sb = new StringBuilder(String.format("%s (%d) split: ", label, pot.amount()));
        boolean first = true;
        for (int seat : award.winnerSeats()) {
            if (!first) sb.append(", ");
            sb.append(String.format("%s wins %d", getPlayerName(seat), award.payouts().get(seat)));
            first = false;
        }
        sb.append(" with ").append(result.describe(award.winnerSeats().get(0)));
        return sb.toString();
    }

    /**
     * Draws the table: players around the edge, board and pots in the middle,
     * followed by any hole cards the viewer may see.
     */
    public String renderBoard(TableSnapshot view) {
        rememberNames(view);
        String[] slots = new String[SLOT_FOR_PLAYER.length];
        Arrays.fill(slots, "");
        List<PlayerView> players = view.players();
        for (int i = 0; i < players.size() && i < SLOT_FOR_PLAYER.length; i++) {
            slots[SLOT_FOR_PLAYER[i]] = renderSeat(players.get(i));
        }

        List<String> lines = new ArrayList<>();
        lines.add("=".repeat(WIDTH));
        lines.add(center(slots[0]));
        lines.add(String.format("%-25s%s%25s", slots[1], " ".repeat(10), slots[2]));
        lines.add("");
        lines.add(String.format("%-15s%s%15s", slots[3], " ".repeat(30), slots[4]));
        lines.add(center("╭" + "─".repeat(BOX_WIDTH) + "╮"));
        lines.add(center("│" + padRight("  Board: " + (view.board().isEmpty() ? "---" : renderCards(view.board()))) + "│"));
        lines.add(center("│" + padRight("  Pot: " + renderPots(view)) + "│"));
        lines.add(center("╰" + "─".repeat(BOX_WIDTH) + "╯"));
        lines.add(String.format("%-15s%s%15s", slots[5], " ".repeat(30), slots[6]));
        lines.add("");
        lines.add(String.format("%-25s%s%25s", slots[7], " ".repeat(10), slots[8]));
        lines.add("=".repeat(WIDTH));

        for (PlayerView p : players) {
            if (p.cardsVisible()) {
                lines.add(String.format("%s: %s", p.name(), renderCards(p.holeCards())));
            }
        }
        return String.join(System.lineSeparator(), lines);
    }

    private String renderSeat(PlayerView p) {
        StringBuilder sb = new StringBuilder(String.format("%s (%d)", p.name(), p.stack()));
        if (p.button()) sb.append(" [D]");
        if (p.smallBlind()) sb.append(" [SB]");
        if (p.bigBlind()) sb.append(" [BB]");
        switch (p.status()) {
            case FOLDED:
                sb.append(" (Folded)");
                break;
            case ALL_IN:
                sb.append(" (All-in)");
                break;
            case SITTING_OUT:
                sb.append(" (Out)");
                break;
            default:
                break;
        }
        return sb.toString();
    }

    private String renderPots(TableSnapshot view) {
        if (view.pots().size() <= 1) {
            return Long.toString(view.potTotal());
        }
        List<String> tiers = new ArrayList<>();
        for (Pot pot : view.pots()) {
            tiers.add(pot.label() + " " + pot.amount());
        }
        return view.potTotal() + " (" + String.join(", ", tiers) + ")";
    }

    public String renderCards(List<Card> cards) {
        StringBuilder sb = new StringBuilder();
        for (Card card : cards) {
            if (sb.length() > 0) sb.append(" ");
            sb.append(card);
        }
        return sb.toString();
    }

    private static String center(String text) {
        if (text.length() >= WIDTH) {
            return text;
        }
        int left = (WIDTH - text.length()) / 2;
        int right = WIDTH - text.length() - left;
        return " ".repeat(left) + text + " ".repeat(right);
    }

    private static String padRight(String text) {
        return text.length() >= BOX_WIDTH ? text : text + " ".repeat(BOX_WIDTH - text.length());
    }

    private static String capitalize(String text) {
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
