package dev.holdem.handflow;

import dev.holdem.hand.betting.ActionRecord;
import dev.holdem.hand.betting.Street;
import dev.holdem.hand.cards.Card;
import dev.holdem.hand.pot.Pot;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the table for one viewer. Changing it never affects the engine.
 *
 * @param street current street, or null outside the betting streets
 * @param actionOn seat whose turn it is, or -1
 */
public record TableSnapshot(
    long handNumber,
    HandPhase phase,
    Street street,
    List<Card> board,
    List<Pot> pots,
    long potTotal,
    int buttonSeat,
    int actionOn,
    long betToCall,
    List<PlayerView> players,
    List<ActionRecord> history
) {
    /** Viewer id for a view that shows no hole cards outside showdown. */
    public static final int SPECTATOR = -1;

    public TableSnapshot {
        board = List.copyOf(board);
        pots = List.copyOf(pots);
        players = List.copyOf(players);
        history = List.copyOf(history);
    }

    public Optional<PlayerView> player(int seat) {
        for (PlayerView view : players) {
            if (view.seat() == seat) {
                return Optional.of(view);
            }
        }
        return Optional.empty();
    }
}
