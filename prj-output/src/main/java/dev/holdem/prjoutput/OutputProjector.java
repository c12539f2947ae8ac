package dev.holdem.prjoutput;

import dev.holdem.hand.betting.ActionRecord;
import dev.holdem.hand.betting.Street;
import dev.holdem.hand.cards.Card;
import dev.holdem.handflow.HandObserver;
import dev.holdem.handflow.HandResult;
import dev.holdem.handflow.TableSnapshot;

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.function.Consumer;

/**
 * Projector: Output
 *
 * <p>Observes the game engine and writes a formatted game log. Only ever
 * sees spectator views, so no private hole cards reach the log before a
 * showdown.
 */
public class OutputProjector implements HandObserver {

    private final TextRenderer renderer;
    private final Consumer<String> outputFn;
    private final boolean showTimestamps;
    private final Clock clock;
    private final DateTimeFormatter timeFormatter;

    public OutputProjector(Consumer<String> outputFn, boolean showTimestamps) {
        this(outputFn, showTimestamps, Clock.systemUTC());
    }

    public OutputProjector(Consumer<String> outputFn, boolean showTimestamps, Clock clock) {
        this.renderer = new TextRenderer();
        this.outputFn = outputFn;
        this.showTimestamps = showTimestamps;
        this.clock = clock;
        this.timeFormatter = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);
    }

    @Override
    public void onHandStarted(TableSnapshot view) {
        emit(renderer.renderHandStarted(view));
        for (ActionRecord blind : view.history()) {
            emit(renderer.renderAction(blind));
        }
    }

    @Override
    public void onAction(ActionRecord action, TableSnapshot view) {
        emit(renderer.renderAction(action));
    }

    @Override
    public void onCommunityCards(Street street, List<Card> cards, TableSnapshot view) {
        emit(renderer.renderCommunityCards(street, cards));
    }

    @Override
    public void onHandComplete(HandResult result, TableSnapshot view) {
        emit(renderer.renderResult(result));
    }

    @Override
    public void onHandAborted(long handNumber, Throwable cause) {
        emit(String.format("Hand #%d aborted, stacks restored: %s", handNumber, cause.getMessage()));
    }

    private void emit(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        if (showTimestamps) {
            text = "[" + timeFormatter.format(clock.instant()) + "] " + text;
        }
        outputFn.accept(text);
    }

    /**
     * Create a file-based projector that appends to {@code path}.
     */
    public static OutputProjector forFile(String path, boolean showTimestamps) throws IOException {
        PrintWriter writer = new PrintWriter(new FileWriter(path, StandardCharsets.UTF_8, true));
        return new OutputProjector(line -> {
            writer.println(line);
            writer.flush();
        }, showTimestamps);
    }
}
