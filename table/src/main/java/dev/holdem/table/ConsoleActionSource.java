package dev.holdem.table;

import dev.holdem.hand.Errors;
import dev.holdem.hand.betting.ActionRequest;
import dev.holdem.hand.betting.ActionType;
import dev.holdem.hand.betting.PlayerAction;
import dev.holdem.handflow.ActionSource;
import dev.holdem.handflow.PlayerView;
import dev.holdem.handflow.TableSnapshot;
import dev.holdem.prjoutput.TextRenderer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads actions typed at the console.
 *
 * <p>Commands: {@code check}, {@code call}, {@code fold}, {@code raise <to>},
 * {@code bet <to>} and {@code allin}. Amounts are raise-to totals. Input that
 * does not parse is reported and asked for again.
 */
public class ConsoleActionSource implements ActionSource {

    private final BufferedReader in;
    private final PrintStream out;
    private final TextRenderer renderer;
    private boolean closed;

    public ConsoleActionSource(BufferedReader in, PrintStream out) {
        this(in, out, new TextRenderer());
    }

    public ConsoleActionSource(BufferedReader in, PrintStream out, TextRenderer renderer) {
        this.in = in;
        this.out = out;
        this.renderer = renderer;
    }

    @Override
    public PlayerAction nextAction(ActionRequest request, TableSnapshot view) {
        out.println(renderer.renderBoard(view));
        String name = view.player(request.seat()).map(PlayerView::name).orElse("Seat " + request.seat());
        while (true) {
            out.print(prompt(name, request));
            out.flush();
            String line = readLine();
            try {
                return parse(line, request);
            } catch (IllegalArgumentException e) {
                out.println(e.getMessage());
            }
        }
    }

    @Override
    public void onIllegalAction(ActionRequest request, Errors.IllegalActionError error) {
        out.println("Illegal action: " + error.getMessage());
        if (error instanceof Errors.InsufficientStackError) {
            Errors.InsufficientStackError shortStack = (Errors.InsufficientStackError) error;
            out.println("You can go all-in for " + shortStack.getAvailableStack());
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    private String readLine() {
        String line;
        try {
            line = in.readLine();
        } catch (IOException e) {
            closed = true;
            throw new Errors.ActionAbortedError("Could not read console input", e);
        }
        if (line == null) {
            closed = true;
            throw new Errors.ActionAbortedError("Console input closed");
        }
        return line;
    }

    static String prompt(String name, ActionRequest request) {
        List<String> options = new ArrayList<>();
        for (ActionType type : ActionType.values()) {
            if (!request.legalActions().contains(type)) {
                continue;
            }
            switch (type) {
                case FOLD:
                    options.add("fold");
                    break;
                case CHECK:
                    options.add("check");
                    break;
                case CALL:
                    options.add("call " + request.toCall());
                    break;
                case RAISE:
                    String verb = request.betToCall() == 0 ? "bet" : "raise";
                    options.add(verb + " <" + request.minRaiseTo() + "-" + request.maxRaiseTo() + ">");
                    break;
                case ALL_IN:
                    options.add("allin");
                    break;
                default:
                    break;
            }
        }
        return String.format("%s (stack %d) [%s]: ", name, request.stack(), String.join(", ", options));
    }

    /**
     * Turns one line of input into an action.
     *
     * @throws IllegalArgumentException if the line is not a command
     */
    static PlayerAction parse(String line, ActionRequest request) {
        String[] words = line.trim().toLowerCase(Locale.ROOT).split("\\s+");
        switch (words[0]) {
            case "f":
            case "fold":
                return PlayerAction.fold();
            case "x":
            case "k":
            case "check":
                return PlayerAction.check();
            case "c":
            case "call":
                return PlayerAction.call();
            case "a":
            case "allin":
            case "all-in":
                return PlayerAction.allIn();
            case "all":
                if (words.length == 2 && words[1].equals("in")) {
                    return PlayerAction.allIn();
                }
                break;
            case "b":
            case "bet":
            case "r":
            case "raise":
                if (words.length != 2) {
                    throw new IllegalArgumentException("Say how much to " + words[0] + " to, e.g. '"
                        + words[0] + " " + Math.max(request.minRaiseTo(), request.betToCall()) + "'");
                }
                try {
                    return PlayerAction.raiseTo(Long.parseLong(words[1]));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Not an amount: '" + words[1] + "'", e);
                }
            default:
                break;
        }
        throw new IllegalArgumentException("Unknown command '" + line.trim()
            + "', use check, call, fold, raise <to>, bet <to> or allin");
    }
}
