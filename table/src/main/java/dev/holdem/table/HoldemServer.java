package dev.holdem.table;

import dev.holdem.hand.Errors;
import dev.holdem.handflow.TableConfig;
import dev.holdem.prjoutput.OutputProjector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Console entry point: seats the players named on stdin and plays until one
 * of them holds every chip.
 */
public class HoldemServer {
    private static final Logger logger = LoggerFactory.getLogger(HoldemServer.class);
    static final int CLI_MIN_PLAYERS = 2;
    static final int CLI_MAX_PLAYERS = 9;

    private final TableConfig config;
    private final BufferedReader in;
    private final PrintStream out;

    public HoldemServer(TableConfig config, BufferedReader in, PrintStream out) {
        this.config = config.withSeatBounds(CLI_MIN_PLAYERS, CLI_MAX_PLAYERS);
        this.in = in;
        this.out = out;
    }

    /**
     * Runs one session.
     *
     * @return 0 when the session finished with a winner, 1 when input ended first
     */
    public int run() throws IOException {
        Integer count = readPlayerCount();
        if (count == null) {
            return 1;
        }
        List<String> names = readNames(count);
        if (names == null) {
            return 1;
        }

        TableSession session = new TableSession(config, names);
        session.addObserver(new OutputProjector(out::println, false));
        ConsoleActionSource source = new ConsoleActionSource(in, out);
        logger.info("session_started", kv("players", count));

        session.run(source, 0);
        return session.getWinner().map(winner -> {
            out.println(winner.getName() + " wins the game with " + winner.getStack() + " chips");
            return 0;
        }).orElseGet(() -> {
            out.println("Game stopped after " + session.getResults().size() + " hand(s)");
            return 1;
        });
    }

    private Integer readPlayerCount() throws IOException {
        while (true) {
            out.printf("Enter the number of players (%d-%d): ", CLI_MIN_PLAYERS, CLI_MAX_PLAYERS);
            out.flush();
            String line = in.readLine();
            if (line == null) {
                return null;
            }
            try {
                int count = Integer.parseInt(line.trim());
                if (count >= CLI_MIN_PLAYERS && count <= CLI_MAX_PLAYERS) {
                    return count;
                }
            } catch (NumberFormatException e) {
                logger.debug("Invalid player count '{}'", line);
            }
            out.println("Please enter a number from " + CLI_MIN_PLAYERS + " to " + CLI_MAX_PLAYERS);
        }
    }

    private List<String> readNames(int count) throws IOException {
        List<String> names = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            out.printf("Name for player %d [Player %d]: ", i, i);
            out.flush();
            String line = in.readLine();
            if (line == null) {
                return null;
            }
            names.add(line.isBlank() ? "Player " + i : line.trim());
        }
        return names;
    }

    public static void main(String[] args) throws IOException {
        TableConfig config = TableConfig.fromEnvironment(System.getenv());
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        HoldemServer server = new HoldemServer(config, in, System.out);
        int status;
        try {
            status = server.run();
        } catch (Errors.HoldemError e) {
            logger.error("Session failed", e);
            status = 2;
        }
        System.exit(status);
    }
}
