package com.knowledge.curation.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;

/**
 * Drives a {@link ReviewSession} from a line-oriented console.
 * End of input is treated like {@code quit}.
 */
public class ConsoleReviewRunner {
    private static final Logger log = LoggerFactory.getLogger(ConsoleReviewRunner.class);

    private final BufferedReader in;
    private final PrintWriter out;

    public ConsoleReviewRunner(BufferedReader in, PrintWriter out) {
        this.in = in;
        this.out = out;
    }

    /**
     * Runs until the queue is exhausted or the reviewer quits.
     *
     * @return the final session state
     */
    public ReviewState run(ReviewSession session) {
        out.println("Session " + session.getSessionId() + ". Type 'help' for commands.");
        String lastEntryId = null;
        while (session.currentEntry().isPresent()) {
            String entryId = session.currentEntry().get().id();
            if (!entryId.equals(lastEntryId)) {
                out.println();
                out.println(session.renderCurrent());
                lastEntryId = entryId;
            }
            out.print("> ");
            out.flush();

            String line = readLine();
            ReviewOutcome outcome = line == null
                    ? session.handle(ReviewCommand.of(ReviewCommand.Type.QUIT))
                    : session.handle(line);
            out.println(outcome.success() ? outcome.message() : "error: " + outcome.message());
            if (outcome.state() == ReviewState.SUSPENDED) {
                out.flush();
                return outcome.state();
            }
            if (outcome.record() != null && entryId.equals(currentId(session))) {
                // still on the same entry after update/reject: show the new content
                out.println(session.renderCurrent());
            }
        }
        out.println("Queue complete.");
        out.flush();
        return session.getState();
    }

    private static String currentId(ReviewSession session) {
        return session.currentEntry().map(e -> e.id()).orElse(null);
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            log.error("review.input-failed error={}", e.getMessage());
            throw new UncheckedIOException("Could not read reviewer input", e);
        }
    }
}
