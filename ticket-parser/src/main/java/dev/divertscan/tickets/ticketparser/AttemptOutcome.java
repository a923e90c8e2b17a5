package dev.divertscan.tickets.ticketparser;

import dev.divertscan.tickets.model.TicketExtractionResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of one step of the extraction retry loop.
 */
sealed interface AttemptOutcome {

    /**
     * The loop ends with a result for the caller.
     */
    record Done(TicketExtractionResult result) implements AttemptOutcome { }

    /**
     * The loop continues with {@code next} after waiting {@code backoff}.
     */
    record Retry(RetryState next, Duration backoff) implements AttemptOutcome { }

    /**
     * The loop ends with an error for the caller.
     */
    record Failed(TicketExtractionException error) implements AttemptOutcome { }

    /**
     * State carried between attempts: the 1-based number of the next attempt, notes collected so
     * far and the last error seen.
     */
    record RetryState(int attempt, List<String> notes, RuntimeException lastError) {

        public RetryState {
            notes = List.copyOf(notes);
        }

        static RetryState initial(List<String> notes) {
            return new RetryState(1, notes, null);
        }

        RetryState next(String note, RuntimeException error) {
            List<String> nextNotes = new ArrayList<>(notes);
            nextNotes.add(note);
            return new RetryState(attempt + 1, nextNotes, error != null ? error : lastError);
        }
    }
}
