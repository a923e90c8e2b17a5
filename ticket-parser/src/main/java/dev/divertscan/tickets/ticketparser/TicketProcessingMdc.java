package dev.divertscan.tickets.ticketparser;

import dev.divertscan.tickets.model.TicketSource;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Utility for populating mapped diagnostic context (MDC) entries so log lines emitted while a
 * ticket is processed share the same identifiers (request, source, attempt, batch index).
 */
final class TicketProcessingMdc {

    static final String KEY_REQUEST_ID = "ticket.requestId";
    static final String KEY_SOURCE = "ticket.source";
    static final String KEY_ATTEMPT = "ticket.attempt";
    static final String KEY_BATCH_INDEX = "ticket.batchIndex";

    private TicketProcessingMdc() {
        // Utility class
    }

    static Context open(String requestId) {
        return new Context(requestId);
    }

    static void setSource(TicketSource source) {
        putIfHasText(KEY_SOURCE, source != null ? source.code() : null);
    }

    static void setAttempt(int attempt) {
        MDC.put(KEY_ATTEMPT, Integer.toString(attempt));
    }

    static void setBatchIndex(int index) {
        MDC.put(KEY_BATCH_INDEX, Integer.toString(index));
    }

    /**
     * Wraps {@code task} so it runs with the MDC of the calling thread and leaves the worker's
     * context as it found it.
     */
    static <T> Supplier<T> propagate(Supplier<T> task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            } else {
                MDC.clear();
            }
            try {
                return task.get();
            } finally {
                restore(previous);
            }
        };
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void restore(Map<String, String> previous) {
        if (previous == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String requestId) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_REQUEST_ID, requestId);
        }

        @Override
        public void close() {
            restore(previous);
        }
    }
}
