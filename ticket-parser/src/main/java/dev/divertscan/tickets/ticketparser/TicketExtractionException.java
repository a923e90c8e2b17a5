package dev.divertscan.tickets.ticketparser;

/**
 * Terminal failure of a single-ticket extraction, raised once every attempt has failed or when no
 * vision provider can be used. The cause is the last underlying error.
 */
public class TicketExtractionException extends RuntimeException {

    private final int attempts;

    public TicketExtractionException(String message) {
        this(message, null, 0);
    }

    public TicketExtractionException(String message, Throwable cause) {
        this(message, cause, 0);
    }

    public TicketExtractionException(String message, Throwable cause, int attempts) {
        super(message, cause);
        this.attempts = attempts;
    }

    /**
     * @return number of extraction attempts made before giving up
     */
    public int getAttempts() {
        return attempts;
    }
}
