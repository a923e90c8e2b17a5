package dev.divertscan.tickets.ticketparser.provider;

/**
 * Signals a failed call to a vision model: transport error, non-success status, or a response body
 * that does not have the expected shape.
 */
public class VisionProviderException extends RuntimeException {

    public VisionProviderException(String message) {
        super(message);
    }

    public VisionProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
