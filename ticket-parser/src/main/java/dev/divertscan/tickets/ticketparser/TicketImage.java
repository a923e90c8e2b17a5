package dev.divertscan.tickets.ticketparser;

/**
 * Raw ticket photo handed to the pipeline.
 *
 * @param data     image bytes
 * @param mimeType image MIME type such as {@code image/jpeg}
 */
public record TicketImage(byte[] data, String mimeType) {

    public static final String DEFAULT_MIME_TYPE = "image/jpeg";

    public TicketImage {
        mimeType = mimeType != null && !mimeType.isBlank() ? mimeType : DEFAULT_MIME_TYPE;
    }
}
