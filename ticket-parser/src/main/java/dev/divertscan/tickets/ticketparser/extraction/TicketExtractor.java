package dev.divertscan.tickets.ticketparser.extraction;

import dev.divertscan.tickets.model.TicketExtractionResult;
import dev.divertscan.tickets.model.TicketSource;

/**
 * Extracts ticket fields from an image for one ticket layout.
 */
public interface TicketExtractor {

    /**
     * @return the layout this extractor handles
     */
    TicketSource source();

    /**
     * Reads the ticket. Each call builds a new result.
     *
     * @throws dev.divertscan.tickets.ticketparser.provider.VisionProviderException when a model call fails
     */
    TicketExtractionResult extract(byte[] image, String mimeType);
}
