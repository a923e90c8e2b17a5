package dev.divertscan.tickets.ticketparser.extraction;

import dev.divertscan.tickets.model.TicketSource;
import dev.divertscan.tickets.ticketparser.provider.VisionProvider;

/**
 * Binds each automatic ticket source to its extractor.
 */
public final class TicketExtractors {

    private TicketExtractors() {
        // Utility class
    }

    /**
     * @throws IllegalArgumentException for sources that are not extracted automatically
     */
    public static TicketExtractor create(TicketSource source, VisionProvider provider) {
        switch (source) {
            case HANDWRITTEN_RED_INK:
                return new HandwrittenTicketExtractor(provider);
            case THERMAL_PRINTOUT:
                return new ThermalTicketExtractor(provider);
            case GENERIC_DIGITAL:
                return new GenericTicketExtractor(provider);
            default:
                throw new IllegalArgumentException("Tickets from source '" + source.code()
                    + "' are not extracted automatically");
        }
    }
}
