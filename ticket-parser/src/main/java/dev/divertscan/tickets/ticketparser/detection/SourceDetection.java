package dev.divertscan.tickets.ticketparser.detection;

import dev.divertscan.tickets.model.TicketSource;
import java.util.List;

/**
 * Layout guess for a ticket image. A detection that could not be completed degrades to a generic
 * guess and carries the reason in {@code fallbackReason}.
 *
 * @param source         detected layout, always an automatic source
 * @param confidence     model-reported confidence in [0, 1]
 * @param indicators     visual cues the model reported
 * @param fallbackReason why detection degraded, or {@code null} when the model answered normally
 */
public record SourceDetection(TicketSource source, double confidence, List<String> indicators,
    String fallbackReason) {

    public static final double FALLBACK_CONFIDENCE = 0.5;

    public SourceDetection {
        indicators = indicators != null ? List.copyOf(indicators) : List.of();
    }

    public static SourceDetection detected(TicketSource source, double confidence, List<String> indicators) {
        return new SourceDetection(source, confidence, indicators, null);
    }

    public static SourceDetection fallback(String reason) {
        return new SourceDetection(TicketSource.GENERIC_DIGITAL, FALLBACK_CONFIDENCE, List.of(), reason);
    }

    public boolean isFallback() {
        return fallbackReason != null;
    }
}
