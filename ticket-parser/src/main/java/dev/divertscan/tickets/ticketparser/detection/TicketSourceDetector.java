package dev.divertscan.tickets.ticketparser.detection;

import dev.divertscan.tickets.model.TicketSource;
import dev.divertscan.tickets.ticketparser.provider.VisionProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the vision model which layout a ticket uses. Detection only picks the extraction prompt, so
 * any failure degrades to a generic guess instead of failing the extraction.
 */
public class TicketSourceDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(TicketSourceDetector.class);

    static final String DETECTION_PROMPT = """
        Analyze this scale ticket image and determine its source type.

        Possible types:
        1. "handwritten" - ticket filled in by hand, typically with entries in red ink
        2. "thermal" - thermal printer output with a standard printed layout
        3. "generic" - any other digital or printed scale ticket

        Return a JSON object:
        {
            "source_type": "handwritten" or "thermal" or "generic",
            "confidence": 0.0 to 1.0,
            "indicators": ["list of visual indicators that led to this classification"]
        }

        Return ONLY the JSON object.
        """;

    private static final Map<String, TicketSource> SOURCE_TYPES = Map.of(
        "handwritten", TicketSource.HANDWRITTEN_RED_INK,
        "thermal", TicketSource.THERMAL_PRINTOUT,
        "generic", TicketSource.GENERIC_DIGITAL);

    private final VisionProvider provider;

    public TicketSourceDetector(VisionProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public SourceDetection detect(byte[] image, String mimeType) {
        Map<String, Object> answer;
        try {
            answer = provider.extractStructured(image, mimeType, DETECTION_PROMPT);
        } catch (RuntimeException ex) {
            LOGGER.warn("Ticket source detection failed, assuming a generic ticket: {}", ex.getMessage());
            return SourceDetection.fallback("detection call failed: " + ex.getMessage());
        }
        SourceDetection detection = interpret(answer);
        if (detection.isFallback()) {
            LOGGER.warn("Ticket source detection degraded to generic: {}", detection.fallbackReason());
        } else {
            LOGGER.info("Detected ticket source {} with confidence {}", detection.source().code(),
                detection.confidence());
        }
        return detection;
    }

    static SourceDetection interpret(Map<String, Object> answer) {
        if (answer == null) {
            return SourceDetection.fallback("detection answer was empty");
        }
        Object rawType = answer.get("source_type");
        if (rawType == null) {
            return SourceDetection.fallback("detection answer had no source_type");
        }
        TicketSource source = resolveSource(String.valueOf(rawType));
        if (source == null) {
            return SourceDetection.fallback("unexpected source_type '" + rawType + "'");
        }
        Double confidence = parseConfidence(answer.get("confidence"));
        if (confidence == null) {
            return SourceDetection.fallback("confidence '" + answer.get("confidence") + "' is not a number");
        }
        return SourceDetection.detected(source, confidence, indicators(answer.get("indicators")));
    }

    private static TicketSource resolveSource(String rawType) {
        String normalised = rawType.trim().toLowerCase(Locale.ROOT);
        TicketSource source = SOURCE_TYPES.get(normalised);
        if (source != null) {
            return source;
        }
        return TicketSource.fromCode(normalised)
            .filter(TicketSource::isAutomatic)
            .orElse(null);
    }

    private static Double parseConfidence(Object raw) {
        if (raw == null) {
            return SourceDetection.FALLBACK_CONFIDENCE;
        }
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else {
            try {
                value = Double.parseDouble(String.valueOf(raw).trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        if (Double.isNaN(value)) {
            return null;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static List<String> indicators(Object raw) {
        List<String> indicators = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    indicators.add(String.valueOf(item));
                }
            }
        }
        return indicators;
    }
}
