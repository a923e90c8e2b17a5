package dev.divertscan.tickets.model;

import java.util.List;

/**
 * A single value read from a ticket together with the heuristic confidence assigned to it.
 *
 * @param value       cleaned value, a {@link String} or {@link Double}; {@code null} when the model
 *                    reported the field without a usable value
 * @param confidence  score in the range [0, 1]
 * @param rawText     the value exactly as the model returned it
 * @param boundingBox optional pixel box of the value on the image; may be {@code null}
 */
public record ExtractedField(Object value, double confidence, String rawText, List<Integer> boundingBox) {

    public static final double CONFIDENT_THRESHOLD = 0.75;

    public ExtractedField {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must lie in [0, 1] but was " + confidence);
        }
        boundingBox = boundingBox != null ? List.copyOf(boundingBox) : null;
    }

    public ExtractedField(Object value, double confidence, String rawText) {
        this(value, confidence, rawText, null);
    }

    public boolean isConfident() {
        return confidence >= CONFIDENT_THRESHOLD;
    }

    public String textValue() {
        return value != null ? value.toString() : null;
    }

    /**
     * @return the value as a number, or {@code null} when the value is not numeric
     */
    public Double numericValue() {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value.toString().trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
