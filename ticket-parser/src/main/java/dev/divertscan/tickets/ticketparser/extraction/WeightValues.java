package dev.divertscan.tickets.ticketparser.extraction;

import java.util.regex.Pattern;

/**
 * Parsing rules for weight values returned by the vision model.
 */
public final class WeightValues {

    private static final Pattern NON_NUMERIC = Pattern.compile("[^\\d.]");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private WeightValues() {
        // Utility class
    }

    /**
     * @return {@code true} when the model returned a number, or text that parses as one as-is
     */
    public static boolean isNumeric(Object raw) {
        if (raw instanceof Number number) {
            return Double.isFinite(number.doubleValue());
        }
        if (!(raw instanceof String text)) {
            return false;
        }
        String trimmed = text.trim();
        return DECIMAL.matcher(trimmed).matches() && Double.isFinite(Double.parseDouble(trimmed));
    }

    /**
     * Strips everything except digits and decimal points and parses the rest. Returns {@code null}
     * when nothing numeric is left, so an unreadable weight is absent rather than zero.
     */
    public static Double clean(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            return Double.isFinite(value) ? value : null;
        }
        String cleaned = NON_NUMERIC.matcher(String.valueOf(raw)).replaceAll("");
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(cleaned);
        } catch (NumberFormatException ex) {
            // e.g. "1.2.3" keeps several decimal points
            return null;
        }
    }
}
