package dev.divertscan.tickets.ticketparser.extraction;

import dev.divertscan.tickets.model.TicketExtractionResult;
import dev.divertscan.tickets.model.TicketField;
import dev.divertscan.tickets.model.TicketSource;
import dev.divertscan.tickets.ticketparser.provider.VisionProvider;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extractor for tickets filled in by hand, typically in red ink. Handwriting is read less reliably
 * than print, so base scores are lower and weights that do not parse as numbers are penalised.
 */
public class HandwrittenTicketExtractor extends AbstractTicketExtractor {

    static final double WEIGHT_BASE = 0.70;
    static final double OTHER_BASE = 0.80;
    static final double NUMERIC_BONUS = 0.15;
    static final double NON_NUMERIC_PENALTY = 0.20;

    private static final String CONFIDENCE_NOTES_KEY = "confidence_notes";

    private static final Map<TicketField, String> FIELD_HINTS = fieldHintTable();

    public HandwrittenTicketExtractor(VisionProvider provider) {
        super(provider);
    }

    @Override
    public TicketSource source() {
        return TicketSource.HANDWRITTEN_RED_INK;
    }

    @Override
    protected Map<TicketField, String> fieldHints() {
        return FIELD_HINTS;
    }

    @Override
    protected Map<String, String> additionalKeys() {
        return Map.of(CONFIDENCE_NOTES_KEY, "any areas of uncertainty in reading handwritten text");
    }

    @Override
    protected String layoutIntroduction() {
        return """
            Analyze this scale ticket image. This ticket likely has HANDWRITTEN entries in RED INK.
            Pay special attention to handwritten numbers and text.
            """;
    }

    @Override
    protected String readingRules() {
        return """
            - For handwritten numbers, be careful to distinguish 1/7, 4/9, 5/6, 0/6/8
            - Red ink may appear faded - look carefully
            - Include ONLY extracted values, use null for fields not found
            - For weights, extract numbers only without units
            """;
    }

    @Override
    protected double score(TicketField field, Object rawValue) {
        if (!field.isWeight()) {
            return OTHER_BASE;
        }
        return WeightValues.isNumeric(rawValue)
            ? WEIGHT_BASE + NUMERIC_BONUS
            : WEIGHT_BASE - NON_NUMERIC_PENALTY;
    }

    @Override
    protected void addLayoutNotes(Map<String, Object> answer, TicketExtractionResult.Builder builder) {
        Object notes = answer.get(CONFIDENCE_NOTES_KEY);
        if (notes != null && !String.valueOf(notes).isBlank()) {
            builder.note("Handwriting notes: " + String.valueOf(notes).trim());
        }
    }

    private static Map<TicketField, String> fieldHintTable() {
        Map<TicketField, String> hints = new LinkedHashMap<>();
        hints.put(TicketField.TICKET_NUMBER, "the ticket/receipt number");
        hints.put(TicketField.GROSS_WEIGHT, "gross weight as a number only");
        hints.put(TicketField.TARE_WEIGHT, "tare weight as a number only");
        hints.put(TicketField.NET_WEIGHT, "net weight as a number only");
        hints.put(TicketField.WEIGHT_UNIT, "lbs, tons, or kg");
        hints.put(TicketField.DATE, "date in MM/DD/YYYY format");
        hints.put(TicketField.TIME_IN, "time in HH:MM format");
        hints.put(TicketField.TIME_OUT, "time out in HH:MM format");
        hints.put(TicketField.TRUCK_ID, "truck number or fleet ID");
        hints.put(TicketField.LICENSE_PLATE, "license plate number");
        hints.put(TicketField.DRIVER_NAME, "driver's name");
        hints.put(TicketField.HAULER_COMPANY, "hauling company name");
        hints.put(TicketField.MATERIAL_TYPE, "type of material (concrete, wood, metal, mixed, etc)");
        hints.put(TicketField.MATERIAL_DESCRIPTION, "detailed description if available");
        hints.put(TicketField.FACILITY_NAME, "scale facility name");
        hints.put(TicketField.FACILITY_ADDRESS, "facility address if written or stamped");
        hints.put(TicketField.PROJECT_NAME, "project or job site name");
        hints.put(TicketField.CUSTOMER_NAME, "customer name");
        hints.put(TicketField.JOB_NUMBER, "job or PO number");
        return Collections.unmodifiableMap(hints);
    }
}
