package dev.divertscan.tickets.ticketparser.extraction;

import dev.divertscan.tickets.model.TicketField;
import dev.divertscan.tickets.model.TicketSource;
import dev.divertscan.tickets.ticketparser.provider.VisionProvider;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extractor for standard digital scale tickets. Every populated field gets the same score.
 */
public class GenericTicketExtractor extends AbstractTicketExtractor {

    static final double FLAT_CONFIDENCE = 0.85;

    private static final Map<TicketField, String> FIELD_HINTS = fieldHintTable();

    public GenericTicketExtractor(VisionProvider provider) {
        super(provider);
    }

    @Override
    public TicketSource source() {
        return TicketSource.GENERIC_DIGITAL;
    }

    @Override
    protected Map<TicketField, String> fieldHints() {
        return FIELD_HINTS;
    }

    @Override
    protected String layoutIntroduction() {
        return "Analyze this scale ticket image and extract all relevant information.";
    }

    @Override
    protected String readingRules() {
        return "- Use null for missing fields";
    }

    @Override
    protected double score(TicketField field, Object rawValue) {
        return FLAT_CONFIDENCE;
    }

    private static Map<TicketField, String> fieldHintTable() {
        Map<TicketField, String> hints = new LinkedHashMap<>();
        hints.put(TicketField.TICKET_NUMBER, "ticket/receipt number");
        hints.put(TicketField.GROSS_WEIGHT, "gross weight (number only)");
        hints.put(TicketField.TARE_WEIGHT, "tare weight (number only)");
        hints.put(TicketField.NET_WEIGHT, "net weight (number only)");
        hints.put(TicketField.WEIGHT_UNIT, "lbs, tons, or kg");
        hints.put(TicketField.DATE, "date (MM/DD/YYYY)");
        hints.put(TicketField.TIME_IN, "time in (HH:MM)");
        hints.put(TicketField.TIME_OUT, "time out (HH:MM)");
        hints.put(TicketField.TRUCK_ID, "truck/vehicle ID");
        hints.put(TicketField.LICENSE_PLATE, "license plate");
        hints.put(TicketField.DRIVER_NAME, "driver name");
        hints.put(TicketField.HAULER_COMPANY, "hauling company");
        hints.put(TicketField.MATERIAL_TYPE, "material type");
        hints.put(TicketField.MATERIAL_DESCRIPTION, "material description");
        hints.put(TicketField.DESTINATION, "destination type");
        hints.put(TicketField.FACILITY_NAME, "facility name");
        hints.put(TicketField.FACILITY_ADDRESS, "facility address");
        hints.put(TicketField.PROJECT_NAME, "project name");
        hints.put(TicketField.CUSTOMER_NAME, "customer name");
        hints.put(TicketField.JOB_NUMBER, "job number");
        hints.put(TicketField.PO_NUMBER, "PO number");
        return Collections.unmodifiableMap(hints);
    }
}
