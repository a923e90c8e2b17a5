package dev.divertscan.tickets.ticketparser.extraction;

import dev.divertscan.tickets.model.TicketField;
import dev.divertscan.tickets.model.TicketSource;
import dev.divertscan.tickets.ticketparser.provider.VisionProvider;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extractor for printed thermal scale tickets. Printed text is trusted more than handwriting, and
 * a weight that fails to parse is a stronger signal that something was misread.
 */
public class ThermalTicketExtractor extends AbstractTicketExtractor {

    static final double BASE = 0.88;
    static final double NUMERIC_WEIGHT = 0.95;
    static final double NON_NUMERIC_WEIGHT = 0.60;

    private static final Map<TicketField, String> FIELD_HINTS = fieldHintTable();

    public ThermalTicketExtractor(VisionProvider provider) {
        super(provider);
    }

    @Override
    public TicketSource source() {
        return TicketSource.THERMAL_PRINTOUT;
    }

    @Override
    protected Map<TicketField, String> fieldHints() {
        return FIELD_HINTS;
    }

    @Override
    protected String layoutIntroduction() {
        return """
            Analyze this scale ticket (thermal printout). These tickets have a standard format
            with printed (not handwritten) text.
            """;
    }

    @Override
    protected String readingRules() {
        return """
            - Thermal prints may have faded sections - extract what's visible
            - Look for the standard layout: header, weights section, footer
            - Weight units are typically shown next to weight values
            - Include ONLY extracted values, use null for fields not found
            """;
    }

    @Override
    protected double score(TicketField field, Object rawValue) {
        if (!field.isWeight()) {
            return BASE;
        }
        return WeightValues.isNumeric(rawValue) ? NUMERIC_WEIGHT : NON_NUMERIC_WEIGHT;
    }

    private static Map<TicketField, String> fieldHintTable() {
        Map<TicketField, String> hints = new LinkedHashMap<>();
        hints.put(TicketField.TICKET_NUMBER, "the ticket/scale ticket number");
        hints.put(TicketField.GROSS_WEIGHT, "gross/in weight as a number only");
        hints.put(TicketField.TARE_WEIGHT, "tare/out weight as a number only");
        hints.put(TicketField.NET_WEIGHT, "net weight as a number only");
        hints.put(TicketField.WEIGHT_UNIT, "lbs, tons, or kg (usually lbs or tons)");
        hints.put(TicketField.DATE, "date in MM/DD/YYYY format");
        hints.put(TicketField.TIME_IN, "time in in HH:MM format");
        hints.put(TicketField.TIME_OUT, "time out in HH:MM format");
        hints.put(TicketField.TRUCK_ID, "truck ID or vehicle number");
        hints.put(TicketField.LICENSE_PLATE, "tag/license plate");
        hints.put(TicketField.DRIVER_NAME, "driver name");
        hints.put(TicketField.HAULER_COMPANY, "carrier/hauler company");
        hints.put(TicketField.MATERIAL_TYPE, "product/material type code or name");
        hints.put(TicketField.MATERIAL_DESCRIPTION, "material description");
        hints.put(TicketField.DESTINATION, "destination (landfill, recycling, etc)");
        hints.put(TicketField.FACILITY_NAME, "facility or location name");
        hints.put(TicketField.FACILITY_ADDRESS, "facility address printed in the header");
        hints.put(TicketField.PROJECT_NAME, "project or job site name");
        hints.put(TicketField.CUSTOMER_NAME, "customer/account name");
        hints.put(TicketField.JOB_NUMBER, "job number or ticket reference");
        hints.put(TicketField.PO_NUMBER, "PO number if present");
        return Collections.unmodifiableMap(hints);
    }
}
