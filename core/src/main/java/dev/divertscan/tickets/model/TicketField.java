package dev.divertscan.tickets.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Named fields of a scale ticket. The wire name is the JSON key requested from the vision model
 * and used when the result is rendered.
 */
public enum TicketField {

    TICKET_NUMBER("ticket_number", false),
    GROSS_WEIGHT("gross_weight", true),
    TARE_WEIGHT("tare_weight", true),
    NET_WEIGHT("net_weight", true),
    WEIGHT_UNIT("weight_unit", false),
    DATE("date", false),
    TIME_IN("time_in", false),
    TIME_OUT("time_out", false),
    TRUCK_ID("truck_id", false),
    LICENSE_PLATE("license_plate", false),
    DRIVER_NAME("driver_name", false),
    HAULER_COMPANY("hauler_company", false),
    MATERIAL_TYPE("material_type", false),
    MATERIAL_DESCRIPTION("material_description", false),
    DESTINATION("destination", false),
    FACILITY_NAME("facility_name", false),
    FACILITY_ADDRESS("facility_address", false),
    PROJECT_NAME("project_name", false),
    CUSTOMER_NAME("customer_name", false),
    JOB_NUMBER("job_number", false),
    PO_NUMBER("po_number", false);

    private final String wireName;
    private final boolean weight;

    TicketField(String wireName, boolean weight) {
        this.wireName = wireName;
        this.weight = weight;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return {@code true} for gross, tare and net weight
     */
    public boolean isWeight() {
        return weight;
    }

    public static Optional<TicketField> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        String normalised = wireName.trim().toLowerCase(Locale.ROOT);
        for (TicketField field : values()) {
            if (field.wireName.equals(normalised)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
