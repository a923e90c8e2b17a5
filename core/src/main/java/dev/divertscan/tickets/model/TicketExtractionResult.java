package dev.divertscan.tickets.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalised data read from one scale ticket image. Every named field is optional; the overall
 * confidence is derived from the fields that were populated and cannot be set directly.
 *
 * <p>Instances are immutable. Methods such as {@link #withAdditionalNotes(List)} return copies.
 */
public final class TicketExtractionResult {

    private final Map<TicketField, ExtractedField> fields;
    private final TicketSource source;
    private final String rawText;
    private final List<String> processingNotes;
    private final double overallConfidence;

    private TicketExtractionResult(Builder builder) {
        EnumMap<TicketField, ExtractedField> copy = new EnumMap<>(TicketField.class);
        copy.putAll(builder.fields);
        this.fields = Collections.unmodifiableMap(copy);
        this.source = builder.source;
        this.rawText = builder.rawText != null ? builder.rawText : "";
        this.processingNotes = List.copyOf(builder.processingNotes);
        this.overallConfidence = meanConfidence(copy);
    }

    public static Builder builder(TicketSource source) {
        return new Builder(source);
    }

    /**
     * Result carrying no data, used when an image could not be processed at all.
     */
    public static TicketExtractionResult failed(String note) {
        return builder(TicketSource.GENERIC_DIGITAL).note(note).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder(source).rawText(rawText);
        builder.fields.putAll(fields);
        builder.processingNotes.addAll(processingNotes);
        return builder;
    }

    /**
     * Returns a copy whose notes are {@code leadingNotes} followed by this result's own notes.
     */
    public TicketExtractionResult withLeadingNotes(List<String> leadingNotes) {
        if (leadingNotes == null || leadingNotes.isEmpty()) {
            return this;
        }
        Builder builder = new Builder(source).rawText(rawText);
        builder.fields.putAll(fields);
        builder.processingNotes.addAll(leadingNotes);
        builder.processingNotes.addAll(processingNotes);
        return builder.build();
    }

    public TicketExtractionResult withAdditionalNotes(List<String> notes) {
        if (notes == null || notes.isEmpty()) {
            return this;
        }
        Builder builder = toBuilder();
        notes.forEach(builder::note);
        return builder.build();
    }

    public ExtractedField ticketNumber() {
        return fields.get(TicketField.TICKET_NUMBER);
    }

    public ExtractedField grossWeight() {
        return fields.get(TicketField.GROSS_WEIGHT);
    }

    public ExtractedField tareWeight() {
        return fields.get(TicketField.TARE_WEIGHT);
    }

    public ExtractedField netWeight() {
        return fields.get(TicketField.NET_WEIGHT);
    }

    public ExtractedField weightUnit() {
        return fields.get(TicketField.WEIGHT_UNIT);
    }

    public ExtractedField date() {
        return fields.get(TicketField.DATE);
    }

    public ExtractedField timeIn() {
        return fields.get(TicketField.TIME_IN);
    }

    public ExtractedField timeOut() {
        return fields.get(TicketField.TIME_OUT);
    }

    public ExtractedField truckId() {
        return fields.get(TicketField.TRUCK_ID);
    }

    public ExtractedField licensePlate() {
        return fields.get(TicketField.LICENSE_PLATE);
    }

    public ExtractedField driverName() {
        return fields.get(TicketField.DRIVER_NAME);
    }

    public ExtractedField haulerCompany() {
        return fields.get(TicketField.HAULER_COMPANY);
    }

    public ExtractedField materialType() {
        return fields.get(TicketField.MATERIAL_TYPE);
    }

    public ExtractedField materialDescription() {
        return fields.get(TicketField.MATERIAL_DESCRIPTION);
    }

    public ExtractedField destination() {
        return fields.get(TicketField.DESTINATION);
    }

    public ExtractedField facilityName() {
        return fields.get(TicketField.FACILITY_NAME);
    }

    public ExtractedField facilityAddress() {
        return fields.get(TicketField.FACILITY_ADDRESS);
    }

    public ExtractedField projectName() {
        return fields.get(TicketField.PROJECT_NAME);
    }

    public ExtractedField customerName() {
        return fields.get(TicketField.CUSTOMER_NAME);
    }

    public ExtractedField jobNumber() {
        return fields.get(TicketField.JOB_NUMBER);
    }

    public ExtractedField poNumber() {
        return fields.get(TicketField.PO_NUMBER);
    }

    public TicketSource source() {
        return source;
    }

    public double overallConfidence() {
        return overallConfidence;
    }

    public String rawText() {
        return rawText;
    }

    public List<String> processingNotes() {
        return processingNotes;
    }

    /**
     * @return populated fields keyed by wire name, in declaration order
     */
    public Map<String, ExtractedField> fieldsByName() {
        Map<String, ExtractedField> byName = new LinkedHashMap<>();
        fields.forEach((field, value) -> byName.put(field.wireName(), value));
        return byName;
    }

    public int populatedFieldCount() {
        return fields.size();
    }

    /**
     * Net weight as extracted, or gross minus tare when the ticket shows no net weight. The derived
     * value is not scored.
     */
    public Optional<Double> resolveNetWeight() {
        Double net = numeric(netWeight());
        if (net != null) {
            return Optional.of(net);
        }
        Double gross = numeric(grossWeight());
        Double tare = numeric(tareWeight());
        if (gross != null && tare != null) {
            return Optional.of(gross - tare);
        }
        return Optional.empty();
    }

    /**
     * Renders the result as plain maps and lists for JSON serialisation.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        fields.forEach((field, value) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("value", value.value());
            entry.put("confidence", value.confidence());
            entry.put("rawText", value.rawText());
            if (value.boundingBox() != null) {
                entry.put("boundingBox", value.boundingBox());
            }
            map.put(field.wireName(), entry);
        });
        map.put("source", source.code());
        map.put("overallConfidence", overallConfidence);
        map.put("netWeight", resolveNetWeight().orElse(null));
        map.put("rawText", rawText);
        map.put("processingNotes", processingNotes);
        return map;
    }

    private static Double numeric(ExtractedField field) {
        return field != null ? field.numericValue() : null;
    }

    private static double meanConfidence(Map<TicketField, ExtractedField> fields) {
        if (fields.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (ExtractedField field : fields.values()) {
            total += field.confidence();
        }
        return total / fields.size();
    }

    @Override
    public String toString() {
        return "TicketExtractionResult{source=" + source + ", fields=" + fields.keySet()
            + ", overallConfidence=" + overallConfidence + ", notes=" + processingNotes.size() + '}';
    }

    public static final class Builder {

        private final TicketSource source;
        private final EnumMap<TicketField, ExtractedField> fields = new EnumMap<>(TicketField.class);
        private final List<String> processingNotes = new ArrayList<>();
        private String rawText;

        private Builder(TicketSource source) {
            this.source = Objects.requireNonNull(source, "source");
        }

        /**
         * Sets or clears a field; a {@code null} value leaves the field unpopulated.
         */
        public Builder field(TicketField field, ExtractedField value) {
            Objects.requireNonNull(field, "field");
            if (value == null) {
                fields.remove(field);
            } else {
                fields.put(field, value);
            }
            return this;
        }

        public Builder rawText(String rawText) {
            this.rawText = rawText;
            return this;
        }

        public Builder note(String note) {
            if (note != null && !note.isBlank()) {
                processingNotes.add(note);
            }
            return this;
        }

        public TicketExtractionResult build() {
            return new TicketExtractionResult(this);
        }
    }
}
