package dev.divertscan.tickets.ticketparser.extraction;

import dev.divertscan.tickets.model.ExtractedField;
import dev.divertscan.tickets.model.TicketExtractionResult;
import dev.divertscan.tickets.model.TicketField;
import dev.divertscan.tickets.model.TicketSource;
import dev.divertscan.tickets.model.WeightUnit;
import dev.divertscan.tickets.ticketparser.provider.VisionProvider;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for the per-layout extractors. Subclasses supply the field table with prompt hints,
 * the prompt wording and the confidence heuristic; this class issues the model calls and maps the
 * answer onto a {@link TicketExtractionResult}.
 */
public abstract class AbstractTicketExtractor implements TicketExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractTicketExtractor.class);

    private final VisionProvider provider;
    private final Map<TicketField, String> fieldTable;
    private final String prompt;

    protected AbstractTicketExtractor(VisionProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.fieldTable = Collections.unmodifiableMap(new LinkedHashMap<>(fieldHints()));
        this.prompt = buildPrompt();
    }

    @Override
    public TicketExtractionResult extract(byte[] image, String mimeType) {
        Map<String, Object> answer = provider.extractStructured(image, mimeType, prompt);
        String rawText = provider.extractText(image, mimeType);
        TicketExtractionResult result = assemble(answer, rawText);
        LOGGER.info("{} extraction populated {} field(s) with overall confidence {}", source().code(),
            result.populatedFieldCount(), String.format("%.2f", result.overallConfidence()));
        return result;
    }

    /**
     * Field table: JSON keys requested from the model, each with the hint shown in the prompt.
     * Iteration order is the order used in the prompt.
     */
    protected abstract Map<TicketField, String> fieldHints();

    /**
     * Opening paragraph of the prompt describing the layout.
     */
    protected abstract String layoutIntroduction();

    /**
     * Layout-specific reading rules appended after the JSON template.
     */
    protected abstract String readingRules();

    /**
     * Confidence for a populated field before clamping into [0, 1].
     *
     * @param field    the field being scored
     * @param rawValue the value exactly as returned by the model, never {@code null}
     */
    protected abstract double score(TicketField field, Object rawValue);

    /**
     * Extra keys requested in the prompt that are not ticket fields, with their hints.
     */
    protected Map<String, String> additionalKeys() {
        return Map.of();
    }

    /**
     * Hook for layout-specific keys in the answer that are not ticket fields.
     */
    protected void addLayoutNotes(Map<String, Object> answer, TicketExtractionResult.Builder builder) {
    }

    public final String prompt() {
        return prompt;
    }

    public final Map<TicketField, String> fieldTable() {
        return fieldTable;
    }

    TicketExtractionResult assemble(Map<String, Object> answer, String rawText) {
        Map<String, Object> safeAnswer = answer != null ? answer : Map.of();
        TicketExtractionResult.Builder builder = TicketExtractionResult.builder(source()).rawText(rawText);
        for (TicketField field : fieldTable.keySet()) {
            Object rawValue = safeAnswer.get(field.wireName());
            if (rawValue == null) {
                continue;
            }
            Object value = cleanValue(field, rawValue);
            if (value == null) {
                if (field.isWeight()) {
                    builder.note(field.wireName() + " value '" + rawValue + "' could not be read as a number");
                }
                continue;
            }
            double confidence = clamp(score(field, rawValue));
            builder.field(field, new ExtractedField(value, confidence, String.valueOf(rawValue)));
        }
        addLayoutNotes(safeAnswer, builder);
        return builder.build();
    }

    static Object cleanValue(TicketField field, Object rawValue) {
        if (field.isWeight()) {
            return WeightValues.clean(rawValue);
        }
        String text = rawValue instanceof Number number ? plainNumber(number) : String.valueOf(rawValue).trim();
        if (text.isEmpty()) {
            return null;
        }
        if (field == TicketField.WEIGHT_UNIT) {
            return WeightUnit.fromText(text).map(WeightUnit::code).orElse(text);
        }
        return text;
    }

    static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private static String plainNumber(Number number) {
        try {
            return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
        } catch (NumberFormatException ex) {
            return number.toString();
        }
    }

    private String buildPrompt() {
        StringBuilder builder = new StringBuilder();
        builder.append(layoutIntroduction().strip()).append("\n\n");
        Map<String, String> template = new LinkedHashMap<>();
        fieldTable.forEach((field, hint) -> template.put(field.wireName(), hint));
        template.putAll(additionalKeys());
        builder.append("Extract the following information into a JSON object:\n{\n");
        int index = 0;
        for (Map.Entry<String, String> entry : template.entrySet()) {
            builder.append("  \"").append(entry.getKey()).append("\": \"").append(entry.getValue()).append('"');
            builder.append(++index < template.size() ? ",\n" : "\n");
        }
        builder.append("}\n\n");
        String rules = readingRules();
        if (rules != null && !rules.isBlank()) {
            builder.append("IMPORTANT:\n").append(rules.strip()).append("\n\n");
        }
        builder.append("Return ONLY the JSON object, no additional text.");
        return builder.toString();
    }
}
