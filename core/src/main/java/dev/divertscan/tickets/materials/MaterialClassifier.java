package dev.divertscan.tickets.materials;

import dev.divertscan.tickets.model.ExtractedField;
import dev.divertscan.tickets.model.MaterialType;
import dev.divertscan.tickets.model.TicketExtractionResult;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Maps free-text material descriptions onto the fixed {@link MaterialType} taxonomy by counting
 * keyword hits. Stateless and safe to share.
 */
public final class MaterialClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(MaterialClassifier.class);

    static final double EMPTY_CONFIDENCE = 0.0;
    static final double UNMATCHED_CONFIDENCE = 0.3;
    private static final double BASE_CONFIDENCE = 0.5;
    private static final double PER_HIT_CONFIDENCE = 0.15;
    private static final double MAX_CONFIDENCE = 0.95;

    private static final Map<MaterialType, List<String>> KEYWORDS = keywordTable();

    private MaterialClassifier() {
        // Utility class
    }

    /**
     * Classifies a description. The type with most keyword hits wins; equal counts go to the type
     * declared first in {@link MaterialType}.
     */
    public static MaterialClassification classify(String description) {
        if (!StringUtils.hasLength(description)) {
            return new MaterialClassification(MaterialType.OTHER, EMPTY_CONFIDENCE, 0);
        }
        String normalised = description.toLowerCase(Locale.ROOT);

        MaterialType best = null;
        int bestHits = 0;
        // EnumMap iterates in declaration order, strict comparison keeps the earliest type on ties
        for (Map.Entry<MaterialType, List<String>> entry : KEYWORDS.entrySet()) {
            int hits = countHits(normalised, entry.getValue());
            if (hits > bestHits) {
                best = entry.getKey();
                bestHits = hits;
            }
        }

        if (best == null) {
            LOGGER.debug("No material keywords matched '{}'", description);
            return new MaterialClassification(MaterialType.OTHER, UNMATCHED_CONFIDENCE, 0);
        }
        double confidence = Math.min(BASE_CONFIDENCE + bestHits * PER_HIT_CONFIDENCE, MAX_CONFIDENCE);
        LOGGER.debug("Classified '{}' as {} with {} keyword hit(s)", description, best.code(), bestHits);
        return new MaterialClassification(best, confidence, bestHits);
    }

    /**
     * Classifies the material of an extracted ticket, preferring the detailed description over the
     * short material type the model read.
     */
    public static MaterialClassification classify(TicketExtractionResult result) {
        if (result == null) {
            return classify((String) null);
        }
        MaterialClassification fromDescription = classify(text(result.materialDescription()));
        if (fromDescription.materialType() != MaterialType.OTHER) {
            return fromDescription;
        }
        MaterialClassification fromType = classify(text(result.materialType()));
        if (fromType.materialType() != MaterialType.OTHER || fromType.confidence() > fromDescription.confidence()) {
            return fromType;
        }
        return fromDescription;
    }

    static List<String> keywordsFor(MaterialType materialType) {
        return KEYWORDS.getOrDefault(materialType, List.of());
    }

    private static int countHits(String description, List<String> keywords) {
        int hits = 0;
        for (String keyword : keywords) {
            if (description.contains(keyword)) {
                hits++;
            }
        }
        return hits;
    }

    private static String text(ExtractedField field) {
        return field != null ? field.textValue() : null;
    }

    private static Map<MaterialType, List<String>> keywordTable() {
        EnumMap<MaterialType, List<String>> table = new EnumMap<>(MaterialType.class);
        table.put(MaterialType.CONCRETE, List.of("concrete", "cement", "rebar", "sidewalk", "foundation"));
        table.put(MaterialType.ASPHALT, List.of("asphalt", "pavement", "blacktop", "tar"));
        table.put(MaterialType.METAL_FERROUS, List.of("steel", "iron", "ferrous", "metal scrap", "rebar"));
        table.put(MaterialType.METAL_NONFERROUS, List.of("aluminum", "copper", "brass", "non-ferrous", "nonferrous"));
        table.put(MaterialType.WOOD_CLEAN, List.of("clean wood", "untreated wood", "lumber", "pallet", "timber"));
        table.put(MaterialType.WOOD_TREATED, List.of("treated wood", "pressure treated", "painted wood"));
        table.put(MaterialType.CARDBOARD, List.of("cardboard", "occ", "corrugated"));
        table.put(MaterialType.PAPER, List.of("paper", "office paper", "newspaper"));
        table.put(MaterialType.PLASTIC, List.of("plastic", "hdpe", "ldpe", "pet", "pvc"));
        table.put(MaterialType.GLASS, List.of("glass", "window", "bottle"));
        table.put(MaterialType.DRYWALL, List.of("drywall", "sheetrock", "gypsum", "wallboard"));
        table.put(MaterialType.INSULATION, List.of("insulation", "fiberglass", "foam board"));
        table.put(MaterialType.ROOFING, List.of("roofing", "shingle", "tar paper", "roof"));
        table.put(MaterialType.BRICK_MASONRY, List.of("brick", "block", "masonry", "cmu", "stone"));
        table.put(MaterialType.SOIL_LAND_CLEARING, List.of("soil", "dirt", "land clearing", "brush", "vegetation"));
        table.put(MaterialType.MIXED_CND, List.of("mixed", "c&d", "c and d", "construction", "demolition", "debris"));
        table.put(MaterialType.HAZARDOUS, List.of("hazardous", "hazmat", "asbestos", "lead", "contaminated"));
        return Collections.unmodifiableMap(table);
    }
}
