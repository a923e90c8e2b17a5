package dev.divertscan.tickets.model;

import java.util.Locale;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Units printed or written next to ticket weights.
 */
public enum WeightUnit {

    LBS("lbs"),
    TONS("tons"),
    KG("kg");

    private final String code;

    WeightUnit(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<WeightUnit> fromText(String text) {
        if (!StringUtils.hasText(text)) {
            return Optional.empty();
        }
        String normalised = text.trim().toLowerCase(Locale.ROOT).replace(".", "");
        switch (normalised) {
            case "lb":
            case "lbs":
            case "pound":
            case "pounds":
                return Optional.of(LBS);
            case "t":
            case "ton":
            case "tons":
            case "tn":
                return Optional.of(TONS);
            case "kg":
            case "kgs":
            case "kilogram":
            case "kilograms":
                return Optional.of(KG);
            default:
                return Optional.empty();
        }
    }
}
