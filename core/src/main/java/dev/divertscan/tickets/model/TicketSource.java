package dev.divertscan.tickets.model;

import java.util.Locale;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Layout families a scale ticket can come from. Only the automatic sources are produced by the
 * extraction pipeline; manual entry and bulk import records are created elsewhere.
 */
public enum TicketSource {

    HANDWRITTEN_RED_INK("handwritten_red_ink", "Handwritten (red ink)", true),
    THERMAL_PRINTOUT("thermal_printout", "Thermal printout", true),
    GENERIC_DIGITAL("generic_digital", "Generic digital scale", true),
    MANUAL_ENTRY("manual_entry", "Manual entry", false),
    BULK_IMPORT("bulk_import", "Bulk import", false);

    private final String code;
    private final String displayName;
    private final boolean automatic;

    TicketSource(String code, String displayName, boolean automatic) {
        this.code = code;
        this.displayName = displayName;
        this.automatic = automatic;
    }

    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * @return {@code true} when tickets of this source are detected and extracted automatically
     */
    public boolean isAutomatic() {
        return automatic;
    }

    public static Optional<TicketSource> fromCode(String code) {
        if (!StringUtils.hasText(code)) {
            return Optional.empty();
        }
        String normalised = code.trim().toLowerCase(Locale.ROOT);
        for (TicketSource source : values()) {
            if (source.code.equals(normalised) || source.name().toLowerCase(Locale.ROOT).equals(normalised)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }
}
