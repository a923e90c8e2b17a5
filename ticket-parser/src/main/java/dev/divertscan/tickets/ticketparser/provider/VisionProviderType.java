package dev.divertscan.tickets.ticketparser.provider;

import java.util.Locale;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Supported vision model vendors.
 */
public enum VisionProviderType {

    ANTHROPIC("anthropic"),
    OPENAI("openai");

    private final String id;

    VisionProviderType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<VisionProviderType> fromId(String id) {
        if (!StringUtils.hasText(id)) {
            return Optional.empty();
        }
        String normalised = id.trim().toLowerCase(Locale.ROOT);
        for (VisionProviderType type : values()) {
            if (type.id.equals(normalised)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
