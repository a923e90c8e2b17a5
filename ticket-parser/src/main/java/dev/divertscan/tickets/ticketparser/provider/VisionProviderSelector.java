package dev.divertscan.tickets.ticketparser.provider;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses which vision provider to construct. Only vendors with an API key are registered; the
 * preferred vendor wins when it is registered, otherwise the first registered vendor in
 * {@link VisionProviderType} order is used.
 */
public class VisionProviderSelector {

    private static final Logger LOGGER = LoggerFactory.getLogger(VisionProviderSelector.class);

    private final VisionProviderType preferred;
    private final Map<VisionProviderType, Supplier<VisionProvider>> factories;

    private VisionProviderSelector(VisionProviderType preferred,
        Map<VisionProviderType, Supplier<VisionProvider>> factories) {
        this.preferred = preferred;
        this.factories = Collections.unmodifiableMap(new EnumMap<>(factories));
    }

    public static Builder builder(VisionProviderType preferred) {
        return new Builder(preferred);
    }

    public Set<VisionProviderType> configuredTypes() {
        return factories.keySet();
    }

    public VisionProviderType preferred() {
        return preferred;
    }

    /**
     * Creates a fresh provider of the resolved vendor.
     *
     * @throws VisionProviderException when no vendor has an API key
     */
    public VisionProvider select() {
        VisionProviderType type = resolveType();
        LOGGER.info("Selected {} vision provider (preferred: {}, configured: {})", type.id(),
            preferred != null ? preferred.id() : "(none)", factories.keySet());
        return create(type);
    }

    /**
     * Creates a provider of a specific vendor.
     *
     * @throws VisionProviderException when that vendor has no API key
     */
    public VisionProvider create(VisionProviderType type) {
        Supplier<VisionProvider> factory = factories.get(type);
        if (factory == null) {
            throw new VisionProviderException("No API key configured for the " + type.id() + " vision provider");
        }
        return factory.get();
    }

    VisionProviderType resolveType() {
        if (preferred != null && factories.containsKey(preferred)) {
            return preferred;
        }
        return factories.keySet().stream()
            .findFirst()
            .orElseThrow(() -> new VisionProviderException("No vision provider configured; "
                + "set an OpenAI or Anthropic API key"));
    }

    public static final class Builder {

        private final VisionProviderType preferred;
        private final Map<VisionProviderType, Supplier<VisionProvider>> factories =
            new EnumMap<>(VisionProviderType.class);

        private Builder(VisionProviderType preferred) {
            this.preferred = preferred;
        }

        public Builder register(VisionProviderType type, Supplier<VisionProvider> factory) {
            factories.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(factory, "factory"));
            return this;
        }

        public VisionProviderSelector build() {
            return new VisionProviderSelector(preferred, factories);
        }
    }
}
