package dev.divertscan.tickets.ticketparser;

import dev.divertscan.tickets.ticketparser.provider.VisionProviderSelector;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Logs the resolved extraction settings when the service boots. API keys are reported as set or
 * unset, never printed.
 */
@Component
public class TicketParserDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(TicketParserDiagnostics.class);

    private final Environment environment;
    private final TicketExtractionProperties properties;
    private final ObjectProvider<VisionProviderSelector> selectorProvider;

    public TicketParserDiagnostics(Environment environment, TicketExtractionProperties properties,
        ObjectProvider<VisionProviderSelector> selectorProvider) {
        this.environment = environment;
        this.properties = properties;
        this.selectorProvider = selectorProvider;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Ticket parser diagnostics starting");
        LOGGER.info("Active Spring profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("API keys - openai: {}, anthropic: {}", describeKey(properties.openaiApiKey()),
            describeKey(properties.anthropicApiKey()));
        LOGGER.info("Default provider: {}, batch concurrency: {}, timeouts: connect {} / read {}",
            properties.defaultProvider(), properties.batchConcurrency(), properties.connectTimeout(),
            properties.readTimeout());

        VisionProviderSelector selector = selectorProvider.getIfAvailable();
        if (selector != null) {
            LOGGER.info("Configured vision providers: {} (preferred: {})", selector.configuredTypes(),
                selector.preferred() != null ? selector.preferred().id() : "(none)");
        } else {
            LOGGER.info("VisionProviderSelector bean not available; skipping provider diagnostics");
        }
    }

    private static String describeKey(String key) {
        return StringUtils.hasText(key) ? "(set)" : "(unset)";
    }
}
