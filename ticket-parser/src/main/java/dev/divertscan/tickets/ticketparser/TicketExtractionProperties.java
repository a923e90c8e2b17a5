package dev.divertscan.tickets.ticketparser;

import dev.divertscan.tickets.ticketparser.provider.VisionProviderType;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings for the ticket extraction service, bound from {@code ticket-extraction.*}.
 */
@ConfigurationProperties(prefix = "ticket-extraction")
public record TicketExtractionProperties(
    String openaiApiKey,
    String anthropicApiKey,
    @DefaultValue("anthropic") String defaultProvider,
    @DefaultValue("3") int maxRetries,
    @DefaultValue("0.75") double confidenceThreshold,
    @DefaultValue("true") boolean enablePreprocessing,
    @DefaultValue("1s") Duration backoff,
    @DefaultValue("3") int batchConcurrency,
    @DefaultValue("10s") Duration connectTimeout,
    @DefaultValue("120s") Duration readTimeout,
    @DefaultValue OpenAi openai,
    @DefaultValue Anthropic anthropic
) {

    public ExtractionPolicy extractionPolicy() {
        return new ExtractionPolicy(maxRetries, confidenceThreshold, backoff);
    }

    /**
     * Preferred vendor, or {@code null} when {@code default-provider} names no known vendor.
     */
    public VisionProviderType preferredProvider() {
        return VisionProviderType.fromId(defaultProvider).orElse(null);
    }

    public record OpenAi(
        @DefaultValue("https://api.openai.com/v1") String baseUrl,
        @DefaultValue("gpt-4o") String model,
        @DefaultValue("4096") int maxTokens
    ) {
    }

    public record Anthropic(
        @DefaultValue("https://api.anthropic.com/v1") String baseUrl,
        @DefaultValue("claude-sonnet-4-20250514") String model,
        @DefaultValue("4096") int maxTokens,
        @DefaultValue("2023-06-01") String version
    ) {
    }
}
