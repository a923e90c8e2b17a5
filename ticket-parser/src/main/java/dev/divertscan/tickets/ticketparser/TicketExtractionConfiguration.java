package dev.divertscan.tickets.ticketparser;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.divertscan.tickets.ticketparser.provider.AnthropicVisionProvider;
import dev.divertscan.tickets.ticketparser.provider.OpenAiVisionProvider;
import dev.divertscan.tickets.ticketparser.provider.VisionProviderSelector;
import dev.divertscan.tickets.ticketparser.provider.VisionProviderType;
import io.micrometer.observation.ObservationRegistry;
import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Service configuration for the ticket extraction workload.
 */
@Configuration
@EnableConfigurationProperties(TicketExtractionProperties.class)
public class TicketExtractionConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(TicketExtractionConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    @Bean
    public VisionProviderSelector visionProviderSelector(TicketExtractionProperties properties,
        ObjectMapper objectMapper, ObjectProvider<ObservationRegistry> observationRegistry) {

        ObservationRegistry registry = observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP);
        VisionProviderType preferred = properties.preferredProvider();
        if (preferred == null) {
            LOGGER.warn("Unknown default provider '{}'; falling back to any configured provider",
                properties.defaultProvider());
        }

        VisionProviderSelector.Builder builder = VisionProviderSelector.builder(preferred);
        if (StringUtils.hasText(properties.openaiApiKey())) {
            TicketExtractionProperties.OpenAi openai = properties.openai();
            RestClient restClient = restClient(properties, openai.baseUrl());
            builder.register(VisionProviderType.OPENAI, () -> new OpenAiVisionProvider(restClient,
                properties.openaiApiKey(), openai.model(), openai.maxTokens(), objectMapper, registry));
            LOGGER.info("Configured OpenAI vision provider - model: {}, baseUrl: {}", openai.model(), openai.baseUrl());
        }
        if (StringUtils.hasText(properties.anthropicApiKey())) {
            TicketExtractionProperties.Anthropic anthropic = properties.anthropic();
            RestClient restClient = restClient(properties, anthropic.baseUrl());
            builder.register(VisionProviderType.ANTHROPIC, () -> new AnthropicVisionProvider(restClient,
                properties.anthropicApiKey(), anthropic.model(), anthropic.maxTokens(), anthropic.version(),
                objectMapper, registry));
            LOGGER.info("Configured Anthropic vision provider - model: {}, baseUrl: {}", anthropic.model(),
                anthropic.baseUrl());
        }

        VisionProviderSelector selector = builder.build();
        if (selector.configuredTypes().isEmpty()) {
            LOGGER.warn("No vision provider API key configured; extraction requests will fail until one is set");
        }
        return selector;
    }

    @Bean
    public TicketExtractionEngine ticketExtractionEngine(VisionProviderSelector visionProviderSelector,
        TicketExtractionProperties properties) {
        ExtractionPolicy policy = properties.extractionPolicy();
        LOGGER.info("Ticket extraction policy - maxRetries: {}, confidenceThreshold: {}, backoff: {}",
            policy.maxRetries(), policy.confidenceThreshold(), policy.backoffUnit());
        LOGGER.info("Image preprocessing flag is {} (preprocessing is not performed by this service)",
            properties.enablePreprocessing() ? "enabled" : "disabled");
        return new TicketExtractionEngine(visionProviderSelector::select, policy);
    }

    @Bean
    public TicketBatchProcessor ticketBatchProcessor(TicketExtractionEngine ticketExtractionEngine,
        TicketExtractionProperties properties) {
        ExecutorService executor = Executors.newCachedThreadPool(new CustomizableThreadFactory("ticket-batch-"));
        return new TicketBatchProcessor(ticketExtractionEngine, executor, properties.batchConcurrency());
    }

    private static RestClient restClient(TicketExtractionProperties properties, String baseUrl) {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(properties.connectTimeout())
            .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.readTimeout());
        return RestClient.builder()
            .baseUrl(baseUrl)
            .requestFactory(requestFactory)
            .build();
    }
}
