package dev.divertscan.tickets.ticketparser.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.ObservationRegistry;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Calls the Anthropic messages endpoint with the image as an inline base64 source. The model
 * answers in free text, so structured calls locate the first balanced JSON object in the reply.
 */
public class AnthropicVisionProvider extends AbstractVisionProvider {

    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com/v1";
    public static final String DEFAULT_MODEL = "claude-sonnet-4-20250514";
    public static final String DEFAULT_API_VERSION = "2023-06-01";
    public static final int DEFAULT_MAX_TOKENS = 4096;

    private static final Logger LOGGER = LoggerFactory.getLogger(AnthropicVisionProvider.class);

    private final String apiVersion;

    public AnthropicVisionProvider(RestClient restClient, String apiKey, String model, int maxTokens,
        String apiVersion, ObjectMapper objectMapper, ObservationRegistry observationRegistry) {
        super(restClient, apiKey, model, maxTokens, objectMapper, observationRegistry);
        this.apiVersion = StringUtils.hasText(apiVersion) ? apiVersion : DEFAULT_API_VERSION;
    }

    @Override
    public VisionProviderType type() {
        return VisionProviderType.ANTHROPIC;
    }

    @Override
    protected String requestText(String base64Image, String mimeType) {
        return firstText(send(buildRequest(base64Image, mimeType, TEXT_PROMPT)));
    }

    @Override
    protected Map<String, Object> requestStructured(String base64Image, String mimeType, String prompt) {
        String text = firstText(send(buildRequest(base64Image, mimeType, prompt)));
        String json = JsonObjectLocator.firstObject(text)
            .orElseThrow(() -> {
                LOGGER.warn("No JSON object found in {} answer: {}", label(), preview(text));
                return new VisionProviderException("Could not locate a JSON object in the " + label() + " answer");
            });
        return parseObject(json);
    }

    private MessagesRequest buildRequest(String base64Image, String mimeType, String prompt) {
        Message message = new Message("user",
            List.of(ContentBlock.image(mimeType, base64Image), ContentBlock.text(prompt)));
        return new MessagesRequest(model, maxTokens, List.of(message));
    }

    private MessagesResponse send(MessagesRequest request) {
        return exchange(() -> restClient.post()
            .uri("/messages")
            .header("x-api-key", apiKey)
            .header("anthropic-version", apiVersion)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .body(request)
            .retrieve()
            .body(MessagesResponse.class));
    }

    private String firstText(MessagesResponse response) {
        if (CollectionUtils.isEmpty(response.content())) {
            throw new VisionProviderException(label() + " response did not contain any content blocks");
        }
        return response.content().stream()
            .filter(block -> block != null && "text".equals(block.type()))
            .map(ResponseBlock::text)
            .filter(StringUtils::hasText)
            .findFirst()
            .orElseThrow(() -> new VisionProviderException(label() + " response did not contain any text"));
    }

    record MessagesRequest(String model, @JsonProperty("max_tokens") int maxTokens, List<Message> messages) { }

    record Message(String role, List<ContentBlock> content) { }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ContentBlock(String type, String text, ImageSource source) {

        static ContentBlock text(String value) {
            return new ContentBlock("text", value, null);
        }

        static ContentBlock image(String mediaType, String data) {
            return new ContentBlock("image", null, new ImageSource("base64", mediaType, data));
        }
    }

    record ImageSource(String type, @JsonProperty("media_type") String mediaType, String data) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessagesResponse(List<ResponseBlock> content) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ResponseBlock(String type, String text) { }
}
