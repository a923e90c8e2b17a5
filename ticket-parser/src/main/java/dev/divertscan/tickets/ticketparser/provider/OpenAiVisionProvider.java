package dev.divertscan.tickets.ticketparser.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.ObservationRegistry;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Calls an OpenAI-compatible chat completions endpoint with the image inlined as a {@code data:}
 * URL. Structured calls request JSON mode so the message content is the JSON object itself.
 */
public class OpenAiVisionProvider extends AbstractVisionProvider {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    public static final String DEFAULT_MODEL = "gpt-4o";
    public static final int DEFAULT_MAX_TOKENS = 4096;

    private static final String LAYOUT_TEXT_PROMPT = "Extract ALL text visible in this scale ticket image. "
        + "Preserve the layout and structure.";

    public OpenAiVisionProvider(RestClient restClient, String apiKey, String model, int maxTokens,
        ObjectMapper objectMapper, ObservationRegistry observationRegistry) {
        super(restClient, apiKey, model, maxTokens, objectMapper, observationRegistry);
    }

    @Override
    public VisionProviderType type() {
        return VisionProviderType.OPENAI;
    }

    @Override
    protected String requestText(String base64Image, String mimeType) {
        String content = firstMessageContent(send(buildRequest(base64Image, mimeType, LAYOUT_TEXT_PROMPT, null)));
        if (!StringUtils.hasText(content)) {
            throw new VisionProviderException(label() + " returned no text");
        }
        return content;
    }

    @Override
    protected Map<String, Object> requestStructured(String base64Image, String mimeType, String prompt) {
        ChatCompletionRequest request = buildRequest(base64Image, mimeType, prompt, ResponseFormat.JSON_OBJECT);
        return parseObject(firstMessageContent(send(request)));
    }

    private ChatCompletionRequest buildRequest(String base64Image, String mimeType, String prompt,
        ResponseFormat responseFormat) {
        String dataUrl = "data:" + mimeType + ";base64," + base64Image;
        Message message = new Message("user", List.of(ContentPart.image(dataUrl), ContentPart.text(prompt)));
        return new ChatCompletionRequest(model, maxTokens, responseFormat, List.of(message));
    }

    private ChatCompletionResponse send(ChatCompletionRequest request) {
        return exchange(() -> restClient.post()
            .uri("/chat/completions")
            .header("Authorization", "Bearer " + apiKey)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .body(request)
            .retrieve()
            .body(ChatCompletionResponse.class));
    }

    private String firstMessageContent(ChatCompletionResponse response) {
        if (CollectionUtils.isEmpty(response.choices())) {
            throw new VisionProviderException(label() + " response did not contain any choices");
        }
        Choice choice = response.choices().get(0);
        if (choice == null || choice.message() == null) {
            throw new VisionProviderException(label() + " response did not contain a message");
        }
        return choice.message().content();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ChatCompletionRequest(String model, @JsonProperty("max_tokens") Integer maxTokens,
        @JsonProperty("response_format") ResponseFormat responseFormat, List<Message> messages) { }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ResponseFormat(String type) {

        static final ResponseFormat JSON_OBJECT = new ResponseFormat("json_object");
    }

    record Message(String role, List<ContentPart> content) { }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ContentPart(String type, String text, @JsonProperty("image_url") ImageUrl imageUrl) {

        static ContentPart text(String value) {
            return new ContentPart("text", value, null);
        }

        static ContentPart image(String url) {
            return new ContentPart("image_url", null, new ImageUrl(url));
        }
    }

    record ImageUrl(String url) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatCompletionResponse(List<Choice> choices) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(ResponseMessage message) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ResponseMessage(String role, String content) { }
}
