package dev.divertscan.tickets.ticketparser.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Shared plumbing for the HTTP vision providers: image encoding, observations, error translation
 * and JSON parsing of model answers.
 */
abstract class AbstractVisionProvider implements VisionProvider {

    static final String TEXT_PROMPT = "Extract ALL text visible in this scale ticket image. "
        + "Preserve the layout and structure. Include all numbers, dates, weights, and handwritten text.";

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractVisionProvider.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() { };
    private static final int PREVIEW_LENGTH = 256;

    protected final RestClient restClient;
    protected final String apiKey;
    protected final String model;
    protected final int maxTokens;
    private final ObjectMapper objectMapper;
    private final ObservationRegistry observationRegistry;
    private final AtomicBoolean closed = new AtomicBoolean();

    protected AbstractVisionProvider(RestClient restClient, String apiKey, String model, int maxTokens,
        ObjectMapper objectMapper, ObservationRegistry observationRegistry) {
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalArgumentException("An API key is required to call the vision model");
        }
        if (!StringUtils.hasText(model)) {
            throw new IllegalArgumentException("A model name is required to call the vision model");
        }
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    @Override
    public String extractText(byte[] image, String mimeType) {
        return observe("text", () -> requestText(encode(image), resolveMimeType(mimeType)));
    }

    @Override
    public Map<String, Object> extractStructured(byte[] image, String mimeType, String prompt) {
        if (!StringUtils.hasText(prompt)) {
            throw new IllegalArgumentException("Prompt must not be empty");
        }
        return observe("structured", () -> requestStructured(encode(image), resolveMimeType(mimeType), prompt));
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            LOGGER.info("Closed {} vision provider for model '{}'", type().id(), model);
        }
    }

    public String model() {
        return model;
    }

    /**
     * Sends the image with the plain OCR prompt and returns the model's text.
     */
    protected abstract String requestText(String base64Image, String mimeType);

    /**
     * Sends the image with {@code prompt} and returns the model's answer as a JSON object.
     */
    protected abstract Map<String, Object> requestStructured(String base64Image, String mimeType, String prompt);

    protected Map<String, Object> parseObject(String json) {
        if (!StringUtils.hasText(json)) {
            throw new VisionProviderException(label() + " returned an empty answer where JSON was expected");
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, MAP_TYPE);
            if (parsed == null) {
                throw new VisionProviderException(label() + " returned JSON null where an object was expected");
            }
            return parsed;
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Failed to parse {} answer as a JSON object. Payload begins with: {}", label(), preview(json));
            throw new VisionProviderException(label() + " returned an answer that is not a JSON object", ex);
        }
    }

    /**
     * Runs a request and translates Spring's client exceptions into {@link VisionProviderException}.
     */
    protected <T> T exchange(Supplier<T> request) {
        try {
            T body = request.get();
            if (body == null) {
                throw new VisionProviderException(label() + " returned an empty response body");
            }
            return body;
        } catch (RestClientResponseException ex) {
            LOGGER.warn("{} call failed with status {} and body {}", label(), ex.getStatusCode(),
                preview(ex.getResponseBodyAsString()));
            throw new VisionProviderException(label() + " request failed with status " + ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            throw new VisionProviderException(label() + " request failed: " + ex.getMessage(), ex);
        }
    }

    protected String label() {
        return type().id() + " vision model";
    }

    static String preview(String text) {
        if (text == null) {
            return "<null>";
        }
        return text.substring(0, Math.min(text.length(), PREVIEW_LENGTH));
    }

    private <T> T observe(String callKind, Supplier<T> call) {
        if (closed.get()) {
            throw new VisionProviderException(label() + " provider has been closed");
        }
        Observation observation = Observation.start("ticket.vision.call", observationRegistry)
            .lowCardinalityKeyValue("provider", type().id())
            .lowCardinalityKeyValue("call", callKind)
            .highCardinalityKeyValue("model", model);
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.debug("Calling {} model '{}' for a {} extraction", type().id(), model, callKind);
            return call.get();
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    private static String encode(byte[] image) {
        if (image == null || image.length == 0) {
            throw new IllegalArgumentException("Cannot read an empty ticket image");
        }
        return Base64.getEncoder().encodeToString(image);
    }

    private static String resolveMimeType(String mimeType) {
        return StringUtils.hasText(mimeType) ? mimeType : "image/jpeg";
    }
}
