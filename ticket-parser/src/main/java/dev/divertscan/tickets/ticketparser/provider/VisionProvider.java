package dev.divertscan.tickets.ticketparser.provider;

import java.util.Map;

/**
 * Remote vision-language model able to read a ticket image. Implementations hold an API key and an
 * HTTP client; they do not cache anything between calls.
 */
public interface VisionProvider extends AutoCloseable {

    /**
     * @return the provider variant
     */
    VisionProviderType type();

    /**
     * Reads all visible text from the image, preserving layout where possible.
     *
     * @throws VisionProviderException when the remote call fails or returns an unusable body
     */
    String extractText(byte[] image, String mimeType);

    /**
     * Asks the model to answer {@code prompt} about the image with a single JSON object.
     *
     * @throws VisionProviderException when the remote call fails or no JSON object can be parsed
     */
    Map<String, Object> extractStructured(byte[] image, String mimeType, String prompt);

    /**
     * Releases the provider. Subsequent calls fail with {@link VisionProviderException}.
     */
    @Override
    void close();
}
