package dev.divertscan.tickets.ticketparser.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.ObservationRegistry;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.match.MockRestRequestMatchers;
import org.springframework.test.web.client.response.MockRestResponseCreators;
import org.springframework.web.client.RestClient;

class OpenAiVisionProviderTest {

    private static final byte[] IMAGE = "ticket".getBytes(StandardCharsets.UTF_8);

    private MockRestServiceServer server;
    private OpenAiVisionProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder restClientBuilder = RestClient.builder().baseUrl("http://localhost/v1");
        server = MockRestServiceServer.bindTo(restClientBuilder).build();
        provider = new OpenAiVisionProvider(restClientBuilder.build(), "sk-test", "gpt-4o", 4096,
            new ObjectMapper(), ObservationRegistry.NOOP);
    }

    @Test
    void structuredCallSendsImageAsDataUrlAndParsesJsonAnswer() {
        server.expect(ExpectedCount.once(), MockRestRequestMatchers.requestTo("http://localhost/v1/chat/completions"))
            .andExpect(MockRestRequestMatchers.method(HttpMethod.POST))
            .andExpect(MockRestRequestMatchers.header("Authorization", "Bearer sk-test"))
            .andExpect(MockRestRequestMatchers.jsonPath("$.model").value("gpt-4o"))
            .andExpect(MockRestRequestMatchers.jsonPath("$.max_tokens").value(4096))
            .andExpect(MockRestRequestMatchers.jsonPath("$.response_format.type").value("json_object"))
            .andExpect(MockRestRequestMatchers.jsonPath("$.messages[0].role").value("user"))
            .andExpect(MockRestRequestMatchers.jsonPath("$.messages[0].content[0].type").value("image_url"))
            .andExpect(MockRestRequestMatchers.jsonPath("$.messages[0].content[0].image_url.url")
                .value("data:image/png;base64,dGlja2V0"))
            .andExpect(MockRestRequestMatchers.jsonPath("$.messages[0].content[1].text").value("Read the ticket"))
            .andRespond(MockRestResponseCreators.withSuccess(
                "{\"choices\":[{\"message\":{\"role\":\"assistant\","
                    + "\"content\":\"{\\\"ticket_number\\\":\\\"A-1\\\",\\\"gross_weight\\\":15280}\"}}]}",
                MediaType.APPLICATION_JSON));

        Map<String, Object> answer = provider.extractStructured(IMAGE, "image/png", "Read the ticket");

        server.verify();
        assertThat(answer).containsEntry("ticket_number", "A-1").containsEntry("gross_weight", 15280);
    }

    @Test
    void textCallOmitsResponseFormatAndDefaultsToJpeg() {
        server.expect(ExpectedCount.once(), MockRestRequestMatchers.requestTo("http://localhost/v1/chat/completions"))
            .andExpect(MockRestRequestMatchers.jsonPath("$.response_format").doesNotExist())
            .andExpect(MockRestRequestMatchers.jsonPath("$.messages[0].content[0].image_url.url")
                .value("data:image/jpeg;base64,dGlja2V0"))
            .andRespond(MockRestResponseCreators.withSuccess(
                "{\"choices\":[{\"message\":{\"content\":\"TICKET 4411\\nGROSS 15,280\"}}]}",
                MediaType.APPLICATION_JSON));

        String text = provider.extractText(IMAGE, null);

        server.verify();
        assertThat(text).isEqualTo("TICKET 4411\nGROSS 15,280");
    }

    @Test
    void errorStatusBecomesProviderException() {
        server.expect(ExpectedCount.once(), MockRestRequestMatchers.requestTo("http://localhost/v1/chat/completions"))
            .andRespond(MockRestResponseCreators.withStatus(HttpStatus.TOO_MANY_REQUESTS)
                .body("{\"error\":\"rate limited\"}")
                .contentType(MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.extractStructured(IMAGE, "image/jpeg", "Read the ticket"))
            .isInstanceOf(VisionProviderException.class)
            .hasMessageContaining("status 429");
    }

    @Test
    void answerThatIsNotJsonBecomesProviderException() {
        server.expect(ExpectedCount.once(), MockRestRequestMatchers.requestTo("http://localhost/v1/chat/completions"))
            .andRespond(MockRestResponseCreators.withSuccess(
                "{\"choices\":[{\"message\":{\"content\":\"I cannot read this ticket\"}}]}",
                MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.extractStructured(IMAGE, "image/jpeg", "Read the ticket"))
            .isInstanceOf(VisionProviderException.class)
            .hasMessageContaining("not a JSON object");
    }

    @Test
    void responseWithoutChoicesBecomesProviderException() {
        server.expect(ExpectedCount.once(), MockRestRequestMatchers.requestTo("http://localhost/v1/chat/completions"))
            .andRespond(MockRestResponseCreators.withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.extractText(IMAGE, "image/jpeg"))
            .isInstanceOf(VisionProviderException.class)
            .hasMessageContaining("did not contain any choices");
    }

    @Test
    void closedProviderRejectsCalls() {
        provider.close();

        assertThatThrownBy(() -> provider.extractText(IMAGE, "image/jpeg"))
            .isInstanceOf(VisionProviderException.class)
            .hasMessageContaining("has been closed");
    }

    @Test
    void emptyImageIsRejectedBeforeAnyRequest() {
        assertThatThrownBy(() -> provider.extractText(new byte[0], "image/jpeg"))
            .isInstanceOf(IllegalArgumentException.class);
        server.verify();
    }

    @Test
    void requiresApiKey() {
        assertThatThrownBy(() -> new OpenAiVisionProvider(RestClient.create(), " ", "gpt-4o", 4096, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("API key");
    }
}
