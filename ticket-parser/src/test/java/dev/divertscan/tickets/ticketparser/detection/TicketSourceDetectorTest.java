package dev.divertscan.tickets.ticketparser.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import dev.divertscan.tickets.model.TicketSource;
import dev.divertscan.tickets.ticketparser.provider.VisionProvider;
import dev.divertscan.tickets.ticketparser.provider.VisionProviderException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TicketSourceDetectorTest {

    private static final byte[] IMAGE = {9, 9};

    @Test
    void mapsModelAnswerToSource() {
        VisionProvider provider = mock(VisionProvider.class);
        when(provider.extractStructured(any(), anyString(), eq(TicketSourceDetector.DETECTION_PROMPT)))
            .thenReturn(Map.of("source_type", "thermal", "confidence", 0.92,
                "indicators", List.of("monospaced print", "barcode")));

        SourceDetection detection = new TicketSourceDetector(provider).detect(IMAGE, "image/jpeg");

        assertThat(detection.source()).isEqualTo(TicketSource.THERMAL_PRINTOUT);
        assertThat(detection.confidence()).isEqualTo(0.92);
        assertThat(detection.indicators()).containsExactly("monospaced print", "barcode");
        assertThat(detection.isFallback()).isFalse();
    }

    @Test
    void providerFailureFallsBackToGeneric() {
        VisionProvider provider = mock(VisionProvider.class);
        when(provider.extractStructured(any(), anyString(), anyString()))
            .thenThrow(new VisionProviderException("timeout"));

        SourceDetection detection = new TicketSourceDetector(provider).detect(IMAGE, "image/jpeg");

        assertThat(detection.source()).isEqualTo(TicketSource.GENERIC_DIGITAL);
        assertThat(detection.confidence()).isEqualTo(SourceDetection.FALLBACK_CONFIDENCE);
        assertThat(detection.fallbackReason()).contains("timeout");
    }

    @Test
    void unexpectedSourceTypeFallsBack() {
        SourceDetection detection = TicketSourceDetector.interpret(Map.of("source_type", "manual_entry"));

        assertThat(detection.isFallback()).isTrue();
        assertThat(detection.source()).isEqualTo(TicketSource.GENERIC_DIGITAL);
        assertThat(detection.fallbackReason()).contains("manual_entry");
    }

    @Test
    void acceptsSourceCodesAndClampsConfidence() {
        SourceDetection detection = TicketSourceDetector.interpret(
            Map.of("source_type", " HANDWRITTEN_RED_INK ", "confidence", "1.4"));

        assertThat(detection.source()).isEqualTo(TicketSource.HANDWRITTEN_RED_INK);
        assertThat(detection.confidence()).isEqualTo(1.0);
        assertThat(detection.indicators()).isEmpty();
    }

    @Test
    void missingConfidenceDefaultsToHalf() {
        SourceDetection detection = TicketSourceDetector.interpret(Map.of("source_type", "handwritten"));

        assertThat(detection.isFallback()).isFalse();
        assertThat(detection.confidence()).isEqualTo(0.5);
    }

    @Test
    void malformedAnswersFallBack() {
        Map<String, Object> nonNumeric = new HashMap<>();
        nonNumeric.put("source_type", "generic");
        nonNumeric.put("confidence", "high");

        assertThat(TicketSourceDetector.interpret(null).isFallback()).isTrue();
        assertThat(TicketSourceDetector.interpret(Map.of("confidence", 0.9)).isFallback()).isTrue();
        assertThat(TicketSourceDetector.interpret(nonNumeric).fallbackReason()).contains("high");
    }
}
