package dev.divertscan.tickets.ticketparser.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import dev.divertscan.tickets.model.ExtractedField;
import dev.divertscan.tickets.model.TicketExtractionResult;
import dev.divertscan.tickets.model.TicketField;
import dev.divertscan.tickets.model.TicketSource;
import dev.divertscan.tickets.ticketparser.provider.VisionProvider;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TicketExtractorsTest {

    private static final byte[] IMAGE = {1, 2, 3};

    private VisionProvider provider;

    @BeforeEach
    void setUp() {
        provider = mock(VisionProvider.class);
    }

    @Test
    void createsExtractorPerAutomaticSource() {
        assertThat(TicketExtractors.create(TicketSource.HANDWRITTEN_RED_INK, provider))
            .isInstanceOf(HandwrittenTicketExtractor.class);
        assertThat(TicketExtractors.create(TicketSource.THERMAL_PRINTOUT, provider))
            .isInstanceOf(ThermalTicketExtractor.class);
        assertThat(TicketExtractors.create(TicketSource.GENERIC_DIGITAL, provider))
            .isInstanceOf(GenericTicketExtractor.class);
    }

    @Test
    void rejectsManualSources() {
        assertThatThrownBy(() -> TicketExtractors.create(TicketSource.MANUAL_ENTRY, provider))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("manual_entry");
    }

    @Test
    void handwrittenScoresNumericWeightsHigherThanUnreadableOnes() {
        Map<String, Object> answer = new HashMap<>();
        answer.put("ticket_number", "4471");
        answer.put("gross_weight", 40120);
        answer.put("tare_weight", "15,280 lbs");
        answer.put("net_weight", "n/a");
        answer.put("weight_unit", "Lbs.");
        answer.put("destination", "ignored by this layout");
        answer.put("confidence_notes", "tare digits smudged");
        stub(answer, "raw handwriting");

        TicketExtractionResult result = new HandwrittenTicketExtractor(provider).extract(IMAGE, "image/jpeg");

        assertThat(result.source()).isEqualTo(TicketSource.HANDWRITTEN_RED_INK);
        assertThat(result.ticketNumber().confidence()).isCloseTo(0.80, within(1e-9));
        assertThat(result.grossWeight().value()).isEqualTo(40120.0);
        assertThat(result.grossWeight().confidence()).isCloseTo(0.85, within(1e-9));
        assertThat(result.tareWeight().value()).isEqualTo(15280.0);
        assertThat(result.tareWeight().confidence()).isCloseTo(0.50, within(1e-9));
        assertThat(result.tareWeight().rawText()).isEqualTo("15,280 lbs");
        assertThat(result.netWeight()).isNull();
        assertThat(result.weightUnit().value()).isEqualTo("lbs");
        assertThat(result.destination()).isNull();
        assertThat(result.resolveNetWeight()).contains(40120.0 - 15280.0);
        assertThat(result.rawText()).isEqualTo("raw handwriting");
        assertThat(result.processingNotes())
            .contains("net_weight value 'n/a' could not be read as a number")
            .contains("Handwriting notes: tare digits smudged");
    }

    @Test
    void thermalUsesPrintedLayoutScores() {
        Map<String, Object> answer = new HashMap<>();
        answer.put("ticket_number", "T-1001");
        answer.put("gross_weight", "40120");
        answer.put("net_weight", "24,840");
        answer.put("destination", "Landfill 3");
        stub(answer, "");

        TicketExtractionResult result = new ThermalTicketExtractor(provider).extract(IMAGE, "image/jpeg");

        assertThat(result.ticketNumber().confidence()).isCloseTo(0.88, within(1e-9));
        assertThat(result.grossWeight().confidence()).isCloseTo(0.95, within(1e-9));
        assertThat(result.netWeight().value()).isEqualTo(24840.0);
        assertThat(result.netWeight().confidence()).isCloseTo(0.60, within(1e-9));
        assertThat(result.destination().value()).isEqualTo("Landfill 3");
    }

    @Test
    void genericGivesEveryFieldTheSameConfidence() {
        Map<String, Object> answer = new HashMap<>();
        answer.put("ticket_number", 5512);
        answer.put("gross_weight", "garbled");
        answer.put("material_type", "  ");
        answer.put("po_number", "PO-77");
        stub(answer, "text");

        TicketExtractionResult result = new GenericTicketExtractor(provider).extract(IMAGE, "image/jpeg");

        assertThat(result.ticketNumber().value()).isEqualTo("5512");
        assertThat(result.poNumber().confidence()).isCloseTo(0.85, within(1e-9));
        assertThat(result.grossWeight()).isNull();
        assertThat(result.materialType()).isNull();
        assertThat(result.fieldsByName().values()).extracting(ExtractedField::confidence)
            .allSatisfy(confidence -> assertThat(confidence).isCloseTo(0.85, within(1e-9)));
        assertThat(result.overallConfidence()).isCloseTo(0.85, within(1e-9));
    }

    @Test
    void promptsListEveryFieldOfTheirTable() {
        HandwrittenTicketExtractor handwritten = new HandwrittenTicketExtractor(provider);
        ThermalTicketExtractor thermal = new ThermalTicketExtractor(provider);
        GenericTicketExtractor generic = new GenericTicketExtractor(provider);

        for (AbstractTicketExtractor extractor : new AbstractTicketExtractor[] {handwritten, thermal, generic}) {
            for (TicketField field : extractor.fieldTable().keySet()) {
                assertThat(extractor.prompt()).contains("\"" + field.wireName() + "\"");
            }
            assertThat(extractor.prompt()).endsWith("Return ONLY the JSON object, no additional text.");
        }
        assertThat(handwritten.prompt()).contains("RED INK").contains("\"confidence_notes\"");
        assertThat(handwritten.fieldTable()).doesNotContainKey(TicketField.DESTINATION);
        assertThat(thermal.fieldTable()).hasSize(TicketField.values().length);
        assertThat(generic.fieldTable()).hasSize(TicketField.values().length);
    }

    @Test
    void providerFailurePropagates() {
        when(provider.extractStructured(any(), anyString(), anyString()))
            .thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> new GenericTicketExtractor(provider).extract(IMAGE, "image/jpeg"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("boom");
    }

    private void stub(Map<String, Object> answer, String rawText) {
        when(provider.extractStructured(any(), anyString(), anyString())).thenReturn(answer);
        when(provider.extractText(any(), anyString())).thenReturn(rawText);
    }
}
