package dev.divertscan.tickets.ticketparser.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;

class VisionProviderSelectorTest {

    @Test
    void prefersConfiguredDefault() {
        VisionProvider anthropic = provider(VisionProviderType.ANTHROPIC);
        VisionProvider openai = provider(VisionProviderType.OPENAI);
        VisionProviderSelector selector = VisionProviderSelector.builder(VisionProviderType.OPENAI)
            .register(VisionProviderType.ANTHROPIC, () -> anthropic)
            .register(VisionProviderType.OPENAI, () -> openai)
            .build();

        assertThat(selector.select()).isSameAs(openai);
    }

    @Test
    void fallsBackToAnyConfiguredVendorWhenDefaultHasNoKey() {
        VisionProvider openai = provider(VisionProviderType.OPENAI);
        VisionProviderSelector selector = VisionProviderSelector.builder(VisionProviderType.ANTHROPIC)
            .register(VisionProviderType.OPENAI, () -> openai)
            .build();

        assertThat(selector.preferred()).isEqualTo(VisionProviderType.ANTHROPIC);
        assertThat(selector.resolveType()).isEqualTo(VisionProviderType.OPENAI);
        assertThat(selector.select()).isSameAs(openai);
    }

    @Test
    void unknownDefaultUsesFirstVendorInDeclarationOrder() {
        VisionProviderSelector selector = VisionProviderSelector.builder(null)
            .register(VisionProviderType.OPENAI, () -> provider(VisionProviderType.OPENAI))
            .register(VisionProviderType.ANTHROPIC, () -> provider(VisionProviderType.ANTHROPIC))
            .build();

        assertThat(selector.resolveType()).isEqualTo(VisionProviderType.ANTHROPIC);
    }

    @Test
    void failsWhenNoVendorIsConfigured() {
        VisionProviderSelector selector = VisionProviderSelector.builder(VisionProviderType.ANTHROPIC).build();

        assertThat(selector.configuredTypes()).isEmpty();
        assertThatThrownBy(selector::select)
            .isInstanceOf(VisionProviderException.class)
            .hasMessageContaining("No vision provider configured");
    }

    @Test
    void explicitVendorWithoutKeyIsRejected() {
        VisionProviderSelector selector = VisionProviderSelector.builder(VisionProviderType.ANTHROPIC)
            .register(VisionProviderType.ANTHROPIC, () -> provider(VisionProviderType.ANTHROPIC))
            .build();

        assertThatThrownBy(() -> selector.create(VisionProviderType.OPENAI))
            .isInstanceOf(VisionProviderException.class)
            .hasMessageContaining("openai");
    }

    @Test
    void parsesVendorIds() {
        assertThat(VisionProviderType.fromId(" OpenAI ")).contains(VisionProviderType.OPENAI);
        assertThat(VisionProviderType.fromId("gemini")).isEmpty();
        assertThat(VisionProviderType.fromId(null)).isEmpty();
    }

    private static VisionProvider provider(VisionProviderType type) {
        VisionProvider provider = mock(VisionProvider.class);
        when(provider.type()).thenReturn(type);
        return provider;
    }
}
