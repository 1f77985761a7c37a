package com.longevitydigest.backend.ai.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.longevitydigest.backend.ai.NoProviderConfiguredException;
import com.longevitydigest.backend.support.ScriptedAiProvider;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProviderRegistryTest {

    private final ScriptedAiProvider kimi = new ScriptedAiProvider("kimi");
    private final ScriptedAiProvider gemini = new ScriptedAiProvider("gemini");
    private final ScriptedAiProvider openai = new ScriptedAiProvider("openai", false);

    @Test
    void generationProvider_shouldPreferConfiguredChoice() {
        ProviderRegistry registry = new ProviderRegistry(List.of(kimi, gemini, openai), "gemini", "kimi");

        assertThat(registry.generationProvider()).isSameAs(gemini);
        assertThat(registry.factCheckProvider()).isSameAs(kimi);
    }

    @Test
    void generationProvider_shouldFallBackToFirstConfigured_whenPreferredHasNoKey() {
        ProviderRegistry registry = new ProviderRegistry(List.of(kimi, gemini, openai), "openai", "openai");

        assertThat(registry.generationProvider()).isSameAs(kimi);
        assertThat(registry.factCheckProvider()).isSameAs(kimi);
    }

    @Test
    void fallbackFor_shouldReturnHighestPriorityOtherConfiguredProvider() {
        ProviderRegistry registry = new ProviderRegistry(List.of(kimi, gemini, openai), "gemini", "kimi");

        assertThat(registry.fallbackFor("gemini")).contains(kimi);
        assertThat(registry.fallbackFor("kimi")).contains(gemini);
        assertThat(registry.configuredProviderNames()).containsExactly("kimi", "gemini");
    }

    @Test
    void fallbackFor_shouldBeEmpty_whenOnlyFailedProviderIsConfigured() {
        ProviderRegistry registry = new ProviderRegistry(List.of(gemini, openai), "gemini", "gemini");

        assertThat(registry.fallbackFor("gemini")).isEmpty();
    }

    @Test
    void generationProvider_shouldThrow_whenNothingConfigured() {
        ProviderRegistry registry = new ProviderRegistry(
                List.of(new ScriptedAiProvider("kimi", false), openai), "gemini", "kimi");

        assertThat(registry.hasConfiguredProvider()).isFalse();
        assertThat(registry.configuredProviderNames()).isEmpty();
        assertThatThrownBy(registry::generationProvider).isInstanceOf(NoProviderConfiguredException.class);
    }
}
