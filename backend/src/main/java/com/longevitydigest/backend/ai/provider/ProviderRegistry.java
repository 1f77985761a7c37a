package com.longevitydigest.backend.ai.provider;

import com.longevitydigest.backend.ai.NoProviderConfiguredException;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Priority-ordered set of AI providers and the rules for choosing among them.
 */
@Slf4j
public class ProviderRegistry {

    private final List<AiProvider> providers;
    private final String preferredGeneration;
    private final String preferredFactCheck;

    public ProviderRegistry(List<AiProvider> providers, String preferredGeneration, String preferredFactCheck) {
        this.providers = List.copyOf(providers);
        this.preferredGeneration = preferredGeneration;
        this.preferredFactCheck = preferredFactCheck;
    }

    public boolean hasConfiguredProvider() {
        return providers.stream().anyMatch(AiProvider::isConfigured);
    }

    /**
     * Preferred generation provider when it has credentials, otherwise the first configured one
     */
    public AiProvider generationProvider() {
        return preferredOrFirstConfigured(preferredGeneration);
    }

    /**
     * Preferred fact-check provider when it has credentials, otherwise the first configured one
     */
    public AiProvider factCheckProvider() {
        return preferredOrFirstConfigured(preferredFactCheck);
    }

    /**
     * Highest-priority configured provider other than the one that just failed
     */
    public Optional<AiProvider> fallbackFor(String failedProvider) {
        return providers.stream()
                .filter(AiProvider::isConfigured)
                .filter(p -> !p.getName().equalsIgnoreCase(failedProvider))
                .findFirst();
    }

    public List<String> configuredProviderNames() {
        return providers.stream()
                .filter(AiProvider::isConfigured)
                .map(AiProvider::getName)
                .toList();
    }

    private AiProvider preferredOrFirstConfigured(String preferred) {
        if (preferred != null) {
            for (AiProvider provider : providers) {
                if (provider.getName().equalsIgnoreCase(preferred) && provider.isConfigured()) {
                    return provider;
                }
            }
        }
        return providers.stream()
                .filter(AiProvider::isConfigured)
                .findFirst()
                .orElseThrow(() -> new NoProviderConfiguredException(
                        "No AI provider configured; set at least one of the provider API keys"));
    }
}
