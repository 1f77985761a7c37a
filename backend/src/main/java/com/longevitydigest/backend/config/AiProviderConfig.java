package com.longevitydigest.backend.config;

import com.longevitydigest.backend.ai.provider.AiProvider;
import com.longevitydigest.backend.ai.provider.ChatModelAiProvider;
import com.longevitydigest.backend.ai.provider.ProviderRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;

/**
 * Builds one chat model per configured provider. All providers speak the
 * OpenAI-compatible chat completions protocol (Moonshot, Gemini and OpenAI do).
 */
@Slf4j
@Configuration
public class AiProviderConfig {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    @Bean
    public ProviderRegistry providerRegistry(PipelineProperties properties) {
        List<AiProvider> providers = new ArrayList<>();

        for (PipelineProperties.Provider provider : properties.getProviders()) {
            if (!provider.hasApiKey()) {
                log.info("🔕 Provider {} has no API key, skipping", provider.getName());
                providers.add(ChatModelAiProvider.unconfigured(provider.getName()));
                continue;
            }
            providers.add(new ChatModelAiProvider(
                    provider.getName(),
                    buildChatModel(provider),
                    provider.getRateLimitAttempts(),
                    provider.getRateLimitBackoff()));
            log.info("🤖 Provider {} ready (model: {})", provider.getName(), provider.getModel());
        }

        ProviderRegistry registry = new ProviderRegistry(
                providers, properties.getGenerationProvider(), properties.getFactCheckProvider());

        if (!registry.hasConfiguredProvider()) {
            log.warn("⚠️ No AI provider has an API key; pipeline runs will be rejected");
        } else {
            log.info("✅ Configured providers (fallback order): {}", registry.configuredProviderNames());
        }
        return registry;
    }

    private ChatModel buildChatModel(PipelineProperties.Provider provider) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(CONNECT_TIMEOUT);
        requestFactory.setReadTimeout(provider.getTimeout());

        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(provider.getBaseUrl())
                .apiKey(provider.getApiKey())
                .completionsPath(provider.getCompletionsPath())
                .restClientBuilder(RestClient.builder().requestFactory(requestFactory))
                .build();

        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(provider.getModel())
                .temperature(provider.getTemperature())
                .maxTokens(provider.getMaxTokens())
                .build();

        // Retries are owned by ChatModelAiProvider
        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(options)
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();
    }
}
