package com.longevitydigest.backend.ai.provider;

import com.longevitydigest.backend.ai.GenerationException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;

/**
 * {@link AiProvider} backed by a Spring AI {@link ChatModel}.
 * <p>
 * Rate-limited calls (HTTP 429) are retried up to {@code rateLimitAttempts} times,
 * waiting {@code attempt x backoffUnit} between attempts. Other failures are not retried.
 */
@Slf4j
public class ChatModelAiProvider implements AiProvider {

    private final String name;
    private final ChatModel chatModel;
    private final int rateLimitAttempts;
    private final Duration backoffUnit;

    public ChatModelAiProvider(String name, ChatModel chatModel, int rateLimitAttempts, Duration backoffUnit) {
        this.name = name;
        this.chatModel = chatModel;
        this.rateLimitAttempts = Math.max(1, rateLimitAttempts);
        this.backoffUnit = backoffUnit != null ? backoffUnit : Duration.ZERO;
    }

    /**
     * Placeholder for a provider listed in configuration without an API key
     */
    public static ChatModelAiProvider unconfigured(String name) {
        return new ChatModelAiProvider(name, null, 1, Duration.ZERO);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isConfigured() {
        return chatModel != null;
    }

    @Override
    public String complete(AiRequest request) {
        if (chatModel == null) {
            throw new GenerationException("Provider " + name + " has no API key configured");
        }

        Prompt prompt = buildPrompt(request);

        for (int attempt = 1; ; attempt++) {
            String text;
            try {
                ChatResponse response = chatModel.call(prompt);
                text = response.getResult().getOutput().getText();
            } catch (Exception e) {
                if (isRateLimited(e) && attempt < rateLimitAttempts) {
                    Duration wait = backoffUnit.multipliedBy(attempt);
                    log.warn("⏳ {} rate limited during {}, retrying in {}s ({}/{})",
                            name, request.getOperation(), wait.toSeconds(), attempt, rateLimitAttempts);
                    pause(wait);
                    continue;
                }
                throw new GenerationException(name + " call failed: " + e.getMessage(), e);
            }

            if (text == null || text.isBlank()) {
                throw new GenerationException(name + " returned empty response");
            }
            log.debug("🤖 {} response for {}: {}", name, request.getOperation(),
                    text.substring(0, Math.min(200, text.length())));
            return text;
        }
    }

    private Prompt buildPrompt(AiRequest request) {
        List<Message> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(new SystemMessage(request.getSystemPrompt()));
        }
        messages.add(new UserMessage(request.getUserPrompt()));

        if (request.getTemperature() != null) {
            return new Prompt(messages, ChatOptions.builder().temperature(request.getTemperature()).build());
        }
        return new Prompt(messages);
    }

    static boolean isRateLimited(Throwable error) {
        Throwable current = error;
        while (current != null) {
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("429") || lower.contains("rate limit") || lower.contains("resource_exhausted")) {
                    return true;
                }
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    private void pause(Duration wait) {
        if (wait.isZero() || wait.isNegative()) {
            return;
        }
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException(name + " retry interrupted", e);
        }
    }
}
