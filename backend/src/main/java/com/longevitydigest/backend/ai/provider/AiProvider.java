package com.longevitydigest.backend.ai.provider;

/**
 * A text-completion service used for generation, revision and fact-checking.
 */
public interface AiProvider {

    String getName();

    /**
     * Whether credentials for this provider are present
     */
    boolean isConfigured();

    /**
     * Send a request and return the raw response text.
     *
     * @throws com.longevitydigest.backend.ai.GenerationException when the call fails,
     *         times out or returns an empty response
     */
    String complete(AiRequest request);
}
