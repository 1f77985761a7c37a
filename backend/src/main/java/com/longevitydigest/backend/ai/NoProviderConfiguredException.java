package com.longevitydigest.backend.ai;

/**
 * No AI provider has credentials; a run cannot start.
 */
public class NoProviderConfiguredException extends RuntimeException {

    public NoProviderConfiguredException(String message) {
        super(message);
    }
}
