package com.longevitydigest.backend.ai;

/**
 * A generation or revision call produced no usable content.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
