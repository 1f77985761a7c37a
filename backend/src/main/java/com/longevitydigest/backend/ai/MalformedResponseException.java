package com.longevitydigest.backend.ai;

/**
 * Provider answered, but the payload did not parse into the expected structure.
 */
public class MalformedResponseException extends GenerationException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
