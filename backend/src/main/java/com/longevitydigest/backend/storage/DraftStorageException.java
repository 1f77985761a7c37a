package com.longevitydigest.backend.storage;

public class DraftStorageException extends RuntimeException {

    public DraftStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
