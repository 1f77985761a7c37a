package com.longevitydigest.backend.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum DraftStatus {
    DRAFT("draft"),
    READY_FOR_REVIEW("ready_for_review"),
    NEEDS_REVISION("needs_revision");

    @JsonValue
    private final String value;

    DraftStatus(String value) {
        this.value = value;
    }

    @JsonCreator
    public static DraftStatus fromValue(String value) {
        for (DraftStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown draft status: " + value);
    }
}
