package com.longevitydigest.backend.pipeline;

import lombok.Getter;

/**
 * Outcome of one pipeline stage for one candidate.
 * <p>
 * {@code SKIP} means the candidate is dropped and the run continues; {@code FATAL}
 * means the run cannot continue at all.
 */
@Getter
public final class StageResult<T> {

    public enum Kind { OK, SKIP, FATAL }

    private final Kind kind;
    private final T value;
    private final String reason;

    private StageResult(Kind kind, T value, String reason) {
        this.kind = kind;
        this.value = value;
        this.reason = reason;
    }

    public static <T> StageResult<T> ok(T value) {
        return new StageResult<>(Kind.OK, value, null);
    }

    public static <T> StageResult<T> skip(String reason) {
        return new StageResult<>(Kind.SKIP, null, reason);
    }

    public static <T> StageResult<T> fatal(String reason) {
        return new StageResult<>(Kind.FATAL, null, reason);
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }

    public boolean isSkip() {
        return kind == Kind.SKIP;
    }

    public boolean isFatal() {
        return kind == Kind.FATAL;
    }

    @Override
    public String toString() {
        return isOk() ? "OK(" + value + ")" : kind + "(" + reason + ")";
    }
}
