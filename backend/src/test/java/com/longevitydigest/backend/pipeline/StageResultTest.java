package com.longevitydigest.backend.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class StageResultTest {

    @Test
    void shouldExposeKindValueAndReason() {
        StageResult<String> ok = StageResult.ok("draft");
        StageResult<String> skip = StageResult.skip("generation failed");
        StageResult<String> fatal = StageResult.fatal("no provider");

        assertThat(ok.isOk()).isTrue();
        assertThat(ok.getValue()).isEqualTo("draft");
        assertThat(skip.isSkip()).isTrue();
        assertThat(skip.getValue()).isNull();
        assertThat(skip.getReason()).isEqualTo("generation failed");
        assertThat(fatal.getKind()).isEqualTo(StageResult.Kind.FATAL);
        assertThat(fatal.toString()).isEqualTo("FATAL(no provider)");
    }
}
