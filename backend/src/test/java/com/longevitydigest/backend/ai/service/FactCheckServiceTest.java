package com.longevitydigest.backend.ai.service;

import static com.longevitydigest.backend.support.Fixtures.candidate;
import static com.longevitydigest.backend.support.Fixtures.verdictJson;
import static org.assertj.core.api.Assertions.assertThat;

import com.longevitydigest.backend.ai.AiResponseParser;
import com.longevitydigest.backend.ai.provider.ProviderRegistry;
import com.longevitydigest.backend.model.dto.Draft;
import com.longevitydigest.backend.model.dto.FactCheckVerdict;
import com.longevitydigest.backend.support.ScriptedAiProvider;
import java.util.List;
import org.junit.jupiter.api.Test;

class FactCheckServiceTest {

    private final ScriptedAiProvider kimi = new ScriptedAiProvider("kimi");
    private final ScriptedAiProvider gemini = new ScriptedAiProvider("gemini");
    private final FactCheckService service = new FactCheckService(
            new ProviderRegistry(List.of(kimi, gemini), "gemini", "kimi"), new AiResponseParser());

    private final Draft draft = Draft.builder()
            .candidate(candidate("10.1/x", "Original title", "pubmed"))
            .body("Generated body")
            .build();

    @Test
    void check_shouldUseFactCheckProviderAtLowTemperature() {
        kimi.reply(verdictJson(true));

        FactCheckVerdict verdict = service.check(draft);

        assertThat(verdict.isSafeToPublish()).isTrue();
        assertThat(kimi.getRequests()).singleElement().satisfies(request -> {
            assertThat(request.getTemperature()).isEqualTo(0.3);
            assertThat(request.getUserPrompt()).contains("Original title").contains("Generated body");
        });
        assertThat(gemini.getRequests()).isEmpty();
    }

    @Test
    void check_shouldDowngradeProviderFailureToUnsafeVerdict() {
        kimi.fail("connection reset");

        FactCheckVerdict verdict = service.check(draft);

        assertThat(verdict.isSafeToPublish()).isFalse();
        assertThat(verdict.getAccuracyScore()).isZero();
        assertThat(verdict.getIssues()).singleElement().asString()
                .startsWith("Fact check failed (kimi)")
                .contains("connection reset");
    }

    @Test
    void check_shouldDowngradeUnparseableResponse() {
        kimi.reply("Looks fine to me!");

        FactCheckVerdict verdict = service.check(draft);

        assertThat(verdict.isSafeToPublish()).isFalse();
        assertThat(verdict.getIssues()).hasSize(1);
    }

    @Test
    void check_shouldReturnUnsafeVerdict_whenNoProviderConfigured() {
        FactCheckService unconfigured = new FactCheckService(
                new ProviderRegistry(List.of(new ScriptedAiProvider("kimi", false)), null, "kimi"),
                new AiResponseParser());

        FactCheckVerdict verdict = unconfigured.check(draft);

        assertThat(verdict.isSafeToPublish()).isFalse();
        assertThat(verdict.getIssues()).hasSize(1);
    }
}
