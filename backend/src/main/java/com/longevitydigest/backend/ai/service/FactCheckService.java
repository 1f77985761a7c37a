package com.longevitydigest.backend.ai.service;

import com.longevitydigest.backend.ai.AiResponseParser;
import com.longevitydigest.backend.ai.prompt.ContentPrompts;
import com.longevitydigest.backend.ai.provider.AiProvider;
import com.longevitydigest.backend.ai.provider.AiRequest;
import com.longevitydigest.backend.ai.provider.ProviderRegistry;
import com.longevitydigest.backend.model.dto.Draft;
import com.longevitydigest.backend.model.dto.FactCheckVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Validates a draft against its candidate's abstract.
 * <p>
 * Never throws: any provider or parsing failure becomes a "not safe to publish"
 * verdict carrying one issue that describes the failure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FactCheckService {

    private static final double FACT_CHECK_TEMPERATURE = 0.3;

    private final ProviderRegistry providerRegistry;
    private final AiResponseParser responseParser;

    public FactCheckVerdict check(Draft draft) {
        String providerName = "unknown";
        try {
            AiProvider provider = providerRegistry.factCheckProvider();
            providerName = provider.getName();

            AiRequest request = AiRequest.builder()
                    .operation("fact-check")
                    .userPrompt(ContentPrompts.factCheck(draft.getCandidate(), draft))
                    .temperature(FACT_CHECK_TEMPERATURE)
                    .build();

            FactCheckVerdict verdict = responseParser.parseVerdict(provider.complete(request));
            log.debug("Fact check by {}: safe={}, accuracy={}, issues={}",
                    providerName, verdict.isSafeToPublish(), verdict.getAccuracyScore(), verdict.getIssues().size());
            return verdict;

        } catch (Exception e) {
            log.warn("⚠️ Fact check failed ({}): {}", providerName, e.getMessage());
            return FactCheckVerdict.failure(providerName, e.getMessage());
        }
    }
}
