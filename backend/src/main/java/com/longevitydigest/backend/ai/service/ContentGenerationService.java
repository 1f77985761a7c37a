package com.longevitydigest.backend.ai.service;

import com.longevitydigest.backend.ai.AiResponseParser;
import com.longevitydigest.backend.ai.GenerationException;
import com.longevitydigest.backend.ai.prompt.ContentPrompts;
import com.longevitydigest.backend.ai.provider.AiProvider;
import com.longevitydigest.backend.ai.provider.AiRequest;
import com.longevitydigest.backend.ai.provider.ProviderRegistry;
import com.longevitydigest.backend.config.PipelineSettings;
import com.longevitydigest.backend.model.dto.Candidate;
import com.longevitydigest.backend.model.dto.Citation;
import com.longevitydigest.backend.model.dto.Draft;
import com.longevitydigest.backend.model.dto.GeneratedContent;
import com.longevitydigest.backend.model.enums.ContentType;
import com.longevitydigest.backend.model.enums.DraftStatus;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates and revises drafts through the primary provider, with exactly one
 * fallback attempt on the highest-priority alternative that has credentials.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentGenerationService {

    private final ProviderRegistry providerRegistry;
    private final AiResponseParser responseParser;
    private final PipelineSettings settings;

    /**
     * Generate a new draft for a candidate
     *
     * @throws GenerationException when both the primary and the fallback fail, or no fallback exists
     * @throws com.longevitydigest.backend.ai.NoProviderConfiguredException when no provider has credentials
     */
    public Draft generate(Candidate candidate, ContentType contentType) {
        log.debug("Generating {} for: {}", contentType.getValue(), candidate.getTitle());

        AiRequest request = AiRequest.builder()
                .operation("generate")
                .systemPrompt(ContentPrompts.systemPrompt(settings.getTargetLanguage()))
                .userPrompt(ContentPrompts.generation(candidate, contentType, settings.getTargetLanguage()))
                .build();

        GeneratedContent content = callWithFallback(request, responseParser::parseContent);

        List<Citation> citations = new ArrayList<>();
        citations.add(Citation.of(candidate));

        return Draft.builder()
                .candidate(candidate)
                .contentType(contentType)
                .title(content.getTitle())
                .summary(content.getSummary())
                .body(content.getBody())
                .originalTitle(candidate.getTitle())
                .originalSummary(candidate.getAbstractText())
                .keyInsights(new ArrayList<>(content.getKeyInsights()))
                .practicalApplications(new ArrayList<>(content.getPracticalApplications()))
                .citations(citations)
                .factCheckNotes(new ArrayList<>())
                .confidenceScore(content.getConfidenceScore())
                .createdAt(LocalDateTime.now())
                .status(DraftStatus.DRAFT)
                .source(candidate.getSourceKind().getTag())
                .build();
    }

    /**
     * Ask for a conservative rewrite of the draft that addresses fact-check issues
     *
     * @throws GenerationException when the revision cannot be produced
     */
    public GeneratedContent revise(Candidate candidate, Draft draft, List<String> issues) {
        AiRequest request = AiRequest.builder()
                .operation("revise")
                .systemPrompt(ContentPrompts.systemPrompt(settings.getTargetLanguage()))
                .userPrompt(ContentPrompts.revision(candidate, draft, issues))
                .build();

        return callWithFallback(request, responseParser::parseRevision);
    }

    private <T> T callWithFallback(AiRequest request, Function<String, T> parser) {
        AiProvider primary = providerRegistry.generationProvider();

        try {
            return parser.apply(primary.complete(request));
        } catch (RuntimeException e) {
            GenerationException failure = asGenerationException(primary, e);

            Optional<AiProvider> fallback = providerRegistry.fallbackFor(primary.getName());
            if (fallback.isEmpty()) {
                log.warn("⚠️ {} failed for {} and no fallback is configured: {}",
                        primary.getName(), request.getOperation(), failure.getMessage());
                throw failure;
            }

            AiProvider alternative = fallback.get();
            log.warn("⚠️ {} failed for {} ({}), falling back to {}",
                    primary.getName(), request.getOperation(), failure.getMessage(), alternative.getName());
            try {
                return parser.apply(alternative.complete(request));
            } catch (RuntimeException fallbackError) {
                throw asGenerationException(alternative, fallbackError);
            }
        }
    }

    private GenerationException asGenerationException(AiProvider provider, RuntimeException e) {
        if (e instanceof GenerationException) {
            return (GenerationException) e;
        }
        return new GenerationException(provider.getName() + " failed: " + e.getMessage(), e);
    }
}
