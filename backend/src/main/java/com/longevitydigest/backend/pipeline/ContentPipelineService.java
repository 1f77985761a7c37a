package com.longevitydigest.backend.pipeline;

import com.longevitydigest.backend.ai.GenerationException;
import com.longevitydigest.backend.ai.NoProviderConfiguredException;
import com.longevitydigest.backend.ai.provider.ProviderRegistry;
import com.longevitydigest.backend.ai.service.ContentGenerationService;
import com.longevitydigest.backend.ai.service.FactCheckLoop;
import com.longevitydigest.backend.config.PipelineSettings;
import com.longevitydigest.backend.discovery.DiversitySelector;
import com.longevitydigest.backend.discovery.PaperDiscoveryService;
import com.longevitydigest.backend.model.dto.Candidate;
import com.longevitydigest.backend.model.dto.Draft;
import com.longevitydigest.backend.model.enums.ContentType;
import com.longevitydigest.backend.model.enums.DraftStatus;
import com.longevitydigest.backend.storage.DraftStorageException;
import com.longevitydigest.backend.storage.DraftStore;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the content pipeline: discovery, then generation and fact checking one
 * candidate at a time until enough drafts are ready or the processing cap is hit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentPipelineService {

    private final PaperDiscoveryService discoveryService;
    private final ContentGenerationService generationService;
    private final FactCheckLoop factCheckLoop;
    private final ProviderRegistry providerRegistry;
    private final DraftStore draftStore;
    private final PipelineSettings settings;

    /**
     * Full weekly run
     *
     * @throws NoProviderConfiguredException before any discovery when no provider has credentials
     */
    public PipelineRunReport runWeeklyPipeline(boolean includePreprints, boolean includeTrials) {
        StageResult<Void> precondition = checkProviders();
        if (precondition.isFatal()) {
            log.error("❌ Pipeline not started: {}", precondition.getReason());
            throw new NoProviderConfiguredException(precondition.getReason());
        }

        log.info("🌟 ===== CONTENT PIPELINE STARTED =====");
        log.info("📡 Sources: PubMed{}{}",
                includePreprints ? " + bioRxiv + medRxiv" : "",
                includeTrials ? " + ClinicalTrials.gov" : "");

        List<Candidate> candidates = discoveryService.discoverWeeklyCandidates(includePreprints, includeTrials);
        return processCandidates(candidates, settings);
    }

    public PipelineRunReport processCandidates(List<Candidate> candidates) {
        return processCandidates(candidates, settings);
    }

    /**
     * Run generation and the fact-check loop over an ordered candidate list
     *
     * @throws NoProviderConfiguredException when no provider has credentials
     */
    public PipelineRunReport processCandidates(List<Candidate> candidates, PipelineSettings runSettings) {
        StageResult<Void> precondition = checkProviders();
        if (precondition.isFatal()) {
            throw new NoProviderConfiguredException(precondition.getReason());
        }

        PipelineRunReport report = PipelineRunReport.builder()
                .candidatesSelected(candidates.size())
                .selectedBySource(DiversitySelector.countBySource(candidates))
                .startedAt(LocalDateTime.now())
                .build();

        for (Candidate candidate : candidates) {
            if (report.getProcessed() >= runSettings.getMaxPapers()
                    || report.getReady() >= runSettings.getTargetReady()) {
                break;
            }
            report.setProcessed(report.getProcessed() + 1);

            log.info("📝 Generating content ({}/{}): {}", report.getReady() + 1, runSettings.getTargetReady(),
                    abbreviate(candidate.getTitle(), 50));

            StageResult<Draft> generated = generate(candidate, runSettings.getContentType());
            if (!generated.isOk()) {
                report.setSkipped(report.getSkipped() + 1);
                log.warn("   ⚠️ Generation failed, skipping: {}", generated.getReason());
                continue;
            }

            Draft draft = factCheckLoop.review(generated.getValue(), runSettings.getMaxRevisions());
            report.getDrafts().add(draft);
            if (draft.getStatus() == DraftStatus.READY_FOR_REVIEW) {
                report.setReady(report.getReady() + 1);
            } else {
                report.setNeedsRevision(report.getNeedsRevision() + 1);
            }

            if (runSettings.isPersistDrafts()) {
                persist(draft, report);
            }

            if (report.getReady() < runSettings.getTargetReady() && !coolDown(runSettings.getCoolDown())) {
                log.warn("⚠️ Pipeline interrupted during cool-down, stopping early");
                break;
            }
        }

        report.setFinishedAt(LocalDateTime.now());
        log.info("✅ Pipeline finished: {} processed, {} ready, {} need revision, {} skipped",
                report.getProcessed(), report.getReady(), report.getNeedsRevision(), report.getSkipped());
        return report;
    }

    /**
     * Generate and fact check one candidate outside a run
     *
     * @return OK with the finished draft, or SKIP when generation failed
     * @throws NoProviderConfiguredException when no provider has credentials
     */
    public StageResult<Draft> processSingle(Candidate candidate, ContentType contentType) {
        StageResult<Void> precondition = checkProviders();
        if (precondition.isFatal()) {
            throw new NoProviderConfiguredException(precondition.getReason());
        }

        StageResult<Draft> generated = generate(candidate, contentType);
        if (!generated.isOk()) {
            return generated;
        }
        return StageResult.ok(factCheckLoop.review(generated.getValue(), settings.getMaxRevisions()));
    }

    StageResult<Void> checkProviders() {
        if (!providerRegistry.hasConfiguredProvider()) {
            return StageResult.fatal("No AI provider configured; set at least one of the provider API keys");
        }
        return StageResult.ok(null);
    }

    private StageResult<Draft> generate(Candidate candidate, ContentType contentType) {
        try {
            return StageResult.ok(generationService.generate(candidate, contentType));
        } catch (GenerationException e) {
            return StageResult.skip(e.getMessage());
        }
    }

    private void persist(Draft draft, PipelineRunReport report) {
        try {
            Path file = draftStore.save(draft);
            report.getSavedFiles().add(file.getFileName().toString());
        } catch (DraftStorageException e) {
            log.error("❌ Could not save draft for {}: {}", draft.getCandidate().getDedupKey(), e.getMessage());
        }
    }

    /**
     * @return false when interrupted
     */
    boolean coolDown(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String abbreviate(String text, int max) {
        if (text == null) return "";
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
