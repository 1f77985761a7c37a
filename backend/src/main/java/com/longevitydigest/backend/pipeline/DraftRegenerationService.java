package com.longevitydigest.backend.pipeline;

import com.longevitydigest.backend.ai.GenerationException;
import com.longevitydigest.backend.ai.NoProviderConfiguredException;
import com.longevitydigest.backend.ai.provider.ProviderRegistry;
import com.longevitydigest.backend.ai.service.ContentGenerationService;
import com.longevitydigest.backend.ai.service.FactCheckLoop;
import com.longevitydigest.backend.config.PipelineSettings;
import com.longevitydigest.backend.model.dto.Draft;
import com.longevitydigest.backend.model.enums.ContentType;
import com.longevitydigest.backend.model.enums.DraftStatus;
import com.longevitydigest.backend.storage.DraftStore;
import com.longevitydigest.backend.storage.StoredDraft;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Regenerates stored drafts that ended in needs_revision and rewrites their files.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftRegenerationService {

    private final DraftStore draftStore;
    private final ContentGenerationService generationService;
    private final FactCheckLoop factCheckLoop;
    private final ProviderRegistry providerRegistry;
    private final PipelineSettings settings;

    public RegenerationReport regenerateNeedsRevision() {
        if (!providerRegistry.hasConfiguredProvider()) {
            throw new NoProviderConfiguredException("No AI provider configured; nothing can be regenerated");
        }

        List<StoredDraft> targets = draftStore.listByStatus(DraftStatus.NEEDS_REVISION);
        RegenerationReport report = new RegenerationReport();
        if (targets.isEmpty()) {
            log.info("✅ No drafts need regeneration");
            return report;
        }

        log.info("🔄 Regenerating {} drafts", targets.size());

        for (int i = 0; i < targets.size(); i++) {
            StoredDraft stored = targets.get(i);
            Draft previous = stored.getDraft();
            report.setAttempted(report.getAttempted() + 1);

            log.info("📝 [{}/{}] {}", i + 1, targets.size(), stored.getFileName());

            ContentType contentType = previous.getContentType() != null ? previous.getContentType() : settings.getContentType();
            Draft regenerated;
            try {
                regenerated = generationService.generate(previous.getCandidate(), contentType);
            } catch (GenerationException e) {
                report.setFailed(report.getFailed() + 1);
                log.warn("   ❌ Still failing, file left unchanged: {}", e.getMessage());
                pauseBetween(i, targets.size());
                continue;
            }

            regenerated.setCreatedAt(previous.getCreatedAt() != null ? previous.getCreatedAt() : regenerated.getCreatedAt());
            Draft reviewed = factCheckLoop.review(regenerated, settings.getMaxRevisions());

            draftStore.write(stored.getPath(), reviewed);
            report.getUpdatedFiles().add(stored.getFileName());
            if (reviewed.isReady()) {
                report.setNowReady(report.getNowReady() + 1);
            } else {
                report.setStillNeedsRevision(report.getStillNeedsRevision() + 1);
            }
            log.info("   💾 Updated: {} ({})", stored.getFileName(), reviewed.getStatus().getValue());

            pauseBetween(i, targets.size());
        }

        log.info("✅ Regeneration finished: {} ready, {} still need revision, {} failed",
                report.getNowReady(), report.getStillNeedsRevision(), report.getFailed());
        return report;
    }

    private void pauseBetween(int index, int total) {
        Duration coolDown = settings.getCoolDown();
        if (index + 1 >= total || coolDown.isZero() || coolDown.isNegative()) {
            return;
        }
        try {
            Thread.sleep(coolDown.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Regeneration interrupted", e);
        }
    }
}
