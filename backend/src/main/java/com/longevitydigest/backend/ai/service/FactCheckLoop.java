package com.longevitydigest.backend.ai.service;

import com.longevitydigest.backend.model.dto.Draft;
import com.longevitydigest.backend.model.dto.FactCheckVerdict;
import com.longevitydigest.backend.model.dto.GeneratedContent;
import com.longevitydigest.backend.model.enums.DraftStatus;
import java.util.ArrayList;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fact-check and auto-revision cycle for one draft.
 * <p>
 * Checking ends in READY_FOR_REVIEW when the verdict is safe to publish. Otherwise the
 * draft is revised and checked again while the revision budget lasts; an exhausted
 * budget or a failed revision ends in NEEDS_REVISION. The fact-check provider is
 * therefore called at most {@code maxRevisions + 1} times.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FactCheckLoop {

    private final FactCheckService factCheckService;
    private final ContentGenerationService generationService;

    /**
     * Drive the draft to a terminal status and return it
     */
    public Draft review(Draft draft, int maxRevisions) {
        int revisions = 0;

        while (true) {
            log.info("   ✓ Fact checking...");
            FactCheckVerdict verdict = factCheckService.check(draft);
            draft.setFactCheckNotes(new ArrayList<>(verdict.getIssues()));

            if (verdict.isSafeToPublish()) {
                draft.setStatus(DraftStatus.READY_FOR_REVIEW);
                log.info("   ✅ Ready for review (accuracy: {}%)", Math.round(verdict.getAccuracyScore() * 100));
                return draft;
            }

            if (revisions >= maxRevisions) {
                return markNeedsRevision(draft);
            }

            revisions++;
            log.info("   🔁 Auto revision attempt ({}/{})...", revisions, maxRevisions);
            try {
                GeneratedContent revision = generationService.revise(
                        draft.getCandidate(), draft, draft.getFactCheckNotes());
                draft.applyRevision(revision);
            } catch (RuntimeException e) {
                log.warn("   ⚠️ Auto revision failed: {}", e.getMessage());
                return markNeedsRevision(draft);
            }
        }
    }

    private Draft markNeedsRevision(Draft draft) {
        draft.setStatus(DraftStatus.NEEDS_REVISION);
        if (draft.getFactCheckNotes().isEmpty()) {
            log.info("   ⚠️ Needs revision: fact check failed");
        } else {
            log.info("   ⚠️ Needs revision: {}", String.join(", ",
                    draft.getFactCheckNotes().subList(0, Math.min(2, draft.getFactCheckNotes().size()))));
        }
        return draft;
    }
}
