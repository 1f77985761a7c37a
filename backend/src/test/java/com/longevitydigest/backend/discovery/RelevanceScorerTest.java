package com.longevitydigest.backend.discovery;

import static com.longevitydigest.backend.support.Fixtures.candidate;
import static org.assertj.core.api.Assertions.assertThat;

import com.longevitydigest.backend.model.dto.Candidate;
import java.util.List;
import org.junit.jupiter.api.Test;

class RelevanceScorerTest {

    private final RelevanceScorer scorer = new RelevanceScorer(
            List.of("senolytics", "cellular senescence", "healthspan"),
            List.of("Nature", "Cell Metabolism"));

    @Test
    void score_shouldAddVenueKeywordsAndLength() {
        Candidate candidate = candidate("10.1/n", "Senolytics reverse cellular senescence in mice", "pubmed");
        candidate.setVenue("Nature");
        candidate.setAbstractText("x".repeat(600));

        assertThat(scorer.score(candidate)).isEqualTo(6.0);
    }

    @Test
    void score_shouldBeZero_whenNothingMatches() {
        Candidate candidate = candidate("10.1/z", "Unrelated topic", "pubmed");
        candidate.setVenue("Regional Bulletin");

        assertThat(scorer.score(candidate)).isZero();
    }

    @Test
    void score_shouldAddSourceBonuses() {
        Candidate trial = candidate("NCT1", "[Clinical Trial] Study", "clinical_trial");
        trial.setVenue("ClinicalTrials.gov (PHASE2)");
        Candidate preprint = candidate("10.1/p", "Preprint study", "biorxiv", "preprint");
        preprint.setVenue("biorxiv (preprint)");

        assertThat(scorer.score(trial)).isEqualTo(2.0);
        assertThat(scorer.score(preprint)).isEqualTo(0.5);
    }

    @Test
    void score_shouldCountVenueBonusOnce_whenSeveralVenuesMatch() {
        Candidate candidate = candidate("10.1/c", "Plain title", "pubmed");
        candidate.setVenue("Nature Cell Metabolism");

        assertThat(scorer.score(candidate)).isEqualTo(3.0);
    }

    @Test
    void score_shouldBePure() {
        Candidate candidate = candidate("10.1/h", "Healthspan and senolytics", "pubmed");
        candidate.setVenue("Cell Metabolism");

        double first = scorer.score(candidate);
        double second = scorer.score(candidate);

        assertThat(second).isEqualTo(first);
        assertThat(candidate.getRelevanceScore()).isZero();
    }

    @Test
    void score_shouldNeverDecrease_whenPriorityVenueIsAdded() {
        Candidate candidate = candidate("10.1/m", "Healthspan study", "pubmed");
        candidate.setVenue("Some Journal");
        double before = scorer.score(candidate);

        candidate.setVenue("Some Journal / Nature");

        assertThat(scorer.score(candidate)).isGreaterThanOrEqualTo(before);
    }

    @Test
    void scoreAll_shouldStoreScoresOnCandidates() {
        Candidate candidate = candidate("10.1/s", "Senolytics", "pubmed");

        scorer.scoreAll(List.of(candidate));

        assertThat(candidate.getRelevanceScore()).isEqualTo(1.0);
    }
}
