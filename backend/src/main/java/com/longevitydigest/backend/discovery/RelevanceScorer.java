package com.longevitydigest.backend.discovery;

import com.longevitydigest.backend.model.dto.Candidate;
import com.longevitydigest.backend.model.enums.SourceKind;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic relevance score built from fixed bonuses. Scores are never negative.
 */
public class RelevanceScorer {

    static final double TRIAL_BONUS = 2.0;
    static final double PREPRINT_BONUS = 0.5;
    static final double PRIORITY_VENUE_BONUS = 3.0;
    static final double KEYWORD_BONUS = 1.0;
    static final double LONG_ABSTRACT_BONUS = 1.0;
    static final int LONG_ABSTRACT_LENGTH = 500;

    private final List<String> keywords;
    private final List<String> priorityVenues;

    public RelevanceScorer(List<String> keywords, List<String> priorityVenues) {
        this.keywords = lowerCase(keywords);
        this.priorityVenues = lowerCase(priorityVenues);
    }

    public double score(Candidate candidate) {
        double score = 0.0;

        if (candidate.hasTag(SourceKind.CLINICAL_TRIAL.getTag())) {
            score += TRIAL_BONUS;
        }
        if (candidate.hasTag(SourceKind.PREPRINT_TAG)) {
            score += PREPRINT_BONUS;
        }

        String venue = lower(candidate.getVenue());
        if (priorityVenues.stream().anyMatch(venue::contains)) {
            score += PRIORITY_VENUE_BONUS;
        }

        String title = lower(candidate.getTitle());
        for (String keyword : keywords) {
            if (title.contains(keyword)) {
                score += KEYWORD_BONUS;
            }
        }

        if (candidate.getAbstractText() != null && candidate.getAbstractText().length() > LONG_ABSTRACT_LENGTH) {
            score += LONG_ABSTRACT_BONUS;
        }

        return score;
    }

    /**
     * Store the score on each candidate and return the same list
     */
    public List<Candidate> scoreAll(List<Candidate> candidates) {
        for (Candidate candidate : candidates) {
            candidate.setRelevanceScore(score(candidate));
        }
        return candidates;
    }

    private static List<String> lowerCase(List<String> values) {
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(RelevanceScorer::lower)
                .toList();
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
