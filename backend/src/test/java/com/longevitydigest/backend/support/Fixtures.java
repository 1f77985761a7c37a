package com.longevitydigest.backend.support;

import com.longevitydigest.backend.model.dto.Candidate;
import com.longevitydigest.backend.model.enums.SourceKind;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Candidate and response builders shared by tests
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static Candidate candidate(String identifier, String title, String... tags) {
        return Candidate.builder()
                .title(title)
                .authors(new ArrayList<>(List.of("Kim Minji", "Lee Joon")))
                .abstractText("Abstract of " + title)
                .venue("Journal of Testing")
                .identifier(identifier)
                .publishedDate("2025")
                .url("https://example.org/" + identifier)
                .tags(new LinkedHashSet<>(List.of(tags)))
                .build();
    }

    public static Candidate pubmed(String identifier, double score) {
        return scored(candidate(identifier, "PubMed paper " + identifier, SourceKind.PUBMED.getTag()), score);
    }

    public static Candidate trial(String identifier, double score) {
        return scored(candidate(identifier, "[Clinical Trial] " + identifier, SourceKind.CLINICAL_TRIAL.getTag()), score);
    }

    public static Candidate preprint(SourceKind server, String identifier, double score) {
        return scored(candidate(identifier, server.getDisplayName() + " preprint " + identifier,
                server.getTag(), SourceKind.PREPRINT_TAG), score);
    }

    public static String contentJson(String title) {
        return """
                {
                  "title": "%s",
                  "summary": "Short summary",
                  "body": "Body text for %s",
                  "key_insights": ["one", "two", "three", "four"],
                  "practical_applications": ["walk more"],
                  "confidence_score": 0.8
                }""".formatted(title, title);
    }

    public static String verdictJson(boolean safe, String... issues) {
        StringBuilder issueArray = new StringBuilder();
        for (int i = 0; i < issues.length; i++) {
            if (i > 0) issueArray.append(", ");
            issueArray.append('"').append(issues[i]).append('"');
        }
        return """
                {"accuracy_score": %s, "issues": [%s], "suggestions": [], "safe_to_publish": %s}"""
                .formatted(safe ? "0.95" : "0.4", issueArray, safe);
    }

    private static Candidate scored(Candidate candidate, double score) {
        candidate.setRelevanceScore(score);
        return candidate;
    }
}
