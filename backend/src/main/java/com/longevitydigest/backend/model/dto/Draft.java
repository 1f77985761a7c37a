package com.longevitydigest.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.longevitydigest.backend.model.enums.ContentType;
import com.longevitydigest.backend.model.enums.DraftStatus;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AI-generated content tied to exactly one candidate.
 * <p>
 * Created in status DRAFT; the fact-check loop moves it to READY_FOR_REVIEW or
 * NEEDS_REVISION and revisions overwrite the generated fields.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Draft {
    private Candidate candidate;
    private ContentType contentType;

    // Target language
    private String title;
    private String summary;
    private String body;

    // Source language, echoed from the candidate
    private String originalTitle;
    private String originalSummary;

    @Builder.Default
    private List<String> keyInsights = new ArrayList<>();
    @Builder.Default
    private List<String> practicalApplications = new ArrayList<>();
    @Builder.Default
    private List<Citation> citations = new ArrayList<>();
    @Builder.Default
    private List<String> factCheckNotes = new ArrayList<>();

    private double confidenceScore;
    private LocalDateTime createdAt;
    @Builder.Default
    private DraftStatus status = DraftStatus.DRAFT;
    private String source;

    /**
     * Overwrite generated fields with a revision, keeping current values for anything the revision omits
     */
    public void applyRevision(GeneratedContent revision) {
        if (revision.getTitle() != null) title = revision.getTitle();
        if (revision.getSummary() != null) summary = revision.getSummary();
        if (revision.getBody() != null) body = revision.getBody();
        if (revision.getKeyInsights() != null && !revision.getKeyInsights().isEmpty()) {
            keyInsights = new ArrayList<>(revision.getKeyInsights());
        }
        if (revision.getPracticalApplications() != null && !revision.getPracticalApplications().isEmpty()) {
            practicalApplications = new ArrayList<>(revision.getPracticalApplications());
        }
        if (revision.getConfidenceScore() != null) confidenceScore = revision.getConfidenceScore();
    }

    @JsonIgnore
    public boolean isReady() {
        return status == DraftStatus.READY_FOR_REVIEW;
    }
}
