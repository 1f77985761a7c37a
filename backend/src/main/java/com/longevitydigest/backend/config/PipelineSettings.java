package com.longevitydigest.backend.config;

import com.longevitydigest.backend.model.enums.ContentType;
import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable run configuration handed to the discovery and run stages.
 */
@Value
@Builder(toBuilder = true)
public class PipelineSettings {

    // Run controller
    @Builder.Default
    int targetReady = 5;
    @Builder.Default
    int maxPapers = 15;
    @Builder.Default
    int maxRevisions = 2;
    @Builder.Default
    Duration coolDown = Duration.ofSeconds(10);
    @Builder.Default
    ContentType contentType = ContentType.NEWSLETTER;
    @Builder.Default
    String targetLanguage = "Korean";
    @Builder.Default
    boolean persistDrafts = true;

    // Selection
    @Builder.Default
    int selectionCap = 15;
    @Builder.Default
    int quotaPerSource = 3;

    // Discovery
    @Builder.Default
    boolean includePreprints = true;
    @Builder.Default
    boolean includeTrials = true;
    @Builder.Default
    int keywordsPerRun = 5;
    @Builder.Default
    int trialKeywordsPerRun = 6;
    @Builder.Default
    int pubmedMaxResults = 10;
    @Builder.Default
    int pubmedDaysBack = 7;
    @Builder.Default
    int preprintMaxResults = 5;
    @Builder.Default
    int preprintDaysBack = 30;
    @Builder.Default
    int trialMaxResults = 5;

    @Singular
    List<String> discoveryKeywords;
    @Singular
    List<String> trialKeywords;
    @Singular
    List<String> scoringKeywords;
    @Singular
    List<String> priorityVenues;
}
