package com.longevitydigest.backend.config;

import com.longevitydigest.backend.discovery.DiversitySelector;
import com.longevitydigest.backend.discovery.RelevanceScorer;
import com.longevitydigest.backend.discovery.TopicCatalogService;
import com.longevitydigest.backend.discovery.source.ClinicalTrialsSourceAdapter;
import com.longevitydigest.backend.discovery.source.PreprintSourceAdapter;
import com.longevitydigest.backend.discovery.source.PubMedSourceAdapter;
import com.longevitydigest.backend.discovery.source.SourceAdapter;
import com.longevitydigest.backend.model.enums.ContentType;
import com.longevitydigest.backend.model.enums.SourceKind;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the immutable run settings, the scorer and selector built from them, and
 * one adapter per source.
 */
@Configuration
public class DiscoveryConfig {

    @Bean
    public PipelineSettings pipelineSettings(PipelineProperties properties, TopicCatalogService topics) {
        PipelineProperties.Discovery discovery = properties.getDiscovery();

        return PipelineSettings.builder()
                .targetReady(properties.getTargetReadyDrafts())
                .maxPapers(properties.getMaxPapersToProcess())
                .maxRevisions(properties.getMaxAutoRevisions())
                .coolDown(properties.getCoolDown())
                .contentType(ContentType.fromValue(properties.getContentType()))
                .targetLanguage(properties.getTargetLanguage())
                .persistDrafts(properties.getStorage().isEnabled())
                .selectionCap(properties.getSelection().getCap())
                .quotaPerSource(properties.getSelection().getQuotaPerSource())
                .includePreprints(properties.isIncludePreprints())
                .includeTrials(properties.isIncludeTrials())
                .keywordsPerRun(discovery.getKeywordsPerRun())
                .trialKeywordsPerRun(discovery.getTrialKeywordsPerRun())
                .pubmedMaxResults(discovery.getPubmedMaxResults())
                .pubmedDaysBack(discovery.getPubmedDaysBack())
                .preprintMaxResults(discovery.getPreprintMaxResults())
                .preprintDaysBack(discovery.getPreprintDaysBack())
                .trialMaxResults(discovery.getTrialMaxResults())
                .discoveryKeywords(topics.getDiscoveryKeywords())
                .trialKeywords(topics.getTrialKeywords())
                .scoringKeywords(topics.getScoringKeywords())
                .priorityVenues(topics.getPriorityVenues())
                .build();
    }

    @Bean
    public RelevanceScorer relevanceScorer(PipelineSettings settings) {
        return new RelevanceScorer(settings.getScoringKeywords(), settings.getPriorityVenues());
    }

    @Bean
    public DiversitySelector diversitySelector(PipelineSettings settings) {
        return new DiversitySelector(settings.getSelectionCap(), settings.getQuotaPerSource());
    }

    @Bean
    public SourceAdapter pubMedSourceAdapter(PipelineProperties properties) {
        return new PubMedSourceAdapter(properties.getSources());
    }

    @Bean
    public SourceAdapter biorxivSourceAdapter(PipelineProperties properties) {
        return new PreprintSourceAdapter(SourceKind.BIORXIV, properties.getSources());
    }

    @Bean
    public SourceAdapter medrxivSourceAdapter(PipelineProperties properties) {
        return new PreprintSourceAdapter(SourceKind.MEDRXIV, properties.getSources());
    }

    @Bean
    public SourceAdapter clinicalTrialsSourceAdapter(PipelineProperties properties) {
        return new ClinicalTrialsSourceAdapter(properties.getSources(), properties.getDiscovery().getTrialStatus());
    }
}
