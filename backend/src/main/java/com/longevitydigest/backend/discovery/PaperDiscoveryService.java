package com.longevitydigest.backend.discovery;

import com.longevitydigest.backend.config.PipelineSettings;
import com.longevitydigest.backend.model.dto.Candidate;
import com.longevitydigest.backend.model.dto.DateWindow;
import com.longevitydigest.backend.model.enums.SourceKind;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Discovery stage of the pipeline: builds the weekly query batch, then aggregates,
 * scores and selects candidates.
 */
@Slf4j
@Service
public class PaperDiscoveryService {

    static final String DEFAULT_TRIAL_QUERY = "longevity";

    private final CandidateAggregator aggregator;
    private final RelevanceScorer scorer;
    private final DiversitySelector selector;
    private final PipelineSettings settings;
    private final Clock clock;

    @Autowired
    public PaperDiscoveryService(CandidateAggregator aggregator, RelevanceScorer scorer,
                                 DiversitySelector selector, PipelineSettings settings) {
        this(aggregator, scorer, selector, settings, Clock.systemDefaultZone());
    }

    PaperDiscoveryService(CandidateAggregator aggregator, RelevanceScorer scorer,
                          DiversitySelector selector, PipelineSettings settings, Clock clock) {
        this.aggregator = aggregator;
        this.scorer = scorer;
        this.selector = selector;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Aggregate, score and select this week's candidates, ordered for processing
     */
    public List<Candidate> discoverWeeklyCandidates(boolean includePreprints, boolean includeTrials) {
        log.info("📚 Searching multiple sources...");

        List<SourceQuery> queries = buildWeeklyQueries(includePreprints, includeTrials);
        List<Candidate> unique = aggregator.aggregate(queries);
        scorer.scoreAll(unique);

        List<Candidate> selected = selector.select(unique);

        Map<SourceKind, Integer> breakdown = DiversitySelector.countBySource(selected);
        log.info("   📊 Selected {} candidates: {} trials, {} medRxiv, {} bioRxiv, {} PubMed",
                selected.size(),
                breakdown.get(SourceKind.CLINICAL_TRIAL),
                breakdown.get(SourceKind.MEDRXIV),
                breakdown.get(SourceKind.BIORXIV),
                breakdown.get(SourceKind.PUBMED));
        return selected;
    }

    /**
     * Query batch for a weekly run: every discovery keyword against PubMed and, when
     * enabled, both preprint servers; then every trial keyword against ClinicalTrials.gov.
     */
    List<SourceQuery> buildWeeklyQueries(boolean includePreprints, boolean includeTrials) {
        LocalDate today = LocalDate.now(clock);
        DateWindow pubmedWindow = DateWindow.lastDays(settings.getPubmedDaysBack(), today);
        DateWindow preprintWindow = DateWindow.lastDays(settings.getPreprintDaysBack(), today);

        List<SourceQuery> queries = new ArrayList<>();
        for (String keyword : head(settings.getDiscoveryKeywords(), settings.getKeywordsPerRun())) {
            log.info("   🔍 Keyword: {}", keyword);
            queries.add(new SourceQuery(SourceKind.PUBMED, keyword, settings.getPubmedMaxResults(), pubmedWindow));
            if (includePreprints) {
                queries.add(new SourceQuery(SourceKind.BIORXIV, keyword, settings.getPreprintMaxResults(), preprintWindow));
                queries.add(new SourceQuery(SourceKind.MEDRXIV, keyword, settings.getPreprintMaxResults(), preprintWindow));
            }
        }

        if (includeTrials) {
            for (String keyword : head(settings.getTrialKeywords(), settings.getTrialKeywordsPerRun())) {
                log.info("   🏥 Clinical trial keyword: {}", keyword);
                queries.add(new SourceQuery(SourceKind.CLINICAL_TRIAL, keyword, settings.getTrialMaxResults(), null));
            }
        }
        return queries;
    }

    /**
     * Preview search across all sources for one query, without scoring or selection.
     * Preprints get twice the window; trials are searched by the query's first word.
     */
    public Map<SourceKind, List<Candidate>> searchAllSources(String query, int maxPerSource,
                                                             int daysBack, boolean includeTrials) {
        LocalDate today = LocalDate.now(clock);
        DateWindow window = DateWindow.lastDays(daysBack, today);
        DateWindow preprintWindow = DateWindow.lastDays(daysBack * 2, today);

        List<SourceQuery> queries = new ArrayList<>();
        queries.add(new SourceQuery(SourceKind.PUBMED, query, maxPerSource, window));
        queries.add(new SourceQuery(SourceKind.BIORXIV, query, maxPerSource, preprintWindow));
        queries.add(new SourceQuery(SourceKind.MEDRXIV, query, maxPerSource, preprintWindow));
        if (includeTrials) {
            queries.add(new SourceQuery(SourceKind.CLINICAL_TRIAL, firstWord(query), maxPerSource, null));
        }

        List<List<Candidate>> results = aggregator.fetchAll(queries);

        Map<SourceKind, List<Candidate>> bySource = new EnumMap<>(SourceKind.class);
        for (SourceKind kind : SourceKind.values()) {
            bySource.put(kind, new ArrayList<>());
        }
        for (int i = 0; i < queries.size(); i++) {
            bySource.get(queries.get(i).getSource()).addAll(results.get(i));
        }
        return bySource;
    }

    static String firstWord(String query) {
        if (query == null || query.isBlank()) {
            return DEFAULT_TRIAL_QUERY;
        }
        return query.trim().split("\\s+")[0];
    }

    private static List<String> head(List<String> values, int limit) {
        return values.size() > limit ? values.subList(0, limit) : values;
    }
}
