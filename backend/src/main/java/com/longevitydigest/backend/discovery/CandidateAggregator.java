package com.longevitydigest.backend.discovery;

import com.longevitydigest.backend.discovery.source.SourceAdapter;
import com.longevitydigest.backend.model.dto.Candidate;
import com.longevitydigest.backend.model.enums.SourceKind;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs source queries in parallel and merges the results.
 * <p>
 * Results are merged in query order after every task has finished, so the outcome
 * does not depend on completion order. Duplicates are resolved first-seen-wins on the
 * candidate's dedup key; later copies are dropped without merging their tags.
 */
@Slf4j
@Service
public class CandidateAggregator {

    private final Map<SourceKind, SourceAdapter> adapters = new EnumMap<>(SourceKind.class);
    private final Executor executor;

    public CandidateAggregator(List<SourceAdapter> adapters,
                               @Qualifier("discoveryTaskExecutor") Executor executor) {
        for (SourceAdapter adapter : adapters) {
            this.adapters.put(adapter.getSourceKind(), adapter);
        }
        this.executor = executor;
    }

    /**
     * Fetch every query concurrently; the result list is aligned with the query list
     */
    public List<List<Candidate>> fetchAll(List<SourceQuery> queries) {
        List<CompletableFuture<List<Candidate>>> futures = new ArrayList<>();

        for (SourceQuery query : queries) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> runQuery(query), executor)
                    .exceptionally(e -> {
                        log.warn("⚠️ {} task failed for '{}': {}",
                                query.getSource().getDisplayName(), query.getQuery(), e.getMessage());
                        return List.of();
                    }));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<List<Candidate>> results = new ArrayList<>(futures.size());
        for (CompletableFuture<List<Candidate>> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    /**
     * Fetch and deduplicate
     */
    public List<Candidate> aggregate(List<SourceQuery> queries) {
        List<List<Candidate>> results = fetchAll(queries);

        Map<String, Candidate> unique = new LinkedHashMap<>();
        int total = 0;
        for (List<Candidate> batch : results) {
            for (Candidate candidate : batch) {
                total++;
                String key = candidate.getDedupKey();
                if (key.isEmpty()) {
                    continue;
                }
                unique.putIfAbsent(key, candidate);
            }
        }

        log.info("   ✅ Found {} unique candidates ({} fetched from {} queries)", unique.size(), total, queries.size());
        return new ArrayList<>(unique.values());
    }

    private List<Candidate> runQuery(SourceQuery query) {
        SourceAdapter adapter = adapters.get(query.getSource());
        if (adapter == null) {
            log.warn("No adapter registered for {}", query.getSource());
            return List.of();
        }
        List<Candidate> candidates = adapter.fetch(query.getQuery(), query.getMaxResults(), query.getWindow());
        return candidates != null ? candidates : List.of();
    }
}
