package com.longevitydigest.backend.discovery;

import com.longevitydigest.backend.model.dto.Candidate;
import com.longevitydigest.backend.model.enums.SourceKind;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Picks the run's candidates: a per-source quota first (buckets in {@link SourceKind}
 * order), then the best remaining candidates by score up to the cap.
 */
public class DiversitySelector {

    private final int cap;
    private final int quotaPerSource;

    public DiversitySelector(int cap, int quotaPerSource) {
        if (cap < 0 || quotaPerSource < 0) {
            throw new IllegalArgumentException("cap and quota must not be negative");
        }
        this.cap = cap;
        this.quotaPerSource = quotaPerSource;
    }

    public List<Candidate> select(List<Candidate> candidates) {
        // List.sort is stable, ties keep aggregation order
        List<Candidate> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator.comparingDouble(Candidate::getRelevanceScore).reversed());

        Map<SourceKind, List<Candidate>> buckets = new EnumMap<>(SourceKind.class);
        for (SourceKind kind : SourceKind.values()) {
            buckets.put(kind, new ArrayList<>());
        }
        for (Candidate candidate : ranked) {
            buckets.get(candidate.getSourceKind()).add(candidate);
        }

        List<Candidate> selected = new ArrayList<>();
        Set<String> used = new HashSet<>();

        for (SourceKind kind : SourceKind.values()) {
            int taken = 0;
            for (Candidate candidate : buckets.get(kind)) {
                if (taken == quotaPerSource || selected.size() == cap) {
                    break;
                }
                if (used.add(candidate.getDedupKey())) {
                    selected.add(candidate);
                    taken++;
                }
            }
        }

        for (Candidate candidate : ranked) {
            if (selected.size() >= cap) {
                break;
            }
            if (used.add(candidate.getDedupKey())) {
                selected.add(candidate);
            }
        }

        return selected;
    }

    /**
     * Candidate count per source, every source present
     */
    public static Map<SourceKind, Integer> countBySource(List<Candidate> candidates) {
        Map<SourceKind, Integer> counts = new EnumMap<>(SourceKind.class);
        for (SourceKind kind : SourceKind.values()) {
            counts.put(kind, 0);
        }
        for (Candidate candidate : candidates) {
            counts.merge(candidate.getSourceKind(), 1, Integer::sum);
        }
        return counts;
    }
}
