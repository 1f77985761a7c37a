package com.longevitydigest.backend.discovery.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.longevitydigest.backend.config.PipelineProperties;
import com.longevitydigest.backend.model.dto.Candidate;
import com.longevitydigest.backend.model.dto.DateWindow;
import com.longevitydigest.backend.model.enums.SourceKind;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * bioRxiv and medRxiv details API. The API only filters by date, so each page is
 * filtered locally: every query word of three or more characters must occur in the
 * title or abstract.
 */
public class PreprintSourceAdapter extends AbstractSourceAdapter {

    static final int PAGE_SIZE = 100;
    private static final int MAX_AUTHORS = 5;

    private final SourceKind sourceKind;

    public PreprintSourceAdapter(SourceKind sourceKind, PipelineProperties.Sources sourcesConfig) {
        super(sourcesConfig);
        if (sourceKind != SourceKind.BIORXIV && sourceKind != SourceKind.MEDRXIV) {
            throw new IllegalArgumentException("Not a preprint server: " + sourceKind);
        }
        this.sourceKind = sourceKind;
    }

    @Override
    public SourceKind getSourceKind() {
        return sourceKind;
    }

    private String server() {
        return sourceKind.getTag();
    }

    @Override
    protected List<Candidate> doFetch(String query, int maxResults, DateWindow window) throws IOException {
        List<String> words = queryWords(query);
        List<Candidate> matches = new ArrayList<>();

        for (int page = 0; page < sourcesConfig.getPreprintPages(); page++) {
            int cursor = page * PAGE_SIZE;
            String url = String.format("%s/details/%s/%s/%s/%d/json",
                    sourcesConfig.getBiorxivBaseUrl(), server(), window.getFrom(), window.getTo(), cursor);

            JsonNode collection = readCollection(httpGet(url, null));
            if (collection.isEmpty()) {
                break;
            }

            matches.addAll(matching(collection, words));
            if (matches.size() >= maxResults) {
                break;
            }
        }

        return matches.size() > maxResults ? new ArrayList<>(matches.subList(0, maxResults)) : matches;
    }

    /**
     * Lower-cased query words of at least three characters, '+' stripped from the ends
     */
    static List<String> queryWords(String query) {
        List<String> words = new ArrayList<>();
        for (String word : query.trim().split("\\s+")) {
            if (word.length() >= 3) {
                words.add(stripPlus(word.toLowerCase(Locale.ROOT)));
            }
        }
        return words;
    }

    JsonNode readCollection(String json) throws IOException {
        return MAPPER.readTree(json).path("collection");
    }

    List<Candidate> matching(JsonNode collection, List<String> words) {
        List<Candidate> result = new ArrayList<>();
        if (words.isEmpty()) {
            return result;
        }

        for (JsonNode item : collection) {
            String title = text(item, "title");
            String abstractText = text(item, "abstract");
            String haystack = (title + " " + abstractText).toLowerCase(Locale.ROOT);

            if (words.stream().allMatch(haystack::contains)) {
                result.add(toCandidate(item, title, abstractText));
            }
        }
        return result;
    }

    private Candidate toCandidate(JsonNode item, String title, String abstractText) {
        String doi = text(item, "doi");
        List<String> authors = Arrays.stream(text(item, "authors").split("; "))
                .map(String::trim)
                .filter(a -> !a.isEmpty())
                .limit(MAX_AUTHORS)
                .toList();

        Set<String> tags = new LinkedHashSet<>();
        tags.add(server());
        tags.add(SourceKind.PREPRINT_TAG);

        return Candidate.builder()
                .title(title)
                .authors(new ArrayList<>(authors))
                .abstractText(abstractText)
                .venue(server() + " (preprint)")
                .identifier(doi)
                .publishedDate(text(item, "date"))
                .url("https://www." + server() + ".org/content/" + doi)
                .tags(tags)
                .build();
    }

    private static String stripPlus(String word) {
        int start = 0;
        int end = word.length();
        while (start < end && word.charAt(start) == '+') start++;
        while (end > start && word.charAt(end - 1) == '+') end--;
        return word.substring(start, end);
    }
}
