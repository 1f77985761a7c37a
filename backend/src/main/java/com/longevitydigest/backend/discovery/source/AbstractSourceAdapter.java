package com.longevitydigest.backend.discovery.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.longevitydigest.backend.config.PipelineProperties;
import com.longevitydigest.backend.model.dto.Candidate;
import com.longevitydigest.backend.model.dto.DateWindow;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;

/**
 * Base class for HTTP source adapters: owns the fetch helper and the guard that
 * turns any failure into an empty result.
 */
@Slf4j
public abstract class AbstractSourceAdapter implements SourceAdapter {

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    protected final PipelineProperties.Sources sourcesConfig;

    protected AbstractSourceAdapter(PipelineProperties.Sources sourcesConfig) {
        this.sourcesConfig = sourcesConfig;
    }

    @Override
    public final List<Candidate> fetch(String query, int maxResults, DateWindow window) {
        if (query == null || query.isBlank() || maxResults <= 0) {
            return List.of();
        }
        try {
            List<Candidate> candidates = doFetch(query.trim(), maxResults, window);
            log.debug("{} returned {} candidates for '{}'", getSourceKind().getDisplayName(), candidates.size(), query);
            return candidates;
        } catch (Exception e) {
            log.warn("⚠️ {} search failed for '{}': {}", getSourceKind().getDisplayName(), query, e.getMessage());
            return List.of();
        }
    }

    protected abstract List<Candidate> doFetch(String query, int maxResults, DateWindow window) throws IOException;

    /**
     * GET a url and return the raw body; non-200 responses raise {@link org.jsoup.HttpStatusException}
     */
    protected String httpGet(String url, Map<String, String> params) throws IOException {
        Connection connection = Jsoup.connect(url)
                .userAgent(sourcesConfig.getUserAgent())
                .timeout(sourcesConfig.getTimeoutSeconds() * 1000)
                .ignoreContentType(true)
                .maxBodySize(0)
                .method(Connection.Method.GET);
        if (params != null && !params.isEmpty()) {
            connection.data(params);
        }
        return connection.execute().body();
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() ? value.asText("") : "";
    }
}
