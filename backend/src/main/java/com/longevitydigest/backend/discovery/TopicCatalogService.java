package com.longevitydigest.backend.discovery;

import jakarta.annotation.PostConstruct;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.Yaml;

/**
 * Service to load the keyword and venue tables from YAML
 */
@Service
@Slf4j
public class TopicCatalogService {

    private final List<String> discoveryKeywords = new ArrayList<>();
    private final List<String> trialKeywords = new ArrayList<>();
    private final List<String> scoringKeywords = new ArrayList<>();
    private final List<String> priorityVenues = new ArrayList<>();

    @Value("classpath:research-topics.yml")
    private Resource catalogResource;

    @PostConstruct
    public void loadCatalog() {
        try (InputStream inputStream = catalogResource.getInputStream()) {
            Yaml yaml = new Yaml();
            Map<String, Object> data = yaml.load(inputStream);

            @SuppressWarnings("unchecked")
            Map<String, Object> topics = (Map<String, Object>) data.get("topics");
            if (topics == null) {
                throw new IllegalStateException("research-topics.yml has no 'topics' section");
            }

            discoveryKeywords.addAll(readList(topics, "discoveryKeywords"));
            trialKeywords.addAll(readList(topics, "trialKeywords"));
            priorityVenues.addAll(readList(topics, "priorityVenues"));

            List<String> scoring = readList(topics, "scoringKeywords");
            scoringKeywords.addAll(scoring.isEmpty() ? discoveryKeywords : scoring);

            log.info("Loaded topic catalog: {} discovery keywords, {} trial keywords, {} priority venues",
                    discoveryKeywords.size(), trialKeywords.size(), priorityVenues.size());

        } catch (Exception e) {
            log.error("Error loading topic catalog", e);
            throw new RuntimeException("Failed to load topic catalog", e);
        }
    }

    public List<String> getDiscoveryKeywords() {
        return List.copyOf(discoveryKeywords);
    }

    public List<String> getTrialKeywords() {
        return List.copyOf(trialKeywords);
    }

    /**
     * Keywords counted in titles by the relevance scorer; the discovery keywords unless overridden
     */
    public List<String> getScoringKeywords() {
        return List.copyOf(scoringKeywords);
    }

    public List<String> getPriorityVenues() {
        return List.copyOf(priorityVenues);
    }

    private List<String> readList(Map<String, Object> topics, String key) {
        Object value = topics.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null && !item.toString().isBlank()) {
                    result.add(item.toString().trim());
                }
            }
        }
        return result;
    }
}
