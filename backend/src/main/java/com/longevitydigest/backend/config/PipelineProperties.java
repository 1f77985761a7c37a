package com.longevitydigest.backend.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Pipeline configuration bound from application.yml.
 * <p>
 * Mutable binding target only; services receive the immutable {@link PipelineSettings}
 * built from it, plus the provider list consumed by {@link AiProviderConfig}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private int targetReadyDrafts = 5;
    private int maxPapersToProcess = 15;
    private int maxAutoRevisions = 2;
    private Duration coolDown = Duration.ofSeconds(10);
    private String contentType = "newsletter";
    private String targetLanguage = "Korean";
    private boolean includePreprints = true;
    private boolean includeTrials = true;

    private Selection selection = new Selection();
    private Discovery discovery = new Discovery();
    private Sources sources = new Sources();

    private String generationProvider = "gemini";
    private String factCheckProvider = "kimi";
    // Priority order, cheapest first
    private List<Provider> providers = new ArrayList<>();

    private Storage storage = new Storage();
    private Schedule schedule = new Schedule();

    @Data
    public static class Selection {
        private int cap = 15;
        private int quotaPerSource = 3;
    }

    @Data
    public static class Discovery {
        private int keywordsPerRun = 5;
        private int trialKeywordsPerRun = 6;
        private int pubmedMaxResults = 10;
        private int pubmedDaysBack = 7;
        private int preprintMaxResults = 5;
        private int preprintDaysBack = 30;
        private int trialMaxResults = 5;
        private String trialStatus = "RECRUITING";
    }

    @Data
    public static class Sources {
        private String pubmedBaseUrl = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils";
        private String biorxivBaseUrl = "https://api.biorxiv.org";
        private String clinicalTrialsBaseUrl = "https://clinicaltrials.gov/api/v2";
        private int timeoutSeconds = 30;
        private int preprintPages = 3;
        private String userAgent = "Mozilla/5.0 (compatible; LongevityDigestBot/1.0)";
    }

    @Data
    public static class Provider {
        private String name;
        private String baseUrl;
        private String completionsPath = "/v1/chat/completions";
        private String model;
        private String apiKey;
        private double temperature = 0.7;
        private int maxTokens = 2048;
        private Duration timeout = Duration.ofSeconds(60);
        // Attempts for rate-limited calls; 1 disables the retry
        private int rateLimitAttempts = 1;
        private Duration rateLimitBackoff = Duration.ofSeconds(15);

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class Storage {
        private boolean enabled = true;
        private String directory = "content_drafts";
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;
        private String cron = "0 0 6 * * MON";
        private boolean runOnStartup = false;
    }
}
