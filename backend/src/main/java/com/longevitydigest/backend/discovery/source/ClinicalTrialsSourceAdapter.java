package com.longevitydigest.backend.discovery.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.longevitydigest.backend.config.PipelineProperties;
import com.longevitydigest.backend.model.dto.Candidate;
import com.longevitydigest.backend.model.dto.DateWindow;
import com.longevitydigest.backend.model.enums.SourceKind;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * ClinicalTrials.gov studies API (v2), normalized into candidates. The date window is
 * not applied; trials are filtered by overall status instead.
 */
public class ClinicalTrialsSourceAdapter extends AbstractSourceAdapter {

    static final String TITLE_PREFIX = "[Clinical Trial] ";
    private static final int MAX_CONDITION_TAGS = 3;

    private final String overallStatus;

    public ClinicalTrialsSourceAdapter(PipelineProperties.Sources sourcesConfig, String overallStatus) {
        super(sourcesConfig);
        this.overallStatus = overallStatus;
    }

    @Override
    public SourceKind getSourceKind() {
        return SourceKind.CLINICAL_TRIAL;
    }

    @Override
    protected List<Candidate> doFetch(String query, int maxResults, DateWindow window) throws IOException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query.term", query);
        params.put("filter.overallStatus", overallStatus);
        params.put("pageSize", String.valueOf(maxResults));
        params.put("format", "json");

        return parseStudies(httpGet(sourcesConfig.getClinicalTrialsBaseUrl() + "/studies", params));
    }

    List<Candidate> parseStudies(String json) throws IOException {
        List<Candidate> candidates = new ArrayList<>();

        for (JsonNode study : MAPPER.readTree(json).path("studies")) {
            JsonNode protocol = study.path("protocolSection");
            JsonNode identification = protocol.path("identificationModule");
            JsonNode status = protocol.path("statusModule");

            String nctId = text(identification, "nctId");

            List<String> phases = new ArrayList<>();
            for (JsonNode phase : protocol.path("designModule").path("phases")) {
                phases.add(phase.asText());
            }

            Set<String> tags = new LinkedHashSet<>();
            tags.add(SourceKind.CLINICAL_TRIAL.getTag());
            int conditionCount = 0;
            for (JsonNode condition : protocol.path("conditionsModule").path("conditions")) {
                if (conditionCount++ == MAX_CONDITION_TAGS) {
                    break;
                }
                tags.add(condition.asText());
            }

            candidates.add(Candidate.builder()
                    .title(TITLE_PREFIX + text(identification, "briefTitle"))
                    .abstractText(text(protocol.path("descriptionModule"), "briefSummary"))
                    .venue("ClinicalTrials.gov (" + String.join(", ", phases) + ")")
                    .identifier(nctId)
                    .publishedDate(text(status.path("startDateStruct"), "date"))
                    .url("https://clinicaltrials.gov/study/" + nctId)
                    .tags(tags)
                    .build());
        }
        return candidates;
    }
}
