package com.longevitydigest.backend.controller;

import com.longevitydigest.backend.discovery.PaperDiscoveryService;
import com.longevitydigest.backend.model.dto.Candidate;
import com.longevitydigest.backend.model.enums.SourceKind;
import com.longevitydigest.backend.storage.DraftStore;
import com.longevitydigest.backend.storage.StoredDraft;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
@Validated
public class DiscoveryController {

    private final PaperDiscoveryService discoveryService;
    private final DraftStore draftStore;

    /**
     * Preview what every source returns for one query
     */
    @GetMapping("/discovery/search")
    public ResponseEntity<?> search(
            @RequestParam @NotBlank String query,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int maxPerSource,
            @RequestParam(defaultValue = "14") @Min(1) @Max(365) int daysBack,
            @RequestParam(defaultValue = "true") boolean includeTrials) {

        try {
            Map<SourceKind, List<Candidate>> results =
                    discoveryService.searchAllSources(query, maxPerSource, daysBack, includeTrials);

            Map<String, Object> bySource = new LinkedHashMap<>();
            Map<String, Integer> counts = new LinkedHashMap<>();
            for (Map.Entry<SourceKind, List<Candidate>> entry : results.entrySet()) {
                bySource.put(entry.getKey().getTag(), entry.getValue());
                counts.put(entry.getKey().getTag(), entry.getValue().size());
            }

            return ResponseEntity.ok(Map.of(
                    "query", query,
                    "counts", counts,
                    "results", bySource
            ));

        } catch (Exception e) {
            log.error("Error during discovery search for '{}'", query, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Search failed: " + e.getMessage()));
        }
    }

    /**
     * List drafts saved by previous runs
     */
    @GetMapping("/drafts")
    public ResponseEntity<?> listDrafts() {
        try {
            List<Map<String, Object>> drafts = new ArrayList<>();
            for (StoredDraft stored : draftStore.list()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("file", stored.getFileName());
                entry.put("draft", stored.getDraft());
                drafts.add(entry);
            }
            return ResponseEntity.ok(Map.of(
                    "directory", draftStore.getDirectory().toString(),
                    "count", drafts.size(),
                    "drafts", drafts
            ));

        } catch (Exception e) {
            log.error("Error listing drafts", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Could not list drafts: " + e.getMessage()));
        }
    }
}
