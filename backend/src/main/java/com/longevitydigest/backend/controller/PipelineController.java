package com.longevitydigest.backend.controller;

import com.longevitydigest.backend.ai.NoProviderConfiguredException;
import com.longevitydigest.backend.config.PipelineSettings;
import com.longevitydigest.backend.model.dto.Candidate;
import com.longevitydigest.backend.model.dto.Draft;
import com.longevitydigest.backend.model.enums.ContentType;
import com.longevitydigest.backend.pipeline.ContentPipelineService;
import com.longevitydigest.backend.pipeline.DraftRegenerationService;
import com.longevitydigest.backend.pipeline.PipelineRunReport;
import com.longevitydigest.backend.pipeline.RegenerationReport;
import com.longevitydigest.backend.pipeline.StageResult;
import com.longevitydigest.backend.startup.ScheduledPipelineService;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
@Slf4j
public class PipelineController {

    private final ContentPipelineService pipelineService;
    private final DraftRegenerationService regenerationService;
    private final ScheduledPipelineService scheduledPipelineService;
    private final PipelineSettings settings;

    /**
     * Run the weekly pipeline synchronously and return the run report
     */
    @PostMapping("/run")
    public ResponseEntity<?> runPipeline(
            @RequestParam(required = false) Boolean includePreprints,
            @RequestParam(required = false) Boolean includeTrials) {

        boolean preprints = includePreprints != null ? includePreprints : settings.isIncludePreprints();
        boolean trials = includeTrials != null ? includeTrials : settings.isIncludeTrials();

        try {
            log.info("🚀 Pipeline run requested (preprints: {}, trials: {})", preprints, trials);
            PipelineRunReport report = pipelineService.runWeeklyPipeline(preprints, trials);
            return ResponseEntity.ok(report);

        } catch (NoProviderConfiguredException e) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        } catch (Exception e) {
            log.error("Error during pipeline run", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Pipeline run failed: " + e.getMessage());
        }
    }

    /**
     * Start the weekly pipeline in the background
     */
    @PostMapping("/run-async")
    public ResponseEntity<?> runPipelineAsync(
            @RequestParam(required = false) Boolean includePreprints,
            @RequestParam(required = false) Boolean includeTrials) {

        boolean preprints = includePreprints != null ? includePreprints : settings.isIncludePreprints();
        boolean trials = includeTrials != null ? includeTrials : settings.isIncludeTrials();

        if (!scheduledPipelineService.triggerAsync(preprints, trials)) {
            return error(HttpStatus.CONFLICT, "A pipeline run is already in progress");
        }
        return ResponseEntity.accepted().body(Map.of(
                "message", "Pipeline run started",
                "status", "RUNNING",
                "checkStatusAt", "/api/pipeline/status"
        ));
    }

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        Map<String, Object> response = new HashMap<>();
        response.put("running", scheduledPipelineService.isRunning());
        response.put("lastReport", scheduledPipelineService.getLastReport());
        return ResponseEntity.ok(response);
    }

    /**
     * Generate and fact check one candidate supplied by the caller
     */
    @PostMapping("/candidates/process")
    public ResponseEntity<?> processCandidate(
            @RequestBody Candidate candidate,
            @RequestParam(defaultValue = "newsletter") String contentType) {

        if (candidate.getTitle() == null || candidate.getTitle().isBlank()) {
            return error(HttpStatus.BAD_REQUEST, "Candidate title is required");
        }

        try {
            StageResult<Draft> result = pipelineService.processSingle(candidate, ContentType.fromValue(contentType));
            if (result.isOk()) {
                return ResponseEntity.ok(result.getValue());
            }
            return error(HttpStatus.UNPROCESSABLE_ENTITY, "Candidate skipped: " + result.getReason());

        } catch (NoProviderConfiguredException e) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        } catch (Exception e) {
            log.error("Error processing candidate {}", candidate.getDedupKey(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Processing failed: " + e.getMessage());
        }
    }

    /**
     * Regenerate stored drafts that need revision
     */
    @PostMapping("/regenerate")
    public ResponseEntity<?> regenerate() {
        try {
            RegenerationReport report = regenerationService.regenerateNeedsRevision();
            return ResponseEntity.ok(report);

        } catch (NoProviderConfiguredException e) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        } catch (Exception e) {
            log.error("Error during draft regeneration", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Regeneration failed: " + e.getMessage());
        }
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", false);
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
