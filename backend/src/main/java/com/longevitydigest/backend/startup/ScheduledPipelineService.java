package com.longevitydigest.backend.startup;

import com.longevitydigest.backend.config.PipelineProperties;
import com.longevitydigest.backend.config.PipelineSettings;
import com.longevitydigest.backend.pipeline.ContentPipelineService;
import com.longevitydigest.backend.pipeline.PipelineRunReport;
import java.time.LocalDateTime;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Weekly scheduled run, optional run on startup, and background runs triggered over
 * HTTP. At most one background run is active at a time.
 */
@Slf4j
@Service
public class ScheduledPipelineService {

    private final ContentPipelineService pipelineService;
    private final PipelineProperties properties;
    private final PipelineSettings settings;
    private final Executor pipelineExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile PipelineRunReport lastReport;

    public ScheduledPipelineService(ContentPipelineService pipelineService,
                                    PipelineProperties properties,
                                    PipelineSettings settings,
                                    @Qualifier("pipelineTaskExecutor") Executor pipelineExecutor) {
        this.pipelineService = pipelineService;
        this.properties = properties;
        this.settings = settings;
        this.pipelineExecutor = pipelineExecutor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getSchedule().isRunOnStartup()) {
            log.info("🔕 Startup run disabled via configuration");
            return;
        }
        log.info("🚀 APPLICATION READY - starting content pipeline in the background");
        triggerAsync(settings.isIncludePreprints(), settings.isIncludeTrials());
    }

    @Scheduled(cron = "${pipeline.schedule.cron:0 0 6 * * MON}")
    public void scheduledRun() {
        if (!properties.getSchedule().isEnabled()) {
            log.debug("Scheduled pipeline disabled, skipping");
            return;
        }
        log.info("⏰ SCHEDULED PIPELINE EXECUTION STARTED");
        if (!running.compareAndSet(false, true)) {
            log.info("⏳ Skipping scheduled execution - a run is already in progress");
            return;
        }
        runGuarded(settings.isIncludePreprints(), settings.isIncludeTrials());
    }

    /**
     * Start a run on the pipeline executor
     *
     * @return false when a run is already in progress
     */
    public boolean triggerAsync(boolean includePreprints, boolean includeTrials) {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        try {
            pipelineExecutor.execute(() -> runGuarded(includePreprints, includeTrials));
            return true;
        } catch (RejectedExecutionException e) {
            running.set(false);
            log.error("❌ Could not start pipeline run: {}", e.getMessage());
            return false;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public PipelineRunReport getLastReport() {
        return lastReport;
    }

    private void runGuarded(boolean includePreprints, boolean includeTrials) {
        log.info("📅 Start Time: {}", LocalDateTime.now());
        try {
            lastReport = pipelineService.runWeeklyPipeline(includePreprints, includeTrials);
            log.info("🎉 ===== CONTENT PIPELINE COMPLETED: {} drafts, {} ready =====",
                    lastReport.getDrafts().size(), lastReport.getReady());
        } catch (Exception e) {
            log.error("💥 ===== CONTENT PIPELINE FAILED =====");
            log.error("❌ Error: {}", e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }
}
