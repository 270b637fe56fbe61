package com.jay.alm.scheduler;

import com.jay.alm.config.AlmConfig;
import com.jay.alm.model.PipelineRun;
import com.jay.alm.service.AlmPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily append run, after the broker publishes the previous US session's extracts.
 * Default: 07:00 Hong Kong time, Tuesday to Saturday. Disabled unless scheduler.enabled is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlmScheduler {

    private final AlmPipelineService pipelineService;
    private final AlmConfig config;

    @Scheduled(cron = "${alm.scheduler.cron:0 0 7 * * TUE-SAT}", zone = "${alm.scheduler.zone:Asia/Hong_Kong}")
    public void dailyAppend() {
        if (!config.scheduler().isEnabled()) {
            log.debug("Scheduled ALM run skipped — scheduler disabled");
            return;
        }
        log.info("=== SCHEDULED ALM APPEND ===");
        try {
            PipelineRun run = pipelineService.runAppend();
            log.info("Scheduled run complete: {} new event(s), gate {}", run.newEvents(), run.report().status());
        } catch (Exception e) {
            // Already alerted by the pipeline; keep the scheduler thread alive
            log.error("Scheduled ALM run failed: {}", e.getMessage(), e);
        }
    }
}
