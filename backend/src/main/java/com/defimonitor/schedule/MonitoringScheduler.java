package com.defimonitor.schedule;

import com.defimonitor.config.AppProps;
import com.defimonitor.service.MonitoringPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers the monitoring pipeline on {@code app.pipeline.cron} (every 15 minutes by default).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringScheduler {

    private final MonitoringPipeline pipeline;
    private final AppProps props;

    @Scheduled(cron = "${app.pipeline.cron:0 0/15 * * * ?}")
    public void run() {
        if (!props.getPipeline().isEnabled()) {
            log.debug("[monitor-scheduler] pipeline disabled, skipping");
            return;
        }
        log.info("[monitor-scheduler] started {}", System.currentTimeMillis());
        try {
            pipeline.run();
        } catch (Exception e) {
            log.error("[monitor-scheduler] run failed: {}", e.getMessage(), e);
        }
    }
}
