package com.journeytide.service;

import com.journeytide.dto.SweepSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the engine sweep on a fixed delay, so a slow sweep never overlaps
 * the next one on this instance. Disable with journeys.sweep.enabled=false
 * to drive sweeps only through the REST endpoint.
 */
@Component
@ConditionalOnProperty(name = "journeys.sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SweepScheduler {

    private final JourneyEngine engine;

    @Scheduled(fixedDelayString = "${journeys.sweep.interval-ms:60000}",
            initialDelayString = "${journeys.sweep.interval-ms:60000}")
    public void sweep() {
        try {
            SweepSummary summary = engine.runSweep();
            if (!summary.getErrors().isEmpty()) {
                log.warn("Scheduled sweep reported {} issue(s)", summary.getErrors().size());
            }
        } catch (Exception e) {
            log.error("Scheduled sweep failed", e);
        }
    }
}
