package com.journeytide.service;

import com.journeytide.config.JourneyEngineProperties;
import com.journeytide.dto.AnalyticsEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes exit-path tracking events to the analytics topic, keyed by
 * enrollment id so one customer's events stay ordered.
 *
 * Tracking is best effort: a publish failure is logged and never blocks the
 * routing decision it belongs to.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnalyticsPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final JourneyEngineProperties properties;

    public void publish(AnalyticsEvent event) {
        try {
            String message = objectMapper.writeValueAsString(event);
            String key = event.getEnrollmentId() != null ? event.getEnrollmentId().toString() : null;
            kafkaTemplate.send(properties.getTopics().getAnalytics(), key, message);
            log.info("Tracked event: name={}, enrollmentId={}, journeyId={}",
                    event.getEventName(), event.getEnrollmentId(), event.getJourneyId());
        } catch (Exception e) {
            log.error("Failed to publish analytics event {}: {}", event.getEventName(), e.getMessage(), e);
        }
    }
}
