package com.journeytide.service;

import com.journeytide.config.JourneyEngineProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Dead-letter handler for callback payloads the engine cannot read.
 *
 * Malformed webhook envelopes are parked on the DLQ topic with the error and
 * where they came from, so nothing is silently lost and the payload can be
 * inspected later. Callbacks that parse but do not apply (unknown message,
 * stale node) are skips, not dead letters.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeadLetterQueueService {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final JourneyEngineProperties properties;

    public void sendRawToDlq(String rawMessage, String source, String errorMessage) {
        try {
            Map<String, Object> dlqMessage = new HashMap<>();
            dlqMessage.put("rawMessage", rawMessage);
            dlqMessage.put("source", source);
            dlqMessage.put("error", errorMessage);
            dlqMessage.put("timestamp", System.currentTimeMillis());

            String message = objectMapper.writeValueAsString(dlqMessage);
            kafkaTemplate.send(properties.getTopics().getDlq(), message);
            log.info("Unparseable callback sent to DLQ: source={}, error={}", source, errorMessage);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to send callback to DLQ: {}", e.getMessage(), e);
        }
    }
}
