package com.journeytide.service;

import com.journeytide.dto.CallbackBatchResult;
import com.journeytide.dto.WhatsAppWebhook;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for webhook envelopes relayed onto the callbacks topic.
 *
 * FLOW:
 *   Webhook relay publishes the raw envelope → "journeys.callbacks"
 *                                                ↓
 *                                      CallbackListener reads it
 *                                                ↓
 *                           statuses[] → ExitPathRouter.handleStatusBatch()
 *                           messages[] → ExitPathRouter.handleReplyBatch()
 *
 * The consumer group "journeys-router" gives each envelope to exactly one
 * instance. Envelopes that do not parse go to the DLQ.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CallbackListener {

    private final ExitPathRouter router;
    private final ObjectMapper objectMapper;
    private final DeadLetterQueueService deadLetterQueueService;

    @KafkaListener(topics = "${journeys.topics.callbacks:journeys.callbacks}", groupId = "journeys-router")
    public void onCallback(String message) {
        WhatsAppWebhook envelope;
        try {
            envelope = objectMapper.readValue(message, WhatsAppWebhook.class);
        } catch (Exception e) {
            log.error("Failed to parse callback envelope: {}", e.getMessage());
            deadLetterQueueService.sendRawToDlq(message, "kafka", e.getMessage());
            return;
        }

        CallbackBatchResult result = router.handleStatusBatch(envelope.statusCallbacks());
        result.merge(router.handleReplyBatch(envelope.interactiveReplies()));
        log.debug("Callback envelope applied: processed={}, skipped={}, failed={}",
                result.getProcessed(), result.getSkipped(), result.getFailed());
    }
}
