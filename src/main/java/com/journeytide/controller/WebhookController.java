package com.journeytide.controller;

import com.journeytide.dto.CallbackBatchResult;
import com.journeytide.dto.WhatsAppWebhook;
import com.journeytide.service.ExitPathRouter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * WhatsApp Cloud API webhooks (alternative to the Kafka relay).
 *
 * POST /api/webhooks/whatsapp/status   → entry[].changes[].value.statuses[]
 * POST /api/webhooks/whatsapp/replies  → entry[].changes[].value.messages[] (interactive)
 *
 * Always answers 200 with the batch counters; per-record failures are
 * reported in the body so the provider does not retry the whole envelope.
 */
@RestController
@RequestMapping("/api/webhooks/whatsapp")
@RequiredArgsConstructor
public class WebhookController {

    private final ExitPathRouter router;

    @PostMapping("/status")
    public ResponseEntity<CallbackBatchResult> status(@RequestBody WhatsAppWebhook envelope) {
        return ResponseEntity.ok(router.handleStatusBatch(envelope.statusCallbacks()));
    }

    @PostMapping("/replies")
    public ResponseEntity<CallbackBatchResult> replies(@RequestBody WhatsAppWebhook envelope) {
        return ResponseEntity.ok(router.handleReplyBatch(envelope.interactiveReplies()));
    }
}
