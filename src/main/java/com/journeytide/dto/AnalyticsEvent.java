package com.journeytide.dto;

import lombok.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Engagement event emitted when a tracked exit path fires.
 *
 * Example JSON:
 * {
 *   "eventName": "vip_offer_read",
 *   "enrollmentId": "6f0c...",
 *   "journeyId": "a1b2...",
 *   "customerId": "cust-42",
 *   "properties": {"messageId": "wamid.HBg...", "status": "read"},
 *   "occurredAt": "2024-05-01T10:15:00Z"
 * }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AnalyticsEvent {

    private String eventName;
    private UUID enrollmentId;
    private UUID journeyId;
    private String customerId;
    private Map<String, Object> properties;
    private Instant occurredAt;
}
