package com.journeytide.dto;

import lombok.*;

import java.util.List;
import java.util.Map;

/**
 * A delivery status update for a sent message, flattened out of the
 * WhatsApp webhook envelope.
 *
 * Example:
 *   messageId   = "wamid.HBgLMTU1NTEyMzQ1NjcVAgARGBI..."
 *   status      = "read"
 *   timestamp   = "1714558500"
 *   recipientId = "15551234567"
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class StatusCallback {

    private String messageId;
    private String status;
    private String timestamp;
    private String recipientId;
    private List<Map<String, Object>> errors;
}
