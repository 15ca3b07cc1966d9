package com.journeytide.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a successful Cloud API send:
 *   {"messaging_product": "whatsapp", "contacts": [...], "messages": [{"id": "wamid.HBg..."}]}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WhatsAppSendResponse {

    @JsonProperty("messaging_product")
    private String messagingProduct;

    @Builder.Default
    private List<SentMessage> messages = new ArrayList<>();

    public String firstMessageId() {
        if (messages == null || messages.isEmpty() || messages.get(0) == null) {
            return null;
        }
        return messages.get(0).getId();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    public static class SentMessage {
        private String id;
    }
}
