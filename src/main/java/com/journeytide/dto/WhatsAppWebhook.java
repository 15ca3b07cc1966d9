package com.journeytide.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * WhatsApp Cloud API webhook envelope, reduced to what the engine reads.
 *
 * Example JSON (status update):
 * {
 *   "object": "whatsapp_business_account",
 *   "entry": [{
 *     "id": "1029384756",
 *     "changes": [{
 *       "field": "messages",
 *       "value": {
 *         "statuses": [{"id": "wamid.HBg...", "status": "read", "timestamp": "1714558500",
 *                       "recipient_id": "15551234567"}]
 *       }
 *     }]
 *   }]
 * }
 *
 * Button and list replies arrive in value.messages[] with interactive.button_reply
 * or interactive.list_reply, and context.id naming the message replied to.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class WhatsAppWebhook {

    private String object;
    private List<Entry> entry = new ArrayList<>();

    public List<StatusCallback> statusCallbacks() {
        List<StatusCallback> callbacks = new ArrayList<>();
        for (Value value : values()) {
            if (value.getStatuses() == null) {
                continue;
            }
            for (Status status : value.getStatuses()) {
                callbacks.add(StatusCallback.builder()
                        .messageId(status.getId())
                        .status(status.getStatus())
                        .timestamp(status.getTimestamp())
                        .recipientId(status.getRecipientId())
                        .errors(status.getErrors())
                        .build());
            }
        }
        return callbacks;
    }

    /**
     * Interactive replies only; plain text messages are not routed.
     */
    public List<InteractiveReply> interactiveReplies() {
        List<InteractiveReply> replies = new ArrayList<>();
        for (Value value : values()) {
            if (value.getMessages() == null) {
                continue;
            }
            for (Message message : value.getMessages()) {
                Interactive interactive = message.getInteractive();
                if (interactive == null) {
                    continue;
                }
                Reply reply = interactive.getButtonReply() != null
                        ? interactive.getButtonReply()
                        : interactive.getListReply();
                if (reply == null) {
                    continue;
                }
                replies.add(InteractiveReply.builder()
                        .messageId(message.getContext() != null ? message.getContext().getId() : null)
                        .from(message.getFrom())
                        .buttonId(reply.getId())
                        .buttonText(reply.getTitle())
                        .build());
            }
        }
        return replies;
    }

    private List<Value> values() {
        List<Value> values = new ArrayList<>();
        if (entry == null) {
            return values;
        }
        for (Entry e : entry) {
            if (e.getChanges() == null) {
                continue;
            }
            for (Change change : e.getChanges()) {
                if (change.getValue() != null) {
                    values.add(change.getValue());
                }
            }
        }
        return values;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    public static class Entry {
        private String id;
        private List<Change> changes;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    public static class Change {
        private String field;
        private Value value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    public static class Value {
        private List<Status> statuses;
        private List<Message> messages;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    public static class Status {
        private String id;
        private String status;
        private String timestamp;
        @JsonProperty("recipient_id")
        private String recipientId;
        private List<Map<String, Object>> errors;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    public static class Message {
        private String from;
        private String id;
        private String type;
        private Interactive interactive;
        private Context context;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    public static class Interactive {
        private String type;
        @JsonProperty("button_reply")
        private Reply buttonReply;
        @JsonProperty("list_reply")
        private Reply listReply;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    public static class Reply {
        private String id;
        private String title;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    public static class Context {
        private String from;
        private String id;
    }
}
