package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Kinds of asynchronous messaging callbacks an exit path can react to.
 */
public enum CallbackKind {
    @JsonProperty("sent") SENT,
    @JsonProperty("delivered") DELIVERED,
    @JsonProperty("read") READ,
    @JsonProperty("failed") FAILED,
    @JsonProperty("button_clicked") BUTTON_CLICKED;

    /**
     * @return the kind for a delivery-status string, or null for statuses the engine ignores
     */
    public static CallbackKind fromStatus(String status) {
        if (status == null) {
            return null;
        }
        return switch (status.toLowerCase()) {
            case "sent" -> SENT;
            case "delivered" -> DELIVERED;
            case "read" -> READ;
            case "failed" -> FAILED;
            default -> null;
        };
    }
}
