package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How customers enter a journey. Only the first two are polled by the sweep.
 */
public enum TriggerType {
    @JsonProperty("segment_joined") SEGMENT_JOINED,
    @JsonProperty("abandoned_cart") ABANDONED_CART,
    @JsonProperty("event_trigger") EVENT_TRIGGER,
    @JsonProperty("date_time") DATE_TIME,
    @JsonProperty("manual_entry") MANUAL_ENTRY;

    /**
     * Maps the legacy builder trigger names onto a subtype.
     */
    public static TriggerType fromLegacy(String legacyType) {
        if (legacyType == null) {
            return MANUAL_ENTRY;
        }
        return switch (legacyType) {
            case "segment" -> SEGMENT_JOINED;
            case "abandoned_cart" -> ABANDONED_CART;
            case "custom_date", "birthday" -> DATE_TIME;
            case "webhook", "order_placed", "tag_added", "first_purchase", "repeat_purchase" -> EVENT_TRIGGER;
            default -> MANUAL_ENTRY;
        };
    }
}
