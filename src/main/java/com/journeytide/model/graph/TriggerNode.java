package com.journeytide.model.graph;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter @Setter @NoArgsConstructor @SuperBuilder
public class TriggerNode extends JourneyNode {

    /** Explicit subtype; when absent it is derived from trigger.type. */
    private TriggerType subtype;

    private TriggerSettings trigger;

    @Override
    public NodeType getType() {
        return NodeType.TRIGGER;
    }

    public TriggerType resolveSubtype() {
        if (subtype != null) {
            return subtype;
        }
        return TriggerType.fromLegacy(trigger != null ? trigger.getType() : null);
    }

    @Getter @Setter @NoArgsConstructor
    public static class TriggerSettings {
        /** Legacy builder trigger name: segment, abandoned_cart, webhook, manual ... */
        private String type;
        private String segmentId;
        /** Abandoned-cart age threshold. */
        private Integer hours;

        public TriggerSettings(String type, String segmentId, Integer hours) {
            this.type = type;
            this.segmentId = segmentId;
            this.hours = hours;
        }
    }
}
