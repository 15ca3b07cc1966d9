package com.journeytide.model.graph;

import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A side-effecting step. send_whatsapp parks the enrollment until a callback
 * arrives; add_tag and update_property complete inline.
 */
@Getter @Setter @NoArgsConstructor @SuperBuilder
public class ActionNode extends JourneyNode {

    @Builder.Default
    private ActionKind subtype = ActionKind.SEND_WHATSAPP;

    @Builder.Default
    private ActionConfig config = new ActionConfig();

    @Override
    public NodeType getType() {
        return NodeType.ACTION;
    }

    public ActionKind kind() {
        return subtype != null ? subtype : ActionKind.SEND_WHATSAPP;
    }

    public boolean sendsMessage() {
        return kind() == ActionKind.SEND_WHATSAPP;
    }

    public ExitPaths exitPaths() {
        return config != null ? config.getExitPaths() : null;
    }

    @Getter @Setter @NoArgsConstructor
    public static class ActionConfig {
        private String templateName;
        private String templateLanguage;
        /** Already-resolved template components, passed to the gateway untouched. */
        private List<Map<String, Object>> components = new ArrayList<>();
        private String tagName;
        private String propertyKey;
        private Object propertyValue;
        private ExitPaths exitPaths;
    }
}
