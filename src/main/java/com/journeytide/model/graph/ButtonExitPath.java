package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Exit path bound to one interactive button of the sent message.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter @Setter @NoArgsConstructor
public class ButtonExitPath extends ExitPath {

    private ButtonConfig buttonConfig;

    public ButtonExitPath(String buttonId, ExitAction action) {
        super(true, action);
        this.buttonConfig = new ButtonConfig(buttonId, null);
    }

    public boolean matches(String buttonId) {
        return isEnabled() && buttonConfig != null && buttonId != null
                && buttonId.equals(buttonConfig.getButtonId());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    public static class ButtonConfig {
        private String buttonId;
        private String customPayload;
    }
}
