package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Reaction configured on a send node for one callback kind.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class ExitPath {

    private boolean enabled;

    private TrackingConfig tracking;

    /** Only honoured on button-click paths. */
    private List<ProfileUpdate> profileUpdates = new ArrayList<>();

    private ExitAction action;

    public ExitPath(boolean enabled, ExitAction action) {
        this.enabled = enabled;
        this.action = action;
    }

    public boolean tracks() {
        return tracking != null && tracking.isEnabled()
                && tracking.getEventName() != null && !tracking.getEventName().isBlank();
    }
}
