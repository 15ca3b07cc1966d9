package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Directed edge between two nodes. Condition and experiment nodes pick their
 * outgoing edge by label (Yes/No, variant label).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class JourneyEdge {

    private String id;

    private String source;

    private String target;

    private String label;

    public boolean hasLabel(String candidate) {
        return label != null && candidate != null && label.equalsIgnoreCase(candidate);
    }

    @JsonIgnore
    public boolean isDefaultBranch() {
        return label == null || label.isBlank()
                || "default".equalsIgnoreCase(label) || "else".equalsIgnoreCase(label);
    }
}
