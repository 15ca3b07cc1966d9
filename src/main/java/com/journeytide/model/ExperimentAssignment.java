package com.journeytide.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The variant an enrollment was bucketed into at an abtest node.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ExperimentAssignment {

    private String variantId;
    private String label;
    private double weight;
    private String edgeId;
    private Instant assignedAt;

    public Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("variantId", variantId);
        details.put("label", label);
        details.put("weight", weight);
        details.put("assignedAt", assignedAt != null ? assignedAt.toString() : null);
        if (edgeId != null) {
            details.put("edgeId", edgeId);
        }
        return details;
    }
}
