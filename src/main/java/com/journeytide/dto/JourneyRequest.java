package com.journeytide.dto;

import com.journeytide.model.JourneyStatus;
import com.journeytide.model.graph.JourneyEdge;
import com.journeytide.model.graph.JourneyNode;
import com.journeytide.model.graph.JourneySettings;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class JourneyRequest {

    @NotBlank(message = "name is required")
    private String name;

    private String description;

    private String storeId;

    /** Defaults to DRAFT. */
    private JourneyStatus status;

    private List<JourneyNode> nodes;

    private List<JourneyEdge> edges;

    private JourneySettings settings;
}
