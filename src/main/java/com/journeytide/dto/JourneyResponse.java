package com.journeytide.dto;

import com.journeytide.model.JourneyStatus;
import com.journeytide.model.graph.JourneyEdge;
import com.journeytide.model.graph.JourneyNode;
import com.journeytide.model.graph.JourneySettings;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class JourneyResponse {
    private UUID id;
    private String name;
    private String description;
    private String storeId;
    private JourneyStatus status;
    private List<JourneyNode> nodes;
    private List<JourneyEdge> edges;
    private JourneySettings settings;
    private Instant createdAt;
    private Instant updatedAt;
}
