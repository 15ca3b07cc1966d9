package com.journeytide.model;

import com.journeytide.model.graph.ActionNode;
import com.journeytide.model.graph.JourneyEdge;
import com.journeytide.model.graph.JourneyNode;
import com.journeytide.model.graph.JourneySettings;
import com.journeytide.model.graph.NodeType;
import com.journeytide.model.graph.TriggerNode;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A journey defines WHO enters (the trigger node) and WHAT happens to them
 * (the node graph). Nodes, edges and settings are stored as JSON documents on
 * the journey row; the graph is read-only while enrollments walk it.
 *
 * Example:
 *   name     = "Abandoned cart recovery"
 *   status   = ACTIVE
 *   nodes    = [ trigger(abandoned_cart, 2h), action(send_whatsapp), goal ]
 *   edges    = [ trigger → action, action → goal ]
 *   settings = { allowReentry: true, reentryCooldownDays: 7 }
 */
@Entity
@Table(name = "journeys", indexes = {
    @Index(name = "idx_journeys_status", columnList = "status")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Journey {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    private String description;

    /** Tenant that owns the journey. */
    @Column(name = "store_id")
    private String storeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private JourneyStatus status = JourneyStatus.DRAFT;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "nodes", nullable = false, columnDefinition = "jsonb")
    @Builder.Default
    private List<JourneyNode> nodes = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "edges", nullable = false, columnDefinition = "jsonb")
    @Builder.Default
    private List<JourneyEdge> edges = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "settings", columnDefinition = "jsonb")
    @Builder.Default
    private JourneySettings settings = new JourneySettings();

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public boolean isActive() {
        return status == JourneyStatus.ACTIVE;
    }

    public JourneySettings effectiveSettings() {
        return settings != null ? settings : new JourneySettings();
    }

    public Optional<JourneyNode> findNode(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            return Optional.empty();
        }
        return nodeList().stream().filter(node -> nodeId.equals(node.getId())).findFirst();
    }

    /**
     * Resolves an exit-path branch target. Node ids win over branch aliases.
     */
    public Optional<JourneyNode> findBranchTarget(String target) {
        Optional<JourneyNode> byId = findNode(target);
        if (byId.isPresent()) {
            return byId;
        }
        return nodeList().stream().filter(node -> node.answersTo(target)).findFirst();
    }

    public Optional<TriggerNode> findTriggerNode() {
        return nodeList().stream()
                .filter(node -> node.getType() == NodeType.TRIGGER)
                .map(TriggerNode.class::cast)
                .findFirst();
    }

    public List<JourneyEdge> outgoingEdges(String nodeId) {
        if (edges == null) {
            return List.of();
        }
        return edges.stream().filter(edge -> nodeId != null && nodeId.equals(edge.getSource())).toList();
    }

    public Optional<JourneyEdge> firstOutgoingEdge(String nodeId) {
        return outgoingEdges(nodeId).stream().findFirst();
    }

    public boolean hasSendActions() {
        return nodeList().stream()
                .filter(node -> node.getType() == NodeType.ACTION)
                .map(ActionNode.class::cast)
                .anyMatch(ActionNode::sendsMessage);
    }

    private List<JourneyNode> nodeList() {
        return nodes != null ? nodes : List.of();
    }
}
