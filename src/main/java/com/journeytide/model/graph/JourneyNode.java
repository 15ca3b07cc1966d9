package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * One node of a journey graph, stored as JSON inside the journey row.
 *
 * The "type" property selects the concrete subclass:
 *   {"type": "delay", "id": "wait_1h", "duration": 1, "unit": "hours"}
 *
 * Layout fields sent by the builder UI (position, styling) are ignored.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TriggerNode.class, name = "trigger"),
        @JsonSubTypes.Type(value = ActionNode.class, name = "action"),
        @JsonSubTypes.Type(value = ConditionNode.class, name = "condition"),
        @JsonSubTypes.Type(value = DelayNode.class, name = "delay"),
        @JsonSubTypes.Type(value = GoalNode.class, name = "goal"),
        @JsonSubTypes.Type(value = ExitNode.class, name = "exit"),
        @JsonSubTypes.Type(value = AbTestNode.class, name = "abtest")
})
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter @Setter @NoArgsConstructor @SuperBuilder
public abstract class JourneyNode {

    private String id;

    private String name;

    /**
     * Alias that exit paths may use instead of the node id when branching.
     */
    private String branchId;

    @JsonIgnore
    public abstract NodeType getType();

    public boolean answersTo(String target) {
        return target != null && (target.equals(id) || target.equals(branchId));
    }
}
