package com.journeytide.model.graph;

import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Yes/No split on the customer's current profile. The outgoing edge labelled
 * with the outcome is taken; an unlabelled (or "default"/"else") edge catches
 * the rest.
 */
@Getter @Setter @NoArgsConstructor @SuperBuilder
public class ConditionNode extends JourneyNode {

    @Builder.Default
    private List<ConditionGroup> conditionGroups = new ArrayList<>();

    /** Optional: the customer must also be a member of this segment. */
    private String segmentId;

    @Builder.Default
    private String trueLabel = "Yes";

    @Builder.Default
    private String falseLabel = "No";

    @Override
    public NodeType getType() {
        return NodeType.CONDITION;
    }

    public String labelFor(boolean outcome) {
        if (outcome) {
            return trueLabel != null ? trueLabel : "Yes";
        }
        return falseLabel != null ? falseLabel : "No";
    }
}
