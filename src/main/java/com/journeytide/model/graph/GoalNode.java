package com.journeytide.model.graph;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter @Setter @NoArgsConstructor @SuperBuilder
public class GoalNode extends JourneyNode {

    private String goalType;

    private String description;

    @Override
    public NodeType getType() {
        return NodeType.GOAL;
    }
}
