package com.journeytide.model.graph;

import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

@NoArgsConstructor @SuperBuilder
public class ExitNode extends JourneyNode {

    @Override
    public NodeType getType() {
        return NodeType.EXIT;
    }
}
