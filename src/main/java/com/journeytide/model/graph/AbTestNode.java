package com.journeytide.model.graph;

import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Experiment split. Variant weights are stored already normalized to 100.
 */
@Getter @Setter @NoArgsConstructor @SuperBuilder
public class AbTestNode extends JourneyNode {

    @Builder.Default
    private List<Variant> variants = new ArrayList<>();

    private String evaluationMetric;

    @Override
    public NodeType getType() {
        return NodeType.ABTEST;
    }
}
