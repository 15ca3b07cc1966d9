package com.journeytide.model.graph;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class Variant {

    private String id;

    private String label;

    private double weight;

    /** Label used to match the variant's outgoing edge, falling back to the id. */
    public String edgeLabel() {
        return label != null && !label.isBlank() ? label : id;
    }
}
