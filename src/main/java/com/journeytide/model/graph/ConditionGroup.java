package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Conditions combined by groupOperator. Groups themselves are always ANDed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class ConditionGroup {

    private LogicalOperator groupOperator = LogicalOperator.AND;

    private List<SegmentCondition> conditions = new ArrayList<>();
}
