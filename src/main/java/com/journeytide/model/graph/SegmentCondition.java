package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One comparison of a customer field against a value, e.g.
 *   {"field": "total_spent", "operator": "greater_than", "value": 500}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class SegmentCondition {

    private String field;

    private ConditionOperator operator;

    private Object value;
}
