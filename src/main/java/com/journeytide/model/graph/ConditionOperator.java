package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ConditionOperator {
    @JsonProperty("equals") EQUALS,
    @JsonProperty("not_equals") NOT_EQUALS,
    @JsonProperty("contains") CONTAINS,
    @JsonProperty("not_contains") NOT_CONTAINS,
    @JsonProperty("starts_with") STARTS_WITH,
    @JsonProperty("ends_with") ENDS_WITH,
    @JsonProperty("greater_than") GREATER_THAN,
    @JsonProperty("less_than") LESS_THAN,
    @JsonProperty("between") BETWEEN,
    @JsonProperty("is_empty") IS_EMPTY,
    @JsonProperty("is_not_empty") IS_NOT_EMPTY,
    @JsonProperty("in_last_days") IN_LAST_DAYS,
    @JsonProperty("before_date") BEFORE_DATE,
    @JsonProperty("after_date") AFTER_DATE
}
