package com.journeytide.model.graph;

public enum LogicalOperator {
    AND,
    OR
}
