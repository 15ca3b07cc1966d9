package com.journeytide.model.graph;

/**
 * Discriminator of the journey node union. The walker switches over it
 * exhaustively, so adding a constant breaks the build until it is handled.
 */
public enum NodeType {
    TRIGGER,
    ACTION,
    CONDITION,
    DELAY,
    GOAL,
    EXIT,
    ABTEST
}
