package com.journeytide.service;

import com.journeytide.model.CustomerProfile;
import com.journeytide.model.graph.ConditionGroup;

import java.util.List;

/**
 * Decides whether a customer matches a tree of condition groups.
 * Implementations must be side-effect free.
 */
public interface SegmentEvaluator {

    boolean matches(CustomerProfile customer, List<ConditionGroup> groups);
}
