package com.journeytide.service;

import com.journeytide.model.Journey;
import com.journeytide.model.graph.AbTestNode;
import com.journeytide.model.graph.ActionNode;
import com.journeytide.model.graph.ExitPath;
import com.journeytide.model.graph.ExitPaths;
import com.journeytide.model.graph.JourneyEdge;
import com.journeytide.model.graph.JourneyNode;
import com.journeytide.model.graph.NodeType;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Structural checks a journey must pass before it can go ACTIVE:
 *   - exactly one trigger node, unique node ids
 *   - every edge connects two existing nodes
 *   - every node is reachable from the trigger, through edges or exit paths
 *   - experiments have at least two variants
 *   - send actions name a template
 *   - condition nodes have somewhere to go
 *
 * Drafts are saved without these checks.
 */
@Component
public class JourneyValidator {

    public void validate(Journey journey) {
        List<String> problems = check(journey);
        if (!problems.isEmpty()) {
            throw new JourneyValidationException(problems);
        }
    }

    public List<String> check(Journey journey) {
        List<String> problems = new ArrayList<>();
        List<JourneyNode> nodes = journey.getNodes() != null ? journey.getNodes() : List.of();
        List<JourneyEdge> edges = journey.getEdges() != null ? journey.getEdges() : List.of();

        Set<String> ids = new HashSet<>();
        for (JourneyNode node : nodes) {
            if (node.getId() == null || node.getId().isBlank()) {
                problems.add("Node without an id");
            } else if (!ids.add(node.getId())) {
                problems.add("Duplicate node id " + node.getId());
            }
        }

        long triggers = nodes.stream().filter(n -> n.getType() == NodeType.TRIGGER).count();
        if (triggers != 1) {
            problems.add("Journey must have exactly one trigger node, found " + triggers);
        }

        for (JourneyEdge edge : edges) {
            if (!ids.contains(edge.getSource())) {
                problems.add("Edge " + edge.getId() + " starts at missing node " + edge.getSource());
            }
            if (!ids.contains(edge.getTarget())) {
                problems.add("Edge " + edge.getId() + " points at missing node " + edge.getTarget());
            }
        }

        for (JourneyNode node : nodes) {
            switch (node.getType()) {
                case ABTEST -> {
                    AbTestNode experiment = (AbTestNode) node;
                    if (experiment.getVariants() == null || experiment.getVariants().size() < 2) {
                        problems.add("Experiment " + node.getId() + " needs at least two variants");
                    }
                }
                case ACTION -> {
                    ActionNode action = (ActionNode) node;
                    if (action.sendsMessage() && (action.getConfig() == null
                            || action.getConfig().getTemplateName() == null
                            || action.getConfig().getTemplateName().isBlank())) {
                        problems.add("Send action " + node.getId() + " has no template");
                    }
                }
                case CONDITION -> {
                    if (journey.outgoingEdges(node.getId()).isEmpty()) {
                        problems.add("Condition " + node.getId() + " has no outgoing edges");
                    }
                }
                case TRIGGER, DELAY, GOAL, EXIT -> {
                    // nothing node-specific
                }
            }
        }

        if (triggers == 1) {
            Set<String> reachable = reachableFromTrigger(journey);
            for (JourneyNode node : nodes) {
                if (node.getId() != null && !reachable.contains(node.getId())) {
                    problems.add("Node " + node.getId() + " is not reachable from the trigger");
                }
            }
        }
        return problems;
    }

    private Set<String> reachableFromTrigger(Journey journey) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        journey.findTriggerNode().ifPresent(trigger -> queue.add(trigger.getId()));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current == null || !seen.add(current)) {
                continue;
            }
            for (JourneyEdge edge : journey.outgoingEdges(current)) {
                if (edge.getTarget() != null) {
                    queue.add(edge.getTarget());
                }
            }
            journey.findNode(current)
                    .filter(node -> node.getType() == NodeType.ACTION)
                    .map(node -> ((ActionNode) node).exitPaths())
                    .ifPresent(paths -> exitPathTargets(paths).stream()
                            .map(journey::findBranchTarget)
                            .flatMap(Optional::stream)
                            .forEach(target -> queue.add(target.getId())));
        }
        return seen;
    }

    /** Branch ids and timeout paths an exit-path configuration can jump to. */
    private List<String> exitPathTargets(ExitPaths paths) {
        List<ExitPath> all = new ArrayList<>();
        all.add(paths.getSent());
        all.add(paths.getDelivered());
        all.add(paths.getRead());
        all.add(paths.getFailed());
        if (paths.getButtonClicked() != null) {
            all.addAll(paths.getButtonClicked());
        }
        List<String> targets = new ArrayList<>();
        for (ExitPath path : all) {
            if (path == null || !path.isEnabled() || path.getAction() == null) {
                continue;
            }
            if (path.getAction().getBranchId() != null) {
                targets.add(path.getAction().getBranchId());
            }
            if (path.getAction().getTimeoutPath() != null) {
                targets.add(path.getAction().getTimeoutPath());
            }
        }
        return targets;
    }
}
