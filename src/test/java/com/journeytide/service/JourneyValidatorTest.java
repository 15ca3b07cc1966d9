package com.journeytide.service;

import com.journeytide.model.Journey;
import com.journeytide.model.graph.ExitAction;
import com.journeytide.model.graph.Variant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.journeytide.service.JourneyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class JourneyValidatorTest {

    private final JourneyValidator validator = new JourneyValidator();

    @Test
    @DisplayName("Well-formed journey passes")
    void wellFormed_passes() {
        Journey journey = journey(List.of(trigger("t"), send("s", "welcome", null), goal("g")),
                List.of(edge("t", "s"), edge("s", "g")));

        assertTrue(validator.check(journey).isEmpty());
        assertDoesNotThrow(() -> validator.validate(journey));
    }

    @Test
    @DisplayName("Nodes reached only through exit paths count as reachable")
    void exitPathTargets_areReachable() {
        Journey journey = journey(
                List.of(trigger("t"), send("s", "welcome", onRead(ExitAction.waitFor(30, "nudge_path"))),
                        goal("nudge", "nudge_path")),
                List.of(edge("t", "s")));

        assertTrue(validator.check(journey).isEmpty());
    }

    @Test
    @DisplayName("Missing or duplicate trigger is reported")
    void triggerCount_reported() {
        Journey none = journey(List.of(goal("g")), List.of());
        Journey two = journey(List.of(trigger("t1"), trigger("t2")), List.of());

        assertTrue(validator.check(none).contains("Journey must have exactly one trigger node, found 0"));
        assertTrue(validator.check(two).contains("Journey must have exactly one trigger node, found 2"));
    }

    @Test
    @DisplayName("Broken graph collects every problem at once")
    void brokenGraph_collectsAllProblems() {
        Journey journey = journey(
                List.of(trigger("t"), send("s", null, null), abTest("ab", new Variant("a", "A", 100)),
                        condition("c"), goal("orphan")),
                List.of(edge("t", "s"), edge("s", "ab"), edge("ab", "c"), edge("ab", "ghost")));

        JourneyValidationException e = assertThrows(JourneyValidationException.class,
                () -> validator.validate(journey));

        assertTrue(e.getProblems().contains("Send action s has no template"));
        assertTrue(e.getProblems().contains("Experiment ab needs at least two variants"));
        assertTrue(e.getProblems().contains("Condition c has no outgoing edges"));
        assertTrue(e.getProblems().contains("Edge ab->ghost points at missing node ghost"));
        assertTrue(e.getProblems().contains("Node orphan is not reachable from the trigger"));
    }
}
