package com.journeytide.service;

import com.journeytide.model.CustomerProfile;
import com.journeytide.model.graph.ConditionGroup;
import com.journeytide.model.graph.ConditionOperator;
import com.journeytide.model.graph.LogicalOperator;
import com.journeytide.model.graph.SegmentCondition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConditionGroupEvaluatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private ConditionGroupEvaluator evaluator;
    private CustomerProfile vip;

    @BeforeEach
    void setUp() {
        evaluator = new ConditionGroupEvaluator(Clock.fixed(NOW, ZoneOffset.UTC));
        vip = CustomerProfile.builder()
                .id("cust-1")
                .firstName("Ana")
                .lastName("Lima")
                .email("ana@example.com")
                .phone("+15551234567")
                .tags("VIP, newsletter")
                .ordersCount(4)
                .totalSpent(new BigDecimal("740.00"))
                .acceptsMarketing(true)
                .country("BR")
                .createdAt(NOW.minus(Duration.ofDays(400)))
                .updatedAt(NOW.minus(Duration.ofDays(3)))
                .attributes(new LinkedHashMap<>(Map.of("loyalty_tier", "gold")))
                .build();
    }

    private static SegmentCondition cond(String field, ConditionOperator op, Object value) {
        return new SegmentCondition(field, op, value);
    }

    private static ConditionGroup group(LogicalOperator op, SegmentCondition... conditions) {
        return new ConditionGroup(op, List.of(conditions));
    }

    @Nested
    @DisplayName("Group logic")
    class GroupLogic {

        @Test
        @DisplayName("No groups matches every customer")
        void noGroups_matchesEveryone() {
            assertTrue(evaluator.matches(vip, List.of()));
            assertTrue(evaluator.matches(vip, null));
        }

        @Test
        @DisplayName("AND group requires every condition")
        void andGroup_requiresAll() {
            ConditionGroup g = group(LogicalOperator.AND,
                    cond("total_spent", ConditionOperator.GREATER_THAN, 500),
                    cond("customer_tags", ConditionOperator.CONTAINS, "vip"));
            assertTrue(evaluator.matches(vip, List.of(g)));

            ConditionGroup failing = group(LogicalOperator.AND,
                    cond("total_spent", ConditionOperator.GREATER_THAN, 500),
                    cond("location_country", ConditionOperator.EQUALS, "US"));
            assertFalse(evaluator.matches(vip, List.of(failing)));
        }

        @Test
        @DisplayName("OR group needs a single matching condition")
        void orGroup_needsOne() {
            ConditionGroup g = group(LogicalOperator.OR,
                    cond("location_country", ConditionOperator.EQUALS, "US"),
                    cond("total_orders", ConditionOperator.GREATER_THAN, 3));
            assertTrue(evaluator.matches(vip, List.of(g)));
        }

        @Test
        @DisplayName("Groups are combined with AND")
        void groupsAreAnded() {
            ConditionGroup matching = group(LogicalOperator.OR,
                    cond("customer_tags", ConditionOperator.CONTAINS, "vip"));
            ConditionGroup failing = group(LogicalOperator.OR,
                    cond("never_ordered", ConditionOperator.EQUALS, true));
            assertFalse(evaluator.matches(vip, List.of(matching, failing)));
        }
    }

    @Nested
    @DisplayName("Operators")
    class Operators {

        @Test
        @DisplayName("String comparisons ignore case")
        void stringsIgnoreCase() {
            assertTrue(evaluator.evaluate(vip, cond("customer_email", ConditionOperator.ENDS_WITH, "@EXAMPLE.com")));
            assertTrue(evaluator.evaluate(vip, cond("customer_name", ConditionOperator.STARTS_WITH, "ana")));
            assertTrue(evaluator.evaluate(vip, cond("location_country", ConditionOperator.EQUALS, "br")));
            assertTrue(evaluator.evaluate(vip, cond("customer_tags", ConditionOperator.NOT_CONTAINS, "wholesale")));
        }

        @Test
        @DisplayName("Numeric operators coerce string targets")
        void numericCoercion() {
            assertTrue(evaluator.evaluate(vip, cond("total_spent", ConditionOperator.GREATER_THAN, "699.99")));
            assertTrue(evaluator.evaluate(vip, cond("total_orders", ConditionOperator.EQUALS, 4)));
            assertTrue(evaluator.evaluate(vip, cond("average_order_value", ConditionOperator.BETWEEN, List.of(100, 200))));
            assertTrue(evaluator.evaluate(vip, cond("total_spent", ConditionOperator.BETWEEN, "700,800")));
            assertFalse(evaluator.evaluate(vip, cond("total_spent", ConditionOperator.LESS_THAN, "abc")));
        }

        @Test
        @DisplayName("Empty checks treat missing and blank values alike")
        void emptyChecks() {
            assertTrue(evaluator.evaluate(vip, cond("location_city", ConditionOperator.IS_EMPTY, null)));
            assertTrue(evaluator.evaluate(vip, cond("customer_phone", ConditionOperator.IS_NOT_EMPTY, null)));
            assertTrue(evaluator.evaluate(vip, cond("unknown_attribute", ConditionOperator.IS_EMPTY, null)));
        }

        @Test
        @DisplayName("Date operators compare against the clock")
        void dateOperators() {
            assertTrue(evaluator.evaluate(vip, cond("last_order_date", ConditionOperator.IN_LAST_DAYS, 7)));
            assertFalse(evaluator.evaluate(vip, cond("last_order_date", ConditionOperator.IN_LAST_DAYS, 2)));
            assertTrue(evaluator.evaluate(vip, cond("customer_since", ConditionOperator.BEFORE_DATE, "2024-01-01")));
            assertTrue(evaluator.evaluate(vip, cond("customer_since", ConditionOperator.AFTER_DATE, "2023-01-01T00:00:00Z")));
            assertTrue(evaluator.evaluate(vip, cond("days_since_last_order", ConditionOperator.LESS_THAN, 5)));
        }

        @Test
        @DisplayName("Unknown fields fall back to custom attributes")
        void customAttributes() {
            assertTrue(evaluator.evaluate(vip, cond("loyalty_tier", ConditionOperator.EQUALS, "GOLD")));
        }

        @Test
        @DisplayName("Marketing aliases read the same flag")
        void marketingAliases() {
            assertTrue(evaluator.evaluate(vip, cond("accepts_marketing", ConditionOperator.EQUALS, true)));
            assertTrue(evaluator.evaluate(vip, cond("email_opt_in", ConditionOperator.EQUALS, "true")));
        }

        @Test
        @DisplayName("Customer without orders reports a sentinel for days since last order")
        void neverOrdered() {
            CustomerProfile fresh = CustomerProfile.builder().id("cust-2").ordersCount(0).build();
            assertTrue(evaluator.evaluate(fresh, cond("never_ordered", ConditionOperator.EQUALS, true)));
            assertTrue(evaluator.evaluate(fresh, cond("days_since_last_order", ConditionOperator.GREATER_THAN, 900)));
        }

        @Test
        @DisplayName("A condition without operator never matches")
        void missingOperator() {
            assertFalse(evaluator.evaluate(vip, cond("total_spent", null, 1)));
        }
    }
}
