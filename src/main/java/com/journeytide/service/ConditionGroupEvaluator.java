package com.journeytide.service;

import com.journeytide.model.CustomerProfile;
import com.journeytide.model.graph.ConditionGroup;
import com.journeytide.model.graph.ConditionOperator;
import com.journeytide.model.graph.LogicalOperator;
import com.journeytide.model.graph.SegmentCondition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates segment condition groups against a customer profile.
 *
 * Supported field names (anything else is looked up in the profile's custom
 * attributes):
 *   customer_name, customer_email, customer_phone, customer_tags,
 *   location_country, location_city, location_state, location_postal_code,
 *   customer_since, accepts_marketing (marketing_opt_in, email_opt_in),
 *   total_orders, total_spent, average_order_value, last_order_date,
 *   days_since_last_order, never_ordered
 *
 * String comparisons are case-insensitive. A condition whose field or value
 * cannot be coerced to the operator's type does not match.
 *
 * Example:
 *   groups = [ {AND: total_spent greater_than 500, customer_tags contains "vip"} ]
 *   customer = {totalSpent: 740, tags: "VIP, newsletter"}
 *   → true
 */
@Component
@RequiredArgsConstructor
public class ConditionGroupEvaluator implements SegmentEvaluator {

    private final Clock clock;

    /**
     * Groups are ANDed; an empty group list or an empty group matches everyone.
     */
    @Override
    public boolean matches(CustomerProfile customer, List<ConditionGroup> groups) {
        if (groups == null || groups.isEmpty()) {
            return true;
        }
        return groups.stream().allMatch(group -> matchesGroup(customer, group));
    }

    private boolean matchesGroup(CustomerProfile customer, ConditionGroup group) {
        if (group == null || group.getConditions() == null || group.getConditions().isEmpty()) {
            return true;
        }
        if (group.getGroupOperator() == LogicalOperator.OR) {
            return group.getConditions().stream().anyMatch(condition -> evaluate(customer, condition));
        }
        return group.getConditions().stream().allMatch(condition -> evaluate(customer, condition));
    }

    public boolean evaluate(CustomerProfile customer, SegmentCondition condition) {
        if (condition == null || condition.getOperator() == null || customer == null) {
            return false;
        }
        Object actual = resolveField(customer, condition.getField());
        return compare(actual, condition.getOperator(), condition.getValue());
    }

    Object resolveField(CustomerProfile customer, String field) {
        if (field == null) {
            return null;
        }
        int orders = customer.getOrdersCount() != null ? customer.getOrdersCount() : 0;
        BigDecimal spent = customer.getTotalSpent() != null ? customer.getTotalSpent() : BigDecimal.ZERO;

        return switch (field) {
            case "customer_name" -> customer.fullName();
            case "customer_email" -> nullToEmpty(customer.getEmail());
            case "customer_phone" -> nullToEmpty(customer.getPhone());
            case "customer_tags" -> nullToEmpty(customer.getTags());
            case "location_country" -> nullToEmpty(customer.getCountry());
            case "location_city" -> nullToEmpty(customer.getCity());
            case "location_state" -> nullToEmpty(customer.getProvince());
            case "location_postal_code" -> nullToEmpty(customer.getZip());
            case "customer_since" -> customer.getCreatedAt();
            case "accepts_marketing", "marketing_opt_in", "email_opt_in" ->
                    Boolean.TRUE.equals(customer.getAcceptsMarketing());
            case "total_orders" -> orders;
            case "total_spent" -> spent.doubleValue();
            case "average_order_value" -> orders > 0 ? spent.doubleValue() / orders : 0.0;
            // updatedAt is the closest signal of the last order the storefront sync gives us
            case "first_order_date", "last_order_date" -> customer.getUpdatedAt();
            case "days_since_last_order" -> customer.getUpdatedAt() != null
                    ? Duration.between(customer.getUpdatedAt(), clock.instant()).toDays()
                    : 999L;
            case "never_ordered" -> orders == 0;
            default -> customer.attributesMap().get(field);
        };
    }

    private boolean compare(Object actual, ConditionOperator operator, Object target) {
        String actualText = actual instanceof String ? ((String) actual).toLowerCase() : null;
        String targetText = target instanceof String ? ((String) target).toLowerCase() : null;
        boolean bothText = actualText != null && targetText != null;

        return switch (operator) {
            case EQUALS -> bothText ? actualText.equals(targetText) : looselyEqual(actual, target);
            case NOT_EQUALS -> bothText ? !actualText.equals(targetText) : !looselyEqual(actual, target);
            case CONTAINS -> bothText && actualText.contains(targetText);
            case NOT_CONTAINS -> bothText && !actualText.contains(targetText);
            case STARTS_WITH -> bothText && actualText.startsWith(targetText);
            case ENDS_WITH -> bothText && actualText.endsWith(targetText);
            case GREATER_THAN -> compareNumbers(actual, target) > 0;
            case LESS_THAN -> compareNumbers(actual, target) < 0;
            case BETWEEN -> isBetween(actual, target);
            case IS_EMPTY -> isEmpty(actual);
            case IS_NOT_EMPTY -> !isEmpty(actual);
            case IN_LAST_DAYS -> isInLastDays(actual, target);
            case BEFORE_DATE -> {
                Instant a = toInstant(actual);
                Instant b = toInstant(target);
                yield a != null && b != null && a.isBefore(b);
            }
            case AFTER_DATE -> {
                Instant a = toInstant(actual);
                Instant b = toInstant(target);
                yield a != null && b != null && a.isAfter(b);
            }
        };
    }

    /** Positive when actual > target; zero when either side is not numeric. */
    private int compareNumbers(Object actual, Object target) {
        Double a = toNumber(actual);
        Double b = toNumber(target);
        if (a == null || b == null) {
            return 0;
        }
        return Double.compare(a, b);
    }

    private boolean looselyEqual(Object actual, Object target) {
        Double a = toNumber(actual);
        Double b = toNumber(target);
        if (a != null && b != null && (actual instanceof Number || target instanceof Number)) {
            return a.doubleValue() == b.doubleValue();
        }
        if (actual instanceof Boolean || target instanceof Boolean) {
            return Objects.equals(String.valueOf(actual).toLowerCase(), String.valueOf(target).toLowerCase());
        }
        return Objects.equals(actual, target);
    }

    private boolean isBetween(Object actual, Object target) {
        List<?> range;
        if (target instanceof Collection) {
            range = List.copyOf((Collection<?>) target);
        } else {
            range = Arrays.asList(String.valueOf(target).split(","));
        }
        if (range.size() < 2) {
            return false;
        }
        Double value = toNumber(actual);
        Double min = toNumber(range.get(0));
        Double max = toNumber(range.get(1));
        return value != null && min != null && max != null && value >= min && value <= max;
    }

    private boolean isEmpty(Object value) {
        return value == null || (value instanceof String && ((String) value).isBlank());
    }

    private boolean isInLastDays(Object actual, Object target) {
        Double days = toNumber(target);
        Instant when = toInstant(actual);
        if (days == null || when == null) {
            return false;
        }
        Instant since = clock.instant().minusMillis((long) (days * 86_400_000L));
        return !when.isBefore(since);
    }

    private Double toNumber(Object value) {
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            return Double.isFinite(number) ? number : null;
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue());
        }
        if (value instanceof String && !((String) value).isBlank()) {
            String text = ((String) value).trim();
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                try {
                    return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
                } catch (DateTimeParseException ignored) {
                    return null;
                }
            }
        }
        return null;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
