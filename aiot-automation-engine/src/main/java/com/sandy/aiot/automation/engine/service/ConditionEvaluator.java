package com.sandy.aiot.automation.engine.service;

import com.sandy.aiot.automation.engine.exception.ConfigurationException;
import com.sandy.aiot.automation.engine.model.ComparisonOperator;
import com.sandy.aiot.automation.engine.model.Condition;
import com.sandy.aiot.automation.engine.model.ConditionType;
import com.sandy.aiot.automation.engine.model.LogicOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates a rule's condition list against a {@link StateSnapshot}.
 * <p>
 * A leaf whose value cannot be resolved, or whose comparison fails, is false; evaluation never throws.
 * AND = all leaves, OR = any leaf, NOT = not(all leaves). An empty list is true.
 */
@Component
@Slf4j
public class ConditionEvaluator {

    public static final Set<String> TIME_PROPERTIES = Set.of("hour", "minute", "weekday", "time", "date");

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    static final int MAX_CACHED_PATTERNS = 256;

    /** Least recently used patterns are evicted once the cache is full. */
    private final Map<String, Pattern> patternCache = Collections.synchronizedMap(
            new LinkedHashMap<String, Pattern>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Pattern> eldest) {
                    return size() > MAX_CACHED_PATTERNS;
                }
            });

    public boolean evaluate(List<Condition> conditions, LogicOperator logicOperator, StateSnapshot snapshot) {
        if (conditions == null || conditions.isEmpty()) return true;
        LogicOperator op = logicOperator == null ? LogicOperator.AND : logicOperator;
        return switch (op) {
            case AND -> conditions.stream().allMatch(c -> evaluateLeaf(c, snapshot));
            case OR -> conditions.stream().anyMatch(c -> evaluateLeaf(c, snapshot));
            case NOT -> !conditions.stream().allMatch(c -> evaluateLeaf(c, snapshot));
        };
    }

    public boolean evaluateLeaf(Condition condition, StateSnapshot snapshot) {
        try {
            Optional<Object> current = resolve(condition, snapshot);
            if (current.isEmpty()) {
                log.debug("Condition value unresolved id={} type={} target={} property={}",
                        condition.getId(), condition.getType(), condition.getTarget(), condition.getProperty());
                return false;
            }
            return compare(current.get(), condition.getOperator(), condition.getValue());
        } catch (RuntimeException e) {
            log.debug("Condition evaluation failed id={} error={}", condition.getId(), e.getMessage());
            return false;
        }
    }

    Optional<Object> resolve(Condition c, StateSnapshot snapshot) {
        if (c.getType() == null) return Optional.empty();
        return switch (c.getType()) {
            case TIME -> timeProperty(c.getProperty(), snapshot.now());
            case DEVICE_STATE, SENSOR_VALUE -> snapshot.deviceProperty(c.getTarget(), c.getProperty());
            case GROUP_STATE -> Optional.ofNullable(snapshot.groupStatus(c.getTarget()).get(c.getProperty()));
            case CUSTOM -> snapshot.variable(c.getTarget()).map(v -> nested(v, c.getProperty()));
        };
    }

    private static Object nested(Object value, String property) {
        if (property != null && !property.isBlank() && value instanceof Map<?, ?> m) {
            return m.get(property);
        }
        return value;
    }

    static Optional<Object> timeProperty(String property, ZonedDateTime now) {
        if (property == null) return Optional.empty();
        return Optional.ofNullable(switch (property) {
            case "hour" -> now.getHour();
            case "minute" -> now.getMinute();
            // Monday = 0
            case "weekday" -> now.getDayOfWeek().getValue() - 1;
            case "time" -> now.format(HH_MM);
            case "date" -> now.toLocalDate().toString();
            default -> null;
        });
    }

    public boolean compare(Object current, ComparisonOperator operator, Object expected) {
        if (operator == null) return false;
        return switch (operator) {
            case EQUALS -> valuesEqual(current, expected);
            case NOT_EQUALS -> !valuesEqual(current, expected);
            case GREATER_THAN -> order(current, expected).map(c -> c > 0).orElse(false);
            case LESS_THAN -> order(current, expected).map(c -> c < 0).orElse(false);
            case GREATER_EQUAL -> order(current, expected).map(c -> c >= 0).orElse(false);
            case LESS_EQUAL -> order(current, expected).map(c -> c <= 0).orElse(false);
            case CONTAINS -> current != null && expected != null && current.toString().contains(expected.toString());
            case IN_RANGE -> inRange(current, expected);
            case REGEX_MATCH -> current != null && expected != null
                    && pattern(expected.toString()).matcher(current.toString()).matches();
        };
    }

    private static boolean valuesEqual(Object a, Object b) {
        if (a == null || b == null) return a == b;
        Double x = toDouble(a), y = toDouble(b);
        if (x != null && y != null) return Double.compare(x, y) == 0;
        return a.toString().equals(b.toString());
    }

    /** Numeric order when both sides are numeric, lexical when both are strings, otherwise none. */
    private static Optional<Integer> order(Object a, Object b) {
        if (a == null || b == null) return Optional.empty();
        Double x = toDouble(a), y = toDouble(b);
        if (x != null && y != null) return Optional.of(Double.compare(x, y));
        if (a instanceof CharSequence && b instanceof CharSequence) {
            return Optional.of(a.toString().compareTo(b.toString()));
        }
        return Optional.empty();
    }

    private static boolean inRange(Object current, Object expected) {
        List<?> bounds = bounds(expected);
        if (bounds == null) return false;
        Optional<Integer> low = order(current, bounds.get(0));
        Optional<Integer> high = order(current, bounds.get(1));
        return low.isPresent() && high.isPresent() && low.get() >= 0 && high.get() <= 0;
    }

    private static List<?> bounds(Object expected) {
        if (expected instanceof List<?> l && l.size() == 2) return l;
        if (expected instanceof Object[] arr && arr.length == 2) return Arrays.asList(arr);
        return null;
    }

    private Pattern pattern(String regex) {
        return patternCache.computeIfAbsent(regex, Pattern::compile);
    }

    int cachedPatternCount() {
        return patternCache.size();
    }

    static Double toDouble(Object v) {
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof CharSequence cs) {
            String s = cs.toString().trim();
            if (s.isEmpty()) return null;
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Rejects conditions that could never be evaluated.
     *
     * @throws ConfigurationException describing the first problem found
     */
    public void validate(Condition c) {
        if (c == null) throw new ConfigurationException("Condition must not be null");
        String id = c.getId() == null ? "<unnamed>" : c.getId();
        if (c.getType() == null) throw new ConfigurationException("Condition " + id + " has no type");
        if (c.getOperator() == null) throw new ConfigurationException("Condition " + id + " has no operator");
        if (c.getType() == ConditionType.TIME) {
            if (c.getProperty() == null || !TIME_PROPERTIES.contains(c.getProperty())) {
                throw new ConfigurationException("Condition " + id + " has unknown time property: " + c.getProperty());
            }
        } else if (c.getTarget() == null || c.getTarget().isBlank()) {
            throw new ConfigurationException("Condition " + id + " has no target");
        }
        if (c.getType() != ConditionType.TIME && c.getType() != ConditionType.CUSTOM
                && (c.getProperty() == null || c.getProperty().isBlank())) {
            throw new ConfigurationException("Condition " + id + " has no property");
        }
        if (c.getOperator() == ComparisonOperator.IN_RANGE && bounds(c.getValue()) == null) {
            throw new ConfigurationException("Condition " + id + " in_range needs a [low, high] value");
        }
        if (c.getOperator() == ComparisonOperator.REGEX_MATCH) {
            if (c.getValue() == null) throw new ConfigurationException("Condition " + id + " regex_match needs a pattern");
            try {
                pattern(c.getValue().toString());
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException("Condition " + id + " has invalid regex: " + c.getValue(), e);
            }
        }
    }
}
