package com.phillippitts.routineengine.service.condition;

import com.phillippitts.routineengine.domain.ConditionType;
import com.phillippitts.routineengine.domain.RoutineCondition;
import com.phillippitts.routineengine.exception.ConditionEvaluationException;
import com.phillippitts.routineengine.service.state.EntityState;
import com.phillippitts.routineengine.service.state.StateQuerySource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalTime;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates a routine's gating conditions as a short-circuit conjunction.
 *
 * <p>Supported kinds:
 * <ul>
 *   <li>{@code time_range{startHour, endHour}}: {@code startHour <= hour < endHour} on the injected
 *       clock; a missing bound passes. Ranges that wrap past midnight never pass.</li>
 *   <li>{@code state_check{service?, entity, property?, equals | notEquals | in}}: string comparison
 *       of the observed entity value.</li>
 *   <li>{@code comparison{service?, entity, property?, operator, value}}: numeric comparison;
 *       a non-numeric observation fails the condition.</li>
 * </ul>
 * {@code custom} conditions and lookup failures raise {@link ConditionEvaluationException}.
 * Unrecognised kinds pass with a warning.
 */
public class ConditionEvaluator {

    private static final Logger LOG = LogManager.getLogger(ConditionEvaluator.class);

    static final String DEFAULT_STATE_SERVICE = "homeassistant";

    private final Clock clock;
    private final StateQuerySource stateSource;

    /**
     * @param clock       time source for {@code time_range}
     * @param stateSource entity state lookup, may be null when no state backend is configured
     */
    public ConditionEvaluator(Clock clock, StateQuerySource stateSource) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stateSource = stateSource;
    }

    public boolean evaluate(List<RoutineCondition> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }
        for (RoutineCondition condition : conditions) {
            if (!evaluate(condition)) {
                LOG.debug("Condition {} not satisfied", condition.type());
                return false;
            }
        }
        return true;
    }

    boolean evaluate(RoutineCondition condition) {
        ConditionType kind = condition.kind();
        return switch (kind) {
            case TIME_RANGE -> timeRange(condition.config());
            case STATE_CHECK -> stateCheck(condition.config());
            case COMPARISON -> comparison(condition.config());
            case CUSTOM -> throw new ConditionEvaluationException(condition.type(),
                    "Unsupported condition type: " + condition.type());
            case UNKNOWN -> {
                LOG.warn("Unknown condition type '{}', treating as satisfied", condition.type());
                yield true;
            }
        };
    }

    private boolean timeRange(Map<String, Object> config) {
        Integer start = intValue(config.get("startHour"));
        Integer end = intValue(config.get("endHour"));
        if (start == null || end == null) {
            return true;
        }
        int hour = LocalTime.now(clock).getHour();
        return hour >= start && hour < end;
    }

    private boolean stateCheck(Map<String, Object> config) {
        Object observed = observe("state_check", config);
        String actual = observed == null ? null : String.valueOf(observed);
        if (config.containsKey("equals")) {
            return actual != null && actual.equals(String.valueOf(config.get("equals")));
        }
        if (config.containsKey("notEquals")) {
            return actual == null || !actual.equals(String.valueOf(config.get("notEquals")));
        }
        if (config.get("in") instanceof Collection<?> allowed) {
            return actual != null && allowed.stream().anyMatch(v -> actual.equals(String.valueOf(v)));
        }
        return actual != null;
    }

    private boolean comparison(Map<String, Object> config) {
        String operator = normaliseOperator(config.get("operator"));
        Double expected = doubleValue(config.get("value"));
        if (expected == null) {
            throw new ConditionEvaluationException("comparison", "comparison requires a numeric value");
        }
        Double actual = doubleValue(observe("comparison", config));
        if (actual == null) {
            return false;
        }
        int cmp = Double.compare(actual, expected);
        return switch (operator) {
            case "gt" -> cmp > 0;
            case "gte" -> cmp >= 0;
            case "lt" -> cmp < 0;
            case "lte" -> cmp <= 0;
            case "eq" -> cmp == 0;
            case "ne" -> cmp != 0;
            default -> throw new ConditionEvaluationException("comparison",
                    "Unsupported comparison operator: " + config.get("operator"));
        };
    }

    private Object observe(String type, Map<String, Object> config) {
        Object entityRaw = config.get("entity");
        if (entityRaw == null || entityRaw.toString().isBlank()) {
            throw new ConditionEvaluationException(type, type + " requires an entity");
        }
        String entity = entityRaw.toString();
        Object serviceRaw = config.get("service");
        String service = serviceRaw == null ? DEFAULT_STATE_SERVICE : serviceRaw.toString();
        if (stateSource == null || !service.equals(stateSource.service())) {
            throw new ConditionEvaluationException(type, "No state source configured for service: " + service);
        }
        EntityState state;
        try {
            state = stateSource.getState(entity);
        } catch (RuntimeException e) {
            throw new ConditionEvaluationException(type, "State lookup failed for " + entity + ": " + e.getMessage(), e);
        }
        Object property = config.get("property");
        return state == null ? null : state.valueOf(property == null ? null : property.toString());
    }

    static String normaliseOperator(Object raw) {
        String op = raw == null ? "" : raw.toString().trim().toLowerCase(Locale.ROOT);
        return switch (op) {
            case ">", "gt" -> "gt";
            case ">=", "gte" -> "gte";
            case "<", "lt" -> "lt";
            case "<=", "lte" -> "lte";
            case "==", "=", "eq" -> "eq";
            case "!=", "ne" -> "ne";
            default -> op;
        };
    }

    private static Integer intValue(Object raw) {
        Double d = doubleValue(raw);
        return d == null ? null : d.intValue();
    }

    private static Double doubleValue(Object raw) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
