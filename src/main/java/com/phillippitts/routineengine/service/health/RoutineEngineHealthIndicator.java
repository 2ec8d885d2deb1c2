package com.phillippitts.routineengine.service.health;

import com.phillippitts.routineengine.domain.Routine;
import com.phillippitts.routineengine.domain.TriggerType;
import com.phillippitts.routineengine.service.store.RoutineRecordCodec;
import com.phillippitts.routineengine.service.store.RoutineRecordStore;
import com.phillippitts.routineengine.service.trigger.TriggerManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Health indicator for routine triggers.
 *
 * <ul>
 *   <li>UP: every enabled time, state_change and vision_detection routine has a live trigger</li>
 *   <li>DEGRADED: at least one of them has none (unparseable schedule, missing source...)</li>
 *   <li>DOWN: the record store cannot be read</li>
 * </ul>
 *
 * <p>Event, completion and user_action triggers are fired by external callers and are never counted
 * as missing. Exposed via /actuator/health.
 */
@Component
public class RoutineEngineHealthIndicator implements HealthIndicator {

    private static final Set<TriggerType> INSTALLABLE =
            EnumSet.of(TriggerType.TIME, TriggerType.STATE_CHANGE, TriggerType.VISION_DETECTION);

    private final RoutineRecordStore store;
    private final RoutineRecordCodec codec;
    private final TriggerManager triggers;

    public RoutineEngineHealthIndicator(RoutineRecordStore store,
                                        RoutineRecordCodec codec,
                                        TriggerManager triggers) {
        this.store = store;
        this.codec = codec;
        this.triggers = triggers;
    }

    @Override
    public Health health() {
        List<Routine> enabled;
        try {
            enabled = store.getRoutines(true).stream()
                    .filter(codec::isRoutine)
                    .map(codec::fromRecord)
                    .filter(Routine::enabled)
                    .toList();
        } catch (RuntimeException e) {
            return Health.down()
                    .withDetail("status", "Routine store unavailable")
                    .withDetail("error", e.getClass().getSimpleName())
                    .build();
        }

        List<String> missing = enabled.stream()
                .filter(r -> INSTALLABLE.contains(r.trigger().kind()))
                .filter(r -> !triggers.isRegistered(r.id()))
                .map(Routine::id)
                .toList();

        Map<String, Long> byKind = new LinkedHashMap<>();
        triggers.registeredCountsByKind().forEach((k, v) -> byKind.put(k.wireName(), v));

        Health.Builder builder = missing.isEmpty()
                ? Health.up().withDetail("status", "All triggers registered")
                : Health.status("DEGRADED").withDetail("status", "Enabled routines without a trigger");
        return builder
                .withDetail("enabledRoutines", enabled.size())
                .withDetail("registeredTriggers", byKind)
                .withDetail("missingTriggers", missing)
                .build();
    }
}
