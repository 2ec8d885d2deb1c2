package com.phillippitts.routineengine.service.trigger;

import com.phillippitts.routineengine.config.properties.TriggerProperties;
import com.phillippitts.routineengine.domain.Monitor;
import com.phillippitts.routineengine.domain.Routine;
import com.phillippitts.routineengine.domain.TriggerType;
import com.phillippitts.routineengine.domain.VisionDetectionConfig;
import com.phillippitts.routineengine.exception.TriggerPollException;
import com.phillippitts.routineengine.service.state.StateQuerySource;
import com.phillippitts.routineengine.service.trigger.event.RoutineTriggeredEvent;
import com.phillippitts.routineengine.service.trigger.event.TriggerPollFailedEvent;
import com.phillippitts.routineengine.service.vision.VisionDetectionSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Owns the live trigger mechanism of every enabled routine, at most one per routine id.
 *
 * <p>{@link #register(Routine)} replaces any existing mechanism for the id; {@link #deregister(String)}
 * is idempotent. Installed mechanisms:
 * <ul>
 *   <li>{@code time}: fixed-rate timer from {@link ScheduleParser}, first tick one period after registration</li>
 *   <li>{@code state_change}: entity poll via {@link StateQuerySource}, first poll immediately</li>
 *   <li>{@code vision_detection}: detection poll via {@link VisionDetectionSource}, first poll immediately</li>
 * </ul>
 * Other trigger kinds, and configurations that cannot be installed, leave the routine without a
 * mechanism and are logged. Firing publishes a {@link RoutineTriggeredEvent}; a failing poll publishes
 * a {@link TriggerPollFailedEvent} and keeps the mechanism running.
 */
public class TriggerManager {

    private static final Logger LOG = LogManager.getLogger(TriggerManager.class);

    static final Set<String> VISION_SERVICES = Set.of("local", "frigate", "codeprojectai", "yolo");

    private final TriggerScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final TriggerProperties props;
    private final StateQuerySource stateSource;
    private final Map<String, VisionDetectionSource> visionSources;
    private final Clock clock;

    private final Map<String, TriggerHandle> handles = new ConcurrentHashMap<>();

    /**
     * @param stateSource   state lookup for state-change triggers, may be null
     * @param visionSources detection services, keyed by {@link VisionDetectionSource#service()}
     */
    public TriggerManager(TriggerScheduler scheduler,
                          ApplicationEventPublisher publisher,
                          TriggerProperties props,
                          StateQuerySource stateSource,
                          List<VisionDetectionSource> visionSources,
                          Clock clock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.props = Objects.requireNonNull(props, "props");
        this.stateSource = stateSource;
        this.visionSources = (visionSources == null ? List.<VisionDetectionSource>of() : visionSources).stream()
                .collect(Collectors.toUnmodifiableMap(VisionDetectionSource::service, s -> s, (a, b) -> {
                    throw new IllegalStateException("Duplicate vision detection source for service: " + a.service());
                }));
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Installs the routine's trigger mechanism, replacing any existing one.
     */
    public void register(Routine routine) {
        String id = routine.id();
        handles.compute(id, (key, existing) -> {
            if (existing != null) {
                existing.cancel();
            }
            return install(routine);
        });
    }

    public void deregister(String routineId) {
        if (routineId == null) {
            return;
        }
        TriggerHandle handle = handles.remove(routineId);
        if (handle != null) {
            handle.cancel();
            LOG.info("Removed {} trigger for routine {}", handle.kind().wireName(), routineId);
        }
    }

    public void deregisterAll() {
        for (String id : Set.copyOf(handles.keySet())) {
            deregister(id);
        }
    }

    public boolean isRegistered(String routineId) {
        return routineId != null && handles.containsKey(routineId);
    }

    public Optional<TriggerType> registeredKind(String routineId) {
        if (routineId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handles.get(routineId)).map(TriggerHandle::kind);
    }

    public int registeredCount() {
        return handles.size();
    }

    public Set<String> registeredIds() {
        return Set.copyOf(handles.keySet());
    }

    public Map<TriggerType, Long> registeredCountsByKind() {
        Map<TriggerType, Long> counts = new EnumMap<>(TriggerType.class);
        for (TriggerHandle h : handles.values()) {
            counts.merge(h.kind(), 1L, Long::sum);
        }
        return counts;
    }

    private TriggerHandle install(Routine routine) {
        TriggerType kind = routine.trigger().kind();
        return switch (kind) {
            case TIME -> installTime(routine);
            case STATE_CHANGE -> installStateChange(routine);
            case VISION_DETECTION -> installVision(routine);
            case EVENT, USER_ACTION, COMPLETION -> {
                LOG.info("Routine {} uses a {} trigger, no mechanism installed (manual execution only)",
                        routine.id(), kind.wireName());
                yield null;
            }
            case UNKNOWN -> {
                LOG.warn("Routine {} has unknown trigger type '{}', no mechanism installed",
                        routine.id(), routine.trigger().type());
                yield null;
            }
        };
    }

    private TriggerHandle installTime(Routine routine) {
        String schedule = routine.trigger().config().schedule();
        Optional<Duration> period = ScheduleParser.parse(schedule);
        if (period.isEmpty()) {
            LOG.warn("Could not parse schedule '{}' for routine {}, no timer installed", schedule, routine.id());
            return null;
        }
        String source = TriggerType.TIME.wireName();
        TriggerHandle handle = schedule(routine.id(), TriggerType.TIME, period.get(), period.get(),
                () -> Optional.of(schedule));
        LOG.info("Scheduled routine {} every {} ({})", routine.id(), period.get(), source);
        return handle;
    }

    private TriggerHandle installStateChange(Routine routine) {
        Monitor monitor = routine.trigger().config().monitor();
        if (monitor == null || !"homeassistant".equals(monitor.service())
                || monitor.entity() == null || monitor.entity().isBlank()) {
            LOG.warn("State change trigger of routine {} needs monitor.service=homeassistant and an entity, "
                    + "no poll installed", routine.id());
            return null;
        }
        if (stateSource == null || !monitor.service().equals(stateSource.service())) {
            LOG.warn("No state source configured for '{}', state change trigger of routine {} not installed",
                    monitor.service(), routine.id());
            return null;
        }
        StateChangePoller poller = new StateChangePoller(stateSource, monitor.entity(), monitor.property());
        Duration interval = props.getStatePollInterval();
        TriggerHandle handle = schedule(routine.id(), TriggerType.STATE_CHANGE, interval, Duration.ZERO, poller::poll);
        LOG.info("Monitoring {} for routine {} every {}", monitor.entity(), routine.id(), interval);
        return handle;
    }

    private TriggerHandle installVision(Routine routine) {
        VisionDetectionConfig vision = routine.trigger().config().visionDetection();
        if (vision == null || vision.service() == null || !VISION_SERVICES.contains(vision.service())
                || vision.objectTypes().isEmpty()) {
            LOG.warn("Vision trigger of routine {} needs a supported service {} and at least one object type, "
                    + "no poll installed", routine.id(), VISION_SERVICES);
            return null;
        }
        Duration interval = vision.checkInterval() != null && vision.checkInterval() > 0
                ? Duration.ofMillis(vision.checkInterval())
                : props.getVisionDefaultCheckInterval();
        VisionDetectionPoller poller = new VisionDetectionPoller(routine.id(), vision, visionSources,
                props.getVisionDefaultMinConfidence());
        TriggerHandle handle = schedule(routine.id(), TriggerType.VISION_DETECTION, interval, Duration.ZERO, poller::poll);
        LOG.info("Watching {} for {} (routine {}) every {}", vision.service(), vision.objectTypes(), routine.id(), interval);
        return handle;
    }

    private TriggerHandle schedule(String routineId, TriggerType kind, Duration period, Duration initialDelay,
                                   Supplier<Optional<String>> check) {
        AtomicBoolean active = new AtomicBoolean(true);
        Runnable tick = () -> runTick(routineId, kind.wireName(), active, check);
        ScheduledTick scheduled = scheduler.schedule(tick, period, initialDelay);
        return new TriggerHandle(routineId, kind, scheduled, active, clock.instant());
    }

    private void runTick(String routineId, String source, AtomicBoolean active, Supplier<Optional<String>> check) {
        if (!active.get()) {
            return;
        }
        ThreadContext.put("routineId", routineId);
        try {
            Optional<String> fired = check.get();
            if (fired.isPresent() && active.get()) {
                LOG.info("Trigger {} fired for routine {}: {}", source, routineId, fired.get());
                publisher.publishEvent(new RoutineTriggeredEvent(routineId, source, clock.instant(), fired.get()));
            }
        } catch (RuntimeException e) {
            TriggerPollException failure = new TriggerPollException(routineId, source, "Trigger poll failed", e);
            LOG.warn("{}: {}", failure.getMessage(), e.toString());
            publisher.publishEvent(new TriggerPollFailedEvent(routineId, source, clock.instant(),
                    failure.getMessage(), failure));
        } finally {
            ThreadContext.remove("routineId");
        }
    }
}
