package com.phillippitts.routineengine.service.engine;

import com.phillippitts.routineengine.config.properties.RoutineStoreProperties;
import com.phillippitts.routineengine.service.action.ActionDispatcher;
import com.phillippitts.routineengine.service.condition.ConditionEvaluator;
import com.phillippitts.routineengine.service.metrics.RoutineMetricsPublisher;
import com.phillippitts.routineengine.service.store.RoutineRecordCodec;
import com.phillippitts.routineengine.service.store.RoutineRecordStore;
import com.phillippitts.routineengine.service.trigger.TriggerManager;
import com.phillippitts.routineengine.util.IdGenerator;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Objects;

/**
 * Builder for {@link DefaultRoutineEngine}.
 *
 * <pre>{@code
 * RoutineEngine engine = DefaultRoutineEngineBuilder.builder()
 *     .store(store)
 *     .triggerManager(triggers)
 *     .conditionEvaluator(conditions)
 *     .actionDispatcher(dispatcher)
 *     .publisher(publisher)
 *     .build();
 * }</pre>
 *
 * <p>Codec, store properties, clock, metrics and execution id generator default when not set.
 */
public final class DefaultRoutineEngineBuilder {

    // Required dependencies
    private RoutineRecordStore store;
    private TriggerManager triggerManager;
    private ConditionEvaluator conditionEvaluator;
    private ActionDispatcher actionDispatcher;
    private ApplicationEventPublisher publisher;

    // Optional dependencies
    private RoutineRecordCodec codec;
    private RoutineStoreProperties storeProperties;
    private RoutineMetricsPublisher metricsPublisher;
    private Clock clock;
    private IdGenerator executionIds;

    private DefaultRoutineEngineBuilder() {
    }

    public static DefaultRoutineEngineBuilder builder() {
        return new DefaultRoutineEngineBuilder();
    }

    /**
     * @param store record store holding routines (required)
     * @return this builder
     */
    public DefaultRoutineEngineBuilder store(RoutineRecordStore store) {
        this.store = store;
        return this;
    }

    /**
     * @param triggerManager registry of live triggers (required)
     * @return this builder
     */
    public DefaultRoutineEngineBuilder triggerManager(TriggerManager triggerManager) {
        this.triggerManager = triggerManager;
        return this;
    }

    /**
     * @param conditionEvaluator gate evaluator (required)
     * @return this builder
     */
    public DefaultRoutineEngineBuilder conditionEvaluator(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
        return this;
    }

    /**
     * @param actionDispatcher action runner (required)
     * @return this builder
     */
    public DefaultRoutineEngineBuilder actionDispatcher(ActionDispatcher actionDispatcher) {
        this.actionDispatcher = actionDispatcher;
        return this;
    }

    /**
     * @param publisher Spring event publisher (required)
     * @return this builder
     */
    public DefaultRoutineEngineBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    public DefaultRoutineEngineBuilder codec(RoutineRecordCodec codec) {
        this.codec = codec;
        return this;
    }

    public DefaultRoutineEngineBuilder storeProperties(RoutineStoreProperties storeProperties) {
        this.storeProperties = storeProperties;
        return this;
    }

    public DefaultRoutineEngineBuilder metricsPublisher(RoutineMetricsPublisher metricsPublisher) {
        this.metricsPublisher = metricsPublisher;
        return this;
    }

    public DefaultRoutineEngineBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public DefaultRoutineEngineBuilder executionIds(IdGenerator executionIds) {
        this.executionIds = executionIds;
        return this;
    }

    /**
     * @return configured engine
     * @throws NullPointerException if a required dependency is missing
     */
    public DefaultRoutineEngine build() {
        Objects.requireNonNull(store, "store is required");
        Objects.requireNonNull(triggerManager, "triggerManager is required");
        Objects.requireNonNull(conditionEvaluator, "conditionEvaluator is required");
        Objects.requireNonNull(actionDispatcher, "actionDispatcher is required");
        Objects.requireNonNull(publisher, "publisher is required");

        Clock effectiveClock = clock != null ? clock : Clock.systemUTC();
        return new DefaultRoutineEngine(
                store,
                codec != null ? codec : new RoutineRecordCodec(),
                storeProperties != null ? storeProperties : RoutineStoreProperties.defaults(),
                triggerManager,
                conditionEvaluator,
                actionDispatcher,
                publisher,
                metricsPublisher != null ? metricsPublisher : RoutineMetricsPublisher.NOOP,
                effectiveClock,
                executionIds != null ? executionIds : IdGenerator.timestamped("exec", effectiveClock)
        );
    }
}
