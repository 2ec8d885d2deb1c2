package com.phillippitts.routineengine.service.engine;

import com.phillippitts.routineengine.config.properties.RoutineEngineProperties;
import com.phillippitts.routineengine.domain.Routine;
import com.phillippitts.routineengine.service.store.MemoryRecord;
import com.phillippitts.routineengine.service.store.RoutineRecordCodec;
import com.phillippitts.routineengine.service.store.RoutineRecordStore;
import com.phillippitts.routineengine.service.trigger.TriggerManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Registers the triggers of every stored, enabled routine when the context starts and cancels all
 * of them when it stops. A routine whose trigger cannot be registered is logged and skipped.
 */
@Component
public class RoutineLifecycle implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(RoutineLifecycle.class);

    private final RoutineRecordStore store;
    private final RoutineRecordCodec codec;
    private final TriggerManager triggers;
    private final RoutineEngineProperties props;

    private volatile boolean running;

    public RoutineLifecycle(RoutineRecordStore store,
                            RoutineRecordCodec codec,
                            TriggerManager triggers,
                            RoutineEngineProperties props) {
        this.store = store;
        this.codec = codec;
        this.triggers = triggers;
        this.props = props;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        running = true;
        if (!props.isAutostart()) {
            LOG.info("Routine autostart disabled; no triggers registered");
            return;
        }

        List<MemoryRecord> records;
        try {
            records = store.getRoutines(true);
        } catch (RuntimeException e) {
            LOG.error("Failed to load routines at startup", e);
            return;
        }

        int registered = 0;
        int failed = 0;
        for (MemoryRecord record : records) {
            if (!codec.isRoutine(record)) {
                continue;
            }
            try {
                Routine routine = codec.fromRecord(record);
                if (!routine.enabled()) {
                    continue;
                }
                triggers.register(routine);
                registered++;
            } catch (RuntimeException e) {
                failed++;
                LOG.warn("Failed to register trigger for routine {}: {}", record.id(), e.getMessage());
            }
        }
        LOG.info("Routine triggers started: registered={}, failed={}, active={}",
                registered, failed, triggers.registeredCount());
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        triggers.deregisterAll();
        running = false;
        LOG.info("Routine triggers stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
