package com.phillippitts.routineengine.service.store;

import com.phillippitts.routineengine.util.IdGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local record store. Records live only as long as the application; deployments that need
 * durable routines provide their own {@link RoutineRecordStore} bean.
 */
public class InMemoryRoutineRecordStore implements RoutineRecordStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryRoutineRecordStore.class);

    private final Map<String, MemoryRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;
    private final IdGenerator ids;

    public InMemoryRoutineRecordStore(Clock clock) {
        this(clock, IdGenerator.timestamped("mem", clock));
    }

    public InMemoryRoutineRecordStore(Clock clock, IdGenerator ids) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    @Override
    public List<MemoryRecord> getRoutines(boolean enabledOnly) {
        return records.values().stream()
                .filter(r -> RoutineMetadataKeys.ROUTINE_TYPE.equals(r.metadataValue(RoutineMetadataKeys.TYPE)))
                .filter(r -> !enabledOnly || !Boolean.FALSE.equals(r.metadataValue(RoutineMetadataKeys.ENABLED)))
                .sorted(Comparator.comparing(MemoryRecord::timestamp).thenComparing(MemoryRecord::id))
                .toList();
    }

    @Override
    public Optional<MemoryRecord> getMemoryById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public String addMemory(String text, String speaker, String kind, String persona, int importance,
                            Map<String, Object> metadata) {
        String id = ids.nextId();
        records.put(id, new MemoryRecord(id, text, speaker, kind, persona, importance, clock.instant(), metadata));
        LOG.debug("Stored record {} (kind={})", id, kind);
        return id;
    }

    @Override
    public boolean updateMemory(String id, MemoryRecord record) {
        return records.computeIfPresent(id, (k, existing) ->
                existing.withContent(record.text(), record.metadata())) != null;
    }

    @Override
    public boolean deleteMemory(String id) {
        return id != null && records.remove(id) != null;
    }

    public int size() {
        return records.size();
    }
}
