package com.phillippitts.routineengine.service.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port to the memory store that persists routines as generic records.
 *
 * <p>Implementations must be thread-safe. Failures are reported as
 * {@link com.phillippitts.routineengine.exception.RoutineStoreException}.
 */
public interface RoutineRecordStore {

    /**
     * Returns routine records, oldest first.
     *
     * @param enabledOnly when true, only records whose {@code routineEnabled} metadata is not false
     */
    List<MemoryRecord> getRoutines(boolean enabledOnly);

    Optional<MemoryRecord> getMemoryById(String id);

    /**
     * Writes a new record and returns its id.
     */
    String addMemory(String text, String speaker, String kind, String persona, int importance,
                     Map<String, Object> metadata);

    /**
     * Replaces text and metadata of an existing record.
     *
     * @return false when no record with this id exists
     */
    boolean updateMemory(String id, MemoryRecord record);

    /**
     * @return false when the store holds no such record or refused the delete
     */
    boolean deleteMemory(String id);
}
