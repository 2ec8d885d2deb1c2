package com.phillippitts.routineengine.service.pattern;

import java.util.List;

/**
 * Supplies the completed-task history that patterns are mined from. Optional: with no bean of this
 * type, detection finds nothing.
 */
public interface CompletedTaskSource {

    List<CompletedTask> completedTasks();
}
