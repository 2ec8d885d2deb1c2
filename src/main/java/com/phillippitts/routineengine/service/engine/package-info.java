/**
 * Routine engine: CRUD over the record store, trigger registration, and the execution pipeline
 * (conditions, then actions, then bookkeeping).
 *
 * <p>{@link com.phillippitts.routineengine.service.engine.DefaultRoutineEngine} is a plain object
 * assembled by {@link com.phillippitts.routineengine.service.engine.DefaultRoutineEngineBuilder};
 * trigger fires reach it as Spring events handled on the {@code routineExecutor} pool.
 */
package com.phillippitts.routineengine.service.engine;
