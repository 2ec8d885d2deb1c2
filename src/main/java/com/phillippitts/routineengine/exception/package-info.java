/**
 * Routine-engine exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.routineengine.exception.RoutineEngineException} - Base exception</li>
 *   <li>{@link com.phillippitts.routineengine.exception.RoutineValidationException} - Rejected
 *       definition or update; propagated to the caller (HTTP 400)</li>
 *   <li>{@link com.phillippitts.routineengine.exception.RoutineNotFoundException} - Unknown routine
 *       id; propagated to the caller (HTTP 404)</li>
 *   <li>{@link com.phillippitts.routineengine.exception.RoutineStoreException} - Store failure on a
 *       mutation (HTTP 503)</li>
 *   <li>{@link com.phillippitts.routineengine.exception.DisabledRoutineException},
 *       {@link com.phillippitts.routineengine.exception.ConditionEvaluationException},
 *       {@link com.phillippitts.routineengine.exception.ActionExecutionException} - Raised while a
 *       routine runs; always captured into the execution result</li>
 *   <li>{@link com.phillippitts.routineengine.exception.TriggerPollException} - Raised inside a
 *       trigger poll tick; logged, the mechanism keeps running</li>
 * </ul>
 *
 * <p>Mutation errors fail fast to the caller. Anything raised while a routine is already running
 * is captured so that one broken routine cannot take down the engine or other routines.
 *
 * @see com.phillippitts.routineengine.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.routineengine.exception;
