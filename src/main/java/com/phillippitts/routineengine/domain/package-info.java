/**
 * Immutable domain model of the routine engine.
 *
 * <p>Routines are stored as generic memory records; the types here are the typed view the
 * engine works with. Trigger, condition and action kinds keep their raw wire names so that
 * kinds this version does not understand survive a read-modify-write cycle.
 *
 * @see com.phillippitts.routineengine.domain.Routine
 * @see com.phillippitts.routineengine.domain.RoutineExecution
 */
package com.phillippitts.routineengine.domain;
