/**
 * Persistence of routines as generic memory records.
 *
 * <p>{@link com.phillippitts.routineengine.service.store.RoutineRecordStore} is the port; the
 * {@link com.phillippitts.routineengine.service.store.RoutineRecordCodec} owns the metadata layout
 * and the JSON encoding of triggers, conditions and actions.
 */
package com.phillippitts.routineengine.service.store;
