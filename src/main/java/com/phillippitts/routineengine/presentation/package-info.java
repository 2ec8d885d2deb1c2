/**
 * Presentation layer: the routine REST API and its exception mapping.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - {@code /api/routines} endpoints</li>
 *   <li>{@code presentation.exception} - translation of routine exceptions to HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters over {@link com.phillippitts.routineengine.service.engine.RoutineEngine};
 * they never throw HTTP-specific exceptions.
 */
package com.phillippitts.routineengine.presentation;
