/**
 * Typed configuration properties bound from {@code application.properties}.
 *
 * <p>Property prefixes: {@code threadpool.*}, {@code routines.*}, {@code routines.trigger.*},
 * {@code routines.store.*}, {@code routines.notification.*}, {@code routines.patterns.*},
 * {@code connectors.homeassistant.*} and {@code vision.*}. Values annotated with Jakarta
 * constraints are validated on startup.
 */
package com.phillippitts.routineengine.config.properties;
