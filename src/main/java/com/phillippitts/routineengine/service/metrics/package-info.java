/**
 * Micrometer instrumentation of routine executions and triggers.
 */
package com.phillippitts.routineengine.service.metrics;
