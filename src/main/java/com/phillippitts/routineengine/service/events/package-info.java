/**
 * Listeners that turn trigger error events into throttled log lines and metrics.
 */
package com.phillippitts.routineengine.service.events;
