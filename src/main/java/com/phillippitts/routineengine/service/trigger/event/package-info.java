/**
 * Events published by trigger mechanisms and consumed asynchronously by the engine and listeners.
 */
package com.phillippitts.routineengine.service.trigger.event;
