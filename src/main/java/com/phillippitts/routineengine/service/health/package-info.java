/**
 * Actuator health contributions.
 */
package com.phillippitts.routineengine.service.health;
