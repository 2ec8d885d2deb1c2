/**
 * Gating conditions evaluated before a routine's actions run.
 */
package com.phillippitts.routineengine.service.condition;
