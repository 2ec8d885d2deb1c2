/**
 * Detection of recurring task behaviour that could be automated as a routine.
 */
package com.phillippitts.routineengine.service.pattern;
