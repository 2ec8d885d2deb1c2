/**
 * Action pipeline: connector calls, notifications and state changes.
 */
package com.phillippitts.routineengine.service.action;
