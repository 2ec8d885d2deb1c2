/**
 * Connector handlers invoked by routine actions, and the registry that resolves them by service id.
 */
package com.phillippitts.routineengine.service.connector;
