/**
 * Home Assistant integration: REST client (also the state source for triggers and conditions)
 * and the {@code homeassistant} connector handler.
 */
package com.phillippitts.routineengine.service.connector.homeassistant;
