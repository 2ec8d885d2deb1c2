/**
 * Spring wiring: thread pools, pool metrics, the engine and its collaborators, and the HTTP
 * connectors.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - externalized settings bound from {@code application.properties}</li>
 *   <li>{@code config.logging} - request MDC filter</li>
 * </ul>
 */
package com.phillippitts.routineengine.config;
