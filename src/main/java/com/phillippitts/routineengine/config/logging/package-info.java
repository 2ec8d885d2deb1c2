/**
 * Logging infrastructure: request correlation through the Log4j2 ThreadContext (MDC).
 *
 * <p>MDC keys:
 * <ul>
 *   <li>{@code requestId} - per HTTP request, from {@code X-Request-ID} or a generated UUID</li>
 *   <li>{@code routineId} - routine being addressed or executed</li>
 *   <li>{@code executionId} - one routine run</li>
 * </ul>
 *
 * <p>Log format:
 * <pre>
 * 2026-10-17 15:42:32,529 [routine-exec-1] [requestId] [routineId] INFO logger.name - message
 * </pre>
 */
package com.phillippitts.routineengine.config.logging;
