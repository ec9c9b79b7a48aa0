/**
 * Logging infrastructure: MDC population for HTTP requests.
 *
 * <p>MDC keys:
 * <ul>
 *   <li>{@code requestId} - per HTTP request</li>
 *   <li>{@code workId} - short id of the unit being dispatched</li>
 * </ul>
 *
 * <p>Worker processes log to stderr with their own configuration ({@code log4j2-worker.xml}); the
 * supervisor re-logs those lines under {@code worker.<slot>}.
 */
package com.phillippitts.sttpool.config.logging;
