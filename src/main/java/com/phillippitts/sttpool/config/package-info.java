/**
 * Spring configuration: the worker-pool composition root, executors and metrics binding.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - pool and executor properties</li>
 *   <li>{@code config.stt} - Vosk engine settings forwarded to workers</li>
 *   <li>{@code config.logging} - MDC filter</li>
 * </ul>
 */
package com.phillippitts.sttpool.config;
