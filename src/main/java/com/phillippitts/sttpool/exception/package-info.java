/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.sttpool.exception.SttPoolException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.sttpool.exception.InvalidAudioException} - Thrown inside a worker when
 *       the input file is missing or is not acceptable audio</li>
 *   <li>{@link com.phillippitts.sttpool.exception.ModelNotFoundException} - Thrown when the
 *       STT model is missing at worker startup</li>
 *   <li>{@link com.phillippitts.sttpool.exception.TranscriptionException} - Thrown when the
 *       engine fails to transcribe audio</li>
 *   <li>{@link com.phillippitts.sttpool.exception.WorkerSpawnException} - Thrown by the supervisor
 *       when a worker process cannot be launched</li>
 * </ul>
 *
 * <p>Worker-side exceptions never cross the process boundary as exceptions: the worker loop
 * classifies them into a {@code FAILURE} outcome before replying.
 *
 * @see com.phillippitts.sttpool.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.sttpool.exception;
