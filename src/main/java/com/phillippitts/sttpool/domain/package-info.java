/**
 * Domain models shared by the coordinator and its worker processes.
 *
 * <p>All domain models are immutable records that validate themselves in their constructors and
 * contain only data that can be serialized across a process boundary.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.sttpool.domain.WorkUnit} - one dispatchable job with a unique id</li>
 *   <li>{@link com.phillippitts.sttpool.domain.WorkPayload} - file path plus parameters handed to a worker</li>
 *   <li>{@link com.phillippitts.sttpool.domain.Outcome} - tagged terminal result of a unit</li>
 *   <li>{@link com.phillippitts.sttpool.domain.TranscriptionResult} - what a successful work function returns</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.sttpool.domain;
