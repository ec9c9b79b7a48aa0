/**
 * Code that runs inside a worker process.
 *
 * <p>{@link com.phillippitts.sttpool.worker.WorkerMain} wires a
 * {@link com.phillippitts.sttpool.worker.WorkFunction} to the process's standard streams and hands
 * control to {@link com.phillippitts.sttpool.worker.WorkerLoop}. Nothing here depends on Spring.
 */
package com.phillippitts.sttpool.worker;
