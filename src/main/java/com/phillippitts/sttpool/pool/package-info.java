/**
 * The worker-process pool: supervisor, per-process handles and launch plumbing.
 *
 * <p>{@link com.phillippitts.sttpool.pool.PoolSupervisor} is the only public entry point for running
 * units; {@code WorkerHandle} is internal to this package.
 */
package com.phillippitts.sttpool.pool;
