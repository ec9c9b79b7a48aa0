/**
 * Engine configuration forwarded from the coordinator to worker processes.
 */
package com.phillippitts.sttpool.config.stt;
