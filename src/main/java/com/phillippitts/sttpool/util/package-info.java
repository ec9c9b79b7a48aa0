/**
 * Small static helpers shared by the coordinator and worker code.
 */
package com.phillippitts.sttpool.util;
