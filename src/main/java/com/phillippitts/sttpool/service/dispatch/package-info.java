/**
 * The dispatch facade: submit a payload, get exactly one outcome.
 */
package com.phillippitts.sttpool.service.dispatch;
