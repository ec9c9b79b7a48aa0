/**
 * Translation of exceptions and failed outcomes into HTTP error bodies.
 */
package com.phillippitts.sttpool.presentation.exception;
