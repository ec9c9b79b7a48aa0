/**
 * HTTP presentation layer.
 */
package com.phillippitts.sttpool.presentation;
