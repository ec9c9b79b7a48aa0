/**
 * Coordinator-side services built on the worker pool: the dispatch facade, metrics and health.
 */
package com.phillippitts.sttpool.service;
