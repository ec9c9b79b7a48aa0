/**
 * REST controllers. Request handling is limited to staging input and mapping outcomes.
 */
package com.phillippitts.sttpool.presentation.controller;
