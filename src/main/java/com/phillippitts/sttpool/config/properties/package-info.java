/**
 * Externalized configuration bound from {@code application.properties}.
 */
package com.phillippitts.sttpool.config.properties;
