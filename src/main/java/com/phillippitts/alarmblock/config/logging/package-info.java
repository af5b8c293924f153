/**
 * Logging infrastructure: request-scoped ThreadContext values for structured Log4j 2 output.
 */
package com.phillippitts.alarmblock.config.logging;
