/**
 * Logging context propagation (Log4j2 ThreadContext).
 */
package com.phillippitts.insightbot.config.logging;
