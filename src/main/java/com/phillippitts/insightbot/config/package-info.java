/**
 * Spring configuration: thread pools, session engine wiring, backend client and metrics.
 *
 * <p>Typed properties live in {@code config.properties} and {@code config.audio}; request-scoped
 * logging context is set up in {@code config.logging}.
 */
package com.phillippitts.insightbot.config;
