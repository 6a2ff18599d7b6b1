/**
 * REST command surface: session lifecycle, guild settings, speaker names and the report board.
 *
 * <p>Controllers only translate HTTP to service calls; failures are mapped to responses by
 * {@code presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.insightbot.presentation.controller;
