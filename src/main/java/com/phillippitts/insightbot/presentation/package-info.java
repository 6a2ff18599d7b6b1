/**
 * Presentation layer (REST API controllers, DTOs and exception handling).
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for the guild command surface</li>
 *   <li>{@code presentation.dto} - request/response records</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Presentation depends on service but not vice versa.
 */
package com.phillippitts.insightbot.presentation;
