/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.insightbot.exception.InvalidSettingException} → 400 Bad Request</li>
 *   <li>Bean validation failures and malformed bodies → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.insightbot.exception.SessionStateException} → 409 Conflict</li>
 *   <li>{@link com.phillippitts.insightbot.exception.TransportException} → 502 Bad Gateway</li>
 *   <li>{@link com.phillippitts.insightbot.exception.SessionCapacityException} → 503 Service Unavailable (retry)</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "InvalidSettingException",
 *   "message": "Invalid interval",
 *   "details": "Interval must be between 60 and 3600 seconds",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @see com.phillippitts.insightbot.exception
 */
package com.phillippitts.insightbot.presentation.exception;
