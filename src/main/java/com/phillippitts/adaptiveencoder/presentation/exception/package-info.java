/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.adaptiveencoder.exception.UnknownProfileException} → 400 Bad Request</li>
 *   <li>{@code IllegalArgumentException} (bad mode or crop) → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.adaptiveencoder.exception.ProbeFailureException} → 422 Unprocessable Entity</li>
 *   <li>{@link com.phillippitts.adaptiveencoder.exception.PassFailureException} → 502 Bad Gateway (diagnostic tail in details)</li>
 *   <li>{@link com.phillippitts.adaptiveencoder.exception.BinaryNotFoundException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "ProbeFailureException",
 *   "message": "Input could not be probed",
 *   "details": "No video stream in /media/in/clip.mkv",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @see com.phillippitts.adaptiveencoder.exception
 * @since 1.0
 */
package com.phillippitts.adaptiveencoder.presentation.exception;
