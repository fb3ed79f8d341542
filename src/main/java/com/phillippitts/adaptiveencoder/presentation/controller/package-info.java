/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code GET /ping} - liveness and structured logging check</li>
 *   <li>{@code POST /api/encodings} - decide and encode a single input</li>
 *   <li>{@code POST /api/encodings/batch} - encode files and directories, one run per file</li>
 *   <li>{@code GET /api/profiles} - list the profile catalog</li>
 * </ul>
 *
 * <p>Controllers only map JSON to service calls; decisions live in the service layer and
 * failures are left to {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.adaptiveencoder.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.adaptiveencoder.presentation.controller;
