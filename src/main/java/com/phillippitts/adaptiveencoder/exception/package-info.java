/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.adaptiveencoder.exception.EncoderException} - Base exception
 *       carrying a {@link com.phillippitts.adaptiveencoder.exception.FailureKind}</li>
 *   <li>{@link com.phillippitts.adaptiveencoder.exception.ProbeFailureException} - Input unreadable
 *       or without a video stream; fatal before any pass</li>
 *   <li>{@link com.phillippitts.adaptiveencoder.exception.PassFailureException} - Encoder pass
 *       exited non-zero; fatal, carries the diagnostic tail</li>
 *   <li>{@link com.phillippitts.adaptiveencoder.exception.ClassificationException} - Oracle
 *       unavailable; recovered to the technical or filename label</li>
 *   <li>{@link com.phillippitts.adaptiveencoder.exception.CropDetectionException} - Crop sample
 *       unusable; recovered to the full frame</li>
 *   <li>{@link com.phillippitts.adaptiveencoder.exception.AnalysisException} - One complexity
 *       signal unavailable; recovered to its neutral default</li>
 *   <li>{@link com.phillippitts.adaptiveencoder.exception.UnknownProfileException} - Caller named a
 *       profile that does not exist</li>
 * </ul>
 *
 * <p>Only probe, pass and profile failures escape the service layer. They map to HTTP status
 * codes via {@code GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.adaptiveencoder.exception;
