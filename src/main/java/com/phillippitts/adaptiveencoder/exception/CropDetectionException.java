package com.phillippitts.adaptiveencoder.exception;

/**
 * Thrown when a crop sample cannot be analyzed. Recovered by proceeding uncropped.
 */
public class CropDetectionException extends EncoderException {

    public CropDetectionException(String message) {
        super(FailureKind.CROP_DETECTION, message);
    }

    public CropDetectionException(String message, Throwable cause) {
        super(FailureKind.CROP_DETECTION, message, cause);
    }
}
