package com.phillippitts.adaptiveencoder.service.progress;

/**
 * What a pass is expected to produce, used to turn samples into fractions.
 *
 * @param label pass description for listeners
 * @param durationSeconds media duration of the input
 * @param totalFrames frame estimate ({@code duration * fps} when no exact count exists)
 * @param updateIntervalSeconds minimum seconds between listener notifications
 */
public record ProgressTarget(String label, double durationSeconds, long totalFrames, int updateIntervalSeconds) {}
