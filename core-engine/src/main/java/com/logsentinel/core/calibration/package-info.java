/**
 * Self-calibrating anomaly threshold.
 *
 * <p>
 * {@link com.logsentinel.core.calibration.ThresholdCalibrator} keeps a
 * bounded, partitioned history of recent anomaly scores
 * ({@link com.logsentinel.core.calibration.ScoreWindow}) and re-tunes the
 * operating threshold by a local grid search that maximises F1.
 * </p>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.calibration;
