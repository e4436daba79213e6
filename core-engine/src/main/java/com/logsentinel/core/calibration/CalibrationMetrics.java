package com.logsentinel.core.calibration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * Point-in-time snapshot of the calibrator, evaluated at the current threshold.
 *
 * <p>
 * {@code FP} counts normal-pool scores above the threshold and {@code TP}
 * counts abnormal-pool scores above it. Precision, recall and F1 are
 * {@code 0.0} when their denominators are zero.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "threshold", "normal_mean", "abnormal_mean", "precision", "recall", "f1",
        "TP", "FP", "TN", "FN", "normal_pool_size", "abnormal_pool_size", "last_recalibrated_at" })
public final class CalibrationMetrics {

    private final double threshold;
    private final double normalMean;
    private final double abnormalMean;
    private final int truePositives;
    private final int falsePositives;
    private final int trueNegatives;
    private final int falseNegatives;
    private final int normalPoolSize;
    private final int abnormalPoolSize;
    private final Instant lastRecalibratedAt;

    CalibrationMetrics(double threshold, ScoreWindow window, Instant lastRecalibratedAt) {
        BoundedScoreBuffer normal = window.normalPool();
        BoundedScoreBuffer abnormal = window.abnormalPool();
        this.threshold = threshold;
        this.normalMean = normal.mean();
        this.abnormalMean = abnormal.mean();
        this.falsePositives = normal.countAbove(threshold);
        this.truePositives = abnormal.countAbove(threshold);
        this.trueNegatives = normal.size() - falsePositives;
        this.falseNegatives = abnormal.size() - truePositives;
        this.normalPoolSize = normal.size();
        this.abnormalPoolSize = abnormal.size();
        this.lastRecalibratedAt = lastRecalibratedAt;
    }

    @JsonProperty("threshold")
    public double getThreshold() {
        return threshold;
    }

    @JsonProperty("normal_mean")
    public double getNormalMean() {
        return normalMean;
    }

    @JsonProperty("abnormal_mean")
    public double getAbnormalMean() {
        return abnormalMean;
    }

    @JsonProperty("precision")
    public double getPrecision() {
        int denominator = truePositives + falsePositives;
        return denominator == 0 ? 0.0 : (double) truePositives / denominator;
    }

    @JsonProperty("recall")
    public double getRecall() {
        int denominator = truePositives + falseNegatives;
        return denominator == 0 ? 0.0 : (double) truePositives / denominator;
    }

    @JsonProperty("f1")
    public double getF1() {
        double p = getPrecision();
        double r = getRecall();
        return p + r == 0 ? 0.0 : 2 * p * r / (p + r);
    }

    @JsonProperty("TP")
    public int getTruePositives() {
        return truePositives;
    }

    @JsonProperty("FP")
    public int getFalsePositives() {
        return falsePositives;
    }

    @JsonProperty("TN")
    public int getTrueNegatives() {
        return trueNegatives;
    }

    @JsonProperty("FN")
    public int getFalseNegatives() {
        return falseNegatives;
    }

    @JsonProperty("normal_pool_size")
    public int getNormalPoolSize() {
        return normalPoolSize;
    }

    @JsonProperty("abnormal_pool_size")
    public int getAbnormalPoolSize() {
        return abnormalPoolSize;
    }

    @JsonProperty("last_recalibrated_at")
    public Instant getLastRecalibratedAt() {
        return lastRecalibratedAt;
    }

    @Override
    public String toString() {
        return "CalibrationMetrics{" +
                "threshold=" + threshold +
                ", TP=" + truePositives +
                ", FP=" + falsePositives +
                ", TN=" + trueNegatives +
                ", FN=" + falseNegatives +
                ", f1=" + getF1() +
                '}';
    }
}
